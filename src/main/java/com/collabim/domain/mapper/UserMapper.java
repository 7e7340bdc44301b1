package com.collabim.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.collabim.domain.entity.UserEntity;

public interface UserMapper extends BaseMapper<UserEntity> {
}
