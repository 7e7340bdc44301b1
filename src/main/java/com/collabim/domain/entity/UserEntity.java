package com.collabim.domain.entity;

import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.collabim.domain.enums.UserRole;
import com.collabim.domain.enums.UserStanding;
import lombok.Data;

/**
 * 账号表的只读视图：注册/审核流程由账号服务负责，这里只取会话需要的列。
 */
@Data
@TableName("t_user")
public class UserEntity {

    @TableId("id")
    private Long id;

    private String displayName;

    private UserRole role;

    /** 品牌名或达人 handle。 */
    private String label;

    private UserStanding standing;
}
