package com.collabim.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.collabim.domain.entity.ConversationEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;
import java.util.Map;

public interface ConversationMapper extends BaseMapper<ConversationEntity> {

    @Select("""
            select connection_status as connectionStatus, count(*) as total
            from t_conversation
            where brand_id = #{identityId} or creator_id = #{identityId}
            group by connection_status
            """)
    List<Map<String, Object>> selectStatusCountsForParticipant(@Param("identityId") long identityId);
}
