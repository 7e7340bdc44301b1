package com.collabim.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.collabim.domain.entity.MessageReadEntity;
import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Param;

import java.util.List;

public interface MessageReadMapper extends BaseMapper<MessageReadEntity> {

    /**
     * 依赖唯一键 (message_id, reader_id) 去重：已有回执时影响行数为 0，read_at 不变。
     */
    @Insert("""
            insert ignore into t_message_read(id, message_id, conversation_id, reader_id, read_at)
            values (#{r.id}, #{r.messageId}, #{r.conversationId}, #{r.readerId}, #{r.readAt})
            """)
    int insertIgnore(@Param("r") MessageReadEntity receipt);

    @Insert("""
            <script>
            insert ignore into t_message_read(id, message_id, conversation_id, reader_id, read_at)
            values
            <foreach collection="rows" item="r" separator=",">
              (#{r.id}, #{r.messageId}, #{r.conversationId}, #{r.readerId}, #{r.readAt})
            </foreach>
            </script>
            """)
    int insertIgnoreBatch(@Param("rows") List<MessageReadEntity> rows);
}
