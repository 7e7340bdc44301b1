package com.collabim.domain.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.collabim.domain.entity.MessageEntity;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.util.List;
import java.util.Map;

public interface MessageMapper extends BaseMapper<MessageEntity> {

    /**
     * 未读：不是自己发的，且自己没有回执。
     */
    @Select("""
            select count(*)
            from t_message m
            where m.conversation_id = #{conversationId}
              and m.sender_id != #{readerId}
              and not exists (
                select 1 from t_message_read r
                where r.message_id = m.id and r.reader_id = #{readerId}
              )
            """)
    long countUnread(@Param("conversationId") long conversationId, @Param("readerId") long readerId);

    @Select("""
            <script>
            select m.conversation_id as conversationId, count(*) as unreadCount
            from t_message m
            where m.conversation_id in
              <foreach collection="conversationIds" item="id" open="(" separator="," close=")">
                #{id}
              </foreach>
              and m.sender_id != #{readerId}
              and not exists (
                select 1 from t_message_read r
                where r.message_id = m.id and r.reader_id = #{readerId}
              )
            group by m.conversation_id
            </script>
            """)
    List<Map<String, Object>> selectUnreadCounts(@Param("conversationIds") List<Long> conversationIds,
                                                 @Param("readerId") long readerId);

    @Select("""
            select count(*)
            from t_message m
            join t_conversation c
              on c.id = m.conversation_id
             and (c.brand_id = #{readerId} or c.creator_id = #{readerId})
            where m.sender_id != #{readerId}
              and not exists (
                select 1 from t_message_read r
                where r.message_id = m.id and r.reader_id = #{readerId}
              )
            """)
    long countUnreadTotal(@Param("readerId") long readerId);

    @Select("""
            select m.id
            from t_message m
            where m.conversation_id = #{conversationId}
              and m.sender_id != #{readerId}
              and not exists (
                select 1 from t_message_read r
                where r.message_id = m.id and r.reader_id = #{readerId}
              )
            order by m.msg_seq asc
            """)
    List<Long> selectUnreadIds(@Param("conversationId") long conversationId, @Param("readerId") long readerId);

    @Update("""
            <script>
            update t_message set delivery_status = 'read'
            where id in
              <foreach collection="ids" item="id" open="(" separator="," close=")">
                #{id}
              </foreach>
            </script>
            """)
    int markReadByIds(@Param("ids") List<Long> ids);

    /**
     * 只允许 sent -> delivered，已读消息不回退。
     */
    @Update("update t_message set delivery_status = 'delivered' where id = #{id} and delivery_status = 'sent'")
    int markDelivered(@Param("id") long id);
}
