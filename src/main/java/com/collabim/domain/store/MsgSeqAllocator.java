package com.collabim.domain.store;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCallback;
import org.springframework.stereotype.Component;

import java.sql.PreparedStatement;
import java.sql.ResultSet;

/**
 * 会话内 msg_seq 分配器（并发安全）。
 *
 * <p>使用 MySQL 的 LAST_INSERT_ID 技巧：在同一连接内 UPDATE 并取回本次递增后的值。
 * 调用方需在同一事务内完成消息插入，否则会留下空洞（空洞不影响排序）。</p>
 */
@Component
public class MsgSeqAllocator {

    private static final String UPDATE_SQL =
            "update t_conversation set next_msg_seq = LAST_INSERT_ID(next_msg_seq + 1) where id = ?";
    private static final String SELECT_SQL = "select LAST_INSERT_ID()";

    private final JdbcTemplate jdbcTemplate;

    public MsgSeqAllocator(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public long allocateNextSeq(long conversationId) {
        if (conversationId <= 0) {
            throw new IllegalArgumentException("conversationId must be positive");
        }

        // 必须保证 UPDATE 与 SELECT 在同一连接上执行。
        Long out = jdbcTemplate.execute(UPDATE_SQL, (PreparedStatementCallback<Long>) ps -> {
            ps.setLong(1, conversationId);
            int updated = ps.executeUpdate();
            if (updated <= 0) {
                throw new IllegalStateException("allocate msg_seq failed: no row updated");
            }
            try (PreparedStatement s = ps.getConnection().prepareStatement(SELECT_SQL);
                 ResultSet rs = s.executeQuery()) {
                if (!rs.next()) {
                    throw new IllegalStateException("allocate msg_seq failed: empty result");
                }
                long v = rs.getLong(1);
                return v > 0 ? v : null;
            }
        });

        if (out == null || out <= 0) {
            throw new IllegalStateException("allocate msg_seq failed");
        }
        return out;
    }
}
