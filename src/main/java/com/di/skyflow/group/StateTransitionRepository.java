package com.di.skyflow.group;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;

/**
 * Append-only audit of group state changes ({@code group_state_history}).
 */
@Repository
@RequiredArgsConstructor
public class StateTransitionRepository {

    private final JdbcTemplate jdbc;

    private static final RowMapper<StateTransitionRecord> ROW_MAPPER = (rs, n) -> {
        String from = rs.getString("from_state");
        return new StateTransitionRecord(
                rs.getLong("id"),
                rs.getString("group_id"),
                from == null ? null : GroupState.valueOf(from),
                GroupState.valueOf(rs.getString("to_state")),
                rs.getTimestamp("changed_at").toInstant(),
                rs.getString("node_name"),
                rs.getString("reason"));
    };

    public void append(StateTransitionRecord r) {
        String reason = r.reason();
        if (reason != null && reason.length() > 4000) {
            reason = reason.substring(0, 4000);
        }
        jdbc.update("""
            INSERT INTO group_state_history (group_id, from_state, to_state, changed_at, node_name, reason)
            VALUES (?,?,?,?,?,?)
            """,
            r.groupId(),
            r.fromState() == null ? null : r.fromState().name(),
            r.toState().name(), Timestamp.from(r.changedAt()), r.nodeName(), reason);
    }

    public List<StateTransitionRecord> findByGroup(String groupId) {
        return jdbc.query("""
            SELECT * FROM group_state_history WHERE group_id = ?
             ORDER BY id
            """, ROW_MAPPER, groupId);
    }
}
