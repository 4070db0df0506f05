package com.di.skyflow.group;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC repository for {@code observation_groups} and {@code group_members}.
 * Every state-changing update is guarded by {@code row_version}.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class ObservationGroupRepository {

    private final JdbcTemplate jdbc;

    // ------------------------------------------------------------------
    // RowMappers
    // ------------------------------------------------------------------

    private static final RowMapper<ObservationGroup> GROUP_MAPPER = (rs, n) -> {
        ObservationGroup g = new ObservationGroup();
        g.setGroupId(rs.getString("group_id"));
        g.setState(GroupState.valueOf(rs.getString("group_state")));
        g.setExpectedCount(rs.getInt("expected_count"));
        g.setObservedMjd(rs.getDouble("observed_mjd"));
        g.setCreatedAt(toInstant(rs.getTimestamp("created_at")));
        g.setUpdatedAt(toInstant(rs.getTimestamp("updated_at")));
        g.setRetryCount(rs.getInt("retry_count"));
        g.setOutputPath(rs.getString("output_path"));
        g.setImagePath(rs.getString("image_path"));
        g.setErrorMessage(rs.getString("error_message"));
        String failedStage = rs.getString("failed_stage");
        g.setFailedStage(failedStage == null ? null : GroupState.valueOf(failedStage));
        g.setRetryable(rs.getBoolean("retryable"));
        g.setCalibratorName(rs.getString("calibrator_name"));
        double transit = rs.getDouble("transit_mjd");
        g.setTransitMjd(rs.wasNull() ? null : transit);
        g.setCalibrationState(CalibrationState.valueOf(rs.getString("calibration_status")));
        g.setCalibrationSets(rs.getString("calibration_sets"));
        g.setRowVersion(rs.getLong("row_version"));
        g.setMembers(new ArrayList<>());
        return g;
    };

    private static final RowMapper<GroupMember> MEMBER_MAPPER = (rs, n) -> new GroupMember(
            rs.getInt("subband_index"),
            rs.getString("file_path"),
            rs.getString("checksum"),
            toInstant(rs.getTimestamp("arrived_at")));

    // ------------------------------------------------------------------
    // Write operations
    // ------------------------------------------------------------------

    /**
     * Inserts a new group. Returns {@code false} if a group with this id already exists.
     */
    public boolean insertIfAbsent(ObservationGroup g) {
        try {
            jdbc.update("""
                INSERT INTO observation_groups
                  (group_id, group_state, expected_count, observed_mjd, created_at, updated_at,
                   retry_count, retryable, calibration_status, row_version)
                VALUES (?,?,?,?,?,?, 0, FALSE, ?, 0)
                """,
                g.getGroupId(), g.getState().name(), g.getExpectedCount(), g.getObservedMjd(),
                Timestamp.from(g.getCreatedAt()), Timestamp.from(g.getUpdatedAt()),
                g.getCalibrationState().name());
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    /**
     * Adds a member. Returns {@code false} when the (group, index) slot or the file path is
     * already taken; the first writer wins.
     */
    public boolean insertMember(String groupId, GroupMember m) {
        try {
            jdbc.update("""
                INSERT INTO group_members (group_id, subband_index, file_path, checksum, arrived_at)
                VALUES (?,?,?,?,?)
                """,
                groupId, m.getSubbandIndex(), m.getPath(), m.getChecksum(), Timestamp.from(m.getArrivedAt()));
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("[GROUP-REPO] member slot taken group={} index={} path={}",
                    groupId, m.getSubbandIndex(), m.getPath());
            return false;
        }
    }

    /**
     * Writes all mutable columns of {@code g} if its stored version still equals
     * {@code g.getRowVersion()}, bumping the version. Returns whether the write won.
     */
    public boolean compareAndUpdate(ObservationGroup g) {
        int rows = jdbc.update("""
            UPDATE observation_groups
               SET group_state        = ?,
                   updated_at         = ?,
                   retry_count        = ?,
                   output_path        = ?,
                   image_path         = ?,
                   error_message      = ?,
                   failed_stage       = ?,
                   retryable          = ?,
                   calibrator_name    = ?,
                   transit_mjd        = ?,
                   calibration_status = ?,
                   calibration_sets   = ?,
                   row_version        = row_version + 1
             WHERE group_id = ? AND row_version = ?
            """,
            g.getState().name(), Timestamp.from(g.getUpdatedAt()), g.getRetryCount(),
            g.getOutputPath(), g.getImagePath(), truncate(g.getErrorMessage()),
            g.getFailedStage() == null ? null : g.getFailedStage().name(),
            g.isRetryable(), g.getCalibratorName(), g.getTransitMjd(),
            g.getCalibrationState().name(), g.getCalibrationSets(),
            g.getGroupId(), g.getRowVersion());
        return rows == 1;
    }

    /**
     * Marks the calibration of the given groups as needing to be reapplied.
     */
    public int invalidateCalibration(Collection<String> groupIds, Instant now) {
        int total = 0;
        for (String id : groupIds) {
            total += jdbc.update("""
                UPDATE observation_groups
                   SET calibration_status = ?, updated_at = ?, row_version = row_version + 1
                 WHERE group_id = ?
                """, CalibrationState.INVALIDATED.name(), Timestamp.from(now), id);
        }
        return total;
    }

    // ------------------------------------------------------------------
    // Read operations
    // ------------------------------------------------------------------

    public Optional<ObservationGroup> findById(String groupId) {
        List<ObservationGroup> rows = jdbc.query(
                "SELECT * FROM observation_groups WHERE group_id = ?", GROUP_MAPPER, groupId);
        if (rows.isEmpty()) {
            return Optional.empty();
        }
        ObservationGroup g = rows.get(0);
        g.setMembers(new ArrayList<>(findMembers(groupId)));
        return Optional.of(g);
    }

    public List<GroupMember> findMembers(String groupId) {
        return jdbc.query("""
            SELECT * FROM group_members WHERE group_id = ? ORDER BY subband_index
            """, MEMBER_MAPPER, groupId);
    }

    public Optional<GroupMember> findMember(String groupId, int subbandIndex) {
        List<GroupMember> rows = jdbc.query("""
            SELECT * FROM group_members WHERE group_id = ? AND subband_index = ?
            """, MEMBER_MAPPER, groupId, subbandIndex);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /** Group id that already holds the given file path, if any. */
    public Optional<String> findGroupIdByPath(String path) {
        List<String> rows = jdbc.queryForList(
                "SELECT group_id FROM group_members WHERE file_path = ?", String.class, path);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public int countMembers(String groupId) {
        Integer n = jdbc.queryForObject(
                "SELECT COUNT(*) FROM group_members WHERE group_id = ?", Integer.class, groupId);
        return n == null ? 0 : n;
    }

    /**
     * Collecting groups that hold every expected member, earliest observation first.
     */
    public List<ObservationGroup> findCompleteCollecting(int limit) {
        return jdbc.query("""
            SELECT g.* FROM observation_groups g
             WHERE g.group_state = 'COLLECTING'
               AND (SELECT COUNT(*) FROM group_members m WHERE m.group_id = g.group_id) >= g.expected_count
             ORDER BY g.observed_mjd, g.group_id
             LIMIT ?
            """, GROUP_MAPPER, limit);
    }

    public List<ObservationGroup> findByState(GroupState state, int limit) {
        return jdbc.query("""
            SELECT * FROM observation_groups WHERE group_state = ?
             ORDER BY observed_mjd, group_id
             LIMIT ?
            """, GROUP_MAPPER, state.name(), limit);
    }

    /**
     * Failed groups that may still be retried automatically.
     */
    public List<ObservationGroup> findRetryable(int maxRetries, int limit) {
        return jdbc.query("""
            SELECT * FROM observation_groups
             WHERE group_state = 'FAILED' AND retryable = TRUE AND retry_count < ?
             ORDER BY updated_at, group_id
             LIMIT ?
            """, GROUP_MAPPER, maxRetries, limit);
    }

    /**
     * Claimed or in-flight groups whose last update is older than {@code cutoff}.
     */
    public List<ObservationGroup> findStale(Instant cutoff, int limit) {
        return jdbc.query("""
            SELECT * FROM observation_groups
             WHERE group_state IN ('PENDING','CONVERTING','CALIBRATING','IMAGING','MOSAICKING')
               AND updated_at < ?
             ORDER BY updated_at, group_id
             LIMIT ?
            """, GROUP_MAPPER, Timestamp.from(cutoff), limit);
    }

    public Map<GroupState, Integer> countByState() {
        Map<GroupState, Integer> counts = new EnumMap<>(GroupState.class);
        for (GroupState s : GroupState.values()) {
            counts.put(s, 0);
        }
        jdbc.query("SELECT group_state, COUNT(*) AS n FROM observation_groups GROUP BY group_state",
                rs -> {
                    counts.put(GroupState.valueOf(rs.getString("group_state")), rs.getInt("n"));
                });
        return counts;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }

    private static String truncate(String s) {
        return s == null || s.length() <= 4000 ? s : s.substring(0, 4000);
    }
}
