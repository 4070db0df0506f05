package com.di.skyflow.mosaic;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * JDBC repository for {@code mosaic_groups} and the tile pool {@code mosaic_tiles}.
 * Member lists are stored as JSON arrays.
 */
@Repository
@Slf4j
public class MosaicRepository {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final JdbcTemplate jdbc;
    private final ObjectMapper objectMapper;

    public MosaicRepository(JdbcTemplate jdbc, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.objectMapper = objectMapper;
    }

    // ------------------------------------------------------------------
    // RowMappers
    // ------------------------------------------------------------------

    private static final RowMapper<MosaicTile> TILE_MAPPER = (rs, n) -> new MosaicTile(
            rs.getString("group_id"), rs.getString("image_path"), rs.getDouble("observed_mjd"));

    private RowMapper<MosaicGroup> groupMapper() {
        return (rs, n) -> MosaicGroup.builder()
                .mosaicId(rs.getString("mosaic_id"))
                .members(readList(rs.getString("members_json")))
                .memberGroupIds(readList(rs.getString("member_groups_json")))
                .overlapCount(rs.getInt("overlap_count"))
                .windowEndMjd(rs.getDouble("window_end_mjd"))
                .status(MosaicStatus.valueOf(rs.getString("mosaic_status")))
                .mosaicPath(rs.getString("mosaic_path"))
                .errorMessage(rs.getString("error_message"))
                .createdAt(rs.getTimestamp("created_at").toInstant())
                .updatedAt(rs.getTimestamp("updated_at").toInstant())
                .build();
    }

    // ------------------------------------------------------------------
    // Tiles
    // ------------------------------------------------------------------

    /** Adds a tile; returns {@code false} if the group is already enrolled. */
    public boolean insertTile(MosaicTile tile, Instant now) {
        try {
            jdbc.update("""
                INSERT INTO mosaic_tiles (group_id, image_path, observed_mjd, mosaic_id, enrolled_at)
                VALUES (?,?,?,NULL,?)
                """, tile.groupId(), tile.imagePath(), tile.observedMjd(), Timestamp.from(now));
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    public List<MosaicTile> findUnconsumedTiles() {
        return jdbc.query("""
            SELECT * FROM mosaic_tiles WHERE mosaic_id IS NULL ORDER BY observed_mjd, group_id
            """, TILE_MAPPER);
    }

    public List<MosaicTile> findTiles(Collection<String> groupIds) {
        List<MosaicTile> tiles = new ArrayList<>();
        for (String id : groupIds) {
            tiles.addAll(jdbc.query("SELECT * FROM mosaic_tiles WHERE group_id = ?", TILE_MAPPER, id));
        }
        return tiles;
    }

    public void markConsumed(Collection<String> groupIds, String mosaicId) {
        for (String id : groupIds) {
            jdbc.update("UPDATE mosaic_tiles SET mosaic_id = ? WHERE group_id = ?", mosaicId, id);
        }
    }

    // ------------------------------------------------------------------
    // Mosaic groups
    // ------------------------------------------------------------------

    public void insert(MosaicGroup m) {
        jdbc.update("""
            INSERT INTO mosaic_groups
              (mosaic_id, members_json, member_groups_json, overlap_count, window_end_mjd, mosaic_status,
               mosaic_path, error_message, created_at, updated_at)
            VALUES (?,?,?,?,?,?, ?,?,?,?)
            """,
            m.getMosaicId(), writeList(m.getMembers()), writeList(m.getMemberGroupIds()),
            m.getOverlapCount(), m.getWindowEndMjd(), m.getStatus().name(), m.getMosaicPath(), m.getErrorMessage(),
            Timestamp.from(m.getCreatedAt()), Timestamp.from(m.getUpdatedAt()));
    }

    public Optional<MosaicGroup> findById(String mosaicId) {
        List<MosaicGroup> rows = jdbc.query("SELECT * FROM mosaic_groups WHERE mosaic_id = ?", groupMapper(), mosaicId);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /** A not-yet-completed mosaic with exactly these members, if one exists. */
    public Optional<MosaicGroup> findOpenWithMembers(List<String> members) {
        List<MosaicGroup> rows = jdbc.query("""
            SELECT * FROM mosaic_groups WHERE members_json = ? AND mosaic_status <> 'COMPLETED'
             ORDER BY created_at
            """, groupMapper(), writeList(members));
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    /** Latest (by last member's observation time) mosaic that has not failed. */
    public Optional<MosaicGroup> findLatestLive() {
        List<MosaicGroup> rows = jdbc.query("""
            SELECT * FROM mosaic_groups WHERE mosaic_status <> 'FAILED'
             ORDER BY window_end_mjd DESC, created_at DESC
             LIMIT 1
            """, groupMapper());
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<MosaicGroup> findByStatus(MosaicStatus status) {
        return jdbc.query("""
            SELECT * FROM mosaic_groups WHERE mosaic_status = ? ORDER BY created_at, mosaic_id
            """, groupMapper(), status.name());
    }

    /**
     * Moves the mosaic from {@code expected} to {@code target}; returns whether this caller won.
     */
    public boolean compareAndSetStatus(String mosaicId, MosaicStatus expected, MosaicStatus target,
                                       String mosaicPath, String error, Instant now) {
        return jdbc.update("""
            UPDATE mosaic_groups
               SET mosaic_status = ?, mosaic_path = COALESCE(?, mosaic_path), error_message = ?, updated_at = ?
             WHERE mosaic_id = ? AND mosaic_status = ?
            """, target.name(), mosaicPath, error, Timestamp.from(now), mosaicId, expected.name()) == 1;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private String writeList(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialise mosaic member list", e);
        }
    }

    private List<String> readList(String json) {
        try {
            return json == null ? new ArrayList<>() : objectMapper.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt mosaic member list: " + json, e);
        }
    }
}
