package com.di.skyflow.calibration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link ValidityStore} backed by {@code calibration_sets} and {@code calibration_tables}.
 */
@Service
@Slf4j
public class JdbcValidityStore implements ValidityStore {

    private static final TypeReference<LinkedHashMap<String, Double>> METRICS_TYPE = new TypeReference<>() {
    };

    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;
    private final ObjectMapper objectMapper;

    public JdbcValidityStore(JdbcTemplate jdbc, TransactionTemplate tx, ObjectMapper objectMapper) {
        this.jdbc = jdbc;
        this.tx = tx;
        this.objectMapper = objectMapper;
    }

    // ------------------------------------------------------------------
    // RowMappers
    // ------------------------------------------------------------------

    private RowMapper<CalibrationSet> setMapper() {
        return (rs, n) -> CalibrationSet.builder()
                .setName(rs.getString("set_name"))
                .validStart(rs.getDouble("valid_start"))
                .validEnd(rs.getDouble("valid_end"))
                .status(CalibrationStatus.valueOf(rs.getString("set_status")))
                .referenceField(rs.getString("reference_field"))
                .referenceAntenna(rs.getString("reference_antenna"))
                .sourceObservation(rs.getString("source_observation"))
                .createdAt(rs.getTimestamp("created_at").toInstant())
                .notes(rs.getString("notes"))
                .qualityMetrics(readMetrics(rs.getString("quality_json")))
                .tables(new ArrayList<>())
                .build();
    }

    private static final RowMapper<CalibrationTable> TABLE_MAPPER = (rs, n) -> new CalibrationTable(
            CalTableKind.fromCode(rs.getString("table_kind")),
            rs.getString("table_path"),
            rs.getInt("order_index"));

    // ------------------------------------------------------------------
    // Write operations
    // ------------------------------------------------------------------

    @Override
    public boolean insert(CalibrationSet set) {
        try {
            tx.executeWithoutResult(status -> {
                jdbc.update("""
                    INSERT INTO calibration_sets
                      (set_name, valid_start, valid_end, set_status, reference_field, reference_antenna,
                       source_observation, created_at, notes, quality_json)
                    VALUES (?,?,?,?,?,?, ?,?,?,?)
                    """,
                    set.getSetName(), set.getValidStart(), set.getValidEnd(), set.getStatus().name(),
                    set.getReferenceField(), set.getReferenceAntenna(), set.getSourceObservation(),
                    Timestamp.from(set.getCreatedAt()), set.getNotes(), writeMetrics(set.getQualityMetrics()));
                for (CalibrationTable t : set.getTables()) {
                    jdbc.update("""
                        INSERT INTO calibration_tables (set_name, order_index, table_kind, table_path)
                        VALUES (?,?,?,?)
                        """, set.getSetName(), t.getOrderIndex(), t.getKind().getCode(), t.getPath());
                }
            });
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("[VALIDITY-STORE] set {} already exists", set.getSetName());
            return false;
        }
    }

    @Override
    public boolean retire(String setName, String reason, Instant retiredAt) {
        Boolean changed = tx.execute(status -> {
            List<String> notes = jdbc.queryForList(
                    "SELECT notes FROM calibration_sets WHERE set_name = ? AND set_status = 'ACTIVE'",
                    String.class, setName);
            if (notes.isEmpty()) {
                return false;
            }
            String previous = notes.get(0);
            String entry = "Retired " + retiredAt + ": " + reason;
            String merged = previous == null || previous.isBlank() ? entry : previous + "\n" + entry;
            if (merged.length() > 4000) {
                merged = merged.substring(merged.length() - 4000);
            }
            int rows = jdbc.update("""
                UPDATE calibration_sets SET set_status = 'RETIRED', notes = ?
                 WHERE set_name = ? AND set_status = 'ACTIVE'
                """, merged, setName);
            return rows == 1;
        });
        return Boolean.TRUE.equals(changed);
    }

    // ------------------------------------------------------------------
    // Read operations
    // ------------------------------------------------------------------

    @Override
    public Optional<CalibrationSet> findByName(String setName) {
        List<CalibrationSet> rows = jdbc.query(
                "SELECT * FROM calibration_sets WHERE set_name = ?", setMapper(), setName);
        return rows.isEmpty() ? Optional.empty() : Optional.of(withTables(rows.get(0)));
    }

    @Override
    public List<CalibrationSet> findActiveCovering(double t) {
        return withTables(jdbc.query("""
            SELECT * FROM calibration_sets
             WHERE set_status = 'ACTIVE' AND valid_start <= ? AND valid_end > ?
             ORDER BY valid_start DESC, created_at DESC, set_name DESC
            """, setMapper(), t, t));
    }

    @Override
    public List<CalibrationSet> findActiveOverlapping(double start, double end) {
        return withTables(jdbc.query("""
            SELECT * FROM calibration_sets
             WHERE set_status = 'ACTIVE' AND valid_start < ? AND valid_end > ?
             ORDER BY valid_start DESC, created_at DESC, set_name DESC
            """, setMapper(), end, start));
    }

    @Override
    public List<CalibrationSet> findActiveWithMidpointBetween(double from, double to) {
        return withTables(jdbc.query("""
            SELECT * FROM calibration_sets
             WHERE set_status = 'ACTIVE'
               AND (valid_start + valid_end) / 2 >= ?
               AND (valid_start + valid_end) / 2 <= ?
             ORDER BY valid_start DESC, created_at DESC, set_name DESC
            """, setMapper(), from, to));
    }

    @Override
    public List<CalibrationSet> findAll() {
        return withTables(jdbc.query(
                "SELECT * FROM calibration_sets ORDER BY valid_start, set_name", setMapper()));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private List<CalibrationSet> withTables(List<CalibrationSet> sets) {
        for (CalibrationSet s : sets) {
            withTables(s);
        }
        return sets;
    }

    private CalibrationSet withTables(CalibrationSet set) {
        set.setTables(new ArrayList<>(jdbc.query("""
            SELECT * FROM calibration_tables WHERE set_name = ? ORDER BY order_index
            """, TABLE_MAPPER, set.getSetName())));
        return set;
    }

    private String writeMetrics(Map<String, Double> metrics) {
        if (metrics == null || metrics.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metrics);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Quality metrics are not serialisable", e);
        }
    }

    private Map<String, Double> readMetrics(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, METRICS_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("[VALIDITY-STORE] unreadable quality_json '{}': {}", json, e.getMessage());
            return new LinkedHashMap<>();
        }
    }
}
