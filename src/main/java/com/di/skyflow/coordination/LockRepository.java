package com.di.skyflow.coordination;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Leased locks in {@code resource_locks}. A row is held until released by its token or until
 * its lease expires, after which any caller may take it over.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class LockRepository {

    private final JdbcTemplate jdbc;

    /**
     * Takes the lock if it is free or its lease has expired.
     */
    public boolean tryAcquire(String key, String owner, String token, Instant now, Instant expiresAt) {
        try {
            jdbc.update("""
                INSERT INTO resource_locks (lock_key, owner_id, lease_token, acquired_at, expires_at)
                VALUES (?,?,?,?,?)
                """, key, owner, token, Timestamp.from(now), Timestamp.from(expiresAt));
            return true;
        } catch (DuplicateKeyException e) {
            int rows = jdbc.update("""
                UPDATE resource_locks
                   SET owner_id = ?, lease_token = ?, acquired_at = ?, expires_at = ?
                 WHERE lock_key = ? AND expires_at < ?
                """, owner, token, Timestamp.from(now), Timestamp.from(expiresAt), key, Timestamp.from(now));
            if (rows == 1) {
                log.warn("[LOCK] took over expired lease on '{}'", key);
                return true;
            }
            return false;
        }
    }

    public boolean release(String key, String token) {
        return jdbc.update("DELETE FROM resource_locks WHERE lock_key = ? AND lease_token = ?", key, token) == 1;
    }

    public boolean renew(String key, String token, Instant expiresAt) {
        return jdbc.update("""
            UPDATE resource_locks SET expires_at = ? WHERE lock_key = ? AND lease_token = ?
            """, Timestamp.from(expiresAt), key, token) == 1;
    }

    /**
     * True while a lease on {@code key} has not expired, that is while {@link #tryAcquire} would refuse it.
     */
    public boolean isHeld(String key, Instant now) {
        Integer rows = jdbc.queryForObject(
                "SELECT COUNT(*) FROM resource_locks WHERE lock_key = ? AND expires_at >= ?",
                Integer.class, key, Timestamp.from(now));
        return rows != null && rows > 0;
    }

    public Optional<String> findOwner(String key) {
        List<String> rows = jdbc.queryForList(
                "SELECT owner_id FROM resource_locks WHERE lock_key = ?", String.class, key);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }
}
