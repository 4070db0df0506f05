package com.di.skyflow.error;

import com.di.skyflow.common.Failure;
import com.di.skyflow.common.FailureKind;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Maps exceptions raised at an adapter boundary (process launch, file system, database)
 * onto a {@link FailureKind}. Only adapters use this; the core never inspects exceptions
 * to decide whether to retry.
 * <p>Usage: {@code Failure f = FailureCategory.toFailure("CONVERT_LAUNCH", exception);}
 */
public enum FailureCategory {

    TIMEOUT("Timeout", FailureKind.TRANSIENT),
    INTERRUPTED("Interrupted", FailureKind.TRANSIENT),
    DATABASE_CONNECTION("Database connection error", FailureKind.TRANSIENT),
    DATABASE_CONFLICT("Concurrent update conflict", FailureKind.TRANSIENT),
    RESOURCE_BUSY("Resource temporarily unavailable", FailureKind.TRANSIENT),
    MISSING_INPUT("Input missing", FailureKind.VALIDATION),
    INVALID_INPUT("Invalid input", FailureKind.VALIDATION),
    CONSTRAINT_VIOLATION("Database constraint violation", FailureKind.VALIDATION),
    RESOURCE_EXHAUSTED("Resource exhausted", FailureKind.FATAL),
    IO_ERROR("I/O error", FailureKind.FATAL),
    APPLICATION_ERROR("Application error", FailureKind.FATAL);

    private final String label;
    private final FailureKind kind;

    FailureCategory(String label, FailureKind kind) {
        this.label = label;
        this.kind = kind;
    }

    public String getLabel() {
        return label;
    }

    public FailureKind getKind() {
        return kind;
    }

    /** First match wins. */
    private static final Map<Predicate<Throwable>, FailureCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(FailureCategory::isTimeout, TIMEOUT);
        MATCHERS.put(t -> t instanceof InterruptedException, INTERRUPTED);
        MATCHERS.put(FailureCategory::isConcurrencyConflict, DATABASE_CONFLICT);
        MATCHERS.put(t -> t instanceof org.springframework.dao.TransientDataAccessException, RESOURCE_BUSY);
        MATCHERS.put(t -> t instanceof org.springframework.dao.DataIntegrityViolationException, CONSTRAINT_VIOLATION);
        MATCHERS.put(FailureCategory::isMissingInput, MISSING_INPUT);
        MATCHERS.put(FailureCategory::isResourceExhausted, RESOURCE_EXHAUSTED);
        MATCHERS.put(t -> t instanceof java.io.IOException || t instanceof java.io.UncheckedIOException, IO_ERROR);
        MATCHERS.put(t -> t instanceof IllegalArgumentException, INVALID_INPUT);
    }

    public static FailureCategory categorize(Throwable exception) {
        if (exception == null) {
            return APPLICATION_ERROR;
        }
        if (exception instanceof SQLException) {
            return categorizeSqlException((SQLException) exception);
        }
        for (Map.Entry<Predicate<Throwable>, FailureCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        if (exception.getCause() != null && exception.getCause() != exception) {
            return categorize(exception.getCause());
        }
        return APPLICATION_ERROR;
    }

    /** Builds a failure whose code is {@code <prefix>_<CATEGORY>}. */
    public static Failure toFailure(String codePrefix, Throwable exception) {
        FailureCategory category = categorize(exception);
        String message = exception == null ? category.label
                : category.label + ": " + exception.getClass().getSimpleName()
                  + (exception.getMessage() == null ? "" : " " + exception.getMessage());
        return Failure.of(category.kind, codePrefix + "_" + category.name(), message);
    }

    private static FailureCategory categorizeSqlException(SQLException sqlEx) {
        String sqlState = sqlEx.getSQLState();
        if (sqlState != null && sqlState.length() >= 2) {
            FailureCategory byState = SQL_STATE_PREFIX.get(sqlState.substring(0, 2));
            if (byState != null) {
                return byState;
            }
        }
        return APPLICATION_ERROR;
    }

    private static final Map<String, FailureCategory> SQL_STATE_PREFIX = Map.of(
            "08", DATABASE_CONNECTION,
            "23", CONSTRAINT_VIOLATION,
            "40", DATABASE_CONFLICT,
            "53", RESOURCE_BUSY,
            "57", RESOURCE_BUSY
    );

    // --- Matcher helpers ---

    private static boolean isTimeout(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.net.SocketTimeoutException
                || t instanceof org.springframework.dao.QueryTimeoutException;
    }

    private static boolean isConcurrencyConflict(Throwable t) {
        return t instanceof org.springframework.dao.OptimisticLockingFailureException
                || t instanceof org.springframework.dao.PessimisticLockingFailureException
                || t instanceof org.springframework.dao.CannotAcquireLockException;
    }

    private static boolean isMissingInput(Throwable t) {
        return t instanceof java.io.FileNotFoundException
                || t instanceof java.nio.file.NoSuchFileException;
    }

    private static boolean isResourceExhausted(Throwable t) {
        return t instanceof OutOfMemoryError
                || (t instanceof java.nio.file.FileSystemException
                    && t.getMessage() != null
                    && t.getMessage().toLowerCase().contains("no space"));
    }

    @Override
    public String toString() {
        return name();
    }
}
