package com.di.skyflow.error;

import com.di.skyflow.common.Failure;
import com.di.skyflow.common.FailureKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessResourceException;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.nio.file.FileSystemException;
import java.nio.file.NoSuchFileException;
import java.sql.SQLException;
import java.util.concurrent.TimeoutException;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for FailureCategory enum.
 */
@DisplayName("FailureCategory Tests")
class FailureCategoryTest {

    // ============================================================================
    // SQL Exception Categorization Tests
    // ============================================================================

    @ParameterizedTest(name = "SQL state {0} -> {1}")
    @MethodSource("sqlStates")
    @DisplayName("Should categorize SQL exceptions by SQL state class")
    void testCategorize_BySqlState(String sqlState, FailureCategory expected) {
        assertEquals(expected, FailureCategory.categorize(new SQLException("boom", sqlState)));
    }

    static Stream<Arguments> sqlStates() {
        return Stream.of(
                Arguments.of("08001", FailureCategory.DATABASE_CONNECTION),
                Arguments.of("23505", FailureCategory.CONSTRAINT_VIOLATION),
                Arguments.of("40001", FailureCategory.DATABASE_CONFLICT),
                Arguments.of("53300", FailureCategory.RESOURCE_BUSY),
                Arguments.of("42601", FailureCategory.APPLICATION_ERROR)
        );
    }

    @Test
    @DisplayName("Should fall back to APPLICATION_ERROR when SQL state is missing")
    void testCategorize_SqlWithoutState() {
        assertEquals(FailureCategory.APPLICATION_ERROR, FailureCategory.categorize(new SQLException("no state")));
    }

    // ============================================================================
    // Exception Type Categorization Tests
    // ============================================================================

    @ParameterizedTest(name = "{0} -> {1}")
    @MethodSource("exceptions")
    @DisplayName("Should categorize exceptions by type")
    void testCategorize_ByType(Throwable exception, FailureCategory expected) {
        assertEquals(expected, FailureCategory.categorize(exception));
    }

    static Stream<Arguments> exceptions() {
        return Stream.of(
                Arguments.of(new TimeoutException("slow"), FailureCategory.TIMEOUT),
                Arguments.of(new SocketTimeoutException("read timed out"), FailureCategory.TIMEOUT),
                Arguments.of(new QueryTimeoutException("query"), FailureCategory.TIMEOUT),
                Arguments.of(new InterruptedException(), FailureCategory.INTERRUPTED),
                Arguments.of(new CannotAcquireLockException("locked"), FailureCategory.DATABASE_CONFLICT),
                Arguments.of(new TransientDataAccessResourceException("pool"), FailureCategory.RESOURCE_BUSY),
                Arguments.of(new DuplicateKeyException("dup"), FailureCategory.CONSTRAINT_VIOLATION),
                Arguments.of(new NoSuchFileException("/data/x.hdf5"), FailureCategory.MISSING_INPUT),
                Arguments.of(new FileNotFoundException("/data/x.hdf5"), FailureCategory.MISSING_INPUT),
                Arguments.of(new FileSystemException("/data", null, "No space left on device"), FailureCategory.RESOURCE_EXHAUSTED),
                Arguments.of(new IOException("broken pipe"), FailureCategory.IO_ERROR),
                Arguments.of(new IllegalArgumentException("bad"), FailureCategory.INVALID_INPUT),
                Arguments.of(new IllegalStateException("odd"), FailureCategory.APPLICATION_ERROR)
        );
    }

    @Test
    @DisplayName("Should categorize by cause when the wrapper is unknown")
    void testCategorize_UsesCause() {
        RuntimeException wrapped = new RuntimeException("wrapper", new SocketTimeoutException("inner"));
        assertEquals(FailureCategory.TIMEOUT, FailureCategory.categorize(wrapped));
    }

    @Test
    @DisplayName("Should handle null exception")
    void testCategorize_Null() {
        assertEquals(FailureCategory.APPLICATION_ERROR, FailureCategory.categorize(null));
    }

    // ============================================================================
    // Failure Conversion Tests
    // ============================================================================

    @Test
    @DisplayName("Should build failure code from prefix and category")
    void testToFailure_Code() {
        Failure f = FailureCategory.toFailure("CONVERT", new SocketTimeoutException("read timed out"));
        assertEquals("CONVERT_TIMEOUT", f.getCode());
        assertEquals(FailureKind.TRANSIENT, f.getKind());
        assertTrue(f.getMessage().contains("SocketTimeoutException"));
        assertTrue(f.isRetryable());
    }

    @Test
    @DisplayName("Should mark I/O errors as fatal")
    void testToFailure_IoIsFatal() {
        Failure f = FailureCategory.toFailure("IMAGE", new IOException("disk"));
        assertEquals(FailureKind.FATAL, f.getKind());
        assertFalse(f.isRetryable());
    }

    @Test
    @DisplayName("Should return non-empty labels")
    void testLabels() {
        for (FailureCategory c : FailureCategory.values()) {
            assertNotNull(c.getLabel());
            assertFalse(c.getLabel().isEmpty());
            assertEquals(c.name(), c.toString());
        }
    }
}
