package com.acme.delivery.persistence.jdbc;

import com.acme.delivery.core.PermanentException;
import com.acme.delivery.core.TransientException;
import org.slf4j.Logger;

import java.sql.SQLException;
import java.util.Locale;
import java.util.Set;

/**
 * Utility class for translating SQLException to domain exceptions.
 * Determines whether an exception is permanent (non-retryable) or transient (retryable).
 */
public final class ExceptionTranslator {

    private static final Set<String> TRANSIENT_MESSAGE_HINTS = Set.of(
            "timeout", "connection refused", "deadlock", "too many connections", "pool exhausted",
            "connection is closed");

    private static final Set<String> PERMANENT_MESSAGE_HINTS = Set.of(
            "syntax error", "table not found", "column not found", "does not exist",
            "schema not found", "constraint violation", "unique constraint", "foreign key",
            "type mismatch", "invalid column");

    // PostgreSQL and H2 vendor codes
    private static final Set<Integer> TRANSIENT_ERROR_CODES = Set.of(
            40001, // serialization failure / H2 deadlock
            8003, 8006, // PostgreSQL connection failure
            50200, // H2 lock timeout
            90008);

    private static final Set<Integer> PERMANENT_ERROR_CODES = Set.of(
            23505, 23503, 42703, // PostgreSQL unique/foreign key/undefined column
            23506, // H2 referential integrity
            42102, 42122, // H2 table/column not found
            90002, 90007);

    private static final String UNIQUE_VIOLATION_STATE = "23505";
    private static final int H2_DUPLICATE_KEY = 23505;

    private ExceptionTranslator() {
        // Utility class - no instantiation
    }

    /**
     * Translates a SQLException to either PermanentException or TransientException, logging the
     * original at ERROR.
     *
     * @param originalException The SQLException that occurred
     * @param operation         Description of the operation that failed
     * @param logger            Logger of the calling repository
     * @return PermanentException for non-retryable errors, TransientException otherwise
     */
    public static RuntimeException translateException(
            SQLException originalException, String operation, Logger logger) {

        logger.error("Database operation failed: {}", operation, originalException);

        if (isTransientError(originalException)) {
            return new TransientException(
                    String.format("Transient database error during %s: %s", operation,
                            originalException.getMessage()), originalException);
        }

        if (isPermanentError(originalException)) {
            return new PermanentException(
                    String.format("Permanent database error during %s: %s", operation,
                            originalException.getMessage()), originalException);
        }

        // Default to TransientException when in doubt
        return new TransientException(
                String.format("Database error during %s: %s", operation, originalException.getMessage()),
                originalException);
    }

    /** True for a primary key or unique index violation on either dialect. */
    public static boolean isUniqueViolation(SQLException exception) {
        return exception != null
                && (UNIQUE_VIOLATION_STATE.equals(exception.getSQLState())
                || exception.getErrorCode() == H2_DUPLICATE_KEY);
    }

    static boolean isTransientError(SQLException exception) {
        if (exception == null) {
            return false;
        }
        if (containsAny(exception.getMessage(), TRANSIENT_MESSAGE_HINTS)) {
            return true;
        }
        String sqlState = exception.getSQLState();
        // 08 connection exception, 40 transaction rollback, 57P03 cannot connect now
        if (sqlState != null
                && (sqlState.startsWith("08") || sqlState.startsWith("40") || sqlState.equals("57P03"))) {
            return true;
        }
        return TRANSIENT_ERROR_CODES.contains(exception.getErrorCode());
    }

    static boolean isPermanentError(SQLException exception) {
        if (exception == null) {
            return false;
        }
        if (containsAny(exception.getMessage(), PERMANENT_MESSAGE_HINTS)) {
            return true;
        }
        String sqlState = exception.getSQLState();
        // 22 data exception, 23 integrity constraint, 42 syntax/access, 3D catalog, 3F schema
        if (sqlState != null
                && (sqlState.startsWith("22") || sqlState.startsWith("23") || sqlState.startsWith("42")
                || sqlState.startsWith("3D") || sqlState.startsWith("3F"))) {
            return true;
        }
        return PERMANENT_ERROR_CODES.contains(exception.getErrorCode());
    }

    private static boolean containsAny(String message, Set<String> hints) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String hint : hints) {
            if (lower.contains(hint)) {
                return true;
            }
        }
        return false;
    }
}
