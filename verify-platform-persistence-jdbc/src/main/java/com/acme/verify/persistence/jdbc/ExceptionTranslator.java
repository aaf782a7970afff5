package com.acme.verify.persistence.jdbc;

import com.acme.verify.core.TransportException;
import org.slf4j.Logger;

import java.sql.SQLException;

/**
 * Utility class for translating SQLException to pipeline exceptions.
 * A store that cannot be reached becomes a {@link TransportException}; anything else becomes a
 * {@link PersistenceException}.
 */
public final class ExceptionTranslator {

    private static final String UNIQUE_VIOLATION = "23505";

    private ExceptionTranslator() {
        // Utility class - no instantiation
    }

    /**
     * Translates a SQLException to either TransportException or PersistenceException.
     *
     * @param originalException The SQLException that occurred
     * @param operation         Description of the operation that failed
     * @param logger            Logger for error reporting
     */
    public static RuntimeException translateException(
            SQLException originalException, String operation, Logger logger) {

        logger.error("Database operation failed: {}", operation, originalException);

        if (isPermanentError(originalException)) {
            return new PersistenceException(
                    String.format("Database error during %s: %s", operation,
                            originalException.getMessage()), originalException);
        }

        // Connection loss, lock and pool timeouts, and anything unclassified
        return new TransportException(
                String.format("Store unavailable during %s: %s", operation,
                        originalException.getMessage()), originalException);
    }

    /** True for a primary key or unique constraint violation, on H2 and PostgreSQL alike. */
    public static boolean isUniqueViolation(SQLException exception) {
        return exception != null && UNIQUE_VIOLATION.equals(exception.getSQLState());
    }

    /**
     * Permanent errors include schema problems (missing table or column), constraint violations,
     * syntax errors and data type mismatches.
     */
    private static boolean isPermanentError(SQLException exception) {
        String message = exception.getMessage() == null ? "" : exception.getMessage().toLowerCase();
        String sqlState = exception.getSQLState();

        if (message.contains("timeout") || message.contains("connection refused") ||
                message.contains("deadlock") || message.contains("pool exhausted")) {
            return false;
        }

        if (sqlState != null) {
            // 08xxx - Connection Exception
            // 40xxx - Transaction Rollback
            // 57P03 - Cannot connect now
            if (sqlState.startsWith("08") || sqlState.startsWith("40") || sqlState.equals("57P03")) {
                return false;
            }
            // 22xxx - Data Exception
            // 23xxx - Integrity Constraint Violation
            // 42xxx - Syntax Error / Access Violation
            // 3Dxxx / 3Fxxx - Invalid Catalog / Schema Name
            if (sqlState.startsWith("22") || sqlState.startsWith("23") || sqlState.startsWith("42") ||
                    sqlState.startsWith("3D") || sqlState.startsWith("3F")) {
                return true;
            }
        }

        if (message.contains("syntax error") || message.contains("not found") ||
                message.contains("does not exist") || message.contains("constraint") ||
                message.contains("type mismatch")) {
            return true;
        }

        // H2: 90002 table not found, 90007 parameter count mismatch, 42122 column not found
        int errorCode = exception.getErrorCode();
        return errorCode == 90002 || errorCode == 90007 || errorCode == 42122;
    }
}
