package com.di.qualitygate.exception;

import com.di.qualitygate.rules.UnparsableValueException;
import org.springframework.dao.DataAccessException;

import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Categories reported for a failed entity and for REST errors.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>The cause chain is searched: a {@link SQLException} or an
 * {@link UnparsableValueException} anywhere below a wrapper decides the category.
 */
public enum ErrorCategory {

    UNPARSABLE_VALUE("Unparsable value", "A staging value could not be read as its declared type"),
    CONNECTION_ERROR("Database connection error", "Failed to establish or maintain database connection"),
    CONSTRAINT_VIOLATION("Database constraint violation", "Database constraint check failed"),
    SQL_SYNTAX_ERROR("SQL syntax error", "Invalid SQL syntax or unknown table or column"),
    TRANSACTION_ROLLBACK("Transaction rollback", "Transaction was rolled back"),
    DATABASE_ERROR("Database error", "General database operation error"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit"),
    VALIDATION_ERROR("Validation error", "Input validation or internal consistency check failed"),
    CONFIGURATION_ERROR("Configuration error", "Application configuration issue"),
    SERIALIZATION_ERROR("Serialization error", "Quarantine payload could not be serialized"),
    APPLICATION_ERROR("Application error", "General application error"),
    UNKNOWN("Unknown error", "Unclassified or unknown error type");

    private final String name;
    private final String description;

    ErrorCategory(String name, String description) {
        this.name = name;
        this.description = description;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: the first matcher hitting any cause wins. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isSerializationError, SERIALIZATION_ERROR);
        MATCHERS.put(t -> t instanceof DataAccessException, DATABASE_ERROR);
        MATCHERS.put(ErrorCategory::isConfigurationError, CONFIGURATION_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
    }

    private static final Map<String, ErrorCategory> SQL_STATE_PREFIX = Map.of(
            "08", CONNECTION_ERROR,
            "23", CONSTRAINT_VIOLATION,
            "42", SQL_SYNTAX_ERROR,
            "40", TRANSACTION_ROLLBACK
    );

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        for (Throwable t = exception; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof UnparsableValueException) {
                return UNPARSABLE_VALUE;
            }
            if (t instanceof SQLException) {
                return categorizeSqlException((SQLException) t);
            }
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            for (Throwable t = exception; t != null; t = t.getCause() == t ? null : t.getCause()) {
                if (e.getKey().test(t)) {
                    return e.getValue();
                }
            }
        }
        return APPLICATION_ERROR;
    }

    private static ErrorCategory categorizeSqlException(SQLException sqlEx) {
        String sqlState = sqlEx.getSQLState();
        if (sqlState != null) {
            ErrorCategory byState = SQL_STATE_PREFIX.get(sqlState.substring(0, Math.min(2, sqlState.length())));
            if (byState != null) {
                return byState;
            }
        }
        String msg = sqlEx.getMessage();
        if (msg != null) {
            String lower = msg.toLowerCase();
            if (containsAny(lower, "connection", "refused", "closed")) return CONNECTION_ERROR;
            if (containsAny(lower, "constraint", "unique", "foreign key")) return CONSTRAINT_VIOLATION;
            if (containsAny(lower, "syntax", "does not exist")) return SQL_SYNTAX_ERROR;
        }
        return DATABASE_ERROR;
    }

    // --- Matcher helpers ---

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.net.SocketTimeoutException
                || t instanceof org.springframework.dao.QueryTimeoutException;
    }

    private static boolean isSerializationError(Throwable t) {
        return t instanceof com.fasterxml.jackson.core.JsonProcessingException;
    }

    private static boolean isConfigurationError(Throwable t) {
        return t instanceof org.springframework.beans.factory.BeanCreationException
                || t instanceof org.springframework.context.ApplicationContextException
                || t instanceof org.springframework.boot.context.properties.bind.BindException;
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof IllegalStateException;
    }

    private static boolean containsAny(String text, String... keywords) {
        for (String k : keywords) {
            if (text.contains(k)) return true;
        }
        return false;
    }

    @Override
    public String toString() {
        return name();
    }
}
