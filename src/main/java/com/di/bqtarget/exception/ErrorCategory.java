package com.di.bqtarget.exception;

import com.google.cloud.bigquery.BigQueryException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Standardized error categories for fatal-error logging.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a new category: add the enum constant (before UNKNOWN), add a matcher in
 * {@link #MATCHERS}, and optionally add a helper in the "Matcher helpers" section below.
 */
public enum ErrorCategory {

    INPUT_ERROR("Input error", "Malformed, unknown or out-of-order Singer message"),
    SCHEMA_ERROR("Schema error", "Schema uses a type or shape the warehouse cannot hold"),
    VALIDATION_ERROR("Validation error", "Record does not satisfy its declared schema"),
    WAREHOUSE_ERROR("Warehouse error", "BigQuery rejected a load, insert or table operation"),
    CONFIGURATION_ERROR("Configuration error", "Missing or unsupported target configuration"),
    NETWORK_ERROR("Network error", "Network communication failure"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit"),
    AUTHENTICATION_ERROR("Authentication error", "Authentication or authorization failure"),
    RESOURCE_ERROR("Resource error", "System resource exhaustion or unavailability"),
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

    /** Order matters: first match wins. Add new categories before APPLICATION_ERROR. */
    private static final Map<Predicate<Throwable>, ErrorCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(ErrorCategory::isInputError, INPUT_ERROR);
        MATCHERS.put(t -> t instanceof UnknownTypeException, SCHEMA_ERROR);
        MATCHERS.put(t -> t instanceof RecordValidationException, VALIDATION_ERROR);
        MATCHERS.put(ErrorCategory::isConfigurationError, CONFIGURATION_ERROR);
        MATCHERS.put(ErrorCategory::isAuthenticationError, AUTHENTICATION_ERROR);
        MATCHERS.put(ErrorCategory::isWarehouseError, WAREHOUSE_ERROR);
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isNetworkError, NETWORK_ERROR);
        MATCHERS.put(ErrorCategory::isResourceError, RESOURCE_ERROR);
    }

    public static ErrorCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        for (Map.Entry<Predicate<Throwable>, ErrorCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return APPLICATION_ERROR;
    }

    // --- Matcher helpers (add new ones here when adding categories) ---

    private static boolean isInputError(Throwable t) {
        return t instanceof MessageParseException
                || t instanceof InvalidMessageException
                || t instanceof SchemaNotFoundException;
    }

    private static boolean isConfigurationError(Throwable t) {
        return t instanceof TargetConfigurationException
                || t instanceof UnsupportedConfigurationException
                || t instanceof org.springframework.beans.factory.BeanCreationException
                || t instanceof org.springframework.boot.context.properties.bind.BindException;
    }

    private static boolean isWarehouseError(Throwable t) {
        return t instanceof LoadFailureException
                || t instanceof InsertFailureException
                || t instanceof BigQueryException;
    }

    private static boolean isAuthenticationError(Throwable t) {
        if (t instanceof BigQueryException bq && (bq.getCode() == 401 || bq.getCode() == 403)) {
            return true;
        }
        return messageContains(t, "unauthenticated", "permission denied", "access denied", "invalid credentials");
    }

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.net.SocketTimeoutException
                || messageContains(t, "timed out", "timeout");
    }

    private static boolean isNetworkError(Throwable t) {
        return t instanceof java.net.ConnectException
                || t instanceof java.net.UnknownHostException
                || t instanceof java.net.SocketException;
    }

    private static boolean isResourceError(Throwable t) {
        return t instanceof OutOfMemoryError
                || t instanceof java.nio.file.FileSystemException
                || t instanceof java.io.UncheckedIOException
                || (t instanceof java.io.IOException && messageContains(t, "no space"));
    }

    private static boolean messageContains(Throwable t, String... keywords) {
        String msg = t.getMessage();
        return msg != null && containsAny(msg.toLowerCase(), keywords);
    }

    private static boolean containsAny(String text, String... keywords) {
        if (text == null) return false;
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
