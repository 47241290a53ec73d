package com.di.awardscope.aspect;

import com.di.awardscope.export.ExportCancelledException;
import com.di.awardscope.query.QueryTimeoutException;
import com.di.awardscope.snapshot.InternalInconsistencyException;
import com.di.awardscope.snapshot.SnapshotLoadException;
import com.di.awardscope.snapshot.SnapshotUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.springframework.http.converter.HttpMessageNotReadableException;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Standardized error categories for error responses and log lines.
 * <p>Usage: {@code ErrorCategory category = ErrorCategory.categorize(exception);}
 * <p>To add a new category: add the enum constant (before UNKNOWN), add a matcher in
 * {@link #MATCHERS}, and optionally add a helper in the "Matcher helpers" section below.
 */
public enum ErrorCategory {

    CANCELLED("Cancelled", "Export stopped on request or client disconnect"),
    DATA_INTEGRITY_ERROR("Data integrity error", "Snapshot data contradicts its manifest or itself"),
    SNAPSHOT_ERROR("Snapshot error", "No usable snapshot is active"),
    NETWORK_ERROR("Network error", "Network communication failure"),
    VALIDATION_ERROR("Validation error", "Input validation or business rule violation"),
    CONFIGURATION_ERROR("Configuration error", "Application configuration issue"),
    RESOURCE_ERROR("Resource error", "System resource exhaustion or unavailability"),
    SERIALIZATION_ERROR("Serialization error", "Data serialization or deserialization failure"),
    TIMEOUT_ERROR("Timeout error", "Operation exceeded maximum time limit"),
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
        MATCHERS.put(ErrorCategory::isCancelled, CANCELLED);
        MATCHERS.put(ErrorCategory::isDataIntegrityError, DATA_INTEGRITY_ERROR);
        MATCHERS.put(ErrorCategory::isSnapshotError, SNAPSHOT_ERROR);
        MATCHERS.put(ErrorCategory::isTimeoutError, TIMEOUT_ERROR);
        MATCHERS.put(ErrorCategory::isSerializationError, SERIALIZATION_ERROR);
        MATCHERS.put(ErrorCategory::isNetworkError, NETWORK_ERROR);
        MATCHERS.put(ErrorCategory::isValidationError, VALIDATION_ERROR);
        MATCHERS.put(ErrorCategory::isConfigurationError, CONFIGURATION_ERROR);
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

    private static boolean isCancelled(Throwable t) {
        return t instanceof ExportCancelledException;
    }

    private static boolean isDataIntegrityError(Throwable t) {
        return t instanceof InternalInconsistencyException;
    }

    private static boolean isSnapshotError(Throwable t) {
        return t instanceof SnapshotUnavailableException
                || t instanceof SnapshotLoadException;
    }

    private static boolean isTimeoutError(Throwable t) {
        return t instanceof QueryTimeoutException
                || t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.net.SocketTimeoutException
                || messageContains(t, "timeout", "timed out");
    }

    private static boolean isSerializationError(Throwable t) {
        return t instanceof HttpMessageNotReadableException
                || t instanceof JsonProcessingException
                || t instanceof java.io.NotSerializableException;
    }

    private static boolean isNetworkError(Throwable t) {
        return t instanceof java.net.ConnectException
                || t instanceof java.net.UnknownHostException
                || t instanceof java.net.SocketException
                || (t instanceof java.io.IOException && !(t instanceof java.io.FileNotFoundException)
                    && !(t instanceof java.nio.file.FileSystemException));
    }

    private static boolean isValidationError(Throwable t) {
        return t instanceof IllegalArgumentException
                || t instanceof jakarta.validation.ValidationException
                || t instanceof IllegalStateException
                || t instanceof java.util.NoSuchElementException
                || t instanceof IndexOutOfBoundsException;
    }

    private static boolean isConfigurationError(Throwable t) {
        return t instanceof org.springframework.beans.factory.BeanCreationException
                || t instanceof org.springframework.context.ApplicationContextException
                || t instanceof org.springframework.beans.factory.BeanDefinitionStoreException
                || t instanceof org.springframework.beans.factory.UnsatisfiedDependencyException;
    }

    private static boolean isResourceError(Throwable t) {
        return t instanceof OutOfMemoryError
                || t instanceof StackOverflowError
                || t instanceof java.util.concurrent.RejectedExecutionException
                || t instanceof java.io.FileNotFoundException
                || t instanceof java.nio.file.FileSystemException
                || (t instanceof java.io.IOException && messageContains(t, "no space"));
    }

    private static boolean messageContains(Throwable t, String... keywords) {
        String msg = t.getMessage();
        return msg != null && containsAny(msg.toLowerCase(Locale.ROOT), keywords);
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
