package com.di.datapipe.exception;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Failure taxonomy shared by every stage. A handler only ever reports success or failure
 * to the bus; the category decides whether that failure is worth a redelivery.
 * <p>Usage: {@code FailureCategory category = FailureCategory.categorize(exception);}
 * <p>To add a new category: add the enum constant (before UNKNOWN) and a matcher in {@link #MATCHERS}.
 */
public enum FailureCategory {

    TRANSIENT("Transient failure", "Network or upstream outage; recovered by redelivery", true),
    TIMEOUT("Timeout", "Operation exceeded its bounded timeout", true),
    MALFORMED_INPUT("Malformed input", "Content rejected by the load; recurs until content or schema handling changes", true),
    PERMISSION_DENIED("Permission denied", "Cross-identity call rejected; configuration defect", false),
    INVALID_MESSAGE("Invalid message", "Message payload could not be decoded", false),
    UNKNOWN("Unknown error", "Unclassified failure", true);

    private final String name;
    private final String description;
    private final boolean retryable;

    FailureCategory(String name, String description, boolean retryable) {
        this.name = name;
        this.description = description;
        this.retryable = retryable;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /** Whether a redelivery can change the outcome. */
    public boolean isRetryable() {
        return retryable;
    }

    /** Order matters: first match wins. */
    private static final Map<Predicate<Throwable>, FailureCategory> MATCHERS = new LinkedHashMap<>();

    static {
        MATCHERS.put(FailureCategory::isTimeout, TIMEOUT);
        MATCHERS.put(FailureCategory::isNetwork, TRANSIENT);
    }

    /**
     * Categorizes a failure. A {@link PipelineException} anywhere in the cause chain wins,
     * otherwise the outermost throwable is matched by type.
     */
    public static FailureCategory categorize(Throwable exception) {
        if (exception == null) {
            return UNKNOWN;
        }
        for (Throwable t = exception; t != null; t = t.getCause()) {
            if (t instanceof PipelineException) {
                return ((PipelineException) t).getCategory();
            }
            if (t.getCause() == t) {
                break;
            }
        }
        for (Map.Entry<Predicate<Throwable>, FailureCategory> e : MATCHERS.entrySet()) {
            if (e.getKey().test(exception)) {
                return e.getValue();
            }
        }
        return UNKNOWN;
    }

    private static boolean isTimeout(Throwable t) {
        return t instanceof java.util.concurrent.TimeoutException
                || t instanceof java.net.SocketTimeoutException;
    }

    private static boolean isNetwork(Throwable t) {
        return t instanceof java.net.ConnectException
                || t instanceof java.net.UnknownHostException
                || t instanceof java.net.SocketException
                || t instanceof java.io.IOException
                || t instanceof org.springframework.web.client.ResourceAccessException;
    }
}
