package com.kurobe.connector;

/**
 * Default and maximum per-call query timeouts, in seconds.
 */
public record QueryTimeouts(int defaultSeconds, int maxSeconds) {

    public static final QueryTimeouts DEFAULTS = new QueryTimeouts(30, 300);

    public QueryTimeouts {
        if (defaultSeconds <= 0 || maxSeconds <= 0) {
            throw new IllegalArgumentException("query timeouts must be positive");
        }
        if (defaultSeconds > maxSeconds) {
            throw new IllegalArgumentException("default query timeout exceeds the maximum");
        }
    }

    /**
     * Resolve a requested timeout: null means default, values are clamped to {@code [1, max]}.
     *
     * @param requested requested seconds, may be null
     * @return effective seconds
     */
    public int resolve(Integer requested) {
        if (requested == null) {
            return defaultSeconds;
        }
        return Math.max(1, Math.min(requested, maxSeconds));
    }
}
