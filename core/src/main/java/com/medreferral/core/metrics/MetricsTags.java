package com.medreferral.core.metrics;

/**
 * Standard tag keys for Micrometer metrics.
 */
public final class MetricsTags {
    private MetricsTags() {
    }

    public static final String NODE_ID = "node_id";

    /**
     * Outcome of an operation (ok/rejected/failed).
     */
    public static final String OUTCOME = "outcome";

    public static final String REASON = "reason";

    public static final String TRANSPORT = "transport";

    public static final String SERVICE = "service";
}
