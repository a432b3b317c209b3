package com.batchinsight.util;

/**
 * MDC keys shared by the request filter, workers and orchestrator; referenced from logback-spring.xml.
 */
public final class MdcKeys {

    public static final String REQUEST_ID = "request_id";
    public static final String CORRELATION_ID = "correlationId";
    public static final String BATCH_ID = "batch_id";
    public static final String JOB_ID = "job_id";

    private MdcKeys() {
        // Utility class
    }
}
