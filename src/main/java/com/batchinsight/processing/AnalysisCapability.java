package com.batchinsight.processing;

/**
 * The opaque content-analysis worker. Implementations are selected by analysis.mode.
 */
public interface AnalysisCapability {

    /**
     * Analyzes one document.
     *
     * @throws AnalysisException with kind TIMEOUT or TRANSIENT when the call may be retried,
     *                           REJECTED when the document will never be accepted
     */
    AnalysisVerdict analyze(AnalysisRequest request) throws AnalysisException;
}
