package com.batchinsight.processing;

import java.util.Map;

/**
 * Input of one analysis call.
 */
public final class AnalysisRequest {

    private final String documentReference;
    private final String content;
    private final Map<String, Object> options;

    public AnalysisRequest(String documentReference, String content, Map<String, Object> options) {
        this.documentReference = documentReference;
        this.content = content;
        this.options = options != null ? options : Map.of();
    }

    public String getDocumentReference() {
        return documentReference;
    }

    public String getContent() {
        return content;
    }

    public Map<String, Object> getOptions() {
        return options;
    }
}
