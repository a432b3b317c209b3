package com.batchinsight.processing;

/**
 * Successful analysis output.
 */
public final class AnalysisVerdict {

    private final String verdict;
    private final double confidenceScore;

    public AnalysisVerdict(String verdict, double confidenceScore) {
        this.verdict = verdict;
        this.confidenceScore = confidenceScore;
    }

    public String getVerdict() {
        return verdict;
    }

    public double getConfidenceScore() {
        return confidenceScore;
    }
}
