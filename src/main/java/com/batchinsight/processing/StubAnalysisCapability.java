package com.batchinsight.processing;

import com.batchinsight.shared.model.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic pattern-based analysis used when no remote analyzer is configured.
 * Starts from an accuracy of 90 and deducts 10 points for every suspicious phrase;
 * the verdict is the resulting risk level.
 */
@Service
@ConditionalOnProperty(name = "analysis.mode", havingValue = "stub", matchIfMissing = true)
public class StubAnalysisCapability implements AnalysisCapability {

    private static final Logger logger = LoggerFactory.getLogger(StubAnalysisCapability.class);

    private static final List<Pattern> SUSPICIOUS_PATTERNS = List.of(
            Pattern.compile("exactly \\d+\\.\\d+%", Pattern.CASE_INSENSITIVE),
            Pattern.compile("perfect 100%", Pattern.CASE_INSENSITIVE),
            Pattern.compile("zero complaints", Pattern.CASE_INSENSITIVE),
            Pattern.compile("unprecedented", Pattern.CASE_INSENSITIVE)
    );

    static final String REJECT_MARKER = "[[reject]]";
    static final int MAX_CONTENT_CHARS = 1_000_000;

    @Override
    public AnalysisVerdict analyze(AnalysisRequest request) throws AnalysisException {
        String content = request.getContent();
        if (content == null || content.isBlank()) {
            throw new AnalysisException(FailureKind.REJECTED, "Document has no text content");
        }
        if (content.length() > MAX_CONTENT_CHARS) {
            throw new AnalysisException(FailureKind.REJECTED,
                    "Document exceeds " + MAX_CONTENT_CHARS + " characters");
        }
        if (content.contains(REJECT_MARKER)) {
            throw new AnalysisException(FailureKind.REJECTED, "Document rejected by content policy");
        }

        double accuracy = 90.0;
        int findings = 0;
        for (Pattern pattern : SUSPICIOUS_PATTERNS) {
            Matcher matcher = pattern.matcher(content);
            while (matcher.find()) {
                findings++;
                accuracy -= 10.0;
            }
        }
        accuracy = Math.max(0.0, accuracy);

        String verdict = riskLevel(accuracy);
        logger.debug("Stub analysis of {}: {} finding(s), accuracy={}, verdict={}",
                request.getDocumentReference(), findings, accuracy, verdict);
        return new AnalysisVerdict(verdict, accuracy / 100.0);
    }

    static String riskLevel(double accuracy) {
        if (accuracy > 85) {
            return "low";
        }
        if (accuracy > 70) {
            return "medium";
        }
        if (accuracy > 50) {
            return "high";
        }
        return "critical";
    }
}
