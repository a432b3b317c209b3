package com.batchinsight.processing;

import com.batchinsight.shared.model.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Calls an HTTP analysis endpoint. 2xx carries the verdict; 408, 429 and 5xx are transient;
 * any other 4xx means the analyzer rejected the document.
 */
@Service
@ConditionalOnProperty(name = "analysis.mode", havingValue = "remote")
public class RemoteAnalysisCapability implements AnalysisCapability {

    private static final Logger logger = LoggerFactory.getLogger(RemoteAnalysisCapability.class);

    private final RestClient restClient;

    @Autowired
    public RemoteAnalysisCapability(
            @Value("${analysis.remote.endpoint}") String endpoint,
            @Value("${analysis.remote.connect-timeout:5s}") Duration connectTimeout,
            @Value("${analysis.remote.read-timeout:4m}") Duration readTimeout) {
        this(RestClient.builder()
                .baseUrl(endpoint)
                .requestFactory(requestFactory(connectTimeout, readTimeout))
                .build());
        logger.info("Remote analysis capability configured: endpoint={}", endpoint);
    }

    RemoteAnalysisCapability(RestClient restClient) {
        this.restClient = restClient;
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeout);
        factory.setReadTimeout(readTimeout);
        return factory;
    }

    @Override
    public AnalysisVerdict analyze(AnalysisRequest request) throws AnalysisException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("documentReference", request.getDocumentReference());
        body.put("content", request.getContent());
        body.put("options", request.getOptions());

        VerdictPayload payload;
        try {
            payload = restClient.post()
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(VerdictPayload.class);
        } catch (RestClientResponseException e) {
            throw classify(e.getStatusCode(), e);
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw new AnalysisException(FailureKind.TIMEOUT, "Analyzer timed out: " + e.getMessage(), e);
            }
            throw new AnalysisException(FailureKind.TRANSIENT, "Analyzer unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new AnalysisException(FailureKind.TRANSIENT, "Analyzer call failed: " + e.getMessage(), e);
        }

        if (payload == null || payload.getVerdict() == null || payload.getVerdict().isBlank()) {
            throw new AnalysisException(FailureKind.TRANSIENT, "Analyzer returned no verdict");
        }
        double confidence = payload.getConfidenceScore() != null ? payload.getConfidenceScore() : 0.0;
        return new AnalysisVerdict(payload.getVerdict(), confidence);
    }

    static AnalysisException classify(HttpStatusCode status, Exception cause) {
        int code = status.value();
        String message = "Analyzer responded with HTTP " + code;
        if (code == 408 || code == 429 || status.is5xxServerError()) {
            return new AnalysisException(FailureKind.TRANSIENT, message, cause);
        }
        logger.warn("Analyzer rejected document: HTTP {}", code);
        return new AnalysisException(FailureKind.REJECTED, message, cause);
    }

    /**
     * Response body of the analysis endpoint.
     */
    public static class VerdictPayload {
        private String verdict;
        private Double confidenceScore;

        public String getVerdict() {
            return verdict;
        }

        public void setVerdict(String verdict) {
            this.verdict = verdict;
        }

        public Double getConfidenceScore() {
            return confidenceScore;
        }

        public void setConfidenceScore(Double confidenceScore) {
            this.confidenceScore = confidenceScore;
        }
    }
}
