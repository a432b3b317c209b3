package com.batchinsight.processing;

import com.batchinsight.shared.model.FailureKind;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatusCode;

import static org.assertj.core.api.Assertions.assertThat;

class RemoteAnalysisCapabilityTest {

    private FailureKind classify(int status) {
        return RemoteAnalysisCapability.classify(HttpStatusCode.valueOf(status), null).getKind();
    }

    @Test
    void serverErrorsAndThrottling_areTransient() {
        assertThat(classify(500)).isEqualTo(FailureKind.TRANSIENT);
        assertThat(classify(503)).isEqualTo(FailureKind.TRANSIENT);
        assertThat(classify(429)).isEqualTo(FailureKind.TRANSIENT);
        assertThat(classify(408)).isEqualTo(FailureKind.TRANSIENT);
    }

    @Test
    void otherClientErrors_areRejections() {
        assertThat(classify(400)).isEqualTo(FailureKind.REJECTED);
        assertThat(classify(413)).isEqualTo(FailureKind.REJECTED);
        assertThat(classify(422)).isEqualTo(FailureKind.REJECTED);
    }
}
