package com.demo.degree.model;

import com.demo.degree.exception.BusinessException;
import com.demo.degree.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DegreeRecord")
class DegreeRecordTest {

    private static final Instant T0 = Instant.parse("2024-06-01T10:00:00Z");

    private final DegreeRecord issued = DegreeRecord.issue("d1", "a".repeat(64), "UNILAG", null, T0);

    @Test
    void shouldStartActiveAndUnverified() {
        assertThat(issued.status()).isEqualTo(DegreeStatus.ACTIVE);
        assertThat(issued.verificationCount()).isZero();
        assertThat(issued.lastVerifiedAt()).isNull();
        assertThat(issued.subjectFields().isEmpty()).isTrue();
    }

    @Test
    void shouldCountVerifications() {
        DegreeRecord verified = issued.withVerification(T0.plusSeconds(5)).withVerification(T0.plusSeconds(9));

        assertThat(verified.verificationCount()).isEqualTo(2);
        assertThat(verified.lastVerifiedAt()).isEqualTo(T0.plusSeconds(9));
        assertThat(issued.verificationCount()).isZero();
    }

    @Test
    void shouldRevokeOnce() {
        DegreeRecord revoked = issued.revoke("forged transcript", "AUTH", T0.plusSeconds(60));

        assertThat(revoked.isRevoked()).isTrue();
        assertThat(revoked.revocationReason()).isEqualTo("forged transcript");
        assertThat(revoked.revokedBy()).isEqualTo("AUTH");
        assertThat(revoked.revokedAt()).isEqualTo(T0.plusSeconds(60));
        assertThat(revoked.certificateHash()).isEqualTo(issued.certificateHash());

        assertThatThrownBy(() -> revoked.revoke("again", "AUTH", T0.plusSeconds(61)))
                .isInstanceOf(BusinessException.class)
                .extracting(e -> ((BusinessException) e).getErrorCode())
                .isEqualTo(ErrorCode.ALREADY_REVOKED);
    }

    @Test
    void shouldKeepRevokedTerminal() {
        assertThat(DegreeStatus.REVOKED.isTerminal()).isTrue();
        assertThat(DegreeStatus.REVOKED.canTransitionTo(DegreeStatus.ACTIVE)).isFalse();
        assertThat(DegreeStatus.ACTIVE.canTransitionTo(DegreeStatus.REVOKED)).isTrue();
    }
}
