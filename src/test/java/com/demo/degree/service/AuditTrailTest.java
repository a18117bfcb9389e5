package com.demo.degree.service;

import com.demo.degree.model.RevocationEvent;
import com.demo.degree.model.VerificationEvent;
import com.demo.degree.model.VerificationMethod;
import com.demo.degree.repository.InMemoryEventLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("Audit trail")
class AuditTrailTest {

    private static final Instant T0 = Instant.parse("2024-06-01T10:00:00Z");

    @Mock
    private ApplicationEventPublisher publisher;

    private AuditTrail auditTrail;

    @BeforeEach
    void setUp() {
        auditTrail = new AuditTrail(new InMemoryEventLog<>(), new InMemoryEventLog<>(), publisher);
    }

    private static VerificationEvent event(String id, String degreeId, Instant at) {
        return new VerificationEvent(id, degreeId, "ACME_HR", VerificationMethod.HASH_ONLY, 1.0, "a".repeat(64), at);
    }

    @Test
    void shouldReturnNewestFirstRegardlessOfAppendOrder() {
        auditTrail.append(event("e2", "d1", T0.plusSeconds(20)));
        auditTrail.append(event("e1", "d1", T0.plusSeconds(10)));
        auditTrail.append(event("e3", "d1", T0.plusSeconds(30)));

        assertThat(auditTrail.queryByDegree("d1").map(VerificationEvent::eventId))
                .containsExactly("e3", "e2", "e1");
    }

    @Test
    void shouldPutLaterAppendFirstOnTimestampTie() {
        auditTrail.append(event("first", "d1", T0));
        auditTrail.append(event("second", "d1", T0));

        assertThat(auditTrail.queryByDegree("d1").map(VerificationEvent::eventId))
                .containsExactly("second", "first");
    }

    @Test
    void shouldKeepDegreesApart() {
        auditTrail.append(event("e1", "d1", T0));
        auditTrail.append(event("e2", "d2", T0));

        assertThat(auditTrail.queryByDegree("d1")).hasSize(1);
        assertThat(auditTrail.queryByDegree("unknown")).isEmpty();
    }

    @Test
    void shouldHandOutSingleUseSequence() {
        auditTrail.append(event("e1", "d1", T0));

        Stream<VerificationEvent> events = auditTrail.queryByDegree("d1");
        assertThat(events.count()).isEqualTo(1);
        assertThatThrownBy(events::count).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldPublishEveryAppendedEntry() {
        VerificationEvent verification = event("e1", "d1", T0);
        RevocationEvent revocation = new RevocationEvent("r1", "d1", "a".repeat(64), "forged", "AUTH", T0);

        auditTrail.append(verification);
        auditTrail.appendRevocation(revocation);

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(publisher, times(2)).publishEvent(captor.capture());
        assertThat(captor.getAllValues()).containsExactly(
                new AuditEventRecorded("d1", verification),
                new AuditEventRecorded("d1", revocation));
        assertThat(auditTrail.revocationsOf("d1")).containsExactly(revocation);
    }

    @Test
    void shouldKeepEntryWhenListenerFails() {
        doThrow(new IllegalStateException("listener down")).when(publisher).publishEvent(any(Object.class));

        auditTrail.append(event("e1", "d1", T0));

        assertThat(auditTrail.queryByDegree("d1")).hasSize(1);
    }
}
