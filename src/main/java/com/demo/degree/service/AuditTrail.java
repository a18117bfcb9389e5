package com.demo.degree.service;

import com.demo.degree.model.RevocationEvent;
import com.demo.degree.model.VerificationEvent;
import com.demo.degree.repository.EventLog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Append-only per-degree history of verification attempts and revocations.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuditTrail {

    private final EventLog<VerificationEvent> verificationLog;
    private final EventLog<RevocationEvent> revocationLog;
    private final ApplicationEventPublisher publisher;

    public void append(VerificationEvent event) {
        verificationLog.append(event.degreeId(), event);
        notifyListeners(event.degreeId(), event);
    }

    public void appendRevocation(RevocationEvent event) {
        revocationLog.append(event.degreeId(), event);
        notifyListeners(event.degreeId(), event);
    }

    /**
     * Verification events of one degree, newest first. Events with the same timestamp keep
     * reverse append order. The returned stream can be consumed once.
     */
    public Stream<VerificationEvent> queryByDegree(String degreeId) {
        List<VerificationEvent> events = new ArrayList<>(verificationLog.read(degreeId));
        Collections.reverse(events);
        events.sort(Comparator.comparing(VerificationEvent::timestamp).reversed());
        return events.stream();
    }

    public List<RevocationEvent> revocationsOf(String degreeId) {
        return revocationLog.read(degreeId);
    }

    private void notifyListeners(String degreeId, Object entry) {
        // the entry is already durable; a failing listener must not undo or hide it
        try {
            publisher.publishEvent(new AuditEventRecorded(degreeId, entry));
        } catch (RuntimeException ex) {
            log.error("Audit listener failed for degree {}: {}", degreeId, ex.toString(), ex);
        }
    }
}
