package com.demo.degree.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Echoes audit entries to the application log as JSON.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AuditLogListener {

    private final ObjectMapper objectMapper;

    @EventListener
    public void onAudit(AuditEventRecorded recorded) {
        if (!log.isDebugEnabled()) return;
        log.debug("audit {} {}", recorded.entry().getClass().getSimpleName(), toJson(recorded.entry()));
    }

    String toJson(Object entry) {
        try {
            return objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            return String.valueOf(entry);
        }
    }
}
