package com.demo.degree.config;

import com.demo.degree.model.DegreeRecord;
import com.demo.degree.model.Organization;
import com.demo.degree.model.RevocationEvent;
import com.demo.degree.model.VerificationEvent;
import com.demo.degree.repository.EventLog;
import com.demo.degree.repository.InMemoryEventLog;
import com.demo.degree.repository.InMemoryKeyValueStore;
import com.demo.degree.repository.KeyValueStore;
import com.demo.degree.service.KeyedLocks;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Backing stores for the registry. In-memory by default; a deployment that hosts the
 * registry elsewhere replaces these beans with its own {@link KeyValueStore} / {@link EventLog}.
 */
@Configuration
public class RegistryConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public KeyValueStore<Organization> organizationStore() {
        return new InMemoryKeyValueStore<>();
    }

    @Bean
    public KeyValueStore<DegreeRecord> degreeStore() {
        return new InMemoryKeyValueStore<>();
    }

    /** certificateHash → degreeId */
    @Bean
    public KeyValueStore<String> hashIndex() {
        return new InMemoryKeyValueStore<>();
    }

    @Bean
    public EventLog<VerificationEvent> verificationLog() {
        return new InMemoryEventLog<>();
    }

    @Bean
    public EventLog<RevocationEvent> revocationLog() {
        return new InMemoryEventLog<>();
    }

    @Bean
    public KeyedLocks keyedLocks(AttestationProperties props) {
        return new KeyedLocks(props.getLockStripes());
    }
}
