package com.demo.degree.config;

import com.demo.degree.service.OrganizationDirectory;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Enrolls the attestation authority once the context is ready.
 */
@Configuration
@RequiredArgsConstructor
public class AuthorityBootstrap {

    private final AtomicBoolean done = new AtomicBoolean(false);

    private final OrganizationDirectory directory;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        // once per context
        if (!done.compareAndSet(false, true))
            return;
        directory.enrollAuthority();
    }
}
