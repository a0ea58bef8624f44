package com.evidencevault.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Fire-and-forget publication of {@link VaultEvent}s. A failing subscriber is
 * logged and otherwise ignored: it never rolls back the vault mutation that
 * produced the event.
 */
@Component
public class VaultEventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(VaultEventPublisher.class);

    private final ApplicationEventPublisher delegate;

    public VaultEventPublisher(ApplicationEventPublisher delegate) {
        this.delegate = delegate;
    }

    public void publish(VaultEvent event) {
        try {
            delegate.publishEvent(event);
        } catch (RuntimeException e) {
            logger.warn("Subscriber failed for {} event: {}", event.eventType(), e.getMessage(), e);
        }
    }
}
