package com.evidencevault.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
public class AuditEventListener {

    private static final Logger logger = LoggerFactory.getLogger(AuditEventListener.class);

    private final AuditSink sink;

    public AuditEventListener(AuditSink sink) {
        this.sink = sink;
    }

    @EventListener
    public void onVaultEvent(VaultEvent event) {
        try {
            sink.record(event.eventType(), event.attributes());
        } catch (RuntimeException e) {
            logger.warn("Audit sink rejected {} event: {}", event.eventType(), e.getMessage());
        }
    }
}
