package com.evidencevault.event;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Default sink: one structured line per record on the {@code AUDIT} logger. */
@Component
public class LoggingAuditSink implements AuditSink {

    private static final Logger audit = LoggerFactory.getLogger("AUDIT");

    @Override
    public void record(String eventType, Map<String, Object> attributes) {
        audit.info("{} {}", eventType, attributes);
    }
}
