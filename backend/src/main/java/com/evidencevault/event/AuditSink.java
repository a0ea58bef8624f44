package com.evidencevault.event;

import java.util.Map;

/**
 * External audit collaborator. Implementations deliver records to wherever the
 * platform keeps its audit trail.
 */
public interface AuditSink {

    void record(String eventType, Map<String, Object> attributes);
}
