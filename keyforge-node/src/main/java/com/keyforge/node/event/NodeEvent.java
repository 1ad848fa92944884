package com.keyforge.node.event;

import java.time.Instant;
import java.util.Map;

/**
 * Event emitted by a node component.
 *
 * @param eventType  what happened
 * @param source     component name that emitted it
 * @param subjectId  task, worker, resource or proposal the event is about
 * @param timestamp  emission time
 * @param message    human readable detail, may be null
 * @param attributes typed details for metrics consumers
 */
public record NodeEvent(
        NodeEventType eventType,
        String source,
        String subjectId,
        Instant timestamp,
        String message,
        Map<String, Object> attributes
) {
    public NodeEvent {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public NodeEvent(NodeEventType eventType, String source, String subjectId) {
        this(eventType, source, subjectId, Instant.now(), null, Map.of());
    }

    public NodeEvent(NodeEventType eventType, String source, String subjectId, String message) {
        this(eventType, source, subjectId, Instant.now(), message, Map.of());
    }

    public NodeEvent(NodeEventType eventType, String source, String subjectId, String message,
                     Map<String, Object> attributes) {
        this(eventType, source, subjectId, Instant.now(), message, attributes);
    }
}
