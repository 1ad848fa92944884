package com.keyforge.node.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Synchronous observer list shared by the components of one node.
 * <p>
 * Handlers run on the emitting thread, in subscription order, type-specific
 * subscribers before wildcard subscribers. A failing handler is logged and does not
 * affect the emitter or other handlers. Handlers must not block.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<NodeEventType, List<Listener>> listenersByType = new EnumMap<>(NodeEventType.class);
    private final Map<String, Listener> listenersById = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong();

    public EventBus() {
        for (NodeEventType type : NodeEventType.values()) {
            listenersByType.put(type, new CopyOnWriteArrayList<>());
        }
    }

    /**
     * Delivers {@code event} to its type's listeners, then to wildcard listeners.
     * A null event is ignored.
     */
    public void emit(NodeEvent event) {
        if (event == null) {
            return;
        }
        deliver(listenersByType.get(event.eventType()), event);
        if (event.eventType() != NodeEventType.ALL) {
            deliver(listenersByType.get(NodeEventType.ALL), event);
        }
    }

    /**
     * Emits events collected while a component held its lock, in list order.
     */
    public void emitAll(List<NodeEvent> events) {
        events.forEach(this::emit);
    }

    /**
     * @param eventType event type to listen for, or {@link NodeEventType#ALL}
     * @return id to pass to {@link #unsubscribe(String)}
     */
    public String subscribe(NodeEventType eventType, Consumer<NodeEvent> handler) {
        if (eventType == null || handler == null) {
            throw new IllegalArgumentException("Event type and handler cannot be null");
        }
        Listener listener = new Listener("sub-" + nextId.incrementAndGet(), eventType, handler);
        listenersById.put(listener.id(), listener);
        listenersByType.get(eventType).add(listener);
        return listener.id();
    }

    /**
     * Removes a listener. Unknown ids are ignored.
     */
    public void unsubscribe(String listenerId) {
        if (listenerId == null) {
            return;
        }
        Listener listener = listenersById.remove(listenerId);
        if (listener != null) {
            listenersByType.get(listener.eventType()).remove(listener);
        }
    }

    public int getSubscriberCount(NodeEventType eventType) {
        return listenersByType.get(eventType).size();
    }

    private static void deliver(List<Listener> listeners, NodeEvent event) {
        for (Listener listener : listeners) {
            try {
                listener.handler().accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed on {}: {}", listener.id(), event.eventType(), e.getMessage(), e);
            }
        }
    }

    private record Listener(String id, NodeEventType eventType, Consumer<NodeEvent> handler) {}
}
