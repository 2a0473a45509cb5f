package xyz.firestige.release.util;

import xyz.firestige.release.domain.shared.event.DomainEvent;
import xyz.firestige.release.domain.shared.event.DomainEventPublisher;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 记录发布的领域事件
 */
public class RecordingEventPublisher implements DomainEventPublisher {

    private final List<DomainEvent> events = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void publish(DomainEvent event) {
        events.add(event);
    }

    public List<DomainEvent> getPublishedEvents() {
        synchronized (events) {
            return new ArrayList<>(events);
        }
    }

    public <T> List<T> getEventsOfType(Class<T> eventType) {
        return getPublishedEvents().stream()
                .filter(eventType::isInstance)
                .map(eventType::cast)
                .collect(Collectors.toList());
    }

    public <T> boolean hasEvent(Class<T> eventType) {
        return !getEventsOfType(eventType).isEmpty();
    }

    public void clear() {
        events.clear();
    }
}
