package xyz.firestige.release.domain.shared.event;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.UUID;

/**
 * 领域事件基类
 */
public abstract class DomainEvent {

    private static final DateTimeFormatter DEFAULT_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final String eventId;
    private final LocalDateTime timestamp;

    protected DomainEvent(LocalDateTime timestamp) {
        this(UUID.randomUUID().toString(), timestamp);
    }

    protected DomainEvent(String eventId, LocalDateTime timestamp) {
        this.eventId = Objects.requireNonNull(eventId, "eventId");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
    }

    public String getEventName() {
        return this.getClass().getSimpleName();
    }

    public String getEventId() {
        return eventId;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public String getFormattedTimestamp() {
        return timestamp.format(DEFAULT_FORMATTER);
    }
}
