package xyz.firestige.fleet.domain.shared.event;

import java.time.Instant;
import java.util.UUID;

/**
 * 领域事件基类
 * <p>
 * message 是给操作员看的一句话摘要，具体字段由子类携带。
 */
public abstract class DomainEvent {

    private final String eventId = UUID.randomUUID().toString();
    private final Instant occurredAt = Instant.now();
    private final String message;

    protected DomainEvent(String message) {
        this.message = message;
    }

    public String getEventType() {
        return getClass().getSimpleName();
    }

    public String getEventId() {
        return eventId;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return getEventType() + "{" + message + "}";
    }
}
