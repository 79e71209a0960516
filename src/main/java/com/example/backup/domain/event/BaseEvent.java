package com.example.backup.domain.event;

import com.example.backup.infrastructure.util.IdGenerator;
import lombok.Data;

import java.time.Instant;

@Data
public abstract class BaseEvent<T> {
    private String eventId;
    private String eventType;
    private T payload;
    private Instant timestamp;

    protected BaseEvent() {
        this.eventId = IdGenerator.generateEventId();
        this.timestamp = Instant.now();
    }

    protected BaseEvent(String eventType, T payload) {
        this();
        this.eventType = eventType;
        this.payload = payload;
    }
}
