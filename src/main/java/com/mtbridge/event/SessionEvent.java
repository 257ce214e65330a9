package com.mtbridge.event;

import com.mtbridge.session.SessionMode;
import com.mtbridge.session.SessionState;
import java.time.Duration;
import java.time.LocalDateTime;
import org.springframework.context.ApplicationEvent;

/**
 * Published on every gateway session lifecycle change.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>ConnectionMetricsService: connect attempt/failure/reconnect counters, connect duration, ready gauge</li>
 *   <li>downstream trading services, which stop issuing calls on DISCONNECTED and CONNECT_FAILED</li>
 * </ul>
 *
 * <p>{@code mode} is null until mode detection has run; {@code elapsed} is the time since
 * {@code connect()} started and is null for events outside a connect.
 */
public class SessionEvent extends ApplicationEvent {

    private final SessionEventType eventType;
    private final SessionState previousState;
    private final SessionState newState;
    private final SessionMode mode;
    private final String message;
    private final Duration elapsed;
    private final LocalDateTime occurredAt;

    public SessionEvent(
            Object source,
            SessionEventType eventType,
            SessionState previousState,
            SessionState newState,
            SessionMode mode,
            String message,
            Duration elapsed) {
        super(source);
        this.eventType = eventType;
        this.previousState = previousState;
        this.newState = newState;
        this.mode = mode;
        this.message = message;
        this.elapsed = elapsed;
        this.occurredAt = LocalDateTime.now();
    }

    public SessionEventType getEventType() {
        return eventType;
    }

    public SessionState getPreviousState() {
        return previousState;
    }

    public SessionState getNewState() {
        return newState;
    }

    public SessionMode getMode() {
        return mode;
    }

    public String getMessage() {
        return message;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public LocalDateTime getOccurredAt() {
        return occurredAt;
    }
}
