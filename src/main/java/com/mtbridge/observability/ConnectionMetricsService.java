package com.mtbridge.observability;

import com.mtbridge.connect.TerminalConnectionEngine;
import com.mtbridge.event.SessionEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the gateway session:
 * <ul>
 *   <li><b>gateway.connect.attempts</b> (counter): every {@code connect()}</li>
 *   <li><b>gateway.connect.failures</b> (counter): every {@code connect()} that raised</li>
 *   <li><b>gateway.reconnects</b> (counter): rebuilds triggered by a failed health probe</li>
 *   <li><b>gateway.connect.duration</b> (timer): connect start to READY</li>
 *   <li><b>gateway.session.ready</b> (gauge 0/1): whether the session is READY</li>
 * </ul>
 * Counters and the timer are driven by {@link SessionEvent}s; the gauge reads the engine.
 */
@Service
public class ConnectionMetricsService {

    private final Counter connectAttempts;
    private final Counter connectFailures;
    private final Counter reconnects;
    private final Timer connectDuration;

    public ConnectionMetricsService(MeterRegistry meterRegistry, TerminalConnectionEngine engine) {
        this.connectAttempts = Counter.builder("gateway.connect.attempts")
                .description("Gateway connect attempts")
                .register(meterRegistry);

        this.connectFailures = Counter.builder("gateway.connect.failures")
                .description("Gateway connect attempts that raised")
                .register(meterRegistry);

        this.reconnects = Counter.builder("gateway.reconnects")
                .description("Session rebuilds triggered by ensureConnected")
                .register(meterRegistry);

        this.connectDuration = Timer.builder("gateway.connect.duration")
                .description("Time from connect start to a ready session")
                .publishPercentiles(0.5, 0.95)
                .maximumExpectedValue(Duration.ofMinutes(2))
                .register(meterRegistry);

        meterRegistry.gauge("gateway.session.ready", engine, e -> e.isConnected() ? 1.0 : 0.0);
    }

    @EventListener
    @Order(20)
    public void onSessionEvent(SessionEvent event) {
        switch (event.getEventType()) {
            case CONNECT_STARTED -> connectAttempts.increment();
            case CONNECT_FAILED -> connectFailures.increment();
            case RECONNECT_TRIGGERED -> reconnects.increment();
            case SESSION_READY -> {
                if (event.getElapsed() != null) {
                    connectDuration.record(event.getElapsed());
                }
            }
            default -> {
                // no metric
            }
        }
    }
}
