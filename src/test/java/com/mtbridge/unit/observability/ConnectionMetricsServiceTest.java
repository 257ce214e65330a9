package com.mtbridge.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

import com.mtbridge.connect.TerminalConnectionEngine;
import com.mtbridge.event.SessionEvent;
import com.mtbridge.event.SessionEventType;
import com.mtbridge.observability.ConnectionMetricsService;
import com.mtbridge.session.SessionMode;
import com.mtbridge.session.SessionState;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

/**
 * Tests for ConnectionMetricsService: counters and the timer follow session events, the
 * readiness gauge reads the engine.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ConnectionMetricsServiceTest {

    private MeterRegistry meterRegistry;
    private ConnectionMetricsService connectionMetricsService;

    @Mock
    private TerminalConnectionEngine engine;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        connectionMetricsService = new ConnectionMetricsService(meterRegistry, engine);
    }

    private void publish(SessionEventType type, Duration elapsed) {
        connectionMetricsService.onSessionEvent(new SessionEvent(
                this, type, SessionState.DISCONNECTED, SessionState.CONNECTING, SessionMode.LITE, type.name(), elapsed));
    }

    private double count(String name) {
        return meterRegistry.get(name).counter().count();
    }

    @Test
    @DisplayName("Connect starts and failures are counted")
    void attemptsAndFailures() {
        publish(SessionEventType.CONNECT_STARTED, null);
        publish(SessionEventType.CONNECT_STARTED, null);
        publish(SessionEventType.CONNECT_FAILED, Duration.ofSeconds(1));

        assertThat(count("gateway.connect.attempts")).isEqualTo(2.0);
        assertThat(count("gateway.connect.failures")).isEqualTo(1.0);
        assertThat(count("gateway.reconnects")).isZero();
    }

    @Test
    @DisplayName("Reconnects are counted")
    void reconnects() {
        publish(SessionEventType.RECONNECT_TRIGGERED, null);

        assertThat(count("gateway.reconnects")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Connect duration is recorded when the session becomes ready")
    void duration() {
        publish(SessionEventType.SESSION_READY, Duration.ofMillis(1500));
        publish(SessionEventType.STUBS_ATTACHED, Duration.ofMillis(200));

        assertThat(meterRegistry.get("gateway.connect.duration").timer().count()).isEqualTo(1);
        assertThat(meterRegistry.get("gateway.connect.duration").timer().totalTime(TimeUnit.MILLISECONDS))
                .isEqualTo(1500.0);
    }

    @Test
    @DisplayName("Readiness gauge follows the engine")
    void readyGauge() {
        when(engine.isConnected()).thenReturn(true);
        assertThat(meterRegistry.get("gateway.session.ready").gauge().value()).isEqualTo(1.0);

        when(engine.isConnected()).thenReturn(false);
        assertThat(meterRegistry.get("gateway.session.ready").gauge().value()).isZero();
    }
}
