package com.mtbridge.unit.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.mtbridge.config.GatewayConfig;
import com.mtbridge.connect.TerminalConnectionEngine;
import com.mtbridge.exception.ConnectException;
import com.mtbridge.session.SessionHealthService;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for SessionHealthService covering when the periodic check runs and how it
 * counts consecutive failures.
 */
class SessionHealthServiceTest {

    private TerminalConnectionEngine engine;
    private GatewayConfig config;
    private SessionHealthService sessionHealthService;

    @BeforeEach
    void setUp() {
        engine = mock(TerminalConnectionEngine.class);
        config = new GatewayConfig();
        sessionHealthService = new SessionHealthService(engine, config);
    }

    @Nested
    @DisplayName("Skipping")
    class Skipping {

        @Test
        @DisplayName("Does nothing when health checks are disabled")
        void disabled() {
            config.getHealthCheck().setEnabled(false);
            when(engine.hasSession()).thenReturn(true);

            sessionHealthService.checkSessionHealth();

            verify(engine, never()).ensureConnected();
        }

        @Test
        @DisplayName("Does nothing before the first session")
        void noSessionYet() {
            when(engine.hasSession()).thenReturn(false);

            sessionHealthService.checkSessionHealth();

            verify(engine, never()).ensureConnected();
        }
    }

    @Nested
    @DisplayName("Checking")
    class Checking {

        @Test
        @DisplayName("Runs ensureConnected while a session exists")
        void checksSession() {
            when(engine.hasSession()).thenReturn(true);

            sessionHealthService.checkSessionHealth();

            verify(engine).ensureConnected();
            assertThat(sessionHealthService.getConsecutiveFailures()).isZero();
        }

        @Test
        @DisplayName("Counts failures and keeps retrying after the session is gone")
        void countsFailures() {
            when(engine.hasSession()).thenReturn(true, false);
            doThrow(new ConnectException(Map.of("reason", "down"))).when(engine).ensureConnected();

            sessionHealthService.checkSessionHealth();
            sessionHealthService.checkSessionHealth();

            verify(engine, times(2)).ensureConnected();
            assertThat(sessionHealthService.getConsecutiveFailures()).isEqualTo(2);
        }

        @Test
        @DisplayName("A successful check resets the failure count")
        void recovery() {
            when(engine.hasSession()).thenReturn(true);
            doThrow(new ConnectException()).doNothing().when(engine).ensureConnected();

            sessionHealthService.checkSessionHealth();
            assertThat(sessionHealthService.getConsecutiveFailures()).isEqualTo(1);

            sessionHealthService.checkSessionHealth();
            assertThat(sessionHealthService.getConsecutiveFailures()).isZero();
        }
    }
}
