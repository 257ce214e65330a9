package com.mtbridge.session;

import com.mtbridge.config.GatewayConfig;
import com.mtbridge.connect.TerminalConnectionEngine;
import com.mtbridge.exception.GatewayException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodically runs {@link TerminalConnectionEngine#ensureConnected()} so a dropped
 * gateway session is rebuilt without waiting for a caller.
 *
 * <p>Only acts while a session exists, or while the last checks failed (a reconnect that
 * failed leaves no session behind). Skipped entirely when
 * {@code gateway.health-check.enabled} is false.
 */
@Service
public class SessionHealthService {

    private static final Logger log = LoggerFactory.getLogger(SessionHealthService.class);

    private final TerminalConnectionEngine engine;
    private final GatewayConfig config;

    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);

    public SessionHealthService(TerminalConnectionEngine engine, GatewayConfig config) {
        this.engine = engine;
        this.config = config;
    }

    @Scheduled(
            fixedDelayString = "${gateway.health-check.interval-ms:30000}",
            initialDelayString = "${gateway.health-check.interval-ms:30000}")
    public void checkSessionHealth() {
        if (!config.getHealthCheck().isEnabled()) {
            return;
        }
        if (!engine.hasSession() && consecutiveFailures.get() == 0) {
            return;
        }

        try {
            engine.ensureConnected();
            if (consecutiveFailures.getAndSet(0) > 0) {
                log.info("Gateway session recovered");
            }
        } catch (GatewayException e) {
            int failures = consecutiveFailures.incrementAndGet();
            log.warn("Gateway health check failed ({} in a row): {}", failures, e.getMessage());
        }
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }
}
