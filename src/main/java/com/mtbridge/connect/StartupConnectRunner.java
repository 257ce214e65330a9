package com.mtbridge.connect;

import com.mtbridge.config.GatewayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Optionally connects once the application has started ({@code gateway.startup.connect-on-ready}).
 *
 * <p>Runs on the connect executor so startup is never blocked. A failed connect is retried
 * with exponential backoff (5s initial, doubling up to 60s, 5 attempts); after that the
 * session stays down until a caller connects or the health check reconnects.
 */
@Component
public class StartupConnectRunner implements ApplicationListener<ApplicationReadyEvent> {

    private static final Logger log = LoggerFactory.getLogger(StartupConnectRunner.class);

    static final long INITIAL_RETRY_INTERVAL_MS = 5_000;
    static final long MAX_RETRY_INTERVAL_MS = 60_000;
    static final int MAX_ATTEMPTS = 5;

    private final TerminalConnectionEngine engine;
    private final GatewayConfig config;

    public StartupConnectRunner(TerminalConnectionEngine engine, GatewayConfig config) {
        this.engine = engine;
        this.config = config;
    }

    @Override
    @Async("connectExecutor")
    public void onApplicationEvent(ApplicationReadyEvent event) {
        if (!config.getStartup().isConnectOnReady()) {
            log.debug("Startup connect disabled");
            return;
        }
        connectWithBackoff();
    }

    /** Returns true once connected; false after exhausting attempts or on interruption. */
    boolean connectWithBackoff() {
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                engine.connect();
                log.info("Startup connect succeeded on attempt {}", attempt);
                return true;
            } catch (RuntimeException e) {
                long interval = backoffInterval(attempt);
                log.warn(
                        "Startup connect attempt {}/{} failed: {}. Retrying in {}s...",
                        attempt,
                        MAX_ATTEMPTS,
                        e.getMessage(),
                        interval / 1000);

                if (attempt < MAX_ATTEMPTS) {
                    try {
                        Thread.sleep(interval);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        log.warn("Startup connect retry interrupted");
                        return false;
                    }
                }
            }
        }

        log.error("Gateway not connected after {} startup attempts; waiting for callers or health check", MAX_ATTEMPTS);
        return false;
    }

    static long backoffInterval(int attempt) {
        return Math.min(INITIAL_RETRY_INTERVAL_MS * (1L << (attempt - 1)), MAX_RETRY_INTERVAL_MS);
    }
}
