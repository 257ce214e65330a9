package com.mtbridge.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the trading-terminal gateway, bound to {@code gateway.*}.
 *
 * <p>Either {@code server-name} or a host/port pair selects the trading server. When
 * {@code host} is not set it is derived from {@code grpc-server} ({@code host:port}),
 * falling back to port 443 if the port part does not parse.
 *
 * <p>The password is never logged; the login is logged masked via {@link #maskedLogin()}.
 */
@Configuration
@ConfigurationProperties(prefix = "gateway")
@Validated
@Getter
@Setter
public class GatewayConfig {

    static final int DEFAULT_PORT = 443;

    /** Trading account login. */
    private Long login;

    /** Trading account password. */
    private String password;

    /** Preferred trading server name, used by connect-by-server-name. */
    private String serverName;

    /** Gateway endpoint as {@code host:port}. */
    @NotBlank
    private String grpcServer = "mt5.mrpc.pro:443";

    /** Explicit host for connect-by-host-port; derived from {@code grpcServer} when blank. */
    private String host;

    private Integer port;

    /** Disables TLS on the gateway channel. */
    private boolean plaintext = false;

    /** Default symbol for chart-bound connect calls and the tick readiness probe. */
    @NotBlank
    private String baseChartSymbol = "EURUSD";

    /** Timeout handed to the connect strategies, in seconds. */
    @Min(1)
    private int timeoutSeconds = 60;

    /** Bound for each probe, ping and login call, in milliseconds. */
    @Min(1)
    private long callTimeoutMs = 5_000;

    /** Bound for session-open and terminal-login handshakes, in milliseconds. */
    @Min(1)
    private long handshakeTimeoutMs = 10_000;

    /** Pause after the connect strategies so the server can warm up. */
    private long warmupDelayMs = 500;

    /** Classpath or file location of the deployment capability table. */
    private String capabilitiesResource = "classpath:gateway-capabilities.json";

    @Valid
    private Readiness readiness = new Readiness();

    private HealthCheck healthCheck = new HealthCheck();

    private Startup startup = new Startup();

    /** Host for connect-by-host-port: the explicit host, or the host part of {@code grpcServer}. */
    public String resolvedHost() {
        if (host != null && !host.isBlank()) {
            return host;
        }
        if (grpcServer != null && grpcServer.contains(":")) {
            return grpcServer.substring(0, grpcServer.lastIndexOf(':'));
        }
        return null;
    }

    public int resolvedPort() {
        if (host != null && !host.isBlank()) {
            return port != null ? port : DEFAULT_PORT;
        }
        if (grpcServer != null && grpcServer.contains(":")) {
            try {
                return Integer.parseInt(grpcServer.substring(grpcServer.lastIndexOf(':') + 1));
            } catch (NumberFormatException e) {
                return DEFAULT_PORT;
            }
        }
        return port != null ? port : DEFAULT_PORT;
    }

    public boolean hasServerName() {
        return serverName != null && !serverName.isBlank();
    }

    public Duration callTimeout() {
        return Duration.ofMillis(callTimeoutMs);
    }

    public Duration handshakeTimeout() {
        return Duration.ofMillis(handshakeTimeoutMs);
    }

    public Duration connectTimeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    public String maskedLogin() {
        if (login == null) {
            return "none";
        }
        String value = String.valueOf(login);
        return value.length() <= 3 ? "***" : value.substring(0, 2) + "***";
    }

    @Getter
    @Setter
    public static class Readiness {

        /** Readiness loop iterations before giving up. */
        @Min(1)
        private int maxTries = 12;

        /** Pause between readiness iterations, in milliseconds. */
        private long delayMs = 500;
    }

    @Getter
    @Setter
    public static class HealthCheck {

        /** Whether the periodic ensure-connected check runs. */
        private boolean enabled = true;

        private long intervalMs = 30_000;
    }

    @Getter
    @Setter
    public static class Startup {

        /** Connect on application start instead of waiting for the first caller. */
        private boolean connectOnReady = false;
    }
}
