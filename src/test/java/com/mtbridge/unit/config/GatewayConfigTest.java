package com.mtbridge.unit.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.mtbridge.config.GatewayConfig;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for GatewayConfig host/port derivation from the server address,
 * defaults and login masking.
 */
class GatewayConfigTest {

    private final GatewayConfig config = new GatewayConfig();

    @Test
    @DisplayName("Host and port derive from the endpoint when not set explicitly")
    void derivedFromEndpoint() {
        config.setGrpcServer("gw.example.net:9443");

        assertThat(config.resolvedHost()).isEqualTo("gw.example.net");
        assertThat(config.resolvedPort()).isEqualTo(9443);
    }

    @Test
    @DisplayName("Explicit host wins over the endpoint")
    void explicitHost() {
        config.setHost("10.1.2.3");

        assertThat(config.resolvedHost()).isEqualTo("10.1.2.3");
        assertThat(config.resolvedPort()).isEqualTo(443);
    }

    @Test
    @DisplayName("An endpoint without a port gives no host")
    void noPort() {
        config.setGrpcServer("gateway-only");

        assertThat(config.resolvedHost()).isNull();
    }

    @Test
    @DisplayName("An unparsable port falls back to 443")
    void badPort() {
        config.setGrpcServer("gw.example.net:tls");

        assertThat(config.resolvedPort()).isEqualTo(443);
    }

    @Test
    @DisplayName("Defaults match the gateway's usual deployment")
    void defaults() {
        assertThat(config.getGrpcServer()).isEqualTo("mt5.mrpc.pro:443");
        assertThat(config.getBaseChartSymbol()).isEqualTo("EURUSD");
        assertThat(config.connectTimeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.getReadiness().getMaxTries()).isEqualTo(12);
        assertThat(config.hasServerName()).isFalse();
    }

    @Test
    @DisplayName("Login is masked in logs")
    void maskedLogin() {
        assertThat(config.maskedLogin()).isEqualTo("none");

        config.setLogin(5_001_234L);
        assertThat(config.maskedLogin()).isEqualTo("50***");
    }
}
