package com.mtbridge.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mtbridge.rpc.CapabilityCatalog;
import com.mtbridge.rpc.CapabilityCatalogLoader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * Bean wiring for the gateway client.
 *
 * <p>The {@link CapabilityCatalog} describes which service modules this deployment
 * build ships. It is loaded once from {@code gateway.capabilities-resource} and shared
 * read-only by every connection attempt.
 */
@Configuration
public class GatewayClientConfig {

    @Bean
    public CapabilityCatalog capabilityCatalog(
            GatewayConfig gatewayConfig, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        return CapabilityCatalogLoader.load(
                resourceLoader.getResource(gatewayConfig.getCapabilitiesResource()), objectMapper);
    }
}
