package com.mtbridge.account;

import com.mtbridge.config.GatewayConfig;
import com.mtbridge.rpc.CapabilityCatalog;
import com.mtbridge.rpc.StubFactory;
import org.springframework.stereotype.Component;

@Component
public class GrpcTerminalAccountFactory implements TerminalAccountFactory {

    private final GatewayConfig gatewayConfig;
    private final CapabilityCatalog capabilityCatalog;
    private final StubFactory stubFactory;

    public GrpcTerminalAccountFactory(
            GatewayConfig gatewayConfig, CapabilityCatalog capabilityCatalog, StubFactory stubFactory) {
        this.gatewayConfig = gatewayConfig;
        this.capabilityCatalog = capabilityCatalog;
        this.stubFactory = stubFactory;
    }

    @Override
    public TerminalAccount create() {
        return new GrpcTerminalAccount(
                gatewayConfig, capabilityCatalog, stubFactory, ChannelOpener.forGatewayTarget());
    }
}
