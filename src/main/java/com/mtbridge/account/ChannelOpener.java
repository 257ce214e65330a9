package com.mtbridge.account;

import com.mtbridge.config.GatewayConfig;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;

/** Opens the gateway transport for an account. */
@FunctionalInterface
public interface ChannelOpener {

    ManagedChannel open(GatewayConfig config);

    /** Opens {@code grpc-server} with TLS, or in plaintext when configured so. */
    static ChannelOpener forGatewayTarget() {
        return config -> {
            ManagedChannelBuilder<?> builder = ManagedChannelBuilder.forTarget(config.getGrpcServer());
            if (config.isPlaintext()) {
                builder.usePlaintext();
            } else {
                builder.useTransportSecurity();
            }
            return builder.build();
        };
    }
}
