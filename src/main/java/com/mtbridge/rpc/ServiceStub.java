package com.mtbridge.rpc;

import io.grpc.Channel;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * A client bound to one transport channel, exposing the remote methods of one
 * service module.
 *
 * <p>Stubs publish their transport through {@link #field(String)} ({@code channel},
 * {@code _channel}) so a channel can be recovered from an already attached stub.
 */
public interface ServiceStub extends FieldTable {

    CapabilityDescriptor descriptor();

    String stubType();

    Channel channel();

    default boolean exposes(String method) {
        return descriptor().exposes(method);
    }

    default Optional<String> firstExposed(List<String> aliases) {
        return aliases.stream().filter(this::exposes).findFirst();
    }

    default List<String> exposedAmong(List<String> aliases) {
        return aliases.stream().filter(this::exposes).toList();
    }

    /**
     * Issues one unary call.
     *
     * @throws com.mtbridge.exception.RpcCallException when the call fails or its deadline expires
     */
    RpcResponse call(String method, RpcRequest request, List<Header> headers, Duration timeout);
}
