package com.mtbridge.rpc;

import io.grpc.Channel;

/** Constructs a stub of the given type for a module, bound to {@code channel}. */
@FunctionalInterface
public interface StubFactory {

    ServiceStub create(CapabilityDescriptor descriptor, String stubType, Channel channel);
}
