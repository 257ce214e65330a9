package com.mtbridge.rpc;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.grpc.Channel;
import org.springframework.stereotype.Component;

@Component
public class GrpcStubFactory implements StubFactory {

    private final ObjectMapper objectMapper;

    public GrpcStubFactory(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ServiceStub create(CapabilityDescriptor descriptor, String stubType, Channel channel) {
        return new GrpcServiceStub(descriptor, stubType, channel, objectMapper);
    }
}
