package com.mtbridge.rpc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mtbridge.exception.RpcCallException;
import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientInterceptors;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.ClientCalls;
import io.grpc.stub.MetadataUtils;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link ServiceStub} that issues unary gRPC calls with JSON bodies.
 *
 * <p>Method descriptors are built once, at construction, for every method the module
 * declares; calls to undeclared methods fail with {@code UNIMPLEMENTED} without
 * touching the wire. Headers are attached per call as ASCII metadata.
 */
public class GrpcServiceStub implements ServiceStub {

    private final CapabilityDescriptor descriptor;
    private final String stubType;
    private final Channel channel;
    private final Map<String, MethodDescriptor<RpcRequest, RpcResponse>> methods = new HashMap<>();

    public GrpcServiceStub(CapabilityDescriptor descriptor, String stubType, Channel channel, ObjectMapper objectMapper) {
        this.descriptor = descriptor;
        this.stubType = stubType;
        this.channel = channel;

        JsonMarshaller<RpcRequest> requestMarshaller = new JsonMarshaller<>(objectMapper, RpcRequest.class);
        JsonMarshaller<RpcResponse> responseMarshaller = new JsonMarshaller<>(objectMapper, RpcResponse.class);
        for (String method : descriptor.getMethods()) {
            methods.put(
                    method,
                    MethodDescriptor.<RpcRequest, RpcResponse>newBuilder()
                            .setType(MethodDescriptor.MethodType.UNARY)
                            .setFullMethodName(MethodDescriptor.generateFullMethodName(descriptor.getService(), method))
                            .setRequestMarshaller(requestMarshaller)
                            .setResponseMarshaller(responseMarshaller)
                            .build());
        }
    }

    @Override
    public CapabilityDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public String stubType() {
        return stubType;
    }

    @Override
    public Channel channel() {
        return channel;
    }

    @Override
    public Optional<Object> field(String name) {
        if ("channel".equals(name) || "_channel".equals(name)) {
            return Optional.of(channel);
        }
        return Optional.empty();
    }

    @Override
    public RpcResponse call(String method, RpcRequest request, List<Header> headers, Duration timeout) {
        MethodDescriptor<RpcRequest, RpcResponse> methodDescriptor = methods.get(method);
        if (methodDescriptor == null) {
            throw new RpcCallException(
                    descriptor.getService(),
                    method,
                    Status.UNIMPLEMENTED.withDescription(stubType + " does not expose " + method),
                    null);
        }

        Channel target = ClientInterceptors.intercept(channel, MetadataUtils.newAttachHeadersInterceptor(toMetadata(headers)));
        CallOptions options = CallOptions.DEFAULT.withDeadlineAfter(timeout.toMillis(), TimeUnit.MILLISECONDS);
        try {
            return ClientCalls.blockingUnaryCall(target, methodDescriptor, options, request);
        } catch (StatusRuntimeException e) {
            throw new RpcCallException(descriptor.getService(), method, e.getStatus(), e);
        }
    }

    static Metadata toMetadata(List<Header> headers) {
        Metadata metadata = new Metadata();
        for (Header header : headers) {
            // gRPC metadata keys are lower-case ASCII
            metadata.put(Metadata.Key.of(header.key().toLowerCase(Locale.ROOT), Metadata.ASCII_STRING_MARSHALLER), header.value());
        }
        return metadata;
    }

    @Override
    public String toString() {
        return stubType + "@" + descriptor.getModule();
    }
}
