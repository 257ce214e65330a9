package com.mtbridge.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.grpc.MethodDescriptor;
import io.grpc.Status;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * gRPC marshaller that carries message bodies as JSON, so request shapes can come
 * from the capability table rather than from generated message classes.
 */
public final class JsonMarshaller<T> implements MethodDescriptor.Marshaller<T> {

    private final ObjectMapper objectMapper;
    private final Class<T> type;

    public JsonMarshaller(ObjectMapper objectMapper, Class<T> type) {
        this.objectMapper = objectMapper;
        this.type = type;
    }

    @Override
    public InputStream stream(T value) {
        try {
            return new ByteArrayInputStream(objectMapper.writeValueAsBytes(value));
        } catch (JsonProcessingException e) {
            throw Status.INTERNAL
                    .withDescription("Cannot encode " + type.getSimpleName())
                    .withCause(e)
                    .asRuntimeException();
        }
    }

    @Override
    public T parse(InputStream stream) {
        try {
            return objectMapper.readValue(stream, type);
        } catch (IOException e) {
            throw Status.INTERNAL
                    .withDescription("Cannot decode " + type.getSimpleName())
                    .withCause(e)
                    .asRuntimeException();
        }
    }
}
