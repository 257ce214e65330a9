package com.mtbridge.unit.rpc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mtbridge.exception.RpcCallException;
import com.mtbridge.rpc.CapabilityDescriptor;
import com.mtbridge.rpc.GrpcServiceStub;
import com.mtbridge.rpc.Header;
import com.mtbridge.rpc.JsonMarshaller;
import com.mtbridge.rpc.RequestType;
import com.mtbridge.rpc.RpcRequest;
import com.mtbridge.rpc.RpcResponse;
import io.grpc.ManagedChannel;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.Server;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.ServerInterceptors;
import io.grpc.ServerServiceDefinition;
import io.grpc.Status;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.stub.ServerCalls;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Exercises the JSON-over-gRPC stub against an in-process server. */
/**
 * Unit tests for GrpcServiceStub calls over an in-process gRPC server:
 * JSON marshalling, headers, deadlines and status mapping.
 */
class GrpcServiceStubTest {

    private static final String SERVICE = "mt5_term_api.AccountHelper";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicReference<Metadata> lastHeaders = new AtomicReference<>();
    private final AtomicReference<JsonNode> lastRequest = new AtomicReference<>();

    private Server server;
    private ManagedChannel channel;
    private GrpcServiceStub stub;

    @BeforeEach
    void setUp() throws Exception {
        String name = InProcessServerBuilder.generateName();
        ServerServiceDefinition service = ServerServiceDefinition.builder(SERVICE)
                .addMethod(method("Ping"), ServerCalls.<JsonNode, JsonNode>asyncUnaryCall((request, observer) -> {
                    lastRequest.set(request);
                    observer.onNext(objectMapper.createObjectNode().put("pong", true));
                    observer.onCompleted();
                }))
                .addMethod(method("AccountSummary"), ServerCalls.<JsonNode, JsonNode>asyncUnaryCall((request, observer) ->
                        observer.onError(Status.PERMISSION_DENIED.withDescription("not logged in").asRuntimeException())))
                .addMethod(method("OpenedOrdersTickets"), ServerCalls.<JsonNode, JsonNode>asyncUnaryCall((request, observer) -> {
                    // never answers
                }))
                .build();

        ServerInterceptor captureHeaders = new ServerInterceptor() {
            @Override
            public <Q, R> ServerCall.Listener<Q> interceptCall(
                    ServerCall<Q, R> call, Metadata headers, ServerCallHandler<Q, R> next) {
                lastHeaders.set(headers);
                return next.startCall(call, headers);
            }
        };

        server = InProcessServerBuilder.forName(name)
                .directExecutor()
                .addService(ServerInterceptors.intercept(service, captureHeaders))
                .build()
                .start();
        channel = InProcessChannelBuilder.forName(name).directExecutor().build();

        CapabilityDescriptor descriptor = CapabilityDescriptor.builder()
                .key("account-helper")
                .module("mt5_term_api_account_helper")
                .service(SERVICE)
                .stubType("AccountHelperServiceStub")
                .method("Ping")
                .method("AccountSummary")
                .method("OpenedOrdersTickets")
                .requestType("PingRequest", new RequestType("PingRequest", List.of("id")))
                .build();
        stub = new GrpcServiceStub(descriptor, "AccountHelperServiceStub", channel, objectMapper);
    }

    @AfterEach
    void tearDown() {
        channel.shutdownNow();
        server.shutdownNow();
    }

    private MethodDescriptor<JsonNode, JsonNode> method(String name) {
        JsonMarshaller<JsonNode> marshaller = new JsonMarshaller<>(objectMapper, JsonNode.class);
        return MethodDescriptor.<JsonNode, JsonNode>newBuilder()
                .setType(MethodDescriptor.MethodType.UNARY)
                .setFullMethodName(MethodDescriptor.generateFullMethodName(SERVICE, name))
                .setRequestMarshaller(marshaller)
                .setResponseMarshaller(marshaller)
                .build();
    }

    @Test
    @DisplayName("Unary call sends the JSON body and returns the response")
    void unaryCallRoundTrip() {
        RpcRequest request = stub.descriptor().requestType("PingRequest").orElseThrow().newRequest();
        request.set("id", "guid-1");

        RpcResponse response = stub.call("Ping", request, List.of(), Duration.ofSeconds(2));

        assertThat(response.path("pong").asBoolean()).isTrue();
        assertThat(lastRequest.get().path("id").asText()).isEqualTo("guid-1");
    }

    @Test
    @DisplayName("Headers travel as lower-cased metadata")
    void headersAttachedAsMetadata() {
        stub.call(
                "Ping",
                RpcRequest.empty(),
                List.of(new Header("terminalInstanceGuid", "guid-1"), new Header("user", "5001234")),
                Duration.ofSeconds(2));

        Metadata headers = lastHeaders.get();
        assertThat(headers.get(Metadata.Key.of("terminalinstanceguid", Metadata.ASCII_STRING_MARSHALLER)))
                .isEqualTo("guid-1");
        assertThat(headers.get(Metadata.Key.of("user", Metadata.ASCII_STRING_MARSHALLER)))
                .isEqualTo("5001234");
    }

    @Test
    @DisplayName("Server errors surface as RpcCallException with the status code")
    void serverErrorWrapped() {
        assertThatThrownBy(() -> stub.call("AccountSummary", RpcRequest.empty(), List.of(), Duration.ofSeconds(2)))
                .isInstanceOfSatisfying(RpcCallException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(Status.Code.PERMISSION_DENIED);
                    assertThat(e.getMessage()).contains("AccountSummary");
                });
    }

    @Test
    @DisplayName("Deadline bounds a call the server never answers")
    void deadlineExceeded() {
        assertThatThrownBy(() ->
                        stub.call("OpenedOrdersTickets", RpcRequest.empty(), List.of(), Duration.ofMillis(100)))
                .isInstanceOfSatisfying(
                        RpcCallException.class,
                        e -> assertThat(e.getStatusCode()).isEqualTo(Status.Code.DEADLINE_EXCEEDED));
    }

    @Test
    @DisplayName("Undeclared methods fail as UNIMPLEMENTED without a round trip")
    void undeclaredMethodUnimplemented() {
        assertThatThrownBy(() -> stub.call("Login", RpcRequest.empty(), List.of(), Duration.ofSeconds(2)))
                .isInstanceOfSatisfying(
                        RpcCallException.class,
                        e -> assertThat(e.getStatusCode()).isEqualTo(Status.Code.UNIMPLEMENTED));
        assertThat(lastHeaders.get()).isNull();
    }

    @Test
    @DisplayName("Publishes its channel for transport lookup")
    void publishesChannel() {
        assertThat(stub.field("_channel")).containsSame(channel);
        assertThat(stub.field("_transport")).isEmpty();
    }
}
