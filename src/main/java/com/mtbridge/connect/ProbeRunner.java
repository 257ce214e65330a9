package com.mtbridge.connect;

import com.mtbridge.config.GatewayConfig;
import com.mtbridge.rpc.Capability;
import com.mtbridge.rpc.RequestType;
import com.mtbridge.rpc.RpcRequest;
import com.mtbridge.rpc.RpcResponse;
import com.mtbridge.rpc.ServiceStub;
import com.mtbridge.session.ConnectionContext;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Executes {@link Probe}s against a context's account and stubs. */
@Component
public class ProbeRunner {

    private static final Logger log = LoggerFactory.getLogger(ProbeRunner.class);

    private final StubRegistry stubRegistry;
    private final OperationInvoker invoker;
    private final GatewayConfig config;

    public ProbeRunner(StubRegistry stubRegistry, OperationInvoker invoker, GatewayConfig config) {
        this.stubRegistry = stubRegistry;
        this.invoker = invoker;
        this.config = config;
    }

    /** Runs each probe in order and returns the first success, else the last failure, else NOT_APPLICABLE. */
    public AttemptResult<Object> firstSuccess(ConnectionContext context, List<Probe> probes) {
        AttemptResult<Object> outcome = AttemptResult.notApplicable("none");
        for (Probe probe : probes) {
            AttemptResult<Object> result = run(context, probe);
            if (result.isSucceeded()) {
                return result;
            }
            if (result.isFailed()) {
                outcome = result;
            }
        }
        return outcome;
    }

    /**
     * Runs one probe: the account operation if published, then every exposed stub method
     * on each of the probe's capabilities, stopping at the first success.
     */
    public AttemptResult<Object> run(ConnectionContext context, Probe probe) {
        Duration timeout = probe.isHandshake() ? config.handshakeTimeout() : config.callTimeout();
        AttemptResult<Object> outcome = AttemptResult.notApplicable(probe.getName());

        if (probe.getAccountOperation() != null) {
            AttemptResult<Object> result =
                    invoker.invoke(context.getAccount(), probe.getAccountOperation(), arguments(probe), timeout);
            if (result.isSucceeded()) {
                return result;
            }
            if (result.isFailed()) {
                outcome = result;
            }
        }

        for (Capability capability : probe.getCapabilities()) {
            Optional<ServiceStub> stub = stubRegistry.obtain(context, capability);
            if (stub.isEmpty()) {
                continue;
            }
            for (String method : stub.get().exposedAmong(probe.getMethods())) {
                RpcRequest request = buildRequest(stub.get(), probe, context.getIdentity());
                AttemptResult<RpcResponse> result =
                        invoker.callStub(stub.get(), method, request, context.getHeaders(), timeout);
                if (result.isSucceeded()) {
                    return AttemptResult.succeeded(result.getLabel(), result.getValue().orElse(null));
                }
                outcome = result.withoutValue();
            }
        }

        if (outcome.isFailed()) {
            log.debug("Probe {} failed: {}", probe.getName(), outcome);
        }
        return outcome;
    }

    private Map<String, Object> arguments(Probe probe) {
        Map<String, Object> arguments = new LinkedHashMap<>(probe.getArguments());
        if (probe.isSymbolBound()) {
            arguments.put("symbol", config.getBaseChartSymbol());
        }
        return arguments;
    }

    private RpcRequest buildRequest(ServiceStub stub, Probe probe, String identity) {
        RpcRequest request = stub.descriptor()
                .firstRequestType(probe.getRequestTypes())
                .map(RequestType::newRequest)
                .orElseGet(RpcRequest::empty);
        arguments(probe).forEach(request::set);
        if (probe.isCredentialed()) {
            CredentialFields.fill(request, config, identity);
        }
        return request;
    }
}
