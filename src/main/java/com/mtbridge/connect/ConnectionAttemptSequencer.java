package com.mtbridge.connect;

import com.mtbridge.account.TerminalAccount;
import com.mtbridge.config.GatewayConfig;
import com.mtbridge.rpc.FieldTable;
import com.mtbridge.rpc.RequestType;
import com.mtbridge.rpc.RpcRequest;
import com.mtbridge.rpc.RpcResponse;
import com.mtbridge.rpc.ServiceStub;
import com.mtbridge.session.ConnectionContext;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Drives the primary connect strategies in a fixed order:
 * <ol>
 *   <li>generic: the first of {@link #GENERIC_CONNECT} the account publishes, tried once</li>
 *   <li>by server name, when one is configured</li>
 *   <li>by host and port, when a host is configured or derivable from the endpoint</li>
 *   <li>manual {@code ConnectEx}, then {@code Connect}, against the account's connection client</li>
 * </ol>
 * Every strategy runs regardless of how the previous ones went and none of them throws;
 * the first success per category is recorded on the context. A fixed warm-up pause follows.
 */
@Component
public class ConnectionAttemptSequencer {

    private static final Logger log = LoggerFactory.getLogger(ConnectionAttemptSequencer.class);

    static final List<String> GENERIC_CONNECT =
            List.of("reconnect", "connect", "connect_async", "start", "initialize", "open");
    static final List<String> NUDGE_CONNECT = List.of("reconnect", "connect", "start", "initialize", "open");
    static final List<String> CLIENT_FACTORIES = List.of("ensure_clients", "connect_clients", "connect_all_clients");
    static final List<String> CONNECTION_CLIENT_FIELDS = List.of("connection_client", "connect_client", "connection_stub");

    private final OperationInvoker invoker;
    private final GatewayConfig config;

    public ConnectionAttemptSequencer(OperationInvoker invoker, GatewayConfig config) {
        this.invoker = invoker;
        this.config = config;
    }

    /**
     * Runs all primary strategies then waits for server warm-up.
     *
     * @return true if at least one strategy succeeded
     */
    public boolean runPrimary(ConnectionContext context) {
        List<Function<ConnectionContext, AttemptResult<?>>> strategies =
                List.of(this::generic, this::byServerName, this::byHostPort, this::manual);

        boolean anySucceeded = false;
        for (Function<ConnectionContext, AttemptResult<?>> strategy : strategies) {
            AttemptResult<?> result = strategy.apply(context);
            if (result.isSucceeded()) {
                anySucceeded = true;
            } else if (result.isFailed()) {
                log.warn("Connect strategy {} failed, continuing: {}", result.getLabel(), failureMessage(result));
            }
        }
        if (!anySucceeded) {
            log.warn("No connect strategy succeeded; readiness probing decides");
        }

        pause(config.getWarmupDelayMs());
        return anySucceeded;
    }

    /** Re-invokes the generic connect once after the handshake. */
    public AttemptResult<Object> nudge(ConnectionContext context) {
        return firstPublished(context, NUDGE_CONNECT, "nudge");
    }

    /**
     * Invokes every client factory the account publishes.
     *
     * @return true if any factory ran successfully
     */
    public boolean runClientFactories(ConnectionContext context) {
        boolean ran = false;
        for (String factory : CLIENT_FACTORIES) {
            AttemptResult<Object> result =
                    invoker.invoke(context.getAccount(), factory, Map.of(), config.connectTimeout());
            ran |= result.isSucceeded();
        }
        return ran;
    }

    AttemptResult<Object> generic(ConnectionContext context) {
        return firstPublished(context, GENERIC_CONNECT, "generic");
    }

    AttemptResult<Object> byServerName(ConnectionContext context) {
        if (!config.hasServerName()) {
            return AttemptResult.notApplicable("connect_by_server_name");
        }
        Map<String, Object> arguments = connectArguments();
        arguments.put("server_name", config.getServerName());
        return record(
                context,
                "server-name",
                invoker.invoke(context.getAccount(), "connect_by_server_name", arguments, config.connectTimeout()));
    }

    AttemptResult<Object> byHostPort(ConnectionContext context) {
        String host = config.resolvedHost();
        if (host == null) {
            return AttemptResult.notApplicable("connect_by_host_port");
        }
        Map<String, Object> arguments = connectArguments();
        arguments.put("host", host);
        arguments.put("port", config.resolvedPort());
        return record(
                context,
                "host-port",
                invoker.invoke(context.getAccount(), "connect_by_host_port", arguments, config.connectTimeout()));
    }

    AttemptResult<RpcResponse> manual(ConnectionContext context) {
        Optional<ServiceStub> client = connectionClient(context.getAccount());
        if (client.isEmpty()) {
            return AttemptResult.notApplicable("manual");
        }
        ServiceStub stub = client.get();

        RpcRequest connectEx = newRequest(stub, "ConnectExRequest");
        connectEx.setFirst(context.getIdentity(), "terminalInstanceGuid", "id");
        connectEx.set("server_name", config.getServerName());
        connectEx.set("host", config.resolvedHost());
        connectEx.set("port", config.resolvedPort());
        AttemptResult<RpcResponse> extended =
                record(context, "manual", invoker.callStub(stub, "ConnectEx", connectEx, context.getHeaders(), config.callTimeout()));
        if (extended.isFailed()) {
            log.debug("ConnectEx failed: {}", failureMessage(extended));
        }

        // Connect is sent whatever ConnectEx returned.
        RpcRequest connect = newRequest(stub, "ConnectRequest");
        connect.set("host", config.resolvedHost());
        connect.set("port", config.resolvedPort());
        AttemptResult<RpcResponse> plain =
                record(context, "manual", invoker.callStub(stub, "Connect", connect, context.getHeaders(), config.callTimeout()));
        return extended.isSucceeded() || plain.isNotApplicable() ? extended : plain;
    }

    private AttemptResult<Object> firstPublished(ConnectionContext context, List<String> names, String category) {
        TerminalAccount account = context.getAccount();
        for (String name : names) {
            if (account.hasOperation(name)) {
                return record(context, category, invoker.invoke(account, name, connectArguments(), config.connectTimeout()));
            }
        }
        return AttemptResult.notApplicable(category);
    }

    private Map<String, Object> connectArguments() {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("base_chart_symbol", config.getBaseChartSymbol());
        arguments.put("wait_for_terminal_is_alive", false);
        arguments.put("timeout_seconds", config.getTimeoutSeconds());
        return arguments;
    }

    private static Optional<ServiceStub> connectionClient(FieldTable account) {
        return CONNECTION_CLIENT_FIELDS.stream()
                .map(account::field)
                .flatMap(Optional::stream)
                .filter(ServiceStub.class::isInstance)
                .map(ServiceStub.class::cast)
                .findFirst();
    }

    private static RpcRequest newRequest(ServiceStub stub, String requestType) {
        return stub.descriptor().requestType(requestType).map(RequestType::newRequest).orElseGet(RpcRequest::empty);
    }

    private static <T> AttemptResult<T> record(ConnectionContext context, String category, AttemptResult<T> result) {
        if (result.isSucceeded()) {
            context.recordSuccess(category, result.getLabel());
            log.info("Connect strategy {} succeeded via {}", category, result.getLabel());
        }
        return result;
    }

    private static String failureMessage(AttemptResult<?> result) {
        return result.getFailure().map(Throwable::getMessage).orElse("unknown");
    }

    private static void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
