package com.mtbridge.account;

import com.mtbridge.config.GatewayConfig;
import com.mtbridge.exception.NotConnectedException;
import com.mtbridge.rpc.Capability;
import com.mtbridge.rpc.CapabilityCatalog;
import com.mtbridge.rpc.CapabilityDescriptor;
import com.mtbridge.rpc.Header;
import com.mtbridge.rpc.RequestType;
import com.mtbridge.rpc.RpcRequest;
import com.mtbridge.rpc.ServiceStub;
import com.mtbridge.rpc.StubFactory;
import io.grpc.ManagedChannel;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Account object backed by a real gateway channel.
 *
 * <p>The channel is opened lazily by the first connect-style operation and closed by
 * {@code close}/{@code disconnect}. Remote-backed operations are only published when the
 * deployment's capability table exposes the method behind them, so an engine probing
 * this account sees exactly what the deployment can do:
 * <ul>
 *   <li>{@code connect_by_server_name} needs connection {@code ConnectEx}</li>
 *   <li>{@code connect_by_host_port} needs connection {@code Connect}</li>
 *   <li>{@code server_time}, {@code symbols_total}, {@code symbol_info_tick} need market-info</li>
 *   <li>{@code opened_orders_tickets}, {@code account_summary} need account-helper</li>
 * </ul>
 */
public class GrpcTerminalAccount extends TableTerminalAccount {

    private static final Logger log = LoggerFactory.getLogger(GrpcTerminalAccount.class);

    static final List<Capability> CLIENT_CAPABILITIES =
            List.of(Capability.ACCOUNT_HELPER, Capability.MARKET_INFO, Capability.CONNECTION);

    private final GatewayConfig config;
    private final CapabilityCatalog catalog;
    private final StubFactory stubFactory;
    private final ChannelOpener channelOpener;

    private final Map<Capability, ServiceStub> clients = new EnumMap<>(Capability.class);
    private ManagedChannel channel;

    public GrpcTerminalAccount(
            GatewayConfig config, CapabilityCatalog catalog, StubFactory stubFactory, ChannelOpener channelOpener) {
        this.config = config;
        this.catalog = catalog;
        this.stubFactory = stubFactory;
        this.channelOpener = channelOpener;

        defineSlot("terminalInstanceGuid", null);
        defineSlot("id", null);
        defineSlot("_headers", null);
        defineField("channel", () -> channel);
        for (Capability capability : CLIENT_CAPABILITIES) {
            defineField(capability.clientField(), () -> clients.get(capability));
        }

        defineOperation("get_channel", args -> channel);
        defineOperation("get_headers", args -> identityHeaders());
        defineOperation("connect", args -> open());
        defineOperation("reconnect", args -> open());
        defineOperation("ensure_clients", args -> ensureClients());
        defineOperation("close", args -> close());
        defineOperation("disconnect", args -> close());

        bindConnect("connect_by_server_name", "ConnectEx", "ConnectExRequest", "server_name");
        bindConnect("connect_by_host_port", "Connect", "ConnectRequest", "host", "port");

        bindRemote("server_time", Capability.MARKET_INFO, "ServerTime", "ServerTimeRequest");
        bindRemote("symbols_total", Capability.MARKET_INFO, "SymbolsTotal", "SymbolsTotalRequest", "selected_only");
        bindRemote("symbol_info_tick", Capability.MARKET_INFO, "SymbolInfoTick", "SymbolInfoTickRequest", "symbol");
        bindRemote(
                "opened_orders_tickets",
                Capability.ACCOUNT_HELPER,
                "OpenedOrdersTickets",
                "OpenedOrdersTicketsRequest");
        bindRemote("account_summary", Capability.ACCOUNT_HELPER, "AccountSummary", "AccountSummaryRequest");
    }

    public synchronized boolean isOpen() {
        return channel != null && !channel.isShutdown();
    }

    synchronized boolean open() {
        if (!isOpen()) {
            channel = channelOpener.open(config);
            clients.clear();
            log.info("Opened gateway channel to {}", config.getGrpcServer());
        }
        ensureClients();
        return true;
    }

    synchronized int ensureClients() {
        if (!isOpen()) {
            return 0;
        }
        int created = 0;
        for (Capability capability : CLIENT_CAPABILITIES) {
            if (clients.containsKey(capability)) {
                continue;
            }
            Optional<CapabilityDescriptor> descriptor = catalog.resolve(capability);
            Optional<String> stubType = descriptor.flatMap(d -> d.resolveStubType(List.of()));
            if (stubType.isPresent()) {
                clients.put(capability, stubFactory.create(descriptor.get(), stubType.get(), channel));
                created++;
            }
        }
        return created;
    }

    synchronized boolean close() {
        clients.clear();
        if (channel == null) {
            return false;
        }
        ManagedChannel closing = channel;
        channel = null;
        closing.shutdown();
        try {
            if (!closing.awaitTermination(1, TimeUnit.SECONDS)) {
                closing.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            closing.shutdownNow();
        }
        log.info("Closed gateway channel to {}", config.getGrpcServer());
        return true;
    }

    private void bindConnect(String operation, String method, String requestType, String... targetFields) {
        if (!exposedBy(Capability.CONNECTION, method)) {
            return;
        }
        defineOperation(operation, args -> {
            open();
            RpcRequest request = newRequest(Capability.CONNECTION, requestType);
            for (String field : targetFields) {
                request.set(field, args.get(field));
            }
            request.set("base_chart_symbol", args.get("base_chart_symbol"));
            request.set("wait_for_terminal_is_alive", args.get("wait_for_terminal_is_alive"));
            field("terminalInstanceGuid").ifPresent(guid -> request.setFirst(guid, "terminalInstanceGuid", "id"));

            return client(Capability.CONNECTION).call(method, request, currentHeaders(), timeout(args));
        });
    }

    private void bindRemote(
            String operation, Capability capability, String method, String requestType, String... argumentFields) {
        if (!exposedBy(capability, method)) {
            return;
        }
        defineOperation(operation, args -> {
            RpcRequest request = newRequest(capability, requestType);
            for (String field : argumentFields) {
                request.set(field, args.get(field));
            }
            return client(capability).call(method, request, currentHeaders(), timeout(args));
        });
    }

    private boolean exposedBy(Capability capability, String method) {
        return catalog.resolve(capability).map(d -> d.exposes(method)).orElse(false);
    }

    private RpcRequest newRequest(Capability capability, String requestType) {
        return catalog.resolve(capability)
                .flatMap(d -> d.requestType(requestType))
                .map(RequestType::newRequest)
                .orElseGet(RpcRequest::empty);
    }

    private synchronized ServiceStub client(Capability capability) {
        ensureClients();
        ServiceStub stub = clients.get(capability);
        if (stub == null) {
            throw new NotConnectedException("No " + capability.key() + " client; channel is not open");
        }
        return stub;
    }

    private Duration timeout(Map<String, Object> args) {
        Object seconds = args.get("timeout_seconds");
        if (seconds instanceof Number number) {
            return Duration.ofSeconds(number.longValue());
        }
        return config.callTimeout();
    }

    @SuppressWarnings("unchecked")
    private List<Header> currentHeaders() {
        Object headers = field("_headers").orElse(null);
        if (headers instanceof List<?> list) {
            return (List<Header>) list;
        }
        return identityHeaders();
    }

    private List<Header> identityHeaders() {
        return field("terminalInstanceGuid")
                .map(guid -> List.of(new Header("id", guid.toString())))
                .orElse(List.of());
    }
}
