package com.mtbridge.connect;

import com.mtbridge.account.TerminalAccount;
import com.mtbridge.config.GatewayConfig;
import com.mtbridge.rpc.Capability;
import com.mtbridge.rpc.FieldPaths;
import com.mtbridge.rpc.FieldTable;
import com.mtbridge.rpc.ServiceStub;
import com.mtbridge.session.AttachedChannel;
import io.grpc.Channel;
import io.grpc.ManagedChannel;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Finds the live transport channel an account object holds.
 *
 * <p>Locations are searched in a fixed order: direct slots, zero-argument accessor
 * operations, slots of a nested {@code clients} container, then transport slots inside
 * stubs (the account's client slots, else stubs already attached to the context).
 * A shut-down channel does not count. Looking is side-effect free and may be repeated.
 */
@Component
public class TransportResolver {

    static final List<String> DIRECT_FIELDS = List.of(
            "channel",
            "_channel",
            "grpc_channel",
            "mt5_channel",
            "aio_channel",
            "channel_aio",
            "grpc_aio_channel",
            "_grpc_aio_channel",
            "conn_channel",
            "connection_channel");

    static final List<String> ACCESSORS = List.of("get_channel", "channel", "grpc_channel", "get_grpc_channel");

    static final List<String> CLIENTS_FIELDS = List.of("channel", "grpc_channel", "_channel", "_grpc_aio_channel");

    static final List<Capability> STUB_HOLDERS = List.of(
            Capability.ACCOUNT,
            Capability.MARKET_INFO,
            Capability.SYMBOLS,
            Capability.CHARTS,
            Capability.BOOK,
            Capability.ACCOUNT_HELPER);

    static final List<String> STUB_TRANSPORT_PATHS = List.of("_channel", "channel", "_transport._channel", "_stub._channel");

    enum LocationKind {
        FIELD,
        ACCESSOR,
        STUB
    }

    record ChannelLocation(LocationKind kind, String path, Capability holder) {

        String label() {
            return switch (kind) {
                case FIELD -> path;
                case ACCESSOR -> path + "()";
                case STUB -> holder.clientField() + "." + path;
            };
        }
    }

    static final List<ChannelLocation> LOCATIONS = buildLocations();

    private final OperationInvoker invoker;
    private final GatewayConfig config;

    public TransportResolver(OperationInvoker invoker, GatewayConfig config) {
        this.invoker = invoker;
        this.config = config;
    }

    /** {@link #findChannel(TerminalAccount, Map)} without any attached stubs. */
    public Optional<AttachedChannel> findChannel(TerminalAccount account) {
        return findChannel(account, Map.of());
    }

    public Optional<AttachedChannel> findChannel(TerminalAccount account, Map<Capability, ServiceStub> attachedStubs) {
        for (ChannelLocation location : LOCATIONS) {
            Optional<Channel> channel = lookup(account, attachedStubs, location);
            if (channel.isPresent()) {
                return Optional.of(new AttachedChannel(channel.get(), location.label()));
            }
        }
        return Optional.empty();
    }

    private Optional<Channel> lookup(
            TerminalAccount account, Map<Capability, ServiceStub> attachedStubs, ChannelLocation location) {
        Optional<Object> value = switch (location.kind()) {
            case FIELD -> FieldPaths.resolve(account, location.path());
            case ACCESSOR -> invoker.invoke(account, location.path(), Map.of(), config.callTimeout()).getValue();
            case STUB -> stubHolder(account, attachedStubs, location.holder())
                    .flatMap(holder -> FieldPaths.resolve(holder, location.path()));
        };
        return value.filter(TransportResolver::isLive).map(Channel.class::cast);
    }

    private static Optional<FieldTable> stubHolder(
            TerminalAccount account, Map<Capability, ServiceStub> attachedStubs, Capability holder) {
        Optional<FieldTable> published = account.field(holder.clientField())
                .filter(FieldTable.class::isInstance)
                .map(FieldTable.class::cast);
        if (published.isPresent()) {
            return published;
        }
        return Optional.ofNullable(attachedStubs.get(holder));
    }

    private static boolean isLive(Object candidate) {
        if (candidate instanceof ManagedChannel managed) {
            return !managed.isShutdown();
        }
        return candidate instanceof Channel;
    }

    private static List<ChannelLocation> buildLocations() {
        List<ChannelLocation> locations = new ArrayList<>();
        DIRECT_FIELDS.forEach(field -> locations.add(new ChannelLocation(LocationKind.FIELD, field, null)));
        ACCESSORS.forEach(accessor -> locations.add(new ChannelLocation(LocationKind.ACCESSOR, accessor, null)));
        CLIENTS_FIELDS.forEach(
                field -> locations.add(new ChannelLocation(LocationKind.FIELD, "clients." + field, null)));
        for (Capability holder : STUB_HOLDERS) {
            STUB_TRANSPORT_PATHS.forEach(path -> locations.add(new ChannelLocation(LocationKind.STUB, path, holder)));
        }
        return List.copyOf(locations);
    }
}
