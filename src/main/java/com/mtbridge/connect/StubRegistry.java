package com.mtbridge.connect;

import com.mtbridge.rpc.Capability;
import com.mtbridge.rpc.CapabilityCatalog;
import com.mtbridge.rpc.CapabilityDescriptor;
import com.mtbridge.rpc.ServiceStub;
import com.mtbridge.rpc.StubFactory;
import com.mtbridge.session.ConnectionContext;
import io.grpc.Channel;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Attaches service stubs to a context for every capability the deployment ships.
 *
 * <p>Stub types are matched against an alias table, since builds name the same client
 * differently ({@code AccountHelperServiceStub}, {@code AccountHelperStub}, ...). A stub
 * the account object already publishes under the capability's client field is adopted
 * instead of building a new one. Capabilities absent from the catalog are skipped.
 * Already attached capabilities are never rebuilt.
 */
@Component
public class StubRegistry {

    private static final Logger log = LoggerFactory.getLogger(StubRegistry.class);

    static final Map<Capability, List<String>> STUB_ALIASES = new EnumMap<>(Capability.class);

    static {
        STUB_ALIASES.put(Capability.ACCOUNT, List.of("AccountServiceStub"));
        STUB_ALIASES.put(
                Capability.ACCOUNT_HELPER,
                List.of("AccountHelperServiceStub", "AccountHelperStub", "AccountHelperClientStub"));
        STUB_ALIASES.put(Capability.MARKET_INFO, List.of("MarketInfoServiceStub", "MarketSymbolsServiceStub"));
        STUB_ALIASES.put(Capability.SYMBOLS, List.of("SymbolsServiceStub"));
        STUB_ALIASES.put(Capability.CHARTS, List.of("ChartsServiceStub"));
        STUB_ALIASES.put(Capability.BOOK, List.of("BookServiceStub", "MarketBookServiceStub"));
        STUB_ALIASES.put(Capability.TRADE_FUNCTIONS, List.of("TradeFunctionsServiceStub", "TradeServiceStub"));
        STUB_ALIASES.put(Capability.SESSION, List.of("SessionServiceStub", "SessionStub"));
        STUB_ALIASES.put(Capability.TERMINAL, List.of("TerminalServiceStub", "TerminalStub"));
        STUB_ALIASES.put(Capability.CONNECTION, List.of("ConnectionServiceStub", "ConnectionStub"));
        STUB_ALIASES.put(Capability.AUTH, List.of("AuthServiceStub", "AuthStub"));
    }

    private final CapabilityCatalog catalog;
    private final StubFactory stubFactory;

    public StubRegistry(CapabilityCatalog catalog, StubFactory stubFactory) {
        this.catalog = catalog;
        this.stubFactory = stubFactory;
    }

    /**
     * Attaches a stub for every registry capability that is not attached yet.
     *
     * @return number of stubs newly attached by this call
     */
    public int attachAll(ConnectionContext context, Channel channel) {
        int attached = 0;
        for (Capability capability : Capability.registrySet()) {
            if (context.hasStub(capability)) {
                continue;
            }
            Optional<ServiceStub> stub = adopt(context, capability).or(() -> construct(capability, channel));
            if (stub.isPresent()) {
                context.attachStub(capability, stub.get());
                attached++;
            } else {
                log.debug("Capability {} not available in deployment {}", capability.key(), catalog.getDeployment());
            }
        }
        log.info("Attached {} stub(s); effective capabilities {}", attached, context.effectiveCapabilities());
        return attached;
    }

    /** The context's stub for {@code capability}, attaching one on demand when the channel is known. */
    public Optional<ServiceStub> obtain(ConnectionContext context, Capability capability) {
        Optional<ServiceStub> existing = context.stub(capability);
        if (existing.isPresent()) {
            return existing;
        }
        Optional<Channel> channel = context.getChannel();
        if (channel.isEmpty()) {
            return Optional.empty();
        }
        return construct(capability, channel.get()).map(stub -> context.attachStub(capability, stub));
    }

    /** Builds a stub for the first catalog module of {@code capability} that defines a matching stub type. */
    public Optional<ServiceStub> construct(Capability capability, Channel channel) {
        for (CapabilityDescriptor descriptor : catalog.resolveAll(capability)) {
            Optional<ServiceStub> stub = constructFor(descriptor, channel);
            if (stub.isPresent()) {
                return stub;
            }
        }
        return Optional.empty();
    }

    /** Builds a stub for an arbitrary catalog module, including ones outside the registry set. */
    public Optional<ServiceStub> constructFor(CapabilityDescriptor descriptor, Channel channel) {
        List<String> aliases = descriptor.capability().map(STUB_ALIASES::get).orElse(List.of());
        Optional<String> stubType = descriptor.resolveStubType(aliases);
        if (stubType.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(stubFactory.create(descriptor, stubType.get(), channel));
        } catch (RuntimeException e) {
            log.debug("Cannot build {} from {}: {}", stubType.get(), descriptor.getModule(), e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<ServiceStub> adopt(ConnectionContext context, Capability capability) {
        return context.getAccount()
                .field(capability.clientField())
                .filter(ServiceStub.class::isInstance)
                .map(ServiceStub.class::cast);
    }
}
