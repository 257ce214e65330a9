package com.mtbridge.connect;

import com.mtbridge.account.TerminalAccount;
import com.mtbridge.config.GatewayConfig;
import com.mtbridge.rpc.Capability;
import com.mtbridge.rpc.RequestType;
import com.mtbridge.rpc.RpcRequest;
import com.mtbridge.rpc.ServiceStub;
import com.mtbridge.session.AttachedChannel;
import com.mtbridge.session.ConnectionContext;
import io.grpc.Context;
import io.grpc.ManagedChannel;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Best-effort, ordered shutdown of a session: streams, logout, account close, channel
 * close. Every step is guarded on its own and a missing resource counts as done. The
 * context is released at the end no matter what happened before.
 *
 * <p>When a cancellation context is supplied, steps run inside it, so in-flight calls
 * are cancelled with it, and once it is cancelled the remaining steps are skipped.
 */
@Component
public class TeardownSequencer {

    private static final Logger log = LoggerFactory.getLogger(TeardownSequencer.class);

    static final List<String> STREAM_STOPPERS = List.of("unsubscribe_all", "stop_streams", "close_streams");
    static final List<String> ACCOUNT_CLOSERS =
            List.of("logout", "close", "disconnect", "stop", "shutdown", "dispose", "release");
    static final List<String> CHANNEL_FIELDS = List.of("channel", "_channel", "grpc_channel", "mt5_channel");
    static final Duration LOGOUT_TIMEOUT = Duration.ofSeconds(3);

    private final OperationInvoker invoker;
    private final GatewayConfig config;

    public TeardownSequencer(OperationInvoker invoker, GatewayConfig config) {
        this.invoker = invoker;
        this.config = config;
    }

    private record Step(String name, Runnable action) {}

    /**
     * Tears the session down.
     *
     * @param cancellation optional caller cancellation; may be null
     * @return true if every step ran, false if cancellation cut the sequence short
     */
    public boolean teardown(ConnectionContext context, Context cancellation) {
        List<Step> steps = List.of(
                new Step("streams", () -> invokeAll(context, STREAM_STOPPERS)),
                new Step("logout", () -> logout(context)),
                new Step("account-close", () -> invokeAll(context, ACCOUNT_CLOSERS)),
                new Step("channel-close", () -> closeChannels(context)));

        Context previous = cancellation != null ? cancellation.attach() : null;
        try {
            for (Step step : steps) {
                if (cancellation != null && cancellation.isCancelled()) {
                    log.warn("Teardown cancelled before step {}; skipping the rest", step.name());
                    return false;
                }
                try {
                    step.action().run();
                } catch (RuntimeException e) {
                    log.warn("Teardown step {} failed: {}", step.name(), e.getMessage());
                }
            }
            return true;
        } finally {
            if (cancellation != null) {
                cancellation.detach(previous);
            }
            context.release();
            log.info("Session torn down");
        }
    }

    private void invokeAll(ConnectionContext context, List<String> operations) {
        for (String operation : operations) {
            AttemptResult<Object> result =
                    invoker.invoke(context.getAccount(), operation, Map.of(), config.callTimeout());
            if (result.isFailed()) {
                log.debug("Teardown operation {} failed: {}", operation, result);
            }
        }
    }

    private void logout(ConnectionContext context) {
        Optional<ServiceStub> account = context.stub(Capability.ACCOUNT);
        if (account.isEmpty() || !account.get().exposes("Logout")) {
            return;
        }
        RpcRequest request = account.get()
                .descriptor()
                .requestType("LogoutRequest")
                .map(RequestType::newRequest)
                .orElseGet(RpcRequest::empty);
        AttemptResult<?> result =
                invoker.callStub(account.get(), "Logout", request, context.getHeaders(), LOGOUT_TIMEOUT);
        log.debug("Logout: {}", result);
    }

    private void closeChannels(ConnectionContext context) {
        Set<ManagedChannel> closed = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Object> candidates = new ArrayList<>();
        TerminalAccount account = context.getAccount();
        for (String field : CHANNEL_FIELDS) {
            account.field(field).ifPresent(candidates::add);
        }
        context.getAttachedChannel().map(AttachedChannel::channel).ifPresent(candidates::add);

        for (Object candidate : candidates) {
            if (candidate instanceof ManagedChannel channel && !channel.isShutdown() && closed.add(channel)) {
                channel.shutdown();
                log.debug("Closed channel {}", channel);
            }
        }
    }
}
