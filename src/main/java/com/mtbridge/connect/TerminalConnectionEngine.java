package com.mtbridge.connect;

import com.mtbridge.account.TerminalAccount;
import com.mtbridge.account.TerminalAccountFactory;
import com.mtbridge.config.GatewayConfig;
import com.mtbridge.event.SessionEvent;
import com.mtbridge.event.SessionEventType;
import com.mtbridge.exception.ConnectException;
import com.mtbridge.rpc.Header;
import com.mtbridge.session.AttachedChannel;
import com.mtbridge.session.ConnectionContext;
import com.mtbridge.session.SessionMode;
import com.mtbridge.session.SessionState;
import io.grpc.Context;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * The gateway session as the rest of the application sees it: {@link #connect()},
 * {@link #disconnect()} and {@link #ensureConnected()}.
 *
 * <p>Connect pipeline:
 * <pre>
 * identity + headers -> primary connect strategies -> channel search -> stub registry
 *   -> mode detection -> handshake (FULL) | ping (LITE) -> nudge
 *   -> login fallback (only without an account stub) -> readiness loop
 * </pre>
 *
 * <p>Each connect builds a fresh {@link ConnectionContext} around a fresh account object;
 * an existing context is torn down first. Only {@code connect()} raises, and only
 * {@link ConnectException}; a failed connect leaves nothing behind. Public methods are
 * serialized on this instance, so at most one connect runs at a time.
 */
@Service
public class TerminalConnectionEngine {

    private static final Logger log = LoggerFactory.getLogger(TerminalConnectionEngine.class);

    private final GatewayConfig config;
    private final TerminalAccountFactory accountFactory;
    private final IdentityHeaderProvider identityHeaderProvider;
    private final ConnectionAttemptSequencer attemptSequencer;
    private final TransportResolver transportResolver;
    private final StubRegistry stubRegistry;
    private final ModeDetector modeDetector;
    private final HandshakeCascade handshakeCascade;
    private final LoginFallbackResolver loginFallbackResolver;
    private final ReadinessProber readinessProber;
    private final TeardownSequencer teardownSequencer;
    private final ApplicationEventPublisher applicationEventPublisher;

    private volatile ConnectionContext context;

    public TerminalConnectionEngine(
            GatewayConfig config,
            TerminalAccountFactory accountFactory,
            IdentityHeaderProvider identityHeaderProvider,
            ConnectionAttemptSequencer attemptSequencer,
            TransportResolver transportResolver,
            StubRegistry stubRegistry,
            ModeDetector modeDetector,
            HandshakeCascade handshakeCascade,
            LoginFallbackResolver loginFallbackResolver,
            ReadinessProber readinessProber,
            TeardownSequencer teardownSequencer,
            ApplicationEventPublisher applicationEventPublisher) {
        this.config = config;
        this.accountFactory = accountFactory;
        this.identityHeaderProvider = identityHeaderProvider;
        this.attemptSequencer = attemptSequencer;
        this.transportResolver = transportResolver;
        this.stubRegistry = stubRegistry;
        this.modeDetector = modeDetector;
        this.handshakeCascade = handshakeCascade;
        this.loginFallbackResolver = loginFallbackResolver;
        this.readinessProber = readinessProber;
        this.teardownSequencer = teardownSequencer;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    /**
     * Builds a new session and blocks until it is ready.
     *
     * @throws ConnectException when readiness is exhausted in FULL mode; the session is
     *     torn down before it is thrown
     */
    public synchronized void connect() {
        if (context != null) {
            log.info("Connect on an existing session; tearing it down first");
            teardown(null);
        }

        log.info(
                "Connecting to {} (login {}, server {})",
                config.getGrpcServer(),
                config.maskedLogin(),
                config.hasServerName() ? config.getServerName() : "-");

        TerminalAccount account = accountFactory.create();
        String identity = identityHeaderProvider.ensureIdentity(account);
        List<Header> headers = identityHeaderProvider.buildHeaders(account, identity);
        ConnectionContext created = new ConnectionContext(account, identity, headers);
        context = created;
        transition(created, SessionState.CONNECTING, SessionEventType.CONNECT_STARTED, "Connect started");

        try {
            establish(created);
        } catch (ConnectException e) {
            fail(created, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected error while connecting: {}", e.getMessage(), e);
            fail(created, e.getMessage());
            throw new ConnectException(Map.of("reason", String.valueOf(e.getMessage())), e);
        }
    }

    /** Tears the session down. Safe to call at any time, any number of times. */
    public void disconnect() {
        disconnect(null);
    }

    /**
     * Tears the session down inside {@code cancellation}: calls in flight are cancelled with
     * it, and once it is cancelled the remaining steps are skipped. The session is released
     * either way.
     */
    public synchronized void disconnect(Context.CancellableContext cancellation) {
        if (context == null) {
            log.debug("Disconnect with no session; nothing to do");
            return;
        }
        teardown(cancellation);
    }

    /**
     * Cheap health probe; on failure the session is rebuilt once. Connects when there is
     * no ready session.
     *
     * @throws ConnectException only when the rebuild itself fails
     */
    public synchronized void ensureConnected() {
        ConnectionContext current = context;
        if (current == null || current.getState() != SessionState.READY) {
            connect();
            return;
        }

        AttemptResult<Object> health = readinessProber.healthCheck(current);
        if (health.isSucceeded() || (current.isLite() && health.isNotApplicable())) {
            log.debug("Session healthy ({})", health.getLabel());
            return;
        }

        log.warn("Session health probe failed ({}); reconnecting", health);
        publish(
                SessionEventType.RECONNECT_TRIGGERED,
                current.getState(),
                current.getState(),
                current.getMode(),
                "Health probe failed: " + health,
                null);
        teardown(null);
        connect();
    }

    public boolean isConnected() {
        ConnectionContext current = context;
        return current != null && current.getState() == SessionState.READY;
    }

    public boolean hasSession() {
        return context != null;
    }

    public SessionState getState() {
        ConnectionContext current = context;
        return current != null ? current.getState() : SessionState.DISCONNECTED;
    }

    /** Mode of the current session; empty before detection or without a session. */
    public Optional<SessionMode> getMode() {
        ConnectionContext current = context;
        return current != null ? Optional.ofNullable(current.getMode()) : Optional.empty();
    }

    /** Current session context, for collaborators that issue calls on the attached stubs. */
    public Optional<ConnectionContext> currentContext() {
        return Optional.ofNullable(context);
    }

    private void establish(ConnectionContext ctx) {
        attemptSequencer.runPrimary(ctx);

        Optional<AttachedChannel> found = resolveChannel(ctx);
        if (found.isPresent()) {
            AttachedChannel channel = found.get();
            ctx.attachChannel(channel.channel(), channel.origin());
            stubRegistry.attachAll(ctx, channel.channel());
            transition(
                    ctx,
                    SessionState.STUBS_ATTACHED,
                    SessionEventType.STUBS_ATTACHED,
                    "Channel from " + channel.origin() + ", stubs " + ctx.effectiveCapabilities());
        } else {
            log.warn("No transport channel found on the account; continuing without stubs");
        }

        SessionMode mode = modeDetector.detectMode(ctx);
        transition(ctx, SessionState.AUTHENTICATING, SessionEventType.AUTHENTICATING, "Mode " + mode);
        if (mode == SessionMode.FULL) {
            handshakeCascade.run(ctx);
        } else {
            handshakeCascade.ping(ctx);
        }
        attemptSequencer.nudge(ctx);

        if (loginFallbackResolver.resolve(ctx).isSucceeded()) {
            attemptSequencer.runClientFactories(ctx);
            ctx.getChannel().ifPresent(channel -> stubRegistry.attachAll(ctx, channel));
        }

        readinessProber.waitReady(
                ctx,
                config.getReadiness().getMaxTries(),
                Duration.ofMillis(config.getReadiness().getDelayMs()));
        transition(
                ctx,
                SessionState.READY,
                SessionEventType.SESSION_READY,
                "Ready in " + mode + " mode via " + ctx.getFirstSuccesses());
    }

    private Optional<AttachedChannel> resolveChannel(ConnectionContext ctx) {
        Optional<AttachedChannel> channel = transportResolver.findChannel(ctx.getAccount(), ctx.getStubs());
        if (channel.isEmpty() && attemptSequencer.runClientFactories(ctx)) {
            channel = transportResolver.findChannel(ctx.getAccount(), ctx.getStubs());
        }
        return channel;
    }

    private void fail(ConnectionContext ctx, String reason) {
        if (ctx.canTransitionTo(SessionState.FAILED)) {
            transition(ctx, SessionState.FAILED, SessionEventType.CONNECT_FAILED, reason);
        } else {
            publish(SessionEventType.CONNECT_FAILED, ctx.getState(), ctx.getState(), ctx.getMode(), reason, ctx.age());
        }
        teardown(null);
    }

    private void teardown(Context.CancellableContext cancellation) {
        ConnectionContext ctx = context;
        if (ctx == null) {
            return;
        }
        SessionState previous = ctx.getState();
        SessionMode mode = ctx.getMode();
        try {
            teardownSequencer.teardown(ctx, cancellation);
        } finally {
            context = null;
        }
        publish(SessionEventType.DISCONNECTED, previous, SessionState.DISCONNECTED, mode, "Session torn down", null);
    }

    private void transition(ConnectionContext ctx, SessionState next, SessionEventType type, String message) {
        SessionState previous = ctx.transitionTo(next);
        log.info("Session {} -> {}: {}", previous, next, message);
        publish(type, previous, next, ctx.getMode(), message, ctx.age());
    }

    private void publish(
            SessionEventType type,
            SessionState previous,
            SessionState next,
            SessionMode mode,
            String message,
            Duration elapsed) {
        applicationEventPublisher.publishEvent(new SessionEvent(this, type, previous, next, mode, message, elapsed));
    }
}
