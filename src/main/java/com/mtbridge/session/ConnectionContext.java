package com.mtbridge.session;

import com.mtbridge.account.TerminalAccount;
import com.mtbridge.rpc.Capability;
import com.mtbridge.rpc.Header;
import com.mtbridge.rpc.ServiceStub;
import io.grpc.Channel;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Everything one session owns, from the start of {@code connect()} until teardown.
 *
 * <p>A context is created fresh for every connect; nothing is carried over from a
 * previous one. Identity and headers are fixed at construction. The channel is attached
 * at most once, stubs are only ever added, and the mode is assigned exactly once.
 * {@link #release()} drops everything and returns the context to DISCONNECTED.
 *
 * <p>Driven by one thread at a time; state and mode may be read from any thread.
 */
public class ConnectionContext {

    private final TerminalAccount account;
    private final String identity;
    private final List<Header> headers;
    private final Instant createdAt = Instant.now();

    private final Map<Capability, ServiceStub> stubs = new EnumMap<>(Capability.class);
    private final Map<String, String> firstSuccesses = new LinkedHashMap<>();
    private AttachedChannel channel;
    private volatile SessionMode mode;
    private volatile SessionState state = SessionState.DISCONNECTED;

    public ConnectionContext(TerminalAccount account, String identity, List<Header> headers) {
        this.account = account;
        this.identity = identity;
        this.headers = List.copyOf(headers);
    }

    public TerminalAccount getAccount() {
        return account;
    }

    public String getIdentity() {
        return identity;
    }

    public List<Header> getHeaders() {
        return headers;
    }

    public Duration age() {
        return Duration.between(createdAt, Instant.now());
    }

    // Channel

    /**
     * Attaches the session's channel.
     *
     * @return false when this channel was already attached
     * @throws IllegalStateException when a different channel is already attached
     */
    public boolean attachChannel(Channel candidate, String origin) {
        if (channel != null) {
            if (channel.channel() == candidate) {
                return false;
            }
            throw new IllegalStateException("Context already has a channel from " + channel.origin());
        }
        channel = new AttachedChannel(candidate, origin);
        return true;
    }

    public Optional<Channel> getChannel() {
        return Optional.ofNullable(channel).map(AttachedChannel::channel);
    }

    public Optional<AttachedChannel> getAttachedChannel() {
        return Optional.ofNullable(channel);
    }

    // Stubs

    /** Attaches {@code stub} unless the capability already has one; returns the stub in effect. */
    public ServiceStub attachStub(Capability capability, ServiceStub stub) {
        ServiceStub existing = stubs.putIfAbsent(capability, stub);
        return existing != null ? existing : stub;
    }

    public Optional<ServiceStub> stub(Capability capability) {
        return Optional.ofNullable(stubs.get(capability));
    }

    public boolean hasStub(Capability capability) {
        return stubs.containsKey(capability);
    }

    public Map<Capability, ServiceStub> getStubs() {
        return Collections.unmodifiableMap(stubs);
    }

    /** Capabilities with an attached stub. */
    public Set<Capability> effectiveCapabilities() {
        return Collections.unmodifiableSet(stubs.keySet());
    }

    // Mode

    public void assignMode(SessionMode detected) {
        if (mode != null) {
            throw new IllegalStateException("Mode already assigned: " + mode);
        }
        mode = detected;
    }

    public SessionMode getMode() {
        return mode;
    }

    public boolean isLite() {
        return mode == SessionMode.LITE;
    }

    // State

    public SessionState getState() {
        return state;
    }

    /** Whether {@link #transitionTo} would accept {@code next} right now. */
    public boolean canTransitionTo(SessionState next) {
        return state.canTransitionTo(next) && (channel != null || !next.requiresChannel(mode));
    }

    /**
     * Moves to {@code next}.
     *
     * @return the previous state
     * @throws IllegalStateException on a backward transition, or when {@code next} needs a channel and none is attached
     */
    public SessionState transitionTo(SessionState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal session transition " + state + " -> " + next);
        }
        if (next.requiresChannel(mode) && channel == null) {
            throw new IllegalStateException("Session state " + next + " requires an attached channel");
        }
        SessionState previous = state;
        state = next;
        return previous;
    }

    // Attempt report

    /** Records the first success seen for a strategy category; later ones are ignored. */
    public void recordSuccess(String category, String label) {
        firstSuccesses.putIfAbsent(category, label);
    }

    public Map<String, String> getFirstSuccesses() {
        return Collections.unmodifiableMap(firstSuccesses);
    }

    /**
     * Drops the channel reference and every stub and returns to DISCONNECTED. Closing
     * the channel itself is the teardown sequence's job.
     *
     * @return the state the context was in
     */
    public SessionState release() {
        SessionState previous = state;
        stubs.clear();
        channel = null;
        state = SessionState.DISCONNECTED;
        return previous;
    }

    @Override
    public String toString() {
        return "ConnectionContext[state=" + state + ", mode=" + mode + ", stubs=" + stubs.keySet() + "]";
    }
}
