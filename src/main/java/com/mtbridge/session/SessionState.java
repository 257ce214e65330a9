package com.mtbridge.session;

/**
 * State machine for one gateway session.
 *
 * <p>Valid transitions:
 * <pre>
 * DISCONNECTED -> CONNECTING -> STUBS_ATTACHED -> AUTHENTICATING -> READY
 *                                                                 \-> FAILED
 *      ^                                                               |
 *      +---------------------- (teardown) -----------------------------+
 * </pre>
 *
 * <p>Transitions only move forward, except that teardown may return any state to
 * DISCONNECTED. Every state from STUBS_ATTACHED on requires an attached channel, with
 * one exception: a LITE session that found no channel skips STUBS_ATTACHED and may still
 * authenticate and become ready through account-level operations.
 */
public enum SessionState {

    /** No session; nothing attached. */
    DISCONNECTED,

    /** Connect strategies and channel search in progress. */
    CONNECTING,

    /** Channel found and the registry's stubs attached. */
    STUBS_ATTACHED,

    /** Handshake, login fallback and readiness probing in progress. */
    AUTHENTICATING,

    /** Session usable. */
    READY,

    /** Readiness exhausted in FULL mode. */
    FAILED;

    public boolean canTransitionTo(SessionState next) {
        return next == DISCONNECTED || next.ordinal() > ordinal();
    }

    public boolean requiresChannel(SessionMode mode) {
        if (this == DISCONNECTED || this == CONNECTING) {
            return false;
        }
        return this == STUBS_ATTACHED || mode != SessionMode.LITE;
    }
}
