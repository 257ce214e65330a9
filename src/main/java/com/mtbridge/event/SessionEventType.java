package com.mtbridge.event;

/** Classifies the session lifecycle change behind a {@link SessionEvent}. */
public enum SessionEventType {

    /** {@code connect()} started building a new context. */
    CONNECT_STARTED,

    /** Channel resolved and registry stubs attached. */
    STUBS_ATTACHED,

    /** Mode detected; handshake, login fallback and readiness probing begin. */
    AUTHENTICATING,

    /** Readiness granted. */
    SESSION_READY,

    /** {@code connect()} raised. */
    CONNECT_FAILED,

    /** Teardown finished. */
    DISCONNECTED,

    /** {@code ensureConnected()} found the session unusable and is rebuilding it. */
    RECONNECT_TRIGGERED
}
