package com.mtbridge.session;

/**
 * How usable the gateway session currently is, for collaborators that adapt their
 * behavior instead of failing outright.
 */
public enum DegradationLevel {

    /** READY in FULL mode. */
    NONE,

    /** READY in LITE mode: calls work, but readiness may have been granted on stub presence alone. */
    REDUCED,

    /** A connect is in progress. */
    PARTIAL,

    /** No usable session. */
    DEGRADED
}
