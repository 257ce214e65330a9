package com.mtbridge.session;

import com.mtbridge.connect.TerminalConnectionEngine;
import com.mtbridge.exception.NotConnectedException;
import org.springframework.stereotype.Component;

/**
 * Guards gateway-backed operations by checking the session before they run.
 *
 * <p>Trading and market-data collaborators call {@link #requireReady()} before issuing
 * calls; {@link #getDegradationLevel()} lets them adapt instead, e.g. treating a LITE
 * session as usable with reduced confidence.
 */
@Component
public class SessionGuard {

    private final TerminalConnectionEngine engine;

    public SessionGuard(TerminalConnectionEngine engine) {
        this.engine = engine;
    }

    /**
     * @throws NotConnectedException if the session is not READY
     */
    public void requireReady() {
        if (!engine.isConnected()) {
            throw new NotConnectedException(
                    "Gateway session is not ready. Current state: " + engine.getState() + ". Call connect first.");
        }
    }

    public DegradationLevel getDegradationLevel() {
        return switch (engine.getState()) {
            case READY -> engine.getMode().orElse(SessionMode.FULL) == SessionMode.LITE
                    ? DegradationLevel.REDUCED
                    : DegradationLevel.NONE;
            case CONNECTING, STUBS_ATTACHED, AUTHENTICATING -> DegradationLevel.PARTIAL;
            case FAILED, DISCONNECTED -> DegradationLevel.DEGRADED;
        };
    }

    public boolean isReady() {
        return engine.isConnected();
    }
}
