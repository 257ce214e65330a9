package com.mtbridge.connect;

import com.mtbridge.session.ConnectionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Activates the session before readiness probing: the full handshake cascade in FULL
 * mode, a single best-effort ping in LITE mode. Neither throws.
 */
@Component
public class HandshakeCascade {

    private static final Logger log = LoggerFactory.getLogger(HandshakeCascade.class);

    private final ProbeRunner probeRunner;

    public HandshakeCascade(ProbeRunner probeRunner) {
        this.probeRunner = probeRunner;
    }

    /** Session-open, terminal-login, terminal-is-alive, ping; first success wins. */
    public AttemptResult<Object> run(ConnectionContext context) {
        AttemptResult<Object> result = probeRunner.firstSuccess(context, ProbeTable.HANDSHAKE);
        report(context, result);
        return result;
    }

    /** The LITE replacement for the handshake. */
    public AttemptResult<Object> ping(ConnectionContext context) {
        AttemptResult<Object> result = probeRunner.run(context, ProbeTable.PING);
        report(context, result);
        return result;
    }

    private void report(ConnectionContext context, AttemptResult<Object> result) {
        if (result.isSucceeded()) {
            context.recordSuccess("handshake", result.getLabel());
            log.info("Handshake succeeded via {}", result.getLabel());
        } else {
            log.warn("Handshake did not succeed ({}), continuing", result);
        }
    }
}
