package com.mtbridge.connect;

import com.mtbridge.exception.ConnectException;
import com.mtbridge.rpc.Capability;
import com.mtbridge.session.ConnectionContext;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides whether a session is usable with a bounded loop of cheap read-only probes.
 *
 * <p>FULL mode is strict: an iteration only counts when a probe succeeds and the account
 * stub is attached, and exhaustion raises {@link ConnectException}. LITE mode is lenient:
 * from iteration {@code max(1, maxTries / 2)} on, the presence of any expected stub is
 * enough, and exhaustion still returns ready.
 */
@Component
public class ReadinessProber {

    private static final Logger log = LoggerFactory.getLogger(ReadinessProber.class);

    static final List<Capability> LITE_EXPECTED =
            List.of(Capability.ACCOUNT_HELPER, Capability.MARKET_INFO, Capability.SYMBOLS, Capability.ACCOUNT);

    private final ProbeRunner probeRunner;

    public ReadinessProber(ProbeRunner probeRunner) {
        this.probeRunner = probeRunner;
    }

    /** One pass over the readiness probes. */
    public AttemptResult<Object> probeOnce(ConnectionContext context) {
        return probeRunner.firstSuccess(context, ProbeTable.READINESS);
    }

    /** One pass over the health probes used by {@code ensureConnected()}. */
    public AttemptResult<Object> healthCheck(ConnectionContext context) {
        return probeRunner.firstSuccess(context, ProbeTable.HEALTH);
    }

    /**
     * @return true once ready
     * @throws ConnectException in FULL mode when no iteration succeeded
     */
    public boolean waitReady(ConnectionContext context, int maxTries, Duration delay) {
        int softThreshold = Math.max(1, maxTries / 2);
        AttemptResult<Object> last = AttemptResult.notApplicable("none");

        for (int i = 0; i < maxTries; i++) {
            last = probeOnce(context);
            if (last.isSucceeded() && (context.isLite() || context.hasStub(Capability.ACCOUNT))) {
                context.recordSuccess("readiness", last.getLabel());
                log.info("Session ready after {} probe round(s) via {}", i + 1, last.getLabel());
                return true;
            }
            if (context.isLite() && i >= softThreshold && hasExpectedStub(context)) {
                context.recordSuccess("readiness", "stub-presence");
                log.info("LITE session accepted on stub presence after {} round(s)", i + 1);
                return true;
            }
            if (i < maxTries - 1 && !sleep(delay)) {
                break;
            }
        }

        if (context.isLite()) {
            log.warn("Readiness probes exhausted in LITE mode (last: {}); continuing with reduced confidence", last);
            return true;
        }
        log.error("Readiness probes exhausted after {} tries in FULL mode (last: {})", maxTries, last);
        throw new ConnectException(
                Map.of("mode", "FULL", "tries", maxTries, "lastProbe", last.toString()),
                last.getFailure().orElse(null));
    }

    private static boolean hasExpectedStub(ConnectionContext context) {
        return LITE_EXPECTED.stream().anyMatch(context::hasStub);
    }

    private static boolean sleep(Duration delay) {
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
