package com.mtbridge.connect;

import com.mtbridge.rpc.Capability;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/**
 * One remote check the engine may issue: an account operation to try first, then stub
 * methods on one or more capabilities as a fallback. Request fields are filled from
 * {@code arguments}, plus credentials and the default chart symbol when flagged.
 */
@Getter
@Builder
public class Probe {

    private final String name;

    /** Account operation tried before any stub method; null for stub-only probes. */
    private final String accountOperation;

    @Singular
    private final Map<String, Object> arguments;

    @Singular
    private final List<Capability> capabilities;

    @Singular
    private final List<String> methods;

    @Singular
    private final List<String> requestTypes;

    /** Sends login, password, server and identity. */
    private final boolean credentialed;

    /** Sends the configured base chart symbol as {@code symbol}. */
    private final boolean symbolBound;

    /** Bounded by the handshake timeout rather than the call timeout. */
    private final boolean handshake;

    @Override
    public String toString() {
        return name;
    }
}
