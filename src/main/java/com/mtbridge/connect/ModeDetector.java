package com.mtbridge.connect;

import com.mtbridge.rpc.Capability;
import com.mtbridge.rpc.CapabilityCatalog;
import com.mtbridge.session.ConnectionContext;
import com.mtbridge.session.SessionMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** FULL when the deployment ships both the session and terminal services, LITE otherwise. */
@Component
public class ModeDetector {

    private static final Logger log = LoggerFactory.getLogger(ModeDetector.class);

    private final CapabilityCatalog catalog;

    public ModeDetector(CapabilityCatalog catalog) {
        this.catalog = catalog;
    }

    /** Detects the mode and assigns it to {@code context}; a context's mode can be assigned only once. */
    public SessionMode detectMode(ConnectionContext context) {
        boolean session = catalog.isResolvable(Capability.SESSION);
        boolean terminal = catalog.isResolvable(Capability.TERMINAL);
        SessionMode mode = session && terminal ? SessionMode.FULL : SessionMode.LITE;
        context.assignMode(mode);
        log.info("Session mode {} (session service: {}, terminal service: {})", mode, session, terminal);
        return mode;
    }
}
