package com.mtbridge.rpc;

import java.util.List;
import java.util.Optional;

/**
 * Named groups of remote methods a gateway deployment may or may not ship.
 *
 * <p>{@code key} is the name used in the deployment capability table;
 * {@code clientField} is the slot name under which an account object publishes a
 * pre-built stub for the capability, if it has one.
 */
public enum Capability {
    ACCOUNT("account", "account_client"),
    ACCOUNT_HELPER("account-helper", "account_helper_client"),
    MARKET_INFO("market-info", "market_info_client"),
    SYMBOLS("symbols", "symbols_client"),
    CHARTS("charts", "charts_client"),
    BOOK("book", "book_client"),
    TRADE_FUNCTIONS("trade-functions", "trade_functions_client"),
    SESSION("session", "session_client"),
    TERMINAL("terminal", "terminal_client"),
    CONNECTION("connection", "connection_client"),
    AUTH("auth", "auth_client");

    private final String key;
    private final String clientField;

    Capability(String key, String clientField) {
        this.key = key;
        this.clientField = clientField;
    }

    public String key() {
        return key;
    }

    public String clientField() {
        return clientField;
    }

    /** Capabilities the stub registry attaches eagerly once a channel is known. */
    public static List<Capability> registrySet() {
        return List.of(ACCOUNT, ACCOUNT_HELPER, MARKET_INFO, SYMBOLS, CHARTS, BOOK, TRADE_FUNCTIONS);
    }

    public static Optional<Capability> fromKey(String key) {
        for (Capability capability : values()) {
            if (capability.key.equals(key)) {
                return Optional.of(capability);
            }
        }
        return Optional.empty();
    }
}
