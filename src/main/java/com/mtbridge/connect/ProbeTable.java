package com.mtbridge.connect;

import com.mtbridge.rpc.Capability;
import java.util.List;

/**
 * Every remote check the engine issues, declared once. The handshake cascade, the LITE
 * ping, the readiness loop and the health check all draw their candidates from here.
 */
public final class ProbeTable {

    public static final Probe SESSION_OPEN = Probe.builder()
            .name("session-open")
            .capability(Capability.SESSION)
            .method("OpenSession")
            .method("SessionOpen")
            .requestType("OpenSessionRequest")
            .requestType("SessionOpenRequest")
            .credentialed(true)
            .handshake(true)
            .build();

    public static final Probe TERMINAL_LOGIN = Probe.builder()
            .name("terminal-login")
            .capability(Capability.TERMINAL)
            .method("TerminalLogin")
            .requestType("TerminalLoginRequest")
            .credentialed(true)
            .handshake(true)
            .build();

    public static final Probe TERMINAL_IS_ALIVE = Probe.builder()
            .name("terminal-is-alive")
            .capability(Capability.TERMINAL)
            .method("IsAlive")
            .method("TerminalIsAlive")
            .requestType("IsAliveRequest")
            .requestType("TerminalIsAliveRequest")
            .build();

    public static final Probe PING = Probe.builder()
            .name("ping")
            .capability(Capability.ACCOUNT_HELPER)
            .method("Ping")
            .requestType("PingRequest")
            .build();

    public static final Probe SERVER_TIME =
            Probe.builder().name("server-time").accountOperation("server_time").build();

    public static final Probe SYMBOLS_TOTAL = Probe.builder()
            .name("symbols-total")
            .accountOperation("symbols_total")
            .argument("selected_only", false)
            .capability(Capability.SYMBOLS)
            .capability(Capability.MARKET_INFO)
            .method("SymbolsTotal")
            .requestType("SymbolsTotalRequest")
            .build();

    public static final Probe OPENED_ORDERS_TICKETS = Probe.builder()
            .name("opened-orders-tickets")
            .accountOperation("opened_orders_tickets")
            .capability(Capability.ACCOUNT_HELPER)
            .method("OpenedOrdersTickets")
            .requestType("OpenedOrdersTicketsRequest")
            .build();

    public static final Probe SYMBOL_INFO_TICK = Probe.builder()
            .name("symbol-info-tick")
            .accountOperation("symbol_info_tick")
            .capability(Capability.MARKET_INFO)
            .method("SymbolInfoTick")
            .requestType("SymbolInfoTickRequest")
            .symbolBound(true)
            .build();

    public static final Probe ACCOUNT_SUMMARY = Probe.builder()
            .name("account-summary")
            .accountOperation("account_summary")
            .capability(Capability.ACCOUNT_HELPER)
            .method("AccountSummary")
            .requestType("AccountSummaryRequest")
            .build();

    /** FULL-mode handshake, first success wins. */
    public static final List<Probe> HANDSHAKE = List.of(SESSION_OPEN, TERMINAL_LOGIN, TERMINAL_IS_ALIVE, PING);

    /** Readiness candidates in priority order. */
    public static final List<Probe> READINESS =
            List.of(SERVER_TIME, SYMBOLS_TOTAL, OPENED_ORDERS_TICKETS, SYMBOL_INFO_TICK);

    /** Cheap checks behind {@code ensureConnected()}. */
    public static final List<Probe> HEALTH = List.of(SERVER_TIME, SYMBOLS_TOTAL, ACCOUNT_SUMMARY);

    private ProbeTable() {}
}
