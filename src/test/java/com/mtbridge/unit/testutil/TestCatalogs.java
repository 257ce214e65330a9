package com.mtbridge.unit.testutil;

import com.mtbridge.rpc.CapabilityCatalog;
import com.mtbridge.rpc.CapabilityDescriptor;
import com.mtbridge.rpc.RequestType;
import java.util.Arrays;
import java.util.List;

/** Capability tables for tests. */
public final class TestCatalogs {

    private TestCatalogs() {}

    public static CapabilityDescriptor.CapabilityDescriptorBuilder module(
            String key, String module, String stubType, String... methods) {
        CapabilityDescriptor.CapabilityDescriptorBuilder builder = CapabilityDescriptor.builder()
                .key(key)
                .module(module)
                .service("mt5_term_api." + module)
                .stubType(stubType);
        Arrays.stream(methods).forEach(builder::method);
        return builder;
    }

    public static RequestType requestType(String name, String... fields) {
        return new RequestType(name, List.of(fields));
    }

    public static CapabilityCatalog catalog(String deployment, CapabilityDescriptor... modules) {
        return new CapabilityCatalog(deployment, List.of(modules));
    }

    public static CapabilityDescriptor accountModule() {
        return module("account", "mt5_term_api_account", "AccountServiceStub", "Login", "Logout")
                .requestType("LoginRequest", requestType("LoginRequest", "login", "password", "server"))
                .build();
    }

    public static CapabilityDescriptor accountHelperModule() {
        return module(
                        "account-helper",
                        "mt5_term_api_account_helper",
                        "AccountHelperServiceStub",
                        "Ping",
                        "AccountSummary",
                        "OpenedOrdersTickets")
                .build();
    }

    public static CapabilityDescriptor marketInfoModule() {
        return module(
                        "market-info",
                        "mt5_term_api_market_info",
                        "MarketInfoServiceStub",
                        "ServerTime",
                        "SymbolsTotal",
                        "SymbolInfoTick")
                .requestType("SymbolInfoTickRequest", requestType("SymbolInfoTickRequest", "symbol"))
                .requestType("SymbolsTotalRequest", requestType("SymbolsTotalRequest", "selected_only"))
                .build();
    }

    public static CapabilityDescriptor sessionModule() {
        return module("session", "mt5_term_api_session", "SessionServiceStub", "OpenSession")
                .requestType(
                        "OpenSessionRequest",
                        requestType("OpenSessionRequest", "login", "password", "server", "terminalInstanceGuid"))
                .build();
    }

    public static CapabilityDescriptor terminalModule() {
        return module("terminal", "mt5_term_api_terminal", "TerminalServiceStub", "TerminalLogin", "IsAlive")
                .requestType(
                        "TerminalLoginRequest",
                        requestType("TerminalLoginRequest", "login", "password", "server_name"))
                .build();
    }

    public static CapabilityDescriptor connectionModule() {
        return module("connection", "mt5_term_api_connection", "ConnectionServiceStub", "Connect", "ConnectEx")
                .requestType(
                        "ConnectExRequest",
                        requestType("ConnectExRequest", "terminalInstanceGuid", "server_name", "host", "port"))
                .requestType("ConnectRequest", requestType("ConnectRequest", "host", "port"))
                .build();
    }

    /** Session and terminal present: FULL mode. */
    public static CapabilityCatalog full() {
        return catalog(
                "full",
                sessionModule(),
                terminalModule(),
                accountModule(),
                accountHelperModule(),
                marketInfoModule());
    }

    /** Only account and account-helper: LITE mode. */
    public static CapabilityCatalog accountOnlyLite() {
        return catalog("lite", accountModule(), accountHelperModule());
    }
}
