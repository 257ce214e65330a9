package com.mtbridge.unit.connect;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.mtbridge.account.TableTerminalAccount;
import com.mtbridge.connect.StubRegistry;
import com.mtbridge.rpc.Capability;
import com.mtbridge.rpc.CapabilityCatalog;
import com.mtbridge.rpc.ServiceStub;
import com.mtbridge.session.ConnectionContext;
import com.mtbridge.unit.testutil.EngineFixture;
import com.mtbridge.unit.testutil.TestAccounts;
import com.mtbridge.unit.testutil.TestCatalogs;
import io.grpc.ManagedChannel;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for StubRegistry covering attachment per capability, stub-type
 * aliases, idempotency and adoption of account-published stubs.
 */
class StubRegistryTest {

    private final ManagedChannel channel = mock(ManagedChannel.class);
    private EngineFixture fixture;

    @AfterEach
    void tearDown() {
        if (fixture != null) {
            fixture.close();
        }
    }

    private ConnectionContext context(CapabilityCatalog catalog, TableTerminalAccount account) {
        fixture = new EngineFixture(catalog);
        ConnectionContext context = fixture.context(account);
        context.attachChannel(channel, "channel");
        return context;
    }

    @Test
    @DisplayName("Attaches only capabilities the deployment ships")
    void attachesPresentCapabilities() {
        ConnectionContext context = context(TestCatalogs.accountOnlyLite(), TestAccounts.bare());
        StubRegistry registry = fixture.registry();

        int attached = registry.attachAll(context, channel);

        assertThat(attached).isEqualTo(2);
        assertThat(context.effectiveCapabilities()).containsExactlyInAnyOrder(Capability.ACCOUNT, Capability.ACCOUNT_HELPER);
        assertThat(context.stub(Capability.ACCOUNT).orElseThrow().channel()).isSameAs(channel);
    }

    @Test
    @DisplayName("Attaching twice keeps the first stubs")
    void idempotent() {
        ConnectionContext context = context(TestCatalogs.full(), TestAccounts.bare());
        StubRegistry registry = fixture.registry();

        registry.attachAll(context, channel);
        Map<Capability, ServiceStub> first = Map.copyOf(context.getStubs());
        int second = registry.attachAll(context, channel);

        assertThat(second).isZero();
        first.forEach((capability, stub) -> assertThat(context.stub(capability)).containsSame(stub));
        assertThat(fixture.stubs().createdCount("account")).isEqualTo(1);
        assertThat(fixture.stubs().createdCount("market-info")).isEqualTo(1);
    }

    @Test
    @DisplayName("Matches alternative stub type names")
    void stubTypeAliases() {
        CapabilityCatalog catalog = TestCatalogs.catalog(
                "aliases",
                TestCatalogs.module("market-info", "mt5_term_api_market_info", "MarketSymbolsServiceStub", "SymbolsTotal")
                        .build(),
                TestCatalogs.module("account-helper", "mt5_term_api_account_helper", "AccountHelperVendorStub", "Ping")
                        .build());
        ConnectionContext context = context(catalog, TestAccounts.bare());

        fixture.registry().attachAll(context, channel);

        assertThat(context.stub(Capability.MARKET_INFO).orElseThrow().stubType()).isEqualTo("MarketSymbolsServiceStub");
        assertThat(context.hasStub(Capability.ACCOUNT_HELPER)).isFalse();
    }

    @Test
    @DisplayName("DOM book resolves from the market_book module when book is absent")
    void bookFromEitherModule() {
        CapabilityCatalog catalog = TestCatalogs.catalog(
                "book",
                TestCatalogs.module("book", "mt5_term_api_book", "SomethingElseStub").build(),
                TestCatalogs.module("book", "mt5_term_api_market_book", "MarketBookServiceStub", "MarketBookGet")
                        .build());
        ConnectionContext context = context(catalog, TestAccounts.bare());

        fixture.registry().attachAll(context, channel);

        assertThat(context.stub(Capability.BOOK).orElseThrow().descriptor().getModule())
                .isEqualTo("mt5_term_api_market_book");
    }

    @Test
    @DisplayName("Adopts a stub the account already publishes")
    void adoptsAccountClient() {
        ServiceStub published = mock(ServiceStub.class);
        TableTerminalAccount account = TestAccounts.bare().defineSlot("account_helper_client", published);
        ConnectionContext context = context(TestCatalogs.accountOnlyLite(), account);

        fixture.registry().attachAll(context, channel);

        assertThat(context.stub(Capability.ACCOUNT_HELPER)).containsSame(published);
        assertThat(fixture.stubs().createdCount("account-helper")).isZero();
    }

    @Test
    @DisplayName("obtain attaches on demand and needs a channel")
    void obtainOnDemand() {
        fixture = new EngineFixture(TestCatalogs.full());
        ConnectionContext withoutChannel = fixture.context(TestAccounts.bare());
        StubRegistry registry = fixture.registry();

        assertThat(registry.obtain(withoutChannel, Capability.SESSION)).isEmpty();

        withoutChannel.attachChannel(channel, "channel");
        ServiceStub session = registry.obtain(withoutChannel, Capability.SESSION).orElseThrow();
        assertThat(registry.obtain(withoutChannel, Capability.SESSION)).containsSame(session);
        assertThat(fixture.stubs().createdCount("session")).isEqualTo(1);
    }
}
