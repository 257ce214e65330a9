package com.mtbridge.unit.connect;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.mtbridge.account.TableTerminalAccount;
import com.mtbridge.connect.TeardownSequencer;
import com.mtbridge.rpc.RpcResponse;
import com.mtbridge.session.ConnectionContext;
import com.mtbridge.session.SessionMode;
import com.mtbridge.session.SessionState;
import com.mtbridge.unit.testutil.EngineFixture;
import com.mtbridge.unit.testutil.TestAccounts;
import com.mtbridge.unit.testutil.TestCatalogs;
import io.grpc.Context;
import io.grpc.ManagedChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for TeardownSequencer step order, per-step failure isolation and
 * cancellation.
 */
class TeardownSequencerTest {

    private EngineFixture fixture;
    private TeardownSequencer teardown;
    private ManagedChannel channel;
    private TestAccounts.OperationLog log;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture(TestCatalogs.full());
        teardown = fixture.teardown();
        channel = mock(ManagedChannel.class);
        log = new TestAccounts.OperationLog();
        fixture.stubs().respond("account", "Logout", request -> {
            log.add("Logout");
            return RpcResponse.empty();
        });
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private ConnectionContext readyContext(TableTerminalAccount account) {
        ConnectionContext context = fixture.context(account);
        context.transitionTo(SessionState.CONNECTING);
        context.attachChannel(channel, "channel");
        fixture.registry().attachAll(context, channel);
        context.assignMode(SessionMode.FULL);
        context.transitionTo(SessionState.READY);
        return context;
    }

    @Test
    @DisplayName("Stops streams, logs out, closes the account, then the channel")
    void order() {
        TableTerminalAccount account = TestAccounts.recording(
                TestAccounts.withChannel(channel), log, "dispose", "stop_streams", "logout");
        ConnectionContext context = readyContext(account);

        assertThat(teardown.teardown(context, null)).isTrue();

        assertThat(log.names()).containsExactly("stop_streams", "Logout", "logout", "dispose");
        verify(channel, times(1)).shutdown();
        assertThat(context.getState()).isEqualTo(SessionState.DISCONNECTED);
        assertThat(context.getStubs()).isEmpty();
        assertThat(context.getChannel()).isEmpty();
    }

    @Test
    @DisplayName("A failing step does not stop the ones after it")
    void failingStepContinues() {
        TableTerminalAccount account = TestAccounts.recording(TestAccounts.bare(), log, "close");
        account.defineOperation("logout", args -> {
            throw new IllegalStateException("already logged out");
        });
        account.defineField("mt5_channel", () -> {
            throw new IllegalStateException("field gone");
        });
        ConnectionContext context = readyContext(account);

        assertThat(teardown.teardown(context, null)).isTrue();

        assertThat(log.names()).containsExactly("Logout", "close");
        assertThat(context.getState()).isEqualTo(SessionState.DISCONNECTED);
    }

    @Test
    @DisplayName("Missing resources count as done")
    void nothingToClose() {
        ConnectionContext context = fixture.context(TestAccounts.bare());

        assertThat(teardown.teardown(context, null)).isTrue();
        assertThat(fixture.stubs().calls()).isEmpty();
        assertThat(context.getState()).isEqualTo(SessionState.DISCONNECTED);
    }

    @Test
    @DisplayName("Channels already shut down are left alone")
    void skipsShutDownChannel() {
        when(channel.isShutdown()).thenReturn(true);
        ConnectionContext context = readyContext(TestAccounts.withChannel(channel));

        teardown.teardown(context, null);

        verify(channel, never()).shutdown();
    }

    @Test
    @DisplayName("A cancelled caller skips the remaining steps but still releases the context")
    void cancellation() {
        Context.CancellableContext cancellation = Context.current().withCancellation();
        TableTerminalAccount account = TestAccounts.recording(TestAccounts.withChannel(channel), log, "logout");
        account.defineOperation("close_streams", args -> {
            log.add("close_streams");
            cancellation.cancel(null);
            return true;
        });
        ConnectionContext context = readyContext(account);

        boolean completed = teardown.teardown(context, cancellation);

        assertThat(completed).isFalse();
        assertThat(log.names()).containsExactly("close_streams");
        verify(channel, never()).shutdown();
        assertThat(context.getState()).isEqualTo(SessionState.DISCONNECTED);
        assertThat(context.getChannel()).isEmpty();
    }

    @Test
    @DisplayName("Already cancelled callers run no step at all")
    void alreadyCancelled() {
        Context.CancellableContext cancellation = Context.current().withCancellation();
        cancellation.cancel(null);
        TableTerminalAccount account = TestAccounts.recording(TestAccounts.bare(), log, "unsubscribe_all");
        ConnectionContext context = fixture.context(account);

        assertThat(teardown.teardown(context, cancellation)).isFalse();
        assertThat(log.names()).isEmpty();
        assertThat(context.getState()).isEqualTo(SessionState.DISCONNECTED);
    }
}
