package com.mtbridge.unit.testutil;

import com.mtbridge.account.TableTerminalAccount;
import io.grpc.Channel;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Hand-assembled account objects. */
public final class TestAccounts {

    private TestAccounts() {}

    /** Identity and header slots only; no channel and no operations. */
    public static TableTerminalAccount bare() {
        return new TableTerminalAccount()
                .defineSlot("terminalInstanceGuid", null)
                .defineSlot("id", null)
                .defineSlot("_headers", null);
    }

    /** A bare account holding {@code channel} in its {@code channel} slot and publishing {@code reconnect}. */
    public static TableTerminalAccount withChannel(Channel channel) {
        TableTerminalAccount account = bare();
        account.defineSlot("channel", channel);
        account.defineOperation("reconnect", args -> true);
        return account;
    }

    /** Records the names of invoked operations. */
    public static final class OperationLog {

        private final List<String> names = new CopyOnWriteArrayList<>();

        public void add(String name) {
            names.add(name);
        }

        public List<String> names() {
            return List.copyOf(names);
        }
    }

    /** Defines each named operation so that invoking it appends its name to {@code log}. */
    public static TableTerminalAccount recording(TableTerminalAccount account, OperationLog log, String... operations) {
        for (String operation : operations) {
            account.defineOperation(operation, args -> {
                log.add(operation);
                return true;
            });
        }
        return account;
    }
}
