package com.mtbridge.account;

/** Creates the account object a new connection context drives. */
@FunctionalInterface
public interface TerminalAccountFactory {

    TerminalAccount create();
}
