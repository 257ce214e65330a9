package com.mtbridge.account;

import com.mtbridge.rpc.FieldTable;
import java.util.Optional;
import java.util.Set;

/**
 * The trading-terminal account object the connection engine drives.
 *
 * <p>Implementations publish what they support as two explicit tables: named slots
 * ({@link #field(String)}) and named operations ({@link #operation(String)}). Account
 * builds differ in which names they publish; the engine looks names up in order and
 * treats an absent name as "not applicable", never as an error.
 */
public interface TerminalAccount extends FieldTable {

    Optional<AccountOperation> operation(String name);

    Set<String> operationNames();

    default boolean hasOperation(String name) {
        return operation(name).isPresent();
    }
}
