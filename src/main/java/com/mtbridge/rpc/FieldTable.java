package com.mtbridge.rpc;

import java.util.Optional;

/**
 * An object whose readable (and optionally writable) slots are published as an
 * explicit name table instead of being discovered by reflection.
 */
public interface FieldTable {

    /** Value of the named slot, or empty when the slot is absent or holds null. */
    Optional<Object> field(String name);

    /**
     * Writes the named slot.
     *
     * @return false when the slot does not exist or is read-only
     */
    default boolean writeField(String name, Object value) {
        return false;
    }
}
