package com.mtbridge.account;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * {@link TerminalAccount} backed by mutable name tables.
 *
 * <p>Subclasses (and hand-assembled accounts) register slots and operations through
 * the fluent {@code define*} methods. A slot registered with {@link #defineSlot} holds
 * its own value and is writable; one registered with {@link #defineField} delegates to
 * the supplied getter and, optionally, setter.
 */
public class TableTerminalAccount implements TerminalAccount {

    private final Map<String, Supplier<Object>> getters = new LinkedHashMap<>();
    private final Map<String, Consumer<Object>> setters = new LinkedHashMap<>();
    private final Map<String, Object> slotValues = new LinkedHashMap<>();
    private final Map<String, AccountOperation> operations = new LinkedHashMap<>();

    public TableTerminalAccount defineField(String name, Supplier<Object> getter) {
        getters.put(name, getter);
        setters.remove(name);
        return this;
    }

    public TableTerminalAccount defineField(String name, Supplier<Object> getter, Consumer<Object> setter) {
        getters.put(name, getter);
        setters.put(name, setter);
        return this;
    }

    /** Registers a self-contained writable slot with an initial value (which may be null). */
    public TableTerminalAccount defineSlot(String name, Object initialValue) {
        slotValues.put(name, initialValue);
        return defineField(name, () -> slotValues.get(name), value -> slotValues.put(name, value));
    }

    public TableTerminalAccount defineOperation(String name, AccountOperation operation) {
        operations.put(name, operation);
        return this;
    }

    @Override
    public Optional<Object> field(String name) {
        Supplier<Object> getter = getters.get(name);
        return getter == null ? Optional.empty() : Optional.ofNullable(getter.get());
    }

    @Override
    public boolean writeField(String name, Object value) {
        Consumer<Object> setter = setters.get(name);
        if (setter == null) {
            return false;
        }
        setter.accept(value);
        return true;
    }

    @Override
    public Optional<AccountOperation> operation(String name) {
        return Optional.ofNullable(operations.get(name));
    }

    @Override
    public Set<String> operationNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(operations.keySet()));
    }
}
