package com.mtbridge.rpc;

import java.util.Optional;

/** Resolves dotted slot paths such as {@code _transport._channel} across nested field tables. */
public final class FieldPaths {

    private FieldPaths() {}

    public static Optional<Object> resolve(FieldTable root, String path) {
        Object current = root;
        for (String part : path.split("\\.")) {
            if (!(current instanceof FieldTable table)) {
                return Optional.empty();
            }
            Optional<Object> next = table.field(part);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            current = next.get();
        }
        return Optional.ofNullable(current);
    }
}
