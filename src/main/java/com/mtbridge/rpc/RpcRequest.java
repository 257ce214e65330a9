package com.mtbridge.rpc;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A request body that only accepts the fields its {@link RequestType} declares.
 *
 * <p>Writes to undeclared fields are dropped silently, which is what lets one
 * credential-filling routine serve request types that spell the same field as
 * {@code login}, {@code user} or {@code login_id}.
 */
public final class RpcRequest {

    private final RequestType type;
    private final Map<String, Object> values = new LinkedHashMap<>();

    RpcRequest(RequestType type) {
        this.type = type;
    }

    /** A request with no declared fields, sent when a build ships no matching request type. */
    public static RpcRequest empty() {
        return new RpcRequest(null);
    }

    public String typeName() {
        return type != null ? type.getName() : "<empty>";
    }

    /** Sets the field when declared and the value is non-null. */
    public boolean set(String field, Object value) {
        if (value == null || type == null || !type.declares(field)) {
            return false;
        }
        values.put(field, value);
        return true;
    }

    /** Sets every declared alias to {@code value}; returns how many were written. */
    public int setAll(Object value, String... aliases) {
        int written = 0;
        for (String alias : aliases) {
            if (set(alias, value)) {
                written++;
            }
        }
        return written;
    }

    /** Sets only the first declared alias. */
    public boolean setFirst(Object value, String... aliases) {
        for (String alias : aliases) {
            if (set(alias, value)) {
                return true;
            }
        }
        return false;
    }

    public Object get(String field) {
        return values.get(field);
    }

    @JsonValue
    public Map<String, Object> values() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return typeName() + values.keySet();
    }
}
