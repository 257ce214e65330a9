package com.mtbridge.rpc;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Shape of one request message in a deployment: its type name and the field
 * names that concrete build actually declares.
 */
public final class RequestType {

    private final String name;
    private final Set<String> fields;

    public RequestType(String name, List<String> fields) {
        this.name = name;
        this.fields = Collections.unmodifiableSet(new LinkedHashSet<>(fields));
    }

    public String getName() {
        return name;
    }

    public Set<String> getFields() {
        return fields;
    }

    public boolean declares(String field) {
        return fields.contains(field);
    }

    public RpcRequest newRequest() {
        return new RpcRequest(this);
    }

    @Override
    public String toString() {
        return name + fields;
    }
}
