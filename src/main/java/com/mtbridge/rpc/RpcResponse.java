package com.mtbridge.rpc;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/** Untyped response body; callers in this engine only care that the call completed. */
public final class RpcResponse {

    private final JsonNode body;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public RpcResponse(JsonNode body) {
        this.body = body != null ? body : JsonNodeFactory.instance.objectNode();
    }

    public static RpcResponse empty() {
        return new RpcResponse(null);
    }

    @JsonValue
    public JsonNode body() {
        return body;
    }

    public JsonNode path(String field) {
        return body.path(field);
    }

    @Override
    public String toString() {
        return body.toString();
    }
}
