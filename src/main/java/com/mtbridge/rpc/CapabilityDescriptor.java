package com.mtbridge.rpc;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

/**
 * One row of the deployment capability table: a service module the gateway
 * build ships, the stub types it defines, the remote methods it exposes and the
 * request shapes those methods accept.
 *
 * <p>{@code key} names the capability ({@code "account-helper"}, {@code "session"}, ...).
 * Modules with a key outside {@link Capability} are still listed so the login
 * fallback can scan them.
 */
@Getter
@Builder
public class CapabilityDescriptor {

    private final String key;
    private final String module;
    private final String service;

    @Singular
    private final List<String> stubTypes;

    @Singular
    private final Set<String> methods;

    @Singular
    private final Map<String, RequestType> requestTypes;

    public Optional<Capability> capability() {
        return Capability.fromKey(key);
    }

    public boolean exposes(String method) {
        return methods.contains(method);
    }

    public boolean exposesAny(Collection<String> candidates) {
        return candidates.stream().anyMatch(methods::contains);
    }

    /**
     * First of {@code aliases} this module defines as a stub type. With no aliases the
     * module's first declared stub type is used.
     */
    public Optional<String> resolveStubType(List<String> aliases) {
        if (aliases.isEmpty()) {
            return stubTypes.stream().findFirst();
        }
        return aliases.stream().filter(stubTypes::contains).findFirst();
    }

    public Optional<RequestType> requestType(String name) {
        return Optional.ofNullable(requestTypes.get(name));
    }

    public Optional<RequestType> firstRequestType(List<String> names) {
        for (String name : names) {
            RequestType type = requestTypes.get(name);
            if (type != null) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return module + "(" + key + ")";
    }
}
