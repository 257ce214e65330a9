package com.mtbridge.rpc;

import java.util.List;
import java.util.Optional;

/**
 * The set of service modules present in this deployment, in declaration order.
 *
 * <p>A capability is resolvable iff at least one module carries its key. Several
 * modules may share a key (the DOM book ships as either {@code mt5_term_api_book}
 * or {@code mt5_term_api_market_book}); {@link #resolveAll} returns them in order.
 */
public class CapabilityCatalog {

    private final String deployment;
    private final List<CapabilityDescriptor> modules;

    public CapabilityCatalog(String deployment, List<CapabilityDescriptor> modules) {
        this.deployment = deployment;
        this.modules = List.copyOf(modules);
    }

    public static CapabilityCatalog empty() {
        return new CapabilityCatalog("empty", List.of());
    }

    public String getDeployment() {
        return deployment;
    }

    public List<CapabilityDescriptor> modules() {
        return modules;
    }

    public Optional<CapabilityDescriptor> resolve(Capability capability) {
        return modules.stream()
                .filter(module -> capability.key().equals(module.getKey()))
                .findFirst();
    }

    public List<CapabilityDescriptor> resolveAll(Capability capability) {
        return modules.stream()
                .filter(module -> capability.key().equals(module.getKey()))
                .toList();
    }

    public boolean isResolvable(Capability capability) {
        return resolve(capability).isPresent();
    }

    public Optional<CapabilityDescriptor> module(String moduleName) {
        return modules.stream()
                .filter(module -> module.getModule().equals(moduleName))
                .findFirst();
    }

    @Override
    public String toString() {
        return "CapabilityCatalog[" + deployment + ", " + modules.size() + " modules]";
    }
}
