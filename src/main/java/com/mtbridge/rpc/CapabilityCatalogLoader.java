package com.mtbridge.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mtbridge.exception.ConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

/**
 * Reads the deployment capability table from JSON.
 *
 * <pre>
 * {
 *   "deployment": "full",
 *   "modules": [
 *     { "module": "mt5_term_api_account_helper", "capability": "account-helper",
 *       "service": "mt5_term_api.AccountHelper",
 *       "stubTypes": ["AccountHelperServiceStub"],
 *       "methods": ["Ping", "AccountSummary"],
 *       "requestTypes": { "PingRequest": [], "AccountSummaryRequest": [] } }
 *   ]
 * }
 * </pre>
 *
 * <p>A missing resource yields an empty catalog: every capability is then unresolvable
 * and the engine runs in LITE mode with no stubs. A malformed one is a configuration error.
 */
public final class CapabilityCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(CapabilityCatalogLoader.class);

    private CapabilityCatalogLoader() {}

    public static CapabilityCatalog load(Resource resource, ObjectMapper objectMapper) {
        if (resource == null || !resource.exists()) {
            log.warn("Capability table {} not found, no service modules will be resolvable", resource);
            return CapabilityCatalog.empty();
        }
        try (InputStream in = resource.getInputStream()) {
            CapabilityCatalog catalog = parse(objectMapper.readTree(in));
            log.info("Loaded {} from {}", catalog, resource.getDescription());
            return catalog;
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read capability table " + resource.getDescription(), e);
        }
    }

    static CapabilityCatalog parse(JsonNode root) {
        JsonNode modulesNode = root.path("modules");
        if (!modulesNode.isArray()) {
            throw new ConfigurationException("Capability table has no 'modules' array");
        }

        List<CapabilityDescriptor> modules = new ArrayList<>();
        for (JsonNode node : modulesNode) {
            modules.add(parseModule(node));
        }
        return new CapabilityCatalog(root.path("deployment").asText("unnamed"), modules);
    }

    private static CapabilityDescriptor parseModule(JsonNode node) {
        String module = node.path("module").asText(null);
        String service = node.path("service").asText(null);
        if (module == null || service == null) {
            throw new ConfigurationException("Capability module entry needs 'module' and 'service': " + node);
        }

        CapabilityDescriptor.CapabilityDescriptorBuilder builder = CapabilityDescriptor.builder()
                .module(module)
                .service(service)
                .key(node.path("capability").asText(module));

        node.path("stubTypes").forEach(stubType -> builder.stubType(stubType.asText()));
        node.path("methods").forEach(method -> builder.method(method.asText()));

        Iterator<Map.Entry<String, JsonNode>> requestTypes = node.path("requestTypes").fields();
        while (requestTypes.hasNext()) {
            Map.Entry<String, JsonNode> entry = requestTypes.next();
            List<String> fields = new ArrayList<>();
            entry.getValue().forEach(field -> fields.add(field.asText()));
            builder.requestType(entry.getKey(), new RequestType(entry.getKey(), fields));
        }
        return builder.build();
    }
}
