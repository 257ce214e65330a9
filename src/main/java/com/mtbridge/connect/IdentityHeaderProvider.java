package com.mtbridge.connect;

import com.mtbridge.account.TerminalAccount;
import com.mtbridge.config.GatewayConfig;
import com.mtbridge.rpc.Header;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Derives the session identity and the metadata headers sent with every call.
 *
 * <p>Never throws: an account that cannot produce headers gets a synthesized set
 * built from identity, login and server name.
 */
@Component
public class IdentityHeaderProvider {

    private static final Logger log = LoggerFactory.getLogger(IdentityHeaderProvider.class);

    static final List<String> IDENTITY_FIELDS = List.of("terminal_instance_guid", "terminalInstanceGuid", "id", "Id");
    static final Set<String> IDENTITY_HEADER_KEYS = Set.of("terminalinstanceguid", "id", "client-id");
    static final String HEADERS_FIELD = "_headers";

    private final OperationInvoker invoker;
    private final GatewayConfig config;

    public IdentityHeaderProvider(OperationInvoker invoker, GatewayConfig config) {
        this.invoker = invoker;
        this.config = config;
    }

    /**
     * Reuses the first non-blank identity the account publishes, or generates one, and
     * writes it to every identity slot the account accepts.
     */
    public String ensureIdentity(TerminalAccount account) {
        String identity = IDENTITY_FIELDS.stream()
                .map(account::field)
                .flatMap(Optional::stream)
                .map(Object::toString)
                .filter(value -> !value.isBlank())
                .findFirst()
                .orElse(null);

        if (identity == null) {
            identity = UUID.randomUUID().toString();
            log.debug("Generated session identity {}", identity);
        }
        for (String field : IDENTITY_FIELDS) {
            account.writeField(field, identity);
        }
        return identity;
    }

    /**
     * Headers from the account's {@code get_headers} when it yields any, else synthesized.
     * The identity is always present under a recognized key. The result is also written
     * to the account's {@code _headers} slot when it has one.
     */
    public List<Header> buildHeaders(TerminalAccount account, String identity) {
        List<Header> headers = new ArrayList<>(accountHeaders(account));
        if (headers.isEmpty()) {
            headers.addAll(synthesize(identity));
        } else if (headers.stream().noneMatch(header -> carriesIdentity(header, identity))) {
            headers.add(0, new Header("terminalInstanceGuid", identity));
        }

        List<Header> result = List.copyOf(headers);
        account.writeField(HEADERS_FIELD, result);
        return result;
    }

    private List<Header> accountHeaders(TerminalAccount account) {
        return invoker.invoke(account, "get_headers", Map.of(), config.callTimeout())
                .getValue()
                .filter(List.class::isInstance)
                .map(value -> ((List<?>) value).stream()
                        .filter(Header.class::isInstance)
                        .map(Header.class::cast)
                        .toList())
                .orElse(List.of());
    }

    private List<Header> synthesize(String identity) {
        List<Header> headers = new ArrayList<>();
        headers.add(new Header("terminalInstanceGuid", identity));
        headers.add(new Header("id", identity));
        headers.add(new Header("client-id", identity));
        if (config.getLogin() != null) {
            headers.add(new Header("user", String.valueOf(config.getLogin())));
        }
        if (config.hasServerName()) {
            headers.add(new Header("server", config.getServerName()));
        }
        return headers;
    }

    private static boolean carriesIdentity(Header header, String identity) {
        return IDENTITY_HEADER_KEYS.contains(header.key().toLowerCase(Locale.ROOT))
                && header.value().equals(identity);
    }
}
