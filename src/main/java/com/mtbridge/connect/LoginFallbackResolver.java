package com.mtbridge.connect;

import com.mtbridge.config.GatewayConfig;
import com.mtbridge.rpc.Capability;
import com.mtbridge.rpc.CapabilityCatalog;
import com.mtbridge.rpc.CapabilityDescriptor;
import com.mtbridge.rpc.RequestType;
import com.mtbridge.rpc.RpcRequest;
import com.mtbridge.rpc.RpcResponse;
import com.mtbridge.rpc.ServiceStub;
import com.mtbridge.session.ConnectionContext;
import io.grpc.Channel;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Authenticates through whatever stub can log in when the deployment has no canonical
 * account stub.
 *
 * <p>Discovery checks the usual login holders first (account, account-helper, auth,
 * session, terminal), then scans every module in the capability table. The stub that
 * logs in successfully is bound as the session's account stub.
 */
@Component
public class LoginFallbackResolver {

    private static final Logger log = LoggerFactory.getLogger(LoginFallbackResolver.class);

    static final List<String> LOGIN_METHODS =
            List.of("Login", "AccountLogin", "UserLogin", "OpenSession", "SessionOpen", "TerminalLogin");
    static final List<String> LOGIN_REQUEST_TYPES = List.of(
            "LoginRequest",
            "AccountLoginRequest",
            "UserLoginRequest",
            "OpenSessionRequest",
            "SessionOpenRequest",
            "TerminalLoginRequest");
    static final List<Capability> LOGIN_HOLDERS = List.of(
            Capability.ACCOUNT, Capability.ACCOUNT_HELPER, Capability.AUTH, Capability.SESSION, Capability.TERMINAL);
    static final List<Capability> REQUEST_MODULES =
            List.of(Capability.ACCOUNT, Capability.AUTH, Capability.SESSION, Capability.TERMINAL);

    private final CapabilityCatalog catalog;
    private final StubRegistry stubRegistry;
    private final OperationInvoker invoker;
    private final GatewayConfig config;

    public LoginFallbackResolver(
            CapabilityCatalog catalog, StubRegistry stubRegistry, OperationInvoker invoker, GatewayConfig config) {
        this.catalog = catalog;
        this.stubRegistry = stubRegistry;
        this.invoker = invoker;
        this.config = config;
    }

    /**
     * Discovers a login-capable stub and logs in with it, unless the context already has
     * an account stub, in which case nothing is attempted.
     */
    public AttemptResult<RpcResponse> resolve(ConnectionContext context) {
        if (context.hasStub(Capability.ACCOUNT)) {
            return AttemptResult.notApplicable("login");
        }
        Optional<ServiceStub> stub = discoverLoginCapableStub(context);
        if (stub.isEmpty()) {
            log.info("No login-capable service in deployment {}", catalog.getDeployment());
            return AttemptResult.notApplicable("login");
        }

        AttemptResult<RpcResponse> result = attemptLogin(context, stub.get());
        if (result.isSucceeded()) {
            context.attachStub(Capability.ACCOUNT, stub.get());
            context.recordSuccess("login", result.getLabel());
            log.info("Logged in via {} ({})", result.getLabel(), stub.get());
        } else {
            log.warn("Login through {} did not succeed: {}", stub.get(), result);
        }
        return result;
    }

    public Optional<ServiceStub> discoverLoginCapableStub(ConnectionContext context) {
        for (Capability holder : LOGIN_HOLDERS) {
            Optional<ServiceStub> stub = stubRegistry.obtain(context, holder).filter(this::canLogIn);
            if (stub.isPresent()) {
                return stub;
            }
        }

        Optional<Channel> channel = context.getChannel();
        if (channel.isEmpty()) {
            return Optional.empty();
        }
        for (CapabilityDescriptor module : catalog.modules()) {
            if (!module.exposesAny(LOGIN_METHODS)) {
                continue;
            }
            Optional<ServiceStub> stub = stubRegistry.constructFor(module, channel.get()).filter(this::canLogIn);
            if (stub.isPresent()) {
                return stub;
            }
        }
        return Optional.empty();
    }

    /** Tries every login-shaped method the stub exposes, in order, until one succeeds. */
    public AttemptResult<RpcResponse> attemptLogin(ConnectionContext context, ServiceStub stub) {
        AttemptResult<RpcResponse> outcome = AttemptResult.notApplicable("login");
        for (String method : stub.exposedAmong(LOGIN_METHODS)) {
            RpcRequest request = loginRequest(stub);
            CredentialFields.fill(request, config, context.getIdentity());
            outcome = invoker.callStub(stub, method, request, context.getHeaders(), config.callTimeout());
            if (outcome.isSucceeded()) {
                return outcome;
            }
        }
        return outcome;
    }

    private boolean canLogIn(ServiceStub stub) {
        return stub.firstExposed(LOGIN_METHODS).isPresent();
    }

    private RpcRequest loginRequest(ServiceStub stub) {
        Optional<RequestType> own = stub.descriptor().firstRequestType(LOGIN_REQUEST_TYPES);
        if (own.isPresent()) {
            return own.get().newRequest();
        }
        for (Capability module : REQUEST_MODULES) {
            Optional<RequestType> shared =
                    catalog.resolve(module).flatMap(descriptor -> descriptor.firstRequestType(LOGIN_REQUEST_TYPES));
            if (shared.isPresent()) {
                return shared.get().newRequest();
            }
        }
        return RpcRequest.empty();
    }
}
