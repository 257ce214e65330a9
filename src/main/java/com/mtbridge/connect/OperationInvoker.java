package com.mtbridge.connect;

import com.mtbridge.account.AccountOperation;
import com.mtbridge.account.TerminalAccount;
import com.mtbridge.rpc.Header;
import com.mtbridge.rpc.RpcRequest;
import com.mtbridge.rpc.RpcResponse;
import com.mtbridge.rpc.ServiceStub;
import io.grpc.Context;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Issues single account operations and stub calls, each bounded by its own timeout, and
 * reports the outcome as an {@link AttemptResult} instead of throwing.
 *
 * <p>Account operations run on a worker thread so a hung operation cannot stall the
 * engine past its timeout. The caller's gRPC {@link Context} is propagated to the
 * worker; cancelling that context interrupts the operation.
 */
@Component
public class OperationInvoker {

    private static final Logger log = LoggerFactory.getLogger(OperationInvoker.class);

    private final ExecutorService executor;

    public OperationInvoker() {
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "gateway-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Invokes the named account operation once.
     *
     * @return NOT_APPLICABLE when the account does not publish {@code name}
     */
    public AttemptResult<Object> invoke(
            TerminalAccount account, String name, Map<String, Object> arguments, Duration timeout) {
        Optional<AccountOperation> operation = account.operation(name);
        if (operation.isEmpty()) {
            return AttemptResult.notApplicable(name);
        }

        Context callerContext = Context.current();
        Future<Object> future = executor.submit(callerContext.wrap(() -> operation.get().invoke(arguments)));
        Context.CancellationListener onCancel = cancelled -> future.cancel(true);
        callerContext.addListener(onCancel, Runnable::run);
        try {
            return AttemptResult.succeeded(name, future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.debug("Operation {} failed: {}", name, cause.getMessage());
            return AttemptResult.failed(name, cause);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.debug("Operation {} timed out after {}ms", name, timeout.toMillis());
            return AttemptResult.failed(name, e);
        } catch (CancellationException e) {
            log.debug("Operation {} cancelled", name);
            return AttemptResult.failed(name, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return AttemptResult.failed(name, e);
        } finally {
            callerContext.removeListener(onCancel);
        }
    }

    /**
     * Calls {@code method} on {@code stub}; the stub applies the deadline itself.
     *
     * @return NOT_APPLICABLE when the stub does not expose {@code method}
     */
    public AttemptResult<RpcResponse> callStub(
            ServiceStub stub, String method, RpcRequest request, List<Header> headers, Duration timeout) {
        String label = stub.descriptor().getKey() + "." + method;
        if (!stub.exposes(method)) {
            return AttemptResult.notApplicable(label);
        }
        try {
            return AttemptResult.succeeded(label, stub.call(method, request, headers, timeout));
        } catch (RuntimeException e) {
            log.debug("Call {} failed: {}", label, e.getMessage());
            return AttemptResult.failed(label, e);
        }
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
