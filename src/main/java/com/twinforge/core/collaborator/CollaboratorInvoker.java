package com.twinforge.core.collaborator;

import com.twinforge.core.config.ExecutorConfig;
import com.twinforge.core.metrics.TwinforgeMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs every collaborator call with a mandatory timeout and stop-request support.
 * <p>
 * The call executes on a separate pool while the caller waits. A timeout cancels the
 * call and surfaces as {@link CollaboratorTimeoutException}; a stop request interrupts it
 * and surfaces as {@link RunCancelledException}; anything else thrown by the collaborator
 * becomes a {@link CollaboratorException}.
 */
@Component
public class CollaboratorInvoker {

    private static final Logger log = LoggerFactory.getLogger(CollaboratorInvoker.class);

    private final ExecutorService executor;
    private final TwinforgeMetrics metrics;

    @Autowired
    public CollaboratorInvoker(@Qualifier(ExecutorConfig.COLLABORATOR_EXECUTOR) ExecutorService executor,
                               @Autowired(required = false) TwinforgeMetrics metrics) {
        this.executor = executor;
        this.metrics = metrics;
    }

    CollaboratorInvoker(ExecutorService executor) {
        this(executor, null);
    }

    /**
     * @param collaborator short name for logs and metrics, e.g. "generation"
     * @param operation    description used in error messages, e.g. "generate backend"
     */
    public <T> T invoke(String collaborator, String operation, Supplier<T> call,
                        Duration timeout, CancellationToken token) {
        token.throwIfCancelled();
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<T> future = executor.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return call.get();
            } finally {
                MDC.clear();
            }
        });
        CancellationToken.Registration registration = token.onCancel(() -> future.cancel(true));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} timed out after {}s", operation, timeout.toSeconds());
            recordFailure(collaborator, "timeout");
            throw new CollaboratorTimeoutException(operation, timeout);
        } catch (CancellationException e) {
            recordFailure(collaborator, "cancelled");
            throw new RunCancelledException(token.runId());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            recordFailure(collaborator, "cancelled");
            throw new RunCancelledException(token.runId());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (token.isCancelled() || cause instanceof RunCancelledException) {
                recordFailure(collaborator, "cancelled");
                throw new RunCancelledException(token.runId());
            }
            recordFailure(collaborator, "error");
            if (cause instanceof CollaboratorException ce) {
                throw ce;
            }
            String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            throw new CollaboratorException(operation + " failed: " + detail, cause);
        } finally {
            registration.remove();
        }
    }

    private void recordFailure(String collaborator, String kind) {
        if (metrics != null) {
            metrics.recordCollaboratorFailure(collaborator, kind);
        }
    }
}
