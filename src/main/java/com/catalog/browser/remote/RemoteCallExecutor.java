package com.catalog.browser.remote;

import com.catalog.browser.core.CatalogException;
import com.catalog.browser.metrics.MetricsService;
import com.catalog.browser.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs remote calls on a dedicated worker pool and bounds each caller's wait.
 * A call that exceeds the timeout is cancelled (its worker is interrupted) and
 * reported as {@link RemoteCallFailureException}.
 */
public class RemoteCallExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RemoteCallExecutor.class);

    private final ExecutorService executor;
    private final Duration timeout;
    private final MetricsService metricsService;

    public RemoteCallExecutor(RemoteCallConfig config) {
        this(config, new NoOpMetricsService());
    }

    public RemoteCallExecutor(RemoteCallConfig config, MetricsService metricsService) {
        this.executor = Executors.newFixedThreadPool(config.workerThreads(), new WorkerThreadFactory());
        this.timeout = config.timeout();
        this.metricsService = metricsService;
    }

    /**
     * Executes a remote call, waiting at most the configured timeout.
     *
     * @param operation operation name for logs and metrics
     * @param call      the blocking remote call
     * @return the call's result
     * @throws RemoteCallFailureException on failure, timeout, interruption or after {@link #close()}
     */
    public <T> T execute(String operation, RemoteCall<T> call) {
        long start = System.nanoTime();
        Map<String, String> context = MDC.getCopyOfContextMap();
        Callable<T> task = () -> {
            // workers log under the caller's context
            if (context != null) {
                MDC.setContextMap(context);
            }
            try {
                return call.call();
            } finally {
                MDC.clear();
            }
        };
        Future<T> future;
        try {
            future = executor.submit(task);
        } catch (RejectedExecutionException e) {
            throw new RemoteCallFailureException(operation, "executor is shut down", e);
        }
        try {
            T result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            record(operation, start, true);
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            record(operation, start, false);
            throw new RemoteCallFailureException(operation, "timed out after " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            record(operation, start, false);
            Throwable cause = e.getCause();
            if (cause instanceof CatalogException catalogException) {
                throw catalogException;
            }
            throw new RemoteCallFailureException(operation, String.valueOf(cause.getMessage()), cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            record(operation, start, false);
            throw new RemoteCallFailureException(operation, "interrupted", e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
        log.debug("Remote call executor shut down");
    }

    private void record(String operation, long startNanos, boolean success) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        metricsService.recordRemoteCall(operation, elapsed, success);
        log.debug("remote call {} finished in {}ms (success={})", operation, elapsed.toMillis(), success);
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "catalog-remote-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
