package com.catalog.browser.remote;

import com.catalog.browser.core.ErrorKind;
import com.catalog.browser.metrics.MicrometerMetricsService;
import com.catalog.browser.view.UnsupportedModelException;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class RemoteCallExecutorTest {

    private SimpleMeterRegistry registry;
    private RemoteCallExecutor executor;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        executor = new RemoteCallExecutor(new RemoteCallConfig(Duration.ofMillis(200), 2),
                new MicrometerMetricsService(registry));
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    @Nested
    @DisplayName("Execution")
    class ExecutionTests {

        @Test
        @DisplayName("Should return the call's result on a worker thread")
        void testResult() {
            String thread = executor.execute("artist", () -> Thread.currentThread().getName());
            assertTrue(thread.startsWith("catalog-remote-"), thread);
        }

        @Test
        @DisplayName("Should run the call under the caller's log context")
        void testLogContextPropagated() {
            MDC.put("catalogId", "abc");
            try {
                String seen = executor.execute("artist", () -> MDC.get("catalogId"));
                assertEquals("abc", seen);
            } finally {
                MDC.remove("catalogId");
            }

            assertNull(executor.execute("artist", () -> MDC.get("catalogId")));
        }

        @Test
        @DisplayName("Should wrap checked failures with the operation name")
        void testWrapsFailure() {
            RemoteCallFailureException e = assertThrows(RemoteCallFailureException.class,
                    () -> executor.execute("album", () -> {
                        throw new IOException("502 Bad Gateway");
                    }));

            assertEquals("album", e.getOperation());
            assertEquals(ErrorKind.REMOTE_CALL, e.getKind());
            assertInstanceOf(IOException.class, e.getCause());
            assertTrue(e.getMessage().contains("502 Bad Gateway"));
        }

        @Test
        @DisplayName("Should rethrow catalog exceptions unchanged")
        void testRethrowsCatalogExceptions() {
            assertThrows(UnsupportedModelException.class, () -> executor.execute("search", () -> {
                throw new UnsupportedModelException("unexpected result");
            }));
        }

        @Test
        @DisplayName("Should cancel a call that exceeds the timeout")
        void testTimeout() throws InterruptedException {
            CountDownLatch interrupted = new CountDownLatch(1);

            RemoteCallFailureException e = assertThrows(RemoteCallFailureException.class,
                    () -> executor.execute("track", () -> {
                        try {
                            Thread.sleep(10_000);
                        } catch (InterruptedException ie) {
                            interrupted.countDown();
                            throw ie;
                        }
                        return "late";
                    }));

            assertTrue(e.getMessage().contains("timed out"));
            assertTrue(interrupted.await(5, TimeUnit.SECONDS));
        }

        @Test
        @DisplayName("Should refuse calls after close")
        void testClosed() {
            executor.close();
            assertThrows(RemoteCallFailureException.class, () -> executor.execute("artist", () -> "ok"));
        }
    }

    @Nested
    @DisplayName("Metrics")
    class MetricsTests {

        @Test
        @DisplayName("Should time successful and failed calls")
        void testTimers() {
            executor.execute("artist", () -> "ok");
            assertThrows(RemoteCallFailureException.class, () -> executor.execute("artist", () -> {
                throw new IOException("boom");
            }));

            Timer success = registry.find("catalog.remote.duration")
                    .tag("operation", "artist").tag("outcome", "success").timer();
            Timer failure = registry.find("catalog.remote.duration")
                    .tag("operation", "artist").tag("outcome", "failure").timer();
            assertEquals(1, success.count());
            assertEquals(1, failure.count());
        }
    }

    @Nested
    @DisplayName("RemoteCallConfig")
    class ConfigTests {

        @Test
        @DisplayName("Should provide defaults")
        void testDefaults() {
            RemoteCallConfig config = RemoteCallConfig.defaults();
            assertEquals(Duration.ofSeconds(60), config.timeout());
            assertEquals(8, config.workerThreads());
        }

        @Test
        @DisplayName("Should reject invalid values")
        void testValidation() {
            assertThrows(IllegalArgumentException.class, () -> new RemoteCallConfig(Duration.ZERO, 1));
            assertThrows(IllegalArgumentException.class, () -> new RemoteCallConfig(Duration.ofSeconds(1), 0));
        }
    }
}
