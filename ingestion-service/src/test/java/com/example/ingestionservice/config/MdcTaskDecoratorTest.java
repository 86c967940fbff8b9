package com.example.ingestionservice.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Correlation id propagation from the submitting thread to backfill workers.
 */
class MdcTaskDecoratorTest {

    private static final String MDC_KEY = "correlationId";

    private ThreadPoolTaskExecutor executor;

    @BeforeEach
    void setUp() {
        // Single worker so consecutive tasks run on the same thread
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("test-backfill-");
        executor.setTaskDecorator(new MdcTaskDecorator());
        executor.initialize();
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
        executor.shutdown();
    }

    @Test
    void testDecorate_CorrelationIdVisibleInWorker() throws Exception {
        // GIVEN
        MDC.put(MDC_KEY, "BACKFILL-1234abcd");

        // WHEN
        String seen = CompletableFuture.supplyAsync(() -> MDC.get(MDC_KEY), executor).get(5, TimeUnit.SECONDS);

        // THEN
        assertThat(seen).isEqualTo("BACKFILL-1234abcd");
    }

    @Test
    void testDecorate_ContextDoesNotLeakIntoNextTask() throws Exception {
        // GIVEN: first task runs with an id
        MDC.put(MDC_KEY, "BACKFILL-first");
        CompletableFuture.runAsync(() -> { }, executor).get(5, TimeUnit.SECONDS);

        // WHEN: second task submitted without an id
        MDC.clear();
        String seen = CompletableFuture.supplyAsync(() -> MDC.get(MDC_KEY), executor).get(5, TimeUnit.SECONDS);

        // THEN
        assertThat(seen).isNull();
    }

    @Test
    void testDecorate_WorkerChangesDoNotReachSubmitter() throws Exception {
        // GIVEN
        MDC.put(MDC_KEY, "BACKFILL-parent");
        AtomicReference<String> inWorker = new AtomicReference<>();

        // WHEN
        CompletableFuture.runAsync(() -> {
            MDC.put(MDC_KEY, "changed-in-worker");
            inWorker.set(MDC.get(MDC_KEY));
        }, executor).get(5, TimeUnit.SECONDS);

        // THEN
        assertThat(inWorker.get()).isEqualTo("changed-in-worker");
        assertThat(MDC.get(MDC_KEY)).isEqualTo("BACKFILL-parent");
    }

    @Test
    void testDecorate_RunsOnCallingThread_RestoresCallerContext() {
        // GIVEN: decorated runnable executed inline
        MDC.put(MDC_KEY, "caller");
        Runnable decorated = new MdcTaskDecorator().decorate(() -> MDC.put(MDC_KEY, "task"));

        // WHEN
        decorated.run();

        // THEN
        assertThat(MDC.get(MDC_KEY)).isEqualTo("caller");
    }
}
