package com.rcassist.infrastructure.concurrent;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class MdcPropagatingExecutorTest {

    private final MdcPropagatingExecutor executor = new MdcPropagatingExecutor("test");

    @AfterEach
    void tearDown() {
        executor.close();
        MDC.clear();
    }

    @Test
    @DisplayName("tasks see the submitting thread's MDC, later tasks do not inherit it")
    void propagates_and_clears() throws Exception {
        MDC.put("runId", "abc123");
        String inside = CompletableFuture.supplyAsync(() -> MDC.get("runId"), executor).get(5, TimeUnit.SECONDS);

        MDC.clear();
        String after = CompletableFuture.supplyAsync(() -> MDC.get("runId"), executor).get(5, TimeUnit.SECONDS);

        assertThat(inside).isEqualTo("abc123");
        assertThat(after).isNull();
    }

    @Test
    @DisplayName("worker threads are named daemons")
    void thread_naming() throws Exception {
        Thread worker = CompletableFuture.supplyAsync(Thread::currentThread, executor).get(5, TimeUnit.SECONDS);

        assertThat(worker.getName()).isEqualTo("test-1");
        assertThat(worker.isDaemon()).isTrue();
    }
}
