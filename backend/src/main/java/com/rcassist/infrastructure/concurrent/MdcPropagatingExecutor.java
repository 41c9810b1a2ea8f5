package com.rcassist.infrastructure.concurrent;

import org.slf4j.MDC;

import java.util.List;
import java.util.Map;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-per-task pool of daemon threads that carries the caller's MDC (run id) into every task.
 * Idle threads are reused; a task never waits in a queue, so a timeout measured from submission
 * measures the task itself.
 */
public class MdcPropagatingExecutor extends AbstractExecutorService implements AutoCloseable {

    private final ExecutorService delegate;

    public MdcPropagatingExecutor(String threadPrefix) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, threadPrefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        this.delegate = Executors.newCachedThreadPool(factory);
    }

    @Override
    public void execute(Runnable command) {
        // Capture MDC context from the calling thread
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        delegate.execute(() -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                command.run();
            } finally {
                MDC.clear();
            }
        });
    }

    @Override
    public void shutdown() {
        delegate.shutdown();
    }

    @Override
    public List<Runnable> shutdownNow() {
        return delegate.shutdownNow();
    }

    @Override
    public boolean isShutdown() {
        return delegate.isShutdown();
    }

    @Override
    public boolean isTerminated() {
        return delegate.isTerminated();
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return delegate.awaitTermination(timeout, unit);
    }

    @Override
    public void close() {
        delegate.shutdownNow();
    }
}
