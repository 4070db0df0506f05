package com.di.skyflow.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Propagates SLF4J MDC to worker threads so that every log line written while a group is
 * processed carries its {@value #GROUP_ID} key.
 * <p>
 * Usage:
 * <ul>
 *   <li>Wrap the worker pool once: {@code ExecutorService pool = MdcPropagation.wrapExecutor(Executors.newFixedThreadPool(n));}</li>
 *   <li>Scope a block to one group: {@code MdcPropagation.runForGroup(groupId, () -> orchestrator.runToCompletion(groupId));}</li>
 * </ul>
 */
public final class MdcPropagation {

    public static final String GROUP_ID = "groupId";

    private MdcPropagation() {
    }

    /**
     * Captures the current thread's MDC and returns a Runnable that installs it for the
     * duration of the task and removes it in {@code finally}.
     */
    public static Runnable wrapRunnable(Runnable task) {
        Map<String, String> contextMap = copyMdc();
        return () -> runWithMdcContext(contextMap, task);
    }

    /**
     * Runs the task with {@value #GROUP_ID} set, restoring the previous value afterwards.
     */
    public static void runForGroup(String groupId, Runnable task) {
        String previous = MDC.get(GROUP_ID);
        MDC.put(GROUP_ID, groupId);
        try {
            task.run();
        } finally {
            if (previous == null) {
                MDC.remove(GROUP_ID);
            } else {
                MDC.put(GROUP_ID, previous);
            }
        }
    }

    public static void runWithMdcContext(Map<String, String> contextMap, Runnable task) {
        setMdc(contextMap);
        try {
            task.run();
        } finally {
            clearMdc(contextMap);
        }
    }

    /**
     * Returns an executor that wraps every submitted task with MDC propagation from the
     * submitting thread.
     */
    public static ExecutorService wrapExecutor(ExecutorService delegate) {
        return new MdcPropagatingExecutor(delegate);
    }

    /** Copy of the current thread's MDC; never null. */
    public static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }

    private static void setMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.forEach(MDC::put);
        }
    }

    private static void clearMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.keySet().forEach(MDC::remove);
        }
    }

    private static final class MdcPropagatingExecutor extends AbstractExecutorService {
        private final ExecutorService delegate;

        MdcPropagatingExecutor(ExecutorService delegate) {
            this.delegate = delegate;
        }

        @Override
        public void execute(Runnable command) {
            delegate.execute(wrapRunnable(command));
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
    }
}
