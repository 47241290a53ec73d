package com.di.awardscope.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Propagates SLF4J MDC ({@code requestId}, {@code requestPath} from
 * {@link com.di.awardscope.config.MdcRequestFilter}) to query-worker threads so that logs written
 * while planning, scanning and merging are correlated with the request that asked for them.
 * <p>
 * Usage:
 * <ul>
 *   <li>Wrap before submitting: {@code executor.submit(MdcPropagation.wrapCallable(() -> doWork()));}</li>
 *   <li>Or wrap the executor once: {@code ExecutorService withMdc = MdcPropagation.wrapExecutor(pool);}</li>
 * </ul>
 */
public final class MdcPropagation {

    private MdcPropagation() {
    }

    /**
     * Captures the current thread's MDC and returns a Runnable that, when run on another thread,
     * sets that MDC for the duration of the task and clears it in {@code finally}.
     */
    public static Runnable wrapRunnable(Runnable task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                task.run();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    /**
     * Captures the current thread's MDC and returns a Callable that, when called on another thread,
     * sets that MDC for the duration of the task and clears it in {@code finally}.
     */
    public static <T> Callable<T> wrapCallable(Callable<T> task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                return task.call();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    /**
     * Returns an executor that wraps every submitted task with MDC propagation from the submitting thread.
     *
     * @param delegate the underlying executor
     * @return an executor that propagates MDC for each task
     */
    public static ExecutorService wrapExecutor(ExecutorService delegate) {
        return new MdcPropagatingExecutor(delegate);
    }

    /**
     * Returns a copy of the current thread's MDC context map, or an empty map if none.
     *
     * @return copy of MDC context; never null
     */
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
