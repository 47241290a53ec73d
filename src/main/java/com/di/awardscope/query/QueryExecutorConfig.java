package com.di.awardscope.query;

import com.di.awardscope.util.MdcPropagation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded {@code query-worker} pool. Tasks carry the submitting request's MDC.
 */
@Slf4j
@Configuration
public class QueryExecutorConfig {

    @Bean(name = "queryExecutor", destroyMethod = "shutdownNow")
    public ExecutorService queryExecutor(QueryProperties properties) {
        int threads = Math.max(1, properties.getWorkerThreads());
        ThreadPoolExecutor pool = new ThreadPoolExecutor(threads, threads, 60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(Math.max(1, properties.getQueueCapacity())),
                namedThreads("query-worker-"),
                new ThreadPoolExecutor.AbortPolicy());
        log.info("[QUERY] query-worker pool: {} threads, queue {}", threads, properties.getQueueCapacity());
        return MdcPropagation.wrapExecutor(pool);
    }

    static ThreadFactory namedThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
