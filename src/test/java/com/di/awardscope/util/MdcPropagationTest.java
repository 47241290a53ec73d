package com.di.awardscope.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for MdcPropagation
 */
@DisplayName("MdcPropagation Tests")
class MdcPropagationTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("Should carry the submitter's MDC into pool threads")
    void testWrapExecutor_CarriesMdc() throws Exception {
        ExecutorService pool = MdcPropagation.wrapExecutor(Executors.newSingleThreadExecutor());
        try {
            MDC.put("requestId", "req-1234");
            Future<String> seen = pool.submit(() -> MDC.get("requestId"));

            assertEquals("req-1234", seen.get(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should not leak one task's MDC into the next")
    void testWrapExecutor_NoLeak() throws Exception {
        ExecutorService pool = MdcPropagation.wrapExecutor(Executors.newSingleThreadExecutor());
        try {
            MDC.put("requestId", "req-a");
            pool.submit(() -> MDC.get("requestId")).get(5, TimeUnit.SECONDS);
            MDC.clear();

            Future<String> seen = pool.submit(() -> MDC.get("requestId"));

            assertNull(seen.get(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should run a wrapped callable with the MDC captured at wrap time")
    void testWrapCallable() throws Exception {
        MDC.put("requestId", "req-outer");
        Callable<String> task = MdcPropagation.wrapCallable(() -> MDC.get("requestId"));
        MDC.clear();

        assertEquals("req-outer", task.call());
        assertNull(MDC.get("requestId"));
    }
}
