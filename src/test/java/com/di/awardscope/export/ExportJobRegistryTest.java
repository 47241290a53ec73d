package com.di.awardscope.export;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test cases for ExportJobRegistry
 */
@DisplayName("ExportJobRegistry Tests")
class ExportJobRegistryTest {

    private ExportProperties properties;
    private ExportJobRegistry registry;

    @BeforeEach
    void setUp() {
        properties = new ExportProperties();
        registry = new ExportJobRegistry(properties);
    }

    @Test
    @DisplayName("Should register jobs under unique ids")
    void testCreate_UniqueIds() {
        ExportJob a = registry.create();
        ExportJob b = registry.create();

        assertTrue(a.getId().startsWith("exp-"));
        assertEquals(16, a.getId().length());
        assertNotEquals(a.getId(), b.getId());
        assertSame(a, registry.find(a.getId()).orElseThrow());
        assertEquals(ExportJobState.RUNNING, a.getState());
    }

    @Test
    @DisplayName("Should return empty for unknown or null ids")
    void testFind_Unknown() {
        assertTrue(registry.find("exp-missing").isEmpty());
        assertTrue(registry.find(null).isEmpty());
        assertTrue(registry.cancel("exp-missing").isEmpty());
    }

    @Test
    @DisplayName("Should flag a running job for cancellation")
    void testCancel_Running() {
        ExportJob job = registry.create();

        Optional<ExportJob> cancelled = registry.cancel(job.getId());

        assertTrue(cancelled.isPresent());
        assertTrue(job.isCancelRequested());
        // takes effect at the streamer's next batch boundary
        assertEquals(ExportJobState.RUNNING, job.getState());
    }

    @Test
    @DisplayName("Should leave a finished job unchanged on cancel")
    void testCancel_Finished() {
        ExportJob job = registry.create();
        job.complete();

        registry.cancel(job.getId());

        assertFalse(job.isCancelRequested());
        assertEquals(ExportJobState.COMPLETED, job.getState());
    }

    @Test
    @DisplayName("Should drop finished jobs after the retention period but keep running ones")
    void testEvictExpired() throws InterruptedException {
        properties.setJobRetentionSeconds(0);
        ExportJob running = registry.create();
        ExportJob finished = registry.create();
        finished.cancelled();
        Thread.sleep(20);

        registry.evictExpired();

        assertEquals(1, registry.size());
        assertTrue(registry.find(running.getId()).isPresent());
        assertTrue(registry.find(finished.getId()).isEmpty());
    }

    @Test
    @DisplayName("Should report progress from the estimate")
    void testStatus_Progress() {
        ExportJob job = registry.create();
        job.setEstimatedRows(4);
        job.advance(1);

        ExportJobStatus status = job.status();

        assertEquals(0.25, status.progress(), 1e-9);
        assertEquals(1, status.rowsEmitted());
        assertNull(status.finishedAt());
    }
}
