package com.di.awardscope.export;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory registry of export jobs, for status polling and cancellation. Finished jobs stay
 * visible for {@code awardscope.export.job-retention-seconds}, then are dropped on the next access.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExportJobRegistry {

    private final ExportProperties properties;
    private final Map<String, ExportJob> jobs = new ConcurrentHashMap<>();

    public ExportJob create() {
        evictExpired();
        ExportJob job = new ExportJob("exp-" + UUID.randomUUID().toString().substring(0, 12));
        jobs.put(job.getId(), job);
        log.debug("[EXPORT] Registered job {}", job.getId());
        return job;
    }

    public Optional<ExportJob> find(String id) {
        evictExpired();
        return Optional.ofNullable(id != null ? jobs.get(id) : null);
    }

    /**
     * Requests cancellation of a running job.
     *
     * @return the job, whether or not it was still running; empty when unknown
     */
    public Optional<ExportJob> cancel(String id) {
        Optional<ExportJob> job = find(id);
        job.ifPresent(j -> {
            if (j.cancel()) {
                log.info("[EXPORT] Cancellation requested for job {} after {} rows", j.getId(), j.getRowsEmitted());
            }
        });
        return job;
    }

    public int size() {
        return jobs.size();
    }

    void evictExpired() {
        Instant cutoff = Instant.now().minus(Duration.ofSeconds(properties.getJobRetentionSeconds()));
        jobs.values().removeIf(j -> j.getFinishedAt() != null && j.getFinishedAt().isBefore(cutoff));
    }
}
