package com.di.awardscope.controller;

import com.di.awardscope.controller.dto.SnapshotSummary;
import com.di.awardscope.snapshot.SnapshotStore;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

/**
 * Inspects and swaps the active snapshot version.
 * Use with context path: e.g. POST /awardscope/api/snapshot/activate?version=2024-06-01
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/snapshot")
@RequiredArgsConstructor
public class SnapshotController {

    private final SnapshotStore snapshotStore;

    /** Active manifest summary; 503 when nothing is active yet. */
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SnapshotSummary> current() {
        return ResponseEntity.ok(SnapshotSummary.of(snapshotStore.current()));
    }

    /**
     * Validates {@code <root>/<version>} and makes it active. In-flight requests finish on the
     * snapshot they started with.
     */
    @PostMapping(value = "/activate", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SnapshotSummary> activate(@RequestParam @NotBlank String version) {
        log.info("[SNAPSHOT] Activation requested: {}", version);
        return ResponseEntity.ok(SnapshotSummary.of(snapshotStore.activate(version)));
    }
}
