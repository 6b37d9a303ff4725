package com.di.qualitygate.controller;

import com.di.qualitygate.batch.BatchRunMetrics;
import com.di.qualitygate.batch.BatchRunOrchestrator;
import com.di.qualitygate.batch.BatchState;
import com.di.qualitygate.batch.BatchStatus;
import com.di.qualitygate.store.QuarantineSink;
import com.di.qualitygate.store.QuarantineSummaryRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST surface for triggering and inspecting quality gate runs.
 *
 * <pre>
 *   POST /api/quality-gate/runs                 run a batch (201 COMPLETED, 500 FAILED, 409 already running)
 *   GET  /api/quality-gate/runs/latest          metrics of the last run (404 if none)
 *   GET  /api/quality-gate/status               state, and run id and current entity while running
 *   GET  /api/quality-gate/quarantine/summary   rejected rows per source table and reason
 * </pre>
 */
@Slf4j
@RestController
@RequestMapping("/api/quality-gate")
@RequiredArgsConstructor
public class QualityGateController {

    private final BatchRunOrchestrator orchestrator;
    private final QuarantineSink quarantineSink;

    @PostMapping(value = "/runs", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<BatchRunMetrics> runBatch() {
        log.info("[API] batch run requested");
        BatchRunMetrics result = orchestrator.runBatch();
        HttpStatus status = result.getState() == BatchState.COMPLETED ? HttpStatus.CREATED : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(result);
    }

    @GetMapping(value = "/runs/latest", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<BatchRunMetrics> latestRun() {
        return orchestrator.getLatestRun()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping(value = "/status", produces = MediaType.APPLICATION_JSON_VALUE)
    public BatchStatus status() {
        return orchestrator.getStatus();
    }

    @GetMapping(value = "/quarantine/summary", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<QuarantineSummaryRow> quarantineSummary() {
        return quarantineSink.summarize();
    }
}
