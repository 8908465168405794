package com.defaultrisk.api;

import com.defaultrisk.infrastructure.health.WorkerDiagnostics;
import com.defaultrisk.infrastructure.health.WorkerDiagnosticsService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/diagnostics")
@RequiredArgsConstructor
public class DiagnosticsController {

    private final WorkerDiagnosticsService diagnosticsService;

    /**
     * Active job, reserved partitions and completed count per worker, plus jobs still queued.
     */
    @GetMapping("/workers")
    public ResponseEntity<WorkerDiagnostics> workers() {
        return ResponseEntity.ok(diagnosticsService.diagnostics());
    }
}
