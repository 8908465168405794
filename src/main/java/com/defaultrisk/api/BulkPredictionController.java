package com.defaultrisk.api;

import com.defaultrisk.domain.exception.DispatchException;
import com.defaultrisk.domain.model.DatasetRef;
import com.defaultrisk.domain.model.JobHandle;
import com.defaultrisk.domain.model.JobStatusView;
import com.defaultrisk.domain.service.BatchJobDispatcher;
import com.defaultrisk.domain.service.BatchJobService;
import com.defaultrisk.infrastructure.dataset.DatasetStagingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.UUID;

/**
 * REST API for bulk predictions.
 *
 * Submission only stages the file and queues a job; the batch itself runs on a worker.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class BulkPredictionController {

    private final DatasetStagingService stagingService;
    private final BatchJobDispatcher dispatcher;
    private final BatchJobService jobService;

    /**
     * Submit a dataset for bulk prediction.
     *
     * POST /api/v1/predictions/bulk (multipart, part "file": .csv, .xlsx or .xls)
     *
     * Response: 202 with the job id
     */
    @PostMapping(path = "/predictions/bulk", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<JobSubmissionResponse> submitBulk(@RequestParam("file") MultipartFile file) {
        log.info("Received bulk prediction upload: {} ({} bytes)", file.getOriginalFilename(), file.getSize());

        DatasetRef staged = stagingService.stage(file);
        JobHandle handle;
        try {
            handle = dispatcher.submit(staged);
        } catch (DispatchException e) {
            stagingService.discard(staged);
            throw e;
        }

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new JobSubmissionResponse(handle.getJobId(), handle.getStatus()));
    }

    /**
     * GET /api/v1/jobs/{jobId}
     */
    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<JobStatusView> jobStatus(@PathVariable UUID jobId) {
        return jobService.status(jobId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Health check endpoint.
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
