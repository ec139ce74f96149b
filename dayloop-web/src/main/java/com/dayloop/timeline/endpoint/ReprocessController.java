package com.dayloop.timeline.endpoint;

import com.dayloop.timeline.dto.ApiResponse;
import com.dayloop.timeline.dto.ReprocessBatchesRequest;
import com.dayloop.timeline.exception.ResourceNotFoundException;
import com.dayloop.timeline.service.ReprocessJob;
import com.dayloop.timeline.service.ReprocessingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

/**
 * Starts reprocessing jobs and reports their progress. Jobs run one at a time.
 */
@RestController
@RequestMapping("/api/reprocess")
@RequiredArgsConstructor
public class ReprocessController {

    private final ReprocessingService reprocessingService;

    @PostMapping("/day/{day}")
    public ResponseEntity<?> reprocessDay(@PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate day) {
        ReprocessJob job = reprocessingService.submitDay(day);
        return ResponseEntity.accepted().body(ApiResponse.success("Reprocessing queued", job.toStatus()));
    }

    @PostMapping("/batches")
    public ResponseEntity<?> reprocessBatches(@Valid @RequestBody ReprocessBatchesRequest request) {
        ReprocessJob job = reprocessingService.submitBatches(request.getBatchIds());
        return ResponseEntity.accepted().body(ApiResponse.success("Reprocessing queued", job.toStatus()));
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<?> jobStatus(@PathVariable String jobId) {
        ReprocessJob job = reprocessingService.findJob(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("Reprocessing job not found: " + jobId));
        return ResponseEntity.ok(job.toStatus());
    }
}
