package com.dayloop.timeline.endpoint;

import com.dayloop.timeline.dto.ApiResponse;
import com.dayloop.timeline.model.AnalysisBatch;
import com.dayloop.timeline.provider.LlmCallRecorder;
import com.dayloop.timeline.service.AnalysisSchedulerService;
import com.dayloop.timeline.service.ChunkStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class BatchController {

    private final ChunkStore chunkStore;
    private final AnalysisSchedulerService schedulerService;
    private final LlmCallRecorder callRecorder;

    @GetMapping("/batches")
    public ResponseEntity<?> listBatches(@RequestParam(required = false) String status) {
        AnalysisBatch.BatchStatus filter = null;
        if (status != null && !status.isBlank()) {
            filter = Arrays.stream(AnalysisBatch.BatchStatus.values())
                    .filter(s -> s.label().equalsIgnoreCase(status) || s.name().equalsIgnoreCase(status))
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("Unknown batch status: " + status));
        }
        return ResponseEntity.ok(chunkStore.listBatches(filter));
    }

    @GetMapping("/batches/{id}/calls")
    public ResponseEntity<?> batchCalls(@PathVariable Long id) {
        return ResponseEntity.ok(callRecorder.callsForBatch(id));
    }

    @DeleteMapping("/batches/{id}")
    public ResponseEntity<?> deleteBatch(@PathVariable Long id) {
        chunkStore.deleteBatch(id);
        return ResponseEntity.ok(ApiResponse.success("Batch deleted", null));
    }

    @PostMapping("/analysis/run")
    public ResponseEntity<?> runAnalysis() {
        if (!schedulerService.triggerAnalysisNow()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("success", false, "message", "Analysis already running"));
        }
        return ResponseEntity.accepted().body(ApiResponse.success("Analysis started", null));
    }
}
