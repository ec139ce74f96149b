package com.dayloop.timeline.endpoint;

import com.dayloop.timeline.dto.ApiResponse;
import com.dayloop.timeline.dto.ChunkCompletionRequest;
import com.dayloop.timeline.dto.ChunkRegistrationRequest;
import com.dayloop.timeline.model.RecordingChunk;
import com.dayloop.timeline.service.ChunkStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Capture-side lifecycle of recording chunks.
 */
@RestController
@RequestMapping("/api/chunks")
@RequiredArgsConstructor
public class RecordingController {

    private final ChunkStore chunkStore;

    @PostMapping
    public ResponseEntity<?> registerChunk(@RequestBody(required = false) ChunkRegistrationRequest request) {
        ChunkRegistrationRequest body = request != null ? request : new ChunkRegistrationRequest();
        RecordingChunk chunk = chunkStore.registerChunk(body.getFilePath(), body.getStartTs());
        return ResponseEntity.ok(ApiResponse.success("Chunk registered", chunk));
    }

    @PostMapping("/{id}/complete")
    public ResponseEntity<?> completeChunk(@PathVariable Long id,
                                           @RequestBody(required = false) ChunkCompletionRequest request) {
        Long endTs = request != null ? request.getEndTs() : null;
        return ResponseEntity.ok(ApiResponse.success("Chunk completed", chunkStore.markChunkCompleted(id, endTs)));
    }

    @PostMapping("/{id}/fail")
    public ResponseEntity<?> failChunk(@PathVariable Long id) {
        chunkStore.markChunkFailed(id);
        return ResponseEntity.ok(ApiResponse.success("Chunk discarded", null));
    }
}
