package com.dayloop.timeline.service;

import com.dayloop.timeline.model.RecordingChunk;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Groups time-ordered chunks into analysis batches. Stateless.
 */
public class BatchBuilder {

    private final long maxGapSeconds;
    private final long targetBatchSeconds;
    private final long minBatchSeconds;

    public BatchBuilder(long maxGapSeconds, long targetBatchSeconds, long minBatchSeconds) {
        if (maxGapSeconds < 0 || targetBatchSeconds <= 0 || minBatchSeconds < 0) {
            throw new IllegalArgumentException("Batch thresholds must be positive");
        }
        this.maxGapSeconds = maxGapSeconds;
        this.targetBatchSeconds = targetBatchSeconds;
        this.minBatchSeconds = minBatchSeconds;
    }

    /**
     * Batches ready for analysis. The most recent batch is held back while it is still
     * under the target duration; it is rebuilt on a later tick once more chunks arrive.
     */
    public List<BatchDraft> build(List<RecordingChunk> chunks) {
        List<BatchDraft> batches = partition(chunks);
        if (!batches.isEmpty() && batches.get(batches.size() - 1).durationSeconds() < targetBatchSeconds) {
            batches.remove(batches.size() - 1);
        }
        return batches;
    }

    /**
     * Every bucket, the trailing one included. A new bucket starts when the gap from the
     * previous chunk's end exceeds the max gap, or when the next chunk would push the
     * bucket past the target duration.
     */
    public List<BatchDraft> partition(List<RecordingChunk> chunks) {
        List<BatchDraft> batches = new ArrayList<>();
        if (chunks == null || chunks.isEmpty()) {
            return batches;
        }

        List<RecordingChunk> ordered = new ArrayList<>(chunks);
        ordered.sort(Comparator.comparingLong(RecordingChunk::getStartTs));

        List<RecordingChunk> bucket = new ArrayList<>();
        long bucketSeconds = 0;

        for (RecordingChunk chunk : ordered) {
            if (!bucket.isEmpty()) {
                RecordingChunk prev = bucket.get(bucket.size() - 1);
                long gap = chunk.getStartTs() - prev.getEndTs();
                boolean wouldBurst = bucketSeconds + chunk.getDurationSeconds() > targetBatchSeconds;
                if (gap > maxGapSeconds || wouldBurst) {
                    batches.add(toDraft(bucket, bucketSeconds));
                    bucket = new ArrayList<>();
                    bucketSeconds = 0;
                }
            }
            bucket.add(chunk);
            bucketSeconds += chunk.getDurationSeconds();
        }
        batches.add(toDraft(bucket, bucketSeconds));
        return batches;
    }

    public boolean isBelowMinimum(long durationSeconds) {
        return durationSeconds < minBatchSeconds;
    }

    public long getMinBatchSeconds() {
        return minBatchSeconds;
    }

    private BatchDraft toDraft(List<RecordingChunk> bucket, long seconds) {
        return new BatchDraft(List.copyOf(bucket),
                bucket.get(0).getStartTs(),
                bucket.get(bucket.size() - 1).getEndTs(),
                seconds,
                isBelowMinimum(seconds));
    }

    public record BatchDraft(List<RecordingChunk> chunks, long startTs, long endTs,
                             long durationSeconds, boolean belowMinimum) {

        public List<Long> chunkIds() {
            return chunks.stream().map(RecordingChunk::getId).toList();
        }
    }
}
