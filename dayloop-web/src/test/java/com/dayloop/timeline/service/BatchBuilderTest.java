package com.dayloop.timeline.service;

import com.dayloop.timeline.model.RecordingChunk;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BatchBuilderTest {

    private final BatchBuilder builder = new BatchBuilder(120, 900, 300);

    private static RecordingChunk chunk(long id, long start, long end, String path) {
        RecordingChunk chunk = new RecordingChunk(start, end, path, RecordingChunk.ChunkStatus.COMPLETED);
        chunk.setId(id);
        return chunk;
    }

    private static List<RecordingChunk> contiguous(int count, long from, long idFrom) {
        List<RecordingChunk> chunks = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            long start = from + i * 60L;
            chunks.add(chunk(idFrom + i, start, start + 60, "c" + (idFrom + i) + ".mp4"));
        }
        return chunks;
    }

    @Test
    void testGapSplitsShortBatchesAndFlagsThem() {
        List<RecordingChunk> chunks = List.of(
                chunk(1, 0, 15, "a.mp4"),
                chunk(2, 15, 30, "b.mp4"),
                chunk(3, 200, 215, "c.mp4"));

        List<BatchBuilder.BatchDraft> batches = builder.partition(chunks);

        assertThat(batches).hasSize(2);
        assertThat(batches.get(0).chunkIds()).containsExactly(1L, 2L);
        assertThat(batches.get(0).startTs()).isEqualTo(0);
        assertThat(batches.get(0).endTs()).isEqualTo(30);
        assertThat(batches.get(0).durationSeconds()).isEqualTo(30);
        assertThat(batches.get(1).chunkIds()).containsExactly(3L);
        assertThat(batches.get(1).startTs()).isEqualTo(200);
        assertThat(batches.get(1).endTs()).isEqualTo(215);
        assertThat(batches).allMatch(BatchBuilder.BatchDraft::belowMinimum);
    }

    @Test
    void testEmptyInput() {
        assertThat(builder.build(List.of())).isEmpty();
        assertThat(builder.partition(null)).isEmpty();
    }

    @Test
    void testGapAtLimitDoesNotSplit() {
        List<RecordingChunk> chunks = List.of(chunk(1, 0, 60, "a.mp4"), chunk(2, 180, 240, "b.mp4"));

        assertThat(builder.partition(chunks)).hasSize(1);
    }

    @Test
    void testGapAboveLimitAlwaysSplits() {
        List<RecordingChunk> chunks = List.of(chunk(1, 0, 60, "a.mp4"), chunk(2, 181, 241, "b.mp4"));

        List<BatchBuilder.BatchDraft> batches = builder.partition(chunks);

        assertThat(batches).hasSize(2);
        assertThat(batches.get(0).endTs()).isEqualTo(60);
        assertThat(batches.get(1).startTs()).isEqualTo(181);
    }

    @Test
    void testTrailingBatchUnderTargetIsHeldBack() {
        // 20 one-minute chunks: one full 15 minute batch plus 5 minutes still growing
        List<BatchBuilder.BatchDraft> batches = builder.build(contiguous(20, 0, 1));

        assertThat(batches).hasSize(1);
        assertThat(batches.get(0).chunks()).hasSize(15);
        assertThat(batches.get(0).durationSeconds()).isEqualTo(900);
    }

    @Test
    void testShortContiguousRunYieldsNothingYet() {
        assertThat(builder.build(contiguous(10, 0, 1))).isEmpty();
        assertThat(builder.partition(contiguous(10, 0, 1))).hasSize(1);
    }

    @Test
    void testRebuildAfterGrowthMatchesFreshRun() {
        List<RecordingChunk> all = contiguous(30, 0, 1);

        List<BatchBuilder.BatchDraft> firstTick = builder.build(all.subList(0, 20));
        List<Long> batched = firstTick.stream().flatMap(b -> b.chunkIds().stream()).toList();
        List<RecordingChunk> remaining = all.stream().filter(c -> !batched.contains(c.getId())).toList();
        List<BatchBuilder.BatchDraft> secondTick = builder.build(remaining);

        List<BatchBuilder.BatchDraft> fresh = builder.build(all);

        List<List<Long>> incremental = new ArrayList<>();
        firstTick.forEach(b -> incremental.add(b.chunkIds()));
        secondTick.forEach(b -> incremental.add(b.chunkIds()));
        assertThat(incremental).isEqualTo(fresh.stream().map(BatchBuilder.BatchDraft::chunkIds).toList());
        assertThat(incremental).hasSize(2);
    }

    @Test
    void testSingleLongChunkIsItsOwnBatch() {
        List<RecordingChunk> chunks = List.of(chunk(1, 0, 1200, "long.mp4"), chunk(2, 1230, 1290, "next.mp4"));

        List<BatchBuilder.BatchDraft> batches = builder.build(chunks);

        assertThat(batches).hasSize(1);
        assertThat(batches.get(0).chunkIds()).containsExactly(1L);
        assertThat(batches.get(0).belowMinimum()).isFalse();
    }

    @Test
    void testUnorderedInputIsSorted() {
        List<RecordingChunk> chunks = List.of(chunk(2, 15, 30, "b.mp4"), chunk(1, 0, 15, "a.mp4"));

        assertThat(builder.partition(chunks).get(0).chunkIds()).containsExactly(1L, 2L);
    }
}
