package com.dayloop.timeline.service;

import com.dayloop.timeline.model.AnalysisBatch;
import com.dayloop.timeline.model.RecordingChunk;
import com.dayloop.timeline.model.RecordingChunk.ChunkStatus;
import com.dayloop.timeline.repository.AnalysisBatchRepository;
import com.dayloop.timeline.repository.ObservationRepository;
import com.dayloop.timeline.repository.RecordingChunkRepository;
import com.dayloop.timeline.repository.TimelineCardRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class ChunkStoreTest {

    @Configuration
    @EntityScan(basePackageClasses = RecordingChunk.class)
    @EnableJpaRepositories(basePackageClasses = RecordingChunkRepository.class)
    static class JpaConfig {
    }

    @Autowired
    private RecordingChunkRepository chunkRepository;
    @Autowired
    private AnalysisBatchRepository batchRepository;
    @Autowired
    private ObservationRepository observationRepository;
    @Autowired
    private TimelineCardRepository cardRepository;
    @Autowired
    private PlatformTransactionManager transactionManager;

    @TempDir
    Path recordingsRoot;

    private ChunkStore chunkStore;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.ofEpochSecond(1_700_100_000L), ZoneOffset.UTC);
        // Zero quota: any file on disk puts the store over quota
        chunkStore = new ChunkStore(chunkRepository, batchRepository, observationRepository, cardRepository,
                new StoreWriter(transactionManager), clock, recordingsRoot.toString(), 0, 10);
    }

    @AfterEach
    void tearDown() {
        chunkStore.shutdown();
        cardRepository.deleteAll();
        observationRepository.deleteAll();
        batchRepository.deleteAll();
        chunkRepository.deleteAll();
    }

    private RecordingChunk storedChunk(long start, ChunkStatus status) throws Exception {
        Path file = Files.writeString(recordingsRoot.resolve("chunk_" + start + ".mp4"), "video");
        return chunkRepository.save(new RecordingChunk(start, start + 60, file.toString(), status));
    }

    private AnalysisBatch batchOf(RecordingChunk... chunks) {
        List<RecordingChunk> list = List.of(chunks);
        BatchBuilder.BatchDraft draft = new BatchBuilder.BatchDraft(list, list.get(0).getStartTs(),
                list.get(list.size() - 1).getEndTs(), 60L * list.size(), false);
        return chunkStore.saveBatch(draft).orElseThrow();
    }

    @Test
    void testPurgeSkipsBatchedChunksAndStopsAtLimit() throws Exception {
        RecordingChunk oldest = storedChunk(1_000, ChunkStatus.COMPLETED);
        batchOf(oldest);
        List<RecordingChunk> unbatched = new ArrayList<>();
        for (int i = 1; i <= 12; i++) {
            unbatched.add(storedChunk(1_000 + i * 60L, ChunkStatus.COMPLETED));
        }

        int evicted = chunkStore.purgeIfNeeded();

        assertThat(evicted).isEqualTo(10);
        assertThat(chunkRepository.findById(oldest.getId())).isPresent();
        assertThat(Files.exists(Path.of(oldest.getFilePath()))).isTrue();
        // the two newest survive until the next registration re-checks
        assertThat(chunkRepository.findAll()).extracting(RecordingChunk::getId)
                .containsExactlyInAnyOrder(oldest.getId(), unbatched.get(10).getId(), unbatched.get(11).getId());
        assertThat(Files.exists(Path.of(unbatched.get(0).getFilePath()))).isFalse();
    }

    @Test
    void testPurgeUnderQuotaDoesNothing() throws Exception {
        ChunkStore roomy = new ChunkStore(chunkRepository, batchRepository, observationRepository, cardRepository,
                new StoreWriter(transactionManager), Clock.systemUTC(), recordingsRoot.toString(), Long.MAX_VALUE, 10);
        storedChunk(1_000, ChunkStatus.COMPLETED);

        assertThat(roomy.purgeIfNeeded()).isZero();
        assertThat(chunkRepository.count()).isEqualTo(1);
        roomy.shutdown();
    }

    @Test
    void testCompleteChunkFlipsStatusAndEnd() throws Exception {
        RecordingChunk chunk = storedChunk(5_000, ChunkStatus.RECORDING);

        RecordingChunk completed = chunkStore.markChunkCompleted(chunk.getId(), 5_045L);

        assertThat(completed.getStatus()).isEqualTo(ChunkStatus.COMPLETED);
        assertThat(completed.getEndTs()).isEqualTo(5_045L);
        assertThatThrownBy(() -> chunkStore.markChunkCompleted(chunk.getId(), 5_050L))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testCompleteChunkRejectsEndBeforeStart() throws Exception {
        RecordingChunk chunk = storedChunk(5_000, ChunkStatus.RECORDING);

        assertThatThrownBy(() -> chunkStore.markChunkCompleted(chunk.getId(), 4_000L))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testFailedChunkRemovesRowAndFile() throws Exception {
        RecordingChunk chunk = storedChunk(5_000, ChunkStatus.RECORDING);

        chunkStore.markChunkFailed(chunk.getId());

        assertThat(chunkRepository.findById(chunk.getId())).isEmpty();
        assertThat(Files.exists(Path.of(chunk.getFilePath()))).isFalse();
    }

    @Test
    void testFailedChunkRefusedWhileBatched() throws Exception {
        RecordingChunk chunk = storedChunk(5_000, ChunkStatus.COMPLETED);
        batchOf(chunk);

        assertThatThrownBy(() -> chunkStore.markChunkFailed(chunk.getId()))
                .isInstanceOf(IllegalStateException.class);
        assertThat(chunkRepository.findById(chunk.getId())).isPresent();
    }

    @Test
    void testUnprocessedChunksExcludeBatchedAndRecording() throws Exception {
        RecordingChunk batched = storedChunk(10_000, ChunkStatus.COMPLETED);
        batchOf(batched);
        RecordingChunk free = storedChunk(10_060, ChunkStatus.COMPLETED);
        storedChunk(10_120, ChunkStatus.RECORDING);
        storedChunk(100, ChunkStatus.COMPLETED);

        List<RecordingChunk> result = chunkStore.fetchUnprocessedChunks(9_000);

        assertThat(result).extracting(RecordingChunk::getId).containsExactly(free.getId());
    }

    @Test
    void testSaveBatchSpansItsChunksAndStartsPending() throws Exception {
        RecordingChunk a = storedChunk(20_000, ChunkStatus.COMPLETED);
        RecordingChunk b = storedChunk(20_060, ChunkStatus.COMPLETED);

        AnalysisBatch batch = batchOf(a, b);

        assertThat(batch.getStatus()).isEqualTo(AnalysisBatch.BatchStatus.PENDING);
        assertThat(batch.getBatchStartTs()).isEqualTo(20_000);
        assertThat(batch.getBatchEndTs()).isEqualTo(20_120);
        assertThat(chunkStore.chunksForBatch(batch.getId())).extracting(RecordingChunk::getId)
                .containsExactly(a.getId(), b.getId());
    }

    @Test
    void testDeleteBatchReleasesChunks() throws Exception {
        RecordingChunk chunk = storedChunk(30_000, ChunkStatus.COMPLETED);
        AnalysisBatch batch = batchOf(chunk);

        chunkStore.deleteBatch(batch.getId());

        assertThat(batchRepository.findById(batch.getId())).isEmpty();
        assertThat(chunkStore.fetchUnprocessedChunks(0)).extracting(RecordingChunk::getId).contains(chunk.getId());
    }

    @Test
    void testInterruptedBatchesAreFailed() throws Exception {
        AnalysisBatch batch = batchOf(storedChunk(40_000, ChunkStatus.COMPLETED));
        chunkStore.updateBatchStatus(batch.getId(), AnalysisBatch.BatchStatus.PROCESSING, null);

        assertThat(chunkStore.failInterruptedBatches()).isEqualTo(1);
        assertThat(chunkStore.findBatchStatus(batch.getId())).contains(AnalysisBatch.BatchStatus.FAILED);
    }
}
