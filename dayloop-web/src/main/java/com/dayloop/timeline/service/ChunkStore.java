package com.dayloop.timeline.service;

import com.dayloop.timeline.exception.ResourceNotFoundException;
import com.dayloop.timeline.model.AnalysisBatch;
import com.dayloop.timeline.model.RecordingChunk;
import com.dayloop.timeline.model.RecordingChunk.ChunkStatus;
import com.dayloop.timeline.model.TimelineCard;
import com.dayloop.timeline.repository.AnalysisBatchRepository;
import com.dayloop.timeline.repository.ObservationRepository;
import com.dayloop.timeline.repository.RecordingChunkRepository;
import com.dayloop.timeline.repository.TimelineCardRepository;
import com.dayloop.timeline.util.FileCleanup;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Stream;

/**
 * Recorded chunks, their batches, and the on-disk quota for the recordings root.
 */
@Service
@Slf4j
public class ChunkStore {

    private static final DateTimeFormatter FILE_NAME_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmssSSS");
    private static final long ESTIMATED_CHUNK_SECONDS = 60;
    private static final List<ChunkStatus> EVICTABLE = List.of(ChunkStatus.COMPLETED, ChunkStatus.RECORDING);

    private final RecordingChunkRepository chunkRepository;
    private final AnalysisBatchRepository batchRepository;
    private final ObservationRepository observationRepository;
    private final TimelineCardRepository cardRepository;
    private final StoreWriter writer;
    private final Clock clock;
    private final Path recordingsRoot;
    private final long quotaBytes;
    private final int purgeLimit;

    private final ExecutorService purgeExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "chunk-purge");
        t.setDaemon(true);
        t.setPriority(Thread.MIN_PRIORITY);
        return t;
    });

    public ChunkStore(RecordingChunkRepository chunkRepository,
                      AnalysisBatchRepository batchRepository,
                      ObservationRepository observationRepository,
                      TimelineCardRepository cardRepository,
                      StoreWriter writer,
                      Clock clock,
                      @Value("${dayloop.storage.recordings-root:data/recordings}") String recordingsRoot,
                      @Value("${dayloop.storage.quota-bytes:5368709120}") long quotaBytes,
                      @Value("${dayloop.storage.purge-limit:10}") int purgeLimit) {
        this.chunkRepository = chunkRepository;
        this.batchRepository = batchRepository;
        this.observationRepository = observationRepository;
        this.cardRepository = cardRepository;
        this.writer = writer;
        this.clock = clock;
        this.recordingsRoot = Paths.get(recordingsRoot);
        this.quotaBytes = quotaBytes;
        this.purgeLimit = purgeLimit;
    }

    @PreDestroy
    public void shutdown() {
        purgeExecutor.shutdownNow();
    }

    public Path nextFileUrl() {
        String name = LocalDateTime.now(clock).format(FILE_NAME_FORMAT) + ".mp4";
        return recordingsRoot.resolve(name);
    }

    public RecordingChunk registerChunk(String filePath, Long startTs) {
        long start = startTs != null ? startTs : clock.instant().getEpochSecond();
        String path = filePath != null && !filePath.isBlank() ? filePath : nextFileUrl().toString();

        RecordingChunk saved = writer.write(status -> chunkRepository.save(
                new RecordingChunk(start, start + ESTIMATED_CHUNK_SECONDS, path, ChunkStatus.RECORDING)));
        log.debug("Registered chunk {} at {}", saved.getId(), path);

        schedulePurge();
        return saved;
    }

    public RecordingChunk markChunkCompleted(Long chunkId, Long endTs) {
        RecordingChunk completed = writer.write(status -> {
            RecordingChunk chunk = requireChunk(chunkId);
            if (chunk.getStatus() != ChunkStatus.RECORDING) {
                throw new IllegalStateException("Chunk " + chunkId + " is already " + chunk.getStatus());
            }
            long end = endTs != null ? endTs : clock.instant().getEpochSecond();
            if (end < chunk.getStartTs()) {
                throw new IllegalArgumentException("Chunk end " + end + " precedes its start " + chunk.getStartTs());
            }
            chunk.setEndTs(end);
            chunk.setStatus(ChunkStatus.COMPLETED);
            return chunkRepository.save(chunk);
        });
        log.debug("Chunk {} completed ({}s)", chunkId, completed.getDurationSeconds());
        return completed;
    }

    public void markChunkFailed(Long chunkId) {
        String path = writer.write(status -> {
            RecordingChunk chunk = requireChunk(chunkId);
            if (chunkRepository.isReferencedByBatch(chunkId)) {
                throw new IllegalStateException("Chunk " + chunkId + " belongs to a batch");
            }
            chunkRepository.delete(chunk);
            return chunk.getFilePath();
        });
        log.info("Chunk {} failed, removed record", chunkId);
        FileCleanup.deleteQuietly(List.of(path));
    }

    public List<RecordingChunk> fetchUnprocessedChunks(long cutoff) {
        return chunkRepository.findUnbatchedSince(cutoff, ChunkStatus.COMPLETED);
    }

    /**
     * Evicts up to {@code purge-limit} of the oldest unbatched chunks when the recordings
     * root is over quota. Does not loop: the next registration re-checks.
     *
     * @return number of chunks evicted
     */
    public int purgeIfNeeded() {
        List<String> files = writer.write(status -> {
            long used = diskUsage();
            if (used <= quotaBytes) {
                return List.<String>of();
            }
            // Referential check and delete share this transaction and the write lock
            List<RecordingChunk> victims = chunkRepository.findEvictionCandidates(EVICTABLE, PageRequest.of(0, purgeLimit));
            chunkRepository.deleteAll(victims);
            chunkRepository.flush();
            log.info("Recordings use {} MB, over quota of {} MB; evicting {} chunks",
                    used / (1024 * 1024), quotaBytes / (1024 * 1024), victims.size());
            return victims.stream().map(RecordingChunk::getFilePath).toList();
        });
        if (!files.isEmpty()) {
            FileCleanup.deleteQuietly(files);
        }
        return files.size();
    }

    public Optional<AnalysisBatch> saveBatch(BatchBuilder.BatchDraft draft) {
        return writer.write(status -> {
            // A chunk may have been evicted or failed since the draft was built
            List<RecordingChunk> chunks = chunkRepository.findAllById(draft.chunkIds());
            if (chunks.isEmpty()) {
                log.warn("No chunks left for batch draft [{}, {}], skipping", draft.startTs(), draft.endTs());
                return Optional.empty();
            }
            AnalysisBatch batch = new AnalysisBatch();
            batch.setBatchStartTs(chunks.stream().mapToLong(RecordingChunk::getStartTs).min().getAsLong());
            batch.setBatchEndTs(chunks.stream().mapToLong(RecordingChunk::getEndTs).max().getAsLong());
            batch.setStatus(AnalysisBatch.BatchStatus.PENDING);
            batch.getChunks().addAll(chunks);
            return Optional.of(batchRepository.save(batch));
        });
    }

    public Optional<AnalysisBatch> findBatch(Long batchId) {
        return batchRepository.findById(batchId);
    }

    public Optional<AnalysisBatch.BatchStatus> findBatchStatus(Long batchId) {
        return batchRepository.findStatusById(batchId);
    }

    public List<AnalysisBatch> listBatches(AnalysisBatch.BatchStatus status) {
        return status == null
                ? batchRepository.findAllByOrderByBatchStartTsDesc()
                : batchRepository.findByStatusOrderByBatchStartTsDesc(status);
    }

    public List<AnalysisBatch> findBatchesWithin(long from, long to) {
        return batchRepository.findByBatchStartTsGreaterThanEqualAndBatchEndTsLessThanEqualOrderByBatchStartTsAsc(from, to);
    }

    public List<AnalysisBatch> findBatches(Collection<Long> batchIds) {
        return batchRepository.findByIdInOrderByBatchStartTsAsc(batchIds);
    }

    public List<RecordingChunk> chunksForBatch(Long batchId) {
        return chunkRepository.findByBatchId(batchId);
    }

    public List<RecordingChunk> completedChunksOverlapping(long from, long to) {
        return chunkRepository.findOverlapping(from, to, ChunkStatus.COMPLETED);
    }

    public void updateBatchStatus(Long batchId, AnalysisBatch.BatchStatus status, String reason) {
        int updated = writer.write(tx -> batchRepository.updateStatus(batchId, status, reason));
        if (updated == 0) {
            log.warn("Batch {} vanished before status {} could be recorded", batchId, status.label());
        } else {
            log.info("Batch {} -> {}", batchId, status.label());
        }
    }

    /**
     * Batches left in PROCESSING by a previous process can never finish; mark them failed.
     */
    public int failInterruptedBatches() {
        return writer.write(status -> {
            List<AnalysisBatch> stuck = batchRepository.findByStatus(AnalysisBatch.BatchStatus.PROCESSING);
            for (AnalysisBatch batch : stuck) {
                batch.setStatus(AnalysisBatch.BatchStatus.FAILED);
                batch.setReason("Interrupted: service stopped while the batch was processing");
            }
            batchRepository.saveAll(stuck);
            return stuck.size();
        });
    }

    /**
     * Deletes a batch with its join rows, observations and cards. Its chunks become
     * unbatched again.
     */
    public void deleteBatch(Long batchId) {
        List<String> files = writer.write(status -> {
            AnalysisBatch batch = batchRepository.findById(batchId)
                    .orElseThrow(() -> new ResourceNotFoundException("Batch not found: " + batchId));
            List<TimelineCard> cards = cardRepository.findByBatchId(batchId);
            cardRepository.deleteAll(cards);
            observationRepository.deleteByBatchIds(List.of(batchId));
            batchRepository.delete(batch);
            return cards.stream().map(TimelineCard::getVideoSummaryUrl).filter(Objects::nonNull).toList();
        });
        log.info("Deleted batch {}", batchId);
        FileCleanup.deleteQuietly(files);
    }

    long diskUsage() {
        if (!Files.isDirectory(recordingsRoot)) {
            return 0;
        }
        try (Stream<Path> walk = Files.walk(recordingsRoot)) {
            return walk.filter(Files::isRegularFile).mapToLong(p -> {
                try {
                    return Files.size(p);
                } catch (IOException e) {
                    return 0; // removed mid-walk
                }
            }).sum();
        } catch (IOException | UncheckedIOException e) {
            log.warn("Could not measure {}: {}", recordingsRoot, e.getMessage());
            return 0;
        }
    }

    private void schedulePurge() {
        try {
            purgeExecutor.execute(() -> {
                try {
                    purgeIfNeeded();
                } catch (RuntimeException e) {
                    log.warn("Storage purge failed", e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Purge skipped, store shutting down");
        }
    }

    private RecordingChunk requireChunk(Long chunkId) {
        return chunkRepository.findById(chunkId)
                .orElseThrow(() -> new ResourceNotFoundException("Chunk not found: " + chunkId));
    }
}
