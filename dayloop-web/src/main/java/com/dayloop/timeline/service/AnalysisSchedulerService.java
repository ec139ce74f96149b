package com.dayloop.timeline.service;

import com.dayloop.timeline.exception.ProviderException;
import com.dayloop.timeline.model.AnalysisBatch;
import com.dayloop.timeline.model.AnalysisBatch.BatchStatus;
import com.dayloop.timeline.model.LlmCall;
import com.dayloop.timeline.model.Observation;
import com.dayloop.timeline.model.RecordingChunk;
import com.dayloop.timeline.model.TimelineCard;
import com.dayloop.timeline.provider.BatchVideo;
import com.dayloop.timeline.provider.CardContext;
import com.dayloop.timeline.provider.CardDraft;
import com.dayloop.timeline.provider.CardSynthesisResult;
import com.dayloop.timeline.provider.LlmProvider;
import com.dayloop.timeline.provider.ObservationDraft;
import com.dayloop.timeline.provider.TranscriptionResult;
import com.dayloop.timeline.util.FileCleanup;
import com.dayloop.timeline.util.LogicalDay;
import com.dayloop.timeline.util.VideoTimestamps;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Drives chunks through batching, transcription and card synthesis.
 *
 * <p>All pipeline work runs on one worker thread. A run is skipped while another is in
 * flight; the guard is per process.
 */
@Service
@Slf4j
public class AnalysisSchedulerService {

    private final ChunkStore chunkStore;
    private final TimelineStore timelineStore;
    private final BatchBuilder batchBuilder;
    private final LlmProvider provider;
    private final VideoProcessingService videoProcessingService;
    private final TimelapseService timelapseService;
    private final CategoryTaxonomy categoryTaxonomy;
    private final LogicalDay logicalDay;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final long lookbackSeconds;
    private final long slidingWindowSeconds;

    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "analysis-worker");
        t.setDaemon(true);
        return t;
    });
    private final AtomicBoolean running = new AtomicBoolean(false);

    public AnalysisSchedulerService(ChunkStore chunkStore,
                                    TimelineStore timelineStore,
                                    BatchBuilder batchBuilder,
                                    LlmProvider provider,
                                    VideoProcessingService videoProcessingService,
                                    TimelapseService timelapseService,
                                    CategoryTaxonomy categoryTaxonomy,
                                    LogicalDay logicalDay,
                                    ObjectMapper objectMapper,
                                    Clock clock,
                                    @Value("${dayloop.analysis.lookback-seconds:86400}") long lookbackSeconds,
                                    @Value("${dayloop.analysis.sliding-window-seconds:3600}") long slidingWindowSeconds) {
        this.chunkStore = chunkStore;
        this.timelineStore = timelineStore;
        this.batchBuilder = batchBuilder;
        this.provider = provider;
        this.videoProcessingService = videoProcessingService;
        this.timelapseService = timelapseService;
        this.categoryTaxonomy = categoryTaxonomy;
        this.logicalDay = logicalDay;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.lookbackSeconds = lookbackSeconds;
        this.slidingWindowSeconds = slidingWindowSeconds;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void recoverInterruptedBatches() {
        int failed = chunkStore.failInterruptedBatches();
        if (failed > 0) {
            log.warn("Marked {} batch(es) interrupted by the last shutdown as failed", failed);
        }
    }

    /**
     * Entry point for the recurring job.
     */
    public void runScheduledAnalysis() {
        if (!triggerAnalysisNow()) {
            log.debug("Analysis run already in progress, skipping tick");
        }
    }

    /**
     * Queues a run unless one is already in flight.
     *
     * @return false if a run was already in progress
     */
    public boolean triggerAnalysisNow() {
        if (!running.compareAndSet(false, true)) {
            return false;
        }
        try {
            worker.submit(() -> {
                try {
                    runOnce();
                } catch (Exception e) {
                    log.error("Analysis run failed", e);
                } finally {
                    running.set(false);
                }
            });
        } catch (RuntimeException e) {
            running.set(false);
            throw e;
        }
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Builds batches from unbatched chunks inside the lookback window and processes each
     * new batch in time order.
     */
    public void runOnce() {
        long cutoff = clock.instant().getEpochSecond() - lookbackSeconds;
        List<RecordingChunk> chunks = chunkStore.fetchUnprocessedChunks(cutoff);
        if (chunks.isEmpty()) {
            log.debug("No unprocessed chunks since {}", cutoff);
            return;
        }

        List<BatchBuilder.BatchDraft> drafts = batchBuilder.build(chunks);
        log.info("Built {} batch(es) from {} unprocessed chunk(s)", drafts.size(), chunks.size());

        List<Long> batchIds = new ArrayList<>();
        for (BatchBuilder.BatchDraft draft : drafts) {
            chunkStore.saveBatch(draft).ifPresent(batch -> batchIds.add(batch.getId()));
        }
        for (Long batchId : batchIds) {
            processBatch(batchId);
        }
    }

    /**
     * Runs one batch on the worker thread, after any run already queued there.
     */
    public Future<?> queueBatch(Long batchId) {
        return worker.submit(() -> processBatch(batchId));
    }

    /**
     * Takes a batch from pending to a terminal status. Never throws; any failure ends in
     * {@code failed} with the underlying message as the reason.
     */
    public void processBatch(Long batchId) {
        AnalysisBatch batch = chunkStore.findBatch(batchId).orElse(null);
        if (batch == null) {
            log.warn("Batch {} no longer exists, skipping", batchId);
            return;
        }

        Path workDir = null;
        try {
            List<RecordingChunk> chunks = chunkStore.chunksForBatch(batchId);
            if (chunks.isEmpty()) {
                chunkStore.updateBatchStatus(batchId, BatchStatus.FAILED_EMPTY, "No chunks found for batch");
                return;
            }
            long duration = chunks.stream().mapToLong(RecordingChunk::getDurationSeconds).sum();
            if (batchBuilder.isBelowMinimum(duration)) {
                chunkStore.updateBatchStatus(batchId, BatchStatus.SKIPPED_SHORT,
                        "Batch is " + duration + "s, below the " + batchBuilder.getMinBatchSeconds() + "s minimum");
                return;
            }

            chunkStore.updateBatchStatus(batchId, BatchStatus.PROCESSING, null);
            long batchStart = batch.getBatchStartTs();
            long batchEnd = batch.getBatchEndTs();

            workDir = Files.createTempDirectory("batch_" + batchId + "_");
            List<Path> inputs = chunks.stream().map(c -> Paths.get(c.getFilePath())).toList();
            Path video = videoProcessingService.stitch(inputs, workDir.resolve("batch.mp4"));

            TranscriptionResult transcription = provider.transcribe(new BatchVideo(batchId, video, duration, batchStart));
            List<Observation> observations = toObservations(batchId, transcription.observations(), batchStart, batchEnd);
            timelineStore.saveObservations(observations);
            log.info("Batch {}: {} observation(s) from {}", batchId, observations.size(), provider.name());

            if (observations.isEmpty()) {
                chunkStore.updateBatchStatus(batchId, BatchStatus.COMPLETED, "No activity observed");
                return;
            }

            long windowStart = batchEnd - slidingWindowSeconds;
            List<TimelineCard> existing = timelineStore.cardsOverlapping(windowStart, batchEnd);
            List<ObservationDraft> recent = timelineStore.observationsInRange(windowStart, batchEnd).stream()
                    .map(o -> new ObservationDraft(
                            VideoTimestamps.toRelative(o.getStartTs(), batchStart),
                            VideoTimestamps.toRelative(o.getEndTs(), batchStart),
                            o.getObservation()))
                    .toList();
            CardContext context = new CardContext(batchId, batchStart, duration,
                    existing.stream().map(c -> toDraft(c, batchStart)).toList(),
                    categoryTaxonomy.categories());

            CardSynthesisResult synthesis = provider.synthesizeCards(recent, context);
            List<TimelineCard> cards = toCards(batchId, synthesis.cards(), existing, batchStart, batchEnd);
            if (cards.isEmpty() && !existing.isEmpty()) {
                // An empty set would wipe the window
                throw new ProviderException("No synthesized card fell within the batch; kept "
                        + existing.size() + " existing card(s)");
            }

            String callSummary = callSummary(transcription.calls(), synthesis.calls());
            List<TimelineCard> saved = timelineStore.replaceCardsInRange(batchId, windowStart, batchEnd, cards, callSummary);

            List<TimelineCard> needVideo = saved.stream().filter(c -> c.getVideoSummaryUrl() == null).toList();
            if (!needVideo.isEmpty()) {
                timelapseService.generateTimelapses(needVideo);
            }
        } catch (Exception e) {
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("Batch {} failed: {}", batchId, reason, e);
            try {
                chunkStore.updateBatchStatus(batchId, BatchStatus.FAILED, reason);
            } catch (Exception statusError) {
                log.error("Could not record failure for batch {}", batchId, statusError);
            }
        } finally {
            FileCleanup.deleteTree(workDir);
        }
    }

    private List<Observation> toObservations(Long batchId, List<ObservationDraft> drafts, long batchStart, long batchEnd) {
        List<Observation> result = new ArrayList<>();
        for (ObservationDraft draft : drafts) {
            long start = clamp(VideoTimestamps.toAbsolute(draft.start(), batchStart), batchStart, batchEnd);
            long end = clamp(VideoTimestamps.toAbsolute(draft.end(), batchStart), batchStart, batchEnd);
            if (end < start) {
                continue;
            }
            result.add(new Observation(batchId, start, end, draft.description(), provider.model()));
        }
        return result;
    }

    private List<TimelineCard> toCards(Long batchId, List<CardDraft> drafts, List<TimelineCard> existing,
                                       long batchStart, long batchEnd) throws JsonProcessingException {
        List<TimelineCard> result = new ArrayList<>();
        for (CardDraft draft : drafts) {
            long start = VideoTimestamps.toAbsolute(draft.start(), batchStart);
            long end = Math.min(VideoTimestamps.toAbsolute(draft.end(), batchStart), batchEnd);
            if (end <= start) {
                log.debug("Dropping card '{}' with empty span", draft.title());
                continue;
            }

            TimelineCard card = new TimelineCard();
            card.setBatchId(batchId);
            card.setStartTs(start);
            card.setEndTs(end);
            card.setStartClock(logicalDay.clockOf(start));
            card.setEndClock(logicalDay.clockOf(end));
            card.setDay(logicalDay.labelOf(start));
            card.setTitle(draft.title());
            card.setDescription(draft.summary());
            card.setDetailedSummary(draft.detailedSummary());
            card.setCategory(categoryTaxonomy.normalize(draft.category()));
            card.setSubcategory(draft.subcategory());
            card.setMetadata(cardMetadata(draft, batchStart));

            existing.stream()
                    .filter(e -> e.getStartTs() == start && e.getEndTs() == end && Objects.equals(e.getTitle(), draft.title()))
                    .findFirst()
                    .ifPresent(previous -> {
                        card.setBatchId(previous.getBatchId());
                        card.setVideoSummaryUrl(previous.getVideoSummaryUrl());
                    });
            result.add(card);
        }
        return result;
    }

    private CardDraft toDraft(TimelineCard card, long batchStart) {
        List<CardDraft.Distraction> distractions = new ArrayList<>();
        if (card.getMetadata() != null) {
            try {
                for (JsonNode d : objectMapper.readTree(card.getMetadata()).path("distractions")) {
                    distractions.add(new CardDraft.Distraction(
                            VideoTimestamps.toRelative(d.path("startTs").asLong(), batchStart),
                            VideoTimestamps.toRelative(d.path("endTs").asLong(), batchStart),
                            d.path("title").asText(""),
                            d.path("summary").asText("")));
                }
            } catch (JsonProcessingException e) {
                log.warn("Ignoring unreadable metadata on card {}: {}", card.getId(), e.getOriginalMessage());
            }
        }
        return new CardDraft(
                VideoTimestamps.toRelative(card.getStartTs(), batchStart),
                VideoTimestamps.toRelative(card.getEndTs(), batchStart),
                card.getCategory(), card.getSubcategory(), card.getTitle(),
                card.getDescription(), card.getDetailedSummary(), distractions);
    }

    private String cardMetadata(CardDraft draft, long batchStart) throws JsonProcessingException {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode distractions = root.putArray("distractions");
        if (draft.distractions() != null) {
            for (CardDraft.Distraction d : draft.distractions()) {
                distractions.addObject()
                        .put("startTs", VideoTimestamps.toAbsolute(d.start(), batchStart))
                        .put("endTs", VideoTimestamps.toAbsolute(d.end(), batchStart))
                        .put("title", d.title())
                        .put("summary", d.summary());
            }
        }
        return objectMapper.writeValueAsString(root);
    }

    private String callSummary(List<LlmCall> transcriptionCalls, List<LlmCall> synthesisCalls) throws JsonProcessingException {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("provider", provider.name());
        root.put("model", provider.model());
        root.put("transcriptionCalls", transcriptionCalls.size());
        root.put("synthesisCalls", synthesisCalls.size());
        root.put("failedAttempts", Stream.concat(transcriptionCalls.stream(), synthesisCalls.stream())
                .filter(c -> c.getStatus() == LlmCall.CallStatus.FAILURE)
                .count());
        return objectMapper.writeValueAsString(root);
    }

    private static long clamp(long value, long min, long max) {
        return Math.max(min, Math.min(max, value));
    }

    @PreDestroy
    public void shutdown() {
        worker.shutdownNow();
    }
}
