package com.dayloop.timeline.service;

import com.dayloop.timeline.dto.ReprocessSummary;
import com.dayloop.timeline.exception.ResourceNotFoundException;
import com.dayloop.timeline.model.AnalysisBatch;
import com.dayloop.timeline.model.AnalysisBatch.BatchStatus;
import com.dayloop.timeline.util.Durations;
import com.dayloop.timeline.util.LogicalDay;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Clears the analysis output of a logical day or a set of batches and runs those batches
 * again, one at a time, waiting for each to reach a terminal status.
 */
@Service
@Slf4j
public class ReprocessingService {

    private final ChunkStore chunkStore;
    private final TimelineStore timelineStore;
    private final AnalysisSchedulerService schedulerService;
    private final LogicalDay logicalDay;
    private final long pollIntervalMs;
    private final long batchTimeoutMs;

    private final Cache<String, ReprocessJob> jobs = Caffeine.newBuilder()
            .expireAfterWrite(1, TimeUnit.HOURS)
            .build();

    // Separate from the analysis worker: this thread blocks while batches run
    private final ExecutorService reprocessWorker = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "reprocess-worker");
        t.setDaemon(true);
        return t;
    });

    public ReprocessingService(ChunkStore chunkStore,
                               TimelineStore timelineStore,
                               AnalysisSchedulerService schedulerService,
                               LogicalDay logicalDay,
                               @Value("${dayloop.reprocess.poll-interval-ms:2000}") long pollIntervalMs,
                               @Value("${dayloop.reprocess.batch-timeout-seconds:1800}") long batchTimeoutSeconds) {
        this.chunkStore = chunkStore;
        this.timelineStore = timelineStore;
        this.schedulerService = schedulerService;
        this.logicalDay = logicalDay;
        this.pollIntervalMs = pollIntervalMs;
        this.batchTimeoutMs = batchTimeoutSeconds * 1000;
    }

    public ReprocessJob submitDay(LocalDate day) {
        return submit("day " + day, job -> reprocessDay(day, job::addProgress));
    }

    public ReprocessJob submitBatches(List<Long> batchIds) {
        if (chunkStore.findBatches(batchIds).isEmpty()) {
            throw new ResourceNotFoundException("No batches found for ids " + batchIds);
        }
        return submit("batches " + batchIds, job -> reprocessBatches(batchIds, job::addProgress));
    }

    public Optional<ReprocessJob> findJob(String jobId) {
        return Optional.ofNullable(jobs.getIfPresent(jobId));
    }

    private ReprocessJob submit(String target, Function<ReprocessJob, ReprocessSummary> work) {
        ReprocessJob job = new ReprocessJob(target);
        jobs.put(job.getId(), job);
        reprocessWorker.submit(() -> {
            try {
                job.finish(work.apply(job));
            } catch (Exception e) {
                log.error("Reprocessing {} failed", target, e);
                job.fail(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            }
        });
        log.info("Queued reprocessing job {} for {}", job.getId(), target);
        return job;
    }

    /**
     * Reprocesses every batch that lies within the logical day.
     */
    public ReprocessSummary reprocessDay(LocalDate day, Consumer<String> progress) {
        long dayStart = logicalDay.startOf(day);
        long dayEnd = logicalDay.endOf(day);
        List<AnalysisBatch> batches = chunkStore.findBatchesWithin(dayStart, dayEnd);
        List<Long> batchIds = batches.stream().map(AnalysisBatch::getId).toList();

        progress.accept("Found " + batchIds.size() + " batch(es) for " + day);
        TimelineStore.ReprocessCleanup cleanup = timelineStore.clearForReprocessing(dayStart, dayEnd, batchIds);
        progress.accept("Deleted " + cleanup.cardsDeleted() + " card(s) and "
                + cleanup.observationsDeleted() + " observation(s)");

        return runSequentially(batchIds, progress);
    }

    /**
     * Reprocesses the given batches. Cards of the first batch's logical day are cleared too.
     */
    public ReprocessSummary reprocessBatches(Collection<Long> requestedIds, Consumer<String> progress) {
        List<AnalysisBatch> batches = chunkStore.findBatches(requestedIds);
        if (batches.isEmpty()) {
            throw new ResourceNotFoundException("No batches found for ids " + requestedIds);
        }
        List<Long> batchIds = batches.stream().map(AnalysisBatch::getId).toList();
        LocalDate day = logicalDay.dayOf(batches.get(0).getBatchStartTs());

        progress.accept("Reprocessing " + batchIds.size() + " batch(es) on " + day);
        TimelineStore.ReprocessCleanup cleanup = timelineStore.clearForReprocessing(
                logicalDay.startOf(day), logicalDay.endOf(day), batchIds);
        progress.accept("Deleted " + cleanup.cardsDeleted() + " card(s) and "
                + cleanup.observationsDeleted() + " observation(s)");

        return runSequentially(batchIds, progress);
    }

    ReprocessSummary runSequentially(List<Long> batchIds, Consumer<String> progress) {
        if (batchIds.isEmpty()) {
            progress.accept("Nothing to reprocess");
            return ReprocessSummary.empty();
        }

        long startedAt = System.nanoTime();
        int processed = 0;
        List<ReprocessSummary.BatchTiming> timings = new ArrayList<>();

        for (int i = 0; i < batchIds.size(); i++) {
            Long batchId = batchIds.get(i);
            int n = i + 1;
            Duration elapsedTotal = Duration.ofNanos(System.nanoTime() - startedAt);
            progress.accept("Processing batch " + n + " of " + batchIds.size()
                    + "... (Total elapsed: " + Durations.humanize(elapsedTotal) + ")");

            long batchStartedAt = System.nanoTime();
            schedulerService.queueBatch(batchId);
            String status = awaitTerminal(batchId);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - batchStartedAt);

            timings.add(new ReprocessSummary.BatchTiming(batchId, status, elapsed));
            if (BatchStatus.COMPLETED.label().equals(status)) {
                processed++;
                progress.accept("✓ Batch " + n + " completed in " + Durations.humanize(elapsed));
            } else {
                progress.accept("⚠️ Batch " + n + " ended with status '" + status + "' after " + Durations.humanize(elapsed));
            }
        }

        ReprocessSummary summary = new ReprocessSummary(batchIds.size(), processed,
                Duration.ofNanos(System.nanoTime() - startedAt), timings);
        progress.accept(summary.render());
        log.info("Reprocessed {} batch(es), {} completed", batchIds.size(), processed);
        return summary;
    }

    private String awaitTerminal(Long batchId) {
        long deadline = System.currentTimeMillis() + batchTimeoutMs;
        while (true) {
            try {
                Thread.sleep(pollIntervalMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return "interrupted";
            }
            Optional<BatchStatus> status = chunkStore.findBatchStatus(batchId);
            if (status.isEmpty()) {
                return "deleted";
            }
            if (status.get().isTerminal()) {
                return status.get().label();
            }
            if (System.currentTimeMillis() > deadline) {
                log.warn("Gave up waiting for batch {} (still {})", batchId, status.get().label());
                return "timed out";
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        reprocessWorker.shutdownNow();
    }
}
