package com.dayloop.timeline.service;

import com.dayloop.timeline.exception.ResourceNotFoundException;
import com.dayloop.timeline.model.AnalysisBatch;
import com.dayloop.timeline.model.Observation;
import com.dayloop.timeline.model.TimelineCard;
import com.dayloop.timeline.repository.AnalysisBatchRepository;
import com.dayloop.timeline.repository.ObservationRepository;
import com.dayloop.timeline.repository.TimelineCardRepository;
import com.dayloop.timeline.util.FileCleanup;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Analysis outputs: observations and timeline cards. Writes share the chunk store's writer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TimelineStore {

    private final ObservationRepository observationRepository;
    private final TimelineCardRepository cardRepository;
    private final AnalysisBatchRepository batchRepository;
    private final StoreWriter writer;

    public List<Observation> saveObservations(List<Observation> observations) {
        if (observations.isEmpty()) {
            return List.of();
        }
        return writer.write(status -> observationRepository.saveAll(observations));
    }

    public List<Observation> observationsInRange(long from, long to) {
        return observationRepository.findInRange(from, to);
    }

    public List<TimelineCard> cardsOverlapping(long from, long to) {
        return cardRepository.findOverlapping(from, to);
    }

    public List<TimelineCard> cardsForDay(String day) {
        return cardRepository.findByDayOrderByStartTsAsc(day);
    }

    /**
     * Swaps every card overlapping {@code [from, to)} for the newly synthesized set and marks
     * the batch completed, in one transaction. Timelapse files of the replaced cards are
     * removed after commit.
     */
    public List<TimelineCard> replaceCardsInRange(Long batchId, long from, long to,
                                                  List<TimelineCard> cards, String llmMetadata) {
        Replacement replacement = writer.write(status -> {
            AnalysisBatch batch = batchRepository.findById(batchId)
                    .orElseThrow(() -> new ResourceNotFoundException("Batch not found: " + batchId));
            List<TimelineCard> previous = cardRepository.findOverlapping(from, to);
            cardRepository.deleteAll(previous);
            cardRepository.flush();

            List<TimelineCard> saved = cardRepository.saveAll(cards);

            batch.setStatus(AnalysisBatch.BatchStatus.COMPLETED);
            batch.setReason(null);
            batch.setLlmMetadata(llmMetadata);
            batchRepository.save(batch);
            // Unchanged cards keep their timelapse; only orphaned files go
            Set<String> kept = new HashSet<>(videoFiles(saved));
            List<String> stale = videoFiles(previous).stream().filter(f -> !kept.contains(f)).toList();
            return new Replacement(saved, previous.size(), stale);
        });

        log.info("Batch {}: replaced {} cards with {}", batchId, replacement.replaced(), replacement.saved().size());
        FileCleanup.deleteQuietly(replacement.staleFiles());
        return replacement.saved();
    }

    public boolean attachTimelapse(Long cardId, String videoPath) {
        return writer.write(status -> cardRepository.updateVideoSummaryUrl(cardId, videoPath) > 0);
    }

    /** Unlinks cards from timelapse files that are about to be evicted. */
    public int detachTimelapses(Collection<String> videoPaths) {
        if (videoPaths.isEmpty()) {
            return 0;
        }
        return writer.write(status -> cardRepository.clearVideoSummaryUrls(videoPaths));
    }

    /**
     * Removes the cards of a logical day (plus any card owned by one of the batches),
     * the batches' observations, and resets the batches to pending.
     */
    public ReprocessCleanup clearForReprocessing(long dayStart, long dayEnd, Collection<Long> batchIds) {
        ReprocessCleanup cleanup = writer.write(status -> {
            List<TimelineCard> cards = batchIds.isEmpty()
                    ? cardRepository.findByStartTsGreaterThanEqualAndStartTsLessThan(dayStart, dayEnd)
                    : cardRepository.findForReprocessing(dayStart, dayEnd, batchIds);
            cardRepository.deleteAll(cards);
            cardRepository.flush();

            int observations = 0;
            if (!batchIds.isEmpty()) {
                observations = observationRepository.deleteByBatchIds(batchIds);
                batchRepository.resetStatus(batchIds, AnalysisBatch.BatchStatus.PENDING);
            }
            return new ReprocessCleanup(cards.size(), observations, videoFiles(cards));
        });

        FileCleanup.deleteQuietly(cleanup.videoFiles());
        return cleanup;
    }

    private static List<String> videoFiles(List<TimelineCard> cards) {
        return cards.stream().map(TimelineCard::getVideoSummaryUrl).filter(Objects::nonNull).toList();
    }

    private record Replacement(List<TimelineCard> saved, int replaced, List<String> staleFiles) {
    }

    public record ReprocessCleanup(int cardsDeleted, int observationsDeleted, List<String> videoFiles) {
    }
}
