package com.dayloop.timeline.provider;

import com.dayloop.timeline.exception.ProviderException;
import com.dayloop.timeline.util.VideoTimestamps;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Checks a synthesized card list before it replaces the sliding window. The returned cards
 * must still cover the time of the existing cards, and every card but the last must be long
 * enough to read as an activity rather than a blip.
 */
final class CardTimelineValidator {

    static final int COVERAGE_SLACK_SECONDS = 180;
    static final int MIN_CARD_SECONDS = 600;

    private CardTimelineValidator() {
    }

    static void validate(List<CardDraft> existing, List<CardDraft> cards) {
        if (cards.isEmpty()) {
            throw new ProviderException("Card synthesis returned no cards");
        }
        validateCoverage(existing, cards);
        validateDurations(cards);
    }

    static void validateCoverage(List<CardDraft> existing, List<CardDraft> cards) {
        if (existing.isEmpty()) {
            return;
        }
        List<int[]> covered = cards.stream()
                .filter(c -> c.durationSeconds() > 0)
                .map(c -> new int[]{c.startSeconds(), c.endSeconds()})
                .sorted(Comparator.comparingInt(r -> r[0]))
                .toList();

        List<String> gaps = new ArrayList<>();
        for (int[] range : merge(existing)) {
            int cursor = range[0];
            for (int[] out : covered) {
                if (out[1] <= cursor) {
                    continue;
                }
                if (out[0] >= range[1]) {
                    break;
                }
                if (out[0] > cursor) {
                    addGap(gaps, cursor, out[0]);
                }
                cursor = out[1];
                if (cursor >= range[1]) {
                    break;
                }
            }
            if (cursor < range[1]) {
                addGap(gaps, cursor, range[1]);
            }
        }
        if (!gaps.isEmpty()) {
            throw new ProviderException("Cards no longer cover existing timeline: missing " + String.join(", ", gaps));
        }
    }

    static void validateDurations(List<CardDraft> cards) {
        for (int i = 0; i < cards.size() - 1; i++) {
            CardDraft card = cards.get(i);
            if (card.durationSeconds() < MIN_CARD_SECONDS) {
                throw new ProviderException("Card " + (i + 1) + " '" + card.title() + "' is only "
                        + VideoTimestamps.format(card.durationSeconds()) + " long; only the last card may be under "
                        + (MIN_CARD_SECONDS / 60) + " minutes");
            }
        }
    }

    // Overlapping or touching ranges of the existing cards collapse into one
    private static List<int[]> merge(List<CardDraft> existing) {
        List<int[]> sorted = existing.stream()
                .map(c -> new int[]{c.startSeconds(), c.endSeconds()})
                .filter(r -> r[1] > r[0])
                .sorted(Comparator.comparingInt(r -> r[0]))
                .toList();
        List<int[]> merged = new ArrayList<>();
        for (int[] r : sorted) {
            int[] last = merged.isEmpty() ? null : merged.get(merged.size() - 1);
            if (last != null && r[0] <= last[1]) {
                last[1] = Math.max(last[1], r[1]);
            } else {
                merged.add(new int[]{r[0], r[1]});
            }
        }
        return merged;
    }

    private static void addGap(List<String> gaps, int from, int to) {
        if (to - from > COVERAGE_SLACK_SECONDS) {
            gaps.add(VideoTimestamps.format(from) + " - " + VideoTimestamps.format(to));
        }
    }
}
