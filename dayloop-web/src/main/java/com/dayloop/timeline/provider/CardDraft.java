package com.dayloop.timeline.provider;

import com.dayloop.timeline.util.VideoTimestamps;

import java.util.List;

public record CardDraft(String start, String end, String category, String subcategory,
                        String title, String summary, String detailedSummary,
                        List<Distraction> distractions) {

    public record Distraction(String start, String end, String title, String summary) {
    }

    public int startSeconds() {
        return VideoTimestamps.parse(start);
    }

    public int endSeconds() {
        return VideoTimestamps.parse(end);
    }

    public int durationSeconds() {
        return endSeconds() - startSeconds();
    }

    public CardDraft withSpan(String newStart, String newEnd) {
        return new CardDraft(newStart, newEnd, category, subcategory, title, summary, detailedSummary, distractions);
    }
}
