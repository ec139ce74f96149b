package com.dayloop.timeline.provider;

import com.dayloop.timeline.config.CategoryProperties;

import java.util.List;

/**
 * Prior cards of the sliding window (relative to this batch, so usually negative offsets),
 * the category taxonomy, and the batch's length.
 */
public record CardContext(Long batchId, long batchStartTs, long batchDurationSeconds,
                          List<CardDraft> existingCards,
                          List<CategoryProperties.Category> categories) {
}
