package com.dayloop.timeline.provider;

public record ObservationDraft(String start, String end, String description) {
}
