package com.dayloop.timeline.provider;

import com.dayloop.timeline.model.LlmCall;

import java.util.List;

public record TranscriptionResult(List<ObservationDraft> observations, List<LlmCall> calls) {
}
