package com.dayloop.timeline.provider;

import com.dayloop.timeline.model.LlmCall;

import java.util.List;

public record CardSynthesisResult(List<CardDraft> cards, List<LlmCall> calls) {
}
