package com.dayloop.timeline.provider;

import java.util.List;

/**
 * An analysis back-end. All times crossing this boundary are video-relative ("MM:SS" from
 * the batch's first chunk); the caller converts to and from wall-clock time.
 */
public interface LlmProvider {

    String name();

    String model();

    /**
     * Extracts observations from a batch's stitched video.
     */
    TranscriptionResult transcribe(BatchVideo video);

    /**
     * Builds the complete card set for the context window: the existing cards in
     * {@code context}, revised, merged or extended by what the observations show.
     */
    CardSynthesisResult synthesizeCards(List<ObservationDraft> observations, CardContext context);
}
