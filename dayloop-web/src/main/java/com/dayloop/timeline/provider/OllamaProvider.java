package com.dayloop.timeline.provider;

import com.dayloop.timeline.exception.ProviderException;
import com.dayloop.timeline.model.LlmCall;
import com.dayloop.timeline.service.VideoProcessingService;
import com.dayloop.timeline.util.FileCleanup;
import com.dayloop.timeline.util.VideoTimestamps;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Decomposed provider for a local vision model: one call per sampled frame, a merge call
 * that folds frame descriptions into observations, then title/summary and merge-decision
 * calls when building cards.
 */
@Service
@ConditionalOnProperty(name = "dayloop.provider.type", havingValue = "ollama")
@Slf4j
public class OllamaProvider implements LlmProvider {

    private static final String NAME = "ollama";
    private static final int FRAME_MERGE_TOLERANCE_SECONDS = 30;
    private static final int MAX_LAST_CARD_SECONDS = 40 * 60;
    private static final int MAX_MERGE_GAP_SECONDS = 5 * 60;
    private static final int MAX_MERGED_CARD_SECONDS = 60 * 60;
    private static final double MIN_MERGE_CONFIDENCE = 0.8;

    private final ObjectMapper objectMapper;
    private final VideoProcessingService videoProcessingService;
    private final String baseUrl;
    private final String model;
    private final int frameIntervalSeconds;
    private final ProviderHttpClient http;
    private final RetryPolicy retryPolicy;

    public OllamaProvider(RestTemplate restTemplate,
                          ObjectMapper objectMapper,
                          LlmCallRecorder recorder,
                          VideoProcessingService videoProcessingService,
                          @Value("${dayloop.provider.ollama.base-url:http://localhost:11434}") String baseUrl,
                          @Value("${dayloop.provider.ollama.model:qwen2.5vl:3b}") String model,
                          @Value("${dayloop.provider.ollama.frame-interval-seconds:60}") int frameIntervalSeconds,
                          @Value("${dayloop.provider.max-attempts:3}") int maxAttempts,
                          @Value("${dayloop.provider.retry-backoff-ms:1000}") long retryBackoffMs) {
        this.objectMapper = objectMapper;
        this.videoProcessingService = videoProcessingService;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model = model;
        this.frameIntervalSeconds = frameIntervalSeconds;
        this.http = new ProviderHttpClient(restTemplate, objectMapper, recorder, NAME, model);
        this.retryPolicy = new RetryPolicy(maxAttempts, Duration.ofMillis(retryBackoffMs));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String model() {
        return model;
    }

    @Override
    public TranscriptionResult transcribe(BatchVideo video) {
        List<LlmCall> calls = new ArrayList<>();
        String group = UUID.randomUUID().toString();
        Path framesDir = video.file().toAbsolutePath().resolveSibling("frames-" + video.batchId());

        try {
            List<Path> frames = videoProcessingService.sampleFrames(video.file(), frameIntervalSeconds, framesDir);
            if (frames.isEmpty()) {
                throw new ProviderException("No frames could be sampled from the batch video");
            }

            StringBuilder descriptions = new StringBuilder();
            for (int i = 0; i < frames.size(); i++) {
                long offset = (long) i * frameIntervalSeconds;
                if (offset > video.durationSeconds()) {
                    break;
                }
                String image = encode(frames.get(i));
                String description = retryPolicy.execute("describe-frame", attempt ->
                        http.call(generateSpec(video.batchId(), group, attempt, "describe-frame",
                                describeFramePrompt(), image), this::responseText, calls));
                descriptions.append('[').append(VideoTimestamps.format(offset)).append("] ").append(description).append('\n');
            }

            String mergePrompt = mergeFramesPrompt(descriptions.toString(), video.durationSeconds());
            List<ObservationDraft> observations = retryPolicy.execute("merge-frames", attempt ->
                    http.call(generateSpec(video.batchId(), group, attempt, "merge-frames", mergePrompt, null), response -> {
                        List<ObservationDraft> parsed = ProviderJson.observations(
                                ProviderJson.readModelJson(objectMapper, responseText(response)));
                        validateObservations(parsed, video.durationSeconds());
                        return parsed;
                    }, calls));

            log.info("Ollama described {} frames of batch {} as {} observations",
                    frames.size(), video.batchId(), observations.size());
            return new TranscriptionResult(observations, calls);
        } finally {
            FileCleanup.deleteTree(framesDir);
        }
    }

    @Override
    public CardSynthesisResult synthesizeCards(List<ObservationDraft> observations, CardContext context) {
        List<LlmCall> calls = new ArrayList<>();
        List<CardDraft> result = new ArrayList<>(context.existingCards());
        if (observations.isEmpty()) {
            return new CardSynthesisResult(result, calls);
        }
        String group = UUID.randomUUID().toString();

        // Observations before this batch (negative offsets) are context only
        List<ObservationDraft> current = observations.stream()
                .filter(o -> VideoTimestamps.parse(o.start()) >= 0)
                .toList();
        if (current.isEmpty()) {
            current = observations;
        }
        String start = current.get(0).start();
        String end = current.get(current.size() - 1).end();

        String summaryPrompt = titleSummaryPrompt(current, context);
        CardDraft card = retryPolicy.execute("title-summary", attempt ->
                http.call(generateSpec(context.batchId(), group, attempt, "title-summary", summaryPrompt, null),
                        response -> ProviderJson.card(ProviderJson.readModelJson(objectMapper, responseText(response)), start, end),
                        calls)).withSpan(start, end);

        CardDraft last = context.existingCards().stream()
                .max(Comparator.comparingInt(CardDraft::endSeconds))
                .orElse(null);

        if (last != null && withinMergeLimits(last, card) && shouldMerge(last, card, context.batchId(), group, calls)) {
            CardDraft merged = mergeCards(last, card, context.batchId(), group, calls);
            if (merged.durationSeconds() <= MAX_MERGED_CARD_SECONDS) {
                result.remove(last);
                result.add(merged);
                return new CardSynthesisResult(result, calls);
            }
            log.info("Discarding merge of '{}' and '{}': {} exceeds an hour",
                    last.title(), card.title(), VideoTimestamps.format(merged.durationSeconds()));
        }

        result.add(card);
        return new CardSynthesisResult(result, calls);
    }

    static boolean withinMergeLimits(CardDraft last, CardDraft next) {
        int gap = next.startSeconds() - last.endSeconds();
        int combined = Math.max(last.endSeconds(), next.endSeconds()) - Math.min(last.startSeconds(), next.startSeconds());
        return last.durationSeconds() < MAX_LAST_CARD_SECONDS
                && gap <= MAX_MERGE_GAP_SECONDS
                && combined <= MAX_MERGED_CARD_SECONDS;
    }

    private boolean shouldMerge(CardDraft last, CardDraft next, Long batchId, String group, List<LlmCall> calls) {
        String prompt = "Two consecutive activity cards from one person's timeline:\n\n"
                + "A: " + describe(last) + "\n"
                + "B: " + describe(next) + "\n\n"
                + "Is B a continuation of the same activity as A, so they belong in one card? "
                + "Return only JSON: {\"combine\": true|false, \"confidence\": 0.0-1.0, \"reason\": \"...\"}";
        JsonNode decision = retryPolicy.execute("merge-decision", attempt ->
                http.call(generateSpec(batchId, group, attempt, "merge-decision", prompt, null),
                        response -> ProviderJson.readModelJson(objectMapper, responseText(response)), calls));

        boolean combine = decision.path("combine").asBoolean(false);
        double confidence = decision.path("confidence").asDouble(0);
        log.debug("Merge decision for '{}' + '{}': combine={} confidence={}", last.title(), next.title(), combine, confidence);
        return combine && confidence >= MIN_MERGE_CONFIDENCE;
    }

    private CardDraft mergeCards(CardDraft last, CardDraft next, Long batchId, String group, List<LlmCall> calls) {
        String start = VideoTimestamps.format(Math.min(last.startSeconds(), next.startSeconds()));
        String end = VideoTimestamps.format(Math.max(last.endSeconds(), next.endSeconds()));
        String prompt = "Combine these two activity cards into one card covering " + start + " to " + end + ":\n\n"
                + "A: " + describe(last) + "\n"
                + "B: " + describe(next) + "\n\n"
                + "Return only JSON: {\"startTime\", \"endTime\", \"category\", \"subcategory\", \"title\", \"summary\", \"detailedSummary\"}";
        CardDraft merged = retryPolicy.execute("merge-cards", attempt ->
                http.call(generateSpec(batchId, group, attempt, "merge-cards", prompt, null),
                        response -> ProviderJson.card(ProviderJson.readModelJson(objectMapper, responseText(response)), start, end),
                        calls));
        List<CardDraft.Distraction> distractions = new ArrayList<>(last.distractions());
        distractions.addAll(next.distractions());
        return new CardDraft(merged.start(), merged.end(), merged.category(), merged.subcategory(), merged.title(),
                merged.summary(), merged.detailedSummary(), distractions);
    }

    private CallSpec generateSpec(Long batchId, String group, int attempt, String operation, String prompt, String image) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("prompt", prompt);
        body.put("stream", false);
        body.put("options", Map.of("temperature", 0.2));
        if (image != null) {
            body.put("images", List.of(image));
        } else {
            body.put("format", "json");
        }
        return new CallSpec(batchId, group, attempt, operation, HttpMethod.POST, baseUrl + "/api/generate", headers, body);
    }

    private String responseText(ResponseEntity<String> response) {
        try {
            String text = objectMapper.readTree(response.getBody() == null ? "{}" : response.getBody())
                    .path("response").asText("");
            if (text.isBlank()) {
                throw new ProviderException("Ollama returned an empty response");
            }
            return text.trim();
        } catch (JsonProcessingException e) {
            throw new ProviderException("Ollama returned invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private void validateObservations(List<ObservationDraft> observations, long durationSeconds) {
        if (observations.isEmpty()) {
            throw new ProviderException("Frame merge returned no observations");
        }
        for (ObservationDraft o : observations) {
            if (VideoTimestamps.parse(o.end()) > durationSeconds + FRAME_MERGE_TOLERANCE_SECONDS) {
                throw new ProviderException("Observation " + o.start() + " - " + o.end()
                        + " runs past the video (" + VideoTimestamps.format(durationSeconds) + " long)");
            }
        }
    }

    private static String encode(Path frame) {
        try {
            return Base64.getEncoder().encodeToString(Files.readAllBytes(frame));
        } catch (IOException e) {
            throw new ProviderException("Cannot read frame " + frame.getFileName() + ": " + e.getMessage(), e);
        }
    }

    private static String describe(CardDraft card) {
        return "[" + card.start() + " - " + card.end() + "] " + card.title()
                + (card.category() != null ? " (" + card.category() + ")" : "")
                + (card.summary() != null ? ": " + card.summary() : "");
    }

    private static String describeFramePrompt() {
        return "Describe what this person is doing on their computer in this screenshot, in one or two sentences. "
                + "Name the application, site or document and what they are working on.";
    }

    private static String mergeFramesPrompt(String descriptions, long durationSeconds) {
        String length = VideoTimestamps.format(durationSeconds);
        return "These are descriptions of screenshots taken at the given MM:SS offsets of a " + length + " recording:\n\n"
                + descriptions + "\n"
                + "Group consecutive screenshots showing the same activity into segments. Segments are contiguous, "
                + "use MM:SS offsets and do not go past " + length + ".\n\n"
                + "Return only JSON: {\"observations\": [{\"startTimestamp\", \"endTimestamp\", \"description\"}]}";
    }

    private static String titleSummaryPrompt(List<ObservationDraft> observations, CardContext context) {
        return "Summarize this stretch of computer activity as one timeline card.\n\n"
                + "Activity:\n" + ProviderJson.observationLines(observations) + "\n"
                + "Categories (use the name exactly):\n" + ProviderJson.categoryLines(context.categories()) + "\n"
                + "Return only JSON: {\"title\": short title, \"summary\": one or two sentences, "
                + "\"category\", \"subcategory\", \"detailedSummary\": minute-by-minute notes}";
    }
}
