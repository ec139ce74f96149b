package com.dayloop.timeline.provider;

import com.dayloop.timeline.exception.ProviderException;
import com.dayloop.timeline.model.LlmCall;
import com.dayloop.timeline.util.VideoTimestamps;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Holistic provider: the whole batch video goes up once through the resumable upload
 * protocol, then one call transcribes it and one call synthesizes cards.
 */
@Service
@ConditionalOnProperty(name = "dayloop.provider.type", havingValue = "gemini", matchIfMissing = true)
@Slf4j
public class GeminiDirectProvider implements LlmProvider {

    private static final String NAME = "gemini";
    private static final int DURATION_TOLERANCE_SECONDS = 120;
    private static final String UPLOAD_URL_HEADER = "X-Goog-Upload-URL";
    private static final String API_KEY_HEADER = "x-goog-api-key";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String model;
    private final String baseUrl;
    private final ProviderHttpClient http;
    private final RetryPolicy retryPolicy;
    private final FileStatePoller poller;

    public GeminiDirectProvider(RestTemplate restTemplate,
                                ObjectMapper objectMapper,
                                LlmCallRecorder recorder,
                                @Value("${dayloop.provider.gemini.api-key:}") String apiKey,
                                @Value("${dayloop.provider.gemini.model:gemini-2.5-flash}") String model,
                                @Value("${dayloop.provider.gemini.base-url:https://generativelanguage.googleapis.com}") String baseUrl,
                                @Value("${dayloop.provider.gemini.file-poll-interval-ms:2000}") long pollIntervalMs,
                                @Value("${dayloop.provider.gemini.file-timeout-seconds:300}") long fileTimeoutSeconds,
                                @Value("${dayloop.provider.max-attempts:3}") int maxAttempts,
                                @Value("${dayloop.provider.retry-backoff-ms:1000}") long retryBackoffMs) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.model = model;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.http = new ProviderHttpClient(restTemplate, objectMapper, recorder, NAME, model);
        this.retryPolicy = new RetryPolicy(maxAttempts, Duration.ofMillis(retryBackoffMs));
        this.poller = new FileStatePoller(Duration.ofMillis(pollIntervalMs), Duration.ofSeconds(fileTimeoutSeconds));
    }

    @PreDestroy
    public void shutdown() {
        poller.close();
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
        requireKey();
        List<LlmCall> calls = new ArrayList<>();
        String group = UUID.randomUUID().toString();

        String fileUri = upload(video, group, calls);
        String prompt = transcriptionPrompt(video.durationSeconds());
        List<Map<String, Object>> parts = List.of(
                Map.of("file_data", Map.of("mime_type", "video/mp4", "file_uri", fileUri)),
                Map.of("text", prompt));

        List<ObservationDraft> observations = retryPolicy.execute("transcribe", attempt ->
                http.call(generateSpec(video.batchId(), group, attempt, "transcribe", parts), response -> {
                    List<ObservationDraft> parsed = ProviderJson.observations(
                            ProviderJson.readModelJson(objectMapper, candidateText(response)));
                    validateTranscription(parsed, video.durationSeconds());
                    return parsed;
                }, calls));

        log.info("Gemini transcribed batch {} into {} observations", video.batchId(), observations.size());
        return new TranscriptionResult(observations, calls);
    }

    @Override
    public CardSynthesisResult synthesizeCards(List<ObservationDraft> observations, CardContext context) {
        requireKey();
        List<LlmCall> calls = new ArrayList<>();
        String group = UUID.randomUUID().toString();
        String prompt = cardPrompt(observations, context);

        List<CardDraft> cards = retryPolicy.execute("generate-cards", attempt ->
                http.call(generateSpec(context.batchId(), group, attempt, "generate-cards", List.of(Map.of("text", prompt))),
                        response -> {
                            List<CardDraft> parsed = ProviderJson.cards(
                                    ProviderJson.readModelJson(objectMapper, candidateText(response)));
                            CardTimelineValidator.validate(context.existingCards(), parsed);
                            return parsed;
                        }, calls));

        log.info("Gemini synthesized {} cards for batch {}", cards.size(), context.batchId());
        return new CardSynthesisResult(cards, calls);
    }

    /**
     * Start session, send bytes and finalize, then wait until the file is ACTIVE.
     *
     * @return the file URI to reference in generate calls
     */
    String upload(BatchVideo video, String group, List<LlmCall> calls) {
        long size;
        try {
            size = Files.size(video.file());
        } catch (IOException e) {
            throw new ProviderException("Cannot read batch video " + video.file() + ": " + e.getMessage(), e);
        }

        HttpHeaders startHeaders = apiHeaders();
        startHeaders.setContentType(MediaType.APPLICATION_JSON);
        startHeaders.set("X-Goog-Upload-Protocol", "resumable");
        startHeaders.set("X-Goog-Upload-Command", "start");
        startHeaders.set("X-Goog-Upload-Header-Content-Length", String.valueOf(size));
        startHeaders.set("X-Goog-Upload-Header-Content-Type", "video/mp4");
        Map<String, Object> startBody = Map.of("file", Map.of("display_name", "batch-" + video.batchId()));

        String uploadUrl = retryPolicy.execute("upload-start", attempt ->
                http.call(new CallSpec(video.batchId(), group, attempt, "upload-start", HttpMethod.POST,
                        baseUrl + "/upload/v1beta/files", startHeaders, startBody), response -> {
                    String url = response.getHeaders().getFirst(UPLOAD_URL_HEADER);
                    if (url == null || url.isBlank()) {
                        throw new ProviderException("Upload start returned no upload URL");
                    }
                    return url;
                }, calls));

        HttpHeaders uploadHeaders = new HttpHeaders();
        uploadHeaders.setContentLength(size);
        uploadHeaders.set("X-Goog-Upload-Offset", "0");
        uploadHeaders.set("X-Goog-Upload-Command", "upload, finalize");

        JsonNode file = retryPolicy.execute("upload-finalize", attempt ->
                http.call(new CallSpec(video.batchId(), group, attempt, "upload-finalize", HttpMethod.PUT,
                        uploadUrl, uploadHeaders, new FileSystemResource(video.file())), response -> {
                    JsonNode node = readJson(response.getBody()).path("file");
                    if (!node.hasNonNull("uri")) {
                        throw new ProviderException("Upload finalize returned no file URI");
                    }
                    return node;
                }, calls));

        String uri = file.get("uri").asText();
        String name = file.path("name").asText(uri);
        if (!"ACTIVE".equals(file.path("state").asText())) {
            log.debug("Waiting for {} to become active", name);
            poller.awaitActive(name, () -> fetchState(uri));
        }
        return uri;
    }

    FileStatePoller.RemoteFileState fetchState(String fileUri) {
        try {
            ResponseEntity<String> response = restTemplate.exchange(fileUri, HttpMethod.GET,
                    new HttpEntity<>(apiHeaders()), String.class);
            String state = readJson(response.getBody()).path("state").asText();
            switch (state) {
                case "ACTIVE":
                    return FileStatePoller.RemoteFileState.ACTIVE;
                case "FAILED":
                    return FileStatePoller.RemoteFileState.FAILED;
                default:
                    return FileStatePoller.RemoteFileState.PROCESSING;
            }
        } catch (RestClientException e) {
            throw new ProviderException("File status check failed: " + e.getMessage(), e);
        }
    }

    private CallSpec generateSpec(Long batchId, String group, int attempt, String operation,
                                  List<Map<String, Object>> parts) {
        HttpHeaders headers = apiHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        Map<String, Object> body = Map.of(
                "contents", List.of(Map.of("parts", parts)),
                "generationConfig", Map.of(
                        "temperature", 0.3,
                        "responseMimeType", "application/json"));
        return new CallSpec(batchId, group, attempt, operation, HttpMethod.POST,
                baseUrl + "/v1beta/models/" + model + ":generateContent", headers, body);
    }

    private String candidateText(ResponseEntity<String> response) {
        JsonNode root = readJson(response.getBody());
        JsonNode candidate = root.path("candidates").path(0);
        StringBuilder text = new StringBuilder();
        for (JsonNode part : candidate.path("content").path("parts")) {
            text.append(part.path("text").asText(""));
        }
        if (text.toString().isBlank()) {
            throw new ProviderException("Gemini returned no text (finishReason=" + candidate.path("finishReason").asText("unknown") + ")");
        }
        return text.toString();
    }

    private void validateTranscription(List<ObservationDraft> observations, long durationSeconds) {
        if (observations.isEmpty()) {
            throw new ProviderException("Transcription returned no observations");
        }
        long limit = durationSeconds + DURATION_TOLERANCE_SECONDS;
        for (ObservationDraft o : observations) {
            int start = VideoTimestamps.parse(o.start());
            int end = VideoTimestamps.parse(o.end());
            if (start < 0 || end > limit) {
                throw new ProviderException("Observation " + o.start() + " - " + o.end()
                        + " falls outside the video (" + VideoTimestamps.format(durationSeconds) + " long)");
            }
        }
    }

    private JsonNode readJson(String body) {
        try {
            return objectMapper.readTree(body == null ? "{}" : body);
        } catch (JsonProcessingException e) {
            throw new ProviderException("Gemini returned invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private HttpHeaders apiHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(API_KEY_HEADER, apiKey);
        return headers;
    }

    private void requireKey() {
        if (apiKey == null || apiKey.isBlank()) {
            throw new ProviderException("Gemini API key is not configured (dayloop.provider.gemini.api-key)");
        }
    }

    private static String transcriptionPrompt(long durationSeconds) {
        String length = VideoTimestamps.format(durationSeconds);
        return "This is a " + length + " screen recording of one person's computer. "
                + "Describe what they are doing as a chronological list of segments, one per coherent activity. "
                + "Name the applications, sites, documents and content involved. "
                + "Timestamps are MM:SS from the start of this video; segments are contiguous and never go past " + length + ".\n\n"
                + "Return only JSON: an array of objects with the fields \"startTimestamp\", \"endTimestamp\" and \"description\".";
    }

    private String cardPrompt(List<ObservationDraft> observations, CardContext context) {
        String length = VideoTimestamps.format(context.batchDurationSeconds());
        String existing;
        try {
            existing = objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(ProviderJson.cardsJson(objectMapper, context.existingCards()));
        } catch (JsonProcessingException e) {
            throw new ProviderException("Could not render existing cards: " + e.getOriginalMessage(), e);
        }
        return "You keep a timeline of activity cards for one person's computer use.\n\n"
                + "Categories (use the name exactly):\n" + ProviderJson.categoryLines(context.categories()) + "\n"
                + "Times are MM:SS relative to the start of the newest recording; negative times are earlier.\n\n"
                + "Existing cards:\n" + existing + "\n\n"
                + "Observations:\n" + ProviderJson.observationLines(observations) + "\n"
                + "Return the complete revised list of cards covering both the existing cards and the observations. "
                + "Extend or merge an existing card while the activity continues; start a new card when it changes. "
                + "Do not drop any time the existing cards cover. "
                + "Aim for cards of 15 to 60 minutes; every card except the last must be at least 10 minutes. "
                + "Cards never overlap and none ends after " + length + ". "
                + "Put brief detours in the card's distractions.\n\n"
                + "Return only JSON: an array of objects with the fields startTime, endTime, category, subcategory, "
                + "title, summary, detailedSummary and distractions (objects with startTime, endTime, title, summary).";
    }
}
