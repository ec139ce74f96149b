package com.dayloop.timeline.provider;

import com.dayloop.timeline.model.LlmCall;
import com.dayloop.timeline.repository.LlmCallRepository;
import com.dayloop.timeline.service.StoreWriter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Persists one audit row per provider HTTP attempt, with credentials scrubbed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmCallRecorder {

    private static final Set<String> SENSITIVE_HEADERS = Set.of("authorization", "x-api-key", "x-goog-api-key");
    private static final Pattern SENSITIVE_QUERY = Pattern.compile("([?&](?:key|api_key|token)=)[^&#]*", Pattern.CASE_INSENSITIVE);
    private static final int MAX_PAYLOAD_CHARS = 100_000;

    private final LlmCallRepository repository;
    private final StoreWriter writer;
    private final ObjectMapper objectMapper;

    public LlmCall record(LlmCall call) {
        call.setRequestUrl(redactUrl(call.getRequestUrl()));
        call.setRequestPayload(truncate(call.getRequestPayload()));
        call.setResponsePayload(truncate(call.getResponsePayload()));
        try {
            return writer.write(status -> repository.save(call));
        } catch (RuntimeException e) {
            // Losing an audit row must not fail the analysis
            log.warn("Could not persist {} call audit: {}", call.getOperation(), e.getMessage());
            return call;
        }
    }

    public List<LlmCall> callsForBatch(Long batchId) {
        return repository.findByBatchIdOrderByCreatedAtAsc(batchId);
    }

    public String headersJson(HttpHeaders headers) {
        if (headers == null || headers.isEmpty()) {
            return null;
        }
        Map<String, String> flat = new TreeMap<>();
        headers.forEach((name, values) -> flat.put(name,
                SENSITIVE_HEADERS.contains(name.toLowerCase(Locale.ROOT)) ? "<redacted>" : String.join(", ", values)));
        try {
            return objectMapper.writeValueAsString(flat);
        } catch (JsonProcessingException e) {
            return flat.toString();
        }
    }

    public static String redactUrl(String url) {
        if (url == null) {
            return null;
        }
        return SENSITIVE_QUERY.matcher(url).replaceAll("$1<redacted>");
    }

    static String truncate(String payload) {
        if (payload == null || payload.length() <= MAX_PAYLOAD_CHARS) {
            return payload;
        }
        return payload.substring(0, MAX_PAYLOAD_CHARS) + "...<truncated " + (payload.length() - MAX_PAYLOAD_CHARS) + " chars>";
    }
}
