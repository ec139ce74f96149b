package com.dayloop.timeline.provider;

import com.dayloop.timeline.exception.ProviderException;
import com.dayloop.timeline.model.LlmCall;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpEntity;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.util.List;

/**
 * Executes one provider HTTP attempt, parses it, and writes exactly one audit row for it
 * whatever the outcome.
 */
public class ProviderHttpClient {

    @FunctionalInterface
    public interface ResponseParser<T> {
        T parse(ResponseEntity<String> response);
    }

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final LlmCallRecorder recorder;
    private final String provider;
    private final String model;

    public ProviderHttpClient(RestTemplate restTemplate, ObjectMapper objectMapper, LlmCallRecorder recorder,
                              String provider, String model) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.recorder = recorder;
        this.provider = provider;
        this.model = model;
    }

    public <T> T call(CallSpec spec, ResponseParser<T> parser, List<LlmCall> audit) {
        LlmCall call = new LlmCall();
        call.setBatchId(spec.batchId());
        call.setCallGroupId(spec.callGroupId());
        call.setAttempt(spec.attempt());
        call.setProvider(provider);
        call.setModel(model);
        call.setOperation(spec.operation());
        call.setRequestMethod(spec.method().name());
        call.setRequestUrl(spec.url());
        call.setRequestHeaders(recorder.headersJson(spec.headers()));
        call.setRequestPayload(describeBody(spec.body()));

        long started = System.nanoTime();
        try {
            ResponseEntity<String> response = restTemplate.exchange(spec.url(), spec.method(),
                    new HttpEntity<>(spec.body(), spec.headers()), String.class);
            call.setHttpStatus(response.getStatusCode().value());
            call.setResponseHeaders(recorder.headersJson(response.getHeaders()));
            call.setResponsePayload(response.getBody());

            T parsed = parser.parse(response);
            call.setStatus(LlmCall.CallStatus.SUCCESS);
            return parsed;
        } catch (HttpStatusCodeException e) {
            int code = e.getStatusCode().value();
            call.setHttpStatus(code);
            call.setResponsePayload(e.getResponseBodyAsString());
            String message = spec.operation() + " failed with HTTP " + code + ": " + abbreviate(e.getResponseBodyAsString());
            markFailed(call, "http", code, message);
            throw new ProviderException(message, code, e);
        } catch (RestClientException e) {
            String message = spec.operation() + " failed: " + e.getMessage();
            markFailed(call, "transport", null, message);
            throw new ProviderException(message, e);
        } catch (ProviderException e) {
            markFailed(call, "content", null, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            String message = spec.operation() + " returned an unusable response: " + e.getMessage();
            markFailed(call, "content", null, message);
            throw new ProviderException(message, e);
        } finally {
            call.setLatencyMs((System.nanoTime() - started) / 1_000_000);
            audit.add(recorder.record(call));
        }
    }

    private void markFailed(LlmCall call, String domain, Integer code, String message) {
        call.setStatus(LlmCall.CallStatus.FAILURE);
        call.setErrorDomain(domain);
        call.setErrorCode(code);
        call.setErrorMessage(message);
    }

    private String describeBody(Object body) {
        if (body == null) {
            return null;
        }
        if (body instanceof String) {
            return (String) body;
        }
        if (body instanceof Resource) {
            Resource resource = (Resource) body;
            try {
                return "<binary " + resource.contentLength() + " bytes: " + resource.getFilename() + ">";
            } catch (IOException e) {
                return "<binary " + resource.getFilename() + ">";
            }
        }
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            return String.valueOf(body);
        }
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > 500 ? text.substring(0, 500) + "..." : text;
    }
}
