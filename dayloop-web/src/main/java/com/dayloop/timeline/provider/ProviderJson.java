package com.dayloop.timeline.provider;

import com.dayloop.timeline.config.CategoryProperties;
import com.dayloop.timeline.exception.ProviderException;
import com.dayloop.timeline.util.VideoTimestamps;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsing and rendering of the JSON shapes both providers ask models for.
 */
final class ProviderJson {

    private ProviderJson() {
    }

    static JsonNode readModelJson(ObjectMapper objectMapper, String text) {
        if (text == null || text.isBlank()) {
            throw new ProviderException("Model returned an empty response");
        }
        try {
            return objectMapper.readTree(stripCodeFence(text));
        } catch (JsonProcessingException e) {
            throw new ProviderException("Model returned invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    static String stripCodeFence(String text) {
        String s = text.trim();
        if (s.startsWith("```")) {
            int firstLineEnd = s.indexOf('\n');
            s = firstLineEnd >= 0 ? s.substring(firstLineEnd + 1) : s.substring(3);
            if (s.endsWith("```")) {
                s = s.substring(0, s.length() - 3);
            }
        }
        return s.trim();
    }

    static List<ObservationDraft> observations(JsonNode root) {
        JsonNode array = root.isArray() ? root : root.path("observations");
        if (!array.isArray()) {
            throw new ProviderException("Expected a JSON array of observations");
        }
        List<ObservationDraft> result = new ArrayList<>();
        for (JsonNode node : array) {
            String start = text(node, "startTimestamp", "start");
            String end = text(node, "endTimestamp", "end");
            String description = text(node, "description", "observation");
            if (start == null || end == null || description == null || description.isBlank()) {
                throw new ProviderException("Observation is missing start, end or description: " + node);
            }
            checkSpan(start, end, "observation");
            result.add(new ObservationDraft(start, end, description.trim()));
        }
        return result;
    }

    static List<CardDraft> cards(JsonNode root) {
        JsonNode array = root.isArray() ? root : root.path("cards");
        if (!array.isArray()) {
            throw new ProviderException("Expected a JSON array of cards");
        }
        List<CardDraft> result = new ArrayList<>();
        for (JsonNode node : array) {
            result.add(card(node, null, null));
        }
        return result;
    }

    /**
     * One card; {@code fallbackStart}/{@code fallbackEnd} fill in when the model leaves
     * the span out.
     */
    static CardDraft card(JsonNode node, String fallbackStart, String fallbackEnd) {
        String start = orElse(text(node, "startTime", "start"), fallbackStart);
        String end = orElse(text(node, "endTime", "end"), fallbackEnd);
        String title = text(node, "title");
        if (start == null || end == null || title == null || title.isBlank()) {
            throw new ProviderException("Card is missing start, end or title: " + node);
        }
        checkSpan(start, end, "card");

        List<CardDraft.Distraction> distractions = new ArrayList<>();
        for (JsonNode d : node.path("distractions")) {
            String dStart = text(d, "startTime", "start");
            String dEnd = text(d, "endTime", "end");
            if (dStart != null && dEnd != null) {
                distractions.add(new CardDraft.Distraction(dStart, dEnd, text(d, "title"), text(d, "summary")));
            }
        }
        return new CardDraft(start, end, text(node, "category"), text(node, "subcategory"), title.trim(),
                text(node, "summary"), text(node, "detailedSummary"), distractions);
    }

    static ArrayNode cardsJson(ObjectMapper objectMapper, List<CardDraft> cards) {
        ArrayNode array = objectMapper.createArrayNode();
        for (CardDraft card : cards) {
            array.add(cardJson(objectMapper, card));
        }
        return array;
    }

    static ObjectNode cardJson(ObjectMapper objectMapper, CardDraft card) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("startTime", card.start());
        node.put("endTime", card.end());
        node.put("category", card.category());
        node.put("subcategory", card.subcategory());
        node.put("title", card.title());
        node.put("summary", card.summary());
        node.put("detailedSummary", card.detailedSummary());
        ArrayNode distractions = node.putArray("distractions");
        for (CardDraft.Distraction d : card.distractions()) {
            distractions.addObject()
                    .put("startTime", d.start())
                    .put("endTime", d.end())
                    .put("title", d.title())
                    .put("summary", d.summary());
        }
        return node;
    }

    static String observationLines(List<ObservationDraft> observations) {
        StringBuilder sb = new StringBuilder();
        for (ObservationDraft o : observations) {
            sb.append('[').append(o.start()).append(" - ").append(o.end()).append("] ").append(o.description()).append('\n');
        }
        return sb.toString();
    }

    static String categoryLines(List<CategoryProperties.Category> categories) {
        StringBuilder sb = new StringBuilder();
        for (CategoryProperties.Category c : categories) {
            sb.append("- ").append(c.getName());
            if (c.getDescription() != null && !c.getDescription().isBlank()) {
                sb.append(": ").append(c.getDescription());
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static void checkSpan(String start, String end, String what) {
        try {
            if (VideoTimestamps.parse(end) < VideoTimestamps.parse(start)) {
                throw new ProviderException("The " + what + " ends before it starts: " + start + " - " + end);
            }
        } catch (IllegalArgumentException e) {
            throw new ProviderException("Bad " + what + " timestamp: " + e.getMessage(), e);
        }
    }

    private static String text(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) {
                return value.asText();
            }
        }
        return null;
    }

    private static String orElse(String value, String fallback) {
        return value != null ? value : fallback;
    }
}
