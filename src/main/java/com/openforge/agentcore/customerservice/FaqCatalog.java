package com.openforge.agentcore.customerservice;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword search over the bundled FAQ entries, exposed as the search_faq tool.
 */
@Slf4j
@Component
public class FaqCatalog {

    static final String DEFAULT_LOCATION = "faq/customer-service-faq.json";
    static final int    DEFAULT_MAX_RESULTS = 3;

    private final ObjectMapper                objectMapper;
    private final Map<String, List<FaqEntry>> entriesByCategory;

    @Autowired
    public FaqCatalog(ObjectMapper objectMapper) {
        this(objectMapper, load(objectMapper, DEFAULT_LOCATION));
    }

    FaqCatalog(ObjectMapper objectMapper, Map<String, List<FaqEntry>> entriesByCategory) {
        this.objectMapper      = objectMapper;
        this.entriesByCategory = new LinkedHashMap<>(entriesByCategory);
        log.info("[FaqCatalog] Loaded {} categories", this.entriesByCategory.size());
    }

    public ObjectNode search(ObjectNode args) {
        JsonNode queryNode = args.get("query");
        if (queryNode == null || queryNode.asText().isBlank()) {
            throw new IllegalArgumentException("missing required field 'query'");
        }
        String query      = queryNode.asText().trim().toLowerCase(Locale.ROOT);
        String category   = args.path("category").asText("all");
        int    maxResults = args.path("max_results").asInt(DEFAULT_MAX_RESULTS);
        log.info("[FaqCatalog] Searching '{}' in category {}", query, category);

        List<ScoredEntry> matches = new ArrayList<>();
        for (Map.Entry<String, List<FaqEntry>> e : entriesByCategory.entrySet()) {
            if (!"all".equals(category) && !e.getKey().equals(category)) continue;
            for (FaqEntry entry : e.getValue()) {
                if (entry.matches(query)) {
                    matches.add(new ScoredEntry(entry, relevance(query, entry)));
                }
            }
        }
        matches.sort(Comparator.comparingDouble(ScoredEntry::score).reversed());
        List<ScoredEntry> top = matches.subList(0, Math.min(Math.max(maxResults, 0), matches.size()));

        ObjectNode result = objectMapper.createObjectNode();
        result.put("success", true);
        result.put("query", query);
        result.put("results_count", top.size());
        ArrayNode results = result.putArray("results");
        for (ScoredEntry scored : top) {
            ObjectNode node = results.addObject();
            node.put("question", scored.entry().question());
            node.put("answer", scored.entry().answer());
            node.put("category", scored.entry().category());
            ArrayNode tags = node.putArray("tags");
            scored.entry().tags().forEach(tags::add);
            node.put("relevance_score", scored.score());
        }
        result.put("message", top.isEmpty()
                ? "I couldn't find a specific FAQ answer for your question. "
                  + "Would you like me to create a support ticket to get you personalized help?"
                : "Found %d relevant FAQ entries for your question.".formatted(top.size()));
        return result;
    }

    /**
     * Question substring +10, each query word among the question words +2,
     * answer substring +5, each query word equal to a tag +1.
     */
    static double relevance(String query, FaqEntry entry) {
        double score = 0;
        String question = entry.question().toLowerCase(Locale.ROOT);
        if (question.contains(query)) score += 10;

        List<String> queryWords    = List.of(query.split("\\s+"));
        List<String> questionWords = List.of(question.split("\\s+"));
        for (String word : queryWords) {
            if (questionWords.contains(word)) score += 2;
        }
        if (entry.answer().toLowerCase(Locale.ROOT).contains(query)) score += 5;
        for (String word : queryWords) {
            if (entry.tags().stream().anyMatch(tag -> tag.equalsIgnoreCase(word))) score += 1;
        }
        return score;
    }

    private static Map<String, List<FaqEntry>> load(ObjectMapper objectMapper, String location) {
        try (InputStream in = new ClassPathResource(location).getInputStream()) {
            return objectMapper.readValue(in, new TypeReference<LinkedHashMap<String, List<FaqEntry>>>() {});
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load FAQ catalog from " + location, e);
        }
    }

    // ── Model ────────────────────────────────────────────────────────────────

    public record FaqEntry(String question, String answer, String category, List<String> tags) {

        public FaqEntry {
            tags = tags == null ? List.of() : List.copyOf(tags);
        }

        boolean matches(String query) {
            return question.toLowerCase(Locale.ROOT).contains(query)
                    || answer.toLowerCase(Locale.ROOT).contains(query)
                    || tags.stream().anyMatch(tag -> tag.toLowerCase(Locale.ROOT).contains(query));
        }
    }

    private record ScoredEntry(FaqEntry entry, double score) {}
}
