package com.lidm.core.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient JSON extraction from free-form model output.
 * <p>
 * Models wrap JSON in prose or markdown fences, so candidates are tried in order:
 * the whole trimmed text, the body of each fenced block, then the first balanced
 * {@code {...}} or {@code [...]} span. Deserialization uses Jackson with unknown
 * properties ignored and single values accepted as arrays.
 */
@Component
public class StructuredOutputParser {

    private static final Logger log = LoggerFactory.getLogger(StructuredOutputParser.class);

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:[a-zA-Z0-9_-]+)?\\s*\\n?(.*?)```", Pattern.DOTALL);

    private final ObjectMapper mapper;

    public StructuredOutputParser() {
        this(lenientMapper());
    }

    public StructuredOutputParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static ObjectMapper lenientMapper() {
        var mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true);
        mapper.configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
        // "42 is the answer" must not parse as the number 42
        mapper.configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
        mapper.configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        mapper.registerModule(new ParameterNamesModule());
        return mapper;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    /**
     * Parses the first JSON candidate in {@code raw} that deserializes into {@code type}.
     *
     * @throws LlmEmptyResponseException if {@code raw} is null or blank
     * @throws LlmParseException         if no candidate deserializes
     */
    public <T> T parse(String raw, Class<T> type) {
        return parse(raw, type.getSimpleName(), json -> mapper.readValue(json, type));
    }

    public <T> T parse(String raw, TypeReference<T> type) {
        return parse(raw, type.getType().getTypeName(), json -> mapper.readValue(json, type));
    }

    /**
     * Returns the first JSON candidate in {@code raw} as a tree, or empty when the
     * text holds no JSON at all (the raw-text fallback is left to the caller).
     */
    public Optional<JsonNode> parseTree(String raw) {
        return parseTree(raw, true);
    }

    /**
     * Like {@link #parseTree(String)} but only the whole text or a fenced block body
     * count as JSON. Prose that merely contains brackets, such as a citation
     * marker, stays prose.
     */
    public Optional<JsonNode> parseWholeTree(String raw) {
        return parseTree(raw, false);
    }

    private Optional<JsonNode> parseTree(String raw, boolean allowEmbedded) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        for (String candidate : candidates(raw, allowEmbedded)) {
            try {
                JsonNode node = mapper.readTree(candidate);
                if (node != null && !node.isMissingNode()) {
                    return Optional.of(node);
                }
            } catch (JsonProcessingException e) {
                log.trace("Candidate is not JSON: {}", e.getOriginalMessage());
            }
        }
        return Optional.empty();
    }

    /** Converts an already parsed tree, e.g. a nested field, into {@code type}. */
    public <T> T convert(JsonNode node, TypeReference<T> type) {
        try {
            return mapper.convertValue(node, type);
        } catch (IllegalArgumentException e) {
            throw new LlmParseException("Failed to convert JSON to " + type.getType().getTypeName()
                    + ": " + e.getMessage(), e);
        }
    }

    /** Compact JSON with object keys sorted, so equal values render identically. */
    public String canonicalText(JsonNode node) {
        try {
            Object plain = mapper.convertValue(node, Object.class);
            return mapper.writeValueAsString(plain);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return node.toString();
        }
    }

    /** Body of the first markdown fenced block, if any. */
    public static Optional<String> fencedBlock(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        Matcher matcher = FENCED_BLOCK.matcher(raw);
        return matcher.find() ? Optional.of(matcher.group(1).trim()) : Optional.empty();
    }

    private <T> T parse(String raw, String typeName, JsonReader<T> reader) {
        if (raw == null || raw.isBlank()) {
            throw new LlmEmptyResponseException("Model returned empty content for " + typeName);
        }
        JsonProcessingException lastError = null;
        for (String candidate : candidates(raw)) {
            try {
                T value = reader.read(candidate);
                if (value != null) {
                    return value;
                }
            } catch (JsonProcessingException e) {
                lastError = e;
            }
        }
        log.debug("Unparseable model output for {}: {}", typeName, raw);
        String reason = lastError != null ? lastError.getOriginalMessage() : "no JSON found";
        throw new LlmParseException("Failed to parse model output to " + typeName + ": " + reason, lastError);
    }

    static List<String> candidates(String raw) {
        return candidates(raw, true);
    }

    static List<String> candidates(String raw, boolean allowEmbedded) {
        var candidates = new ArrayList<String>();
        String trimmed = raw.trim();
        candidates.add(trimmed);
        Matcher matcher = FENCED_BLOCK.matcher(trimmed);
        while (matcher.find()) {
            String body = matcher.group(1).trim();
            if (!body.isEmpty() && !candidates.contains(body)) {
                candidates.add(body);
            }
        }
        if (allowEmbedded) {
            balancedSpan(trimmed).filter(span -> !candidates.contains(span)).ifPresent(candidates::add);
        }
        return candidates;
    }

    /**
     * First balanced {@code {...}} or {@code [...]} span, honouring string literals.
     */
    static Optional<String> balancedSpan(String text) {
        int start = -1;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '{' || c == '[') {
                start = i;
                break;
            }
        }
        if (start < 0) {
            return Optional.empty();
        }
        var closers = new ArrayList<Character>();
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            switch (c) {
                case '"' -> inString = true;
                case '{' -> closers.add('}');
                case '[' -> closers.add(']');
                case '}', ']' -> {
                    if (closers.isEmpty() || closers.remove(closers.size() - 1) != c) {
                        return Optional.empty();
                    }
                    if (closers.isEmpty()) {
                        return Optional.of(text.substring(start, i + 1));
                    }
                }
                default -> {
                }
            }
        }
        return Optional.empty();
    }

    @FunctionalInterface
    private interface JsonReader<T> {
        T read(String json) throws JsonProcessingException;
    }
}
