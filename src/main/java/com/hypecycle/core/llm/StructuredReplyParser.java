package com.hypecycle.core.llm;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hypecycle.core.model.Phase;
import com.hypecycle.core.model.PhaseOpinion;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw LLM replies into validated values.
 * <p>
 * Decoding is attempted in a fixed order: the whole reply as JSON, then the first
 * fenced code block, then one JSON value read from each of the first
 * {@link #MAX_EMBEDDED_CANDIDATES} '{' positions in turn. Replies longer than
 * {@link #MAX_REPLY_CHARS} are only decoded directly. If none of these yields a JSON
 * object the reply is rejected with {@link LlmParseException}.
 */
public class StructuredReplyParser {

    static final int MAX_REPLY_CHARS = 64_000;
    static final int MAX_EMBEDDED_CANDIDATES = 16;

    private static final Pattern FENCED_BLOCK =
            Pattern.compile("```(?:json|JSON)?\\s*(\\{.*?})\\s*```", Pattern.DOTALL);

    private final ObjectMapper mapper;

    public StructuredReplyParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public StructuredReplyParser() {
        this(new ObjectMapper());
    }

    /**
     * Extracts the JSON object carried by the reply.
     */
    public JsonNode parseObject(String reply) {
        if (reply == null || reply.isBlank()) {
            throw new LlmParseException("Reply is empty");
        }
        String trimmed = reply.trim();
        Optional<JsonNode> direct = tryObject(trimmed);
        if (direct.isPresent()) {
            return direct.get();
        }
        if (trimmed.length() <= MAX_REPLY_CHARS) {
            Matcher fenced = FENCED_BLOCK.matcher(trimmed);
            if (fenced.find()) {
                Optional<JsonNode> block = tryObject(fenced.group(1));
                if (block.isPresent()) {
                    return block.get();
                }
            }
            Optional<JsonNode> embedded = scanEmbedded(trimmed);
            if (embedded.isPresent()) {
                return embedded.get();
            }
        }
        throw new LlmParseException("No JSON object found in reply (" + trimmed.length() + " chars)");
    }

    /**
     * Parses and validates a phase verdict: {@code phase} must be one of the five wire names,
     * {@code confidence} a number in [0, 1] and {@code reasoning} non-blank text.
     */
    public PhaseOpinion parseOpinion(String reply) {
        JsonNode node = parseObject(reply);
        for (String field : List.of("phase", "confidence", "reasoning")) {
            if (!node.hasNonNull(field)) {
                throw new LlmParseException("Missing required field: " + field);
            }
        }

        JsonNode phaseNode = node.get("phase");
        if (!phaseNode.isTextual() || !Phase.isValid(phaseNode.asText())) {
            throw new LlmParseException("Invalid phase: " + phaseNode);
        }

        double confidence = readConfidence(node.get("confidence"));
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new LlmParseException("Confidence out of range [0, 1]: " + confidence);
        }

        JsonNode reasoning = node.get("reasoning");
        if (!reasoning.isTextual() || reasoning.asText().isBlank()) {
            throw new LlmParseException("Reasoning must be non-empty text");
        }
        return new PhaseOpinion(Phase.fromWireName(phaseNode.asText()), confidence, reasoning.asText().trim());
    }

    /**
     * Reads the {@code terms} array of a query-expansion reply. Non-text entries are skipped;
     * validation of the terms themselves is up to the caller.
     */
    public List<String> parseTerms(String reply) {
        JsonNode node = parseObject(reply);
        JsonNode terms = node.get("terms");
        if (terms == null || !terms.isArray()) {
            throw new LlmParseException("Missing required array: terms");
        }
        List<String> result = new ArrayList<>();
        for (JsonNode term : terms) {
            if (term.isTextual()) {
                result.add(term.asText());
            }
        }
        return result;
    }

    private double readConfidence(JsonNode node) {
        if (node.isNumber()) {
            return node.asDouble();
        }
        throw new LlmParseException("Confidence is not numeric: " + node);
    }

    /**
     * Reads a single JSON value starting at each '{' and keeps the first that is an object.
     * Trailing prose after the value is ignored.
     */
    private Optional<JsonNode> scanEmbedded(String text) {
        int open = text.indexOf('{');
        for (int tried = 0; open >= 0 && tried < MAX_EMBEDDED_CANDIDATES; tried++) {
            Optional<JsonNode> node = readObjectAt(text, open);
            if (node.isPresent()) {
                return node;
            }
            open = text.indexOf('{', open + 1);
        }
        return Optional.empty();
    }

    private Optional<JsonNode> readObjectAt(String text, int offset) {
        try (JsonParser parser = mapper.getFactory().createParser(text.substring(offset))) {
            JsonNode node = mapper.readTree(parser);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (IOException e) {
            return Optional.empty();
        }
    }

    private Optional<JsonNode> tryObject(String candidate) {
        try {
            JsonNode node = mapper.readTree(candidate);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
