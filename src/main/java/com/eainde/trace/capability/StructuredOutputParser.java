package com.eainde.trace.capability;

import com.eainde.trace.error.GenerationFormatException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.log4j.Log4j2;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort recovery of one JSON object from generation output.
 *
 * <h3>Fallback order</h3>
 * <ol>
 *   <li>strip markdown fences (the first fenced block wins)</li>
 *   <li>strict parse of the stripped text</li>
 *   <li>strict parse of the first balanced {@code {...}} object in it</li>
 *   <li>one local reformat: lenient parse of that object (comments, single quotes,
 *       unquoted names, trailing commas, raw control characters)</li>
 * </ol>
 * If none yields an object, {@link GenerationFormatException} is thrown.
 */
@Log4j2
public class StructuredOutputParser {

    private static final Pattern FENCED_BLOCK = Pattern.compile("```[a-zA-Z0-9_-]*\\s*\\n?(.*?)```", Pattern.DOTALL);
    private static final int PREVIEW_LENGTH = 200;

    private final ObjectMapper strictMapper;
    private final ObjectMapper lenientMapper;

    public StructuredOutputParser() {
        this(new ObjectMapper());
    }

    public StructuredOutputParser(ObjectMapper strictMapper) {
        this.strictMapper = strictMapper;
        this.lenientMapper = JsonMapper.builder()
                .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
                .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
                .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
                .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
                .enable(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS)
                .build();
    }

    public JsonNode parseObject(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new GenerationFormatException("Generation output is empty");
        }

        String body = stripFences(raw);
        Optional<JsonNode> direct = tryParse(strictMapper, body);
        if (direct.isPresent()) {
            return direct.get();
        }

        String candidate = firstBalancedObject(body)
                .orElseThrow(() -> new GenerationFormatException(
                        "No JSON object found in generation output: " + preview(raw)));

        Optional<JsonNode> extracted = tryParse(strictMapper, candidate);
        if (extracted.isPresent()) {
            return extracted.get();
        }

        Optional<JsonNode> reformatted = tryParse(lenientMapper, candidate);
        if (reformatted.isPresent()) {
            log.warn("Generation output needed lenient reformat to parse");
            return reformatted.get();
        }
        throw new GenerationFormatException("Unparseable JSON object in generation output: " + preview(candidate));
    }

    /** Parses and binds to {@code type}; binding failures are format errors too. */
    public <T> T parse(String raw, Class<T> type) {
        JsonNode node = parseObject(raw);
        try {
            return strictMapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new GenerationFormatException("Generation output does not match " + type.getSimpleName(), e);
        }
    }

    static String stripFences(String raw) {
        String text = raw.trim();
        Matcher fenced = FENCED_BLOCK.matcher(text);
        if (fenced.find()) {
            return fenced.group(1).trim();
        }
        if (text.startsWith("```")) {
            // opening fence without a closing one
            int newline = text.indexOf('\n');
            return newline < 0 ? "" : text.substring(newline + 1).trim();
        }
        return text;
    }

    /**
     * First {@code {...}} span whose braces balance, ignoring braces inside double-quoted strings.
     */
    static Optional<String> firstBalancedObject(String text) {
        int start = text.indexOf('{');
        while (start >= 0) {
            int end = matchingBrace(text, start);
            if (end > 0) {
                return Optional.of(text.substring(start, end + 1));
            }
            start = text.indexOf('{', start + 1);
        }
        return Optional.empty();
    }

    private static int matchingBrace(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (ch == '\\') {
                    escaped = true;
                } else if (ch == '"') {
                    inString = false;
                }
                continue;
            }
            if (ch == '"') {
                inString = true;
            } else if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static Optional<JsonNode> tryParse(ObjectMapper mapper, String text) {
        try {
            JsonNode node = mapper.readTree(text);
            return node != null && node.isObject() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException e) {
            log.debug("Parse attempt failed: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static String preview(String text) {
        return text.length() <= PREVIEW_LENGTH ? text : text.substring(0, PREVIEW_LENGTH) + "...";
    }
}
