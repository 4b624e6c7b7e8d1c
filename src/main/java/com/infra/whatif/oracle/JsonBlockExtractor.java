package com.infra.whatif.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Pulls the first well-formed JSON object out of a free-text oracle response.
 *
 * The whole text is tried first. Otherwise each '{' is taken in turn as a candidate
 * start, its matching '}' is located by brace counting (braces inside string literals
 * and escaped quotes are ignored) and the block is parsed. The first block that parses
 * to an object wins; if none does, {@link OracleResponseException} is thrown.
 */
@Component
public class JsonBlockExtractor {

    private final ObjectMapper objectMapper;

    public JsonBlockExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public JsonNode extract(String text) {
        if (text == null || text.isBlank()) {
            throw new OracleResponseException("Oracle returned an empty response", text);
        }

        JsonNode whole = tryParse(text.strip());
        if (whole != null) {
            return whole;
        }

        int start = text.indexOf('{');
        while (start >= 0) {
            int end = findBlockEnd(text, start);
            if (end >= 0) {
                JsonNode block = tryParse(text.substring(start, end + 1));
                if (block != null) {
                    return block;
                }
            }
            start = text.indexOf('{', start + 1);
        }

        throw new OracleResponseException("Could not extract valid JSON from oracle response", text);
    }

    /**
     * @return index of the '}' closing the block opened at {@code start}, or -1
     */
    static int findBlockEnd(String text, int start) {
        int depth = 0;
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
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private JsonNode tryParse(String candidate) {
        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
