package com.devseo.audit.fix;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Decodes completion text into a {@link FixCandidate}. Each field is checked on its own, so one
 * missing or mistyped field does not discard the others.
 */
@Component
public class AiFixJsonParser {
    private final ObjectMapper objectMapper;

    public AiFixJsonParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    FixCandidate parse(String responseText) {
        if (!StringUtils.hasText(responseText)) {
            return FixCandidate.empty();
        }
        JsonNode payload = parseJsonPayload(responseText);
        if (!payload.isObject()) {
            throw new IllegalArgumentException("Fix response is not a JSON object");
        }
        JsonNode schema = payload.get("jsonLdSchema");
        return new FixCandidate(
            text(payload, "optimizedTitle"),
            text(payload, "optimizedMetaDescription"),
            text(payload, "improvedH1"),
            schema != null && schema.isObject() ? (ObjectNode) schema : null,
            text(payload, "suggestedInternalLinkingText")
        );
    }

    private JsonNode parseJsonPayload(String responseText) {
        String cleaned = responseText.replace("```json", "").replace("```", "").trim();
        try {
            return objectMapper.readTree(cleaned);
        } catch (JsonProcessingException initialParseException) {
            int openBrace = cleaned.indexOf('{');
            int closeBrace = cleaned.lastIndexOf('}');
            if (openBrace < 0 || closeBrace <= openBrace) {
                throw new IllegalArgumentException("Fix response did not include a JSON object");
            }
            try {
                return objectMapper.readTree(cleaned.substring(openBrace, closeBrace + 1));
            } catch (JsonProcessingException parseException) {
                throw new IllegalArgumentException("Fix response JSON parsing failed", parseException);
            }
        }
    }

    private static String text(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        if (node == null || !node.isTextual() || !StringUtils.hasText(node.asText())) {
            return null;
        }
        return node.asText().trim();
    }
}
