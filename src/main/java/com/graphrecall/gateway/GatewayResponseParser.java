package com.graphrecall.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.graphrecall.exception.GatewayException;
import com.graphrecall.model.graph.ExtractedTriple;
import com.graphrecall.model.graph.ParsedQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns chat-model JSON into triples and parsed queries, substituting the speaker
 * for the {@code <user>} placeholder.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GatewayResponseParser {

    private final ObjectMapper objectMapper;

    /**
     * Best-effort: unreadable output gives an empty list, incomplete entries are skipped.
     */
    public List<ExtractedTriple> parseTriples(String content, String username) {
        JsonNode root = readLenient(content);
        if (root == null) {
            log.warn("Extraction output is not JSON, no fragments recovered: {}", content);
            return List.of();
        }

        JsonNode items = root;
        if (root.isObject()) {
            JsonNode wrapped = root.has("relationships") ? root.get("relationships") : root.get("triples");
            items = wrapped != null ? wrapped : root;
        }

        List<ExtractedTriple> triples = new ArrayList<>();
        if (items.isArray()) {
            items.forEach(item -> toTriple(item, username, triples));
        } else {
            toTriple(items, username, triples);
        }
        return triples;
    }

    /**
     * @throws GatewayException when the output has no usable relationship phrase
     */
    public ParsedQuery parseQuery(String content, String username) {
        JsonNode root = readLenient(content);
        if (root == null || !root.isObject()) {
            throw new GatewayException("parseQuery", "unreadable response: " + content);
        }

        List<String> entities = new ArrayList<>();
        JsonNode entityNodes = root.get("entities");
        if (entityNodes != null && entityNodes.isArray()) {
            entityNodes.forEach(node -> {
                String name = substitute(node.asText(), username);
                if (!name.isBlank()) {
                    entities.add(name);
                }
            });
        }

        String relationship = text(root, "relationship", "relationshipPhrase");
        if (relationship == null || relationship.isBlank()) {
            throw new GatewayException("parseQuery", "no relationship in response: " + content);
        }

        return ParsedQuery.builder()
                .entities(entities)
                .relationshipPhrase(substitute(relationship, username))
                .build();
    }

    private void toTriple(JsonNode item, String username, List<ExtractedTriple> out) {
        if (item == null || !item.isObject()) {
            return;
        }
        ExtractedTriple triple = ExtractedTriple.builder()
                .source(substitute(text(item, "sourceEntity", "source"), username))
                .relationship(trim(text(item, "relationship", "relation")))
                .target(substitute(text(item, "targetEntity", "target"), username))
                .alias(item.path("isAlias").asBoolean(false) || item.path("alias").asBoolean(false))
                .build();
        if (triple.isComplete()) {
            out.add(triple);
        } else {
            log.debug("Skipping incomplete extraction entry: {}", item);
        }
    }

    private JsonNode readLenient(String content) {
        if (content == null || content.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            // Models sometimes wrap JSON in prose or code fences
            String embedded = embeddedJson(content);
            if (embedded == null) {
                return null;
            }
            try {
                return objectMapper.readTree(embedded);
            } catch (JsonProcessingException inner) {
                log.debug("Embedded JSON unreadable", inner);
                return null;
            }
        }
    }

    private String embeddedJson(String content) {
        int objectStart = content.indexOf('{');
        int arrayStart = content.indexOf('[');
        int start = objectStart < 0 ? arrayStart : (arrayStart < 0 ? objectStart : Math.min(objectStart, arrayStart));
        if (start < 0) {
            return null;
        }
        char close = content.charAt(start) == '{' ? '}' : ']';
        int end = content.lastIndexOf(close);
        return end > start ? content.substring(start, end + 1) : null;
    }

    private static String text(JsonNode node, String field, String fallbackField) {
        JsonNode value = node.has(field) ? node.get(field) : node.get(fallbackField);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String substitute(String value, String username) {
        if (value == null) {
            return null;
        }
        return value.replace(PromptTemplates.USER_PLACEHOLDER, username).trim();
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }
}
