package com.jirasync.webhooks.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.jirasync.webhooks.error.MalformedPayloadException;
import com.jirasync.webhooks.model.Timestamps;
import com.jirasync.webhooks.model.WebhookEnvelope;

import java.io.IOException;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Decodes a raw request body into a {@link WebhookEnvelope}.
 *
 * <p>Two body shapes are understood. The canonical one:
 * <pre>
 *   {"eventType": "jira:project_created",
 *    "timestamp": "2025-01-01T00:00:00Z",
 *    "entityPayload": {"id": "PRJ-1", "name": "Alpha"}}
 * </pre>
 * and the one Jira itself posts, where the entity sits under {@code issue} or
 * {@code project} and issue attributes are nested in {@code fields}:
 * <pre>
 *   {"webhookEvent": "jira:issue_updated",
 *    "timestamp": 1525698237764,
 *    "issue": {"id": "10002", "key": "ED-1",
 *              "fields": {"summary": "...", "project": {"id": "10000"}}}}
 * </pre>
 * Issue {@code fields} are lifted to the top level of the snapshot so both
 * shapes produce the same keys. Unknown fields are kept and otherwise ignored.
 *
 * <p>The parser is stateless and thread-safe.
 */
public class WebhookPayloadParser {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public WebhookPayloadParser() {
        this(new ObjectMapper().registerModule(new JavaTimeModule()));
    }

    public WebhookPayloadParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * @param body        the exact bytes received
     * @param contentType the declared content type; {@code null} is read as JSON
     * @return the decoded envelope
     * @throws MalformedPayloadException if the body is not a usable webhook payload
     */
    public WebhookEnvelope parse(byte[] body, String contentType) throws MalformedPayloadException {
        checkContentType(contentType);
        if (body == null || body.length == 0) {
            throw new MalformedPayloadException("Empty request body");
        }

        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedPayloadException("Malformed JSON payload: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MalformedPayloadException("Unreadable payload", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedPayloadException("Payload must be a JSON object");
        }

        String eventType = text(root, "eventType");
        if (eventType == null) {
            eventType = text(root, "webhookEvent");
        }
        if (eventType == null) {
            throw new MalformedPayloadException("Missing eventType");
        }

        Instant timestamp = timestamp(root, eventType);

        ObjectNode entity = entity(root);
        if (entity == null) {
            throw new MalformedPayloadException("Missing entity snapshot", eventType);
        }
        JsonNode id = entity.get("id");
        if (id == null || !id.isValueNode() || id.isNull() || id.asText().isBlank()) {
            throw new MalformedPayloadException("Entity snapshot has no id", eventType);
        }

        Map<String, Object> payload = mapper.convertValue(entity, MAP_TYPE);
        return new WebhookEnvelope(eventType, timestamp, payload);
    }

    // ------------------------------------------------------------------

    private static void checkContentType(String contentType) throws MalformedPayloadException {
        if (contentType == null || contentType.isBlank()) return;
        String mediaType = contentType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        if (!mediaType.equals("application/json") && !mediaType.endsWith("+json")) {
            throw new MalformedPayloadException("Unsupported content type: " + contentType);
        }
    }

    private static Instant timestamp(JsonNode root, String eventType) throws MalformedPayloadException {
        JsonNode node = root.get("timestamp");
        if (node == null || node.isNull()) {
            throw new MalformedPayloadException("Missing timestamp", eventType);
        }
        try {
            return Timestamps.parse(node.isNumber() ? node.numberValue() : node.asText());
        } catch (IllegalArgumentException e) {
            throw new MalformedPayloadException("Invalid timestamp: " + e.getMessage(), eventType);
        }
    }

    /** Picks the entity snapshot out of either body shape, or {@code null}. */
    private static ObjectNode entity(JsonNode root) {
        for (String field : new String[] {"entityPayload", "issue", "project"}) {
            JsonNode node = root.get(field);
            if (node != null && node.isObject()) {
                return flattenFields((ObjectNode) node.deepCopy());
            }
        }
        return null;
    }

    /** Lifts Jira's nested {@code fields} object into the snapshot without overwriting. */
    private static ObjectNode flattenFields(ObjectNode entity) {
        JsonNode fields = entity.remove("fields");
        if (fields != null && fields.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = fields.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                if (!entity.has(e.getKey())) {
                    entity.set(e.getKey(), e.getValue());
                }
            }
        }
        return entity;
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual()) return null;
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }
}
