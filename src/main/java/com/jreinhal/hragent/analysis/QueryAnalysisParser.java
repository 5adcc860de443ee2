package com.jreinhal.hragent.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.hragent.model.EntityType;
import com.jreinhal.hragent.model.ExtractedEntity;
import com.jreinhal.hragent.model.QueryAnalysisResult;
import com.jreinhal.hragent.model.QueryComplexity;
import com.jreinhal.hragent.model.QueryIntent;
import com.jreinhal.hragent.model.RoutingDecision;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Turns the analysis model's JSON reply into a {@link QueryAnalysisResult}.
 *
 * <p>{@code entities} arrives in three shapes depending on the prompt version: a list of
 * {@code {text,type,confidence,metadata}} objects, a flat list of strings, or a map from category
 * name to strings. All three are normalised into {@link ExtractedEntity} values. Missing optional
 * fields take defaults. A field that is present but invalid (out of range, wrong type, unknown
 * enum value) is an error, as is a missing intent, complexity or object-entity text, type or
 * confidence.</p>
 */
public class QueryAnalysisParser {

    static final double DEFAULT_INTENT_CONFIDENCE = 0.8;
    static final double DEFAULT_COMPLEXITY_SCORE = 0.5;
    static final double DEFAULT_ROUTING_CONFIDENCE = 0.8;
    static final int DEFAULT_DOC_COUNT = 5;
    static final double DEFAULT_SIMILARITY_THRESHOLD = 0.45;
    static final double STRING_ENTITY_CONFIDENCE = 0.7;
    static final double CATEGORY_ENTITY_CONFIDENCE = 0.8;

    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() { };

    private final ObjectMapper objectMapper;

    public QueryAnalysisParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public QueryAnalysisResult parse(String query, String reply, double analysisTimeMs) {
        JsonNode root = readObject(reply);

        QueryIntent intent = requiredEnum(root, "intent", QueryIntent::fromValue);
        QueryComplexity complexity = requiredEnum(root, "complexity", QueryComplexity::fromValue);

        return new QueryAnalysisResult(
                query,
                intent,
                unit(root, "intent_confidence", DEFAULT_INTENT_CONFIDENCE),
                complexity,
                unit(root, "complexity_score", DEFAULT_COMPLEXITY_SCORE),
                entities(root.get("entities")),
                routing(root),
                unit(root, "routing_confidence", DEFAULT_ROUTING_CONFIDENCE),
                root.path("requires_recent_context").asBoolean(false),
                root.path("requires_multiple_sources").asBoolean(false),
                docCount(root),
                unit(root, "suggested_similarity_threshold", DEFAULT_SIMILARITY_THRESHOLD),
                root.path("requires_tools").asBoolean(false),
                strings(root.get("suggested_tools")),
                strings(root.get("key_concepts")),
                strings(root.get("query_topics")),
                root.path("analysis_reasoning").asText(""),
                analysisTimeMs);
    }

    private JsonNode readObject(String reply) {
        String json = stripFences(reply);
        if (json.isEmpty()) {
            throw new QueryAnalysisException("Empty analysis reply");
        }
        JsonNode root;
        try {
            root = this.objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new QueryAnalysisException("Analysis reply is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new QueryAnalysisException("Analysis reply is not a JSON object");
        }
        return root;
    }

    static String stripFences(String reply) {
        if (reply == null) {
            return "";
        }
        String text = reply.trim();
        if (text.startsWith("```json")) {
            text = text.replace("```json", "").replace("```", "").trim();
        } else if (text.startsWith("```")) {
            text = text.replace("```", "").trim();
        }
        return text;
    }

    private static <E> E requiredEnum(JsonNode root, String field, Function<String, E> lookup) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || !node.isTextual()) {
            throw new QueryAnalysisException("Missing required field '" + field + "'");
        }
        try {
            return lookup.apply(node.asText());
        } catch (IllegalArgumentException e) {
            throw new QueryAnalysisException(e.getMessage(), e);
        }
    }

    private static RoutingDecision routing(JsonNode root) {
        JsonNode routing = root.get("routing");
        if (routing != null && routing.isTextual()) {
            return RoutingDecision.fromValue(routing.asText());
        }
        JsonNode legacy = root.get("routing_decision");
        if (legacy != null && legacy.isTextual()) {
            return RoutingDecision.fromValue(legacy.asText());
        }
        return RoutingDecision.STANDARD_RAG;
    }

    private static int docCount(JsonNode root) {
        JsonNode node = root.get("suggested_doc_count");
        if (node == null || node.isNull()) {
            return DEFAULT_DOC_COUNT;
        }
        if (!node.isIntegralNumber()) {
            throw new QueryAnalysisException("Field 'suggested_doc_count' is not an integer");
        }
        int count = node.asInt();
        if (count < QueryAnalysisResult.MIN_DOC_COUNT || count > QueryAnalysisResult.MAX_DOC_COUNT) {
            throw new QueryAnalysisException("Field 'suggested_doc_count' out of range: " + count);
        }
        return count;
    }

    private static double unit(JsonNode root, String field, double fallback) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        return unitValue(node, field);
    }

    private static double unitValue(JsonNode node, String field) {
        if (!node.isNumber()) {
            throw new QueryAnalysisException("Field '" + field + "' is not a number");
        }
        double value = node.asDouble();
        if (value < 0.0 || value > 1.0) {
            throw new QueryAnalysisException("Field '" + field + "' out of range: " + value);
        }
        return value;
    }

    private static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return values;
        }
        for (JsonNode item : node) {
            if (item.isValueNode() && !item.isNull()) {
                values.add(item.asText());
            }
        }
        return values;
    }

    private List<ExtractedEntity> entities(JsonNode node) {
        List<ExtractedEntity> entities = new ArrayList<>();
        if (node == null || node.isNull()) {
            return entities;
        }
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> categories = node.fields();
            while (categories.hasNext()) {
                Map.Entry<String, JsonNode> category = categories.next();
                EntityType type = category.getKey().toLowerCase(Locale.ROOT).contains("product")
                        ? EntityType.PRODUCT
                        : EntityType.CONCEPT;
                for (JsonNode item : category.getValue()) {
                    if (item.isTextual()) {
                        entities.add(new ExtractedEntity(item.asText(), type, CATEGORY_ENTITY_CONFIDENCE,
                                Map.of("category", category.getKey())));
                    }
                }
            }
        } else if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isObject()) {
                    entities.add(objectEntity(item));
                } else if (item.isTextual()) {
                    entities.add(new ExtractedEntity(item.asText(), EntityType.CONCEPT, STRING_ENTITY_CONFIDENCE, Map.of()));
                }
            }
        }
        return entities;
    }

    private ExtractedEntity objectEntity(JsonNode item) {
        JsonNode text = item.get("text");
        if (text == null || !text.isTextual()) {
            throw new QueryAnalysisException("Entity without 'text'");
        }
        JsonNode type = item.get("type");
        if (type == null || !type.isTextual()) {
            throw new QueryAnalysisException("Entity without 'type'");
        }
        JsonNode confidence = item.get("confidence");
        if (confidence == null || confidence.isNull()) {
            throw new QueryAnalysisException("Entity without 'confidence'");
        }
        EntityType entityType;
        try {
            entityType = EntityType.fromValue(type.asText());
        } catch (IllegalArgumentException e) {
            throw new QueryAnalysisException(e.getMessage(), e);
        }
        JsonNode metadata = item.get("metadata");
        return new ExtractedEntity(
                text.asText(),
                entityType,
                unitValue(confidence, "entities.confidence"),
                metadata != null && metadata.isObject() ? this.objectMapper.convertValue(metadata, OBJECT_MAP) : Map.of());
    }
}
