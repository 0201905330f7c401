package batchkeeper.coordinator.store;

import batchkeeper.coordinator.error.StoreException;
import batchkeeper.coordinator.model.ResourceRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON encoding of the structured job columns (resources, env, expected files, error lines).
 */
final class JsonColumns {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final TypeReference<LinkedHashMap<String, String>> STRING_MAP = new TypeReference<>() {
    };

    private JsonColumns() {
    }

    static String writeResources(ResourceRequest resources) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("nodes", resources.nodes());
        node.put("cpus", resources.cpus());
        node.put("gpus", resources.gpus());
        node.put("memory", resources.memory());
        node.put("walltime", resources.walltime());
        if (resources.queue() != null) {
            node.put("queue", resources.queue());
        }
        if (resources.account() != null) {
            node.put("account", resources.account());
        }
        return node.toString();
    }

    static ResourceRequest readResources(String json) {
        JsonNode node = parse(json);
        return ResourceRequest.builder()
                .nodes(node.path("nodes").asInt(1))
                .cpus(node.path("cpus").asInt(1))
                .gpus(node.path("gpus").asInt(0))
                .memory(node.path("memory").asText(ResourceRequest.DEFAULT_MEMORY))
                .walltime(node.path("walltime").asText(ResourceRequest.DEFAULT_WALLTIME))
                .queue(node.hasNonNull("queue") ? node.get("queue").asText() : null)
                .account(node.hasNonNull("account") ? node.get("account").asText() : null)
                .build();
    }

    static String writeList(List<?> values) {
        return write(values != null ? values : List.of());
    }

    static List<String> readList(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return MAPPER.readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new StoreException("Corrupt JSON list column: " + json, e);
        }
    }

    static String writeMap(Map<String, String> values) {
        return write(values != null ? values : Map.of());
    }

    static Map<String, String> readMap(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return MAPPER.readValue(json, STRING_MAP);
        } catch (JsonProcessingException e) {
            throw new StoreException("Corrupt JSON map column: " + json, e);
        }
    }

    private static String write(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to encode JSON column", e);
        }
    }

    private static JsonNode parse(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new StoreException("Corrupt JSON column: " + json, e);
        }
    }
}
