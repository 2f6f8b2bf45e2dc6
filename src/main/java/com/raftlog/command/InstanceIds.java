package com.raftlog.command;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Encoding of a member set as {@code {"instanceIds": [...]}}.
 */
final class InstanceIds {

    static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    static final String INSTANCE_IDS_FIELD = "instanceIds";

    private InstanceIds() {}

    static Set<Long> copyOf(Set<Long> ids) {
        if (ids == null || ids.isEmpty()) return Set.of();
        for (Long id : ids) {
            if (id == null) {
                throw new IllegalArgumentException("Configuration contains a null node id");
            }
            if (id < 0) {
                throw new IllegalArgumentException("Node ids are unsigned, got " + id);
            }
        }
        return Set.copyOf(ids);
    }

    // sorted on every call, Set.copyOf gives no iteration order
    static ObjectNode encode(Set<Long> ids) {
        ArrayNode array = NODES.arrayNode(ids.size());
        for (Long id : new TreeSet<>(ids)) {
            array.add(id);
        }
        ObjectNode configuration = NODES.objectNode();
        configuration.set(INSTANCE_IDS_FIELD, array);
        return configuration;
    }

    static Set<Long> decode(JsonNode configuration) {
        if (configuration == null) return Set.of();
        JsonNode array = configuration.path(INSTANCE_IDS_FIELD);
        if (!array.isArray()) return Set.of();

        Set<Long> ids = new HashSet<>();
        for (JsonNode element : array) {
            if (element.isIntegralNumber() && element.canConvertToLong() && element.longValue() >= 0) {
                ids.add(element.longValue());
            }
        }
        return ids;
    }

    static String render(Set<Long> ids) {
        return new TreeSet<>(ids).toString();
    }
}
