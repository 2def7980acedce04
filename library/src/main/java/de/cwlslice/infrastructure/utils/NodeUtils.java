package de.cwlslice.infrastructure.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class NodeUtils {

    /**
     * Reads a scalar-or-list value (e.g. {@code source}, {@code outputSource}) as a list of texts.
     */
    public static List<String> asTextList(final JsonNode node) {
        List<String> values = new ArrayList<>();
        if (Objects.isNull(node) || node.isNull() || node.isMissingNode()) {
            return values;
        }
        if (node.isArray()) {
            node.forEach(element -> values.add(element.asText()));
        } else {
            values.add(node.asText());
        }
        return values;
    }

    public static List<ObjectNode> objects(final JsonNode parent, final String field) {
        List<ObjectNode> objects = new ArrayList<>();
        var node = parent.get(field);
        if (Objects.nonNull(node) && node.isArray()) {
            node.forEach(element -> {
                if (element.isObject()) {
                    objects.add((ObjectNode) element);
                }
            });
        }
        return objects;
    }

    /**
     * Identifier of a port given either as a bare string or as a record with an {@code id}.
     */
    public static Optional<String> idOf(final JsonNode port) {
        if (Objects.isNull(port)) {
            return Optional.empty();
        }
        if (port.isTextual()) {
            return Optional.of(port.asText());
        }
        if (port.isObject() && port.hasNonNull("id")) {
            return Optional.of(port.get("id").asText());
        }
        return Optional.empty();
    }

    public static Optional<String> text(final JsonNode parent, final String field) {
        var node = parent.get(field);
        if (Objects.isNull(node) || !node.isTextual()) {
            return Optional.empty();
        }
        return Optional.of(node.asText());
    }

    private NodeUtils() {}
}
