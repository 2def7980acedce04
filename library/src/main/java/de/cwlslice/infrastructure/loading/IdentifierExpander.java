package de.cwlslice.infrastructure.loading;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import de.cwlslice.core.model.CwlKeys;
import de.cwlslice.infrastructure.utils.IdentifierUtils;
import de.cwlslice.infrastructure.utils.NodeUtils;

import java.net.URI;
import java.util.Objects;

/**
 * Rewrites the local identifiers of a freshly parsed document into global ones.
 * <p>
 * Map notation of {@code inputs}, {@code outputs}, {@code steps} and {@code in} is turned into lists first, e.g.
 * {@code inputs: {message: string}} becomes {@code inputs: [{id: message, type: string}]}. Then:
 * <ul>
 *     <li>inputs, outputs and steps become {@code <document-id>#<name>},</li>
 *     <li>step ports become {@code <step-id>/<name>},</li>
 *     <li>{@code source} and {@code outputSource} are resolved against the document id,</li>
 *     <li>{@code run} references are resolved against the document location,</li>
 *     <li>embedded processes are expanded with the id {@code <step-id>/run} unless they carry an absolute id.</li>
 * </ul>
 * Identifiers that are already absolute are left alone, so expanding twice changes nothing.
 */
public class IdentifierExpander {

    private static final String EMBEDDED_RUN_NAME = "run";

    public ObjectNode expand(final ObjectNode document, final String location) {
        ObjectNode expanded = document.deepCopy();
        var documentId = NodeUtils.text(expanded, CwlKeys.ID)
                .map(id -> IdentifierUtils.join(location, id))
                .orElse(location);
        expandProcess(expanded, documentId, location);
        return expanded;
    }

    private void expandProcess(final ObjectNode process, final String processId, final String location) {
        process.put(CwlKeys.ID, processId);
        normalize(process, CwlKeys.INPUTS, CwlKeys.TYPE);
        normalize(process, CwlKeys.OUTPUTS, CwlKeys.TYPE);
        normalize(process, CwlKeys.STEPS, null);

        for (ObjectNode input : NodeUtils.objects(process, CwlKeys.INPUTS)) {
            expandId(input, processId);
        }
        for (ObjectNode output : NodeUtils.objects(process, CwlKeys.OUTPUTS)) {
            expandId(output, processId);
            expandSources(output, CwlKeys.OUTPUT_SOURCE, processId);
        }
        for (ObjectNode step : NodeUtils.objects(process, CwlKeys.STEPS)) {
            var stepId = expandId(step, processId);
            expandStep(step, stepId, processId, location);
        }
    }

    private void expandStep(final ObjectNode step, final String stepId, final String processId, final String location) {
        normalize(step, CwlKeys.IN, CwlKeys.SOURCE);
        for (ObjectNode inPort : NodeUtils.objects(step, CwlKeys.IN)) {
            expandId(inPort, stepId);
            expandSources(inPort, CwlKeys.SOURCE, processId);
        }

        var out = step.get(CwlKeys.OUT);
        if (Objects.nonNull(out) && out.isArray()) {
            ArrayNode expandedOut = JsonNodeFactory.instance.arrayNode();
            for (JsonNode outPort : out) {
                if (outPort.isTextual()) {
                    expandedOut.add(IdentifierUtils.join(stepId, outPort.asText()));
                } else if (outPort.isObject()) {
                    ObjectNode record = outPort.deepCopy();
                    expandId(record, stepId);
                    expandedOut.add(record);
                } else {
                    expandedOut.add(outPort);
                }
            }
            step.set(CwlKeys.OUT, expandedOut);
        }

        var run = step.get(CwlKeys.RUN);
        if (Objects.nonNull(run) && run.isTextual()) {
            step.put(CwlKeys.RUN, resolveLocation(location, run.asText()));
        } else if (Objects.nonNull(run) && run.isObject()) {
            var embedded = (ObjectNode) run;
            var embeddedId = NodeUtils.text(embedded, CwlKeys.ID)
                    .filter(IdentifierUtils::isAbsolute)
                    .orElse(IdentifierUtils.join(stepId, EMBEDDED_RUN_NAME));
            expandProcess(embedded, embeddedId, location);
        }
    }

    private String expandId(final ObjectNode record, final String base) {
        var id = IdentifierUtils.join(base, record.path(CwlKeys.ID).asText(""));
        record.put(CwlKeys.ID, id);
        return id;
    }

    private void expandSources(final ObjectNode record, final String field, final String base) {
        var sources = record.get(field);
        if (Objects.isNull(sources)) {
            return;
        }
        if (sources.isArray()) {
            ArrayNode expanded = JsonNodeFactory.instance.arrayNode();
            sources.forEach(source -> expanded.add(IdentifierUtils.join(base, source.asText())));
            record.set(field, expanded);
        } else if (sources.isTextual()) {
            record.set(field, TextNode.valueOf(IdentifierUtils.join(base, sources.asText())));
        }
    }

    // {name: value} -> [{id: name, ...}], a scalar value is stored under shorthandKey
    private void normalize(final ObjectNode parent, final String field, final String shorthandKey) {
        var value = parent.get(field);
        if (Objects.isNull(value) || !value.isObject()) {
            return;
        }
        ArrayNode records = JsonNodeFactory.instance.arrayNode();
        value.fields().forEachRemaining(entry -> {
            var record = records.addObject();
            record.put(CwlKeys.ID, entry.getKey());
            if (entry.getValue().isObject()) {
                entry.getValue().fields().forEachRemaining(f -> {
                    if (!CwlKeys.ID.equals(f.getKey())) {
                        record.set(f.getKey(), f.getValue());
                    }
                });
            } else if (Objects.nonNull(shorthandKey)) {
                record.set(shorthandKey, entry.getValue());
            }
        });
        parent.set(field, records);
    }

    private String resolveLocation(final String location, final String reference) {
        if (IdentifierUtils.isAbsolute(reference)) {
            return reference;
        }
        try {
            return URI.create(location).resolve(reference).toString();
        } catch (IllegalArgumentException e) {
            return reference;
        }
    }
}
