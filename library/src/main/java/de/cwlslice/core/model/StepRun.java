package de.cwlslice.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * What a step runs: a live process, a process document embedded in the step, or a reference to another document.
 */
public interface StepRun {

    static StepRun of(final JsonNode run) {
        if (Objects.nonNull(run) && run.isTextual()) {
            return new ExternalRun(run.asText());
        }
        if (Objects.nonNull(run) && run.isObject()) {
            return new EmbeddedRun((ObjectNode) run);
        }
        throw new IllegalArgumentException("Unsupported 'run' value: %s".formatted(run));
    }

    record InlineRun(Process process) implements StepRun {}

    record EmbeddedRun(ObjectNode document) implements StepRun {

        public boolean isWorkflow() {
            return CwlKeys.WORKFLOW_CLASS.equals(document.path(CwlKeys.CLASS).asText(null));
        }
    }

    record ExternalRun(String location) implements StepRun {}
}
