package de.cwlslice.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

public record LocatedStep(ObjectNode record, WorkflowStep step) {

    public LocatedStep(final WorkflowStep step) {
        this(step.getTool(), step);
    }
}
