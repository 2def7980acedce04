package de.cwlslice.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;

import java.util.List;

@Getter
public class Workflow extends Process {

    private final List<WorkflowStep> steps;

    public Workflow(final ObjectNode tool, final ObjectNode metadata, final List<WorkflowStep> steps) {
        super(tool, metadata);
        this.steps = List.copyOf(steps);
    }
}
