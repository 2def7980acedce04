package de.cwlslice.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import de.cwlslice.infrastructure.utils.NodeUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds live process objects around (already expanded) process documents. The document is wrapped, not copied.
 */
public final class ProcessFactory {

    public static Process create(final ObjectNode tool, final ObjectNode metadata) {
        if (!CwlKeys.WORKFLOW_CLASS.equals(tool.path(CwlKeys.CLASS).asText(null))) {
            return new Process(tool, metadata);
        }
        List<WorkflowStep> steps = new ArrayList<>();
        NodeUtils.objects(tool, CwlKeys.STEPS).forEach(step -> steps.add(new WorkflowStep(step)));
        return new Workflow(tool, metadata, steps);
    }

    private ProcessFactory() {}
}
