package de.cwlslice.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import de.cwlslice.infrastructure.utils.NodeUtils;
import lombok.Getter;

import java.util.List;

@Getter
public class WorkflowStep {

    private final ObjectNode tool;
    private final StepRun run;

    public WorkflowStep(final ObjectNode tool) {
        this(tool, StepRun.of(tool.get(CwlKeys.RUN)));
    }

    public WorkflowStep(final ObjectNode tool, final Process process) {
        this(tool, new StepRun.InlineRun(process));
    }

    private WorkflowStep(final ObjectNode tool, final StepRun run) {
        this.tool = tool;
        this.run = run;
    }

    public String getId() {
        return tool.path(CwlKeys.ID).asText(null);
    }

    public List<ObjectNode> getInPorts() {
        return NodeUtils.objects(tool, CwlKeys.IN);
    }

    @Override
    public String toString() {
        return "WorkflowStep(id=%s, run=%s)".formatted(getId(), run);
    }
}
