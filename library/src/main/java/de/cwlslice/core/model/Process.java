package de.cwlslice.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;

/**
 * A loaded process definition: its raw document plus the metadata of the document it was loaded from.
 */
@Getter
public class Process {

    private final ObjectNode tool;
    private final ObjectNode metadata;

    public Process(final ObjectNode tool, final ObjectNode metadata) {
        this.tool = tool;
        this.metadata = metadata;
    }

    public String getId() {
        return tool.path(CwlKeys.ID).asText(null);
    }

    public String getProcessClass() {
        return tool.path(CwlKeys.CLASS).asText(null);
    }

    public boolean isWorkflow() {
        return CwlKeys.WORKFLOW_CLASS.equals(getProcessClass());
    }

    @Override
    public String toString() {
        return "%s(id=%s)".formatted(getProcessClass(), getId());
    }
}
