package de.cwlslice.core.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.cwlslice.core.model.CwlKeys;
import de.cwlslice.infrastructure.utils.NodeUtils;
import lombok.extern.slf4j.Slf4j;

/**
 * Walks a workflow document once and records its inputs, outputs, steps and their data dependencies.
 * The document is only read.
 */
@Slf4j
public final class GraphBuilder {

    public static NodeRegistry build(final ObjectNode workflow) {
        var registry = new NodeRegistry();

        for (ObjectNode input : NodeUtils.objects(workflow, CwlKeys.INPUTS)) {
            registry.declare(input.path(CwlKeys.ID).asText(), NodeKind.INPUT);
        }

        for (ObjectNode output : NodeUtils.objects(workflow, CwlKeys.OUTPUTS)) {
            var outputId = output.path(CwlKeys.ID).asText();
            registry.declare(outputId, NodeKind.OUTPUT);
            for (String source : NodeUtils.asTextList(output.get(CwlKeys.OUTPUT_SOURCE))) {
                // source is upstream from output
                registry.declare(source, NodeKind.UNCLASSIFIED);
                registry.connect(source, outputId);
            }
        }

        for (ObjectNode step : NodeUtils.objects(workflow, CwlKeys.STEPS)) {
            var stepId = step.path(CwlKeys.ID).asText();
            registry.declare(stepId, NodeKind.STEP);
            for (ObjectNode inPort : NodeUtils.objects(step, CwlKeys.IN)) {
                // ports without source use defaults or stay unconnected
                if (!inPort.has(CwlKeys.SOURCE)) {
                    continue;
                }
                for (String source : NodeUtils.asTextList(inPort.get(CwlKeys.SOURCE))) {
                    registry.declare(source, NodeKind.UNCLASSIFIED);
                    registry.connect(source, stepId);
                }
            }
            var outPorts = step.path(CwlKeys.OUT);
            for (JsonNode outPort : outPorts) {
                NodeUtils.idOf(outPort).ifPresent(outId -> {
                    // step is upstream from its output
                    registry.declare(outId, NodeKind.UNCLASSIFIED);
                    registry.connect(stepId, outId);
                });
            }
        }

        log.debug("Built dependency graph of '{}' with {} nodes", workflow.path(CwlKeys.ID).asText(), registry.size());
        return registry;
    }

    private GraphBuilder() {}
}
