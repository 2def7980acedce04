package de.cwlslice.core.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import de.cwlslice.core.exception.UnresolvableRewireException;
import de.cwlslice.core.graph.Node;
import de.cwlslice.core.graph.NodeKind;
import de.cwlslice.core.graph.NodeRegistry;
import de.cwlslice.core.graph.RewireEntry;
import de.cwlslice.core.graph.RewirePlan;
import de.cwlslice.core.model.CwlKeys;
import de.cwlslice.core.model.Process;
import de.cwlslice.core.model.StepRun;
import de.cwlslice.core.model.Workflow;
import de.cwlslice.core.model.WorkflowStep;
import de.cwlslice.infrastructure.loading.LoadingContext;
import de.cwlslice.infrastructure.utils.IdentifierUtils;
import de.cwlslice.infrastructure.utils.NodeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Keeps the top-level inputs the reached steps and outputs depend on, and replaces every other dependency that
 * lies outside the reached set by a synthetic top-level input.
 */
@Slf4j
@RequiredArgsConstructor
public class BoundaryRewriter {

    private static final Set<String> CAPTURED_STREAMS = Set.of("stdout", "stderr");
    private static final String FILE_TYPE = "File";

    private final NodeRegistry registry;
    private final StepLocator stepLocator;
    private final LoadingContext loadingContext;

    public RewirePlan rewrite(final Workflow workflow, final Set<String> reached) {
        Set<String> visited = new LinkedHashSet<>();
        Map<String, RewireEntry> rewire = new LinkedHashMap<>();

        for (String id : reached) {
            visited.add(id);
            var node = registry.get(id);
            if (node.getKind() != NodeKind.STEP && node.getKind() != NodeKind.OUTPUT) {
                continue;
            }
            for (String upstream : node.getUpstream()) {
                if (reached.contains(upstream)) {
                    continue;
                }
                if (registry.kindOf(upstream) == NodeKind.INPUT) {
                    visited.add(upstream);
                    continue;
                }
                // first match wins
                if (rewire.containsKey(upstream)) {
                    continue;
                }
                var entry = new RewireEntry(IdentifierUtils.flatten(upstream), resolveType(workflow, node, upstream));
                log.debug("Rewiring '{}' of '{}' to new input '{}'", upstream, id, entry.id());
                rewire.put(upstream, entry);
            }
        }
        return new RewirePlan(visited, rewire);
    }

    private JsonNode resolveType(final Workflow workflow, final Node node, final String danglingId) {
        if (node.getKind() == NodeKind.OUTPUT) {
            // a dangling output source is one of several, so the output's own type does not apply
            return producedType(workflow, danglingId).orElseGet(this::defaultType);
        }

        var located = stepLocator.find(workflow.getSteps(), node.getId())
                .orElseThrow(() -> new UnresolvableRewireException(node.getId(), danglingId));
        for (ObjectNode inPort : NodeUtils.objects(located.record(), CwlKeys.IN)) {
            if (!NodeUtils.asTextList(inPort.get(CwlKeys.SOURCE)).contains(danglingId)) {
                continue;
            }
            if (inPort.hasNonNull(CwlKeys.TYPE)) {
                return inPort.get(CwlKeys.TYPE).deepCopy();
            }
            var portName = IdentifierUtils.shortname(inPort.path(CwlKeys.ID).asText());
            return runInputType(located.step(), portName).orElseGet(this::defaultType);
        }
        return defaultType();
    }

    // type the step's process declares for the port, if the process is at hand without loading anything
    private Optional<JsonNode> runInputType(final WorkflowStep step, final String portName) {
        return runPortType(step, CwlKeys.INPUTS, portName);
    }

    // type of a step output '<step-id>/<port>' as declared by the process the step runs
    private Optional<JsonNode> producedType(final Workflow workflow, final String danglingId) {
        if (!IdentifierUtils.defrag(danglingId).fragment().contains(IdentifierUtils.PATH_SEPARATOR)) {
            return Optional.empty();
        }
        var stepId = StringUtils.substringBeforeLast(danglingId, IdentifierUtils.PATH_SEPARATOR);
        return stepLocator.find(workflow.getSteps(), stepId)
                .flatMap(located -> runPortType(located.step(), CwlKeys.OUTPUTS, IdentifierUtils.shortname(danglingId)))
                .map(BoundaryRewriter::captureType);
    }

    private Optional<JsonNode> runPortType(final WorkflowStep step, final String field, final String portName) {
        Optional<ObjectNode> processDocument = Optional.empty();
        var run = step.getRun();
        if (run instanceof StepRun.InlineRun inline) {
            processDocument = Optional.of(inline.process().getTool());
        } else if (run instanceof StepRun.EmbeddedRun embedded) {
            processDocument = Optional.of(embedded.document());
        } else if (run instanceof StepRun.ExternalRun external) {
            processDocument = loadingContext.lookup(external.location()).map(Process::getTool);
        }
        return processDocument.flatMap(document -> NodeUtils.objects(document, field).stream()
                .filter(port -> portName.equals(IdentifierUtils.shortname(port.path(CwlKeys.ID).asText())))
                .map(port -> port.get(CwlKeys.TYPE))
                .filter(Objects::nonNull)
                .findFirst()
                .map(type -> type.<JsonNode>deepCopy()));
    }

    // stdout and stderr outputs are files once captured
    private static JsonNode captureType(final JsonNode type) {
        if (type.isTextual() && CAPTURED_STREAMS.contains(type.asText())) {
            return TextNode.valueOf(FILE_TYPE);
        }
        return type;
    }

    private JsonNode defaultType() {
        return TextNode.valueOf(loadingContext.getOptions().getDefaultType());
    }
}
