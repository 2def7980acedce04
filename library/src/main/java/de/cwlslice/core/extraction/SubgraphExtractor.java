package de.cwlslice.core.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import de.cwlslice.core.exception.InvalidProcessClassException;
import de.cwlslice.core.graph.GraphBuilder;
import de.cwlslice.core.graph.ReachabilityWalker;
import de.cwlslice.core.graph.RewirePlan;
import de.cwlslice.core.model.CwlKeys;
import de.cwlslice.core.model.Process;
import de.cwlslice.core.model.Workflow;
import de.cwlslice.infrastructure.loading.LoadingContext;
import de.cwlslice.infrastructure.utils.NodeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Set;

/**
 * Extracts the part of a workflow reachable from a set of roots as a new, self-contained workflow document.
 * <p>
 * Records of the source document are deep-copied; the source document is left as it is.
 */
@Slf4j
@RequiredArgsConstructor
public class SubgraphExtractor {

    private static final Set<String> FILTERED_FIELDS = Set.of(CwlKeys.STEPS, CwlKeys.INPUTS, CwlKeys.OUTPUTS);

    private final LoadingContext loadingContext;

    public ObjectNode extract(final Collection<String> roots, final Process process) {
        if (!(process instanceof Workflow workflow) || !process.isWorkflow()) {
            throw new InvalidProcessClassException(process.getProcessClass());
        }

        var registry = GraphBuilder.build(workflow.getTool());
        var reached = new ReachabilityWalker(registry).walkFromRoots(roots);
        var rewriter = new BoundaryRewriter(registry, new StepLocator(loadingContext), loadingContext);
        var plan = rewriter.rewrite(workflow, reached);

        var extracted = assemble(workflow.getTool(), plan);
        log.info("Extracted subgraph of '{}' from roots {}: {} nodes kept, {} inputs rewired",
                workflow.getId(), roots, plan.visited().size(), plan.rewire().size());
        return extracted;
    }

    private ObjectNode assemble(final ObjectNode tool, final RewirePlan plan) {
        var extracted = JsonNodeFactory.instance.objectNode();
        tool.fields().forEachRemaining(field -> {
            if (!FILTERED_FIELDS.contains(field.getKey())) {
                extracted.set(field.getKey(), field.getValue().deepCopy());
                return;
            }
            var records = extracted.putArray(field.getKey());
            for (JsonNode element : field.getValue()) {
                if (!element.isObject() || !plan.keeps(element.path(CwlKeys.ID).asText())) {
                    continue;
                }
                ObjectNode copy = element.deepCopy();
                if (CwlKeys.STEPS.equals(field.getKey())) {
                    NodeUtils.objects(copy, CwlKeys.IN).forEach(inPort -> substitute(inPort, CwlKeys.SOURCE, plan));
                } else if (CwlKeys.OUTPUTS.equals(field.getKey())) {
                    substitute(copy, CwlKeys.OUTPUT_SOURCE, plan);
                }
                records.add(copy);
            }
        });

        if (!plan.rewire().isEmpty()) {
            var inputs = extracted.has(CwlKeys.INPUTS) ? (ArrayNode) extracted.get(CwlKeys.INPUTS) : extracted.putArray(CwlKeys.INPUTS);
            plan.rewire().values().forEach(entry -> {
                var input = inputs.addObject();
                input.put(CwlKeys.ID, entry.id());
                input.set(CwlKeys.TYPE, entry.type().deepCopy());
            });
        }
        return extracted;
    }

    // list values are substituted element by element, elements without a rewire entry are kept
    private void substitute(final ObjectNode record, final String field, final RewirePlan plan) {
        var value = record.get(field);
        if (value == null) {
            return;
        }
        if (value.isArray()) {
            var substituted = JsonNodeFactory.instance.arrayNode();
            value.forEach(element -> substituted.add(plan.replacementFor(element.asText())
                    .<JsonNode>map(TextNode::valueOf)
                    .orElse(element)));
            record.set(field, substituted);
        } else if (value.isTextual()) {
            plan.replacementFor(value.asText()).ifPresent(replacement -> record.put(field, replacement));
        }
    }
}
