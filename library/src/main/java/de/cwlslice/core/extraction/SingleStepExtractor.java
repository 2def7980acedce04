package de.cwlslice.core.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.cwlslice.core.exception.StepNotFoundException;
import de.cwlslice.core.model.CwlKeys;
import de.cwlslice.core.model.Workflow;
import de.cwlslice.infrastructure.loading.LoadingContext;
import de.cwlslice.infrastructure.utils.IdentifierUtils;
import de.cwlslice.infrastructure.utils.NodeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.Set;

/**
 * Wraps a single (possibly nested) step into a one-step workflow document with pass-through inputs and outputs.
 */
@Slf4j
@RequiredArgsConstructor
public class SingleStepExtractor {

    private static final Set<String> REPLACED_FIELDS = Set.of(CwlKeys.STEPS, CwlKeys.INPUTS, CwlKeys.OUTPUTS);

    private final LoadingContext loadingContext;

    public ObjectNode extract(final Workflow workflow, final String stepId) {
        var located = new StepLocator(loadingContext).find(workflow.getSteps(), stepId)
                .orElseThrow(() -> new StepNotFoundException(stepId));
        var options = loadingContext.getOptions();

        ObjectNode step = located.record().deepCopy();
        var locatedId = step.path(CwlKeys.ID).asText();
        var parentId = StringUtils.substringBeforeLast(locatedId, IdentifierUtils.FRAGMENT_SEPARATOR);
        var stepName = StringUtils.substringAfterLast(locatedId, IdentifierUtils.FRAGMENT_SEPARATOR);

        var extracted = JsonNodeFactory.instance.objectNode();
        extracted.putArray(CwlKeys.STEPS).add(step);
        var inputs = extracted.putArray(CwlKeys.INPUTS);
        var outputs = extracted.putArray(CwlKeys.OUTPUTS);

        for (ObjectNode inPort : NodeUtils.objects(step, CwlKeys.IN)) {
            var name = IdentifierUtils.FRAGMENT_SEPARATOR + IdentifierUtils.shortname(inPort.path(CwlKeys.ID).asText());
            var input = inputs.addObject();
            input.put(CwlKeys.ID, name);
            input.put(CwlKeys.TYPE, options.getDefaultType());
            if (inPort.has(CwlKeys.DEFAULT)) {
                input.set(CwlKeys.DEFAULT, inPort.get(CwlKeys.DEFAULT).deepCopy());
            }
            inPort.put(CwlKeys.SOURCE, name);
            // merging only makes sense for several sources
            inPort.remove(CwlKeys.LINK_MERGE);
        }

        for (JsonNode outPort : step.path(CwlKeys.OUT)) {
            NodeUtils.idOf(outPort).ifPresent(outId -> {
                var name = IdentifierUtils.shortname(outId);
                var output = outputs.addObject();
                output.put(CwlKeys.ID, name);
                output.put(CwlKeys.TYPE, options.getDefaultType());
                output.put(CwlKeys.OUTPUT_SOURCE, "%s#%s/%s".formatted(parentId, stepName, name));
            });
        }

        workflow.getTool().fields().forEachRemaining(field -> {
            if (!REPLACED_FIELDS.contains(field.getKey())) {
                extracted.set(field.getKey(), field.getValue().deepCopy());
            }
        });
        extracted.put(CwlKeys.ID, parentId);
        var versionField = options.getVersionField();
        if (!extracted.has(versionField) && workflow.getMetadata().has(versionField)) {
            extracted.set(versionField, workflow.getMetadata().get(versionField).deepCopy());
        }

        log.info("Extracted step '{}' as workflow '{}'", locatedId, parentId);
        return extracted;
    }
}
