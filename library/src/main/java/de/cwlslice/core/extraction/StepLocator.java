package de.cwlslice.core.extraction;

import de.cwlslice.core.model.LocatedStep;
import de.cwlslice.core.model.Process;
import de.cwlslice.core.model.StepRun;
import de.cwlslice.core.model.Workflow;
import de.cwlslice.core.model.WorkflowStep;
import de.cwlslice.infrastructure.loading.LoadingContext;
import de.cwlslice.infrastructure.utils.IdentifierUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Finds a step by identifier, descending into nested workflows.
 * <p>
 * A nested workflow has its own identifier namespace rooted at its own id, so the part of the identifier below
 * the enclosing step is re-based onto the nested workflow's id before searching its steps.
 */
@Slf4j
@RequiredArgsConstructor
public class StepLocator {

    private final LoadingContext loadingContext;

    public Optional<LocatedStep> find(final List<WorkflowStep> steps, final String stepId) {
        for (WorkflowStep step : steps) {
            if (stepId.equals(step.getId())) {
                return Optional.of(new LocatedStep(step));
            }
        }
        for (WorkflowStep step : steps) {
            var id = step.getId();
            if (id == null || !IdentifierUtils.isNestedUnder(stepId, id)) {
                continue;
            }
            var suffix = stepId.substring(id.length() + 1);
            var found = findNested(step, suffix);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    private Optional<LocatedStep> findNested(final WorkflowStep step, final String suffix) {
        var run = step.getRun();
        if (run instanceof StepRun.InlineRun inline) {
            if (inline.process() instanceof Workflow workflow) {
                log.debug("Searching '{}' in live workflow of step '{}'", suffix, step.getId());
                var found = find(workflow.getSteps(), suffix);
                if (found.isPresent()) {
                    return found;
                }
                return find(workflow.getSteps(), IdentifierUtils.rebase(workflow.getId(), suffix));
            }
        } else if (run instanceof StepRun.EmbeddedRun embedded) {
            if (embedded.isWorkflow()) {
                log.debug("Searching '{}' in embedded workflow of step '{}'", suffix, step.getId());
                return findInWorkflow(loadingContext.makeTool(embedded.document()), suffix);
            }
        } else if (run instanceof StepRun.ExternalRun external) {
            log.debug("Searching '{}' in '{}' referenced by step '{}'", suffix, external.location(), step.getId());
            return findInWorkflow(loadingContext.requireLoader().resolve(external.location()), suffix);
        }
        return Optional.empty();
    }

    private Optional<LocatedStep> findInWorkflow(final Process process, final String suffix) {
        if (process instanceof Workflow workflow) {
            return find(workflow.getSteps(), IdentifierUtils.rebase(workflow.getId(), suffix));
        }
        return Optional.empty();
    }
}
