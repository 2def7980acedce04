package de.cwlslice.core.extraction;

import de.cwlslice.core.exception.StepNotFoundException;
import de.cwlslice.core.exception.UnresolvedReferenceException;
import de.cwlslice.core.model.Process;
import de.cwlslice.core.model.ProcessFactory;
import de.cwlslice.core.model.ProcessResolution;
import de.cwlslice.core.model.StepRun;
import de.cwlslice.core.model.Workflow;
import de.cwlslice.infrastructure.loading.LoadingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class ProcessResolver {

    private final LoadingContext loadingContext;

    public ProcessResolution resolve(final Workflow workflow, final String stepId) {
        var loader = loadingContext.requireLoader();
        var located = new StepLocator(loadingContext).find(workflow.getSteps(), stepId)
                .orElseThrow(() -> new StepNotFoundException(stepId));

        Process process;
        var run = located.step().getRun();
        if (run instanceof StepRun.ExternalRun external) {
            process = loader.lookup(external.location())
                    .orElseThrow(() -> new UnresolvedReferenceException(external.location()));
        } else if (run instanceof StepRun.InlineRun inline) {
            process = inline.process();
        } else if (run instanceof StepRun.EmbeddedRun embedded) {
            // wraps the embedded document as is
            process = ProcessFactory.create(embedded.document(), workflow.getMetadata());
        } else {
            throw new IllegalStateException("Unexpected run of step '%s': %s".formatted(stepId, run));
        }
        log.debug("Resolved step '{}' to {}", stepId, process);
        return new ProcessResolution(process, located.step());
    }
}
