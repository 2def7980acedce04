package de.cwlslice;

import com.fasterxml.jackson.databind.node.ObjectNode;
import de.cwlslice.core.extraction.ProcessResolver;
import de.cwlslice.core.extraction.SingleStepExtractor;
import de.cwlslice.core.extraction.SubgraphExtractor;
import de.cwlslice.core.model.Process;
import de.cwlslice.core.model.ProcessResolution;
import de.cwlslice.core.model.Workflow;
import de.cwlslice.infrastructure.loading.LoadingContext;
import lombok.Getter;

import java.util.Collection;

/**
 * Entry point for slicing workflows.
 *
 * <pre>{@code
 * var loader = new YamlDocumentLoader();
 * var slicer = new CwlSlicer(LoadingContext.of(loader));
 * var workflow = loader.resolve("pipelines/main.cwl");
 * ObjectNode part = slicer.getSubgraph(List.of(workflow.getId() + "#align"), workflow);
 * }</pre>
 */
@Getter
public class CwlSlicer {

    private final LoadingContext loadingContext;
    private final SubgraphExtractor subgraphExtractor;
    private final SingleStepExtractor singleStepExtractor;
    private final ProcessResolver processResolver;

    public CwlSlicer(final LoadingContext loadingContext) {
        this.loadingContext = loadingContext;
        this.subgraphExtractor = new SubgraphExtractor(loadingContext);
        this.singleStepExtractor = new SingleStepExtractor(loadingContext);
        this.processResolver = new ProcessResolver(loadingContext);
    }

    /**
     * Workflow document holding everything reachable from {@code roots}, with dangling dependencies turned
     * into new inputs.
     */
    public ObjectNode getSubgraph(final Collection<String> roots, final Process workflow) {
        return subgraphExtractor.extract(roots, workflow);
    }

    /**
     * One-step workflow document running the step {@code stepId}.
     */
    public ObjectNode getStep(final Workflow workflow, final String stepId) {
        return singleStepExtractor.extract(workflow, stepId);
    }

    /**
     * The process run by step {@code stepId}, together with the step.
     */
    public ProcessResolution getProcess(final Workflow workflow, final String stepId) {
        return processResolver.resolve(workflow, stepId);
    }
}
