package de.cwlslice.infrastructure.loading;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.cwlslice.core.exception.MissingLoaderException;
import de.cwlslice.core.extraction.ExtractionOptions;
import de.cwlslice.core.model.Process;
import de.cwlslice.core.model.ProcessFactory;
import lombok.Builder;
import lombok.Getter;

import java.util.Objects;
import java.util.Optional;

@Getter
@Builder
public class LoadingContext {

    private final DocumentLoader loader;
    @Builder.Default
    private final ExtractionOptions options = ExtractionOptions.ofDefault();

    public static LoadingContext of(final DocumentLoader loader) {
        return LoadingContext.builder().loader(loader).build();
    }

    public DocumentLoader requireLoader() {
        if (Objects.isNull(loader)) {
            throw new MissingLoaderException();
        }
        return loader;
    }

    public Optional<Process> lookup(final String reference) {
        if (Objects.isNull(loader)) {
            return Optional.empty();
        }
        return loader.lookup(reference);
    }

    public Process makeTool(final ObjectNode document) {
        if (Objects.isNull(loader)) {
            return ProcessFactory.create(document, JsonNodeFactory.instance.objectNode());
        }
        return loader.makeTool(document);
    }
}
