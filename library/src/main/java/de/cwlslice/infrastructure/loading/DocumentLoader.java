package de.cwlslice.infrastructure.loading;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.cwlslice.core.model.Process;
import de.cwlslice.core.model.ProcessFactory;

import java.util.Optional;

/**
 * Resolves external process references into live process objects.
 */
public interface DocumentLoader {

    /**
     * Loads (or returns the already loaded) process at {@code location}.
     */
    Process resolve(final String location);

    /**
     * Looks a reference up in the identifier index without loading anything.
     */
    Optional<Process> lookup(final String reference);

    default Process makeTool(final ObjectNode document) {
        return ProcessFactory.create(document, JsonNodeFactory.instance.objectNode());
    }
}
