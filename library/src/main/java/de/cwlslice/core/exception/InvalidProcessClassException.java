package de.cwlslice.core.exception;

import lombok.Getter;

/**
 * Raised when an operation that needs a {@code Workflow} document receives another process class.
 */
@Getter
public class InvalidProcessClassException extends CwlSliceException {

    private final String processClass;

    public InvalidProcessClassException(final String processClass) {
        super("Can only extract subgraph from workflow, got class '%s'".formatted(processClass));
        this.processClass = processClass;
    }
}
