package de.cwlslice.core.exception;

import lombok.Getter;

@Getter
public class UnknownRootException extends CwlSliceException {

    private final String rootId;

    public UnknownRootException(final String rootId) {
        super("Root '%s' is not part of the workflow graph".formatted(rootId));
        this.rootId = rootId;
    }
}
