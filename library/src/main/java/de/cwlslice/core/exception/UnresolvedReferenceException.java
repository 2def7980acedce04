package de.cwlslice.core.exception;

import lombok.Getter;

/**
 * Raised when a {@code run} reference has not been loaded into the loader's identifier index.
 */
@Getter
public class UnresolvedReferenceException extends CwlSliceException {

    private final String reference;

    public UnresolvedReferenceException(final String reference) {
        super("Reference '%s' is not present in the loader index".formatted(reference));
        this.reference = reference;
    }
}
