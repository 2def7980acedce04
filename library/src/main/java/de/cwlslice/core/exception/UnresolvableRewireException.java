package de.cwlslice.core.exception;

import lombok.Getter;

/**
 * Raised when a step node owning a dangling dependency has no matching step record.
 */
@Getter
public class UnresolvableRewireException extends CwlSliceException {

    private final String stepId;
    private final String danglingId;

    public UnresolvableRewireException(final String stepId, final String danglingId) {
        super("Could not find step '%s' while rewiring '%s'".formatted(stepId, danglingId));
        this.stepId = stepId;
        this.danglingId = danglingId;
    }
}
