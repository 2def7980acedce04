package de.cwlslice.core.exception;

import lombok.Getter;

@Getter
public class StepNotFoundException extends CwlSliceException {

    private final String stepId;

    public StepNotFoundException(final String stepId) {
        super("Step '%s' was not found".formatted(stepId));
        this.stepId = stepId;
    }
}
