package de.cwlslice.core.exception;

public class MissingLoaderException extends CwlSliceException {

    public MissingLoaderException() {
        super("Loading context has no document loader");
    }

    public MissingLoaderException(final String message) {
        super(message);
    }
}
