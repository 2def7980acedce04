package de.cwlslice.core.exception;

public class DocumentLoadException extends CwlSliceException {

    public DocumentLoadException(final String message) {
        super(message);
    }

    public DocumentLoadException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
