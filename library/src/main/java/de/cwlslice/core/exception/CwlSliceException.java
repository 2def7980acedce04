package de.cwlslice.core.exception;

public class CwlSliceException extends RuntimeException {

    public CwlSliceException() {
        super();
    }

    public CwlSliceException(final String message) {
        super(message);
    }

    public CwlSliceException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public CwlSliceException(final Throwable cause) {
        super(cause);
    }
}
