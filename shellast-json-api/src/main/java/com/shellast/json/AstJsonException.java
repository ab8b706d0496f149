package com.shellast.json;

/**
 * A shell tree could not be written as JSON, or JSON could not be read back
 * into one. The underlying library's exception is kept as the cause.
 */
public class AstJsonException extends RuntimeException {

    public AstJsonException(String message) {
        super(message);
    }

    public AstJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
