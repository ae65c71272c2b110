package org.dynamis.builder;

public class DynamisBuilderException extends RuntimeException {

    public DynamisBuilderException(String message) {
        super(message);
    }

    public DynamisBuilderException(String message, Throwable cause) {
        super(message, cause);
    }

    public DynamisBuilderException(Throwable cause) {
        super(cause);
    }
}
