package com.stagegraph.definition.parser;

/** Base class for errors that abort a manifest or script parse. Nothing is partially applied. */
public class DefinitionException extends RuntimeException {

    public DefinitionException(String message) {
        super(message);
    }

    public DefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
