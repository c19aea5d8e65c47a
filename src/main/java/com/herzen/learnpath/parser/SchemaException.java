package com.herzen.learnpath.parser;

/** The source cannot be analysed at all: unreadable, missing a required column, or without a single valid row. */
public class SchemaException extends RuntimeException {
    public SchemaException(String message) {
        super(message);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
