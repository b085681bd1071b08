package com.phillippitts.culinara.exception;

/** Thrown when the vector store cannot be queried. */
public class StoreUnavailableException extends SourceUnavailableException {

    public static final String SOURCE = "vector-store";

    public StoreUnavailableException(String message) {
        super(message, SOURCE);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, SOURCE, cause);
    }
}
