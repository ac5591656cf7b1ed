package com.purchasingpower.codegraph.exception;

import lombok.Getter;

/**
 * Raised when the graph store cannot complete a write, read or delete.
 */
@Getter
public class GraphStoreException extends RuntimeException {

    private final String operation;

    public GraphStoreException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    public GraphStoreException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

}
