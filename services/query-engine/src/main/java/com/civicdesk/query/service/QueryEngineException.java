package com.civicdesk.query.service;

/**
 * Base type for every failure the engine reports to its callers.
 */
public abstract class QueryEngineException extends RuntimeException {

    protected QueryEngineException(String message) {
        super(message);
    }

    protected QueryEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
