package com.civicdesk.query.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The query store failed or did not answer in time. A merge is never applied
 * partially, but a merge that timed out may have been committed after all;
 * callers should read the query back instead of assuming the prior state.
 */
@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class PersistenceException extends QueryEngineException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
