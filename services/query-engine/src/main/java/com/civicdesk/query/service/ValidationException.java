package com.civicdesk.query.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Input was rejected before any state change was attempted: a blank resolution
 * message, an unknown or disallowed status, an unsupported metrics window.
 */
@ResponseStatus(HttpStatus.BAD_REQUEST)
public class ValidationException extends QueryEngineException {

    public ValidationException(String message) {
        super(message);
    }
}
