package com.civicdesk.query.service;

import java.util.Locale;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import com.civicdesk.query.domain.QueryAction;

/**
 * The actor's role does not grant the requested capability. Nothing was written
 * and nothing was sent when this is raised.
 */
@ResponseStatus(HttpStatus.FORBIDDEN)
public class AuthorizationException extends QueryEngineException {

    public AuthorizationException(String actorId, QueryAction action) {
        super("Actor %s is not allowed to %s queries".formatted(actorId, action.name().toLowerCase(Locale.ROOT).replace('_', ' ')));
    }

    public AuthorizationException(String message) {
        super(message);
    }
}
