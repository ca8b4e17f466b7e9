package com.civicdesk.query.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Exception thrown when a query id does not exist. Spring WebFlux maps it to a
 * 404 response via {@link org.springframework.web.bind.annotation.ResponseStatus}.
 */
@ResponseStatus(HttpStatus.NOT_FOUND)
public class QueryNotFoundException extends QueryEngineException {

    public QueryNotFoundException(String id) {
        super("Query with id %s not found".formatted(id));
    }
}
