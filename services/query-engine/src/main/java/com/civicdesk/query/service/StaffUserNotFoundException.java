package com.civicdesk.query.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class StaffUserNotFoundException extends QueryEngineException {

    public StaffUserNotFoundException(String id) {
        super("Staff user with id %s not found".formatted(id));
    }
}
