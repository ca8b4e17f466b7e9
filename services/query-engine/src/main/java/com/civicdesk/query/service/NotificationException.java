package com.civicdesk.query.service;

/**
 * Delivery of an assignment notification failed. Raised by notification sinks;
 * the engine logs it and keeps the assignment.
 */
public class NotificationException extends QueryEngineException {

    public NotificationException(String message) {
        super(message);
    }

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
