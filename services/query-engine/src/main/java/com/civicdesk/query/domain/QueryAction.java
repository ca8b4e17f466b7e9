package com.civicdesk.query.domain;

/**
 * Capabilities checked by the access policy before any query operation.
 */
public enum QueryAction {
    VIEW,
    CHANGE_STATUS,
    RESOLVE,
    ASSIGN
}
