package com.civicdesk.query.domain;

public enum ChangeType {
    ADDED,
    MODIFIED,
    REMOVED
}
