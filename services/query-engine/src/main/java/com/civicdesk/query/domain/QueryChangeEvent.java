package com.civicdesk.query.domain;

/**
 * One delta of the live query set as seen by engine subscribers.
 */
public record QueryChangeEvent(ChangeType type, Query query) {

    public static QueryChangeEvent added(Query query) {
        return new QueryChangeEvent(ChangeType.ADDED, query);
    }

    public static QueryChangeEvent modified(Query query) {
        return new QueryChangeEvent(ChangeType.MODIFIED, query);
    }

    public static QueryChangeEvent removed(Query query) {
        return new QueryChangeEvent(ChangeType.REMOVED, query);
    }
}
