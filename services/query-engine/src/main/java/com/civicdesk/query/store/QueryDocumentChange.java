package com.civicdesk.query.store;

import com.civicdesk.query.domain.ChangeType;

/**
 * A push delta from the store subscription. Always carries the full current document.
 */
public record QueryDocumentChange(ChangeType type, QueryDocument document) {

    public static QueryDocumentChange added(QueryDocument document) {
        return new QueryDocumentChange(ChangeType.ADDED, document);
    }

    public static QueryDocumentChange modified(QueryDocument document) {
        return new QueryDocumentChange(ChangeType.MODIFIED, document);
    }

    public static QueryDocumentChange removed(QueryDocument document) {
        return new QueryDocumentChange(ChangeType.REMOVED, document);
    }
}
