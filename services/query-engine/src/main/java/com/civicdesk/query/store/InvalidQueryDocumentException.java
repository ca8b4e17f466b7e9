package com.civicdesk.query.store;

/**
 * A store document does not satisfy the query invariants and cannot be turned
 * into a {@link com.civicdesk.query.domain.Query}.
 */
public class InvalidQueryDocumentException extends RuntimeException {

    private final String documentId;

    public InvalidQueryDocumentException(String documentId, String reason) {
        super("Query document %s rejected: %s".formatted(documentId, reason));
        this.documentId = documentId;
    }

    public String getDocumentId() {
        return documentId;
    }
}
