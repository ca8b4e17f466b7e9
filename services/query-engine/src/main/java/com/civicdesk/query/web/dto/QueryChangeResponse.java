package com.civicdesk.query.web.dto;

import com.civicdesk.query.domain.ChangeType;

/**
 * One event of the live query stream.
 */
public record QueryChangeResponse(ChangeType type, QueryResponse query) {
}
