package com.civicdesk.query.web;

import java.util.Optional;

import org.springframework.stereotype.Component;

import com.civicdesk.query.domain.Query;
import com.civicdesk.query.domain.QueryAssignment;
import com.civicdesk.query.domain.QueryChangeEvent;
import com.civicdesk.query.domain.QueryResolution;
import com.civicdesk.query.domain.StaffUser;
import com.civicdesk.query.web.dto.QueryChangeResponse;
import com.civicdesk.query.web.dto.QueryResponse;
import com.civicdesk.query.web.dto.StaffResponse;

/**
 * Centralises conversion between engine records and API DTOs so the shape of
 * responses stays consistent across controllers.
 */
@Component
public class QueryMapper {

    public QueryResponse toResponse(Query query) {
        Optional<QueryAssignment> assignment = query.currentAssignment();
        Optional<QueryResolution> resolution = query.currentResolution();
        return new QueryResponse(
            query.id(),
            query.referenceId(),
            query.accountNumber(),
            query.customerName(),
            query.contactNumber(),
            query.description(),
            query.queryType(),
            query.submissionDate(),
            query.status(),
            assignment.map(QueryAssignment::assignedTo).orElse(null),
            assignment.map(QueryAssignment::assignedToName).orElse(null),
            assignment.map(QueryAssignment::assignedBy).orElse(null),
            assignment.map(QueryAssignment::assignedAt).orElse(null),
            resolution.map(QueryResolution::message).orElse(null),
            resolution.map(QueryResolution::resolutionDate).orElse(null),
            resolution.map(QueryResolution::resolvedBy).orElse(null),
            query.lastUpdated(),
            query.updatedBy()
        );
    }

    public QueryChangeResponse toResponse(QueryChangeEvent event) {
        return new QueryChangeResponse(event.type(), toResponse(event.query()));
    }

    public StaffResponse toResponse(StaffUser user) {
        return new StaffResponse(user.id(), user.name(), user.email(), user.department(), user.role().value());
    }
}
