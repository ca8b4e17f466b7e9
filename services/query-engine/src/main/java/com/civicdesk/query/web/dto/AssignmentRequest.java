package com.civicdesk.query.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Payload sent by a superadmin to (re)assign a query.
 */
public class AssignmentRequest {

    @NotBlank
    @Size(max = 128)
    private String assigneeId;

    public AssignmentRequest() {
    }

    public AssignmentRequest(String assigneeId) {
        this.assigneeId = assigneeId;
    }

    public String getAssigneeId() {
        return assigneeId;
    }

    public void setAssigneeId(String assigneeId) {
        this.assigneeId = assigneeId;
    }
}
