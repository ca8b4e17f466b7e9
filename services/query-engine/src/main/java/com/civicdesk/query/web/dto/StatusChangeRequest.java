package com.civicdesk.query.web.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Payload for moving a query to {@code Open} or {@code Active}.
 */
public class StatusChangeRequest {

    @NotBlank
    private String status;

    public StatusChangeRequest() {
    }

    public StatusChangeRequest(String status) {
        this.status = status;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }
}
