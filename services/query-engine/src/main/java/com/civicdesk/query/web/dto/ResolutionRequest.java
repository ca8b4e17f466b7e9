package com.civicdesk.query.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Payload committing a resolution. The message is shown to the customer.
 */
public class ResolutionRequest {

    @NotBlank
    @Size(max = 4000)
    private String message;

    public ResolutionRequest() {
    }

    public ResolutionRequest(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
