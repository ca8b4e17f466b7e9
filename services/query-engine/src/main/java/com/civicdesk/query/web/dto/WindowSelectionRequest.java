package com.civicdesk.query.web.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Payload for changing the metrics window shared by every metrics stream.
 */
public class WindowSelectionRequest {

    @NotBlank
    private String window;

    public WindowSelectionRequest() {
    }

    public WindowSelectionRequest(String window) {
        this.window = window;
    }

    public String getWindow() {
        return window;
    }

    public void setWindow(String window) {
        this.window = window;
    }
}
