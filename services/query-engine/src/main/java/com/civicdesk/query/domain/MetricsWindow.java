package com.civicdesk.query.domain;

import java.util.Arrays;

import com.civicdesk.query.service.ValidationException;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Trailing windows offered on the query analytics chart.
 */
public enum MetricsWindow {
    LAST_7_DAYS("7D", 7),
    LAST_30_DAYS("30D", 30),
    LAST_3_MONTHS("3M", 90),
    LAST_6_MONTHS("6M", 180),
    LAST_12_MONTHS("12M", 365);

    private final String label;
    private final int days;

    MetricsWindow(String label, int days) {
        this.label = label;
        this.days = days;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public int days() {
        return days;
    }

    public static MetricsWindow ofDays(int days) {
        return Arrays.stream(values())
            .filter(window -> window.days == days)
            .findFirst()
            .orElseThrow(() -> new ValidationException("Unsupported metrics window of %d days".formatted(days)));
    }

    /**
     * Accepts either a label ({@code "30D"}, {@code "3M"}) or a plain day count ({@code "90"}).
     */
    public static MetricsWindow fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new ValidationException("Metrics window must not be blank");
        }
        String candidate = label.trim();
        for (MetricsWindow window : values()) {
            if (window.label.equalsIgnoreCase(candidate)) {
                return window;
            }
        }
        try {
            return ofDays(Integer.parseInt(candidate));
        } catch (NumberFormatException e) {
            throw new ValidationException("Unknown metrics window '%s'".formatted(label));
        }
    }
}
