package com.civicdesk.query.domain;

import java.time.LocalDate;

/**
 * One calendar day of the analytics series. {@code avgResolutionDays} is
 * {@code null} when nothing was resolved that day, which charts render as a gap.
 */
public record MetricsBucket(LocalDate date, int queryCount, Double avgResolutionDays) {

    public boolean hasResolutions() {
        return avgResolutionDays != null;
    }
}
