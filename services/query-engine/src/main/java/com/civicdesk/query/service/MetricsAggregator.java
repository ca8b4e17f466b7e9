package com.civicdesk.query.service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.civicdesk.query.domain.MetricsBucket;
import com.civicdesk.query.domain.MetricsSeries;
import com.civicdesk.query.domain.MetricsWindow;
import com.civicdesk.query.domain.Query;
import com.civicdesk.query.domain.QueryStatus;
import com.civicdesk.query.domain.StatusSummary;

/**
 * Derives the query analytics series from a set of queries.
 *
 * <p>For each day of the trailing window it counts submissions and averages the
 * resolution latency of queries resolved that day. Latency is the whole number
 * of days between submission and resolution, rounded up; since resolution dates
 * are stored at midnight, a query resolved on the day it was submitted counts
 * as one day. Computation is pure: the same input always yields the same series.</p>
 */
@Component
public class MetricsAggregator {

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final ZoneId zone;

    public MetricsAggregator(ZoneId zone) {
        this.zone = zone;
    }

    public MetricsSeries compute(Collection<Query> queries, MetricsWindow window, LocalDate today) {
        Map<LocalDate, Long> submissions = queries.stream()
            .collect(Collectors.groupingBy(query -> day(query.submissionDate()), Collectors.counting()));

        Map<LocalDate, List<Query>> resolutions = queries.stream()
            .filter(query -> query.status() == QueryStatus.RESOLVED)
            .collect(Collectors.groupingBy(query -> day(query.resolution().resolutionDate())));

        List<MetricsBucket> buckets = new ArrayList<>(window.days());
        LocalDate first = today.minusDays(window.days() - 1L);
        for (int offset = 0; offset < window.days(); offset++) {
            LocalDate date = first.plusDays(offset);
            int queryCount = submissions.getOrDefault(date, 0L).intValue();
            buckets.add(new MetricsBucket(date, queryCount, averageLatency(resolutions.get(date))));
        }
        return new MetricsSeries(window, buckets);
    }

    public StatusSummary summarize(Collection<Query> queries) {
        Map<QueryStatus, Long> byStatus = queries.stream()
            .collect(Collectors.groupingBy(Query::status, Collectors.counting()));
        long unassigned = queries.stream()
            .filter(query -> query.status() != QueryStatus.RESOLVED && !query.isAssigned())
            .count();
        return new StatusSummary(
            byStatus.getOrDefault(QueryStatus.OPEN, 0L),
            byStatus.getOrDefault(QueryStatus.ACTIVE, 0L),
            byStatus.getOrDefault(QueryStatus.RESOLVED, 0L),
            unassigned,
            queries.size()
        );
    }

    /**
     * Whole days between submission and resolution, rounded up.
     */
    static long latencyDays(Instant submitted, Instant resolved) {
        long millis = Math.abs(Duration.between(submitted, resolved).toMillis());
        return (long) Math.ceil(millis / MILLIS_PER_DAY);
    }

    private Double averageLatency(List<Query> resolved) {
        if (resolved == null || resolved.isEmpty()) {
            return null;
        }
        double mean = resolved.stream()
            .mapToLong(query -> latencyDays(query.submissionDate(), query.resolution().resolutionDate()))
            .average()
            .orElse(0);
        return BigDecimal.valueOf(mean).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }

    private LocalDate day(Instant instant) {
        return instant.atZone(zone).toLocalDate();
    }
}
