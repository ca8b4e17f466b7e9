package com.civicdesk.query.domain;

import java.util.List;

public record MetricsSeries(MetricsWindow window, List<MetricsBucket> buckets) {

    public MetricsSeries {
        buckets = List.copyOf(buckets);
    }
}
