package com.propertyintel.housekeeping.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Dense Before x After cross-tabulation of HSK statuses.
 * Both axes hold the observed statuses sorted ascending; unobserved pairs count 0.
 */
public class TransitionMatrix {

    private final List<String> beforeStatuses;
    private final List<String> afterStatuses;
    private final Map<String, Map<String, Long>> counts;

    public TransitionMatrix(List<String> beforeStatuses, List<String> afterStatuses,
                            Map<String, Map<String, Long>> counts) {
        this.beforeStatuses = List.copyOf(beforeStatuses);
        this.afterStatuses = List.copyOf(afterStatuses);
        this.counts = counts;
    }

    public List<String> getBeforeStatuses() {
        return beforeStatuses;
    }

    public List<String> getAfterStatuses() {
        return afterStatuses;
    }

    public long count(String before, String after) {
        return counts.getOrDefault(before, Collections.emptyMap()).getOrDefault(after, 0L);
    }

    public long total() {
        return counts.values().stream()
                .flatMap(row -> row.values().stream())
                .mapToLong(Long::longValue)
                .sum();
    }

    public boolean isEmpty() {
        return beforeStatuses.isEmpty();
    }
}
