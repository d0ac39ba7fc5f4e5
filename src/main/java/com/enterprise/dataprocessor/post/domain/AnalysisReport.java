package com.enterprise.dataprocessor.post.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Run metadata, dataset-wide summary and per-group breakdown of one run.
 *
 * <p>The breakdown is copied into an unmodifiable map sorted by group id, so
 * serialization order never depends on the caller's map implementation.
 */
public record AnalysisReport(
    ExecutionInfo executionInfo,
    Summary summary,
    SortedMap<Integer, AggregateRow> breakdown
) {

    public AnalysisReport {
        breakdown = Collections.unmodifiableSortedMap(new TreeMap<>(breakdown));
    }

    public record ExecutionInfo(
        String jobName,
        String executionId,
        boolean manualTrigger,
        Instant completedAt
    ) {}

    public record Summary(
        int totalRecords,
        int uniqueGroups,
        double avgTitleLength,
        long totalWordCount,
        int minTitleLength,
        int maxTitleLength
    ) {}
}
