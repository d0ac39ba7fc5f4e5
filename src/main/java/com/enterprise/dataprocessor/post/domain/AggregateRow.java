package com.enterprise.dataprocessor.post.domain;

/**
 * Per-group statistics. {@code avgTitleLength} is rounded to 2 decimal places.
 */
public record AggregateRow(
    int count,
    double avgTitleLength,
    long totalWordCount
) {}
