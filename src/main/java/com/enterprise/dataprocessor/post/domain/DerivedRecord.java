package com.enterprise.dataprocessor.post.domain;

import java.time.Instant;

public record DerivedRecord(
    long id,
    String title,
    String body,
    int groupId,
    Instant processedAt,
    int titleLength,
    int wordCount
) {}
