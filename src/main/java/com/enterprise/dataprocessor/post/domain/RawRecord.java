package com.enterprise.dataprocessor.post.domain;

/**
 * A post as received from the data source. {@code title} and {@code body}
 * may be {@code null}.
 */
public record RawRecord(
    long id,
    String title,
    String body,
    int groupId
) {}
