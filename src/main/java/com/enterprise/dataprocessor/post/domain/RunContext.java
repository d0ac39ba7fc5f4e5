package com.enterprise.dataprocessor.post.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable metadata of one job run, built once at launch and handed to
 * every stage that needs it.
 */
public record RunContext(
    String jobName,
    String executionId,
    boolean manualTrigger,
    Instant startedAt
) {

    public RunContext {
        Objects.requireNonNull(jobName, "jobName");
        Objects.requireNonNull(executionId, "executionId");
        Objects.requireNonNull(startedAt, "startedAt");
    }
}
