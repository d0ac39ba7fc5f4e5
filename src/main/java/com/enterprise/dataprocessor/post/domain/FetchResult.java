package com.enterprise.dataprocessor.post.domain;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a remote fetch: either the records or the reason it failed.
 */
public sealed interface FetchResult permits FetchResult.Success, FetchResult.Failure {

    static FetchResult success(List<RawRecord> records) {
        return new Success(records);
    }

    static FetchResult failure(String reason) {
        return new Failure(reason);
    }

    record Success(List<RawRecord> records) implements FetchResult {

        public Success {
            records = List.copyOf(records);
        }
    }

    record Failure(String reason) implements FetchResult {

        public Failure {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
