package com.enterprise.dataprocessor.post.application;

import com.enterprise.dataprocessor.post.domain.FetchResult;
import com.enterprise.dataprocessor.post.domain.RawRecord;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * Supplies the raw records of a run. Tries the remote {@link PostSource}
 * once and substitutes {@link FallbackPostGenerator} data on failure, so
 * {@link #fetch(int)} never fails outward.
 */
@Slf4j
public class PostDataSource {

    private final PostSource source;
    private final FallbackPostGenerator fallback;

    public PostDataSource(PostSource source, FallbackPostGenerator fallback) {
        this.source = Objects.requireNonNull(source, "source");
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    public List<RawRecord> fetch(int limit) {
        FetchResult result = source.fetch(limit);
        if (result instanceof FetchResult.Failure failure) {
            log.error("Failed to fetch data: {}", failure.reason());
            log.info("Generating mock data as fallback...");
            return fallback.generate(limit);
        }
        List<RawRecord> records = ((FetchResult.Success) result).records();
        if (records.size() > limit) {
            records = List.copyOf(records.subList(0, limit));
        }
        log.info("Successfully fetched {} records", records.size());
        return records;
    }
}
