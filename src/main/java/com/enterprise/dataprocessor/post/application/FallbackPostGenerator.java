package com.enterprise.dataprocessor.post.application;

import com.enterprise.dataprocessor.post.domain.RawRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic mock posts used when the remote source is unavailable.
 * Record {@code i} (1-based) belongs to group {@code ((i - 1) % 3) + 1}.
 */
public class FallbackPostGenerator {

    static final int GROUP_COUNT = 3;

    public List<RawRecord> generate(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative: " + count);
        }
        List<RawRecord> records = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            records.add(new RawRecord(
                i,
                "Sample Data Entry " + i,
                "This is mock data entry number " + i,
                ((i - 1) % GROUP_COUNT) + 1));
        }
        return List.copyOf(records);
    }
}
