package com.enterprise.dataprocessor.post.application;

import com.enterprise.dataprocessor.post.domain.DerivedRecord;
import com.enterprise.dataprocessor.post.domain.RawRecord;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Adds the derived fields to each post.
 *
 * <p><b>titleLength</b> — number of Unicode code points in the title.
 *
 * <p><b>wordCount</b> — number of whitespace-separated tokens in the body.
 *
 * <p>A {@code null} title or body is counted as the empty string (0) rather
 * than rejected; the {@code null} itself is carried into the derived record.
 */
public class PostTransformer {

    private static final Pattern TOKEN = Pattern.compile("\\S+", Pattern.UNICODE_CHARACTER_CLASS);

    public List<DerivedRecord> transform(List<RawRecord> records, Instant capturedAt) {
        return records.stream()
            .map(record -> derive(record, capturedAt))
            .toList();
    }

    public DerivedRecord derive(RawRecord record, Instant capturedAt) {
        Objects.requireNonNull(record, "record");
        Objects.requireNonNull(capturedAt, "capturedAt");
        return new DerivedRecord(
            record.id(), record.title(), record.body(), record.groupId(),
            capturedAt, titleLength(record.title()), wordCount(record.body()));
    }

    static int titleLength(String title) {
        return title == null ? 0 : title.codePointCount(0, title.length());
    }

    static int wordCount(String body) {
        return body == null ? 0 : (int) TOKEN.matcher(body).results().count();
    }
}
