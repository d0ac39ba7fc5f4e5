package com.enterprise.dataprocessor.shared.filebridge.adapter;

import org.springframework.batch.item.file.transform.ExtractorLineAggregator;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Delimited line aggregator with RFC 4180 minimal quoting: a field is wrapped
 * in double quotes only when it contains the delimiter, a double quote, CR or
 * LF, and embedded quotes are doubled. {@code null} renders as an empty field.
 *
 * @param <T> item type
 */
public class CsvLineAggregator<T> extends ExtractorLineAggregator<T> {

    private static final String QUOTE = "\"";

    private String delimiter = ",";

    @Override
    protected String doAggregate(Object[] fields) {
        return join(fields);
    }

    /** Joins already-extracted values, quoting as needed. Also used for header lines. */
    public String join(Object[] fields) {
        return Arrays.stream(fields)
            .map(this::render)
            .collect(Collectors.joining(delimiter));
    }

    String render(Object field) {
        String value = field == null ? "" : field.toString();
        if (value.contains(delimiter) || value.contains(QUOTE)
                || value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
            return QUOTE + value.replace(QUOTE, QUOTE + QUOTE) + QUOTE;
        }
        return value;
    }

    /** Field delimiter. Default {@code ","}. */
    public void setDelimiter(String delimiter) {
        this.delimiter = delimiter;
    }
}
