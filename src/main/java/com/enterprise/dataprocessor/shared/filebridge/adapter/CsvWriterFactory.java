package com.enterprise.dataprocessor.shared.filebridge.adapter;

import org.springframework.batch.item.file.FlatFileHeaderCallback;
import org.springframework.batch.item.file.FlatFileItemWriter;
import org.springframework.batch.item.file.transform.RecordFieldExtractor;
import org.springframework.core.io.WritableResource;

/**
 * Factory that creates CSV {@link FlatFileItemWriter} instances for Java
 * records, using {@link RecordFieldExtractor} for field extraction and
 * {@link CsvLineAggregator} for quoting.
 *
 * <p>Field names drive both value extraction (record components) and
 * header generation.
 *
 * <p>Typical usage:
 * <pre>{@code
 * FlatFileItemWriter<DerivedRecord> writer = factory.csvWriter("processedData",
 *         new FileSystemResource("output/processed_data.csv"),
 *         DerivedRecord.class,
 *         new String[]{"id", "title", "body", "groupId"});
 * }</pre>
 */
public class CsvWriterFactory {

    private static final String ENCODING = "UTF-8";

    private String delimiter = ",";
    private String lineSeparator = "\n";

    /**
     * Creates a CSV writer with a header joined from the field names.
     *
     * @param <T>        record type
     * @param name       writer name (for restart data and logging)
     * @param resource   output file resource
     * @param recordType record class the field names refer to
     * @param fieldNames record component names, in column order
     * @return configured writer
     */
    public <T> FlatFileItemWriter<T> csvWriter(
            String name,
            WritableResource resource,
            Class<T> recordType,
            String[] fieldNames) {

        if (fieldNames == null || fieldNames.length == 0) {
            throw new IllegalArgumentException("fieldNames must not be empty");
        }
        CsvLineAggregator<T> headerFormat = lineAggregator();
        return csvWriter(name, resource, recordType, fieldNames,
                w -> w.write(headerFormat.join(fieldNames)));
    }

    /**
     * Creates a CSV writer with a custom header callback.
     *
     * @param <T>            record type
     * @param name           writer name (for restart data and logging)
     * @param resource       output file resource
     * @param recordType     record class the field names refer to
     * @param fieldNames     record component names, in column order
     * @param headerCallback writes the header line (or {@code null} to skip)
     * @return configured writer
     */
    public <T> FlatFileItemWriter<T> csvWriter(
            String name,
            WritableResource resource,
            Class<T> recordType,
            String[] fieldNames,
            FlatFileHeaderCallback headerCallback) {

        if (fieldNames == null || fieldNames.length == 0) {
            throw new IllegalArgumentException("fieldNames must not be empty");
        }

        RecordFieldExtractor<T> extractor = new RecordFieldExtractor<>(recordType);
        extractor.setNames(fieldNames);

        CsvLineAggregator<T> aggregator = lineAggregator();
        aggregator.setFieldExtractor(extractor);

        FlatFileItemWriter<T> writer = new FlatFileItemWriter<>();
        writer.setName(name);
        writer.setResource(resource);
        writer.setEncoding(ENCODING);
        writer.setLineSeparator(lineSeparator);
        writer.setShouldDeleteIfExists(true);
        writer.setLineAggregator(aggregator);
        if (headerCallback != null) {
            writer.setHeaderCallback(headerCallback);
        }
        return writer;
    }

    private <T> CsvLineAggregator<T> lineAggregator() {
        CsvLineAggregator<T> aggregator = new CsvLineAggregator<>();
        aggregator.setDelimiter(delimiter);
        return aggregator;
    }

    /** Field delimiter. Default {@code ","}. */
    public void setDelimiter(String delimiter) {
        this.delimiter = delimiter;
    }

    /** Line separator. Default {@code "\n"} regardless of platform. */
    public void setLineSeparator(String lineSeparator) {
        this.lineSeparator = lineSeparator;
    }
}
