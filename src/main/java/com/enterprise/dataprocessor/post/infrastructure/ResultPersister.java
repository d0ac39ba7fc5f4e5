package com.enterprise.dataprocessor.post.infrastructure;

import com.enterprise.dataprocessor.post.domain.AnalysisReport;
import com.enterprise.dataprocessor.post.domain.DerivedRecord;
import com.enterprise.dataprocessor.shared.filebridge.adapter.AtomicFiles;
import com.enterprise.dataprocessor.shared.filebridge.adapter.CsvWriterFactory;

import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.Chunk;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.file.FlatFileItemWriter;
import org.springframework.core.io.FileSystemResource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the two artifacts of a run into the output directory:
 * <ul>
 *   <li>{@code processed_data_<executionId>.csv} — one row per derived record</li>
 *   <li>{@code analysis_<executionId>.json} — the indented analysis report</li>
 * </ul>
 * Both go through {@link AtomicFiles}, so a rerun with the same execution id
 * replaces the previous pair and a crash leaves no partial file behind.
 */
@Slf4j
public class ResultPersister {

    static final String[] CSV_COLUMNS = {
        "id", "title", "body", "groupId", "processedAt", "titleLength", "wordCount"
    };

    private final CsvWriterFactory csvWriterFactory;
    private final ObjectWriter reportWriter;

    public ResultPersister(CsvWriterFactory csvWriterFactory) {
        this.csvWriterFactory = csvWriterFactory;
        this.reportWriter = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build()
            .writerWithDefaultPrettyPrinter();
    }

    public static Path csvPath(Path outputDir, String executionId) {
        return outputDir.resolve("processed_data_" + executionId + ".csv");
    }

    public static Path jsonPath(Path outputDir, String executionId) {
        return outputDir.resolve("analysis_" + executionId + ".json");
    }

    public PersistedFiles persist(
            List<DerivedRecord> records,
            AnalysisReport report,
            Path outputDir,
            String executionId) {

        requireFileNameFragment(executionId);
        log.info("Saving processing results...");
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory " + outputDir, e);
        }

        Path csvPath = csvPath(outputDir, executionId);
        AtomicFiles.write(csvPath, path -> writeCsv(records, path));
        log.info("Saved processed data to: {}", csvPath);

        Path jsonPath = jsonPath(outputDir, executionId);
        AtomicFiles.write(jsonPath, path -> reportWriter.writeValue(path.toFile(), report));
        log.info("Saved analysis to: {}", jsonPath);

        PersistedFiles files = new PersistedFiles(csvPath, size(csvPath), jsonPath, size(jsonPath));
        log.info("File sizes: CSV={} bytes, JSON={} bytes", files.csvSize(), files.jsonSize());
        return files;
    }

    private void writeCsv(List<DerivedRecord> records, Path path) throws Exception {
        FlatFileItemWriter<DerivedRecord> writer = csvWriterFactory.csvWriter(
            "processedDataWriter", new FileSystemResource(path), DerivedRecord.class, CSV_COLUMNS);
        // runs inside the step transaction; a transactional writer would only flush on commit
        writer.setTransactional(false);
        writer.open(new ExecutionContext());
        try {
            writer.write(new Chunk<>(records));
        } finally {
            writer.close();
        }
    }

    private static long size(Path path) {
        try {
            return Files.size(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read size of " + path, e);
        }
    }

    private static void requireFileNameFragment(String executionId) {
        if (executionId == null || executionId.isBlank()
                || executionId.contains("/") || executionId.contains("\\")) {
            throw new IllegalArgumentException("Invalid execution id for file names: '" + executionId + "'");
        }
    }
}
