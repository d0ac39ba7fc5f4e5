package com.enterprise.dataprocessor.post.infrastructure;

import com.enterprise.dataprocessor.config.DataProcessorProperties;
import com.enterprise.dataprocessor.post.application.AnalysisReporter;
import com.enterprise.dataprocessor.post.application.FallbackPostGenerator;
import com.enterprise.dataprocessor.post.application.PostAggregator;
import com.enterprise.dataprocessor.post.application.PostBatch;
import com.enterprise.dataprocessor.post.application.PostDataSource;
import com.enterprise.dataprocessor.post.application.PostSource;
import com.enterprise.dataprocessor.post.application.PostTransformer;
import com.enterprise.dataprocessor.post.domain.AggregateRow;
import com.enterprise.dataprocessor.post.domain.AnalysisReport;
import com.enterprise.dataprocessor.post.domain.DerivedRecord;
import com.enterprise.dataprocessor.post.domain.RawRecord;
import com.enterprise.dataprocessor.shared.filebridge.adapter.CsvWriterFactory;

import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.configuration.annotation.JobScope;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.item.ItemProcessor;
import org.springframework.batch.item.ItemWriter;
import org.springframework.batch.item.support.ListItemReader;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * The data processing job: four strictly sequential steps sharing a
 * job-scoped {@link PostBatch}.
 * <pre>
 * fetchPostsStep      (tasklet)   remote source, fallback on failure
 * transformPostsStep  (chunk)     raw record -> derived record
 * analysisStep        (tasklet)   per-group breakdown + report
 * persistResultsStep  (tasklet)   CSV + JSON into the output directory
 * </pre>
 */
@Slf4j
@Configuration
public class DataProcessingJobConfig {

    private static final int CHUNK_SIZE = 10;

    // --- Pipeline components ---

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    PostDataSource postDataSource(PostSource postSource) {
        return new PostDataSource(postSource, new FallbackPostGenerator());
    }

    @Bean
    PostTransformer postTransformer() {
        return new PostTransformer();
    }

    @Bean
    PostAggregator postAggregator() {
        return new PostAggregator();
    }

    @Bean
    AnalysisReporter analysisReporter(Clock clock) {
        return new AnalysisReporter(clock);
    }

    @Bean
    ResultPersister resultPersister(CsvWriterFactory csvWriterFactory) {
        return new ResultPersister(csvWriterFactory);
    }

    // --- JobScope context ---

    @Bean
    @JobScope
    PostBatch postBatch(@Value("#{jobParameters}") Map<String, Object> jobParameters) {
        return new PostBatch(RunContextParameters.fromJobParameters(jobParameters));
    }

    // --- Step 1: fetch ---

    @Bean
    Step fetchPostsStep(JobRepository jobRepository,
            PlatformTransactionManager transactionManager,
            PostDataSource postDataSource,
            PostBatch postBatch,
            DataProcessorProperties properties) {
        return new StepBuilder("fetchPostsStep", jobRepository)
            .tasklet((contribution, chunkContext) -> {
                postBatch.setRawRecords(postDataSource.fetch(properties.getSource().getLimit()));
                return RepeatStatus.FINISHED;
            }, transactionManager)
            .build();
    }

    // --- Step 2: transform ---

    @Bean
    @StepScope
    ListItemReader<RawRecord> rawRecordReader(PostBatch postBatch) {
        return new ListItemReader<>(postBatch.rawRecords());
    }

    @Bean
    @StepScope
    ItemProcessor<RawRecord, DerivedRecord> postTransformProcessor(
            PostTransformer postTransformer, Clock clock) {
        // one capture per step execution, shared by every record of the run
        Instant capturedAt = clock.instant();
        return item -> postTransformer.derive(item, capturedAt);
    }

    @Bean
    ItemWriter<DerivedRecord> derivedRecordCollector(PostBatch postBatch) {
        return chunk -> postBatch.addDerivedRecords(chunk.getItems());
    }

    @Bean
    Step transformPostsStep(JobRepository jobRepository,
            PlatformTransactionManager transactionManager,
            ListItemReader<RawRecord> rawRecordReader,
            ItemProcessor<RawRecord, DerivedRecord> postTransformProcessor,
            ItemWriter<DerivedRecord> derivedRecordCollector) {
        return new StepBuilder("transformPostsStep", jobRepository)
            .<RawRecord, DerivedRecord>chunk(CHUNK_SIZE, transactionManager)
            .reader(rawRecordReader)
            .processor(postTransformProcessor)
            .writer(derivedRecordCollector)
            .build();
    }

    // --- Step 3: aggregate + report ---

    @Bean
    Step analysisStep(JobRepository jobRepository,
            PlatformTransactionManager transactionManager,
            PostAggregator postAggregator,
            AnalysisReporter analysisReporter,
            PostBatch postBatch) {
        return new StepBuilder("analysisStep", jobRepository)
            .tasklet((contribution, chunkContext) -> {
                List<DerivedRecord> records = postBatch.derivedRecords();
                SortedMap<Integer, AggregateRow> breakdown = postAggregator.aggregate(records);
                AnalysisReport report = analysisReporter.buildReport(records, breakdown, postBatch.context());
                postBatch.setReport(report);
                logStatistics(report);
                return RepeatStatus.FINISHED;
            }, transactionManager)
            .build();
    }

    // --- Step 4: persist ---

    @Bean
    Step persistResultsStep(JobRepository jobRepository,
            PlatformTransactionManager transactionManager,
            ResultPersister resultPersister,
            PostBatch postBatch,
            DataProcessorProperties properties) {
        return new StepBuilder("persistResultsStep", jobRepository)
            .tasklet((contribution, chunkContext) -> {
                resultPersister.persist(
                    postBatch.derivedRecords(),
                    postBatch.report(),
                    Path.of(properties.getOutputDir()),
                    postBatch.context().executionId());
                return RepeatStatus.FINISHED;
            }, transactionManager)
            .build();
    }

    // --- Job ---

    @Bean
    Job dataProcessingJob(JobRepository jobRepository,
            Step fetchPostsStep,
            Step transformPostsStep,
            Step analysisStep,
            Step persistResultsStep) {
        return new JobBuilder("dataProcessingJob", jobRepository)
            .start(fetchPostsStep)
            .next(transformPostsStep)
            .next(analysisStep)
            .next(persistResultsStep)
            .build();
    }

    private static void logStatistics(AnalysisReport report) {
        AnalysisReport.Summary summary = report.summary();
        log.info("Data processing statistics:");
        log.info("   Total records: {}", summary.totalRecords());
        log.info("   Unique groups: {}", summary.uniqueGroups());
        log.info("   Average title length: {}", LogFormat.twoDecimals(summary.avgTitleLength()));
        log.info("   Total words: {}", summary.totalWordCount());
        log.info("Group statistics:");
        report.breakdown().forEach((groupId, row) ->
            log.info("   Group {}: {} posts, avg title length: {}, total words: {}",
                groupId, row.count(), row.avgTitleLength(), row.totalWordCount()));
    }
}
