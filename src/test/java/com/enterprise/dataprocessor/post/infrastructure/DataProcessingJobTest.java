package com.enterprise.dataprocessor.post.infrastructure;

import com.enterprise.dataprocessor.DataProcessorApplication;
import com.enterprise.dataprocessor.post.application.PostSource;
import com.enterprise.dataprocessor.post.domain.AnalysisReport;
import com.enterprise.dataprocessor.post.domain.FetchResult;
import com.enterprise.dataprocessor.post.domain.RawRecord;
import com.enterprise.dataprocessor.post.domain.RunContext;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.TestPropertySource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.BDDMockito.given;

/**
 * Runs the whole job against a stubbed remote source and checks the files
 * written to the output directory.
 */
@SpringBootTest(classes = DataProcessorApplication.class)
@TestPropertySource(properties = {
    "dataprocessor.run-on-startup=false",
    "dataprocessor.output-dir=" + DataProcessingJobTest.OUTPUT_DIR
})
class DataProcessingJobTest {

    static final String OUTPUT_DIR = "target/data-processing-job-test";

    private static final AtomicLong RUN_IDS = new AtomicLong(System.currentTimeMillis());

    @Autowired private JobLauncher jobLauncher;
    @Autowired @Qualifier("dataProcessingJob") private Job dataProcessingJob;
    @MockBean private PostSource postSource;

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());

    @Test
    void remoteFailureRunsOnFallbackData() throws Exception {
        given(postSource.fetch(anyInt())).willReturn(FetchResult.failure("connect timed out"));

        JobExecution execution = launch("fallback-run");

        assertThat(execution.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(execution.getStepExecutions())
            .extracting(StepExecution::getStepName)
            .containsExactly("fetchPostsStep", "transformPostsStep", "analysisStep", "persistResultsStep");

        List<String> csv = Files.readAllLines(csvPath("fallback-run"));
        assertThat(csv).hasSize(11);
        assertThat(csv.get(1)).startsWith("1,Sample Data Entry 1,This is mock data entry number 1,1,");

        AnalysisReport report = readReport("fallback-run");
        assertThat(report.summary()).isEqualTo(new AnalysisReport.Summary(10, 3, 19.1, 70, 19, 20));
        assertThat(report.breakdown().keySet()).containsExactly(1, 2, 3);
        assertThat(report.breakdown().get(1).count()).isEqualTo(4);
        assertThat(report.breakdown().get(1).avgTitleLength()).isEqualTo(19.25);
        assertThat(report.executionInfo().jobName()).isEqualTo("nightly-posts");
    }

    @Test
    void remoteRecordsFlowThroughPipeline() throws Exception {
        given(postSource.fetch(anyInt())).willReturn(FetchResult.success(List.of(
            new RawRecord(1, "AB", "a b c", 1),
            new RawRecord(2, "CDE", "d e", 1),
            new RawRecord(3, "F", "g", 2))));

        JobExecution execution = launch("remote-run");

        assertThat(execution.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        AnalysisReport report = readReport("remote-run");
        assertThat(report.summary()).isEqualTo(new AnalysisReport.Summary(3, 2, 2.0, 6, 1, 3));
        assertThat(report.breakdown().get(1).avgTitleLength()).isEqualTo(2.5);

        List<String> csv = Files.readAllLines(csvPath("remote-run"));
        assertThat(csv).hasSize(4);
        String processedAt = csv.get(1).split(",")[4];
        assertThat(csv.subList(1, 4)).allSatisfy(row -> assertThat(row).contains("," + processedAt + ","));
    }

    @Test
    void rerunWithSameExecutionIdReplacesOutputs() throws Exception {
        given(postSource.fetch(anyInt())).willReturn(FetchResult.failure("offline"));
        assertThat(launch("rerun").getStatus()).isEqualTo(BatchStatus.COMPLETED);

        given(postSource.fetch(anyInt())).willReturn(FetchResult.success(List.of(
            new RawRecord(42, "second", "run only", 5))));
        assertThat(launch("rerun").getStatus()).isEqualTo(BatchStatus.COMPLETED);

        assertThat(Files.readAllLines(csvPath("rerun"))).hasSize(2);
        assertThat(readReport("rerun").breakdown()).containsOnlyKeys(5);
        assertThat(Path.of(OUTPUT_DIR, "processed_data_rerun.csv.tmp")).doesNotExist();
        assertThat(Path.of(OUTPUT_DIR, "analysis_rerun.json.tmp")).doesNotExist();
    }

    @Test
    void persistenceFailureFailsTheJob() throws Exception {
        given(postSource.fetch(anyInt())).willReturn(FetchResult.failure("offline"));

        JobExecution execution = launch("bad/id");

        assertThat(execution.getStatus()).isEqualTo(BatchStatus.FAILED);
        assertThat(execution.getAllFailureExceptions())
            .anySatisfy(e -> assertThat(e).hasStackTraceContaining("Invalid execution id"));
    }

    private JobExecution launch(String executionId) throws Exception {
        RunContext context = new RunContext("nightly-posts", executionId, false, Instant.now());
        return jobLauncher.run(dataProcessingJob,
            RunContextParameters.toJobParameters(context, RUN_IDS.incrementAndGet()));
    }

    private static Path csvPath(String executionId) {
        return ResultPersister.csvPath(Path.of(OUTPUT_DIR), executionId);
    }

    private AnalysisReport readReport(String executionId) throws Exception {
        return mapper.readValue(
            ResultPersister.jsonPath(Path.of(OUTPUT_DIR), executionId).toFile(), AnalysisReport.class);
    }
}
