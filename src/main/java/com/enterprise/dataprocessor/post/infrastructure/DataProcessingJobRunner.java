package com.enterprise.dataprocessor.post.infrastructure;

import com.enterprise.dataprocessor.config.DataProcessorProperties;
import com.enterprise.dataprocessor.post.domain.RunContext;

import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobExecutionException;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Launches {@code dataProcessingJob} once at startup and exposes the outcome
 * as the process exit code: 0 for a completed job, 1 for a failed job or a
 * launch error.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "dataprocessor", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
public class DataProcessingJobRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int SUCCESS = 0;
    static final int FAILURE = 1;

    private final JobLauncher jobLauncher;
    private final Job dataProcessingJob;
    private final DataProcessorProperties properties;
    private final Clock clock;

    private int exitCode = SUCCESS;

    public DataProcessingJobRunner(JobLauncher jobLauncher,
            @Qualifier("dataProcessingJob") Job dataProcessingJob,
            DataProcessorProperties properties,
            Clock clock) {
        this.jobLauncher = jobLauncher;
        this.dataProcessingJob = dataProcessingJob;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void run(String... args) {
        exitCode = launch();
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int launch() {
        RunContext context = new RunContext(
            properties.getJobName(),
            properties.getExecutionId(),
            properties.isManualTrigger(),
            clock.instant());

        log.info("Data Processing CronJob Started");
        log.info("   Name: {}", context.jobName());
        log.info("   Execution UUID: {}", context.executionId());
        log.info("   Manual Trigger: {}", context.manualTrigger());
        log.info("   Start Time: {}", context.startedAt());

        JobExecution execution;
        try {
            execution = jobLauncher.run(dataProcessingJob,
                RunContextParameters.toJobParameters(context, System.currentTimeMillis()));
        } catch (JobExecutionException e) {
            log.error("CronJob failed to launch: {}", e.getMessage(), e);
            return FAILURE;
        }

        if (execution.getStatus() != BatchStatus.COMPLETED) {
            log.error("CronJob failed with status {}", execution.getStatus());
            execution.getAllFailureExceptions()
                .forEach(e -> log.error("Failure in execution {}", context.executionId(), e));
            return FAILURE;
        }

        Duration elapsed = Duration.between(context.startedAt(), clock.instant());
        log.info("Data processing completed successfully");
        log.info("Total execution time: {} seconds", LogFormat.twoDecimals(elapsed.toMillis() / 1000.0));
        return SUCCESS;
    }
}
