package com.enterprise.dataprocessor.post.infrastructure;

import com.enterprise.dataprocessor.post.domain.RunContext;

import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;

import java.time.Instant;
import java.util.Map;

/**
 * Maps a {@link RunContext} to job parameters and back. {@code run.id} makes
 * every launch a new job instance, so a rerun with an already used execution
 * id is not rejected as complete.
 */
public final class RunContextParameters {

    public static final String JOB_NAME = "jobName";
    public static final String EXECUTION_ID = "executionId";
    public static final String MANUAL_TRIGGER = "manualTrigger";
    public static final String STARTED_AT = "startedAt";
    public static final String RUN_ID = "run.id";

    private RunContextParameters() {
    }

    public static JobParameters toJobParameters(RunContext context, long runId) {
        return new JobParametersBuilder()
            .addString(JOB_NAME, context.jobName())
            .addString(EXECUTION_ID, context.executionId())
            .addString(MANUAL_TRIGGER, Boolean.toString(context.manualTrigger()))
            .addString(STARTED_AT, context.startedAt().toString())
            .addLong(RUN_ID, runId)
            .toJobParameters();
    }

    public static RunContext fromJobParameters(Map<String, Object> parameters) {
        return new RunContext(
            required(parameters, JOB_NAME),
            required(parameters, EXECUTION_ID),
            Boolean.parseBoolean(required(parameters, MANUAL_TRIGGER)),
            Instant.parse(required(parameters, STARTED_AT)));
    }

    private static String required(Map<String, Object> parameters, String key) {
        Object value = parameters.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Missing job parameter: " + key);
        }
        return value.toString();
    }
}
