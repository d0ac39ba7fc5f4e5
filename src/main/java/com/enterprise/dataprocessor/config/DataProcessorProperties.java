package com.enterprise.dataprocessor.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Binding for all job configuration. Environment variables are mapped onto
 * these keys in {@code application.yml}.
 *
 * <pre>
 * dataprocessor:
 *   job-name: dockerfile-data-processor
 *   execution-id: local-run
 *   manual-trigger: false
 *   output-dir: /tmp/cronjob_output
 *   source:
 *     url: https://jsonplaceholder.typicode.com/posts
 *     timeout: 30s
 *     limit: 10
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "dataprocessor")
public class DataProcessorProperties {

    private String jobName = "dockerfile-data-processor";

    /** Scopes the output file names; reruns with the same id overwrite. */
    private String executionId = "local-run";

    private boolean manualTrigger;

    private String outputDir = "/tmp/cronjob_output";

    /** Launch the job when the application starts. Disabled in tests. */
    private boolean runOnStartup = true;

    @Valid
    private final Source source = new Source();

    @Data
    public static class Source {

        private String url = "https://jsonplaceholder.typicode.com/posts";

        /** Applied to both connect and read. */
        private Duration timeout = Duration.ofSeconds(30);

        /** Records kept from the response, and the size of the fallback dataset. */
        @Min(0)
        private int limit = 10;
    }
}
