package com.enterprise.dataprocessor;

import com.enterprise.dataprocessor.config.DataProcessorProperties;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Runs the data processing job once and exits with its status:
 * 0 when the job completed, 1 otherwise.
 */
@SpringBootApplication
@EnableConfigurationProperties(DataProcessorProperties.class)
public class DataProcessorApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(DataProcessorApplication.class, args)));
    }
}
