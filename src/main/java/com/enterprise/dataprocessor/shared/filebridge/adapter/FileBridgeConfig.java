package com.enterprise.dataprocessor.shared.filebridge.adapter;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the {@link CsvWriterFactory} bean.
 *
 * <p>Override the bean to customize (e.g. different delimiter):
 * <pre>{@code
 * @Bean
 * public CsvWriterFactory csvWriterFactory() {
 *     CsvWriterFactory factory = new CsvWriterFactory();
 *     factory.setDelimiter(";");
 *     return factory;
 * }
 * }</pre>
 */
@Configuration
public class FileBridgeConfig {

    @Bean
    public CsvWriterFactory csvWriterFactory() {
        return new CsvWriterFactory();
    }
}
