package com.enterprise.dataprocessor.post.infrastructure;

import com.enterprise.dataprocessor.config.DataProcessorProperties;
import com.enterprise.dataprocessor.post.application.PostSource;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.net.URI;

/**
 * HTTP client for the remote post source. The configured timeout bounds
 * both connecting and reading; there are no retries.
 */
@Slf4j
@Configuration
public class PostSourceConfig {

    @Bean
    RestTemplate postSourceRestTemplate(DataProcessorProperties properties) {
        int timeoutMillis = Math.toIntExact(properties.getSource().getTimeout().toMillis());

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeoutMillis);
        requestFactory.setReadTimeout(timeoutMillis);

        log.debug("Post source client configured with {}ms timeout", timeoutMillis);
        return new RestTemplate(requestFactory);
    }

    @Bean
    PostSource httpPostSource(RestTemplate postSourceRestTemplate,
            ObjectMapper objectMapper,
            DataProcessorProperties properties) {
        return new HttpPostSource(postSourceRestTemplate, objectMapper,
            URI.create(properties.getSource().getUrl()));
    }
}
