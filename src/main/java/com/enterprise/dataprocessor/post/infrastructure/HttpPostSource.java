package com.enterprise.dataprocessor.post.infrastructure;

import com.enterprise.dataprocessor.post.application.PostSource;
import com.enterprise.dataprocessor.post.domain.FetchResult;
import com.enterprise.dataprocessor.post.domain.RawRecord;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Fetches posts with a single GET returning a JSON array of
 * {@code {id, title, body, userId}} objects; {@code userId} becomes the
 * group id. Transport errors, non-2xx statuses and malformed payloads are
 * returned as {@link FetchResult.Failure}.
 */
@Slf4j
public class HttpPostSource implements PostSource {

    private static final TypeReference<List<RemotePost>> REMOTE_POSTS = new TypeReference<>() {};

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final URI endpoint;

    public HttpPostSource(RestTemplate restTemplate, ObjectMapper objectMapper, URI endpoint) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.endpoint = endpoint;
    }

    @Override
    public FetchResult fetch(int limit) {
        log.info("Fetching sample data from {}", endpoint);

        String payload;
        try {
            payload = restTemplate.getForObject(endpoint, String.class);
        } catch (RestClientException e) {
            return FetchResult.failure("request to " + endpoint + " failed: " + e.getMessage());
        }
        if (payload == null || payload.isBlank()) {
            return FetchResult.failure("empty response body from " + endpoint);
        }

        List<RemotePost> posts;
        try {
            posts = objectMapper.readValue(payload, REMOTE_POSTS);
        } catch (JsonProcessingException e) {
            return FetchResult.failure("malformed payload: " + e.getOriginalMessage());
        }
        if (posts == null) {
            return FetchResult.failure("malformed payload: null instead of an array");
        }

        List<RawRecord> records = new ArrayList<>();
        for (RemotePost post : posts.subList(0, Math.min(limit, posts.size()))) {
            if (post == null || post.id() == null || post.userId() == null) {
                return FetchResult.failure("malformed payload: post without id or userId");
            }
            records.add(new RawRecord(post.id(), post.title(), post.body(), post.userId()));
        }
        return FetchResult.success(records);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RemotePost(Long id, String title, String body, Integer userId) {}
}
