package com.enterprise.dataprocessor.post.application;

import com.enterprise.dataprocessor.post.domain.FetchResult;

/**
 * Remote supplier of posts. Implementations report failures through
 * {@link FetchResult.Failure} instead of throwing.
 */
@FunctionalInterface
public interface PostSource {

    /**
     * @param limit maximum number of records to return
     */
    FetchResult fetch(int limit);
}
