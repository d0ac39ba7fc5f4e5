package com.enterprise.dataprocessor.post.infrastructure;

import java.nio.file.Path;

public record PersistedFiles(
    Path csvPath,
    long csvSize,
    Path jsonPath,
    long jsonSize
) {}
