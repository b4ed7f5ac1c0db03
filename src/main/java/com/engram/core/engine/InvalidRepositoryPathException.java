package com.engram.core.engine;

import java.nio.file.Path;

/**
 * The path handed to {@link RepoAnalyzer} does not exist or is not a directory.
 */
public class InvalidRepositoryPathException extends IllegalArgumentException {

    public InvalidRepositoryPathException(Path path) {
        super("Not a directory: " + path);
    }
}
