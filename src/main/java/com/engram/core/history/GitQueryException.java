package com.engram.core.history;

/**
 * A single {@code git} query could not produce usable output.
 */
public class GitQueryException extends Exception {

    public GitQueryException(String message) {
        super(message);
    }

    public GitQueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
