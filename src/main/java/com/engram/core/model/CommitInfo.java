package com.engram.core.model;

/**
 * One entry of the recent-commit log.
 *
 * @param hash    abbreviated commit hash (first 8 characters)
 * @param author  author name
 * @param date    author date, {@code yyyy-MM-dd}
 * @param message subject line, truncated
 */
public record CommitInfo(
    String hash,
    String author,
    String date,
    String message
) {}
