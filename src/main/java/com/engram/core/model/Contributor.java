package com.engram.core.model;

/**
 * A contributor and the number of non-merge commits attributed to them.
 */
public record Contributor(String name, int commits) {}
