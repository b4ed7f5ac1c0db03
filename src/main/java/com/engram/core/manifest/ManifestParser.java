package com.engram.core.manifest;

import com.engram.core.model.ManifestResult;

import java.io.IOException;

/**
 * Interprets the text of one ecosystem's manifest file.
 * <p>
 * Implementations are stateless and may throw on malformed input; the
 * {@link ManifestInterpreter} turns any failure into an empty result.
 */
public interface ManifestParser {

    /**
     * @param content manifest text, already capped in size
     * @return the ecosystem's partial result
     * @throws IOException if structured content cannot be read
     */
    ManifestResult parse(String content) throws IOException;
}
