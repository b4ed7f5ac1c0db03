package com.engram.core.engine;

import com.engram.core.model.RepoAnalysis;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * JSON form of a {@link RepoAnalysis}: snake_case field names, and fields holding an empty,
 * false or zero value are left out.
 */
public final class AnalysisJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .setSerializationInclusion(JsonInclude.Include.NON_DEFAULT)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private AnalysisJson() {}

    public static String toJson(RepoAnalysis analysis) {
        try {
            return MAPPER.writeValueAsString(analysis);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize analysis of " + analysis.path(), e);
        }
    }
}
