package io.github.trackidity.flow_finder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.trackidity.flow_finder.model.AnalysisUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the facts document produced by the Solidity front-end.
 */
public class AnalysisUnitLoader {

    private static final Logger log = LoggerFactory.getLogger(AnalysisUnitLoader.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public AnalysisUnit load(Path input) throws AnalysisException {
        if (!Files.isRegularFile(input)) {
            throw new AnalysisException("Input file not found: " + input);
        }
        try {
            AnalysisUnit unit = mapper.readValue(input.toFile(), AnalysisUnit.class);
            log.info("Loaded {} contracts from {}", unit.contracts().size(), input);
            return unit;
        } catch (IOException e) {
            throw new AnalysisException("Could not read analysis input " + input + ": " + e.getMessage(), e);
        }
    }

    public AnalysisUnit parse(String json) throws AnalysisException {
        try {
            return mapper.readValue(json, AnalysisUnit.class);
        } catch (JsonProcessingException e) {
            throw new AnalysisException("Invalid analysis input: " + e.getOriginalMessage(), e);
        }
    }
}
