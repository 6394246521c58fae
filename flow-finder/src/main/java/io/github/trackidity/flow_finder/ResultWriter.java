package io.github.trackidity.flow_finder;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import io.github.trackidity.flow_finder.model.AnalysisResult;
import io.github.trackidity.flow_finder.model.TraceStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class ResultWriter {

    private static final Logger log = LoggerFactory.getLogger(ResultWriter.class);
    private static final ObjectWriter writer = new ObjectMapper().writerWithDefaultPrettyPrinter();

    /**
     * Writes the result document as pretty-printed JSON. Parent directories are created when missing.
     */
    public static void writeResult(AnalysisResult result, Path outputPath) throws IOException {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        writer.writeValue(outputPath.toFile(), result);
        log.info("Analysis result written to: {}", outputPath);
    }

    /**
     * Writes the result document to a stream the caller owns, typically stdout.
     */
    public static void writeResult(AnalysisResult result, OutputStream out) throws IOException {
        out.write(toJson(result).getBytes(StandardCharsets.UTF_8));
        out.write('\n');
        out.flush();
    }

    public static String toJson(AnalysisResult result) throws IOException {
        return writer.writeValueAsString(result);
    }

    /**
     * Writes the traversal statistics of every entry point, the report used to tune {@code max-depth}.
     */
    public static void writeTraceStatsToJson(List<TraceStats> stats, Path statsPath) throws IOException {
        try (Writer out = new FileWriter(statsPath.toFile(), StandardCharsets.UTF_8)) {
            Gson gson = new GsonBuilder().setPrettyPrinting().create();
            gson.toJson(stats, out);
        }
        log.info("Trace statistics written to: {}", statsPath);
        if (log.isDebugEnabled()) {
            stats.forEach(s -> log.debug("{}", s));
        }
    }
}
