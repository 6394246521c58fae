package io.github.trackidity.flow_finder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import io.github.trackidity.flow_finder.model.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ResultWriter
 */
class ResultWriterTest {

    @TempDir
    Path tempDir;

    private static AnalysisResult sampleResult() {
        Location location = new Location("contracts/A.sol", 3, 4);
        CallTreeNode cycle = new CallTreeNode("f", "A", "Internal", "A.f()", location, NodeStatus.CYCLE, false,
                "contracts/A.sol:A.f()", List.of());
        EntryPointView entryPoint = new EntryPointView("contracts/A.sol::A.f()", "f", "A", false, null,
                "A.f() • contracts/A.sol", location, List.of(cycle));
        WriterView writer = new WriterView("contracts/A.sol::A.f()", "f", "A", location, WriteKind.DIRECT, 0);
        VariableView variable = new VariableView("contracts/A.sol::A.x", "x", "uint256", "A", false, null, false,
                false, new Location("contracts/A.sol", 1, 4), List.of(writer));
        return AnalysisResult.success(
                List.of(new FileEntryPoints("contracts/A.sol", List.of(entryPoint))),
                List.of(new VariableGroup("contracts/A.sol", "A", List.of(variable))),
                List.of(Diagnostic.warning("A", "Base contract B not found, inheritance edge dropped")));
    }

    @Test
    void testWriteResult_ToFile() throws IOException {
        Path output = tempDir.resolve("out/result.json");
        ResultWriter.writeResult(sampleResult(), output);

        assertTrue(Files.exists(output));
        JsonNode root = new ObjectMapper().readTree(output.toFile());
        assertEquals(1, root.get("version").asInt());
        assertTrue(root.get("ok").asBoolean());
        assertFalse(root.has("error"));
        JsonNode entryPoint = root.get("files").get(0).get("entrypoints").get(0);
        assertEquals("contracts/A.sol::A.f()", entryPoint.get("flowId").asText());
        assertTrue(entryPoint.get("inheritedFrom").isNull());
        JsonNode call = entryPoint.get("calls").get(0);
        assertEquals("CYCLE", call.get("status").asText());
        assertTrue(call.get("cycle").asBoolean());
        assertFalse(call.get("truncated").asBoolean());
        JsonNode variable = root.get("variables").get(0).get("vars").get(0);
        assertFalse(variable.get("isConstant").asBoolean());
        assertEquals("DIRECT", variable.get("modifiers").get(0).get("write").asText());
        assertEquals("WARNING", root.get("diagnostics").get(0).get("severity").asText());
    }

    @Test
    void testWriteResult_FailureOnlyCarriesError() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ResultWriter.writeResult(AnalysisResult.failure("Inheritance cycle: A -> B -> A"), out);

        JsonNode root = new ObjectMapper().readTree(out.toString(StandardCharsets.UTF_8));
        assertFalse(root.get("ok").asBoolean());
        assertEquals("Inheritance cycle: A -> B -> A", root.get("error").asText());
        assertFalse(root.has("files"));
        assertFalse(root.has("variables"));
        assertFalse(root.has("diagnostics"));
    }

    @Test
    void testWriteTraceStatsToJson() throws IOException {
        Path statsFile = tempDir.resolve("trace-stats.json");
        List<TraceStats> stats = List.of(
                new TraceStats("contracts/A.sol::A.f()", 3, 1, 2, false, 0),
                new TraceStats("contracts/A.sol::A.g()", 12, 4, 11, true, 2));
        ResultWriter.writeTraceStatsToJson(stats, statsFile);

        assertTrue(Files.exists(statsFile));
        JsonArray array = new Gson().fromJson(Files.readString(statsFile), JsonArray.class);
        assertEquals(2, array.size());
        JsonObject second = array.get(1).getAsJsonObject();
        assertEquals("contracts/A.sol::A.g()", second.get("flowId").getAsString());
        assertEquals(12, second.get("visitedUnits").getAsInt());
        assertTrue(second.get("truncated").getAsBoolean());
        assertEquals(2, second.get("cycleEdges").getAsInt());
    }
}
