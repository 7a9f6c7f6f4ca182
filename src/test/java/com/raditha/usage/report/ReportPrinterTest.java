package com.raditha.usage.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.usage.analyzer.UsageAnalyzer;
import com.raditha.usage.analyzer.UsageReport;
import com.raditha.usage.config.UsageConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReportPrinterTest {

    private ByteArrayOutputStream buffer;
    private ReportPrinter printer;
    private UsageReport report;

    @BeforeEach
    void setUp() {
        buffer = new ByteArrayOutputStream();
        printer = new ReportPrinter(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        report = new UsageAnalyzer(UsageConfig.standard().withParallelism(1)).analyzeSources(Map.of(
                "src/Sample.java", """
                        class Sample {
                            private int a, b;
                            int first(int unusedArg) { return a; }
                        }
                        """));
    }

    @Test
    void testJsonOutput() throws Exception {
        printer.printJson(report);

        JsonNode root = new ObjectMapper().readTree(buffer.toString(StandardCharsets.UTF_8));
        assertEquals("1.0.0", root.get("version").asText());
        assertEquals(1, root.get("filesAnalyzed").asInt());
        assertEquals(2, root.get("totalFindings").asInt());

        JsonNode field = root.get("findings").get(0);
        assertEquals("USW001", field.get("rule").asText());
        assertEquals("FIELD", field.get("kind").asText());
        assertEquals("b", field.get("name").asText());
        assertEquals("src/Sample.java", field.get("file").asText());
        assertEquals(2, field.get("line").asInt());
        assertFalse(field.get("writeOnly").asBoolean());
        assertEquals(1, field.get("siblingGroup").get("index").asInt());
        assertEquals(2, field.get("siblingGroup").get("size").asInt());

        JsonNode parameter = root.get("findings").get(1);
        assertEquals("USW002", parameter.get("rule").asText());
        assertEquals("Parameter 'unusedArg' is never used", parameter.get("message").asText());
        assertTrue(parameter.get("siblingGroup").isNull());
    }

    @Test
    void testTextOutput() {
        printer.printText(report);

        String text = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(text.startsWith("=".repeat(80)));
        assertTrue(text.contains("src/Sample.java"));
        assertTrue(text.contains("Private field 'b' is declared but never used"));
    }
}
