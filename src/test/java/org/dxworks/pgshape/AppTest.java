package org.dxworks.pgshape;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void missingArgumentsIsUsageError() throws Exception {
        assertEquals(2, App.run(new String[0]));
        assertEquals(2, App.run(new String[]{"schema"}));
    }

    @Test
    void missingInputFails() throws Exception {
        Path output = tempDir.resolve("out.jsonl");

        assertEquals(1, App.run(new String[]{tempDir.resolve("nope").toString(), output.toString()}));
        assertFalse(Files.exists(output));
    }

    @Test
    void writesRunObjectsAndSummary() throws Exception {
        Path schema = Files.createDirectories(tempDir.resolve("schema"));
        Files.writeString(schema.resolve("01_tables.sql"),
                "CREATE TABLE users (id integer PRIMARY KEY, email text);\n"
                        + "CREATE INDEX users_email_idx ON users (email);\n");
        Files.writeString(schema.resolve("02_views.sql"),
                "CREATE VIEW emails AS SELECT email FROM users;\n");
        Files.writeString(schema.resolve("notes.txt"), "not sql");
        Path output = tempDir.resolve("out/result.jsonl");

        assertEquals(0, App.run(new String[]{schema.toString(), output.toString()}));

        List<JsonNode> lines = readLines(output);
        assertEquals(4, lines.size());
        assertEquals("run", lines.get(0).get("kind").asText());
        assertEquals(2, lines.get(0).get("total_files").asInt());

        JsonNode done = lines.get(lines.size() - 1);
        assertEquals("done", done.get("kind").asText());
        assertEquals(2, done.get("objects_analyzed").asInt());
        assertEquals(0, done.get("objects_with_errors").asInt());
        assertEquals(1, done.get("statements_skipped").asInt());
    }

    @Test
    void analysisErrorsAreReportedWithoutFailingTheRun() throws Exception {
        Path file = tempDir.resolve("broken.sql");
        Files.writeString(file, "CREATE TABLE users (id integer);\n"
                + "CREATE VIEW broken AS SELECT missing FROM users;\n");
        Path output = tempDir.resolve("result.jsonl");

        assertEquals(0, App.run(new String[]{file.toString(), output.toString()}));

        JsonNode done = readLines(output).get(readLines(output).size() - 1);
        assertEquals(1, done.get("objects_analyzed").asInt());
        assertEquals(1, done.get("objects_with_errors").asInt());
    }

    @Test
    void parseErrorFailsTheRun() throws Exception {
        Path file = tempDir.resolve("bad.sql");
        Files.writeString(file, "CREATE TABLE (;\n");

        assertEquals(1, App.run(new String[]{file.toString(), tempDir.resolve("result.jsonl").toString()}));
    }

    private static List<JsonNode> readLines(Path output) throws Exception {
        assertTrue(Files.exists(output));
        List<JsonNode> nodes = new ArrayList<>();
        for (String line : Files.readAllLines(output, StandardCharsets.UTF_8)) {
            if (!line.isBlank()) {
                nodes.add(MAPPER.readTree(line));
            }
        }
        return nodes;
    }
}
