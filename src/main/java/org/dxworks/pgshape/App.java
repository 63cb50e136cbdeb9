package org.dxworks.pgshape;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.pgshape.analyzer.AnalysisFailure;
import org.dxworks.pgshape.analyzer.AnalysisReport;
import org.dxworks.pgshape.analyzer.InternalRoutineFilter;
import org.dxworks.pgshape.analyzer.ObjectResult;
import org.dxworks.pgshape.analyzer.ReportFactory;
import org.dxworks.pgshape.analyzer.SchemaAnalyzer;
import org.dxworks.pgshape.catalog.Catalog;
import org.dxworks.pgshape.error.CycleException;
import org.dxworks.pgshape.error.DuplicateObjectException;
import org.dxworks.pgshape.error.SchemaParseException;
import org.dxworks.pgshape.parser.ParsedSchema;
import org.dxworks.pgshape.parser.SchemaParser;
import org.dxworks.pgshape.parser.SqlStatement;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public static void main(String[] args) throws Exception {
        int exitCode = run(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    static int run(String[] args) throws IOException {
        if (args.length < 2) {
            System.err.println("Usage: java -jar pgshape.jar <schema-dir-or-file> <output-file>");
            System.err.println("  <schema-dir-or-file>: Directory of .sql files or a single .sql file");
            System.err.println("  <output-file>:        Path to output JSONL file");
            return 2;
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            return 1;
        }

        Path jsonlOutput = Paths.get(args[1]);
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        PgShapeConfig config = PgShapeConfig.load();
        System.out.println("Starting schema analysis...");
        System.out.println("Input: " + input.toAbsolutePath());

        List<Path> files = collectSqlFiles(input, config.getMaxFileLines());
        System.out.println("Found " + files.size() + " schema files");

        Instant startTime = Instant.now();
        ParsedSchema parsed = new ParsedSchema();
        AnalysisReport report;
        try {
            SchemaParser parser = new SchemaParser(config.getDefaultSchema());
            for (Path file : files) {
                parsed.addAll(parser.parseFile(file, displayName(input, file)));
            }
            for (SqlStatement skipped : parsed.skipped) {
                System.err.println("[SchemaParser] Skipping statement at " + skipped.span + ": " + firstLine(skipped.text));
            }
            Catalog catalog = Catalog.of(parsed.objects);
            report = new SchemaAnalyzer(config).analyze(catalog, (current, total, object) ->
                    System.out.println("[" + current + "/" + total + "] Analyzing "
                            + object.getKind().getLabel() + " " + object.getId()));
        } catch (SchemaParseException | DuplicateObjectException | CycleException e) {
            System.err.println("Error: " + e.describe());
            return 1;
        }

        List<ObjectResult> emitted = report.emitted(List.of(new InternalRoutineFilter(config.getInternalRoutinePrefixes())));
        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new LinkedHashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            writeLine(writer, runInfo);

            for (ObjectResult result : emitted) {
                writeLine(writer, ReportFactory.toReport(result));
            }
            for (AnalysisFailure failure : report.getFailures()) {
                writeLine(writer, ReportFactory.toReport(failure));
                System.err.println("  Error: " + failure.describe());
            }

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new LinkedHashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("objects_analyzed", report.getResults().size());
            doneInfo.put("objects_emitted", emitted.size());
            doneInfo.put("objects_with_errors", report.getFailures().size());
            doneInfo.put("statements_skipped", parsed.skipped.size());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writeLine(writer, doneInfo);
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Analysis complete!");
        System.out.println("Successfully analyzed: " + report.getResults().size() + " objects");
        if (report.hasFailures()) {
            System.out.println("Errors: " + report.getFailures().size());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
        return 0;
    }

    private static void writeLine(BufferedWriter writer, Object value) throws IOException {
        writer.write(MAPPER.writeValueAsString(value));
        writer.newLine();
    }

    static List<Path> collectSqlFiles(Path input, int maxFileLines) throws IOException {
        List<Path> files = new ArrayList<>();
        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(App::isSqlFile)
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            files.add(input);
        }

        List<Path> accepted = new ArrayList<>();
        for (Path file : files) {
            if (withinMaxLines(file, maxFileLines)) {
                accepted.add(file);
            } else {
                System.err.println("[App] Skipping " + file + ": more than " + maxFileLines + " lines");
            }
        }
        return accepted;
    }

    private static boolean isSqlFile(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".sql");
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException e) {
            return true;
        }
    }

    private static String displayName(Path input, Path file) {
        if (Files.isDirectory(input)) {
            return input.relativize(file).toString().replace('\\', '/');
        }
        return file.getFileName().toString();
    }

    private static String firstLine(String text) {
        int nl = text.indexOf('\n');
        return nl < 0 ? text : text.substring(0, nl).trim();
    }
}
