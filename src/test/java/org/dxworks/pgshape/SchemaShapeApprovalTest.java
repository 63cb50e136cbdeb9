package org.dxworks.pgshape;

import org.approvaltests.Approvals;
import org.dxworks.pgshape.analyzer.AnalysisFailure;
import org.dxworks.pgshape.analyzer.AnalysisReport;
import org.dxworks.pgshape.analyzer.DeclarationRenderer;
import org.dxworks.pgshape.analyzer.InternalRoutineFilter;
import org.dxworks.pgshape.analyzer.ObjectResult;
import org.dxworks.pgshape.analyzer.SchemaAnalyzer;
import org.dxworks.pgshape.catalog.Catalog;
import org.dxworks.pgshape.parser.SchemaParser;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

public class SchemaShapeApprovalTest {

    @Test
    void analyze_SQL_Sample() throws Exception {
        verify(Paths.get("src/test/resources/samples/sql/sample.sql"));
    }

    private static void verify(Path file) throws Exception {
        SchemaParser parser = new SchemaParser("public");
        Catalog catalog = Catalog.of(parser.parseFile(file, file.getFileName().toString()).objects);
        AnalysisReport report = new SchemaAnalyzer(PgShapeConfig.defaults()).analyze(catalog);

        StringBuilder out = new StringBuilder();
        for (ObjectResult result : report.emitted(List.of(new InternalRoutineFilter(List.of("_"))))) {
            out.append(DeclarationRenderer.render(result)).append('\n');
        }
        for (AnalysisFailure failure : report.getFailures()) {
            out.append("error: ").append(failure.describe()).append('\n');
        }
        Approvals.verify(out.toString());
    }
}
