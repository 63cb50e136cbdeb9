package org.dxworks.pgshape.analyzer;

import org.dxworks.pgshape.PgShapeConfig;
import org.dxworks.pgshape.model.Identifier;
import org.dxworks.pgshape.model.report.ErrorReport;
import org.dxworks.pgshape.model.report.ObjectReport;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.pgshape.TestUtils.catalog;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class ReportFactoryTest {

    private final AnalysisReport report = new SchemaAnalyzer(PgShapeConfig.defaults()).analyze(catalog(
            "CREATE TYPE mood AS ENUM ('sad', 'happy');\n"
                    + "CREATE TABLE people (id integer PRIMARY KEY, feeling mood, manager_id integer REFERENCES people(id));\n"
                    + "CREATE VIEW broken AS SELECT nope FROM people;"));

    @Test
    void objectReportsListFieldsAndDependencies() {
        ObjectReport people = ReportFactory.toReport(report.getResult(Identifier.of("people")));

        assertEquals("object", people.kind);
        assertEquals("table", people.objectKind);
        assertEquals("public.people", people.id);
        assertEquals("test.sql", people.file);
        assertEquals(2, people.line);
        assertEquals(List.of("public.mood"), people.dependencies);
        assertEquals(3, people.fields.size());
        assertEquals("public.mood", people.fields.get(1).type);
        assertEquals("JSON", people.fields.get(1).category);
        assertNull(people.labels);
    }

    @Test
    void enumReportsCarryTheirLabels() {
        ObjectReport mood = ReportFactory.toReport(report.getResult(Identifier.of("mood")));
        assertEquals(List.of("sad", "happy"), mood.labels);
        assertEquals("type Mood = \"sad\" | \"happy\"", mood.declaration);
    }

    @Test
    void errorReportsNameTheFailure() {
        ErrorReport broken = ReportFactory.toReport(report.getFailure(Identifier.of("broken")));

        assertEquals("error", broken.kind);
        assertEquals("view", broken.objectKind);
        assertEquals("ColumnNotFoundException", broken.error);
        assertEquals(3, broken.line);
        assertNull(broken.origin);
    }
}
