package org.dxworks.pgshape.analyzer;

import org.dxworks.pgshape.PgShapeConfig;
import org.dxworks.pgshape.catalog.Catalog;
import org.dxworks.pgshape.error.AnalysisCancelledException;
import org.dxworks.pgshape.error.ColumnNotFoundException;
import org.dxworks.pgshape.error.CycleException;
import org.dxworks.pgshape.model.BuiltinTypes;
import org.dxworks.pgshape.model.Identifier;
import org.dxworks.pgshape.model.SchemaObject;
import org.dxworks.pgshape.model.TypeCategory;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.dxworks.pgshape.TestUtils.catalog;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SchemaAnalyzerTest {

    private static final String USERS = "CREATE TABLE users (id integer PRIMARY KEY, email text, tags text[]);\n";

    private final SchemaAnalyzer analyzer = new SchemaAnalyzer(PgShapeConfig.defaults());

    private AnalysisReport analyze(String sql) {
        return analyzer.analyze(catalog(sql));
    }

    private static String declaration(AnalysisReport report, String name) {
        return DeclarationRenderer.render(report.getResult(Identifier.of(name)));
    }

    @Test
    void describesTableColumns() {
        AnalysisReport report = analyze(USERS);

        ObjectResult users = report.getResult(Identifier.of("users"));
        assertEquals(List.of("int4", "text", "text[]"), users.getTypeNames());
        assertEquals(List.of(TypeCategory.NUMBER, TypeCategory.STRING, TypeCategory.STRING), users.getCategories());
        assertEquals("type Users = { id: number, email: string | null, tags: string[] | null }",
                DeclarationRenderer.render(users));
    }

    @Test
    void continuesPastFailingObjects() {
        AnalysisReport report = analyze(USERS
                + "CREATE VIEW bad AS SELECT missing FROM users;\n"
                + "CREATE VIEW dependent AS SELECT * FROM bad;\n"
                + "CREATE VIEW ok AS SELECT id FROM users;");

        List<String> order = new ArrayList<>();
        for (SchemaObject object : report.getOrder()) {
            order.add(object.getId().getName());
        }
        assertEquals(List.of("users", "bad", "dependent", "ok"), order);
        assertEquals(2, report.getResults().size());
        assertEquals(2, report.getFailures().size());

        AnalysisFailure bad = report.getFailure(Identifier.of("bad"));
        assertInstanceOf(ColumnNotFoundException.class, bad.getError());
        assertNull(bad.getOrigin());
        assertEquals(2, bad.getError().getSpan().getLine());

        AnalysisFailure dependent = report.getFailure(Identifier.of("dependent"));
        assertEquals(Identifier.of("bad"), dependent.getOrigin());
        assertTrue(dependent.describe().startsWith("test.sql:3: public.dependent: depends on public.bad: "));
    }

    @Test
    void viewCyclesStopTheRun() {
        assertThrows(CycleException.class, () -> analyze(
                "CREATE VIEW a AS SELECT * FROM b;\nCREATE VIEW b AS SELECT * FROM a;"));
    }

    @Test
    void refinesJsonResultsFromSqlBodies() {
        AnalysisReport report = analyze(USERS
                + "CREATE FUNCTION user_json(uid integer) RETURNS jsonb LANGUAGE sql STABLE AS $$\n"
                + "  SELECT jsonb_build_object('id', uid, 'email', email) FROM users WHERE id = uid\n"
                + "$$;");

        assertEquals("type UserJson = { user_json: { id: number | null, email: string | null } | null }",
                declaration(report, "user_json"));
    }

    @Test
    void returnsTableColumnsKeepTheirDeclaredNames() {
        AnalysisReport report = analyze(USERS
                + "CREATE FUNCTION user_cards() RETURNS TABLE (user_id integer, card json) LANGUAGE sql AS $$\n"
                + "  SELECT id, json_build_object('tags', tags) FROM users\n"
                + "$$;");

        assertEquals("type UserCards = { user_id: number | null, card: { tags: string[] | null } | null }",
                declaration(report, "user_cards"));
    }

    @Test
    void setofTableReturnsTheTableRow() {
        AnalysisReport report = analyze(USERS
                + "CREATE FUNCTION all_users() RETURNS SETOF users LANGUAGE sql AS $$ SELECT * FROM users $$;");

        assertEquals(3, report.getResult(Identifier.of("all_users")).getFields().size());
    }

    @Test
    void recordResultsComeFromTheBody() {
        AnalysisReport report = analyze(
                "CREATE FUNCTION pair() RETURNS record LANGUAGE sql AS $$ SELECT 1 AS a, 'x'::text AS b $$;\n"
                        + "CREATE FUNCTION opaque() RETURNS record LANGUAGE plpgsql AS $$ BEGIN END $$;");

        assertEquals("type Pair = { a: number, b: string }", declaration(report, "pair"));
        ObjectResult opaque = report.getResult(Identifier.of("opaque"));
        assertEquals(1, opaque.getFields().size());
        assertEquals(BuiltinTypes.RECORD, opaque.getFields().get(0).getTypeOid());
        assertEquals(TypeCategory.JSON, opaque.getCategories().get(0));
    }

    @Test
    void voidRoutinesHaveNoFields() {
        AnalysisReport report = analyze("CREATE FUNCTION touch() RETURNS void LANGUAGE sql AS $$ SELECT 1 $$;");
        assertEquals("type Touch = {}", declaration(report, "touch"));
    }

    @Test
    void describesEnumAndCompositeTypes() {
        AnalysisReport report = analyze("CREATE TYPE mood AS ENUM ('sad', 'happy');\n"
                + "CREATE TYPE audit.entry AS (at timestamptz, feeling mood);");

        assertEquals("type Mood = \"sad\" | \"happy\"", declaration(report, "mood"));
        ObjectResult entry = report.getResult(new Identifier("audit", "entry"));
        assertEquals("type AuditEntry = { at: string | null, feeling: JSON | null }", DeclarationRenderer.render(entry));
        assertEquals("public.mood", entry.getTypeNames().get(1));
    }

    @Test
    void reportsProgressForEveryObject() {
        List<String> progress = new ArrayList<>();
        analyzer.analyze(catalog(USERS + "CREATE VIEW ok AS SELECT id FROM users;"),
                (current, total, object) -> progress.add(current + "/" + total + " " + object.getId()));

        assertEquals(List.of("1/2 public.users", "2/2 public.ok"), progress);
    }

    @Test
    void stopsWhenInterrupted() {
        Catalog catalog = catalog(USERS);
        Thread.currentThread().interrupt();
        try {
            AnalysisCancelledException e = assertThrows(AnalysisCancelledException.class, () -> analyzer.analyze(catalog));
            assertTrue(e.getMessage().contains("0"));
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void shapesCanBeDisabled() {
        SchemaAnalyzer plain = new SchemaAnalyzer(PgShapeConfig.with("public", 100, List.of(), false));
        AnalysisReport report = plain.analyze(catalog(USERS));

        ObjectResult users = report.getResult(Identifier.of("users"));
        assertNull(users.getShapes().get(0));
        assertEquals("type Users = { id: number, email: string | null, tags: string[] | null }",
                DeclarationRenderer.render(users));
    }

    @Test
    void filtersInternalRoutines() {
        AnalysisReport report = analyze(USERS
                + "CREATE FUNCTION _helper() RETURNS int LANGUAGE sql AS $$ SELECT 1 $$;\n"
                + "CREATE FUNCTION api() RETURNS int LANGUAGE sql AS $$ SELECT 1 $$;");

        List<ObjectResult> emitted = report.emitted(List.of(new InternalRoutineFilter(List.of("_"))));

        assertEquals(3, report.getResults().size());
        assertEquals(2, emitted.size());
        assertFalse(emitted.stream().anyMatch(r -> r.getObject().getId().getName().equals("_helper")));
    }
}
