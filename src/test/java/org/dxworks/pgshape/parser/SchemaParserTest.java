package org.dxworks.pgshape.parser;

import org.dxworks.pgshape.error.SchemaParseException;
import org.dxworks.pgshape.model.ColumnDefinition;
import org.dxworks.pgshape.model.CompositeTypeObject;
import org.dxworks.pgshape.model.EnumTypeObject;
import org.dxworks.pgshape.model.Identifier;
import org.dxworks.pgshape.model.ObjectKind;
import org.dxworks.pgshape.model.RoutineObject;
import org.dxworks.pgshape.model.TableObject;
import org.dxworks.pgshape.model.ViewObject;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SchemaParserTest {

    private final SchemaParser parser = new SchemaParser("public");

    @Test
    void parsesTableColumnsAndForeignKeys() {
        ParsedSchema parsed = parser.parse(
                "CREATE TABLE users (id integer PRIMARY KEY, email text NOT NULL, nickname varchar(40));\n"
                        + "CREATE TABLE posts (\n"
                        + "  id bigint,\n"
                        + "  author_id integer REFERENCES users(id),\n"
                        + "  tags text[],\n"
                        + "  PRIMARY KEY (id)\n"
                        + ");", "tables.sql");

        assertEquals(2, parsed.objects.size());
        TableObject users = (TableObject) parsed.objects.get(0);
        assertEquals(Identifier.of("users"), users.getId());
        List<ColumnDefinition> columns = users.getColumns();
        assertEquals(3, columns.size());
        assertFalse(columns.get(0).nullable);
        assertFalse(columns.get(1).nullable);
        assertTrue(columns.get(2).nullable);
        assertEquals("pg_catalog.varchar", columns.get(2).type.getId().toString());

        TableObject posts = (TableObject) parsed.objects.get(1);
        assertEquals(2, posts.getSpan().getLine());
        assertFalse(posts.getColumns().get(0).nullable);
        assertEquals(1, posts.getColumns().get(2).type.getArrayDims());
        assertEquals(List.of(Identifier.of("users")), posts.getReferences());
    }

    @Test
    void parsesViewsWithColumnListsAndReferences() {
        ParsedSchema parsed = parser.parse(
                "CREATE MATERIALIZED VIEW app.recent (post_id, title) AS SELECT p.id, p.title FROM posts p", "views.sql");

        ViewObject view = (ViewObject) parsed.objects.get(0);
        assertEquals(new Identifier("app", "recent"), view.getId());
        assertTrue(view.isMaterialized());
        assertEquals(List.of("post_id", "title"), view.getColumnNames());
        assertTrue(view.getReferences().contains(new Identifier("app", "posts")));
    }

    @Test
    void viewRelationReferencesAreInNameOrder() {
        ParsedSchema parsed = parser.parse(
                "CREATE VIEW feed AS SELECT p.id, u.email FROM users u JOIN posts p ON p.user_id = u.id"
                        + " JOIN comments c ON c.post_id = p.id", "views.sql");

        ViewObject view = (ViewObject) parsed.objects.get(0);
        assertEquals(List.of(Identifier.of("comments"), Identifier.of("posts"), Identifier.of("users")),
                view.getReferences());
    }

    @Test
    void parsesEnumAndCompositeTypes() {
        ParsedSchema parsed = parser.parse(
                "CREATE TYPE mood AS ENUM ('sad', 'it''s ok', 'happy');\n"
                        + "CREATE TYPE audit.point AS (x double precision, y double precision, label mood);", null);

        EnumTypeObject mood = (EnumTypeObject) parsed.objects.get(0);
        assertEquals(List.of("sad", "it's ok", "happy"), mood.getLabels());

        CompositeTypeObject point = (CompositeTypeObject) parsed.objects.get(1);
        assertEquals(new Identifier("audit", "point"), point.getId());
        assertEquals(3, point.getAttributes().size());
        assertEquals("pg_catalog.float8", point.getAttributes().get(0).type.getId().toString());
        assertEquals("public.mood", point.getAttributes().get(2).type.getId().toString());
    }

    @Test
    void parsesRoutineSignatures() {
        ParsedSchema parsed = parser.parse(
                "CREATE OR REPLACE FUNCTION list_posts(author integer, lim int DEFAULT 10)\n"
                        + "RETURNS TABLE (id bigint, title text) LANGUAGE sql STABLE AS $$\n"
                        + "  SELECT id, title FROM posts WHERE author_id = author LIMIT lim\n"
                        + "$$;\n"
                        + "CREATE FUNCTION all_posts() RETURNS SETOF posts AS 'SELECT * FROM posts' LANGUAGE sql;\n"
                        + "CREATE FUNCTION stats(OUT total bigint, OUT latest timestamptz) LANGUAGE plpgsql AS $$ BEGIN END $$;\n"
                        + "CREATE PROCEDURE cleanup() LANGUAGE sql AS $$ DELETE FROM posts $$;", "routines.sql");

        assertEquals(4, parsed.objects.size());
        RoutineObject listPosts = (RoutineObject) parsed.objects.get(0);
        assertEquals(ObjectKind.ROUTINE, listPosts.getKind());
        assertEquals(2, listPosts.getParameters().size());
        assertEquals("lim", listPosts.getParameters().get(1).name);
        assertTrue(listPosts.isReturnSet());
        assertNull(listPosts.getReturnType());
        assertEquals(2, listPosts.getReturnColumns().size());
        assertTrue(listPosts.isSqlLanguage());
        assertTrue(listPosts.getBody().contains("LIMIT lim"));

        RoutineObject allPosts = (RoutineObject) parsed.objects.get(1);
        assertTrue(allPosts.isReturnSet());
        assertEquals(Identifier.of("posts"), allPosts.getReturnType().getId());
        assertEquals("SELECT * FROM posts", allPosts.getBody());

        RoutineObject stats = (RoutineObject) parsed.objects.get(2);
        assertTrue(stats.getParameters().isEmpty());
        assertEquals(2, stats.getReturnColumns().size());
        assertEquals("plpgsql", stats.getLanguage());
        assertNull(stats.getBody());

        assertTrue(((RoutineObject) parsed.objects.get(3)).isProcedure());
    }

    @Test
    void skipsStatementsThatDeclareNothing() {
        ParsedSchema parsed = parser.parse(
                "CREATE EXTENSION IF NOT EXISTS citext;\n"
                        + "CREATE INDEX users_email ON users (email);\n"
                        + "COMMENT ON TABLE users IS 'people';\n"
                        + "GRANT SELECT ON users TO reader;", "misc.sql");

        assertTrue(parsed.objects.isEmpty());
        assertEquals(4, parsed.skipped.size());
        assertEquals(2, parsed.skipped.get(1).span.getLine());
    }

    @Test
    void malformedDdlFailsInsteadOfBeingSkipped() {
        SchemaParseException misspelt = assertThrows(SchemaParseException.class,
                () -> parser.parse("CREATE TABLE ok (id int);\nCREATE TABEL t (id int);", "bad.sql"));
        assertEquals(2, misspelt.getSpan().getLine());

        assertThrows(SchemaParseException.class, () -> parser.parse("CREATE TABLE (;", "bad.sql"));
    }

    @Test
    void reportsUnparsableStatementsWithTheirLocation() {
        SchemaParseException e = assertThrows(SchemaParseException.class,
                () -> parser.parse("CREATE TABLE ok (id int);\nCREATE TABLE broken (id int,,);", "bad.sql"));
        assertEquals("bad.sql", e.getSpan().getFile());
        assertEquals(2, e.getSpan().getLine());
    }
}
