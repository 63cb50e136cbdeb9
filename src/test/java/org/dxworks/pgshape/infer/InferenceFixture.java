package org.dxworks.pgshape.infer;

import org.dxworks.pgshape.model.Field;
import org.dxworks.pgshape.model.json.JsonTypeRenderer;

import java.util.List;

import static org.dxworks.pgshape.TestUtils.catalog;
import static org.dxworks.pgshape.TestUtils.select;

/**
 * Inference engine over a small fixed schema.
 */
class InferenceFixture {

    static final String SCHEMA = "CREATE TABLE t1 (id integer PRIMARY KEY, name text);\n"
            + "CREATE TABLE t2 (id integer NOT NULL, label varchar(40), t1_id integer REFERENCES t1(id));\n"
            + "CREATE TABLE foo (a integer, b text);\n"
            + "CREATE TABLE posts (id bigint PRIMARY KEY, title text NOT NULL, tags text[], meta jsonb);\n"
            + "CREATE VIEW named_t1 AS SELECT id, name AS label FROM t1;\n"
            + "CREATE VIEW renamed_t1 (ref_id) AS SELECT id, name FROM t1;\n"
            + "CREATE TYPE mood AS ENUM ('sad', 'happy');";

    final InferenceEngine engine = new InferenceEngine(new CatalogMetadataResolver(catalog(SCHEMA)));

    List<Field> fields(String sql) {
        return engine.inferSelect(select(sql), engine.newScope("public"));
    }

    Field field(String sql) {
        return fields(sql).get(0);
    }

    /**
     * Rendered JSON shape of the first output column.
     */
    String shape(String sql) {
        InferenceScope scope = engine.newScope("public");
        List<Field> fields = engine.inferSelect(select(sql), scope);
        return JsonTypeRenderer.render(engine.shapeOf(fields.get(0), scope));
    }

    String typeName(Field field) {
        return engine.newScope("public").getTypeName(field.getTypeOid()).getId().getName();
    }
}
