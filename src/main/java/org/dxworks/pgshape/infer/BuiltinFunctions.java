package org.dxworks.pgshape.infer;

import org.dxworks.pgshape.model.BuiltinTypes;
import org.dxworks.pgshape.model.Field;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Return types of commonly used {@code pg_catalog} functions.
 */
final class BuiltinFunctions {

    enum Returns {
        /** A fixed type. */
        FIXED,
        /** The type of an argument. */
        ARG,
        /** An array of the type of an argument. */
        ARG_ARRAY,
        /** The element type of an array argument. */
        ARG_ELEMENT
    }

    enum Nulls {
        /** Null if any argument is null. */
        PROPAGATE,
        /** Null only if every argument is null. */
        ALL,
        /** May be null even for non-null arguments. */
        MAYBE,
        /** Never null. */
        NEVER
    }

    static final class Rule {
        final Returns returns;
        final int oid;
        final int dims;
        final int argIndex;
        final Nulls nulls;

        Rule(Returns returns, int oid, int dims, int argIndex, Nulls nulls) {
            this.returns = returns;
            this.oid = oid;
            this.dims = dims;
            this.argIndex = argIndex;
            this.nulls = nulls;
        }
    }

    private static final Map<String, Rule> RULES = new HashMap<>();

    static {
        int text = BuiltinTypes.TEXT;
        int int4 = BuiltinTypes.INT4;
        int int8 = BuiltinTypes.INT8;
        int bool = BuiltinTypes.BOOL;
        int json = BuiltinTypes.JSON;
        int jsonb = BuiltinTypes.JSONB;
        int numeric = BuiltinTypes.NUMERIC;
        int float8 = BuiltinTypes.FLOAT8;
        int timestamptz = BuiltinTypes.oidOf("timestamptz");

        // aggregates
        fixed("count", int8, Nulls.NEVER);
        fixed("avg", numeric, Nulls.MAYBE);
        arg("sum", 0, Nulls.MAYBE);
        arg("min", 0, Nulls.MAYBE);
        arg("max", 0, Nulls.MAYBE);
        fixed("bool_and", bool, Nulls.MAYBE);
        fixed("bool_or", bool, Nulls.MAYBE);
        fixed("every", bool, Nulls.MAYBE);
        fixed("string_agg", text, Nulls.MAYBE);
        RULES.put("array_agg", new Rule(Returns.ARG_ARRAY, 0, 0, 0, Nulls.MAYBE));
        fixed("json_agg", json, Nulls.MAYBE);
        fixed("jsonb_agg", jsonb, Nulls.MAYBE);
        fixed("json_object_agg", json, Nulls.MAYBE);
        fixed("jsonb_object_agg", jsonb, Nulls.MAYBE);

        // window functions
        fixed("row_number", int8, Nulls.NEVER);
        fixed("rank", int8, Nulls.NEVER);
        fixed("dense_rank", int8, Nulls.NEVER);
        fixed("ntile", int4, Nulls.NEVER);
        arg("lag", 0, Nulls.MAYBE);
        arg("lead", 0, Nulls.MAYBE);
        arg("first_value", 0, Nulls.MAYBE);
        arg("last_value", 0, Nulls.MAYBE);

        // conditional
        arg("coalesce", 0, Nulls.ALL);
        arg("nullif", 0, Nulls.MAYBE);
        arg("greatest", 0, Nulls.ALL);
        arg("least", 0, Nulls.ALL);

        // strings
        for (String name : List.of("lower", "upper", "trim", "btrim", "ltrim", "rtrim", "substring", "substr",
                "replace", "left", "right", "lpad", "rpad", "initcap", "md5", "repeat", "reverse", "split_part",
                "regexp_replace", "translate", "to_char", "quote_ident", "quote_literal", "array_to_string")) {
            fixed(name, text, Nulls.PROPAGATE);
        }
        fixed("concat", text, Nulls.NEVER);
        fixed("concat_ws", text, Nulls.NEVER);
        fixed("format", text, Nulls.NEVER);
        fixed("length", int4, Nulls.PROPAGATE);
        fixed("char_length", int4, Nulls.PROPAGATE);
        fixed("octet_length", int4, Nulls.PROPAGATE);
        fixed("position", int4, Nulls.PROPAGATE);
        fixed("strpos", int4, Nulls.PROPAGATE);
        RULES.put("string_to_array", new Rule(Returns.FIXED, text, 1, 0, Nulls.PROPAGATE));
        RULES.put("regexp_split_to_array", new Rule(Returns.FIXED, text, 1, 0, Nulls.PROPAGATE));

        // numbers
        for (String name : List.of("abs", "round", "trunc", "floor", "ceil", "ceiling", "mod")) {
            arg(name, 0, Nulls.PROPAGATE);
        }
        fixed("random", float8, Nulls.NEVER);
        fixed("sqrt", float8, Nulls.PROPAGATE);
        fixed("power", float8, Nulls.PROPAGATE);
        fixed("date_part", float8, Nulls.PROPAGATE);
        fixed("extract", numeric, Nulls.PROPAGATE);

        // date/time
        fixed("now", timestamptz, Nulls.NEVER);
        fixed("clock_timestamp", timestamptz, Nulls.NEVER);
        fixed("statement_timestamp", timestamptz, Nulls.NEVER);
        fixed("transaction_timestamp", timestamptz, Nulls.NEVER);
        fixed("to_timestamp", timestamptz, Nulls.PROPAGATE);
        fixed("to_date", BuiltinTypes.oidOf("date"), Nulls.PROPAGATE);
        fixed("age", BuiltinTypes.oidOf("interval"), Nulls.PROPAGATE);
        arg("date_trunc", 1, Nulls.PROPAGATE);

        // arrays
        fixed("array_length", int4, Nulls.MAYBE);
        fixed("array_position", int4, Nulls.MAYBE);
        fixed("cardinality", int4, Nulls.PROPAGATE);
        RULES.put("unnest", new Rule(Returns.ARG_ELEMENT, 0, 0, 0, Nulls.MAYBE));
        arg("array_append", 0, Nulls.NEVER);
        arg("array_prepend", 1, Nulls.NEVER);
        arg("array_cat", 0, Nulls.PROPAGATE);
        arg("array_remove", 0, Nulls.PROPAGATE);

        // json
        for (String name : List.of("json_build_object", "json_build_array", "json_object")) {
            fixed(name, json, Nulls.NEVER);
        }
        for (String name : List.of("jsonb_build_object", "jsonb_build_array", "jsonb_object")) {
            fixed(name, jsonb, Nulls.NEVER);
        }
        for (String name : List.of("to_json", "row_to_json", "array_to_json", "json_strip_nulls")) {
            fixed(name, json, Nulls.PROPAGATE);
        }
        for (String name : List.of("to_jsonb", "jsonb_strip_nulls", "jsonb_set", "jsonb_insert")) {
            fixed(name, jsonb, Nulls.PROPAGATE);
        }
        fixed("json_extract_path", json, Nulls.MAYBE);
        fixed("jsonb_extract_path", jsonb, Nulls.MAYBE);
        fixed("json_extract_path_text", text, Nulls.MAYBE);
        fixed("jsonb_extract_path_text", text, Nulls.MAYBE);
        fixed("json_typeof", text, Nulls.PROPAGATE);
        fixed("jsonb_typeof", text, Nulls.PROPAGATE);
        fixed("json_array_length", int4, Nulls.PROPAGATE);
        fixed("jsonb_array_length", int4, Nulls.PROPAGATE);
        fixed("jsonb_pretty", text, Nulls.PROPAGATE);

        // misc
        fixed("gen_random_uuid", BuiltinTypes.oidOf("uuid"), Nulls.NEVER);
        fixed("current_setting", text, Nulls.MAYBE);
    }

    private BuiltinFunctions() {
        // utility class
    }

    private static void fixed(String name, int oid, Nulls nulls) {
        RULES.put(name, new Rule(Returns.FIXED, oid, 0, 0, nulls));
    }

    private static void arg(String name, int index, Nulls nulls) {
        RULES.put(name, new Rule(Returns.ARG, 0, 0, index, nulls));
    }

    static Rule lookup(String name) {
        return RULES.get(name);
    }

    static boolean isNullable(Nulls nulls, List<Field> args) {
        switch (nulls) {
            case NEVER:
                return false;
            case MAYBE:
                return true;
            case ALL:
                for (Field arg : args) {
                    if (!arg.isNullable()) return false;
                }
                return true;
            default:
                for (Field arg : args) {
                    if (arg.isNullable()) return true;
                }
                return false;
        }
    }
}
