package org.dxworks.pgshape.model;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The {@code pg_catalog} types known without a database connection, with their real OIDs.
 */
public final class BuiltinTypes {

    public static final String SCHEMA = "pg_catalog";

    public static final int BOOL = 16;
    public static final int INT8 = 20;
    public static final int INT2 = 21;
    public static final int INT4 = 23;
    public static final int TEXT = 25;
    public static final int JSON = 114;
    public static final int FLOAT8 = 701;
    public static final int UNKNOWN = 705;
    public static final int RECORD = 2249;
    public static final int VOID = 2278;
    public static final int NUMERIC = 1700;
    public static final int JSONB = 3802;

    /** Type name to {oid, array oid}; array oid 0 when the type has no array type. */
    private static final Map<String, int[]> BY_NAME = new LinkedHashMap<>();
    private static final Map<Integer, String> BY_OID = new HashMap<>();
    private static final Map<Integer, Integer> ELEMENT_BY_ARRAY = new HashMap<>();

    static {
        register("bool", BOOL, 1000);
        register("bytea", 17, 1001);
        register("char", 18, 1002);
        register("name", 19, 1003);
        register("int8", INT8, 1016);
        register("int2", INT2, 1005);
        register("int4", INT4, 1007);
        register("text", TEXT, 1009);
        register("oid", 26, 1028);
        register("json", JSON, 199);
        register("xml", 142, 143);
        register("float4", 700, 1021);
        register("float8", FLOAT8, 1022);
        register("unknown", UNKNOWN, 0);
        register("money", 790, 791);
        register("inet", 869, 1041);
        register("cidr", 650, 651);
        register("bpchar", 1042, 1014);
        register("varchar", 1043, 1015);
        register("date", 1082, 1182);
        register("time", 1083, 1183);
        register("timestamp", 1114, 1115);
        register("timestamptz", 1184, 1185);
        register("interval", 1186, 1187);
        register("timetz", 1266, 1270);
        register("bit", 1560, 1561);
        register("varbit", 1562, 1563);
        register("numeric", NUMERIC, 1231);
        register("uuid", 2950, 2951);
        register("record", RECORD, 2287);
        register("void", VOID, 0);
        register("tsvector", 3614, 3643);
        register("jsonb", JSONB, 3807);
    }

    private BuiltinTypes() {
        // utility class
    }

    private static void register(String name, int oid, int arrayOid) {
        BY_NAME.put(name, new int[]{oid, arrayOid});
        if (oid != 0) {
            BY_OID.put(oid, name);
        }
        if (arrayOid != 0) {
            ELEMENT_BY_ARRAY.put(arrayOid, oid);
        }
    }

    public static boolean isBuiltin(String name) {
        return BY_NAME.containsKey(name) && BY_NAME.get(name)[0] != 0;
    }

    /**
     * OID of a builtin type, or 0 if unknown.
     */
    public static int oidOf(String name) {
        int[] oids = BY_NAME.get(name);
        return oids == null ? 0 : oids[0];
    }

    public static String nameOf(int oid) {
        return BY_OID.get(oid);
    }

    /**
     * Element OID of a builtin array type, or 0 if {@code oid} is not an array type.
     */
    public static int elementOf(int oid) {
        Integer element = ELEMENT_BY_ARRAY.get(oid);
        return element == null ? 0 : element;
    }
}
