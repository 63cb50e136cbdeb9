package org.dxworks.pgshape.parser;

import org.dxworks.pgshape.model.SchemaObject;

import java.util.ArrayList;
import java.util.List;

public class ParsedSchema {
    public final List<SchemaObject> objects = new ArrayList<>();
    /** Statements that declare nothing the analyzer models. */
    public final List<SqlStatement> skipped = new ArrayList<>();

    public void addAll(ParsedSchema other) {
        objects.addAll(other.objects);
        skipped.addAll(other.skipped);
    }
}
