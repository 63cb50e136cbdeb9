package org.dxworks.pgshape.model.report;

import java.util.ArrayList;
import java.util.List;

public class ObjectReport {
    public String kind = "object";
    public String objectKind;
    public String id;
    public String file;
    public int line;
    public List<String> dependencies = new ArrayList<>();
    public List<FieldReport> fields = new ArrayList<>();
    // enum types only
    public List<String> labels;
    public String declaration;
}
