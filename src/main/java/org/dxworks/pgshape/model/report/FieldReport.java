package org.dxworks.pgshape.model.report;

public class FieldReport {
    public String name;
    public String type;
    public String category;
    public boolean nullable;
    public int dims;
    public String declaration;
}
