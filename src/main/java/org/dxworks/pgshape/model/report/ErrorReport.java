package org.dxworks.pgshape.model.report;

public class ErrorReport {
    public String kind = "error";
    public String objectKind;
    public String id;
    public String file;
    public int line;
    public String error;
    public String message;
    public String construct;
    // set when the failure was raised while inferring another object
    public String origin;
}
