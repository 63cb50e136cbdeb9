package org.dxworks.pgshape.analyzer;

import org.dxworks.pgshape.model.EnumTypeObject;
import org.dxworks.pgshape.model.Field;
import org.dxworks.pgshape.model.SchemaObject;
import org.dxworks.pgshape.model.report.ErrorReport;
import org.dxworks.pgshape.model.report.FieldReport;
import org.dxworks.pgshape.model.report.ObjectReport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Converts analysis results into the serializable report lines.
 */
public final class ReportFactory {

    private ReportFactory() {
        // utility class
    }

    public static ObjectReport toReport(ObjectResult result) {
        SchemaObject object = result.getObject();
        ObjectReport report = new ObjectReport();
        report.objectKind = object.getKind().getLabel();
        report.id = object.getId().toString();
        if (object.getSpan() != null) {
            report.file = object.getSpan().getFile();
            report.line = object.getSpan().getLine();
        }
        for (SchemaObject dependency : object.getDependencies()) {
            report.dependencies.add(dependency.getId().toString());
        }
        Collections.sort(report.dependencies);
        for (int i = 0; i < result.getFields().size(); i++) {
            Field field = result.getFields().get(i);
            FieldReport fieldReport = new FieldReport();
            fieldReport.name = field.getName();
            fieldReport.type = result.getTypeNames().get(i);
            fieldReport.category = result.getCategories().get(i).getLabel();
            fieldReport.nullable = field.isNullable();
            fieldReport.dims = field.getDims();
            fieldReport.declaration = DeclarationRenderer.renderType(result, i);
            report.fields.add(fieldReport);
        }
        if (object instanceof EnumTypeObject) {
            report.labels = new ArrayList<>(((EnumTypeObject) object).getLabels());
        }
        report.declaration = DeclarationRenderer.render(result);
        return report;
    }

    public static ErrorReport toReport(AnalysisFailure failure) {
        SchemaObject object = failure.getObject();
        ErrorReport report = new ErrorReport();
        report.objectKind = object.getKind().getLabel();
        report.id = object.getId().toString();
        if (object.getSpan() != null) {
            report.file = object.getSpan().getFile();
            report.line = object.getSpan().getLine();
        }
        report.error = failure.getError().getClass().getSimpleName();
        report.message = failure.getError().getMessage();
        report.construct = failure.getError().getConstruct();
        report.origin = failure.getOrigin() != null ? failure.getOrigin().toString() : null;
        return report;
    }

    public static List<ObjectReport> toReports(List<ObjectResult> results) {
        List<ObjectReport> reports = new ArrayList<>();
        for (ObjectResult result : results) {
            reports.add(toReport(result));
        }
        return reports;
    }
}
