package org.dxworks.pgshape.analyzer;

import org.dxworks.pgshape.model.EnumTypeObject;
import org.dxworks.pgshape.model.Field;
import org.dxworks.pgshape.model.Identifier;
import org.dxworks.pgshape.model.SchemaObject;
import org.dxworks.pgshape.model.json.JsonTypeRenderer;
import org.dxworks.pgshape.model.json.StructuralType;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders one client-facing type declaration per analyzed object, e.g.
 * {@code type Users = { id: number, email: string | null }}.
 */
public final class DeclarationRenderer {

    private DeclarationRenderer() {
        // utility class
    }

    public static String render(ObjectResult result) {
        SchemaObject object = result.getObject();
        String name = typeName(object.getId());
        if (object instanceof EnumTypeObject) {
            List<String> labels = new ArrayList<>();
            for (String label : ((EnumTypeObject) object).getLabels()) {
                labels.add(JsonTypeRenderer.quote(label));
            }
            return "type " + name + " = " + (labels.isEmpty() ? "never" : String.join(" | ", labels));
        }
        List<String> members = new ArrayList<>();
        for (int i = 0; i < result.getFields().size(); i++) {
            members.add(renderField(result, i));
        }
        return "type " + name + " = " + (members.isEmpty() ? "{}" : "{ " + String.join(", ", members) + " }");
    }

    /**
     * {@code name: type} for the {@code index}th field of the result.
     */
    public static String renderField(ObjectResult result, int index) {
        Field field = result.getFields().get(index);
        return JsonTypeRenderer.key(field.getName()) + ": " + renderType(result, index);
    }

    public static String renderType(ObjectResult result, int index) {
        StructuralType shape = result.getShapes().get(index);
        if (shape != null) {
            return JsonTypeRenderer.render(shape);
        }
        Field field = result.getFields().get(index);
        String type = result.getCategories().get(index).getLabel() + "[]".repeat(field.getDims());
        return field.isNullable() ? type + " | null" : type;
    }

    /**
     * {@code public.user_accounts} becomes {@code UserAccounts}; other schemas prefix the
     * name, so {@code audit.log} becomes {@code AuditLog}.
     */
    static String typeName(Identifier id) {
        String base = Identifier.DEFAULT_SCHEMA.equals(id.getSchema()) ? id.getName() : id.getSchema() + "_" + id.getName();
        StringBuilder sb = new StringBuilder();
        boolean upper = true;
        for (char c : base.toCharArray()) {
            if (!Character.isLetterOrDigit(c)) {
                upper = true;
                continue;
            }
            sb.append(upper ? Character.toUpperCase(c) : c);
            upper = false;
        }
        if (sb.length() == 0 || Character.isDigit(sb.charAt(0))) {
            sb.insert(0, '_');
        }
        return sb.toString();
    }
}
