package org.dxworks.pgshape.infer;

import net.sf.jsqlparser.expression.Alias;
import org.dxworks.pgshape.model.Identifier;
import org.dxworks.pgshape.parser.SqlTextUtils;

import java.util.List;

final class Names {

    private Names() {
        // utility class
    }

    static String normalize(String raw) {
        return SqlTextUtils.normalizeIdentifier(raw);
    }

    static String aliasName(Alias alias) {
        return alias == null || alias.getName() == null ? null : normalize(alias.getName());
    }

    /**
     * {@code name} or {@code schema.name}; longer chains keep their last two parts.
     */
    static Identifier toIdentifier(String qualified, String defaultSchema) {
        List<String> parts = SqlTextUtils.splitQualified(qualified);
        if (parts.size() == 1) {
            return new Identifier(defaultSchema, parts.get(0));
        }
        return new Identifier(parts.get(parts.size() - 2), parts.get(parts.size() - 1));
    }
}
