package org.dxworks.pgshape.infer;

import org.dxworks.pgshape.model.Field;
import org.dxworks.pgshape.model.Identifier;
import org.dxworks.pgshape.model.TypeName;

import java.util.List;

/**
 * Lookups the inference engine cannot answer from the query alone.
 */
public interface MetadataResolver {

    /**
     * Table or view usable in a FROM clause.
     *
     * @throws org.dxworks.pgshape.error.RelationNotFoundException if no such relation exists
     */
    RelationBinding resolveRelation(Identifier id);

    /**
     * Fields of a row type (table, view or composite type), or {@code null} if {@code id}
     * does not name one.
     */
    List<Field> resolveRowType(Identifier id);

    /**
     * Name of the type with the given OID. Array OIDs resolve to their element type with one dimension.
     *
     * @throws org.dxworks.pgshape.error.UnknownTypeException if the OID is unknown
     */
    TypeName getTypeName(int oid);

    /**
     * OID of the element type named by {@code type}; array dimensions are ignored.
     *
     * @throws org.dxworks.pgshape.error.UnknownTypeException if the type is unknown
     */
    int getTypeOid(TypeName type);

    /**
     * Result of calling {@code function} with arguments of the given shapes. The returned
     * field is named after the function.
     *
     * @throws org.dxworks.pgshape.error.UnknownTypeException if the function is unknown
     */
    Field getReturnType(Identifier function, List<Field> args);
}
