package org.dxworks.pgshape.error;

public class RelationNotFoundException extends SchemaAnalysisException {

    private final String relationName;

    public RelationNotFoundException(String relationName, String construct) {
        super("Unknown relation: " + relationName, construct);
        this.relationName = relationName;
    }

    public String getRelationName() {
        return relationName;
    }
}
