package org.dxworks.pgshape.infer;

public enum RelationKind {
    TABLE,
    VIEW,
    CTE,
    SUBQUERY
}
