package com.crdtypes.generator.schema;

/**
 * Visitor over the closed set of schema node variants.
 */
public interface SchemaNodeVisitor<R> {
    R visit(ScalarNode scalar);
    R visit(ObjectNode object);
    R visit(ArrayNode array);
    R visit(MapNode map);
    R visit(UnionNode union);
    R visit(EnumerationNode enumeration);
    R visit(UnknownNode unknown);
    R visit(IntersectionNode intersection);
    R visit(ReferenceNode reference);
    R visit(UnsupportedNode unsupported);
}
