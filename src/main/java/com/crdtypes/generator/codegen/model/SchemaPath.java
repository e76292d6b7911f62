package com.crdtypes.generator.codegen.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Value;

/**
 * Location of a node, as the sequence of steps taken from the root schema.
 *
 * Rendered for diagnostics as {@code Root.spec.groups[]}: property names are
 * dotted, array items render as {@code []}, map values as {@code {}} and union
 * branches as {@code #n}.
 */
@Getter
@EqualsAndHashCode
public final class SchemaPath {

    public enum SegmentKind {
        PROPERTY,
        ITEM,
        VALUE,
        VARIANT
    }

    /**
     * One step. {@code name} is the property name, or the variant name for
     * {@link SegmentKind#VARIANT}; {@code index} is only meaningful for variants.
     */
    @Value
    public static class Segment {
        SegmentKind kind;
        String name;
        int index;

        String render() {
            return switch (kind) {
                case PROPERTY -> "." + name;
                case ITEM -> "[]";
                case VALUE -> "{}";
                case VARIANT -> "#" + index;
            };
        }
    }

    private final String rootName;
    private final List<Segment> segments;

    private SchemaPath(String rootName, List<Segment> segments) {
        this.rootName = Objects.requireNonNull(rootName, "rootName");
        this.segments = Collections.unmodifiableList(segments);
    }

    public static SchemaPath root(String rootName) {
        return new SchemaPath(rootName, List.of());
    }

    public SchemaPath property(String name) {
        return append(new Segment(SegmentKind.PROPERTY, name, -1));
    }

    public SchemaPath item() {
        return append(new Segment(SegmentKind.ITEM, null, -1));
    }

    public SchemaPath value() {
        return append(new Segment(SegmentKind.VALUE, null, -1));
    }

    public SchemaPath variant(int index, String variantName) {
        return append(new Segment(SegmentKind.VARIANT, variantName, index));
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    public int depth() {
        return segments.size();
    }

    public Segment last() {
        return segments.isEmpty() ? null : segments.get(segments.size() - 1);
    }

    private SchemaPath append(Segment segment) {
        List<Segment> next = new ArrayList<>(segments.size() + 1);
        next.addAll(segments);
        next.add(segment);
        return new SchemaPath(rootName, next);
    }

    public String render() {
        StringBuilder sb = new StringBuilder(rootName);
        for (Segment segment : segments) {
            sb.append(segment.render());
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return render();
    }
}
