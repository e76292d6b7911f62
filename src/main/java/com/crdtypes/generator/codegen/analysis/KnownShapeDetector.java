package com.crdtypes.generator.codegen.analysis;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.crdtypes.generator.codegen.model.KnownShape;
import com.crdtypes.generator.schema.ObjectNode;
import com.crdtypes.generator.schema.ScalarKind;
import com.crdtypes.generator.schema.ScalarNode;
import com.crdtypes.generator.schema.SchemaNode;
import com.crdtypes.generator.schema.UnionNode;

/**
 * Recognizes schema subtrees that match a platform type.
 *
 * Matching is purely structural; property types of the matched objects are not
 * inspected.
 */
public class KnownShapeDetector {

    private static final Logger log = LoggerFactory.getLogger(KnownShapeDetector.class);

    private static final Set<String> CONDITION_PROPERTIES =
            Set.of("type", "status", "reason", "message", "lastTransitionTime");
    private static final Set<String> CONDITION_REQUIRED = Set.of("type", "status");
    private static final Set<String> OBJECT_REFERENCE_PROPERTIES =
            Set.of("apiVersion", "fieldPath", "kind", "name", "namespace", "resourceVersion", "uid");

    private final Set<KnownShape> suppressed;

    public KnownShapeDetector(Set<KnownShape> suppressed) {
        this.suppressed = suppressed == null || suppressed.isEmpty()
                ? EnumSet.noneOf(KnownShape.class)
                : EnumSet.copyOf(suppressed);
        this.suppressed.removeIf(shape -> !shape.isSuppressible());
    }

    public KnownShapeDetector() {
        this(Set.of());
    }

    /**
     * Returns the platform type {@code node} should be replaced by, unless that
     * substitution has been suppressed.
     */
    public Optional<KnownShape> detect(SchemaNode node) {
        SchemaNode resolved = node.resolve();
        Optional<KnownShape> match = match(node, resolved);
        if (match.isPresent() && suppressed.contains(match.get())) {
            log.debug("Known shape {} matched but substitution is disabled", match.get());
            return Optional.empty();
        }
        return match;
    }

    private Optional<KnownShape> match(SchemaNode node, SchemaNode resolved) {
        if (node.isIntOrString() || resolved.isIntOrString() || isIntegerOrStringUnion(resolved)) {
            return Optional.of(KnownShape.INT_OR_STRING);
        }
        if (resolved instanceof ObjectNode object) {
            if (isCondition(object)) {
                return Optional.of(KnownShape.CONDITION);
            }
            if (isObjectReference(object)) {
                return Optional.of(KnownShape.OBJECT_REFERENCE);
            }
        }
        return Optional.empty();
    }

    static boolean isCondition(ObjectNode object) {
        return object.getProperties().keySet().containsAll(CONDITION_PROPERTIES)
                && object.getRequired().containsAll(CONDITION_REQUIRED);
    }

    static boolean isObjectReference(ObjectNode object) {
        return object.getProperties().keySet().equals(OBJECT_REFERENCE_PROPERTIES);
    }

    private static boolean isIntegerOrStringUnion(SchemaNode node) {
        if (!(node instanceof UnionNode union) || union.getVariants().size() != 2) {
            return false;
        }
        EnumSet<ScalarKind> kinds = EnumSet.noneOf(ScalarKind.class);
        for (SchemaNode variant : union.getVariants()) {
            if (!(variant.resolve() instanceof ScalarNode scalar)) {
                return false;
            }
            kinds.add(scalar.getKind());
        }
        return kinds.equals(EnumSet.of(ScalarKind.INTEGER, ScalarKind.STRING));
    }
}
