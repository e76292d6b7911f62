package com.crdtypes.generator.codegen.version;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.crdtypes.generator.codegen.exception.AnalysisException;
import com.crdtypes.generator.codegen.exception.ErrorKind;
import com.crdtypes.generator.codegen.model.SchemaPath;
import com.crdtypes.generator.schema.ArrayNode;
import com.crdtypes.generator.schema.EnumerationNode;
import com.crdtypes.generator.schema.IntersectionNode;
import com.crdtypes.generator.schema.MapNode;
import com.crdtypes.generator.schema.ObjectNode;
import com.crdtypes.generator.schema.ReferenceNode;
import com.crdtypes.generator.schema.ScalarNode;
import com.crdtypes.generator.schema.SchemaFlags;
import com.crdtypes.generator.schema.SchemaNode;
import com.crdtypes.generator.schema.UnionNode;
import com.crdtypes.generator.schema.UnknownNode;
import com.crdtypes.generator.schema.UnsupportedNode;

/**
 * Merges the schemas of two versions of a resource field by field.
 *
 * The first argument is the higher-priority version and wins wherever both
 * agree up to presentation (descriptions, defaults, property order). A
 * property missing from either side becomes optional. Shapes that cannot be
 * expressed by one type fail with {@link ErrorKind#IRRECONCILABLE_UNION}.
 */
public class SchemaMerger {

    private static final Logger log = LoggerFactory.getLogger(SchemaMerger.class);

    public SchemaNode merge(SchemaNode preferred, SchemaNode other, SchemaPath path) {
        return new Merge().merge(preferred, other, path);
    }

    /**
     * Merges all {@code schemas}, highest priority first.
     */
    public SchemaNode mergeAll(List<SchemaNode> schemas, SchemaPath path) {
        SchemaNode merged = schemas.get(0);
        for (int i = 1; i < schemas.size(); i++) {
            merged = merge(merged, schemas.get(i), path);
        }
        return merged;
    }

    /**
     * One merge of two schema trees. Each pair of shared definitions is merged
     * once; every later use of the same pair refers to that result, which keeps
     * recursive definitions finite.
     */
    private final class Merge {
        private final Map<String, ReferenceNode> mergedDefinitions = new HashMap<>();

        SchemaNode merge(SchemaNode preferred, SchemaNode other, SchemaPath path) {
            if (preferred == other) {
                return preferred;
            }
            if (isLeaf(preferred) && preferred.equals(other)) {
                return preferred;
            }
            if (preferred instanceof ReferenceNode left && other instanceof ReferenceNode right) {
                return mergeReferences(left, right, path);
            }

            SchemaNode a = preferred.resolve();
            SchemaNode b = other.resolve();
            SchemaFlags flags = mergeFlags(preferred.getFlags(), other.getFlags());

            // left in place for analysis to report
            if (a instanceof UnsupportedNode) {
                return a;
            }
            if (b instanceof UnsupportedNode) {
                return b;
            }
            if (a instanceof ObjectNode left && b instanceof ObjectNode right) {
                return mergeObjects(left, right, flags, path);
            }
            if (a instanceof ScalarNode left && b instanceof ScalarNode right) {
                if (left.getKind() != right.getKind()) {
                    throw irreconcilable(path, "declared as " + left.getKind().schemaName() + " in one version and "
                            + right.getKind().schemaName() + " in another");
                }
                String format = Objects.equals(left.getFormat(), right.getFormat()) ? left.getFormat() : null;
                if (format == null && left.getFormat() != null) {
                    log.debug("{}: formats {} and {} differ, dropping the format", path, left.getFormat(),
                            right.getFormat());
                }
                return new ScalarNode(flags, left.getKind(), format);
            }
            if (a instanceof ArrayNode left && b instanceof ArrayNode right) {
                if (left.getItems() == null || right.getItems() == null) {
                    return new ArrayNode(flags, left.getItems() != null ? left.getItems() : right.getItems());
                }
                return new ArrayNode(flags, merge(left.getItems(), right.getItems(), path.item()));
            }
            if (a instanceof MapNode left && b instanceof MapNode right) {
                if (left.getValueSchema() == null || right.getValueSchema() == null) {
                    return new MapNode(flags, null);
                }
                return new MapNode(flags, merge(left.getValueSchema(), right.getValueSchema(), path.value()));
            }
            if (a instanceof EnumerationNode left && b instanceof EnumerationNode right) {
                if (left.getBaseKind() != right.getBaseKind()) {
                    throw irreconcilable(path, "enumerations of " + left.getBaseKind().schemaName() + " and "
                            + right.getBaseKind().schemaName() + " values");
                }
                Set<Object> literals = new LinkedHashSet<>(left.getLiterals());
                literals.addAll(right.getLiterals());
                return new EnumerationNode(flags, left.getBaseKind(), new ArrayList<>(literals));
            }
            if (a instanceof EnumerationNode enumeration && b instanceof ScalarNode scalar) {
                return widen(enumeration, scalar, flags, path);
            }
            if (a instanceof ScalarNode scalar && b instanceof EnumerationNode enumeration) {
                return widen(enumeration, scalar, flags, path);
            }
            if (a instanceof UnknownNode && b instanceof UnknownNode) {
                return new UnknownNode(flags);
            }
            if (a instanceof UnionNode left && b instanceof UnionNode right
                    && left.getCombinator() == right.getCombinator()
                    && left.getVariants().size() == right.getVariants().size()) {
                List<SchemaNode> variants = new ArrayList<>();
                for (int i = 0; i < left.getVariants().size(); i++) {
                    variants.add(merge(left.getVariants().get(i), right.getVariants().get(i), path));
                }
                return new UnionNode(flags, left.getCombinator(), variants);
            }
            if (a instanceof IntersectionNode left && b instanceof IntersectionNode right
                    && left.getBranches().size() == right.getBranches().size()) {
                List<SchemaNode> branches = new ArrayList<>();
                for (int i = 0; i < left.getBranches().size(); i++) {
                    branches.add(merge(left.getBranches().get(i), right.getBranches().get(i), path));
                }
                return new IntersectionNode(flags, branches);
            }
            throw irreconcilable(path, "declared as " + describe(a) + " in one version and " + describe(b)
                    + " in another");
        }

        private ObjectNode mergeObjects(ObjectNode left, ObjectNode right, SchemaFlags flags, SchemaPath path) {
            Map<String, SchemaNode> properties = new LinkedHashMap<>();
            for (Map.Entry<String, SchemaNode> entry : left.getProperties().entrySet()) {
                SchemaNode counterpart = right.getProperties().get(entry.getKey());
                properties.put(entry.getKey(), counterpart == null
                        ? entry.getValue()
                        : merge(entry.getValue(), counterpart, path.property(entry.getKey())));
            }
            right.getProperties().forEach(properties::putIfAbsent);

            // required only when every version has the property and requires it
            Set<String> required = new LinkedHashSet<>(left.getRequired());
            required.retainAll(right.getRequired());
            return new ObjectNode(flags, properties, required);
        }

        private SchemaNode widen(EnumerationNode enumeration, ScalarNode scalar, SchemaFlags flags, SchemaPath path) {
            if (enumeration.getBaseKind() != scalar.getKind()) {
                throw irreconcilable(path, "enumeration of " + enumeration.getBaseKind().schemaName()
                        + " values in one version and " + scalar.getKind().schemaName() + " in another");
            }
            log.debug("{}: enumeration in one version only, keeping the unrestricted {}", path,
                    scalar.getKind().schemaName());
            return new ScalarNode(flags, scalar.getKind(), scalar.getFormat());
        }

        /**
         * Each use site keeps its own flags and points at the merged definition
         * shared by every site of the same pair.
         */
        private SchemaNode mergeReferences(ReferenceNode left, ReferenceNode right, SchemaPath path) {
            String key = left.getName() + "\u0000" + right.getName();
            ReferenceNode shared = mergedDefinitions.get(key);
            if (shared == null) {
                shared = ReferenceNode.named(left.getName());
                mergedDefinitions.put(key, shared);
                log.debug("{}: merging definitions {} and {}", path, left.getName(), right.getName());
                shared.bind(merge(left.resolve(), right.resolve(), path));
            }
            ReferenceNode site = new ReferenceNode(mergeFlags(left.getFlags(), right.getFlags()), left.getName());
            site.bind(shared);
            return site;
        }
    }

    private static boolean isLeaf(SchemaNode node) {
        return node instanceof ScalarNode || node instanceof EnumerationNode || node instanceof UnknownNode;
    }

    private static SchemaFlags mergeFlags(SchemaFlags a, SchemaFlags b) {
        return SchemaFlags.builder()
                .description(a.getDescription() != null ? a.getDescription() : b.getDescription())
                .nullable(a.isNullable() || b.isNullable())
                .intOrString(a.isIntOrString() || b.isIntOrString())
                .preserveUnknownFields(a.isPreserveUnknownFields() || b.isPreserveUnknownFields())
                .embeddedResource(a.isEmbeddedResource() || b.isEmbeddedResource())
                .defaultValue(a.getDefaultValue() != null ? a.getDefaultValue() : b.getDefaultValue())
                .build();
    }

    private static String describe(SchemaNode node) {
        if (node instanceof ScalarNode scalar) {
            return scalar.getKind().schemaName();
        }
        String simple = node.getClass().getSimpleName();
        return simple.endsWith("Node") ? simple.substring(0, simple.length() - 4).toLowerCase(Locale.ROOT) : simple;
    }

    private static AnalysisException irreconcilable(SchemaPath path, String detail) {
        return new AnalysisException(ErrorKind.IRRECONCILABLE_UNION, path, detail);
    }
}
