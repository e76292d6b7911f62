package com.crdtypes.generator.codegen.analysis;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.crdtypes.generator.codegen.StructuralSignatureCalculator;
import com.crdtypes.generator.codegen.exception.AnalysisException;
import com.crdtypes.generator.codegen.exception.ErrorKind;
import com.crdtypes.generator.codegen.model.AbsentPolicy;
import com.crdtypes.generator.codegen.model.CompositeField;
import com.crdtypes.generator.codegen.model.CompositeType;
import com.crdtypes.generator.codegen.model.EnumVariant;
import com.crdtypes.generator.codegen.model.EnumeratedType;
import com.crdtypes.generator.codegen.model.GeneratedType;
import com.crdtypes.generator.codegen.model.KnownShape;
import com.crdtypes.generator.codegen.model.PrimitiveType;
import com.crdtypes.generator.codegen.model.SchemaPath;
import com.crdtypes.generator.codegen.model.TypeGraph;
import com.crdtypes.generator.codegen.model.TypeKind;
import com.crdtypes.generator.codegen.model.TypeRef;
import com.crdtypes.generator.codegen.model.core.context.GeneratorConfig;
import com.crdtypes.generator.codegen.model.core.context.ToolDiagnostics;
import com.crdtypes.generator.codegen.util.NamingUtil;
import com.crdtypes.generator.schema.ArrayNode;
import com.crdtypes.generator.schema.EnumerationNode;
import com.crdtypes.generator.schema.IntersectionNode;
import com.crdtypes.generator.schema.MapNode;
import com.crdtypes.generator.schema.ObjectNode;
import com.crdtypes.generator.schema.ReferenceNode;
import com.crdtypes.generator.schema.ScalarKind;
import com.crdtypes.generator.schema.ScalarNode;
import com.crdtypes.generator.schema.SchemaNode;
import com.crdtypes.generator.schema.SchemaNodeVisitor;
import com.crdtypes.generator.schema.UnionNode;
import com.crdtypes.generator.schema.UnknownNode;
import com.crdtypes.generator.schema.UnsupportedNode;

/**
 * Walks a schema tree and produces the named, deduplicated {@link TypeGraph}.
 *
 * A build runs in phases:
 * <ol>
 * <li>depth-first walk creating draft types under placeholder names, with
 * cycle detection keyed by node identity;</li>
 * <li>pruning of drafts the root cannot reach (left behind by relaxed-mode
 * fallbacks);</li>
 * <li>structural signatures and deduplication, first draft wins;</li>
 * <li>name assignment from the full origin path;</li>
 * <li>rewrite of placeholders to final names.</li>
 * </ol>
 * All naming state lives in the {@link Run} of a single {@link #build} call, so
 * one builder can serve independent builds.
 */
public class TypeGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(TypeGraphBuilder.class);

    private static final Set<String> ENVELOPE_PROPERTIES = Set.of("apiVersion", "kind", "metadata");
    private static final String DRAFT_PREFIX = "#draft";

    private final GeneratorConfig config;
    private final KnownShapeDetector detector;

    public TypeGraphBuilder(GeneratorConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.detector = new KnownShapeDetector(config.getSuppressKnownShapes());
    }

    /**
     * Builds the graph for {@code root}, naming the root type {@code rootName}.
     *
     * @throws AnalysisException when the schema cannot be represented; no graph
     *                           is produced in that case
     */
    public TypeGraph build(SchemaNode root, String rootName) {
        Objects.requireNonNull(root, "root");
        String normalizedRoot = NamingUtil.toPascalCase(rootName);
        if (normalizedRoot == null || normalizedRoot.isEmpty()) {
            throw new IllegalArgumentException("Root name must not be empty");
        }
        log.debug("Building type graph for {}", normalizedRoot);
        return new Run(normalizedRoot).execute(root);
    }

    /**
     * State of one build invocation.
     */
    private final class Run {
        private final String rootName;
        private final ToolDiagnostics diagnostics = new ToolDiagnostics();

        /** Completed drafts, keyed by placeholder name. */
        private final Map<String, GeneratedType> drafts = new HashMap<>();
        /** Placeholder names in allocation (pre-order) order. */
        private final List<String> allocationOrder = new ArrayList<>();

        private final Map<SchemaNode, TypeRef> completed = new IdentityHashMap<>();
        private final Map<SchemaNode, String> inProgress = new IdentityHashMap<>();
        private final Map<IntersectionNode, ObjectNode> flattened = new IdentityHashMap<>();

        Run(String rootName) {
            this.rootName = rootName;
        }

        TypeGraph execute(SchemaNode root) {
            TypeRef rootRef = analyze(root, SchemaPath.root(rootName), 0);

            List<String> reachable = reachableDrafts(rootRef);
            Map<String, String> canonical = deduplicate(reachable);
            Map<String, String> finalNames = assignNames(reachable, canonical);

            TypeGraph graph = new TypeGraph(config.getMapRepresentation(), config.getEffectiveSchemaMode(),
                    diagnostics);
            for (String token : reachable) {
                if (!canonical.get(token).equals(token)) {
                    continue;
                }
                graph.addType(rename(drafts.get(token), finalNames.get(token), canonical, finalNames));
            }
            graph.setRootRef(rootRef.mapNames(token -> finalNames.get(canonical.get(token))));

            log.debug("Type graph for {}: {} types ({} drafts, {} merged)", rootName, graph.size(),
                    allocationOrder.size(), reachable.size() - graph.size());
            return graph;
        }

        // ---------------------------------------------------------------
        // Phase 1: walk
        // ---------------------------------------------------------------

        TypeRef analyze(SchemaNode node, SchemaPath path, int depth) {
            if (depth > config.getMaxDepth()) {
                throw new AnalysisException(ErrorKind.CYCLE_DEPTH_EXCEEDED, path,
                        "schema nesting exceeds the maximum depth of " + config.getMaxDepth());
            }
            try {
                Optional<KnownShape> shape = detector.detect(node);
                if (shape.isPresent()) {
                    log.debug("{}: substituted known shape {}", path, shape.get());
                    return TypeRef.external(shape.get());
                }

                SchemaNode resolved = node.resolve();
                TypeRef done = completed.get(resolved);
                if (done != null) {
                    log.debug("{}: reusing {}", path, done);
                    return done;
                }
                String active = inProgress.get(resolved);
                if (active != null) {
                    log.debug("{}: back-reference to enclosing type", path);
                    return TypeRef.indirect(active);
                }

                TypeRef result = resolved.accept(new NodeAnalyzer(node, path, depth));
                completed.put(resolved, result);
                return result;
            } catch (AnalysisException e) {
                if (config.isRelaxed() && e.getKind().isRelaxable()) {
                    log.warn("Relaxed mode: {} - using an untyped value instead", e.getMessage());
                    diagnostics.recordDowngrade(e);
                    return TypeRef.unknown();
                }
                throw e;
            }
        }

        String allocate(SchemaNode node) {
            String token = DRAFT_PREFIX + allocationOrder.size();
            allocationOrder.add(token);
            inProgress.put(node, token);
            return token;
        }

        void complete(SchemaNode node, GeneratedType draft) {
            inProgress.remove(node);
            drafts.put(draft.getName(), draft);
        }

        String documentation(SchemaNode... nodes) {
            if (!config.isDocsEnabled()) {
                return null;
            }
            for (SchemaNode candidate : nodes) {
                if (candidate.getDescription() != null && !candidate.getDescription().isBlank()) {
                    return candidate.getDescription().strip();
                }
            }
            return null;
        }

        /**
         * Dispatches on the resolved node. {@code declared} is the node as it
         * appears at this position, which may be a reference carrying its own
         * flags.
         */
        private final class NodeAnalyzer implements SchemaNodeVisitor<TypeRef> {
            private final SchemaNode declared;
            private final SchemaPath path;
            private final int depth;

            NodeAnalyzer(SchemaNode declared, SchemaPath path, int depth) {
                this.declared = declared;
                this.path = path;
                this.depth = depth;
            }

            @Override
            public TypeRef visit(ScalarNode scalar) {
                return TypeRef.primitive(primitiveFor(scalar));
            }

            @Override
            public TypeRef visit(ObjectNode object) {
                if (object.getProperties().isEmpty()) {
                    log.debug("{}: object without properties, using an open map", path);
                    return TypeRef.mapOf(TypeRef.unknown());
                }

                String token = allocate(object);
                List<CompositeField> fields = new ArrayList<>();
                for (Map.Entry<String, SchemaNode> property : object.getProperties().entrySet()) {
                    String name = property.getKey();
                    if (path.isRoot() && config.isSkipEnvelopeProperties() && ENVELOPE_PROPERTIES.contains(name)) {
                        continue;
                    }
                    fields.add(field(object, name, property.getValue()));
                }
                complete(object, new CompositeType(token, path, documentation(declared, object), fields));
                return TypeRef.named(token);
            }

            private CompositeField field(ObjectNode owner, String name, SchemaNode child) {
                SchemaNode resolvedChild = child.resolve();
                TypeRef ref = analyze(child, path.property(name), depth + 1);

                boolean nullable = child.isNullable() || resolvedChild.isNullable();
                boolean optional = !owner.isRequired(name) || nullable || ref instanceof TypeRef.UnknownRef;
                AbsentPolicy absentPolicy = !optional
                        && (ref instanceof TypeRef.SequenceRef || ref instanceof TypeRef.MapRef)
                        ? AbsentPolicy.TREAT_ABSENT_AS_EMPTY
                        : AbsentPolicy.NONE;
                Object defaultValue = child.getDefaultValue() != null
                        ? child.getDefaultValue()
                        : resolvedChild.getDefaultValue();

                return CompositeField.builder()
                        .name(name)
                        .type(optional ? TypeRef.optional(ref) : ref)
                        .optional(optional)
                        .absentPolicy(absentPolicy)
                        .documentation(documentation(child, resolvedChild))
                        .defaultValue(defaultValue)
                        .build();
            }

            @Override
            public TypeRef visit(ArrayNode array) {
                if (array.getItems() == null) {
                    throw new AnalysisException(ErrorKind.UNSUPPORTED_SCHEMA_CONSTRUCT, path,
                            "array without a single items schema");
                }
                return TypeRef.sequence(analyze(array.getItems(), path.item(), depth + 1));
            }

            @Override
            public TypeRef visit(MapNode map) {
                if (map.getValueSchema() == null) {
                    return TypeRef.mapOf(TypeRef.unknown());
                }
                return TypeRef.mapOf(analyze(map.getValueSchema(), path.value(), depth + 1));
            }

            @Override
            public TypeRef visit(UnknownNode unknown) {
                return TypeRef.unknown();
            }

            @Override
            public TypeRef visit(UnsupportedNode unsupported) {
                throw new AnalysisException(ErrorKind.UNSUPPORTED_SCHEMA_CONSTRUCT, path, unsupported.getReason());
            }

            @Override
            public TypeRef visit(EnumerationNode enumeration) {
                boolean nullable = declared.isNullable() || enumeration.isNullable();
                List<Object> literals = new ArrayList<>(enumLiterals(enumeration, nullable));
                return unitEnum(enumeration, literals, enumeration.getDefaultValue());
            }

            private TypeRef unitEnum(SchemaNode owner, List<Object> literals, Object defaultValue) {
                if (literals.isEmpty()) {
                    throw new AnalysisException(ErrorKind.UNSUPPORTED_SCHEMA_CONSTRUCT, path,
                            "enumeration without values");
                }
                long stringCount = literals.stream().filter(String.class::isInstance).count();
                if (stringCount > 0 && stringCount < literals.size()) {
                    throw new AnalysisException(ErrorKind.UNSUPPORTED_SCHEMA_CONSTRUCT, path,
                            "enumeration mixes string and integer values " + literals);
                }
                String token = allocate(owner);
                List<EnumVariant> variants = new ArrayList<>();
                for (Object literal : new LinkedHashSet<>(literals)) {
                    variants.add(EnumVariant.unit(String.valueOf(literal), literal));
                }
                Object defaultLiteral = defaultValue != null && literals.contains(defaultValue) ? defaultValue : null;
                complete(owner, new EnumeratedType(token, path, documentation(declared, owner), TypeKind.UNIT_ENUM,
                        variants, defaultLiteral));
                return TypeRef.named(token);
            }

            private List<Object> enumLiterals(EnumerationNode enumeration, boolean nullable) {
                List<Object> literals = new ArrayList<>();
                for (Object literal : enumeration.getLiterals()) {
                    if (literal == null) {
                        if (!nullable) {
                            throw new AnalysisException(ErrorKind.UNSUPPORTED_SCHEMA_CONSTRUCT, path,
                                    "null enumeration value on a non-nullable field");
                        }
                        continue;
                    }
                    if (!(literal instanceof String) && !isIntegral(literal)) {
                        throw new AnalysisException(ErrorKind.UNSUPPORTED_SCHEMA_CONSTRUCT, path,
                                "enumeration value " + literal + " of type " + literal.getClass().getSimpleName()
                                        + " is neither a string nor an integer");
                    }
                    literals.add(literal);
                }
                return literals;
            }

            @Override
            public TypeRef visit(UnionNode union) {
                List<SchemaNode> variants = union.getVariants();
                if (variants.isEmpty()) {
                    throw new AnalysisException(ErrorKind.UNSUPPORTED_SCHEMA_CONSTRUCT, path, "union without variants");
                }
                if (variants.size() == 1) {
                    return analyze(variants.get(0), path, depth + 1);
                }

                List<SchemaNode> resolvedVariants = variants.stream().map(SchemaNode::resolve).toList();
                long literalCount = resolvedVariants.stream().filter(EnumerationNode.class::isInstance).count();
                if (literalCount == resolvedVariants.size()) {
                    List<Object> literals = new ArrayList<>();
                    for (SchemaNode variant : resolvedVariants) {
                        literals.addAll(enumLiterals((EnumerationNode) variant,
                                declared.isNullable() || union.isNullable()));
                    }
                    return unitEnum(union, literals, union.getDefaultValue());
                }
                if (literalCount > 0) {
                    throw new AnalysisException(ErrorKind.UNSUPPORTED_SCHEMA_CONSTRUCT, path,
                            "union mixes literal values with other shapes");
                }

                long unknownCount = resolvedVariants.stream().filter(UnknownNode.class::isInstance).count();
                if (unknownCount == resolvedVariants.size()) {
                    return TypeRef.unknown();
                }
                if (unknownCount > 0) {
                    throw new AnalysisException(ErrorKind.IRRECONCILABLE_UNION, path,
                            "union mixes an untyped variant with concrete shapes");
                }
                requireDistinguishable(resolvedVariants);

                List<String> names = variantNames(resolvedVariants);
                String token = allocate(union);
                List<EnumVariant> tagged = new ArrayList<>();
                for (int i = 0; i < variants.size(); i++) {
                    TypeRef payload = analyze(variants.get(i), path.variant(i, names.get(i)), depth + 1);
                    tagged.add(EnumVariant.tagged(names.get(i), payload));
                }
                complete(union, new EnumeratedType(token, path, documentation(declared, union), TypeKind.TAGGED_ENUM,
                        tagged, null));
                return TypeRef.named(token);
            }

            private void requireDistinguishable(List<SchemaNode> variants) {
                Set<ScalarKind> scalarKinds = EnumSet.noneOf(ScalarKind.class);
                Set<Set<String>> objectKeys = new HashSet<>();
                int arrays = 0;
                int maps = 0;
                int objects = 0;
                for (SchemaNode variant : variants) {
                    if (variant instanceof ScalarNode scalar) {
                        if (!scalarKinds.add(scalar.getKind())) {
                            throw irreconcilable("two variants are both " + scalar.getKind().schemaName());
                        }
                    } else if (variant instanceof ObjectNode object) {
                        objects++;
                        if (!objectKeys.add(object.getProperties().keySet())) {
                            throw irreconcilable("two object variants declare the same properties "
                                    + object.getProperties().keySet());
                        }
                    } else if (variant instanceof IntersectionNode) {
                        objects++;
                    } else if (variant instanceof ArrayNode) {
                        arrays++;
                    } else if (variant instanceof MapNode) {
                        maps++;
                    } else if (variant instanceof UnsupportedNode unsupported) {
                        throw new AnalysisException(ErrorKind.UNSUPPORTED_SCHEMA_CONSTRUCT, path,
                                unsupported.getReason());
                    } else {
                        throw new AnalysisException(ErrorKind.UNSUPPORTED_SCHEMA_CONSTRUCT, path,
                                "nested union variants are not supported");
                    }
                }
                if (arrays > 1) {
                    throw irreconcilable("more than one array variant");
                }
                if (maps > 1 || (maps == 1 && objects > 0)) {
                    throw irreconcilable("an open map variant cannot be told apart from object variants");
                }
            }

            private AnalysisException irreconcilable(String detail) {
                return new AnalysisException(ErrorKind.IRRECONCILABLE_UNION, path, detail);
            }

            private List<String> variantNames(List<SchemaNode> variants) {
                List<String> names = new ArrayList<>();
                Set<String> used = new HashSet<>();
                for (int i = 0; i < variants.size(); i++) {
                    SchemaNode variant = variants.get(i);
                    String base;
                    if (variant instanceof ObjectNode object && object.getProperties().size() == 1) {
                        base = NamingUtil.toPascalCase(object.getProperties().keySet().iterator().next());
                    } else if (variant instanceof ScalarNode scalar) {
                        base = NamingUtil.toPascalCase(scalar.getKind().schemaName());
                    } else if (variant instanceof ArrayNode) {
                        base = "List";
                    } else if (variant instanceof MapNode) {
                        base = "Map";
                    } else {
                        base = "Variant" + i;
                    }
                    if (base.isEmpty()) {
                        base = "Variant" + i;
                    }
                    String name = used.contains(base) ? base + i : base;
                    used.add(name);
                    names.add(name);
                }
                return names;
            }

            @Override
            public TypeRef visit(IntersectionNode intersection) {
                ObjectNode merged = flattened.get(intersection);
                if (merged == null) {
                    merged = flatten(intersection);
                    flattened.put(intersection, merged);
                }
                return analyze(merged, path, depth + 1);
            }

            private ObjectNode flatten(IntersectionNode intersection) {
                Map<String, SchemaNode> properties = new LinkedHashMap<>();
                Set<String> required = new LinkedHashSet<>();
                for (SchemaNode branch : intersection.getBranches()) {
                    SchemaNode resolvedBranch = branch.resolve();
                    if (resolvedBranch instanceof UnsupportedNode unsupported) {
                        throw new AnalysisException(ErrorKind.UNSUPPORTED_SCHEMA_CONSTRUCT, path,
                                unsupported.getReason());
                    }
                    if (!(resolvedBranch instanceof ObjectNode object)) {
                        throw new AnalysisException(ErrorKind.UNSUPPORTED_SCHEMA_CONSTRUCT, path,
                                "allOf branch is not an object and cannot be flattened");
                    }
                    for (Map.Entry<String, SchemaNode> property : object.getProperties().entrySet()) {
                        SchemaNode existing = properties.putIfAbsent(property.getKey(), property.getValue());
                        if (existing != null && !existing.equals(property.getValue())) {
                            throw new AnalysisException(ErrorKind.UNSUPPORTED_SCHEMA_CONSTRUCT,
                                    path.property(property.getKey()),
                                    "allOf branches declare conflicting schemas for the same property");
                        }
                    }
                    required.addAll(object.getRequired());
                }
                return new ObjectNode(intersection.getFlags(), properties, required);
            }

            @Override
            public TypeRef visit(ReferenceNode reference) {
                return analyze(reference.resolve(), path, depth + 1);
            }

            private PrimitiveType primitiveFor(ScalarNode scalar) {
                String format = scalar.getFormat();
                return switch (scalar.getKind()) {
                    case BOOLEAN -> PrimitiveType.BOOLEAN;
                    case STRING -> stringFormat(format);
                    case INTEGER -> integerFormat(format);
                    case NUMBER -> "float".equals(format) ? PrimitiveType.FLOAT32 : PrimitiveType.FLOAT64;
                };
            }

            private PrimitiveType stringFormat(String format) {
                if (format == null) {
                    return PrimitiveType.STRING;
                }
                return switch (format) {
                    case "date" -> PrimitiveType.DATE;
                    case "date-time" -> PrimitiveType.DATE_TIME;
                    case "byte" -> PrimitiveType.BYTES;
                    default -> PrimitiveType.STRING;
                };
            }

            private PrimitiveType integerFormat(String format) {
                if (format == null) {
                    return PrimitiveType.INT64;
                }
                return switch (format) {
                    case "int8" -> PrimitiveType.INT8;
                    case "int16" -> PrimitiveType.INT16;
                    case "int32" -> PrimitiveType.INT32;
                    case "uint8" -> PrimitiveType.UINT8;
                    case "uint16" -> PrimitiveType.UINT16;
                    case "uint32" -> PrimitiveType.UINT32;
                    case "uint64", "uint128" -> PrimitiveType.UINT64;
                    default -> PrimitiveType.INT64;
                };
            }
        }

        // ---------------------------------------------------------------
        // Phase 2: reachability
        // ---------------------------------------------------------------

        List<String> reachableDrafts(TypeRef rootRef) {
            Set<String> seen = new HashSet<>();
            Deque<String> pending = new ArrayDeque<>();
            List<String> start = new ArrayList<>();
            rootRef.collectNames(start);
            pending.addAll(start);
            while (!pending.isEmpty()) {
                String token = pending.pop();
                if (!seen.add(token)) {
                    continue;
                }
                GeneratedType draft = drafts.get(token);
                if (draft == null) {
                    throw new IllegalStateException("Draft " + token + " was referenced but never completed");
                }
                List<String> next = new ArrayList<>();
                referencesOf(draft).forEach(ref -> ref.collectNames(next));
                pending.addAll(next);
            }
            List<String> reachable = allocationOrder.stream().filter(seen::contains).toList();
            if (reachable.size() < drafts.size()) {
                log.debug("Discarding {} unreachable draft types", drafts.size() - reachable.size());
            }
            return reachable;
        }

        // ---------------------------------------------------------------
        // Phase 3: deduplication
        // ---------------------------------------------------------------

        Map<String, String> deduplicate(List<String> reachable) {
            Map<String, GeneratedType> reachableDrafts = new LinkedHashMap<>();
            reachable.forEach(token -> reachableDrafts.put(token, drafts.get(token)));
            StructuralSignatureCalculator calculator = new StructuralSignatureCalculator(reachableDrafts);
            Map<String, String> firstBySignature = new HashMap<>();
            Map<String, String> canonical = new HashMap<>();
            for (String token : reachable) {
                String signature = calculator.calculateSignature(token);
                String first = firstBySignature.putIfAbsent(signature, token);
                canonical.put(token, first != null ? first : token);
                if (first != null) {
                    log.debug("{} is structurally identical to {}, merging",
                            drafts.get(token).getOriginPath(), drafts.get(first).getOriginPath());
                }
            }
            return canonical;
        }

        // ---------------------------------------------------------------
        // Phase 4: naming
        // ---------------------------------------------------------------

        Map<String, String> assignNames(List<String> reachable, Map<String, String> canonical) {
            Map<String, SchemaPath> owners = new HashMap<>();
            Map<String, String> names = new HashMap<>();
            for (String token : reachable) {
                if (!canonical.get(token).equals(token)) {
                    continue;
                }
                SchemaPath origin = drafts.get(token).getOriginPath();
                String name = typeName(origin);
                SchemaPath owner = owners.putIfAbsent(name, origin);
                if (owner != null) {
                    throw new AnalysisException(ErrorKind.NAMING_COLLISION, origin,
                            "type name " + name + " is already used by the different type at " + owner);
                }
                names.put(token, name);
            }
            return names;
        }

        // ---------------------------------------------------------------
        // Phase 5: final names
        // ---------------------------------------------------------------

        GeneratedType rename(GeneratedType draft, String name, Map<String, String> canonical,
                             Map<String, String> finalNames) {
            UnaryOperator<String> renamer = token -> finalNames.get(canonical.get(token));
            if (draft instanceof CompositeType composite) {
                List<CompositeField> fields = composite.getFields().stream()
                        .map(f -> f.toBuilder().type(f.getType().mapNames(renamer)).build())
                        .toList();
                return new CompositeType(name, draft.getOriginPath(), draft.getDocumentation(), fields);
            }
            EnumeratedType enumerated = (EnumeratedType) draft;
            List<EnumVariant> variants = enumerated.getVariants().stream()
                    .map(v -> v.getPayload() == null ? v
                            : EnumVariant.tagged(v.getName(), v.getPayload().mapNames(renamer)))
                    .toList();
            return new EnumeratedType(name, draft.getOriginPath(), draft.getDocumentation(), draft.getKind(),
                    variants, enumerated.getDefaultLiteral().orElse(null));
        }
    }

    /**
     * Type name for {@code path}: the root name followed by every naming
     * segment of the path, concatenated.
     */
    static String typeName(SchemaPath path) {
        return String.join("", namingSegments(path));
    }

    /**
     * PascalCase naming segments for a path. Array items and map values add
     * nothing of their own unless they directly follow another container step
     * (or start the path), in which case they add {@code Items} or
     * {@code Value}.
     */
    static List<String> namingSegments(SchemaPath path) {
        List<String> segments = new ArrayList<>();
        segments.add(NamingUtil.toPascalCase(path.getRootName()));
        SchemaPath.SegmentKind previous = null;
        for (SchemaPath.Segment segment : path.getSegments()) {
            boolean afterContainer = previous == null
                    || previous == SchemaPath.SegmentKind.ITEM
                    || previous == SchemaPath.SegmentKind.VALUE;
            switch (segment.getKind()) {
                case PROPERTY, VARIANT -> segments.add(NamingUtil.toPascalCase(segment.getName()));
                case ITEM -> {
                    if (afterContainer) {
                        segments.add("Items");
                    }
                }
                case VALUE -> {
                    if (afterContainer) {
                        segments.add("Value");
                    }
                }
            }
            previous = segment.getKind();
        }
        return Collections.unmodifiableList(segments);
    }

    private static List<TypeRef> referencesOf(GeneratedType type) {
        List<TypeRef> refs = new ArrayList<>();
        if (type instanceof CompositeType composite) {
            composite.getFields().forEach(f -> refs.add(f.getType()));
        } else if (type instanceof EnumeratedType enumerated) {
            enumerated.getVariants().stream()
                    .filter(v -> v.getPayload() != null)
                    .forEach(v -> refs.add(v.getPayload()));
        }
        return refs;
    }

    private static boolean isIntegral(Object literal) {
        return literal instanceof Integer || literal instanceof Long || literal instanceof Short
                || literal instanceof Byte || literal instanceof BigInteger;
    }
}
