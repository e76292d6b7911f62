package com.crdtypes.generator.codegen.analysis;

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
import com.crdtypes.generator.schema.ArrayNode;
import com.crdtypes.generator.schema.EnumerationNode;
import com.crdtypes.generator.schema.IntersectionNode;
import com.crdtypes.generator.schema.ObjectNode;
import com.crdtypes.generator.schema.ReferenceNode;
import com.crdtypes.generator.schema.ScalarKind;
import com.crdtypes.generator.schema.ScalarNode;
import com.crdtypes.generator.schema.SchemaFlags;
import com.crdtypes.generator.schema.SchemaNode;
import com.crdtypes.generator.schema.UnionNode;
import com.crdtypes.generator.schema.UnknownNode;
import com.crdtypes.generator.schema.UnsupportedNode;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

/**
 * Unit tests for TypeGraphBuilder: naming, deduplication, cycles, unions and
 * relaxed mode.
 */
class TypeGraphBuilderTest {

    @Test
    void testArrayOfObjectsProducesTwoComposites() {
        ObjectNode groupItem = object(props("name", string(), "interval", string()), "name");
        ObjectNode root = object(props("groups", ArrayNode.of(groupItem)), "groups");

        TypeGraph graph = build(root);

        assertThat(graph.getTypeNames()).containsExactly("Root", "RootGroups");
        assertThat(graph.getRootRef()).isEqualTo(TypeRef.named("Root"));

        CompositeField groups = composite(graph, "Root").field("groups").orElseThrow();
        assertThat(groups.isOptional()).isFalse();
        assertThat(groups.getType()).isEqualTo(TypeRef.sequence(TypeRef.named("RootGroups")));
        assertThat(groups.getAbsentPolicy()).isEqualTo(AbsentPolicy.TREAT_ABSENT_AS_EMPTY);

        CompositeType item = composite(graph, "RootGroups");
        CompositeField name = item.field("name").orElseThrow();
        CompositeField interval = item.field("interval").orElseThrow();
        assertThat(name.isOptional()).isFalse();
        assertThat(name.getType()).isEqualTo(TypeRef.primitive(PrimitiveType.STRING));
        assertThat(interval.isOptional()).isTrue();
        assertThat(interval.getType()).isEqualTo(TypeRef.optional(TypeRef.primitive(PrimitiveType.STRING)));
    }

    @Test
    void testIntOrStringBecomesExternalReference() {
        SchemaNode port = new ScalarNode(SchemaFlags.builder().intOrString(true).build(), ScalarKind.STRING, null);
        ObjectNode root = object(props("port", port));

        TypeGraph graph = build(root);

        assertThat(graph.size()).isEqualTo(1);
        assertThat(composite(graph, "Root").field("port").orElseThrow().getType())
                .isEqualTo(TypeRef.optional(TypeRef.external(KnownShape.INT_OR_STRING)));
    }

    @Test
    void testIntegerStringUnionIsIntOrString() {
        UnionNode union = UnionNode.builder()
                .variant(ScalarNode.of(ScalarKind.INTEGER))
                .variant(ScalarNode.of(ScalarKind.STRING))
                .build();
        TypeGraph graph = build(object(props("port", union), "port"));

        assertThat(composite(graph, "Root").field("port").orElseThrow().getType())
                .isEqualTo(TypeRef.external(KnownShape.INT_OR_STRING));
    }

    @Test
    void testOneOfOverLiteralsIsSingleUnitEnum() {
        UnionNode mode = UnionNode.builder()
                .variant(EnumerationNode.builder().literal("A").build())
                .variant(EnumerationNode.builder().literal("B").build())
                .variant(EnumerationNode.builder().literal("C").build())
                .build();

        TypeGraph graph = build(object(props("mode", mode)));

        assertThat(graph.getTypeNames()).containsExactly("Root", "RootMode");
        EnumeratedType enumerated = (EnumeratedType) graph.require("RootMode");
        assertThat(enumerated.getKind()).isEqualTo(TypeKind.UNIT_ENUM);
        assertThat(enumerated.getVariants()).extracting(EnumVariant::getLiteral).containsExactly("A", "B", "C");
        assertThat(enumerated.getVariants()).allMatch(EnumVariant::isUnit);
    }

    @Test
    void testEnumerationKeepsLiteralSpellingAndDefault() {
        EnumerationNode policy = EnumerationNode.builder()
                .flags(SchemaFlags.builder().defaultValue("IfNotPresent").build())
                .literal("Always")
                .literal("IfNotPresent")
                .literal("Never")
                .build();

        TypeGraph graph = build(object(props("pullPolicy", policy)));

        EnumeratedType enumerated = (EnumeratedType) graph.require("RootPullPolicy");
        assertThat(enumerated.getVariants()).extracting(EnumVariant::getName)
                .containsExactly("Always", "IfNotPresent", "Never");
        assertThat(enumerated.getDefaultLiteral()).contains("IfNotPresent");
    }

    @Test
    void testConditionArrayIsSubstituted() {
        ObjectNode condition = object(props(
                "type", string(),
                "status", string(),
                "reason", string(),
                "message", string(),
                "lastTransitionTime", new ScalarNode(null, ScalarKind.STRING, "date-time")),
                "type", "status");
        ObjectNode status = object(props("conditions", ArrayNode.of(condition)));
        ObjectNode root = object(props("status", status));

        TypeGraph graph = build(root);

        assertThat(graph.getTypeNames()).containsExactly("Root", "RootStatus");
        assertThat(composite(graph, "RootStatus").field("conditions").orElseThrow().getType())
                .isEqualTo(TypeRef.optional(TypeRef.sequence(TypeRef.external(KnownShape.CONDITION))));
        assertThat(graph.externalShapesUsed()).containsExactly(KnownShape.CONDITION);
    }

    @Test
    void testSuppressedConditionIsSynthesized() {
        ObjectNode condition = object(props(
                "type", string(), "status", string(), "reason", string(), "message", string(),
                "lastTransitionTime", string()),
                "type", "status");
        ObjectNode root = object(props("status", object(props("conditions", ArrayNode.of(condition)))));
        GeneratorConfig config = GeneratorConfig.builder().suppressKnownShape(KnownShape.CONDITION).build();

        TypeGraph graph = new TypeGraphBuilder(config).build(root, "Root");

        assertThat(graph.getTypeNames()).containsExactly("Root", "RootStatus", "RootStatusConditions");
        assertThat(graph.externalShapesUsed()).isEmpty();
    }

    @Test
    void testEnvelopePropertiesAreSkippedAtRootOnly() {
        ObjectNode spec = object(props("kind", string(), "size", ScalarNode.of(ScalarKind.INTEGER)));
        ObjectNode root = object(props(
                "apiVersion", string(),
                "kind", string(),
                "metadata", object(props("name", string())),
                "spec", spec));

        TypeGraph graph = build(root);

        assertThat(composite(graph, "Root").getFields()).extracting(CompositeField::getName).containsExactly("spec");
        assertThat(composite(graph, "RootSpec").getFields()).extracting(CompositeField::getName)
                .containsExactly("kind", "size");
    }

    @Test
    void testStructurallyIdenticalObjectsAreMerged() {
        ObjectNode root = object(props(
                "primary", object(props("host", string(), "port", ScalarNode.of(ScalarKind.INTEGER)), "host"),
                "secondary", object(props("host", string(), "port", ScalarNode.of(ScalarKind.INTEGER)), "host")));

        TypeGraph graph = build(root);

        assertThat(graph.getTypeNames()).containsExactly("Root", "RootPrimary");
        assertThat(composite(graph, "Root").field("secondary").orElseThrow().getType())
                .isEqualTo(TypeRef.optional(TypeRef.named("RootPrimary")));
    }

    @Test
    void testNestedObjectsAreNamedByTheirFullPath() {
        ObjectNode root = object(props(
                "spec", object(props("config", object(props("x", string())))),
                "status", object(props("config", object(props("y", string()))))));

        TypeGraph graph = build(root);

        assertThat(graph.getTypeNames())
                .containsExactly("Root", "RootSpec", "RootSpecConfig", "RootStatus", "RootStatusConfig");
        assertThat(composite(graph, "RootStatus").field("config").orElseThrow().getType())
                .isEqualTo(TypeRef.optional(TypeRef.named("RootStatusConfig")));
    }

    @Test
    void testNamingCollisionWhenPropertyNamesFoldTogether() {
        ObjectNode root = object(props(
                "a-b", object(props("x", string())),
                "aB", object(props("y", ScalarNode.of(ScalarKind.INTEGER)))));

        assertThatThrownBy(() -> build(root))
                .isInstanceOf(AnalysisException.class)
                .satisfies(e -> assertThat(((AnalysisException) e).getKind()).isEqualTo(ErrorKind.NAMING_COLLISION));
    }

    @Test
    void testGeneratedNamesAreUnique() {
        ObjectNode leaf = object(props("value", string()));
        ObjectNode root = object(props(
                "spec", object(props("items", ArrayNode.of(object(props("leaf", leaf, "n", string()))))),
                "status", object(props("items", ArrayNode.of(object(props("other", string())))))));

        TypeGraph graph = build(root);

        List<String> names = graph.getTypeNames();
        assertThat(new HashSet<>(names)).hasSameSizeAs(names);
    }

    @Test
    void testBuildIsDeterministic() {
        ObjectNode root = object(props(
                "spec", object(props(
                        "groups", ArrayNode.of(object(props("name", string(), "rules",
                                ArrayNode.of(object(props("alert", string(), "expr", string())))), "name")),
                        "mode", EnumerationNode.builder().literal("fast").literal("slow").build())),
                "status", object(props("observed", ScalarNode.of(ScalarKind.INTEGER)))));

        TypeGraph first = build(root);
        TypeGraph second = new TypeGraphBuilder(GeneratorConfig.defaults()).build(root, "Root");

        assertThat(second.getTypeNames()).isEqualTo(first.getTypeNames());
        for (String name : first.getTypeNames()) {
            assertThat(describe(second.require(name))).isEqualTo(describe(first.require(name)));
        }
    }

    @Test
    void testSelfReferenceTerminatesWithIndirectReference() {
        ReferenceNode nodeRef = ReferenceNode.named("node");
        ReferenceNode childRef = ReferenceNode.named("node");
        ObjectNode node = object(props("value", string(), "children", ArrayNode.of(childRef)));
        nodeRef.bind(node);
        childRef.bind(node);

        TypeGraph graph = build(object(props("tree", nodeRef)));

        assertThat(graph.getTypeNames()).containsExactly("Root", "RootTree");
        TypeRef children = composite(graph, "RootTree").field("children").orElseThrow().getType();
        assertThat(children.describe()).isEqualTo("Optional<Sequence<&RootTree>>");
        graph.freeze();
    }

    @Test
    void testMutuallyRecursiveDefinitionsBuildQuickly() {
        int count = 12;
        List<ObjectNode> definitions = new ArrayList<>();
        List<ReferenceNode> references = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Map<String, SchemaNode> properties = new LinkedHashMap<>();
            properties.put("value", string());
            for (int j = 0; j < count; j++) {
                ReferenceNode next = ReferenceNode.named("node" + j);
                references.add(next);
                properties.put("next" + j, next);
            }
            definitions.add(object(properties));
        }
        ReferenceNode entry = ReferenceNode.named("node0");
        references.add(entry);
        for (ReferenceNode reference : references) {
            reference.bind(definitions.get(Integer.parseInt(reference.getName().substring("node".length()))));
        }

        TypeGraph graph = assertTimeoutPreemptively(Duration.ofSeconds(10), () -> build(object(props("entry", entry))));

        assertThat(graph.getTypeNames()).containsExactly("Root", "RootEntry");
        assertThat(composite(graph, "RootEntry").field("next0").orElseThrow().getType().describe())
                .isEqualTo("Optional<&RootEntry>");
    }

    @Test
    void testNestingBeyondMaxDepthFails() {
        SchemaNode nested = string();
        for (int i = 0; i < 5; i++) {
            nested = object(props("level" + i, nested));
        }
        SchemaNode root = nested;
        GeneratorConfig config = GeneratorConfig.builder().maxDepth(2).build();

        assertThatThrownBy(() -> new TypeGraphBuilder(config).build(root, "Root"))
                .isInstanceOf(AnalysisException.class)
                .satisfies(e -> assertThat(((AnalysisException) e).getKind())
                        .isEqualTo(ErrorKind.CYCLE_DEPTH_EXCEEDED));
    }

    @Test
    void testUnsupportedConstructFailsWithPath() {
        ObjectNode root = object(props("tuple", new ArrayNode(null, null)));

        assertThatThrownBy(() -> build(root))
                .isInstanceOf(AnalysisException.class)
                .satisfies(e -> {
                    AnalysisException failure = (AnalysisException) e;
                    assertThat(failure.getKind()).isEqualTo(ErrorKind.UNSUPPORTED_SCHEMA_CONSTRUCT);
                    assertThat(failure.getPath().render()).isEqualTo("Root.tuple");
                });
    }

    @Test
    void testRelaxedModeDowngradesToUnknown() {
        ObjectNode root = object(props("tuple", new ArrayNode(null, null), "name", string()), "tuple");
        GeneratorConfig config = GeneratorConfig.builder().relaxed(true).build();

        TypeGraph graph = new TypeGraphBuilder(config).build(root, "Root");

        CompositeField tuple = composite(graph, "Root").field("tuple").orElseThrow();
        assertThat(tuple.isOptional()).isTrue();
        assertThat(tuple.getType()).isEqualTo(TypeRef.optional(TypeRef.unknown()));
        assertThat(graph.getDiagnostics().getDowngrades()).hasSize(1);
        assertThat(graph.getDiagnostics().getDowngrades().get(0).getKind())
                .isEqualTo(ErrorKind.UNSUPPORTED_SCHEMA_CONSTRUCT);
    }

    @Test
    void testTypelessSchemaIsUnsupportedUnlessRelaxed() {
        ObjectNode root = object(props("opaque", new UnsupportedNode(null, "schema without a type")), "opaque");
        GeneratorConfig config = GeneratorConfig.builder().relaxed(true).build();

        assertThatThrownBy(() -> build(root))
                .isInstanceOf(AnalysisException.class)
                .satisfies(e -> {
                    AnalysisException failure = (AnalysisException) e;
                    assertThat(failure.getKind()).isEqualTo(ErrorKind.UNSUPPORTED_SCHEMA_CONSTRUCT);
                    assertThat(failure.getPath().render()).isEqualTo("Root.opaque");
                    assertThat(failure.getMessage()).contains("schema without a type");
                });

        TypeGraph graph = new TypeGraphBuilder(config).build(root, "Root");

        assertThat(composite(graph, "Root").field("opaque").orElseThrow().getType())
                .isEqualTo(TypeRef.optional(TypeRef.unknown()));
        assertThat(graph.getDiagnostics().getDowngrades()).hasSize(1);
    }

    @Test
    void testEnumerationMixingStringsAndIntegersIsUnsupported() {
        EnumerationNode restart = EnumerationNode.builder().literal(1L).literal("always").build();

        assertThatThrownBy(() -> build(object(props("restart", restart))))
                .isInstanceOf(AnalysisException.class)
                .satisfies(e -> {
                    AnalysisException failure = (AnalysisException) e;
                    assertThat(failure.getKind()).isEqualTo(ErrorKind.UNSUPPORTED_SCHEMA_CONSTRUCT);
                    assertThat(failure.getPath().render()).isEqualTo("Root.restart");
                });
    }

    @Test
    void testLiteralUnionMixingStringsAndIntegersIsUnsupported() {
        UnionNode union = UnionNode.builder()
                .variant(EnumerationNode.builder().literal(0L).build())
                .variant(EnumerationNode.builder().literal("never").build())
                .build();

        assertThatThrownBy(() -> build(object(props("retries", union))))
                .isInstanceOf(AnalysisException.class)
                .satisfies(e -> assertThat(((AnalysisException) e).getKind())
                        .isEqualTo(ErrorKind.UNSUPPORTED_SCHEMA_CONSTRUCT));
    }

    @Test
    void testIntegerEnumerationKeepsIntegerLiterals() {
        EnumerationNode level = EnumerationNode.builder().literal(1L).literal(2L).build();

        TypeGraph graph = build(object(props("level", level), "level"));

        EnumeratedType enumerated = (EnumeratedType) graph.require("RootLevel");
        assertThat(enumerated.getVariants()).extracting(EnumVariant::getLiteral).containsExactly(1L, 2L);
    }

    @Test
    void testRelaxedModeDoesNotHideNamingCollisions() {
        ObjectNode root = object(props(
                "a-b", object(props("x", string())),
                "aB", object(props("y", ScalarNode.of(ScalarKind.INTEGER)))));
        GeneratorConfig config = GeneratorConfig.builder().relaxed(true).build();

        assertThatThrownBy(() -> new TypeGraphBuilder(config).build(root, "Root"))
                .isInstanceOf(AnalysisException.class);
    }

    @Test
    void testUnionOfTwoStringsIsIrreconcilable() {
        UnionNode union = UnionNode.builder()
                .variant(new ScalarNode(null, ScalarKind.STRING, "date"))
                .variant(string())
                .build();

        assertThatThrownBy(() -> build(object(props("when", union))))
                .isInstanceOf(AnalysisException.class)
                .satisfies(e -> assertThat(((AnalysisException) e).getKind())
                        .isEqualTo(ErrorKind.IRRECONCILABLE_UNION));
    }

    @Test
    void testUnionMixingLiteralsAndShapesIsUnsupported() {
        UnionNode union = UnionNode.builder()
                .variant(EnumerationNode.builder().literal("auto").build())
                .variant(object(props("size", ScalarNode.of(ScalarKind.INTEGER))))
                .build();

        assertThatThrownBy(() -> build(object(props("sizing", union))))
                .isInstanceOf(AnalysisException.class)
                .satisfies(e -> assertThat(((AnalysisException) e).getKind())
                        .isEqualTo(ErrorKind.UNSUPPORTED_SCHEMA_CONSTRUCT));
    }

    @Test
    void testDistinguishableUnionBecomesTaggedEnum() {
        UnionNode union = UnionNode.builder()
                .variant(string())
                .variant(object(props("secretRef", string()), "secretRef"))
                .build();

        TypeGraph graph = build(object(props("source", union)));

        EnumeratedType source = (EnumeratedType) graph.require("RootSource");
        assertThat(source.getKind()).isEqualTo(TypeKind.TAGGED_ENUM);
        assertThat(source.getVariants()).extracting(EnumVariant::getName).containsExactly("String", "SecretRef");
        assertThat(source.getVariants().get(0).getPayload()).isEqualTo(TypeRef.primitive(PrimitiveType.STRING));
        assertThat(source.getVariants().get(1).getPayload()).isInstanceOf(TypeRef.NamedRef.class);
    }

    @Test
    void testAllOfObjectsAreFlattened() {
        IntersectionNode merged = IntersectionNode.builder()
                .branches(List.of(
                        object(props("a", string())),
                        object(props("b", ScalarNode.of(ScalarKind.BOOLEAN)), "b")))
                .build();

        TypeGraph graph = build(object(props("both", merged)));

        CompositeType both = composite(graph, "RootBoth");
        assertThat(both.getFields()).extracting(CompositeField::getName).containsExactly("a", "b");
        assertThat(both.field("a").orElseThrow().isOptional()).isTrue();
        assertThat(both.field("b").orElseThrow().isOptional()).isFalse();
    }

    @Test
    void testAllOfWithNonObjectBranchIsUnsupported() {
        IntersectionNode merged = IntersectionNode.builder()
                .branches(List.of(object(props("a", string())), string()))
                .build();

        assertThatThrownBy(() -> build(object(props("both", merged))))
                .isInstanceOf(AnalysisException.class)
                .satisfies(e -> assertThat(((AnalysisException) e).getKind())
                        .isEqualTo(ErrorKind.UNSUPPORTED_SCHEMA_CONSTRUCT));
    }

    @Test
    void testScalarFormatsAndOpenObjects() {
        ObjectNode root = object(props(
                "replicas", new ScalarNode(null, ScalarKind.INTEGER, "int32"),
                "ratio", new ScalarNode(null, ScalarKind.NUMBER, "float"),
                "created", new ScalarNode(null, ScalarKind.STRING, "date-time"),
                "labels", object(props()),
                "extra", UnknownNode.of()));

        CompositeType type = composite(build(root), "Root");

        assertThat(type.field("replicas").orElseThrow().getType().unwrapOptional())
                .isEqualTo(TypeRef.primitive(PrimitiveType.INT32));
        assertThat(type.field("ratio").orElseThrow().getType().unwrapOptional())
                .isEqualTo(TypeRef.primitive(PrimitiveType.FLOAT32));
        assertThat(type.field("created").orElseThrow().getType().unwrapOptional())
                .isEqualTo(TypeRef.primitive(PrimitiveType.DATE_TIME));
        assertThat(type.field("labels").orElseThrow().getType().unwrapOptional())
                .isEqualTo(TypeRef.mapOf(TypeRef.unknown()));
        assertThat(type.field("extra").orElseThrow().getType()).isEqualTo(TypeRef.optional(TypeRef.unknown()));
    }

    @Test
    void testDocumentationOnlyWhenEnabled() {
        ObjectNode root = new ObjectNode(SchemaFlags.builder().description("The resource.").build(),
                props("name", new ScalarNode(SchemaFlags.builder().description("Name of it.").build(),
                        ScalarKind.STRING, null)),
                Set.of());

        TypeGraph plain = build(root);
        TypeGraph documented = new TypeGraphBuilder(GeneratorConfig.builder().enableDocs(true).build())
                .build(root, "Root");

        assertThat(plain.require("Root").getDocumentation()).isNull();
        assertThat(documented.require("Root").getDocumentation()).isEqualTo("The resource.");
        assertThat(composite(documented, "Root").field("name").orElseThrow().getDocumentation())
                .isEqualTo("Name of it.");
    }

    @Test
    void testNameDoesNotDependOnSiblings() {
        ObjectNode statusOnly = object(props(
                "status", object(props("config", object(props("b", string()))))));
        ObjectNode withSpec = object(props(
                "spec", object(props(
                        "groups", ArrayNode.of(object(props("name", string()))),
                        "config", object(props("a", string())))),
                "status", object(props("config", object(props("b", string()))))));

        assertThat(build(statusOnly).getTypeNames()).containsExactly("Root", "RootStatus", "RootStatusConfig");
        assertThat(build(withSpec).getTypeNames()).containsExactly(
                "Root", "RootSpec", "RootSpecGroups", "RootSpecConfig", "RootStatus", "RootStatusConfig");
    }

    @Test
    void testTypeNameConcatenatesWholePath() {
        SchemaPath path = SchemaPath.root("Root").property("spec").property("groups").item();

        assertThat(TypeGraphBuilder.typeName(path)).isEqualTo("RootSpecGroups");
        assertThat(TypeGraphBuilder.typeName(SchemaPath.root("Root"))).isEqualTo("Root");
        assertThat(TypeGraphBuilder.namingSegments(SchemaPath.root("Root").property("matrix").item().item()))
                .containsExactly("Root", "Matrix", "Items");
    }

    // ---- helpers ----

    private static TypeGraph build(SchemaNode root) {
        return new TypeGraphBuilder(GeneratorConfig.defaults()).build(root, "Root");
    }

    private static CompositeType composite(TypeGraph graph, String name) {
        GeneratedType type = graph.require(name);
        assertThat(type).isInstanceOf(CompositeType.class);
        return (CompositeType) type;
    }

    private static String describe(GeneratedType type) {
        if (type instanceof CompositeType composite) {
            StringBuilder sb = new StringBuilder(type.getName()).append('{');
            for (CompositeField field : composite.getFields()) {
                sb.append(field.getName()).append(':').append(field.getType().describe()).append(';');
            }
            return sb.append('}').toString();
        }
        return type.getName() + ((EnumeratedType) type).getVariants();
    }

    private static ScalarNode string() {
        return ScalarNode.of(ScalarKind.STRING);
    }

    private static ObjectNode object(Map<String, SchemaNode> properties, String... required) {
        return new ObjectNode(null, properties, Set.of(required));
    }

    private static Map<String, SchemaNode> props(Object... pairs) {
        Map<String, SchemaNode> properties = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            properties.put((String) pairs[i], (SchemaNode) pairs[i + 1]);
        }
        return properties;
    }
}
