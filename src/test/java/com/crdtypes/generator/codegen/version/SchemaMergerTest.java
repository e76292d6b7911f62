package com.crdtypes.generator.codegen.version;

import com.crdtypes.generator.codegen.exception.AnalysisException;
import com.crdtypes.generator.codegen.exception.ErrorKind;
import com.crdtypes.generator.codegen.model.SchemaPath;
import com.crdtypes.generator.schema.ArrayNode;
import com.crdtypes.generator.schema.EnumerationNode;
import com.crdtypes.generator.schema.ObjectNode;
import com.crdtypes.generator.schema.ReferenceNode;
import com.crdtypes.generator.schema.ScalarKind;
import com.crdtypes.generator.schema.ScalarNode;
import com.crdtypes.generator.schema.SchemaFlags;
import com.crdtypes.generator.schema.SchemaNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class SchemaMergerTest {

    private static final SchemaPath PATH = SchemaPath.root("Root");

    private final SchemaMerger merger = new SchemaMerger();

    @Test
    void testEqualSchemasMergeToThemselves() {
        ScalarNode string = ScalarNode.of(ScalarKind.STRING);

        assertThat(merger.merge(string, ScalarNode.of(ScalarKind.STRING), PATH)).isSameAs(string);
    }

    @Test
    void testDifferingFormatIsDropped() {
        SchemaNode merged = merger.merge(
                new ScalarNode(null, ScalarKind.INTEGER, "int32"),
                new ScalarNode(null, ScalarKind.INTEGER, "int64"),
                PATH);

        assertThat(merged).isEqualTo(ScalarNode.of(ScalarKind.INTEGER));
    }

    @Test
    void testEnumerationLiteralsAreUnioned() {
        EnumerationNode merged = (EnumerationNode) merger.merge(
                new EnumerationNode(null, ScalarKind.STRING, List.of("A", "B")),
                new EnumerationNode(null, ScalarKind.STRING, List.of("B", "C")),
                PATH);

        assertThat(merged.getLiterals()).containsExactly("A", "B", "C");
    }

    @Test
    void testEnumerationWidensToScalar() {
        SchemaNode merged = merger.merge(
                ScalarNode.of(ScalarKind.STRING),
                new EnumerationNode(null, ScalarKind.STRING, List.of("A")),
                PATH);

        assertThat(merged).isEqualTo(ScalarNode.of(ScalarKind.STRING));
    }

    @Test
    void testArrayItemsAreMerged() {
        ObjectNode left = new ObjectNode(null, Map.of("a", ScalarNode.of(ScalarKind.STRING)), Set.of("a"));
        ObjectNode right = new ObjectNode(null, Map.of("b", ScalarNode.of(ScalarKind.BOOLEAN)), Set.of());

        ArrayNode merged = (ArrayNode) merger.merge(ArrayNode.of(left), ArrayNode.of(right), PATH);

        ObjectNode items = (ObjectNode) merged.getItems();
        assertThat(items.getProperties()).containsOnlyKeys("a", "b");
        assertThat(items.getRequired()).isEmpty();
    }

    @Test
    void testDescriptionOfPreferredVersionWins() {
        SchemaNode merged = merger.merge(
                new ScalarNode(SchemaFlags.builder().description("new").build(), ScalarKind.STRING, null),
                new ScalarNode(SchemaFlags.builder().description("old").nullable(true).build(), ScalarKind.STRING,
                        null),
                PATH);

        assertThat(merged.getDescription()).isEqualTo("new");
        assertThat(merged.isNullable()).isTrue();
    }

    @Test
    void testSharedDefinitionsAreComparedByContent() {
        ReferenceNode left = reference("node", object(Map.of("a", ScalarNode.of(ScalarKind.STRING))));
        ReferenceNode right = reference("node", object(Map.of("a", ScalarNode.of(ScalarKind.INTEGER))));
        ObjectNode newer = object(Map.of("n", left));
        ObjectNode older = object(Map.of("n", right));

        assertThatThrownBy(() -> merger.merge(newer, older, PATH))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("Root.n.a")
                .extracting(e -> ((AnalysisException) e).getKind())
                .isEqualTo(ErrorKind.IRRECONCILABLE_UNION);
    }

    @Test
    void testRecursiveDefinitionsAreMergedOnce() {
        ReferenceNode leftChild = ReferenceNode.named("node");
        ObjectNode leftNode = object(Map.of("value", ScalarNode.of(ScalarKind.STRING),
                "children", ArrayNode.of(leftChild)));
        leftChild.bind(leftNode);
        ReferenceNode rightChild = ReferenceNode.named("node");
        ObjectNode rightNode = object(Map.of("value", ScalarNode.of(ScalarKind.STRING),
                "children", ArrayNode.of(rightChild), "weight", ScalarNode.of(ScalarKind.INTEGER)));
        rightChild.bind(rightNode);

        SchemaNode merged = merger.merge(reference("node", leftNode), reference("node", rightNode), PATH);

        assertThat(merged).isInstanceOf(ReferenceNode.class);
        ObjectNode node = (ObjectNode) merged.resolve();
        assertThat(node.getProperties()).containsOnlyKeys("value", "children", "weight");
        ArrayNode children = (ArrayNode) node.getProperties().get("children");
        assertThat(children.getItems().resolve()).isSameAs(node);
    }

    @Test
    void testObjectAgainstScalarIsIrreconcilable() {
        ObjectNode object = new ObjectNode(null, Map.of("a", ScalarNode.of(ScalarKind.STRING)), Set.of());

        assertThatThrownBy(() -> merger.merge(object, ScalarNode.of(ScalarKind.STRING), PATH.property("spec")))
                .isInstanceOf(AnalysisException.class)
                .hasMessageContaining("Root.spec")
                .extracting(e -> ((AnalysisException) e).getKind())
                .isEqualTo(ErrorKind.IRRECONCILABLE_UNION);
    }

    @Test
    void testMergeAllFoldsInPriorityOrder() {
        SchemaNode merged = merger.mergeAll(List.of(
                new EnumerationNode(null, ScalarKind.STRING, List.of("A")),
                new EnumerationNode(null, ScalarKind.STRING, List.of("B")),
                new EnumerationNode(null, ScalarKind.STRING, List.of("A", "C"))), PATH);

        assertThat(((EnumerationNode) merged).getLiterals()).containsExactly("A", "B", "C");
    }

    private static ReferenceNode reference(String name, SchemaNode target) {
        ReferenceNode reference = ReferenceNode.named(name);
        reference.bind(target);
        return reference;
    }

    private static ObjectNode object(Map<String, SchemaNode> properties) {
        return new ObjectNode(null, properties, Set.of());
    }
}
