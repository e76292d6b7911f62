package com.crdtypes.generator.schema.loader;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.crdtypes.generator.schema.ArrayNode;
import com.crdtypes.generator.schema.CustomResourceDocument;
import com.crdtypes.generator.schema.EnumerationNode;
import com.crdtypes.generator.schema.IntersectionNode;
import com.crdtypes.generator.schema.MapNode;
import com.crdtypes.generator.schema.ObjectNode;
import com.crdtypes.generator.schema.ReferenceNode;
import com.crdtypes.generator.schema.ScalarKind;
import com.crdtypes.generator.schema.ScalarNode;
import com.crdtypes.generator.schema.SchemaFlags;
import com.crdtypes.generator.schema.SchemaNode;
import com.crdtypes.generator.schema.SchemaVersion;
import com.crdtypes.generator.schema.UnionNode;
import com.crdtypes.generator.schema.UnknownNode;
import com.crdtypes.generator.schema.UnsupportedNode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

/**
 * Reads a CustomResourceDefinition (YAML or JSON) and converts each version's
 * {@code openAPIV3Schema} into the schema model.
 *
 * The document tree is only inspected here; everything downstream works on
 * {@link SchemaNode}s.
 */
public class CrdSchemaLoader {

    private static final Logger log = LoggerFactory.getLogger(CrdSchemaLoader.class);

    private static final String DEFINITIONS_PREFIX = "#/definitions/";
    private static final String DEFS_PREFIX = "#/$defs/";

    /** Keywords that give a oneOf/anyOf branch a shape of its own. */
    private static final Set<String> SHAPE_KEYWORDS =
            Set.of("type", "$ref", "enum", "const", "items", "additionalProperties", "allOf", "oneOf", "anyOf");

    private final YAMLMapper mapper;

    public CrdSchemaLoader() {
        this.mapper = new YAMLMapper();
    }

    public CustomResourceDocument load(Path file) throws CrdLoadException {
        log.debug("Reading {}", file);
        String content;
        try {
            content = Files.readString(file);
        } catch (IOException e) {
            throw new CrdLoadException("Failed to read " + file + ": " + e.getMessage(), e);
        }
        return parse(content, file.toString());
    }

    public CustomResourceDocument parse(String content, String source) throws CrdLoadException {
        JsonNode root = readTree(content, source);
        if (root == null || !root.isObject()) {
            throw new CrdLoadException(source + ": not a CustomResourceDefinition document");
        }
        String kind = root.path("kind").asText("");
        if (!kind.isEmpty() && !"CustomResourceDefinition".equals(kind)) {
            throw new CrdLoadException(source + ": expected kind CustomResourceDefinition but found " + kind);
        }

        JsonNode spec = root.path("spec");
        String group = requireText(spec, "group", source);
        String resourceKind = requireText(spec.path("names"), "kind", source);
        String plural = spec.path("names").path("plural").asText(resourceKind.toLowerCase(Locale.ROOT) + "s");
        boolean namespaced = "Namespaced".equals(spec.path("scope").asText("Namespaced"));

        CustomResourceDocument.CustomResourceDocumentBuilder document = CustomResourceDocument.builder()
                .group(group)
                .kind(resourceKind)
                .plural(plural)
                .namespaced(namespaced);

        JsonNode versions = spec.path("versions");
        if (!versions.isArray() || versions.isEmpty()) {
            throw new CrdLoadException(source + ": spec.versions is missing or empty");
        }
        for (JsonNode version : versions) {
            String label = requireText(version, "name", source);
            JsonNode schema = version.path("schema").path("openAPIV3Schema");
            if (schema.isMissingNode()) {
                // apiextensions v1beta1 kept one schema for every version
                schema = spec.path("validation").path("openAPIV3Schema");
            }
            if (schema.isMissingNode() || schema.isNull()) {
                throw new CrdLoadException(source + ": version " + label + " has no openAPIV3Schema");
            }
            document.version(SchemaVersion.builder()
                    .label(label)
                    .served(version.path("served").asBoolean(true))
                    .storage(version.path("storage").asBoolean(false))
                    .statusSubresource(version.path("subresources").has("status"))
                    .root(convertSchema(schema, source + "#" + label))
                    .build());
        }
        CustomResourceDocument result = document.build();
        log.debug("Loaded {}.{} with versions {}", result.getKind(), result.getGroup(),
                result.getVersions().stream().map(SchemaVersion::getLabel).toList());
        return result;
    }

    /**
     * Converts a standalone schema document, e.g. an {@code openAPIV3Schema}
     * block on its own.
     */
    public SchemaNode parseSchema(String content, String source) throws CrdLoadException {
        return convertSchema(readTree(content, source), source);
    }

    SchemaNode convertSchema(JsonNode schema, String source) throws CrdLoadException {
        return new Conversion(schema, source).run();
    }

    private JsonNode readTree(String content, String source) throws CrdLoadException {
        try {
            return mapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new CrdLoadException(source + ": invalid YAML/JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static String requireText(JsonNode parent, String field, String source) throws CrdLoadException {
        JsonNode value = parent.get(field);
        if (value == null || !value.isTextual() || value.asText().isEmpty()) {
            throw new CrdLoadException(source + ": missing required field '" + field + "'");
        }
        return value.asText();
    }

    /**
     * One schema tree, together with the shared definitions its {@code $ref}s
     * point into.
     */
    private final class Conversion {
        private final JsonNode root;
        private final String source;
        private final Map<String, JsonNode> definitions = new LinkedHashMap<>();
        private final Map<String, List<ReferenceNode>> unbound = new LinkedHashMap<>();
        private final Map<String, SchemaNode> converted = new HashMap<>();

        Conversion(JsonNode root, String source) {
            this.root = root;
            this.source = source;
            collectDefinitions(root.path("definitions"));
            collectDefinitions(root.path("$defs"));
        }

        private void collectDefinitions(JsonNode block) {
            for (Iterator<Map.Entry<String, JsonNode>> it = block.fields(); it.hasNext();) {
                Map.Entry<String, JsonNode> entry = it.next();
                definitions.put(entry.getKey(), entry.getValue());
            }
        }

        SchemaNode run() throws CrdLoadException {
            SchemaNode result = convert(root, "");
            // binding a definition can reference further definitions
            while (!unbound.isEmpty()) {
                String name = unbound.keySet().iterator().next();
                List<ReferenceNode> references = unbound.remove(name);
                SchemaNode target = converted.get(name);
                if (target == null) {
                    JsonNode definition = definitions.get(name);
                    if (definition == null) {
                        throw new CrdLoadException(source + ": reference to undefined definition '" + name + "'");
                    }
                    target = convert(definition, "/definitions/" + name);
                    converted.put(name, target);
                }
                for (ReferenceNode reference : references) {
                    reference.bind(target);
                }
            }
            return result;
        }

        SchemaNode convert(JsonNode node, String location) throws CrdLoadException {
            if (node.isBoolean()) {
                return node.asBoolean() ? UnknownNode.of() : unsupported(SchemaFlags.NONE, location,
                        "schema 'false' cannot be represented");
            }
            if (!node.isObject()) {
                return unsupported(SchemaFlags.NONE, location, "expected a schema object");
            }
            SchemaFlags flags = flags(node, location);

            if (node.has("$ref")) {
                return reference(node.get("$ref").asText(), flags, location);
            }
            if (node.has("enum")) {
                return enumeration(node, flags, node.get("enum"), location);
            }
            if (node.has("const")) {
                return enumeration(node, flags, mapper.createArrayNode().add(node.get("const")), location);
            }
            if (node.has("allOf")) {
                return intersection(node, flags, location);
            }
            if (flags.isIntOrString()) {
                return new UnknownNode(flags);
            }

            JsonNode alternatives = node.has("oneOf") ? node.get("oneOf") : node.get("anyOf");
            UnionNode.Combinator combinator = node.has("oneOf") ? UnionNode.Combinator.ONE_OF : UnionNode.Combinator.ANY_OF;
            if (alternatives != null && !isValidationOnly(alternatives, node)) {
                if (node.has("properties")) {
                    return unsupported(flags, location, "oneOf/anyOf with shapes of their own beside properties");
                }
                List<SchemaNode> variants = new ArrayList<>();
                int i = 0;
                for (JsonNode alternative : alternatives) {
                    variants.add(convert(alternative, location + "/" + combinator.name().toLowerCase(Locale.ROOT) + "/" + i++));
                }
                return new UnionNode(flags, combinator, variants);
            }

            String type = node.path("type").asText(null);
            if (type == null) {
                return untyped(node, flags, location);
            }
            String format = node.path("format").asText(null);
            return switch (type) {
                case "object" -> object(node, flags, location);
                case "array" -> array(node, flags, location);
                case "date" -> date(flags, format, location);
                default -> ScalarKind.fromSchemaType(type)
                        .<SchemaNode>map(kind -> new ScalarNode(flags, kind, format))
                        .orElseGet(() -> unsupported(flags, location, "unsupported type '" + type + "'"));
            };
        }

        private SchemaNode untyped(JsonNode node, SchemaFlags flags, String location) throws CrdLoadException {
            if (flags.isPreserveUnknownFields() && !node.has("properties")) {
                return new UnknownNode(flags);
            }
            if (node.has("properties") || node.has("additionalProperties")) {
                return object(node, flags, location);
            }
            if (node.has("items")) {
                return array(node, flags, location);
            }
            return unsupported(flags, location, "schema without a type");
        }

        /**
         * The non-standard {@code type: date}, read as a string carrying the
         * date or date-time format.
         */
        private SchemaNode date(SchemaFlags flags, String format, String location) {
            if (format == null || "date".equals(format) || "date-time".equals(format)) {
                return new ScalarNode(flags, ScalarKind.STRING, format);
            }
            return unsupported(flags, location, "unknown date format '" + format + "'");
        }

        private SchemaNode object(JsonNode node, SchemaFlags flags, String location) throws CrdLoadException {
            JsonNode properties = node.path("properties");
            JsonNode additional = node.get("additionalProperties");
            if (properties.isEmpty() && additional != null) {
                if (additional.isObject()) {
                    return new MapNode(flags, convert(additional, location + "/additionalProperties"));
                }
                if (additional.asBoolean(false)) {
                    return new MapNode(flags, null);
                }
            }

            Map<String, SchemaNode> children = new LinkedHashMap<>();
            for (Iterator<Map.Entry<String, JsonNode>> it = properties.fields(); it.hasNext();) {
                Map.Entry<String, JsonNode> property = it.next();
                children.put(property.getKey(),
                        convert(property.getValue(), location + "/properties/" + property.getKey()));
            }
            Set<String> required = new LinkedHashSet<>();
            for (JsonNode name : node.path("required")) {
                if (children.containsKey(name.asText())) {
                    required.add(name.asText());
                } else {
                    log.warn("{}: required property '{}' is not declared at {}, ignoring it", source, name.asText(),
                            displayLocation(location));
                }
            }
            return new ObjectNode(flags, children, required);
        }

        private SchemaNode array(JsonNode node, SchemaFlags flags, String location) throws CrdLoadException {
            JsonNode items = node.get("items");
            if (items == null || items.isArray()) {
                return new ArrayNode(flags, null);
            }
            return new ArrayNode(flags, convert(items, location + "/items"));
        }

        private SchemaNode enumeration(JsonNode node, SchemaFlags flags, JsonNode values, String location)
                throws CrdLoadException {
            List<Object> literals = new ArrayList<>();
            for (JsonNode value : values) {
                literals.add(toValue(value, location));
            }
            ScalarKind baseKind = ScalarKind.fromSchemaType(node.path("type").asText(null))
                    .orElseGet(() -> inferKind(literals));
            return new EnumerationNode(flags, baseKind, literals);
        }

        private SchemaNode intersection(JsonNode node, SchemaFlags flags, String location) throws CrdLoadException {
            List<SchemaNode> branches = new ArrayList<>();
            int i = 0;
            for (JsonNode branch : node.get("allOf")) {
                branches.add(convert(branch, location + "/allOf/" + i++));
            }
            if (node.has("properties")) {
                branches.add(object(node, SchemaFlags.NONE, location));
            }
            return new IntersectionNode(flags, branches);
        }

        private SchemaNode reference(String ref, SchemaFlags flags, String location) throws CrdLoadException {
            String name;
            if (ref.startsWith(DEFINITIONS_PREFIX)) {
                name = ref.substring(DEFINITIONS_PREFIX.length());
            } else if (ref.startsWith(DEFS_PREFIX)) {
                name = ref.substring(DEFS_PREFIX.length());
            } else {
                return unsupported(flags, location,
                        "only local references into definitions are supported, found " + ref);
            }
            ReferenceNode reference = new ReferenceNode(flags, name);
            unbound.computeIfAbsent(name, k -> new ArrayList<>()).add(reference);
            return reference;
        }

        /**
         * Structural schemas may only use oneOf/anyOf to restrict which of the
         * declared properties are present.
         */
        private boolean isValidationOnly(JsonNode alternatives, JsonNode owner) {
            for (JsonNode alternative : alternatives) {
                if (!alternative.isObject()) {
                    return false;
                }
                for (Iterator<String> it = alternative.fieldNames(); it.hasNext();) {
                    if (SHAPE_KEYWORDS.contains(it.next())) {
                        return false;
                    }
                }
                for (Iterator<String> it = alternative.path("properties").fieldNames(); it.hasNext();) {
                    if (!owner.path("properties").has(it.next())) {
                        return false;
                    }
                }
            }
            return true;
        }

        private SchemaFlags flags(JsonNode node, String location) throws CrdLoadException {
            JsonNode defaultValue = node.get("default");
            return SchemaFlags.builder()
                    .description(node.hasNonNull("description") ? node.get("description").asText() : null)
                    .nullable(node.path("nullable").asBoolean(false))
                    .intOrString(node.path("x-kubernetes-int-or-string").asBoolean(false))
                    .preserveUnknownFields(node.path("x-kubernetes-preserve-unknown-fields").asBoolean(false))
                    .embeddedResource(node.path("x-kubernetes-embedded-resource").asBoolean(false))
                    .defaultValue(defaultValue == null || defaultValue.isNull() ? null : toValue(defaultValue, location))
                    .build();
        }

        private Object toValue(JsonNode value, String location) throws CrdLoadException {
            try {
                return mapper.treeToValue(value, Object.class);
            } catch (JsonProcessingException e) {
                throw new CrdLoadException(source + ": unreadable value at " + displayLocation(location), e);
            }
        }

        private SchemaNode unsupported(SchemaFlags flags, String location, String reason) {
            log.debug("{}: {} at {}", source, reason, displayLocation(location));
            return new UnsupportedNode(flags, reason);
        }
    }

    private static ScalarKind inferKind(List<Object> literals) {
        for (Object literal : literals) {
            if (literal instanceof String) {
                return ScalarKind.STRING;
            }
            if (literal instanceof Boolean) {
                return ScalarKind.BOOLEAN;
            }
            if (literal instanceof Integer || literal instanceof Long || literal instanceof BigInteger) {
                return ScalarKind.INTEGER;
            }
            if (literal instanceof Number) {
                return ScalarKind.NUMBER;
            }
        }
        return ScalarKind.STRING;
    }

    private static String displayLocation(String location) {
        return location.isEmpty() ? "/" : location;
    }
}
