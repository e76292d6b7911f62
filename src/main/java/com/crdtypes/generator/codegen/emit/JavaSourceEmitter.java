package com.crdtypes.generator.codegen.emit;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.crdtypes.generator.codegen.emit.view.CompositeView;
import com.crdtypes.generator.codegen.emit.view.ConstantView;
import com.crdtypes.generator.codegen.emit.view.FieldView;
import com.crdtypes.generator.codegen.emit.view.TaggedEnumView;
import com.crdtypes.generator.codegen.emit.view.UnitEnumView;
import com.crdtypes.generator.codegen.emit.view.VariantView;
import com.crdtypes.generator.codegen.model.AbsentPolicy;
import com.crdtypes.generator.codegen.model.Capability;
import com.crdtypes.generator.codegen.model.CompositeField;
import com.crdtypes.generator.codegen.model.CompositeType;
import com.crdtypes.generator.codegen.model.EnumVariant;
import com.crdtypes.generator.codegen.model.EnumeratedType;
import com.crdtypes.generator.codegen.model.GeneratedType;
import com.crdtypes.generator.codegen.model.PrimitiveType;
import com.crdtypes.generator.codegen.model.ResourceInfo;
import com.crdtypes.generator.codegen.model.TypeGraph;
import com.crdtypes.generator.codegen.model.TypeKind;
import com.crdtypes.generator.codegen.model.TypeRef;
import com.crdtypes.generator.codegen.model.core.context.GeneratorConfig;
import com.crdtypes.generator.codegen.util.FileWriteUtil;
import com.crdtypes.generator.codegen.util.ImportManager;
import com.crdtypes.generator.codegen.util.NamingUtil;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Writes one Java source file per non-elided type of a frozen graph.
 *
 * Composites become Lombok/Jackson classes, unit enums become Java enums and
 * tagged enums become wrapper classes holding exactly one variant. The root
 * composite extends the fabric8 {@code CustomResource} unless resource
 * annotations are hidden.
 */
public class JavaSourceEmitter {
    private static final Logger log = LoggerFactory.getLogger(JavaSourceEmitter.class);

    public static final String GENERATOR_NAME = "crd-type-generator";

    private static final String LOMBOK = "lombok.";
    private static final String JACKSON_ANNOTATION = "com.fasterxml.jackson.annotation.";
    private static final String FABRIC8_ANNOTATION = "io.fabric8.kubernetes.model.annotation.";

    private final GeneratorConfig config;
    private final Configuration freemarkerConfig;

    public JavaSourceEmitter(GeneratorConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    public List<Path> emit(TypeGraph graph) throws IOException {
        if (config.getOutputDir() == null) {
            throw new IllegalStateException("No output directory configured");
        }
        Path packageDir = FileWriteUtil.packageDirectory(config.getOutputDir(), config.getBasePackage());
        List<Path> written = new ArrayList<>();
        for (GeneratedType type : graph.getTypes()) {
            if (type.isElided()) {
                log.debug("Skipping elided type {}", type.getName());
                continue;
            }
            Path file = packageDir.resolve(type.getName() + ".java");
            FileWriteUtil.safeWriteString(file, render(type, graph));
            written.add(file);
        }
        log.info("Wrote {} source files to {}", written.size(), packageDir);
        return written;
    }

    /**
     * Renders the source of a single type.
     */
    public String render(GeneratedType type, TypeGraph graph) {
        JavaTypeMapper mapper = new JavaTypeMapper(graph.getMapRepresentation());
        if (type instanceof CompositeType composite) {
            return process("composite.ftl", compositeView(composite, graph, mapper));
        }
        EnumeratedType enumerated = (EnumeratedType) type;
        if (enumerated.isUnitEnum()) {
            return process("enum.ftl", unitEnumView(enumerated));
        }
        return process("tagged-enum.ftl", taggedEnumView(enumerated, mapper));
    }

    private String process(String templateName, Object view) {
        try {
            Template template = freemarkerConfig.getTemplate(templateName);
            StringWriter out = new StringWriter();
            template.process(Map.of("type", view), out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new IllegalStateException("Failed to render " + templateName, e);
        }
    }

    private CompositeView compositeView(CompositeType type, TypeGraph graph, JavaTypeMapper mapper) {
        ImportManager imports = new ImportManager(config.getBasePackage());
        CompositeView.CompositeViewBuilder view = CompositeView.builder()
                .header(header())
                .packageName(config.getBasePackage())
                .className(type.getName())
                .javadoc(javadoc(type.getDocumentation()));

        boolean resource = isCustomResource(type, graph);
        view.annotation("@" + imports.use(LOMBOK + "Getter"));
        view.annotation("@" + imports.use(LOMBOK + "Setter"));
        if (type.has(Capability.EQUALITY)) {
            String callSuper = resource ? "(callSuper = true)" : "";
            view.annotation("@" + imports.use(LOMBOK + "EqualsAndHashCode") + callSuper);
            view.annotation("@" + imports.use(LOMBOK + "ToString") + callSuper);
        }
        if (type.has(Capability.BUILDER)) {
            view.annotation("@" + imports.use(LOMBOK + "Builder") + "(toBuilder = true)");
            view.annotation("@" + imports.use(LOMBOK + "AllArgsConstructor"));
        }
        view.annotation("@" + imports.use(LOMBOK + "NoArgsConstructor"));
        view.annotation("@" + imports.use(JACKSON_ANNOTATION + "JsonInclude") + "(JsonInclude.Include.NON_NULL)");
        if (type.has(Capability.SCHEMA) && type.getDocumentation() != null) {
            view.annotation("@" + imports.use(JACKSON_ANNOTATION + "JsonClassDescription") + "("
                    + javaString(type.getDocumentation()) + ")");
        }

        Set<String> skipped = new HashSet<>();
        if (resource) {
            ResourceInfo info = graph.getResourceInfo();
            view.annotation("@" + imports.use(FABRIC8_ANNOTATION + "Group") + "(" + javaString(info.getGroup()) + ")");
            view.annotation("@" + imports.use(FABRIC8_ANNOTATION + "Version") + "(" + javaString(info.getVersion()) + ")");
            view.annotation("@" + imports.use(FABRIC8_ANNOTATION + "Kind") + "(" + javaString(info.getKind()) + ")");
            view.annotation("@" + imports.use(FABRIC8_ANNOTATION + "Plural") + "(" + javaString(info.getPlural()) + ")");
            String spec = envelopeParameter(type, "spec", mapper, imports);
            String status = envelopeParameter(type, "status", mapper, imports);
            view.superclass(imports.use("io.fabric8.kubernetes.client.CustomResource") + "<" + spec + ", " + status + ">");
            if (info.isNamespaced()) {
                view.implemented(imports.use("io.fabric8.kubernetes.api.model.Namespaced"));
            }
            skipped.add("spec");
            skipped.add("status");
        }

        Set<String> usedNames = new HashSet<>();
        for (CompositeField field : type.getFields()) {
            if (skipped.contains(field.getName())) {
                continue;
            }
            view.field(fieldView(type, field, graph, mapper, imports, usedNames));
        }
        return view.imports(imports.getImports()).build();
    }

    private boolean isCustomResource(CompositeType type, TypeGraph graph) {
        return !config.isHideResourceAnnotations()
                && graph.getResourceInfo() != null
                && graph.getRootRef() instanceof TypeRef.NamedRef root
                && root.getTypeName().equals(type.getName());
    }

    private String envelopeParameter(CompositeType root, String fieldName, JavaTypeMapper mapper,
                                     ImportManager imports) {
        return root.field(fieldName)
                .map(f -> mapper.javaType(f.getType(), imports))
                .orElse("Void");
    }

    private FieldView fieldView(CompositeType owner, CompositeField field, TypeGraph graph, JavaTypeMapper mapper,
                                ImportManager imports, Set<String> usedNames) {
        String javaName = NamingUtil.disambiguate(
                NamingUtil.toJavaIdentifier(NamingUtil.toCamelCase(field.getName()), "field"), usedNames);
        usedNames.add(javaName);
        TypeRef ref = field.getType().unwrapOptional();

        FieldView.FieldViewBuilder view = FieldView.builder()
                .javaName(javaName)
                .javaType(mapper.javaType(ref, imports))
                .javadoc(javadoc(field.getDocumentation()));

        String property = imports.use(JACKSON_ANNOTATION + "JsonProperty");
        view.annotation(field.isOptional()
                ? "@" + property + "(" + javaString(field.getName()) + ")"
                : "@" + property + "(value = " + javaString(field.getName()) + ", required = true)");
        if (owner.has(Capability.SCHEMA) && field.getDocumentation() != null) {
            view.annotation("@" + imports.use(JACKSON_ANNOTATION + "JsonPropertyDescription") + "("
                    + javaString(field.getDocumentation()) + ")");
        }
        if (field.getAbsentPolicy() == AbsentPolicy.TREAT_ABSENT_AS_EMPTY) {
            view.annotation("@" + imports.use(JACKSON_ANNOTATION + "JsonSetter") + "(nulls = "
                    + imports.use(JACKSON_ANNOTATION + "Nulls") + ".AS_EMPTY)");
        }
        if (ref instanceof TypeRef.MapRef) {
            view.annotation("@" + imports.use("com.fasterxml.jackson.databind.annotation.JsonDeserialize")
                    + "(as = " + imports.use(mapper.mapImplementation()) + ".class)");
        }

        String initializer = initializer(owner, field, ref, graph, mapper, imports);
        if (initializer != null && owner.has(Capability.BUILDER)) {
            view.annotation("@Builder.Default");
        }
        return view.initializer(initializer).build();
    }

    private String initializer(CompositeType owner, CompositeField field, TypeRef ref, TypeGraph graph,
                               JavaTypeMapper mapper, ImportManager imports) {
        if (field.getAbsentPolicy() == AbsentPolicy.TREAT_ABSENT_AS_EMPTY) {
            return emptyContainer(ref, mapper, imports);
        }
        if (field.hasDefaultValue()) {
            String literal = defaultLiteral(field.getDefaultValue(), ref, graph, imports);
            if (literal == null) {
                log.debug("{}.{}: default value {} has no Java literal", owner.getName(), field.getName(),
                        field.getDefaultValue());
            }
            return literal;
        }
        if (owner.has(Capability.DEFAULT) && !field.isOptional()) {
            return zeroValue(ref, graph, mapper, imports);
        }
        return null;
    }

    private static String emptyContainer(TypeRef ref, JavaTypeMapper mapper, ImportManager imports) {
        if (ref instanceof TypeRef.SequenceRef) {
            return "new " + imports.use("java.util.ArrayList") + "<>()";
        }
        if (ref instanceof TypeRef.MapRef) {
            return "new " + imports.use(mapper.mapImplementation()) + "<>()";
        }
        return null;
    }

    private String zeroValue(TypeRef ref, TypeGraph graph, JavaTypeMapper mapper, ImportManager imports) {
        if (ref instanceof TypeRef.SequenceRef || ref instanceof TypeRef.MapRef) {
            return emptyContainer(ref, mapper, imports);
        }
        if (ref instanceof TypeRef.PrimitiveRef primitive) {
            return switch (primitive.getType()) {
                case STRING -> "\"\"";
                case BOOLEAN -> "false";
                case INT8, INT16, INT32, UINT8, UINT16 -> "0";
                case INT64, UINT32 -> "0L";
                case UINT64 -> imports.use("java.math.BigInteger") + ".ZERO";
                case FLOAT32 -> "0.0f";
                case FLOAT64 -> "0.0d";
                case DATE, DATE_TIME, BYTES -> null;
            };
        }
        if (ref instanceof TypeRef.ExternalRef external && external.getShape().hasDefault()) {
            return "new " + imports.use(JavaTypeMapper.externalClass(external.getShape())) + "()";
        }
        if (ref instanceof TypeRef.NamedRef named) {
            GeneratedType target = graph.require(named.getTypeName());
            if (target.getKind() == TypeKind.COMPOSITE) {
                return "new " + target.getName() + "()";
            }
            if (target.getKind() == TypeKind.UNIT_ENUM && target.has(Capability.DEFAULT)) {
                return target.getName() + ".defaultValue()";
            }
        }
        return null;
    }

    private String defaultLiteral(Object value, TypeRef ref, TypeGraph graph, ImportManager imports) {
        if (ref instanceof TypeRef.PrimitiveRef primitive) {
            return primitiveLiteral(value, primitive.getType(), imports);
        }
        if (ref instanceof TypeRef.NamedRef named
                && graph.require(named.getTypeName()) instanceof EnumeratedType enumerated
                && enumerated.isUnitEnum()) {
            List<String> constants = constantNames(enumerated);
            for (int i = 0; i < enumerated.getVariants().size(); i++) {
                if (sameLiteral(enumerated.getVariants().get(i).getLiteral(), value)) {
                    return enumerated.getName() + "." + constants.get(i);
                }
            }
        }
        return null;
    }

    private static String primitiveLiteral(Object value, PrimitiveType type, ImportManager imports) {
        if (type == PrimitiveType.STRING && value instanceof String s) {
            return javaString(s);
        }
        if (type == PrimitiveType.BOOLEAN && value instanceof Boolean b) {
            return b.toString();
        }
        if (!(value instanceof Number number)) {
            return null;
        }
        return switch (type) {
            case INT8, INT16, INT32, UINT8, UINT16 -> Integer.toString(number.intValue());
            case INT64, UINT32 -> number.longValue() + "L";
            case UINT64 -> "new " + imports.use("java.math.BigInteger") + "(\"" + number + "\")";
            case FLOAT32 -> number.floatValue() + "f";
            case FLOAT64 -> number.doubleValue() + "d";
            default -> null;
        };
    }

    private UnitEnumView unitEnumView(EnumeratedType type) {
        ImportManager imports = new ImportManager(config.getBasePackage());
        imports.use(JACKSON_ANNOTATION + "JsonCreator");
        imports.use(JACKSON_ANNOTATION + "JsonValue");

        boolean textual = type.getVariants().stream().anyMatch(v -> v.getLiteral() instanceof String);
        List<String> constants = constantNames(type);
        UnitEnumView.UnitEnumViewBuilder view = UnitEnumView.builder()
                .header(header())
                .packageName(config.getBasePackage())
                .className(type.getName())
                .valueType(textual ? "String" : "Long")
                .javadoc(javadoc(type.getDocumentation()));
        if (type.has(Capability.SCHEMA) && type.getDocumentation() != null) {
            view.annotation("@" + imports.use(JACKSON_ANNOTATION + "JsonClassDescription") + "("
                    + javaString(type.getDocumentation()) + ")");
        }
        for (int i = 0; i < type.getVariants().size(); i++) {
            Object literal = type.getVariants().get(i).getLiteral();
            String code = textual ? javaString(String.valueOf(literal)) : literal + "L";
            view.constant(new ConstantView(constants.get(i), code));
            if (type.has(Capability.DEFAULT) && sameLiteral(literal, type.getDefaultLiteral().orElse(null))) {
                view.defaultConstant(constants.get(i));
            }
        }
        return view.imports(imports.getImports()).build();
    }

    private TaggedEnumView taggedEnumView(EnumeratedType type, JavaTypeMapper mapper) {
        ImportManager imports = new ImportManager(config.getBasePackage());
        imports.use(JACKSON_ANNOTATION + "JsonCreator");
        imports.use(JACKSON_ANNOTATION + "JsonValue");
        imports.use("com.fasterxml.jackson.core.type.TypeReference");
        imports.use("com.fasterxml.jackson.databind.ObjectMapper");
        imports.use(JavaTypeMapper.JSON_NODE);

        TaggedEnumView.TaggedEnumViewBuilder view = TaggedEnumView.builder()
                .header(header())
                .packageName(config.getBasePackage())
                .className(type.getName())
                .javadoc(javadoc(type.getDocumentation()));
        if (type.has(Capability.EQUALITY)) {
            view.annotation("@" + imports.use(LOMBOK + "EqualsAndHashCode"));
            view.annotation("@" + imports.use(LOMBOK + "ToString"));
        }

        Set<String> usedNames = new HashSet<>();
        for (EnumVariant variant : type.getVariants()) {
            String fieldName = NamingUtil.disambiguate(
                    NamingUtil.toJavaIdentifier(NamingUtil.toCamelCase(variant.getName()), "variant"), usedNames);
            usedNames.add(fieldName);
            view.variant(new VariantView(fieldName, NamingUtil.toPascalCase(fieldName),
                    mapper.javaType(variant.getPayload(), imports)));
        }
        return view.imports(imports.getImports()).build();
    }

    private List<String> header() {
        List<String> lines = new ArrayList<>();
        lines.add("Generated by " + GENERATOR_NAME + ". Manual changes to this file will be overwritten.");
        if (config.getInvocation() != null && !config.getInvocation().isBlank()) {
            lines.add("Invocation: " + config.getInvocation().replaceAll("\\R", " "));
        }
        return lines;
    }

    /**
     * Java constant names for the variants of a unit enum, in variant order.
     */
    static List<String> constantNames(EnumeratedType type) {
        List<String> names = new ArrayList<>();
        Set<String> used = new HashSet<>();
        for (EnumVariant variant : type.getVariants()) {
            String name = NamingUtil.disambiguate(
                    NamingUtil.toJavaIdentifier(NamingUtil.toScreamingSnakeCase(variant.getName()), "VALUE"), used);
            used.add(name);
            names.add(name);
        }
        return names;
    }

    private static boolean sameLiteral(Object a, Object b) {
        if (a == null || b == null) {
            return false;
        }
        if (a instanceof Number && b instanceof Number) {
            return a.toString().equals(b.toString());
        }
        return a.equals(b);
    }

    static List<String> javadoc(String documentation) {
        if (documentation == null || documentation.isBlank()) {
            return List.of();
        }
        List<String> lines = new ArrayList<>();
        for (String line : documentation.strip().split("\\R")) {
            lines.add(line.stripTrailing().replace("*/", "*&#47;"));
        }
        return lines;
    }

    static String javaString(String value) {
        StringBuilder sb = new StringBuilder("\"");
        for (char c : value.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }
}
