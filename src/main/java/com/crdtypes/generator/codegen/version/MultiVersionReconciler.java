package com.crdtypes.generator.codegen.version;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.crdtypes.generator.codegen.exception.AnalysisException;
import com.crdtypes.generator.codegen.exception.ErrorKind;
import com.crdtypes.generator.codegen.model.SchemaPath;
import com.crdtypes.generator.codegen.model.core.context.GeneratorConfig;
import com.crdtypes.generator.schema.SchemaNode;
import com.crdtypes.generator.schema.SchemaVersion;

/**
 * Chooses the schema version a run operates on.
 *
 * <ul>
 * <li>A pinned label must exist.</li>
 * <li>Otherwise, among served versions (every version when none is served),
 * the storage version wins, then the highest {@link ApiVersion}.</li>
 * <li>In combine mode the candidates are merged, highest priority first.</li>
 * </ul>
 */
public class MultiVersionReconciler {

    private static final Logger log = LoggerFactory.getLogger(MultiVersionReconciler.class);

    private final GeneratorConfig config;
    private final SchemaMerger merger = new SchemaMerger();

    public MultiVersionReconciler(GeneratorConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public SchemaVersion select(List<SchemaVersion> versions) {
        if (versions == null || versions.isEmpty()) {
            throw new AnalysisException(ErrorKind.RECONCILE_ERROR, "resource declares no versions");
        }

        if (config.getVersionPin() != null) {
            return versions.stream()
                    .filter(v -> v.getLabel().equals(config.getVersionPin()))
                    .findFirst()
                    .orElseThrow(() -> new AnalysisException(ErrorKind.RECONCILE_ERROR,
                            "version '" + config.getVersionPin() + "' not found, available versions are "
                                    + availableLabels(versions)));
        }

        List<SchemaVersion> candidates = versions.stream().filter(SchemaVersion::isServed).toList();
        if (candidates.isEmpty()) {
            log.debug("No version is served, considering all {}", versions.size());
            candidates = versions;
        }
        candidates = candidates.stream()
                .sorted(Comparator.comparing((SchemaVersion v) -> ApiVersion.parse(v.getLabel())).reversed())
                .toList();

        if (config.isCombineVersions() && candidates.size() > 1) {
            return combine(candidates);
        }

        List<SchemaVersion> storage = candidates.stream().filter(SchemaVersion::isStorage).toList();
        if (storage.size() > 1) {
            throw new AnalysisException(ErrorKind.RECONCILE_ERROR, "more than one storage version: "
                    + storage.stream().map(SchemaVersion::getLabel).collect(Collectors.joining(", ")));
        }
        SchemaVersion selected = storage.isEmpty() ? candidates.get(0) : storage.get(0);
        log.debug("Selected version {} of {}", selected.getLabel(), availableLabels(versions));
        return selected;
    }

    /**
     * Merges the candidates into one version. The result keeps the label of the
     * version that would have been selected without combining.
     */
    private SchemaVersion combine(List<SchemaVersion> candidates) {
        String combinedLabels = candidates.stream().map(SchemaVersion::getLabel).collect(Collectors.joining("+"));
        log.info("Combining versions {}", combinedLabels);

        List<SchemaNode> roots = candidates.stream().map(SchemaVersion::getRoot).toList();
        SchemaNode merged = merger.mergeAll(roots, SchemaPath.root(combinedLabels));

        SchemaVersion primary = candidates.stream()
                .filter(SchemaVersion::isStorage)
                .findFirst()
                .orElse(candidates.get(0));
        return primary.toBuilder()
                .statusSubresource(candidates.stream().anyMatch(SchemaVersion::isStatusSubresource))
                .root(merged)
                .build();
    }

    /**
     * Version labels, highest priority first.
     */
    static String availableLabels(List<SchemaVersion> versions) {
        return versions.stream()
                .map(SchemaVersion::getLabel)
                .sorted(ApiVersion.priorityOrder())
                .collect(Collectors.joining(", "));
    }
}
