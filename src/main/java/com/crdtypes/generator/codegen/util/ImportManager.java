package com.crdtypes.generator.codegen.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Collects the imports of one generated source file.
 */
public class ImportManager {

    private final Set<String> imports = new TreeSet<>();
    private final String currentPackage;

    public ImportManager(String currentPackage) {
        this.currentPackage = currentPackage;
    }

    /**
     * Adds an import for a fully qualified class name and returns its simple
     * name. Classes from {@code java.lang} and the current package are not
     * imported.
     */
    public String use(String fullyQualifiedName) {
        int lastDot = fullyQualifiedName.lastIndexOf('.');
        if (lastDot < 0) {
            return fullyQualifiedName;
        }
        String packageName = fullyQualifiedName.substring(0, lastDot);
        if (!packageName.equals("java.lang") && !packageName.equals(currentPackage)) {
            imports.add(fullyQualifiedName);
        }
        return fullyQualifiedName.substring(lastDot + 1);
    }

    public List<String> getImports() {
        return new ArrayList<>(imports);
    }

    public boolean isEmpty() {
        return imports.isEmpty();
    }
}
