package com.crdtypes.generator.codegen.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ImportManagerTest {

    @Test
    void testImportsAreSortedAndDeduplicated() {
        ImportManager imports = new ImportManager("com.example.crd");

        assertThat(imports.use("java.util.List")).isEqualTo("List");
        assertThat(imports.use("com.fasterxml.jackson.annotation.JsonProperty")).isEqualTo("JsonProperty");
        imports.use("java.util.List");

        assertThat(imports.getImports())
                .containsExactly("com.fasterxml.jackson.annotation.JsonProperty", "java.util.List");
    }

    @Test
    void testLangAndSamePackageAreNotImported() {
        ImportManager imports = new ImportManager("com.example.crd");

        assertThat(imports.use("java.lang.String")).isEqualTo("String");
        assertThat(imports.use("com.example.crd.CronTabSpec")).isEqualTo("CronTabSpec");
        assertThat(imports.isEmpty()).isTrue();
    }
}
