package com.crdtypes.generator.codegen.util;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class NamingUtilTest {

    @Test
    void testToPascalCase() {
        assertThat(NamingUtil.toPascalCase("lastTransitionTime")).isEqualTo("LastTransitionTime");
        assertThat(NamingUtil.toPascalCase("tls_config")).isEqualTo("TlsConfig");
        assertThat(NamingUtil.toPascalCase("x-kubernetes-list")).isEqualTo("XKubernetesList");
        assertThat(NamingUtil.toPascalCase("$ref")).isEqualTo("Ref");
    }

    @Test
    void testToCamelCase() {
        assertThat(NamingUtil.toCamelCase("ServiceAccountName")).isEqualTo("serviceAccountName");
        assertThat(NamingUtil.toCamelCase("match-labels")).isEqualTo("matchLabels");
    }

    @Test
    void testToScreamingSnakeCase() {
        assertThat(NamingUtil.toScreamingSnakeCase("IfNotPresent")).isEqualTo("IF_NOT_PRESENT");
        assertThat(NamingUtil.toScreamingSnakeCase("read-write")).isEqualTo("READ_WRITE");
        assertThat(NamingUtil.toScreamingSnakeCase("*/5")).isEqualTo("5");
    }

    @Test
    void testToJavaIdentifier() {
        assertThat(NamingUtil.toJavaIdentifier("class", "field")).isEqualTo("class_");
        assertThat(NamingUtil.toJavaIdentifier("1x", "field")).isEqualTo("_1x");
        assertThat(NamingUtil.toJavaIdentifier("", "field")).isEqualTo("field");
        assertThat(NamingUtil.toJavaIdentifier("name", "field")).isEqualTo("name");
    }

    @Test
    void testDisambiguate() {
        assertThat(NamingUtil.disambiguate("name", Set.of())).isEqualTo("name");
        assertThat(NamingUtil.disambiguate("name", Set.of("name"))).isEqualTo("name2");
        assertThat(NamingUtil.disambiguate("name", Set.of("name", "name2"))).isEqualTo("name3");
    }
}
