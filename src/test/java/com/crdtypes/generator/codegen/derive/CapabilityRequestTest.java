package com.crdtypes.generator.codegen.derive;

import com.crdtypes.generator.codegen.model.Capability;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CapabilityRequestTest {

    @Test
    void testBareCapabilityAppliesToAll() {
        CapabilityRequest request = CapabilityRequest.parse("PartialEq");

        assertThat(request.getTarget()).isEqualTo(CapabilityTarget.ALL);
        assertThat(request.getTypeName()).isNull();
        assertThat(request.getCapability()).isEqualTo(Capability.EQUALITY);
    }

    @Test
    void testTypeTarget() {
        CapabilityRequest request = CapabilityRequest.parse("CronTabSpec=Default");

        assertThat(request).isEqualTo(CapabilityRequest.forType("CronTabSpec", Capability.DEFAULT));
    }

    @Test
    void testGroupTargets() {
        assertThat(CapabilityRequest.parse("@struct=Builder").getTarget()).isEqualTo(CapabilityTarget.COMPOSITES);
        assertThat(CapabilityRequest.parse("@enum=ord").getTarget()).isEqualTo(CapabilityTarget.ENUMS);
        assertThat(CapabilityRequest.parse("@enum:simple=Default").getTarget())
                .isEqualTo(CapabilityTarget.UNIT_ENUMS);
    }

    @Test
    void testWhitespaceAroundParts() {
        CapabilityRequest request = CapabilityRequest.parse(" Foo = schema ");

        assertThat(request.getTypeName()).isEqualTo("Foo");
        assertThat(request.getCapability()).isEqualTo(Capability.SCHEMA);
    }

    @Test
    void testUnknownCapability() {
        assertThatThrownBy(() -> CapabilityRequest.parse("Hash"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Hash");
    }

    @Test
    void testUnknownGroup() {
        assertThatThrownBy(() -> CapabilityRequest.parse("@union=Default"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("@union");
    }

    @Test
    void testEmptyParts() {
        assertThatThrownBy(() -> CapabilityRequest.parse("=Default"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CapabilityRequest.parse("Foo="))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CapabilityRequest.parse(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
