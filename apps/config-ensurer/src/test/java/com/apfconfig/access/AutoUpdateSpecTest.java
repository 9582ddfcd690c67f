package com.apfconfig.access;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.FlowSchema;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class AutoUpdateSpecTest {

    @ParameterizedTest
    @ValueSource(strings = { "1", "t", "T", "TRUE", "true", "True" })
    void acceptsTrueSpellings(String value) {
        assertEquals(AutoUpdateSpec.ENABLED, AutoUpdateSpec.parse(value));
    }

    @ParameterizedTest
    @ValueSource(strings = { "0", "f", "F", "FALSE", "false", "False" })
    void acceptsFalseSpellings(String value) {
        assertEquals(AutoUpdateSpec.DISABLED, AutoUpdateSpec.parse(value));
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "yes", "tRuE", " true" })
    void rejectsAnythingElse(String value) {
        AutoUpdateSpec parsed = AutoUpdateSpec.parse(value);

        assertEquals(AutoUpdateSpec.INVALID, parsed);
        assertFalse(parsed.allowsAutoUpdate());
        assertTrue(parsed.isPresent());
    }

    @Test
    void missingAnnotationIsAbsentAndAllowsUpdates() {
        FlowSchema flowSchema = new FlowSchema();
        flowSchema.setMetadata(new ObjectMetaBuilder().withName("probes")
                .withAnnotations(Map.of("unrelated", "x")).build());

        AutoUpdateSpec state = AutoUpdateSpec.of(flowSchema);

        assertEquals(AutoUpdateSpec.ABSENT, state);
        assertTrue(state.allowsAutoUpdate());
        assertFalse(state.isPresent());
        assertEquals(AutoUpdateSpec.ABSENT, AutoUpdateSpec.of(new FlowSchema()));
    }

    @Test
    void stampWorksOnImmutableAnnotations() {
        FlowSchema flowSchema = new FlowSchema();
        flowSchema.setMetadata(new ObjectMetaBuilder().withName("probes")
                .withAnnotations(Map.of(AutoUpdateSpec.ANNOTATION, "false", "owner", "team-a")).build());

        AutoUpdateSpec.stamp(flowSchema, true);

        assertEquals(AutoUpdateSpec.ENABLED, AutoUpdateSpec.of(flowSchema));
        assertEquals("team-a", flowSchema.getMetadata().getAnnotations().get("owner"));
    }

    @Test
    void stampCreatesMetadataWhenMissing() {
        FlowSchema flowSchema = new FlowSchema();

        AutoUpdateSpec.stamp(flowSchema, false);

        assertEquals("false", flowSchema.getMetadata().getAnnotations().get(AutoUpdateSpec.ANNOTATION));
    }
}
