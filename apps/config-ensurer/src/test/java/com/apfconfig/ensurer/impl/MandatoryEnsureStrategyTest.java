package com.apfconfig.ensurer.impl;

import static com.apfconfig.ensurer.FlowSchemaFixtures.bootstrap;
import static com.apfconfig.ensurer.FlowSchemaFixtures.flowSchema;
import static com.apfconfig.ensurer.FlowSchemaFixtures.withAutoUpdate;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.apfconfig.access.AutoUpdateSpec;
import com.apfconfig.ensurer.Ensurers;
import com.apfconfig.ensurer.InMemoryFlowSchemaAccess;
import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.FlowSchema;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MandatoryEnsureStrategyTest {

    InMemoryFlowSchemaAccess access;

    @BeforeEach
    void setUp() {
        access = new InMemoryFlowSchemaAccess();
    }

    @Test
    void forcesSpecAndReEnablesAutoUpdateWhenUserDisabledIt() {
        access.seed(withAutoUpdate(flowSchema("catch-all", "custom", 5), "false"));

        Ensurers.mandatory(access).ensure(List.of(bootstrap("catch-all", "catch-all", 10000)));

        FlowSchema stored = access.stored("catch-all");
        assertEquals(1, access.updates);
        assertEquals(10000, stored.getSpec().getMatchingPrecedence());
        assertEquals("catch-all", stored.getSpec().getPriorityLevelConfiguration().getName());
        assertEquals("true", stored.getMetadata().getAnnotations().get(AutoUpdateSpec.ANNOTATION));
    }

    @Test
    void rewritesDisabledAnnotationEvenWhenSpecAlreadyMatches() {
        access.seed(withAutoUpdate(flowSchema("catch-all", "catch-all", 10000), "false"));

        Ensurers.mandatory(access).ensure(List.of(bootstrap("catch-all", "catch-all", 10000)));

        assertEquals(1, access.updates);
        assertEquals("true", access.stored("catch-all").getMetadata().getAnnotations().get(AutoUpdateSpec.ANNOTATION));
    }

    @Test
    void rewritesInvalidAnnotation() {
        access.seed(withAutoUpdate(flowSchema("exempt", "exempt", 1), "yes"));

        Ensurers.mandatory(access).ensure(List.of(bootstrap("exempt", "exempt", 1)));

        assertEquals("true", access.stored("exempt").getMetadata().getAnnotations().get(AutoUpdateSpec.ANNOTATION));
    }

    @Test
    void doesNotWriteWhenInSync() {
        access.seed(withAutoUpdate(flowSchema("exempt", "exempt", 1), "true"));
        access.seed(flowSchema("catch-all", "catch-all", 10000));

        Ensurers.mandatory(access).ensure(List.of(
                bootstrap("exempt", "exempt", 1),
                bootstrap("catch-all", "catch-all", 10000)));

        assertEquals(0, access.writes());
    }

    @Test
    void revisionLeavesBothInputsUntouched() {
        MandatoryEnsureStrategy<FlowSchema> strategy = new MandatoryEnsureStrategy<>(access);
        FlowSchema current = withAutoUpdate(flowSchema("catch-all", "custom", 5), "false");
        FlowSchema bootstrap = flowSchema("catch-all", "catch-all", null);

        Optional<FlowSchema> revised = strategy.reviseIfNeeded(current, bootstrap);

        assertTrue(revised.isPresent());
        assertNull(revised.get().getSpec().getMatchingPrecedence());
        assertEquals("catch-all", revised.get().getSpec().getPriorityLevelConfiguration().getName());
        assertEquals("false", current.getMetadata().getAnnotations().get(AutoUpdateSpec.ANNOTATION));
        assertEquals(5, current.getSpec().getMatchingPrecedence());
        assertNull(bootstrap.getSpec().getMatchingPrecedence());
        assertEquals(AutoUpdateSpec.ABSENT, AutoUpdateSpec.of(bootstrap));
    }

    @Test
    void prepareForCreateStampsAutoUpdateOnCopy() {
        MandatoryEnsureStrategy<FlowSchema> strategy = new MandatoryEnsureStrategy<>(access);
        FlowSchema bootstrap = flowSchema("exempt", "exempt", 1);

        FlowSchema prepared = strategy.prepareForCreate(bootstrap);

        assertEquals("true", prepared.getMetadata().getAnnotations().get(AutoUpdateSpec.ANNOTATION));
        assertEquals(AutoUpdateSpec.ABSENT, AutoUpdateSpec.of(bootstrap));
    }
}
