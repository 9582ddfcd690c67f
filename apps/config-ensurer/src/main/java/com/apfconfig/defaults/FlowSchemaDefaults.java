package com.apfconfig.defaults;

import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.FlowSchema;
import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.FlowSchemaSpec;

public final class FlowSchemaDefaults {

    public static final int DEFAULT_MATCHING_PRECEDENCE = 1000;

    private FlowSchemaDefaults() {
    }

    public static void apply(FlowSchema flowSchema) {
        FlowSchemaSpec spec = flowSchema.getSpec();
        if (spec == null) {
            return;
        }
        if (spec.getMatchingPrecedence() == null || spec.getMatchingPrecedence() == 0) {
            spec.setMatchingPrecedence(DEFAULT_MATCHING_PRECEDENCE);
        }
    }
}
