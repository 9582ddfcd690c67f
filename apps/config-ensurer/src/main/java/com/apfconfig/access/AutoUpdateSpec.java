package com.apfconfig.access;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public enum AutoUpdateSpec {
    ENABLED,
    DISABLED,
    ABSENT,
    INVALID;

    public static final String ANNOTATION = "apf.kubernetes.io/autoupdate-spec";

    private static final Set<String> TRUE_VALUES = Set.of("1", "t", "T", "TRUE", "true", "True");
    private static final Set<String> FALSE_VALUES = Set.of("0", "f", "F", "FALSE", "false", "False");

    public static AutoUpdateSpec of(HasMetadata object) {
        ObjectMeta metadata = object.getMetadata();
        if (metadata == null || metadata.getAnnotations() == null
                || !metadata.getAnnotations().containsKey(ANNOTATION)) {
            return ABSENT;
        }
        return parse(metadata.getAnnotations().get(ANNOTATION));
    }

    static AutoUpdateSpec parse(String value) {
        if (value == null) {
            return INVALID;
        }
        if (TRUE_VALUES.contains(value)) {
            return ENABLED;
        }
        if (FALSE_VALUES.contains(value)) {
            return DISABLED;
        }
        return INVALID;
    }

    // absent counts as enabled
    public boolean allowsAutoUpdate() {
        return this == ENABLED || this == ABSENT;
    }

    public boolean isPresent() {
        return this != ABSENT;
    }

    public static void stamp(HasMetadata object, boolean enabled) {
        if (object.getMetadata() == null) {
            object.setMetadata(new ObjectMeta());
        }
        ObjectMeta metadata = object.getMetadata();
        Map<String, String> annotations = metadata.getAnnotations() == null
                ? new LinkedHashMap<>()
                : new LinkedHashMap<>(metadata.getAnnotations());
        annotations.put(ANNOTATION, Boolean.toString(enabled));
        metadata.setAnnotations(annotations);
    }
}
