package com.apfconfig.ensurer;

import io.fabric8.kubernetes.api.model.HasMetadata;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Default object embedded in the process; {@link #get()} returns a fresh copy.
 */
public final class BootstrapObject<T extends HasMetadata> {

    private final String name;
    private final T template;
    private final UnaryOperator<T> copier;

    private BootstrapObject(T template, UnaryOperator<T> copier) {
        this.copier = Objects.requireNonNull(copier, "copier");
        this.template = copier.apply(Objects.requireNonNull(template, "template"));
        if (template.getMetadata() == null || template.getMetadata().getName() == null
                || template.getMetadata().getName().isBlank()) {
            throw new IllegalArgumentException("bootstrap object must have a name");
        }
        this.name = template.getMetadata().getName();
    }

    public static <T extends HasMetadata> BootstrapObject<T> of(T template, UnaryOperator<T> copier) {
        return new BootstrapObject<>(template, copier);
    }

    public String name() {
        return name;
    }

    public T get() {
        return copier.apply(template);
    }

    @Override
    public String toString() {
        return template.getKind() + "/" + name;
    }
}
