package com.apfconfig.ensurer.impl;

import com.apfconfig.access.AutoUpdateSpec;
import com.apfconfig.access.ConfigurationAccess;
import com.apfconfig.ensurer.EnsureStrategy;
import io.fabric8.kubernetes.api.model.HasMetadata;
import java.util.Optional;

public abstract class AbstractEnsureStrategy<T extends HasMetadata> implements EnsureStrategy<T> {

    protected final ConfigurationAccess<T> access;

    protected AbstractEnsureStrategy(ConfigurationAccess<T> access) {
        this.access = access;
    }

    @Override
    public T prepareForCreate(T bootstrap) {
        T object = access.copy(bootstrap);
        AutoUpdateSpec.stamp(object, true);
        return object;
    }

    @Override
    public Optional<T> reviseIfNeeded(T current, T bootstrap) {
        AutoUpdateSpec autoUpdate = AutoUpdateSpec.of(current);
        boolean specChanged = shouldUpdateSpec(autoUpdate) && access.hasSpecChanged(bootstrap, current);
        boolean annotationChanged = shouldRewriteAnnotation(autoUpdate);
        if (!specChanged && !annotationChanged) {
            return Optional.empty();
        }
        T revised = access.copy(current);
        if (specChanged) {
            access.copySpec(bootstrap, revised);
        }
        AutoUpdateSpec.stamp(revised, true);
        return Optional.of(revised);
    }

    protected abstract boolean shouldUpdateSpec(AutoUpdateSpec autoUpdate);

    protected abstract boolean shouldRewriteAnnotation(AutoUpdateSpec autoUpdate);
}
