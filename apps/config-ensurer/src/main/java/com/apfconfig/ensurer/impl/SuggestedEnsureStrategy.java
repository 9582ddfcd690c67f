package com.apfconfig.ensurer.impl;

import com.apfconfig.access.AutoUpdateSpec;
import com.apfconfig.access.ConfigurationAccess;
import io.fabric8.kubernetes.api.model.HasMetadata;

public class SuggestedEnsureStrategy<T extends HasMetadata> extends AbstractEnsureStrategy<T> {

    public SuggestedEnsureStrategy(ConfigurationAccess<T> access) {
        super(access);
    }

    @Override
    public String name() {
        return "suggested";
    }

    @Override
    protected boolean shouldUpdateSpec(AutoUpdateSpec autoUpdate) {
        return autoUpdate.allowsAutoUpdate();
    }

    @Override
    protected boolean shouldRewriteAnnotation(AutoUpdateSpec autoUpdate) {
        return false;
    }
}
