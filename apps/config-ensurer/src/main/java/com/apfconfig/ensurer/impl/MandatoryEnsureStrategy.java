package com.apfconfig.ensurer.impl;

import com.apfconfig.access.AutoUpdateSpec;
import com.apfconfig.access.ConfigurationAccess;
import io.fabric8.kubernetes.api.model.HasMetadata;

public class MandatoryEnsureStrategy<T extends HasMetadata> extends AbstractEnsureStrategy<T> {

    public MandatoryEnsureStrategy(ConfigurationAccess<T> access) {
        super(access);
    }

    @Override
    public String name() {
        return "mandatory";
    }

    @Override
    protected boolean shouldUpdateSpec(AutoUpdateSpec autoUpdate) {
        return true;
    }

    @Override
    protected boolean shouldRewriteAnnotation(AutoUpdateSpec autoUpdate) {
        return autoUpdate == AutoUpdateSpec.DISABLED || autoUpdate == AutoUpdateSpec.INVALID;
    }
}
