package com.apfconfig.ensurer;

import com.apfconfig.access.ConfigurationAccess;
import com.apfconfig.ensurer.impl.ConfigurationEnsurer;
import com.apfconfig.ensurer.impl.ConfigurationRemover;
import com.apfconfig.ensurer.impl.MandatoryEnsureStrategy;
import com.apfconfig.ensurer.impl.SuggestedEnsureStrategy;
import io.fabric8.kubernetes.api.model.HasMetadata;

public final class Ensurers {

    private Ensurers() {
    }

    public static <T extends HasMetadata> Ensurer<T> suggested(ConfigurationAccess<T> access) {
        return new ConfigurationEnsurer<>(access, new SuggestedEnsureStrategy<>(access));
    }

    public static <T extends HasMetadata> Ensurer<T> mandatory(ConfigurationAccess<T> access) {
        return new ConfigurationEnsurer<>(access, new MandatoryEnsureStrategy<>(access));
    }

    public static <T extends HasMetadata> Remover remover(ConfigurationAccess<T> access) {
        return new ConfigurationRemover<>(access);
    }
}
