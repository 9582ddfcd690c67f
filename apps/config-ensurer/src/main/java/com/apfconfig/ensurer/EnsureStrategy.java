package com.apfconfig.ensurer;

import io.fabric8.kubernetes.api.model.HasMetadata;
import java.util.Optional;

public interface EnsureStrategy<T extends HasMetadata> {

    String name();

    T prepareForCreate(T bootstrap);

    Optional<T> reviseIfNeeded(T current, T bootstrap);
}
