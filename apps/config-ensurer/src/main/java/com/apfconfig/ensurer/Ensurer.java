package com.apfconfig.ensurer;

import io.fabric8.kubernetes.api.model.HasMetadata;
import java.util.List;

public interface Ensurer<T extends HasMetadata> {

    void ensure(List<BootstrapObject<T>> bootstrapObjects);
}
