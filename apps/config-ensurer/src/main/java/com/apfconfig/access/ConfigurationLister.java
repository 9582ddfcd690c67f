package com.apfconfig.access;

import io.fabric8.kubernetes.api.model.HasMetadata;
import java.util.List;

public interface ConfigurationLister<T extends HasMetadata> {

    T get(String name);

    List<T> list();
}
