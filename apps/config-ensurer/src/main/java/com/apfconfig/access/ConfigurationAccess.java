package com.apfconfig.access;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Preconditions;
import java.util.List;

public interface ConfigurationAccess<T extends HasMetadata> {

    String FIELD_MANAGER = "api-priority-and-fairness-config-producer-v1";

    String typeName();

    T create(HasMetadata object);

    T update(HasMetadata object);

    T get(String name);

    List<T> list();

    void delete(String name, Preconditions preconditions);

    void copySpec(HasMetadata bootstrap, HasMetadata current);

    boolean hasSpecChanged(HasMetadata bootstrap, HasMetadata current);

    T copy(HasMetadata object);
}
