package com.apfconfig.ensurer.impl;

import com.apfconfig.access.AutoUpdateSpec;
import com.apfconfig.access.ConfigurationAccess;
import com.apfconfig.access.ObjectNotFoundException;
import com.apfconfig.ensurer.Remover;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Preconditions;
import io.fabric8.kubernetes.api.model.PreconditionsBuilder;
import java.util.List;
import org.jboss.logging.Logger;

// deletes are never retried: after a precondition failure the name may be another object
public class ConfigurationRemover<T extends HasMetadata> implements Remover {

    private static final Logger LOGGER = Logger.getLogger("BOOTSTRAP.Remover");

    private final ConfigurationAccess<T> access;

    public ConfigurationRemover(ConfigurationAccess<T> access) {
        this.access = access;
    }

    @Override
    public void removeAutoUpdateEnabledObjects(List<String> names) {
        for (String name : names) {
            removeOne(name);
        }
    }

    private void removeOne(String name) {
        T current;
        try {
            current = access.get(name);
        } catch (ObjectNotFoundException ex) {
            LOGGER.debugv("[REMOVE-SKIP] type={0} name={1} already absent", access.typeName(), name);
            return;
        }

        AutoUpdateSpec autoUpdate = AutoUpdateSpec.of(current);
        if (!autoUpdate.allowsAutoUpdate()) {
            LOGGER.infov("[REMOVE-SKIP] type={0} name={1} autoUpdate={2}", access.typeName(), name, autoUpdate);
            return;
        }

        Preconditions preconditions = new PreconditionsBuilder()
                .withUid(current.getMetadata().getUid())
                .withResourceVersion(current.getMetadata().getResourceVersion())
                .build();
        try {
            access.delete(name, preconditions);
            LOGGER.infov("[REMOVE] type={0} name={1}", access.typeName(), name);
        } catch (ObjectNotFoundException ex) {
            LOGGER.debugv("[REMOVE-SKIP] type={0} name={1} deleted concurrently", access.typeName(), name);
        }
    }
}
