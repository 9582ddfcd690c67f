package com.apfconfig.ensurer.impl;

import com.apfconfig.access.ConfigurationAccess;
import com.apfconfig.access.ConflictException;
import com.apfconfig.access.ObjectNotFoundException;
import com.apfconfig.ensurer.BootstrapObject;
import com.apfconfig.ensurer.EnsureStrategy;
import com.apfconfig.ensurer.Ensurer;
import io.fabric8.kubernetes.api.model.HasMetadata;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.jboss.logging.Logger;

public class ConfigurationEnsurer<T extends HasMetadata> implements Ensurer<T> {

    private static final Logger LOGGER = Logger.getLogger("BOOTSTRAP.Ensurer");

    // one re-read and write after a lost update or create race
    static final int MAX_CONFLICT_RETRIES = 1;

    private final ConfigurationAccess<T> access;
    private final EnsureStrategy<T> strategy;

    public ConfigurationEnsurer(ConfigurationAccess<T> access, EnsureStrategy<T> strategy) {
        this.access = access;
        this.strategy = strategy;
    }

    @Override
    public void ensure(List<BootstrapObject<T>> bootstrapObjects) {
        requireUniqueNames(bootstrapObjects);
        for (BootstrapObject<T> bootstrapObject : bootstrapObjects) {
            ensureOne(bootstrapObject.get());
        }
    }

    private void ensureOne(T bootstrap) {
        String name = bootstrap.getMetadata().getName();
        for (int attempt = 0; ; attempt++) {
            try {
                writeIfNeeded(name, bootstrap);
                return;
            } catch (ConflictException ex) {
                if (attempt >= MAX_CONFLICT_RETRIES) {
                    LOGGER.warnv("[ENSURE-CONFLICT] type={0} name={1} giving up after {2} retry",
                            access.typeName(), name, MAX_CONFLICT_RETRIES);
                    throw ex;
                }
                LOGGER.infov("[ENSURE-CONFLICT] type={0} name={1} re-reading and retrying: {2}",
                        access.typeName(), name, ex.getMessage());
            }
        }
    }

    // a lost create race surfaces as AlreadyExistsException, a ConflictException
    private void writeIfNeeded(String name, T bootstrap) {
        T current;
        try {
            current = access.get(name);
        } catch (ObjectNotFoundException ex) {
            access.create(strategy.prepareForCreate(bootstrap));
            LOGGER.infov("[ENSURE-CREATE] type={0} name={1} strategy={2}", access.typeName(), name, strategy.name());
            return;
        }
        Optional<T> revised = strategy.reviseIfNeeded(current, bootstrap);
        if (revised.isEmpty()) {
            LOGGER.debugv("[ENSURE-NOOP] type={0} name={1} strategy={2}", access.typeName(), name, strategy.name());
            return;
        }
        T updated = access.update(revised.get());
        LOGGER.infov("[ENSURE-UPDATE] type={0} name={1} strategy={2} resourceVersion={3}",
                access.typeName(), name, strategy.name(), updated.getMetadata().getResourceVersion());
    }

    private void requireUniqueNames(List<BootstrapObject<T>> bootstrapObjects) {
        Set<String> seen = new HashSet<>();
        for (BootstrapObject<T> bootstrapObject : bootstrapObjects) {
            if (!seen.add(bootstrapObject.name())) {
                throw new IllegalArgumentException(
                        "duplicate " + access.typeName() + " name in bootstrap batch: " + bootstrapObject.name());
            }
        }
    }
}
