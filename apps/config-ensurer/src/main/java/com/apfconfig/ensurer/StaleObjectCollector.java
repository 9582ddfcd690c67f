package com.apfconfig.ensurer;

import com.apfconfig.access.AutoUpdateSpec;
import com.apfconfig.access.ConfigurationAccess;
import com.apfconfig.access.ConfigurationException;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ManagedFieldsEntry;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class StaleObjectCollector {

    private StaleObjectCollector() {
    }

    public static List<String> compute(Collection<? extends HasMetadata> liveObjects, Set<String> bootstrapNames) {
        return liveObjects.stream()
                .filter(StaleObjectCollector::isSystemOwned)
                .map(object -> object.getMetadata().getName())
                .filter(name -> !bootstrapNames.contains(name))
                .toList();
    }

    public static <T extends HasMetadata> List<String> removeCandidates(ConfigurationAccess<T> access,
            Collection<BootstrapObject<T>> bootstrapObjects) {
        List<T> live;
        try {
            live = access.list();
        } catch (RuntimeException ex) {
            throw new ConfigurationException("failed to list " + access.typeName(), ex);
        }
        Set<String> bootstrapNames = new LinkedHashSet<>();
        for (BootstrapObject<T> bootstrapObject : bootstrapObjects) {
            bootstrapNames.add(bootstrapObject.name());
        }
        return compute(live, bootstrapNames);
    }

    static boolean isSystemOwned(HasMetadata object) {
        ObjectMeta metadata = object.getMetadata();
        if (metadata == null || metadata.getName() == null) {
            return false;
        }
        if (AutoUpdateSpec.of(object).isPresent()) {
            return true;
        }
        List<ManagedFieldsEntry> managedFields = metadata.getManagedFields();
        return managedFields != null && managedFields.stream()
                .anyMatch(entry -> ConfigurationAccess.FIELD_MANAGER.equals(entry.getManager()));
    }
}
