package com.apfconfig.access.impl;

import com.apfconfig.access.ConfigurationLister;
import com.apfconfig.defaults.PriorityLevelConfigurationDefaults;
import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.PriorityLevelConfiguration;
import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.PriorityLevelConfigurationBuilder;
import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.PriorityLevelConfigurationSpecBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;

public class PriorityLevelConfigurationAccess extends AbstractConfigurationAccess<PriorityLevelConfiguration> {

    public PriorityLevelConfigurationAccess(KubernetesClient client,
            ConfigurationLister<PriorityLevelConfiguration> lister) {
        super(PriorityLevelConfiguration.class, client, lister);
    }

    public static PriorityLevelConfiguration deepCopyOf(PriorityLevelConfiguration priorityLevel) {
        return new PriorityLevelConfigurationBuilder(priorityLevel).build();
    }

    @Override
    protected PriorityLevelConfiguration deepCopy(PriorityLevelConfiguration object) {
        return deepCopyOf(object);
    }

    @Override
    protected Object specOf(PriorityLevelConfiguration object) {
        return object.getSpec();
    }

    @Override
    protected void copySpecInto(PriorityLevelConfiguration bootstrap, PriorityLevelConfiguration current) {
        current.setSpec(bootstrap.getSpec() == null
                ? null
                : new PriorityLevelConfigurationSpecBuilder(bootstrap.getSpec()).build());
    }

    @Override
    protected void applyDefaults(PriorityLevelConfiguration object) {
        PriorityLevelConfigurationDefaults.apply(object);
    }
}
