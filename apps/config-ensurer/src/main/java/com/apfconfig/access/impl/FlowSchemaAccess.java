package com.apfconfig.access.impl;

import com.apfconfig.access.ConfigurationLister;
import com.apfconfig.defaults.FlowSchemaDefaults;
import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.FlowSchema;
import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.FlowSchemaBuilder;
import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.FlowSchemaSpecBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;

public class FlowSchemaAccess extends AbstractConfigurationAccess<FlowSchema> {

    public FlowSchemaAccess(KubernetesClient client, ConfigurationLister<FlowSchema> lister) {
        super(FlowSchema.class, client, lister);
    }

    public static FlowSchema deepCopyOf(FlowSchema flowSchema) {
        return new FlowSchemaBuilder(flowSchema).build();
    }

    @Override
    protected FlowSchema deepCopy(FlowSchema object) {
        return deepCopyOf(object);
    }

    @Override
    protected Object specOf(FlowSchema object) {
        return object.getSpec();
    }

    @Override
    protected void copySpecInto(FlowSchema bootstrap, FlowSchema current) {
        current.setSpec(bootstrap.getSpec() == null ? null : new FlowSchemaSpecBuilder(bootstrap.getSpec()).build());
    }

    @Override
    protected void applyDefaults(FlowSchema object) {
        FlowSchemaDefaults.apply(object);
    }
}
