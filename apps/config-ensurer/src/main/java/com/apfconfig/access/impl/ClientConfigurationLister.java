package com.apfconfig.access.impl;

import com.apfconfig.access.ConfigurationLister;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;
import java.util.List;
import java.util.Optional;

public class ClientConfigurationLister<T extends HasMetadata> implements ConfigurationLister<T> {

    private final KubernetesClient client;
    private final Class<T> type;

    public ClientConfigurationLister(KubernetesClient client, Class<T> type) {
        this.client = client;
        this.type = type;
    }

    @Override
    public T get(String name) {
        return client.resources(type).withName(name).get();
    }

    @Override
    public List<T> list() {
        return Optional.ofNullable(client.resources(type).list())
                .map(list -> list.getItems())
                .map(List::copyOf)
                .orElse(List.of());
    }
}
