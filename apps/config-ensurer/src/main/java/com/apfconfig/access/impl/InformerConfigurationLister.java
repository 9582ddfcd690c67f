package com.apfconfig.access.impl;

import com.apfconfig.access.ConfigurationLister;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import io.fabric8.kubernetes.client.informers.cache.Lister;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class InformerConfigurationLister<T extends HasMetadata> implements ConfigurationLister<T>, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(InformerConfigurationLister.class);

    private final SharedIndexInformer<T> informer;
    private final Lister<T> lister;

    public InformerConfigurationLister(SharedIndexInformer<T> informer) {
        this.informer = informer;
        this.lister = new Lister<>(informer.getIndexer());
    }

    public static <T extends HasMetadata> InformerConfigurationLister<T> start(KubernetesClient client, Class<T> type) {
        SharedIndexInformer<T> informer = client.resources(type).inform();
        LOGGER.info("Informer for {} synced", type.getSimpleName());
        return new InformerConfigurationLister<>(informer);
    }

    @Override
    public T get(String name) {
        return lister.get(name);
    }

    @Override
    public List<T> list() {
        return List.copyOf(lister.list());
    }

    @Override
    public void close() {
        informer.stop();
    }
}
