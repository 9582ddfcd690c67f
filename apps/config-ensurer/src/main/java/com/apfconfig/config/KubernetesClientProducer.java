package com.apfconfig.config;

import com.apfconfig.access.ConfigurationAccess;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import java.time.Duration;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

@ApplicationScoped
public class KubernetesClientProducer {

    private static final Logger LOGGER = Logger.getLogger("BOOTSTRAP.Client");

    @ConfigProperty(name = "apf.kubernetes.request-timeout", defaultValue = "PT10S")
    Duration requestTimeout;

    private KubernetesClient client;

    @Produces
    @ApplicationScoped
    public KubernetesClient kubernetesClient() {
        Config config = new ConfigBuilder(Config.autoConfigure(null))
                .withUserAgent(ConfigurationAccess.FIELD_MANAGER)
                .withRequestTimeout((int) requestTimeout.toMillis())
                .build();
        client = new KubernetesClientBuilder().withConfig(config).build();
        LOGGER.infov("[INIT] Kubernetes client master={0} requestTimeout={1}", client.getMasterUrl(), requestTimeout);
        return client;
    }

    @PreDestroy
    void close() {
        if (client != null) {
            client.close();
        }
    }
}
