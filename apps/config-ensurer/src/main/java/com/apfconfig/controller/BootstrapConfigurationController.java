package com.apfconfig.controller;

import com.apfconfig.access.ConfigurationAccess;
import com.apfconfig.access.ConfigurationLister;
import com.apfconfig.access.impl.ClientConfigurationLister;
import com.apfconfig.access.impl.FlowSchemaAccess;
import com.apfconfig.access.impl.InformerConfigurationLister;
import com.apfconfig.access.impl.PriorityLevelConfigurationAccess;
import com.apfconfig.bootstrap.BootstrapConfiguration;
import com.apfconfig.ensurer.BootstrapObject;
import com.apfconfig.ensurer.Ensurers;
import com.apfconfig.ensurer.StaleObjectCollector;
import com.apfconfig.model.ReconciliationReport;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.FlowSchema;
import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.PriorityLevelConfiguration;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.quarkus.runtime.StartupEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

@ApplicationScoped
public class BootstrapConfigurationController {

    private static final Logger LOGGER = Logger.getLogger("BOOTSTRAP.Controller");

    @Inject
    KubernetesClient client;

    @Inject
    ReconciliationHistory history;

    @ConfigProperty(name = "apf.bootstrap.enabled", defaultValue = "true")
    boolean enabled;

    @ConfigProperty(name = "apf.bootstrap.remove-dangling", defaultValue = "true")
    boolean removeDangling;

    @ConfigProperty(name = "apf.bootstrap.use-informer-cache", defaultValue = "true")
    boolean useInformerCache;

    private final List<InformerConfigurationLister<?>> informers = new CopyOnWriteArrayList<>();
    private PriorityLevelConfigurationAccess priorityLevels;
    private FlowSchemaAccess flowSchemas;

    @PostConstruct
    void init() {
        LOGGER.infov("[INIT] BootstrapConfigurationController enabled={0} removeDangling={1} informerCache={2}",
                enabled, removeDangling, useInformerCache);
    }

    void onStart(@Observes StartupEvent event) {
        if (!enabled) {
            LOGGER.info("[INIT] startup reconciliation disabled");
            return;
        }
        reconcile();
    }

    @PreDestroy
    synchronized void close() {
        informers.forEach(InformerConfigurationLister::close);
        informers.clear();
        if (flowSchemas != null) {
            flowSchemas.close();
            priorityLevels.close();
            flowSchemas = null;
            priorityLevels = null;
        }
    }

    public ReconciliationReport reconcile() {
        String id = UUID.randomUUID().toString();
        Instant start = Instant.now();
        LOGGER.infov("[RECONCILE-START] id={0}", id);
        ReconciliationReport report;
        try {
            initAccess();
            Ensurers.mandatory(priorityLevels).ensure(BootstrapConfiguration.MANDATORY_PRIORITY_LEVELS);
            Ensurers.suggested(priorityLevels).ensure(BootstrapConfiguration.SUGGESTED_PRIORITY_LEVELS);
            Ensurers.mandatory(flowSchemas).ensure(BootstrapConfiguration.MANDATORY_FLOW_SCHEMAS);
            Ensurers.suggested(flowSchemas).ensure(BootstrapConfiguration.SUGGESTED_FLOW_SCHEMAS);

            Map<String, List<String>> removed = new LinkedHashMap<>();
            if (removeDangling) {
                removed.put(flowSchemas.typeName(),
                        removeDangling(flowSchemas, BootstrapConfiguration.allFlowSchemas()));
                removed.put(priorityLevels.typeName(),
                        removeDangling(priorityLevels, BootstrapConfiguration.allPriorityLevels()));
            }
            report = ReconciliationReport.success(id, start, Instant.now(), removed);
            LOGGER.infov("[RECONCILE-END] id={0} durationMs={1} removed={2}",
                    id, Duration.between(start, report.finishedAt()).toMillis(), removed);
        } catch (RuntimeException ex) {
            report = ReconciliationReport.failure(id, start, Instant.now(), describe(ex));
            LOGGER.errorv(ex, "[RECONCILE-FAILED] id={0} durationMs={1}",
                    id, Duration.between(start, report.finishedAt()).toMillis());
        }
        history.record(report);
        return report;
    }

    static String describe(RuntimeException ex) {
        return ex.getMessage() == null ? ex.getClass().getName() : ex.getMessage();
    }

    private <T extends HasMetadata> List<String> removeDangling(ConfigurationAccess<T> access,
            List<BootstrapObject<T>> bootstrapObjects) {
        List<String> candidates = StaleObjectCollector.removeCandidates(access, bootstrapObjects);
        if (!candidates.isEmpty()) {
            LOGGER.infov("[REMOVE-CANDIDATES] type={0} names={1}", access.typeName(), candidates);
            Ensurers.remover(access).removeAutoUpdateEnabledObjects(candidates);
        }
        return candidates;
    }

    private synchronized void initAccess() {
        if (flowSchemas != null) {
            return;
        }
        priorityLevels = new PriorityLevelConfigurationAccess(client, lister(PriorityLevelConfiguration.class));
        flowSchemas = new FlowSchemaAccess(client, lister(FlowSchema.class));
    }

    private <T extends HasMetadata> ConfigurationLister<T> lister(Class<T> type) {
        if (!useInformerCache) {
            return new ClientConfigurationLister<>(client, type);
        }
        InformerConfigurationLister<T> informer = InformerConfigurationLister.start(client, type);
        informers.add(informer);
        return informer;
    }
}
