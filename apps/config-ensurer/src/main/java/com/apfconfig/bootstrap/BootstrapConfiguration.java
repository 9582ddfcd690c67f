package com.apfconfig.bootstrap;

import com.apfconfig.access.AutoUpdateSpec;
import com.apfconfig.access.impl.FlowSchemaAccess;
import com.apfconfig.access.impl.PriorityLevelConfigurationAccess;
import com.apfconfig.ensurer.BootstrapObject;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.FlowDistinguisherMethod;
import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.FlowSchema;
import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.FlowSchemaSpec;
import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.GroupSubject;
import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.LimitResponse;
import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.LimitedPriorityLevelConfiguration;
import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.NonResourcePolicyRule;
import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.PolicyRulesWithSubjects;
import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.PriorityLevelConfiguration;
import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.PriorityLevelConfigurationReference;
import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.PriorityLevelConfigurationSpec;
import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.QueuingConfiguration;
import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.ResourcePolicyRule;
import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.ServiceAccountSubject;
import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.Subject;
import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.UserSubject;
import java.util.ArrayList;
import java.util.List;

public final class BootstrapConfiguration {

    public static final String PRIORITY_LEVEL_EXEMPT = "exempt";
    public static final String PRIORITY_LEVEL_CATCH_ALL = "catch-all";
    public static final String PRIORITY_LEVEL_NODE_HIGH = "node-high";
    public static final String PRIORITY_LEVEL_SYSTEM = "system";
    public static final String PRIORITY_LEVEL_LEADER_ELECTION = "leader-election";
    public static final String PRIORITY_LEVEL_WORKLOAD_HIGH = "workload-high";
    public static final String PRIORITY_LEVEL_WORKLOAD_LOW = "workload-low";
    public static final String PRIORITY_LEVEL_GLOBAL_DEFAULT = "global-default";

    private static final String GROUP_MASTERS = "system:masters";
    private static final String GROUP_NODES = "system:nodes";
    private static final String GROUP_AUTHENTICATED = "system:authenticated";
    private static final String GROUP_UNAUTHENTICATED = "system:unauthenticated";
    private static final String GROUP_SERVICE_ACCOUNTS = "system:serviceaccounts";
    private static final String BY_USER = "ByUser";
    private static final String BY_NAMESPACE = "ByNamespace";

    public static final List<BootstrapObject<PriorityLevelConfiguration>> MANDATORY_PRIORITY_LEVELS = List.of(
            exemptPriorityLevel(PRIORITY_LEVEL_EXEMPT),
            rejectingPriorityLevel(PRIORITY_LEVEL_CATCH_ALL, 5));

    public static final List<BootstrapObject<PriorityLevelConfiguration>> SUGGESTED_PRIORITY_LEVELS = List.of(
            queuingPriorityLevel(PRIORITY_LEVEL_NODE_HIGH, 40, 25, 64, 6, 50),
            queuingPriorityLevel(PRIORITY_LEVEL_SYSTEM, 30, 33, 64, 6, 50),
            queuingPriorityLevel(PRIORITY_LEVEL_LEADER_ELECTION, 10, 0, 16, 4, 50),
            queuingPriorityLevel(PRIORITY_LEVEL_WORKLOAD_HIGH, 40, 50, 128, 6, 50),
            queuingPriorityLevel(PRIORITY_LEVEL_WORKLOAD_LOW, 100, 90, 128, 6, 50),
            queuingPriorityLevel(PRIORITY_LEVEL_GLOBAL_DEFAULT, 20, 50, 128, 6, 50));

    public static final List<BootstrapObject<FlowSchema>> MANDATORY_FLOW_SCHEMAS = List.of(
            flowSchema("exempt", PRIORITY_LEVEL_EXEMPT, 1, null,
                    rules(List.of(group(GROUP_MASTERS)), allResources(), allNonResources())),
            flowSchema("catch-all", PRIORITY_LEVEL_CATCH_ALL, 10000, BY_USER,
                    rules(List.of(group(GROUP_UNAUTHENTICATED), group(GROUP_AUTHENTICATED)),
                            allResources(), allNonResources())));

    public static final List<BootstrapObject<FlowSchema>> SUGGESTED_FLOW_SCHEMAS = List.of(
            flowSchema("probes", PRIORITY_LEVEL_EXEMPT, 2, null,
                    rules(List.of(group(GROUP_UNAUTHENTICATED), group(GROUP_AUTHENTICATED)),
                            List.of(),
                            List.of(nonResourceRule(List.of("get"), List.of("/healthz", "/readyz", "/livez"))))),
            flowSchema("system-leader-election", PRIORITY_LEVEL_LEADER_ELECTION, 100, BY_USER,
                    rules(List.of(user("system:kube-controller-manager"), user("system:kube-scheduler")),
                            List.of(resourceRule(List.of("get", "create", "update"), List.of("coordination.k8s.io"),
                                    List.of("leases"), false, List.of("kube-system"))),
                            List.of())),
            flowSchema("system-nodes", PRIORITY_LEVEL_SYSTEM, 500, BY_USER,
                    rules(List.of(group(GROUP_NODES)), allResources(), allNonResources())),
            flowSchema("kube-controller-manager", PRIORITY_LEVEL_WORKLOAD_HIGH, 800, BY_NAMESPACE,
                    rules(List.of(user("system:kube-controller-manager")), allResources(), allNonResources())),
            flowSchema("kube-scheduler", PRIORITY_LEVEL_WORKLOAD_HIGH, 800, BY_NAMESPACE,
                    rules(List.of(user("system:kube-scheduler")), allResources(), allNonResources())),
            flowSchema("kube-system-service-accounts", PRIORITY_LEVEL_WORKLOAD_HIGH, 900, BY_NAMESPACE,
                    rules(List.of(serviceAccount("kube-system", "*")), allResources(), allNonResources())),
            flowSchema("service-accounts", PRIORITY_LEVEL_WORKLOAD_LOW, 9000, BY_USER,
                    rules(List.of(group(GROUP_SERVICE_ACCOUNTS)), allResources(), allNonResources())),
            flowSchema("global-default", PRIORITY_LEVEL_GLOBAL_DEFAULT, 9900, BY_USER,
                    rules(List.of(group(GROUP_UNAUTHENTICATED), group(GROUP_AUTHENTICATED)),
                            allResources(), allNonResources())));

    private BootstrapConfiguration() {
    }

    public static List<BootstrapObject<PriorityLevelConfiguration>> allPriorityLevels() {
        List<BootstrapObject<PriorityLevelConfiguration>> all = new ArrayList<>(MANDATORY_PRIORITY_LEVELS);
        all.addAll(SUGGESTED_PRIORITY_LEVELS);
        return List.copyOf(all);
    }

    public static List<BootstrapObject<FlowSchema>> allFlowSchemas() {
        List<BootstrapObject<FlowSchema>> all = new ArrayList<>(MANDATORY_FLOW_SCHEMAS);
        all.addAll(SUGGESTED_FLOW_SCHEMAS);
        return List.copyOf(all);
    }

    private static ObjectMeta metadata(String name) {
        return new ObjectMetaBuilder()
                .withName(name)
                .addToAnnotations(AutoUpdateSpec.ANNOTATION, "true")
                .build();
    }

    private static BootstrapObject<PriorityLevelConfiguration> exemptPriorityLevel(String name) {
        PriorityLevelConfigurationSpec spec = new PriorityLevelConfigurationSpec();
        spec.setType("Exempt");
        return priorityLevel(name, spec);
    }

    private static BootstrapObject<PriorityLevelConfiguration> rejectingPriorityLevel(String name, int shares) {
        LimitResponse limitResponse = new LimitResponse();
        limitResponse.setType("Reject");
        LimitedPriorityLevelConfiguration limited = new LimitedPriorityLevelConfiguration();
        limited.setNominalConcurrencyShares(shares);
        limited.setLendablePercent(0);
        limited.setLimitResponse(limitResponse);
        return limitedPriorityLevel(name, limited);
    }

    private static BootstrapObject<PriorityLevelConfiguration> queuingPriorityLevel(String name, int shares,
            int lendablePercent, int queues, int handSize, int queueLengthLimit) {
        QueuingConfiguration queuing = new QueuingConfiguration();
        queuing.setQueues(queues);
        queuing.setHandSize(handSize);
        queuing.setQueueLengthLimit(queueLengthLimit);
        LimitResponse limitResponse = new LimitResponse();
        limitResponse.setType("Queue");
        limitResponse.setQueuing(queuing);
        LimitedPriorityLevelConfiguration limited = new LimitedPriorityLevelConfiguration();
        limited.setNominalConcurrencyShares(shares);
        limited.setLendablePercent(lendablePercent);
        limited.setLimitResponse(limitResponse);
        return limitedPriorityLevel(name, limited);
    }

    private static BootstrapObject<PriorityLevelConfiguration> limitedPriorityLevel(String name,
            LimitedPriorityLevelConfiguration limited) {
        PriorityLevelConfigurationSpec spec = new PriorityLevelConfigurationSpec();
        spec.setType("Limited");
        spec.setLimited(limited);
        return priorityLevel(name, spec);
    }

    private static BootstrapObject<PriorityLevelConfiguration> priorityLevel(String name,
            PriorityLevelConfigurationSpec spec) {
        PriorityLevelConfiguration priorityLevel = new PriorityLevelConfiguration();
        priorityLevel.setMetadata(metadata(name));
        priorityLevel.setSpec(spec);
        return BootstrapObject.of(priorityLevel, PriorityLevelConfigurationAccess::deepCopyOf);
    }

    private static BootstrapObject<FlowSchema> flowSchema(String name, String priorityLevel, int matchingPrecedence,
            String distinguisher, PolicyRulesWithSubjects rules) {
        PriorityLevelConfigurationReference reference = new PriorityLevelConfigurationReference();
        reference.setName(priorityLevel);
        FlowSchemaSpec spec = new FlowSchemaSpec();
        spec.setPriorityLevelConfiguration(reference);
        spec.setMatchingPrecedence(matchingPrecedence);
        if (distinguisher != null) {
            FlowDistinguisherMethod method = new FlowDistinguisherMethod();
            method.setType(distinguisher);
            spec.setDistinguisherMethod(method);
        }
        spec.setRules(List.of(rules));
        FlowSchema flowSchema = new FlowSchema();
        flowSchema.setMetadata(metadata(name));
        flowSchema.setSpec(spec);
        return BootstrapObject.of(flowSchema, FlowSchemaAccess::deepCopyOf);
    }

    private static PolicyRulesWithSubjects rules(List<Subject> subjects, List<ResourcePolicyRule> resourceRules,
            List<NonResourcePolicyRule> nonResourceRules) {
        PolicyRulesWithSubjects rules = new PolicyRulesWithSubjects();
        rules.setSubjects(subjects);
        rules.setResourceRules(resourceRules);
        rules.setNonResourceRules(nonResourceRules);
        return rules;
    }

    private static List<ResourcePolicyRule> allResources() {
        return List.of(resourceRule(List.of("*"), List.of("*"), List.of("*"), true, List.of("*")));
    }

    private static List<NonResourcePolicyRule> allNonResources() {
        return List.of(nonResourceRule(List.of("*"), List.of("*")));
    }

    private static ResourcePolicyRule resourceRule(List<String> verbs, List<String> apiGroups, List<String> resources,
            boolean clusterScope, List<String> namespaces) {
        ResourcePolicyRule rule = new ResourcePolicyRule();
        rule.setVerbs(verbs);
        rule.setApiGroups(apiGroups);
        rule.setResources(resources);
        rule.setClusterScope(clusterScope);
        rule.setNamespaces(namespaces);
        return rule;
    }

    private static NonResourcePolicyRule nonResourceRule(List<String> verbs, List<String> urls) {
        NonResourcePolicyRule rule = new NonResourcePolicyRule();
        rule.setVerbs(verbs);
        rule.setNonResourceURLs(urls);
        return rule;
    }

    private static Subject group(String name) {
        GroupSubject group = new GroupSubject();
        group.setName(name);
        Subject subject = new Subject();
        subject.setKind("Group");
        subject.setGroup(group);
        return subject;
    }

    private static Subject user(String name) {
        UserSubject user = new UserSubject();
        user.setName(name);
        Subject subject = new Subject();
        subject.setKind("User");
        subject.setUser(user);
        return subject;
    }

    private static Subject serviceAccount(String namespace, String name) {
        ServiceAccountSubject serviceAccount = new ServiceAccountSubject();
        serviceAccount.setNamespace(namespace);
        serviceAccount.setName(name);
        Subject subject = new Subject();
        subject.setKind("ServiceAccount");
        subject.setServiceAccount(serviceAccount);
        return subject;
    }
}
