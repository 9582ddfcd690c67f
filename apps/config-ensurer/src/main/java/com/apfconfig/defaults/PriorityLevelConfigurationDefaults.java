package com.apfconfig.defaults;

import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.LimitResponse;
import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.LimitedPriorityLevelConfiguration;
import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.PriorityLevelConfiguration;
import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.QueuingConfiguration;

// exempt defaults are all zero, so only limited levels need defaulting
public final class PriorityLevelConfigurationDefaults {

    public static final int DEFAULT_NOMINAL_CONCURRENCY_SHARES = 30;
    public static final int DEFAULT_LENDABLE_PERCENT = 0;
    public static final int DEFAULT_QUEUES = 64;
    public static final int DEFAULT_HAND_SIZE = 8;
    public static final int DEFAULT_QUEUE_LENGTH_LIMIT = 50;

    private PriorityLevelConfigurationDefaults() {
    }

    public static void apply(PriorityLevelConfiguration priorityLevel) {
        if (priorityLevel.getSpec() == null || priorityLevel.getSpec().getLimited() == null) {
            return;
        }
        LimitedPriorityLevelConfiguration limited = priorityLevel.getSpec().getLimited();
        if (limited.getNominalConcurrencyShares() == null) {
            limited.setNominalConcurrencyShares(DEFAULT_NOMINAL_CONCURRENCY_SHARES);
        }
        if (limited.getLendablePercent() == null) {
            limited.setLendablePercent(DEFAULT_LENDABLE_PERCENT);
        }
        LimitResponse limitResponse = limited.getLimitResponse();
        if (limitResponse == null || limitResponse.getQueuing() == null) {
            return;
        }
        QueuingConfiguration queuing = limitResponse.getQueuing();
        if (isUnset(queuing.getQueues())) {
            queuing.setQueues(DEFAULT_QUEUES);
        }
        if (isUnset(queuing.getHandSize())) {
            queuing.setHandSize(DEFAULT_HAND_SIZE);
        }
        if (isUnset(queuing.getQueueLengthLimit())) {
            queuing.setQueueLengthLimit(DEFAULT_QUEUE_LENGTH_LIMIT);
        }
    }

    private static boolean isUnset(Integer value) {
        return value == null || value == 0;
    }
}
