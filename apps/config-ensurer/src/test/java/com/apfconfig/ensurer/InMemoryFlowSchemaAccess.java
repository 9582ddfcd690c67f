package com.apfconfig.ensurer;

import com.apfconfig.access.AlreadyExistsException;
import com.apfconfig.access.ConfigurationAccess;
import com.apfconfig.access.ConflictException;
import com.apfconfig.access.ObjectNotFoundException;
import com.apfconfig.access.impl.FlowSchemaAccess;
import com.apfconfig.defaults.FlowSchemaDefaults;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Preconditions;
import io.fabric8.kubernetes.api.model.flowcontrol.v1beta3.FlowSchema;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * FlowSchema store that behaves like the API server for the parts the ensurer
 * relies on: defaulting on write, resourceVersion checks and UID preconditions.
 * Counts every write.
 */
public class InMemoryFlowSchemaAccess implements ConfigurationAccess<FlowSchema> {

    private final FlowSchemaAccess schema = new FlowSchemaAccess(null, null);
    private final Map<String, FlowSchema> store = new LinkedHashMap<>();
    private final Deque<RuntimeException> updateFailures = new ArrayDeque<>();
    private Runnable beforeNextUpdate;
    private long resourceVersion;
    private long uid;

    public int creates;
    public int updates;
    public int deletes;
    public int gets;

    public FlowSchema seed(FlowSchema flowSchema) {
        FlowSchema stored = schema.copy(flowSchema);
        stored.getMetadata().setUid("uid-" + (++uid));
        stored.getMetadata().setResourceVersion(Long.toString(++resourceVersion));
        store.put(stored.getMetadata().getName(), stored);
        return schema.copy(stored);
    }

    /**
     * Applies {@code change} as if another client had updated the object.
     */
    public void modify(String name, Consumer<FlowSchema> change) {
        FlowSchema stored = store.get(name);
        change.accept(stored);
        stored.getMetadata().setResourceVersion(Long.toString(++resourceVersion));
    }

    public FlowSchema stored(String name) {
        FlowSchema stored = store.get(name);
        return stored == null ? null : schema.copy(stored);
    }

    public void failNextUpdate(RuntimeException failure) {
        updateFailures.addLast(failure);
    }

    public void beforeNextUpdate(Runnable action) {
        this.beforeNextUpdate = action;
    }

    public int writes() {
        return creates + updates + deletes;
    }

    @Override
    public String typeName() {
        return schema.typeName();
    }

    @Override
    public FlowSchema create(HasMetadata object) {
        FlowSchema flowSchema = schema.copy(object);
        String name = flowSchema.getMetadata().getName();
        if (store.containsKey(name)) {
            throw new AlreadyExistsException(typeName(), name, null);
        }
        FlowSchemaDefaults.apply(flowSchema);
        creates++;
        return seed(flowSchema);
    }

    @Override
    public FlowSchema update(HasMetadata object) {
        FlowSchema flowSchema = schema.copy(object);
        if (beforeNextUpdate != null) {
            Runnable action = beforeNextUpdate;
            beforeNextUpdate = null;
            action.run();
        }
        if (!updateFailures.isEmpty()) {
            throw updateFailures.removeFirst();
        }
        String name = flowSchema.getMetadata().getName();
        FlowSchema stored = store.get(name);
        if (stored == null) {
            throw new ObjectNotFoundException(typeName(), name);
        }
        if (!stored.getMetadata().getResourceVersion().equals(flowSchema.getMetadata().getResourceVersion())) {
            throw new ConflictException("the object has been modified; please apply your changes to the latest version");
        }
        FlowSchemaDefaults.apply(flowSchema);
        flowSchema.getMetadata().setResourceVersion(Long.toString(++resourceVersion));
        store.put(name, flowSchema);
        updates++;
        return schema.copy(flowSchema);
    }

    @Override
    public FlowSchema get(String name) {
        gets++;
        FlowSchema stored = store.get(name);
        if (stored == null) {
            throw new ObjectNotFoundException(typeName(), name);
        }
        return schema.copy(stored);
    }

    @Override
    public List<FlowSchema> list() {
        List<FlowSchema> all = new ArrayList<>();
        store.values().forEach(flowSchema -> all.add(schema.copy(flowSchema)));
        return all;
    }

    @Override
    public void delete(String name, Preconditions preconditions) {
        FlowSchema stored = store.get(name);
        if (stored == null) {
            throw new ObjectNotFoundException(typeName(), name);
        }
        if (preconditions != null && preconditions.getUid() != null
                && !preconditions.getUid().equals(stored.getMetadata().getUid())) {
            throw new ConflictException("UID precondition failed for " + name);
        }
        if (preconditions != null && preconditions.getResourceVersion() != null
                && !preconditions.getResourceVersion().equals(stored.getMetadata().getResourceVersion())) {
            throw new ConflictException("resourceVersion precondition failed for " + name);
        }
        store.remove(name);
        deletes++;
    }

    @Override
    public void copySpec(HasMetadata bootstrap, HasMetadata current) {
        schema.copySpec(bootstrap, current);
    }

    @Override
    public boolean hasSpecChanged(HasMetadata bootstrap, HasMetadata current) {
        return schema.hasSpecChanged(bootstrap, current);
    }

    @Override
    public FlowSchema copy(HasMetadata object) {
        return schema.copy(object);
    }
}
