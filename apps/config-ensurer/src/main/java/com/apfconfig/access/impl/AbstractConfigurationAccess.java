package com.apfconfig.access.impl;

import com.apfconfig.access.AlreadyExistsException;
import com.apfconfig.access.ConfigurationAccess;
import com.apfconfig.access.ConfigurationLister;
import com.apfconfig.access.ConflictException;
import com.apfconfig.access.KindMismatchException;
import com.apfconfig.access.ObjectNotFoundException;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Preconditions;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.dsl.Resource;
import java.net.HttpURLConnection;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public abstract class AbstractConfigurationAccess<T extends HasMetadata>
        implements ConfigurationAccess<T>, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractConfigurationAccess.class);

    private final Class<T> type;
    private final KubernetesClient client;
    private final boolean ownsClient;
    private final ConfigurationLister<T> lister;

    protected AbstractConfigurationAccess(Class<T> type, KubernetesClient client, ConfigurationLister<T> lister) {
        this.type = Objects.requireNonNull(type, "type");
        this.ownsClient = client != null && !FIELD_MANAGER.equals(client.getConfiguration().getUserAgent());
        this.client = ownsClient ? writeClient(client) : client;
        this.lister = lister;
    }

    private static KubernetesClient writeClient(KubernetesClient client) {
        LOGGER.debug("Deriving a write client with user agent {} from {}", FIELD_MANAGER,
                client.getConfiguration().getUserAgent());
        Config config = new ConfigBuilder(client.getConfiguration())
                .withUserAgent(FIELD_MANAGER)
                .build();
        return new KubernetesClientBuilder().withConfig(config).build();
    }

    @Override
    public void close() {
        if (ownsClient) {
            client.close();
        }
    }

    @Override
    public String typeName() {
        return type.getSimpleName();
    }

    @Override
    public T create(HasMetadata object) {
        T typed = requireKind(object);
        try {
            return client.resource(typed).create();
        } catch (KubernetesClientException ex) {
            if (ex.getCode() == HttpURLConnection.HTTP_CONFLICT) {
                throw new AlreadyExistsException(typeName(), nameOf(typed), ex);
            }
            throw ex;
        }
    }

    @Override
    public T update(HasMetadata object) {
        T typed = requireKind(object);
        try {
            return client.resource(typed).update();
        } catch (KubernetesClientException ex) {
            throw translate(ex, nameOf(typed));
        }
    }

    @Override
    public T get(String name) {
        T object = lister.get(name);
        if (object == null) {
            throw new ObjectNotFoundException(typeName(), name);
        }
        return object;
    }

    @Override
    public List<T> list() {
        return lister.list();
    }

    @Override
    public void delete(String name, Preconditions preconditions) {
        Resource<T> resource = client.resources(type).withName(name);
        T fresh = resource.get();
        if (fresh == null) {
            throw new ObjectNotFoundException(typeName(), name);
        }
        String uid = preconditions == null ? null : preconditions.getUid();
        if (uid != null && !uid.equals(fresh.getMetadata().getUid())) {
            throw new ConflictException(String.format(
                    "precondition failed for %s %s: UID in precondition %s, UID in object %s",
                    typeName(), name, uid, fresh.getMetadata().getUid()));
        }
        String resourceVersion = preconditions == null || preconditions.getResourceVersion() == null
                ? fresh.getMetadata().getResourceVersion()
                : preconditions.getResourceVersion();
        try {
            resource.lockResourceVersion(resourceVersion).delete();
            LOGGER.debug("Deleted {} {} at resourceVersion {}", typeName(), name, resourceVersion);
        } catch (KubernetesClientException ex) {
            throw translate(ex, name);
        }
    }

    @Override
    public void copySpec(HasMetadata bootstrap, HasMetadata current) {
        T bootstrapObject = requireKind(bootstrap);
        T currentObject = requireKind(current);
        copySpecInto(bootstrapObject, currentObject);
    }

    @Override
    public boolean hasSpecChanged(HasMetadata bootstrap, HasMetadata current) {
        T expected = deepCopy(requireKind(bootstrap));
        T actual = requireKind(current);
        applyDefaults(expected);
        return !SpecEquality.semanticallyEqual(specOf(expected), specOf(actual));
    }

    @Override
    public T copy(HasMetadata object) {
        return deepCopy(requireKind(object));
    }

    protected abstract T deepCopy(T object);

    protected abstract Object specOf(T object);

    protected abstract void copySpecInto(T bootstrap, T current);

    protected abstract void applyDefaults(T object);

    protected T requireKind(Object object) {
        if (!type.isInstance(object)) {
            throw new KindMismatchException(typeName(), object);
        }
        return type.cast(object);
    }

    private RuntimeException translate(KubernetesClientException ex, String name) {
        if (ex.getCode() == HttpURLConnection.HTTP_CONFLICT) {
            return new ConflictException(typeName() + " " + name + " was modified concurrently", ex);
        }
        if (ex.getCode() == HttpURLConnection.HTTP_NOT_FOUND) {
            return new ObjectNotFoundException(typeName(), name, ex);
        }
        return ex;
    }

    private static String nameOf(HasMetadata object) {
        return object.getMetadata() == null ? null : object.getMetadata().getName();
    }
}
