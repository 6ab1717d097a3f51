package io.awsaccount.operator.store;

import io.kubernetes.client.common.KubernetesListObject;
import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.util.generic.GenericKubernetesApi;
import io.kubernetes.client.util.generic.KubernetesApiResponse;
import lombok.extern.slf4j.Slf4j;

import java.net.HttpURLConnection;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * {@link ResourceStore} backed by a {@link GenericKubernetesApi}.
 */
@Slf4j
public class KubernetesResourceStore<T extends KubernetesObject, L extends KubernetesListObject>
        implements ResourceStore<T> {

    private final GenericKubernetesApi<T, L> api;
    private final Function<T, Object> statusAccessor;

    public KubernetesResourceStore(GenericKubernetesApi<T, L> api, Function<T, Object> statusAccessor) {
        this.api = api;
        this.statusAccessor = statusAccessor;
    }

    public KubernetesResourceStore(GenericKubernetesApi<T, L> api) {
        this(api, null);
    }

    @Override
    public Optional<T> get(String namespace, String name) throws ApiException {
        KubernetesApiResponse<T> response = api.get(namespace, name);
        if (response.getHttpStatusCode() == HttpURLConnection.HTTP_NOT_FOUND) {
            return Optional.empty();
        }
        return Optional.of(response.throwsApiException().getObject());
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<T> list(String namespace) throws ApiException {
        KubernetesApiResponse<L> response = namespace == null ? api.list() : api.list(namespace);
        L list = response.throwsApiException().getObject();
        if (list == null || list.getItems() == null) {
            return new ArrayList<>();
        }
        return new ArrayList<>((List<T>) list.getItems());
    }

    @Override
    public T update(T resource) throws ApiException {
        T updated = api.update(resource).throwsApiException().getObject();
        copyResourceVersion(updated, resource);
        return updated;
    }

    @Override
    public T updateStatus(T resource) throws ApiException {
        if (statusAccessor == null) {
            throw new UnsupportedOperationException("Resource kind has no status subresource");
        }
        T updated = api.updateStatus(resource, statusAccessor).throwsApiException().getObject();
        copyResourceVersion(updated, resource);
        return updated;
    }

    @Override
    public void delete(String namespace, String name) throws ApiException {
        KubernetesApiResponse<T> response = api.delete(namespace, name);
        if (response.getHttpStatusCode() == HttpURLConnection.HTTP_NOT_FOUND) {
            log.debug("Resource {}/{} already deleted", namespace, name);
            return;
        }
        response.throwsApiException();
    }

    private void copyResourceVersion(T from, T to) {
        if (from != null && from.getMetadata() != null && to.getMetadata() != null) {
            to.getMetadata().setResourceVersion(from.getMetadata().getResourceVersion());
        }
    }
}
