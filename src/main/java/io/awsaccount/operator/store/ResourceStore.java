package io.awsaccount.operator.store;

import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.ApiException;

import java.util.List;
import java.util.Optional;

/**
 * Read and write access to one kind of resource held by the API server.
 * {@link #update} and {@link #updateStatus} copy the new resource version onto the argument.
 */
public interface ResourceStore<T extends KubernetesObject> {

    Optional<T> get(String namespace, String name) throws ApiException;

    /**
     * Lists resources in {@code namespace}, or in all namespaces when it is null.
     */
    List<T> list(String namespace) throws ApiException;

    T update(T resource) throws ApiException;

    T updateStatus(T resource) throws ApiException;

    void delete(String namespace, String name) throws ApiException;
}
