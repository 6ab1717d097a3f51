package io.awsaccount.operator.service;

import io.awsaccount.operator.store.ResourceStore;
import io.kubernetes.client.common.KubernetesObject;
import io.kubernetes.client.openapi.ApiException;
import io.kubernetes.client.openapi.models.V1ObjectMeta;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Adds and removes the operator finalizer, running teardown before release.
 */
@Slf4j
@Component
public class FinalizerManager {
    public static final String FINALIZER = "finalizer.aws.managed.openshift.io";

    /**
     * Cleanup that must succeed before the finalizer is removed.
     */
    @FunctionalInterface
    public interface Teardown {
        void run() throws ApiException;
    }

    public boolean hasFinalizer(KubernetesObject resource) {
        List<String> finalizers = resource.getMetadata().getFinalizers();
        return finalizers != null && finalizers.contains(FINALIZER);
    }

    public boolean isDeleting(KubernetesObject resource) {
        return resource.getMetadata().getDeletionTimestamp() != null;
    }

    /**
     * Adds the finalizer to a live resource that lacks it.
     *
     * @return true when the resource was updated; the caller should end the pass
     */
    public <T extends KubernetesObject> boolean addIfMissing(T resource, ResourceStore<T> store) throws ApiException {
        if (isDeleting(resource) || hasFinalizer(resource)) {
            return false;
        }
        V1ObjectMeta metadata = resource.getMetadata();
        log.info("Adding finalizer {} to {}/{}", FINALIZER, metadata.getNamespace(), metadata.getName());

        List<String> finalizers = metadata.getFinalizers() == null
                ? new ArrayList<>() : new ArrayList<>(metadata.getFinalizers());
        finalizers.add(FINALIZER);
        metadata.setFinalizers(finalizers);
        store.update(resource);
        return true;
    }

    public <T extends KubernetesObject> void removeFinalizer(T resource, ResourceStore<T> store) throws ApiException {
        V1ObjectMeta metadata = resource.getMetadata();
        if (!hasFinalizer(resource)) {
            return;
        }
        log.info("Removing finalizer {} from {}/{}", FINALIZER, metadata.getNamespace(), metadata.getName());

        List<String> finalizers = new ArrayList<>(metadata.getFinalizers());
        finalizers.remove(FINALIZER);
        metadata.setFinalizers(finalizers);
        store.update(resource);
    }

    /**
     * Handles a resource marked for deletion. With the finalizer present, runs {@code teardown} and
     * releases the finalizer once it returns; a thrown teardown leaves the finalizer in place.
     *
     * @return true when the resource is being deleted and the caller should end the pass
     */
    public <T extends KubernetesObject> boolean finalizeIfDeleting(T resource, ResourceStore<T> store,
                                                                   Teardown teardown) throws ApiException {
        if (!isDeleting(resource)) {
            return false;
        }
        if (!hasFinalizer(resource)) {
            return true;
        }
        V1ObjectMeta metadata = resource.getMetadata();
        log.info("Running teardown for {}/{}", metadata.getNamespace(), metadata.getName());
        teardown.run();
        removeFinalizer(resource, store);
        return true;
    }
}
