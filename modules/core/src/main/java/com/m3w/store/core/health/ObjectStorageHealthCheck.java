package com.m3w.store.core.health;

import com.m3w.store.core.storage.ObjectStorage;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

/**
 * Probes the configured object store with an existence check on a key that
 * is never written.
 */
@Readiness
@ApplicationScoped
public class ObjectStorageHealthCheck implements HealthCheck {

    static final String PROBE_KEY = "health/probe";

    @Inject
    ObjectStorage storage;

    @Override
    public HealthCheckResponse call() {
        try {
            storage.exists(PROBE_KEY).await().indefinitely();
            return HealthCheckResponse.named("object-store")
                    .up()
                    .build();
        } catch (Exception e) {
            return HealthCheckResponse.named("object-store")
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
