package com.m3w.store.core.storage;

import io.minio.MinioClient;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.Optional;

/**
 * Builds the client behind {@link S3ObjectStorage} when audio blobs live in an
 * S3-compatible bucket. Region is only needed for AWS endpoints; MinIO ignores it.
 */
@ApplicationScoped
@IfBuildProperty(name = "m3w.object-store.type", stringValue = "s3")
public class MinioClientProducer {

    private static final Logger log = Logger.getLogger(MinioClientProducer.class);

    @ConfigProperty(name = "m3w.minio.endpoint")
    String endpoint;

    @ConfigProperty(name = "m3w.minio.access-key")
    String accessKey;

    @ConfigProperty(name = "m3w.minio.secret-key")
    String secretKey;

    @ConfigProperty(name = "m3w.minio.region")
    Optional<String> region;

    @Produces
    @Singleton
    public MinioClient minioClient() {
        MinioClient.Builder builder = MinioClient.builder()
                .endpoint(endpoint)
                .credentials(accessKey, secretKey);
        region.ifPresent(builder::region);
        log.infof("Audio blobs stored at %s (region=%s)", endpoint, region.orElse("default"));
        return builder.build();
    }
}
