package com.m3w.store.core.storage;

import io.minio.BucketExistsArgs;
import io.minio.GetObjectArgs;
import io.minio.ListObjectsArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.RemoveObjectArgs;
import io.minio.Result;
import io.minio.StatObjectArgs;
import io.minio.StatObjectResponse;
import io.minio.errors.ErrorResponseException;
import io.minio.messages.Item;
import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * S3/MinIO-backed ObjectStorage for production use.
 *
 * <p>All payloads share one bucket, created on first write. Keys are used
 * verbatim; MinIO handles sharding internally.
 */
@ApplicationScoped
@IfBuildProperty(name = "m3w.object-store.type", stringValue = "s3")
public class S3ObjectStorage implements ObjectStorage {

    @Inject
    MinioClient minioClient;

    @ConfigProperty(name = "m3w.object-store.bucket", defaultValue = "m3w-files")
    String bucket;

    private volatile boolean bucketReady;

    public S3ObjectStorage() {
    }

    public S3ObjectStorage(MinioClient minioClient, String bucket) {
        this.minioClient = minioClient;
        this.bucket = bucket;
    }

    private void ensureBucket() {
        if (bucketReady) {
            return;
        }
        try {
            if (!minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucket).build())) {
                minioClient.makeBucket(MakeBucketArgs.builder().bucket(bucket).build());
            }
            bucketReady = true;
        } catch (ErrorResponseException e) {
            // another thread created the bucket first
            if ("BucketAlreadyOwnedByYou".equals(e.errorResponse().code())) {
                bucketReady = true;
                return;
            }
            throw new StorageException("ensure bucket", bucket, e);
        } catch (Exception e) {
            throw new StorageException("ensure bucket", bucket, e);
        }
    }

    private static boolean isMissing(ErrorResponseException e) {
        String code = e.errorResponse().code();
        return "NoSuchKey".equals(code) || "NoSuchBucket".equals(code) || "NotFound".equals(code);
    }

    @Override
    public Uni<Void> put(String key, byte[] data, String contentType) {
        return Uni.createFrom().voidItem().invoke(() -> {
            ensureBucket();
            try (InputStream is = new ByteArrayInputStream(data)) {
                minioClient.putObject(PutObjectArgs.builder()
                        .bucket(bucket)
                        .object(key)
                        .stream(is, data.length, -1)
                        .contentType(contentType != null ? contentType : "application/octet-stream")
                        .build());
            } catch (Exception e) {
                throw new StorageException("write object", key, e);
            }
        });
    }

    @Override
    public Uni<byte[]> get(String key) {
        return Uni.createFrom().item(() -> {
            try (InputStream is = minioClient.getObject(
                    GetObjectArgs.builder().bucket(bucket).object(key).build())) {
                return is.readAllBytes();
            } catch (ErrorResponseException e) {
                if (isMissing(e)) {
                    throw new ObjectNotFoundException(key);
                }
                throw new StorageException("read object", key, e);
            } catch (Exception e) {
                throw new StorageException("read object", key, e);
            }
        });
    }

    @Override
    public Uni<InputStream> streamRange(String key, long start, Long end) {
        return Uni.createFrom().item(() -> {
            GetObjectArgs.Builder args = GetObjectArgs.builder().bucket(bucket).object(key).offset(start);
            if (end != null) {
                args.length(end - start + 1);
            }
            try {
                return (InputStream) minioClient.getObject(args.build());
            } catch (ErrorResponseException e) {
                if (isMissing(e)) {
                    throw new ObjectNotFoundException(key);
                }
                throw new StorageException("open range of object", key, e);
            } catch (Exception e) {
                throw new StorageException("open range of object", key, e);
            }
        });
    }

    @Override
    public Uni<Boolean> delete(String key) {
        return Uni.createFrom().item(() -> {
            // MinIO removeObject is silent on missing keys
            try {
                minioClient.statObject(StatObjectArgs.builder().bucket(bucket).object(key).build());
            } catch (ErrorResponseException e) {
                if (isMissing(e)) {
                    return false;
                }
                throw new StorageException("delete object", key, e);
            } catch (Exception e) {
                throw new StorageException("delete object", key, e);
            }
            try {
                minioClient.removeObject(RemoveObjectArgs.builder().bucket(bucket).object(key).build());
                return true;
            } catch (Exception e) {
                throw new StorageException("delete object", key, e);
            }
        });
    }

    @Override
    public Uni<Boolean> exists(String key) {
        return Uni.createFrom().item(() -> {
            try {
                minioClient.statObject(StatObjectArgs.builder().bucket(bucket).object(key).build());
                return true;
            } catch (ErrorResponseException e) {
                if (isMissing(e)) {
                    return false;
                }
                throw new StorageException("check existence", key, e);
            } catch (Exception e) {
                throw new StorageException("check existence", key, e);
            }
        });
    }

    @Override
    public Uni<ObjectMetadata> getMetadata(String key) {
        return Uni.createFrom().item(() -> {
            try {
                StatObjectResponse stat = minioClient.statObject(
                        StatObjectArgs.builder().bucket(bucket).object(key).build());
                return new ObjectMetadata(stat.size(), stat.contentType(),
                        stat.lastModified() != null ? stat.lastModified().toInstant() : null);
            } catch (ErrorResponseException e) {
                if (isMissing(e)) {
                    throw new ObjectNotFoundException(key);
                }
                throw new StorageException("stat object", key, e);
            } catch (Exception e) {
                throw new StorageException("stat object", key, e);
            }
        });
    }

    @Override
    public Multi<String> list(String prefix) {
        return Multi.createFrom().items(() -> {
            try {
                List<String> keys = new ArrayList<>();
                for (Result<Item> result : minioClient.listObjects(
                        ListObjectsArgs.builder().bucket(bucket).prefix(prefix).recursive(true).build())) {
                    keys.add(result.get().objectName());
                }
                return keys.stream();
            } catch (ErrorResponseException e) {
                if ("NoSuchBucket".equals(e.errorResponse().code())) {
                    return java.util.stream.Stream.<String>empty();
                }
                throw new StorageException("list objects under", prefix, e);
            } catch (Exception e) {
                throw new StorageException("list objects under", prefix, e);
            }
        });
    }
}
