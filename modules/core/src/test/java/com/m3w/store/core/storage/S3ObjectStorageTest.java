package com.m3w.store.core.storage;

import io.minio.MinioClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.MinIOContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
class S3ObjectStorageTest {

    @Container
    static final MinIOContainer MINIO = new MinIOContainer("minio/minio:RELEASE.2024-11-07T00-52-20Z");

    private S3ObjectStorage storage;

    @BeforeEach
    void setUp() {
        MinioClient client = MinioClient.builder()
                .endpoint(MINIO.getS3URL())
                .credentials(MINIO.getUserName(), MINIO.getPassword())
                .build();
        storage = new S3ObjectStorage(client, "m3w-" + UUID.randomUUID().toString().substring(0, 8));
    }

    @Test
    void shouldRoundTripObjectWithContentType() {
        byte[] data = "audio bytes".getBytes(StandardCharsets.UTF_8);
        storage.put("files/aabb.mp3", data, "audio/mpeg").await().indefinitely();

        assertThat(storage.get("files/aabb.mp3").await().indefinitely()).isEqualTo(data);
        ObjectMetadata metadata = storage.getMetadata("files/aabb.mp3").await().indefinitely();
        assertThat(metadata.size()).isEqualTo(data.length);
        assertThat(metadata.contentType()).isEqualTo("audio/mpeg");
    }

    @Test
    void shouldReportMissingObjects() {
        assertThat(storage.exists("files/none.mp3").await().indefinitely()).isFalse();
        assertThat(storage.delete("files/none.mp3").await().indefinitely()).isFalse();
        assertThatThrownBy(() -> storage.get("files/none.mp3").await().indefinitely())
                .isInstanceOf(ObjectNotFoundException.class);
    }

    @Test
    void shouldDeleteExistingObjectOnce() {
        storage.put("files/ccdd.flac", new byte[]{1, 2}, "audio/flac").await().indefinitely();

        assertThat(storage.delete("files/ccdd.flac").await().indefinitely()).isTrue();
        assertThat(storage.delete("files/ccdd.flac").await().indefinitely()).isFalse();
    }

    @Test
    void shouldStreamRangeAndListByPrefix() throws Exception {
        storage.put("files/eeff.mp3", "0123456789".getBytes(StandardCharsets.UTF_8), null)
                .await().indefinitely();
        storage.put("other/x", new byte[]{1}, null).await().indefinitely();

        try (InputStream in = storage.streamRange("files/eeff.mp3", 3, 5L).await().indefinitely()) {
            assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("345");
        }
        assertThat(storage.list("files/").collect().asList().await().indefinitely())
                .containsExactly("files/eeff.mp3");
    }
}
