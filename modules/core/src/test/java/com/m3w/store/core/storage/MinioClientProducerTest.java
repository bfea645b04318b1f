package com.m3w.store.core.storage;

import io.minio.MinioClient;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class MinioClientProducerTest {

    private static MinioClientProducer producer(Optional<String> region) {
        MinioClientProducer producer = new MinioClientProducer();
        producer.endpoint = "http://localhost:9000";
        producer.accessKey = "m3w";
        producer.secretKey = "m3w-secret";
        producer.region = region;
        return producer;
    }

    @Test
    void shouldBuildClientWithoutRegion() {
        assertThat(producer(Optional.empty()).minioClient()).isNotNull();
    }

    @Test
    void shouldBuildClientForRegionalEndpoint() {
        MinioClient client = producer(Optional.of("eu-west-1")).minioClient();

        assertThat(client).isNotNull();
    }
}
