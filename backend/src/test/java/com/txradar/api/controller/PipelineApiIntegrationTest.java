package com.txradar.api.controller;

import com.txradar.ingestion.SourceIngester;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.util.List;

import static com.txradar.pipeline.PipelineFixtures.bankRow;
import static org.mockito.Mockito.when;

@SpringBootTest
@ActiveProfiles("test")
@AutoConfigureWebTestClient
@Testcontainers(disabledWithoutDocker = true)
class PipelineApiIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    SourceIngester sourceIngester;

    @Test
    @DisplayName("a run stores enriched rows that the query and report endpoints read back")
    void runThenQuery() {
        when(sourceIngester.fetchBatch()).thenReturn(List.of(
                bankRow(0, "2024-01-05", "Coffee shop", "Dining", "4.50", null),
                bankRow(1, "2024-01-06", "Coffee shop", "Dining", "5.00", null),
                bankRow(2, "2024-01-20", "Flight to Denver", "Travel", "900.00", null),
                bankRow(3, "2024-02-01", "Payroll deposit", "Salary", null, "2500.00")));

        webTestClient.post()
                .uri("/api/v1/pipeline/runs")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("COMPLETE")
                .jsonPath("$.row_count").isEqualTo(4)
                .jsonPath("$.category_count").isEqualTo(3);

        webTestClient.get()
                .uri("/api/v1/transactions?anomaliesOnly=true")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.count").isEqualTo(2)
                .jsonPath("$.transactions[0].row_index").isEqualTo(2)
                .jsonPath("$.transactions[0].is_large_transaction").isEqualTo(true)
                .jsonPath("$.transactions[1].row_index").isEqualTo(3);

        webTestClient.get()
                .uri("/api/v1/reports/monthly-flow")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[0].year_month").isEqualTo("2024-01")
                .jsonPath("$[1].year_month").isEqualTo("2024-02");

        webTestClient.get()
                .uri("/api/v1/pipeline/runs/latest")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("COMPLETE");
    }

    @Test
    @DisplayName("an empty source batch fails the run with 422")
    void emptyBatch() {
        when(sourceIngester.fetchBatch()).thenReturn(List.of());

        webTestClient.post()
                .uri("/api/v1/pipeline/runs")
                .exchange()
                .expectStatus().isEqualTo(422)
                .expectBody()
                .jsonPath("$.error").isEqualTo("EMPTY_BATCH");
    }
}
