package com.txradar.ingestion;

import com.txradar.domain.RawTransaction;
import com.txradar.ingestion.config.IngestionProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FakeBankSourceClientTest {

    private static final String PAYLOAD = """
            [
              {"id": 1, "transactionDate": "2016-01-04", "description": "Payment, thank you",
               "category": "Payment/Credit", "debit": null, "credit": 1000},
              {"id": 2, "transactionDate": "2016-01-05", "description": "NETFLIX.COM",
               "category": "Other Services", "debit": 15.99, "credit": null}
            ]
            """;

    private final List<String> requestedUrls = new ArrayList<>();

    private FakeBankSourceClient client(HttpStatus status, String body) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(req -> {
            requestedUrls.add(req.url().toString());
            return Mono.just(ClientResponse.create(status)
                    .header("Content-Type", "application/json")
                    .body(body)
                    .build());
        });
        IngestionProperties properties = new IngestionProperties();
        properties.setBaseUrl("https://api.sampleapis.test/");
        properties.setEndpoint("/fakebank/accounts");
        return new FakeBankSourceClient(builder, properties);
    }

    @Test
    @DisplayName("fetchBatch reads the JSON array into rows numbered in delivery order")
    void fetchBatch() {
        List<RawTransaction> rows = client(HttpStatus.OK, PAYLOAD).fetchBatch();

        assertThat(requestedUrls).containsExactly("https://api.sampleapis.test/fakebank/accounts");
        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).getRowIndex()).isZero();
        assertThat(rows.get(0).getFields()).containsEntry("transactionDate", "2016-01-04");
        assertThat(rows.get(0).getFields()).containsEntry("debit", null);
        assertThat((BigDecimal) rows.get(1).getFields().get("debit")).isEqualByComparingTo("15.99");
    }

    @Test
    @DisplayName("a single object is a one-row batch; empty array is an empty batch")
    void parseShapes() {
        assertThat(FakeBankSourceClient.parseRows("{\"id\": 7, \"debit\": 3}")).hasSize(1);
        assertThat(FakeBankSourceClient.parseRows("[]")).isEmpty();
        assertThat(FakeBankSourceClient.parseRows("")).isEmpty();
    }

    @Test
    @DisplayName("non-JSON payload and HTTP errors surface as SourceUnavailableException")
    void failures() {
        assertThatThrownBy(() -> FakeBankSourceClient.parseRows("<html>"))
                .isInstanceOf(SourceUnavailableException.class);
        assertThatThrownBy(() -> FakeBankSourceClient.parseRows("42"))
                .isInstanceOf(SourceUnavailableException.class);
        FakeBankSourceClient failing = client(HttpStatus.INTERNAL_SERVER_ERROR, "{}");
        assertThatThrownBy(failing::fetchBatch).isInstanceOf(SourceUnavailableException.class);
    }
}
