package com.txradar.ingestion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.txradar.domain.RawTransaction;
import com.txradar.ingestion.config.IngestionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the raw batch from GET {baseUrl}/{endpoint}. Column names and value types are passed through as
 * delivered; the normalizer canonicalizes them.
 */
@Component
@Slf4j
public class FakeBankSourceClient implements SourceIngester {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final WebClient webClient;
    private final IngestionProperties properties;

    public FakeBankSourceClient(WebClient.Builder webClientBuilder, IngestionProperties properties) {
        this.webClient = webClientBuilder.build();
        this.properties = properties;
    }

    @Override
    public List<RawTransaction> fetchBatch() {
        String url = sourceUrl();
        log.info("Fetching source batch from {}", url);
        String body;
        try {
            body = webClient.get()
                    .uri(url)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .block();
        } catch (RuntimeException e) {
            throw new SourceUnavailableException("Source fetch failed for " + url + ": " + e.getMessage(), e);
        }
        List<RawTransaction> rows = parseRows(body);
        log.info("Fetched {} source rows", rows.size());
        return rows;
    }

    String sourceUrl() {
        String base = properties.getBaseUrl().replaceAll("/+$", "");
        String endpoint = properties.getEndpoint().replaceAll("^/+", "");
        return base + "/" + endpoint;
    }

    /** A JSON array of objects, or a single object as a one-row batch. Empty body is an empty batch. */
    static List<RawTransaction> parseRows(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new SourceUnavailableException("Source payload is not JSON", e);
        }
        List<RawTransaction> rows = new ArrayList<>();
        if (root.isObject()) {
            rows.add(new RawTransaction(0, toFields(root)));
            return rows;
        }
        if (!root.isArray()) {
            throw new SourceUnavailableException("Source payload is neither an array nor an object");
        }
        int index = 0;
        for (JsonNode node : root) {
            rows.add(new RawTransaction(index++, node.isObject() ? toFields(node) : Map.of()));
        }
        return rows;
    }

    private static Map<String, Object> toFields(JsonNode node) {
        Map<String, Object> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            fields.put(field.getKey(), toValue(field.getValue()));
        }
        return fields;
    }

    private static Object toValue(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        return value.toString();
    }
}
