package com.shieldsync.ingestion.relayer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Relayer HTTP client using WebClient. Bodies are read as strings and parsed with Jackson so that
 * the relayer's loose shapes (numbers as strings, bare-string "not found" bodies) are handled in one place.
 */
public class WebClientRelayerClient implements RelayerClient {

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public WebClientRelayerClient(WebClient.Builder builder, ObjectMapper objectMapper) {
        this.webClient = builder.build();
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<List<String>> fetchTransactions(String baseUrl, long offset, int limit) {
        return webClient.get()
                .uri(endpoint(baseUrl, "/transactions?offset={offset}&limit={limit}"), offset, limit)
                .retrieve()
                .bodyToMono(String.class)
                .defaultIfEmpty("[]")
                .map(this::parseEntries)
                .onErrorMap(WebClientException.class, e -> new RelayerException("GET /transactions failed: " + e.getMessage(), e));
    }

    @Override
    public Mono<RelayerInfo> info(String baseUrl) {
        return webClient.get()
                .uri(endpoint(baseUrl, "/info"))
                .retrieve()
                .bodyToMono(String.class)
                .map(this::parseInfo)
                .onErrorMap(WebClientException.class, e -> new RelayerException("GET /info failed: " + e.getMessage(), e));
    }

    @Override
    public Mono<String> sendTransactions(String baseUrl, List<RelayerTxRequest> transactions) {
        return webClient.post()
                .uri(endpoint(baseUrl, "/sendTransactions"))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(transactions)
                .retrieve()
                .bodyToMono(String.class)
                .map(body -> {
                    JsonNode jobId = readTree(body).get("jobId");
                    if (jobId == null || jobId.isNull() || jobId.asText().isBlank()) {
                        throw new RelayerException("Relayer accepted transactions without a job id: " + body);
                    }
                    return jobId.asText();
                })
                .onErrorMap(WebClientResponseException.class, e -> new RelayerException(
                        "POST /sendTransactions rejected (" + e.getStatusCode().value() + "): " + e.getResponseBodyAsString(), e))
                .onErrorMap(e -> e instanceof WebClientException && !(e instanceof WebClientResponseException),
                        e -> new RelayerException("POST /sendTransactions failed: " + e.getMessage(), e));
    }

    @Override
    public Mono<Optional<RelayerJob>> getJob(String baseUrl, String jobId) {
        return webClient.get()
                .uri(endpoint(baseUrl, "/job/{id}"), jobId)
                .retrieve()
                .bodyToMono(String.class)
                .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.just("\"Job not found\""))
                .map(body -> parseJob(jobId, body))
                .onErrorMap(WebClientException.class, e -> new RelayerException("GET /job/" + jobId + " failed: " + e.getMessage(), e));
    }

    @Override
    public Mono<Long> fee(String baseUrl) {
        return webClient.get()
                .uri(endpoint(baseUrl, "/fee"))
                .retrieve()
                .bodyToMono(String.class)
                .map(body -> {
                    JsonNode fee = readTree(body).get("fee");
                    if (fee == null || fee.isNull()) {
                        throw new RelayerException("Relayer fee response without fee: " + body);
                    }
                    return fee.asLong();
                })
                .onErrorMap(WebClientException.class, e -> new RelayerException("GET /fee failed: " + e.getMessage(), e));
    }

    List<String> parseEntries(String body) {
        JsonNode root = readTree(body);
        if (!root.isArray()) {
            throw new RelayerException("Expected an array of transactions, got: " + abbreviate(body));
        }
        List<String> entries = new ArrayList<>(root.size());
        for (JsonNode node : root) {
            entries.add(node.asText());
        }
        return entries;
    }

    RelayerInfo parseInfo(String body) {
        JsonNode root = readTree(body);
        JsonNode deltaIndex = root.get("deltaIndex");
        if (deltaIndex == null || deltaIndex.isNull()) {
            throw new RelayerException("Relayer info without deltaIndex: " + abbreviate(body));
        }
        return new RelayerInfo(root.path("root").asText(null), deltaIndex.asLong());
    }

    Optional<RelayerJob> parseJob(String jobId, String body) {
        JsonNode root = readTree(body);
        if (root.isTextual() || root.isNull() || root.isMissingNode()) {
            return Optional.empty();
        }
        List<String> hashes = new ArrayList<>();
        JsonNode txHash = root.path("txHash");
        if (txHash.isArray()) {
            txHash.forEach(h -> hashes.add(h.asText()));
        } else if (txHash.isTextual()) {
            hashes.add(txHash.asText());
        }
        String reason = root.hasNonNull("failedReason") ? root.get("failedReason").asText() : null;
        return Optional.of(new RelayerJob(jobId, RelayerJobState.fromWire(root.path("state").asText(null)), hashes, reason));
    }

    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new RelayerException("Malformed relayer response: " + abbreviate(body), e);
        }
    }

    private static String endpoint(String baseUrl, String pathTemplate) {
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return base + pathTemplate;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "null";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
