package com.quarry.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.quarry.config.QuarryProperties;
import com.quarry.model.PartitionResponse;
import com.quarry.model.SearchQuery;
import com.quarry.model.SearchRequest;
import com.quarry.model.SearchResponse;
import com.quarry.model.StreamField;
import com.quarry.model.StreamFieldSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Search backend speaking the OpenObserve HTTP API.
 */
@Slf4j
@Component
public class HttpSearchBackend extends AbstractSearchBackend {

    private static final String PAGE_TYPE = "logs";
    private static final String SEARCH_TYPE = "ui";
    private static final boolean USE_CACHE = true;

    public HttpSearchBackend(WebClient webClient, QuarryProperties properties, ObjectMapper objectMapper) {
        super(webClient, properties, objectMapper);
    }

    @Override
    public String getName() {
        return "openobserve";
    }

    @Override
    public Mono<SearchResponse> search(String organization, SearchRequest request) {
        log.debug("Searching org={} sql={}", organization, request.getQuery().getSql());

        return execute("search", webClient.post()
                .uri(uri -> uri.path("/api/{org}/_search")
                        .queryParam("type", PAGE_TYPE)
                        .queryParam("search_type", SEARCH_TYPE)
                        .queryParam("use_cache", USE_CACHE)
                        .build(organization))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(SearchResponse.class)
                .defaultIfEmpty(new SearchResponse()));
    }

    @Override
    public Mono<SearchResponse> histogram(String organization, SearchRequest request) {
        log.debug("Histogram org={} range=[{}, {}]",
                organization, request.getQuery().getStartTime(), request.getQuery().getEndTime());

        return execute("histogram", webClient.post()
                .uri(uri -> uri.path("/api/{org}/_search")
                        .queryParam("type", PAGE_TYPE)
                        .queryParam("search_type", SEARCH_TYPE)
                        .queryParam("use_cache", USE_CACHE)
                        .queryParam("is_ui_histogram", true)
                        .build(organization))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(SearchResponse.class)
                .defaultIfEmpty(new SearchResponse()));
    }

    @Override
    public Mono<PartitionResponse> partition(String organization, SearchQuery query) {
        return execute("partition", webClient.post()
                .uri(uri -> uri.path("/api/{org}/_search_partition")
                        .queryParam("type", PAGE_TYPE)
                        .queryParam("enable_align_histogram", true)
                        .build(organization))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(query)
                .retrieve()
                .bodyToMono(PartitionResponse.class)
                .defaultIfEmpty(new PartitionResponse()));
    }

    @Override
    public Mono<StreamFieldSet> streamSchema(String organization, String stream) {
        return execute("schema", webClient.get()
                .uri(uri -> uri.path("/api/{org}/streams/{stream}/schema")
                        .queryParam("type", PAGE_TYPE)
                        .build(organization, stream))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(this::parseSchema)
                .defaultIfEmpty(StreamFieldSet.empty()));
    }

    @Override
    public Mono<Void> ping() {
        return execute("ping", webClient.get()
                .uri("/api/organizations")
                .retrieve()
                .toBodilessEntity()
                .then());
    }

    /**
     * Reads {@code schema: [{name, type}]}; user-defined settings fields are not separated out.
     */
    private StreamFieldSet parseSchema(JsonNode body) {
        JsonNode schema = body.path("schema");
        if (!schema.isArray()) {
            return StreamFieldSet.empty();
        }
        List<StreamField> fields = new ArrayList<>();
        for (JsonNode node : schema) {
            String name = node.path("name").asText(null);
            if (name != null) {
                fields.add(new StreamField(name, node.path("type").asText("Utf8")));
            }
        }
        return StreamFieldSet.of(fields);
    }
}
