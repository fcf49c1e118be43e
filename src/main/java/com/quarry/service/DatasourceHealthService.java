package com.quarry.service;

import com.quarry.api.HealthResponse;
import com.quarry.backend.SearchBackend;
import com.quarry.backend.SearchBackendException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Pass/fail connectivity report for the configured backend.
 */
@Slf4j
@Service
public class DatasourceHealthService {

    private final SearchBackend searchBackend;

    public DatasourceHealthService(SearchBackend searchBackend) {
        this.searchBackend = searchBackend;
    }

    public Mono<HealthResponse> check() {
        return searchBackend.ping()
                .then(Mono.fromSupplier(() -> new HealthResponse("success", "Data source successfully connected.")))
                .onErrorResume(error -> {
                    log.warn("Data source health check failed: {}", error.getMessage());
                    String info = error instanceof SearchBackendException backendError
                            && backendError.getBackendMessage() != null
                            ? " (" + backendError.getBackendMessage() + ")"
                            : "";
                    return Mono.just(new HealthResponse("error",
                            "Unable to connect to the search backend" + info
                                    + ". Verify that the backend is correctly configured"));
                });
    }
}
