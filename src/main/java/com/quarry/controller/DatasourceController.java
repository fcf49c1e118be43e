package com.quarry.controller;

import com.quarry.api.HealthResponse;
import com.quarry.service.DatasourceHealthService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/v1/datasource")
public class DatasourceController {

    private final DatasourceHealthService healthService;

    public DatasourceController(DatasourceHealthService healthService) {
        this.healthService = healthService;
    }

    @GetMapping("/health")
    public Mono<HealthResponse> health() {
        return healthService.check();
    }
}
