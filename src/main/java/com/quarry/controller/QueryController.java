package com.quarry.controller;

import com.quarry.api.QueryBatchRequest;
import com.quarry.api.QueryBatchResponse;
import com.quarry.api.QueryModifyRequest;
import com.quarry.model.QueryTarget;
import com.quarry.service.QueryService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Query resolution endpoints used by the front-end.
 */
@Slf4j
@RestController
@RequestMapping("/v1/query")
public class QueryController {

    private final QueryService queryService;

    public QueryController(QueryService queryService) {
        this.queryService = queryService;
    }

    /**
     * Resolve one batch of targets; frames come back in target order.
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<QueryBatchResponse> query(@Valid @RequestBody QueryBatchRequest request) {
        log.debug("Received batch of {} targets", request.getTargets().size());
        return queryService.query(request).map(QueryBatchResponse::new);
    }

    /**
     * Resolve the log-volume histogram for each target of a batch.
     */
    @PostMapping(value = "/logs-volume", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<QueryBatchResponse> logsVolume(@Valid @RequestBody QueryBatchRequest request) {
        return queryService.logsVolume(request).map(QueryBatchResponse::new);
    }

    @PostMapping(value = "/modify", consumes = MediaType.APPLICATION_JSON_VALUE)
    public QueryTarget modify(@Valid @RequestBody QueryModifyRequest request) {
        return queryService.modify(request.getQuery(), request.getType(), request.getKey(), request.getValue());
    }
}
