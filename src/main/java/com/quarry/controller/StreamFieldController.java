package com.quarry.controller;

import com.quarry.model.StreamField;
import com.quarry.model.StreamFieldSet;
import com.quarry.service.StreamFieldRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Read and replace the stream fields used for query building and logs frames.
 */
@Slf4j
@RestController
@RequestMapping("/v1/stream-fields")
public class StreamFieldController {

    private final StreamFieldRegistry streamFieldRegistry;

    public StreamFieldController(StreamFieldRegistry streamFieldRegistry) {
        this.streamFieldRegistry = streamFieldRegistry;
    }

    @GetMapping
    public StreamFieldSet current() {
        return streamFieldRegistry.current();
    }

    @PutMapping
    public StreamFieldSet update(@RequestBody List<StreamField> fields) {
        return streamFieldRegistry.update(fields);
    }

    /**
     * Load the field set of a stream from the backend schema.
     */
    @PostMapping("/refresh")
    public Mono<StreamFieldSet> refresh(@RequestParam String organization, @RequestParam String stream) {
        log.info("Refreshing stream fields for {}/{}", organization, stream);
        return streamFieldRegistry.refresh(organization, stream);
    }
}
