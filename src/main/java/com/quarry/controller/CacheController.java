package com.quarry.controller;

import com.quarry.service.StreamFieldRegistry;
import com.quarry.service.cache.DispatchCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Cache management controller.
 * Exposes the dispatch cache slots and resets them.
 */
@Slf4j
@RestController
@RequestMapping("/v1/cache")
public class CacheController {

    private final DispatchCache dispatchCache;
    private final StreamFieldRegistry streamFieldRegistry;

    public CacheController(DispatchCache dispatchCache, StreamFieldRegistry streamFieldRegistry) {
        this.dispatchCache = dispatchCache;
        this.streamFieldRegistry = streamFieldRegistry;
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats() {
        return ResponseEntity.ok(Map.of(
                "slots", dispatchCache.snapshot(),
                "status", "healthy"
        ));
    }

    /**
     * Clear both slots and the schema cache. In-flight fetches are cancelled.
     */
    @PostMapping("/clear")
    public ResponseEntity<Map<String, String>> clearCache() {
        log.info("Cache clear requested");
        dispatchCache.clear();
        streamFieldRegistry.invalidateSchemas();

        return ResponseEntity.ok(Map.of(
                "status", "success",
                "message", "Dispatch cache and schema cache cleared"
        ));
    }
}
