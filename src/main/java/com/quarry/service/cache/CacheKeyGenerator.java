package com.quarry.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.quarry.model.DisplayMode;
import com.quarry.model.SearchRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Generates dispatch cache keys.
 *
 * Key = SHA-256 of the canonical JSON of {request, display mode, target id}, so the same
 * request rendered as logs and as a graph is cached twice.
 */
@Slf4j
@Component
public class CacheKeyGenerator {

    private final ObjectMapper canonicalMapper;

    public CacheKeyGenerator(ObjectMapper objectMapper) {
        this.canonicalMapper = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    /**
     * @return 64 hex chars
     */
    public String generate(SearchRequest request, DisplayMode displayMode, String refId) {
        Map<String, Object> key = new LinkedHashMap<>();
        key.put("reqData", request);
        key.put("displayMode", displayMode != null ? displayMode : DisplayMode.AUTO);
        key.put("type", refId);

        try {
            return DigestUtils.sha256Hex(canonicalMapper.writeValueAsString(key));
        } catch (JsonProcessingException e) {
            log.error("Error serializing cache key, using toString form", e);
            return DigestUtils.sha256Hex(String.valueOf(key));
        }
    }
}
