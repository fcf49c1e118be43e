package com.quarry.service;

import com.quarry.config.QuarryProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * User-facing messages for backend search error codes.
 * Entries from {@code quarry.backend.error-messages} override the built-in ones.
 */
@Component
public class SearchErrorMessages {

    private static final Map<Integer, String> DEFAULTS = Map.of(
            20001, "Search query is not valid",
            20002, "Search stream not found",
            20003, "Full text search field not found",
            20004, "Search SQL is not valid",
            20005, "Search field not found",
            20006, "Search function is not defined",
            20007, "Search data file not found",
            20008, "Search field has no compatible data type",
            20009, "Search query was cancelled",
            20010, "Search query timed out"
    );

    private final Map<Integer, String> messages;

    public SearchErrorMessages(QuarryProperties properties) {
        Map<Integer, String> merged = new HashMap<>(DEFAULTS);
        merged.putAll(properties.getBackend().getErrorMessages());
        this.messages = Map.copyOf(merged);
    }

    /**
     * @return the remapped message, or null when the code is unknown
     */
    public String forCode(Integer code) {
        return code != null ? messages.get(code) : null;
    }
}
