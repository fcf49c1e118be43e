package com.quarry.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Backend search result. Hit maps keep the backend's key order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {

    @Builder.Default
    private List<Map<String, Object>> hits = new ArrayList<>();

    private Long total;

    private Long took;

    public List<Map<String, Object>> getHits() {
        return hits != null ? hits : List.of();
    }
}
