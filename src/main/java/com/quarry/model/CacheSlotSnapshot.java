package com.quarry.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Point-in-time view of one dispatch cache slot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheSlotSnapshot {

    private String slot;
    private String state;
    private String key;
    private boolean fetching;
}
