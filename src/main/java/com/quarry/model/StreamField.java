package com.quarry.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A column known to exist in a log stream, with its backend type name (e.g. Utf8, Int64).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StreamField {

    private String name;

    private String type;
}
