package com.quarry.api;

import com.quarry.model.QueryTarget;
import com.quarry.service.query.QueryModifier;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Adds a filter clause to a target's expression.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryModifyRequest {

    @NotNull
    private QueryTarget query;

    @NotNull
    private QueryModifier.Action type;

    private String key;

    private String value;
}
