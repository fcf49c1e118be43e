package com.quarry.api;

import com.quarry.model.ResultFrame;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Frames in the same order as the request's targets.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueryBatchResponse {

    private List<ResultFrame> data;
}
