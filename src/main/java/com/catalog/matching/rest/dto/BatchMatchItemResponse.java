package com.catalog.matching.rest.dto;

import com.catalog.matching.api.BatchMatchItem;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST response DTO for one element of a batch.
 */
public record BatchMatchItemResponse(int queryIndex, String queryText, List<MatchCandidateResponse> candidates) {

    public static BatchMatchItemResponse from(BatchMatchItem item) {
        return new BatchMatchItemResponse(
                item.queryIndex(),
                item.queryText(),
                item.candidates().stream().map(MatchCandidateResponse::from).collect(Collectors.toList()));
    }
}
