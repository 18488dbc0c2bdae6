package com.catalog.matching.tier;

import com.catalog.matching.core.model.MatchCandidate;

import java.util.List;

/**
 * One stage of the tiered match. The first tier returning a non-empty list answers the query.
 */
public interface MatchTier {

    /**
     * Short identifier used in logs, metrics and traces.
     */
    String name();

    /**
     * @return at most {@code context.limit()} candidates in final order; empty to pass
     */
    List<MatchCandidate> evaluate(MatchContext context);
}
