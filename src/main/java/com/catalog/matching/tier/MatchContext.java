package com.catalog.matching.tier;

import com.catalog.matching.signal.QueryContext;

import java.util.List;
import java.util.function.Function;

/**
 * Per-query state shared by the tiers: the query, its clamped limit and threshold, and the
 * training-example lookup that both training tiers consume.
 */
public class MatchContext {

    private final QueryContext query;
    private final int limit;
    private final double threshold;
    private final Function<QueryContext, List<TrainingMatch>> trainingLookup;
    private List<TrainingMatch> trainingMatches;

    public MatchContext(QueryContext query, int limit, double threshold,
                        Function<QueryContext, List<TrainingMatch>> trainingLookup) {
        this.query = query;
        this.limit = limit;
        this.threshold = threshold;
        this.trainingLookup = trainingLookup;
    }

    public QueryContext query() {
        return query;
    }

    public int limit() {
        return limit;
    }

    public double threshold() {
        return threshold;
    }

    /**
     * Approved examples similar to the query, computed on first access.
     */
    public synchronized List<TrainingMatch> trainingMatches() {
        if (trainingMatches == null) {
            trainingMatches = trainingLookup != null ? List.copyOf(trainingLookup.apply(query)) : List.of();
        }
        return trainingMatches;
    }
}
