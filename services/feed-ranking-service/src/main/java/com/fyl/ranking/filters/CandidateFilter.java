package com.fyl.ranking.filters;

import com.fyl.ranking.candidate.Candidate;
import java.util.List;

/**
 * A total function over a candidate list. Implementations never mutate the input and never
 * reorder the survivors.
 */
public interface CandidateFilter {
    String name();

    List<Candidate> apply(List<Candidate> candidates, FilterContext context);
}
