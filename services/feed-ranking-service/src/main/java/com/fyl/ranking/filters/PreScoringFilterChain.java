package com.fyl.ranking.filters;

import com.fyl.ranking.candidate.Candidate;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs the filters in their declared order: duplicates, age, self-authored, already seen.
 */
@Component
public class PreScoringFilterChain {
    private static final Logger log = LoggerFactory.getLogger(PreScoringFilterChain.class);

    private final List<CandidateFilter> filters;

    public PreScoringFilterChain(List<CandidateFilter> filters) {
        this.filters = List.copyOf(filters);
    }

    public static PreScoringFilterChain standard() {
        return new PreScoringFilterChain(
            List.of(new DuplicateFilter(), new AgeFilter(), new SelfPostFilter(), new SeenFilter())
        );
    }

    public List<Candidate> apply(List<Candidate> candidates, FilterContext context) {
        List<Candidate> out = candidates == null ? new ArrayList<>() : new ArrayList<>(candidates);
        for (CandidateFilter filter : filters) {
            int before = out.size();
            out = filter.apply(out, context);
            if (log.isDebugEnabled() && out.size() != before) {
                log.debug("filter {} dropped {} of {} candidates", filter.name(), before - out.size(), before);
            }
        }
        return out;
    }

    public List<String> filterNames() {
        List<String> names = new ArrayList<>(filters.size());
        for (CandidateFilter filter : filters) {
            names.add(filter.name());
        }
        return names;
    }
}
