package com.fyl.ranking.filters;

import com.fyl.ranking.candidate.Candidate;
import java.util.ArrayList;
import java.util.List;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(40)
public class SeenFilter implements CandidateFilter {

    @Override
    public String name() {
        return "previously_seen";
    }

    @Override
    public List<Candidate> apply(List<Candidate> candidates, FilterContext context) {
        if (context.seenPostIds().isEmpty()) {
            return new ArrayList<>(candidates);
        }
        List<Candidate> out = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            if (!context.seenPostIds().contains(candidate.getPostId())) {
                out.add(candidate);
            }
        }
        return out;
    }
}
