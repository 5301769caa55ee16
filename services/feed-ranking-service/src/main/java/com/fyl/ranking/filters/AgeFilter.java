package com.fyl.ranking.filters;

import com.fyl.ranking.candidate.Candidate;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(20)
public class AgeFilter implements CandidateFilter {

    @Override
    public String name() {
        return "max_age";
    }

    @Override
    public List<Candidate> apply(List<Candidate> candidates, FilterContext context) {
        if (context.maxAge() == null) {
            return new ArrayList<>(candidates);
        }
        Instant cutoff = context.now().minus(context.maxAge());
        List<Candidate> out = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            if (!candidate.getPost().createdAt().isBefore(cutoff)) {
                out.add(candidate);
            }
        }
        return out;
    }
}
