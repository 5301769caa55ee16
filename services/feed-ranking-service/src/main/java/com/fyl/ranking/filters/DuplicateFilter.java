package com.fyl.ranking.filters;

import com.fyl.ranking.candidate.Candidate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(10)
public class DuplicateFilter implements CandidateFilter {

    @Override
    public String name() {
        return "drop_duplicates";
    }

    @Override
    public List<Candidate> apply(List<Candidate> candidates, FilterContext context) {
        Set<String> seen = new HashSet<>();
        List<Candidate> out = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            if (seen.add(candidate.getPostId())) {
                out.add(candidate);
            }
        }
        return out;
    }
}
