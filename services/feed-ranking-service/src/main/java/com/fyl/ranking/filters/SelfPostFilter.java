package com.fyl.ranking.filters;

import com.fyl.ranking.candidate.Candidate;
import java.util.ArrayList;
import java.util.List;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(30)
public class SelfPostFilter implements CandidateFilter {

    @Override
    public String name() {
        return "self_post";
    }

    @Override
    public List<Candidate> apply(List<Candidate> candidates, FilterContext context) {
        List<Candidate> out = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            if (!candidate.getAuthorId().equals(context.viewerId())) {
                out.add(candidate);
            }
        }
        return out;
    }
}
