package com.fyl.ranking.external;

import com.fyl.ranking.candidate.Candidate;
import java.util.List;

/**
 * Optional third-party content injected as out-of-network candidates. Callers check
 * {@link #isAvailable()} first; {@link #fetch(int)} returns an empty list on any failure and never
 * throws.
 */
public interface ExternalContentSource {
    String name();

    boolean isAvailable();

    List<Candidate> fetch(int limit);
}
