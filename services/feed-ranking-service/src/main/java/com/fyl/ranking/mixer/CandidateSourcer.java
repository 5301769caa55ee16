package com.fyl.ranking.mixer;

import com.fyl.ranking.candidate.Candidate;
import com.fyl.ranking.external.ExternalContentSource;
import com.fyl.ranking.sources.InNetworkSource;
import com.fyl.ranking.sources.OutOfNetworkSource;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Concatenates the candidate pools: in-network, then out-of-network, then any available external
 * source. The order only seeds scorer input; scoring decides the feed order.
 */
@Component
public class CandidateSourcer {
    private static final Logger log = LoggerFactory.getLogger(CandidateSourcer.class);

    private final InNetworkSource inNetworkSource;
    private final OutOfNetworkSource outOfNetworkSource;
    private final List<ExternalContentSource> externalSources;
    private final MixerProperties properties;

    public CandidateSourcer(
        InNetworkSource inNetworkSource,
        OutOfNetworkSource outOfNetworkSource,
        List<ExternalContentSource> externalSources,
        MixerProperties properties
    ) {
        this.inNetworkSource = inNetworkSource;
        this.outOfNetworkSource = outOfNetworkSource;
        this.externalSources = externalSources == null ? List.of() : List.copyOf(externalSources);
        this.properties = properties;
    }

    public List<Candidate> followingOnly(String viewerId) {
        return inNetworkSource.fetch(viewerId, properties.getLimitPerAuthor(), properties.getLimitInNetworkFollowingOnly());
    }

    public List<Candidate> forYou(String viewerId) {
        List<Candidate> inNetwork = inNetworkSource.fetch(
            viewerId,
            properties.getLimitPerAuthor(),
            properties.getLimitInNetwork()
        );
        List<Candidate> outOfNetwork = outOfNetworkSource.fetch(viewerId, properties.getLimitOutOfNetwork());

        List<Candidate> merged = new ArrayList<>(inNetwork.size() + outOfNetwork.size());
        merged.addAll(inNetwork);
        merged.addAll(outOfNetwork);
        for (ExternalContentSource source : externalSources) {
            if (!source.isAvailable()) {
                continue;
            }
            List<Candidate> external = source.fetch(properties.getExternalLimit());
            log.debug("external source {} contributed {} candidates", source.name(), external.size());
            merged.addAll(external);
        }
        log.debug("sourced {} in-network and {} out-of-network candidates for {}", inNetwork.size(), outOfNetwork.size(), viewerId);
        return merged;
    }
}
