/**
 * Turns search hits into an ordered, bounded list of permissive candidates
 *
 * Features:
 * - Resolves every hit concurrently and waits for all of them
 * - Keeps search relevance order regardless of completion order
 * - Truncates to MAX_SEARCH_RESULTS
 */
package com.williamcallahan.trivia_image_curator.service.discovery;

import com.williamcallahan.trivia_image_curator.monitoring.CurationMetrics;
import com.williamcallahan.trivia_image_curator.types.CandidateResolution;
import com.williamcallahan.trivia_image_curator.types.ImageCandidate;
import com.williamcallahan.trivia_image_curator.types.SearchHit;
import com.williamcallahan.trivia_image_curator.util.ExternalApiLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

@Component
@Slf4j
public class CandidateSelector {

    public static final int MAX_SEARCH_RESULTS = 8;

    private final CurationMetrics metrics;

    public CandidateSelector(CurationMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Resolve all hits at once. The list is in hit order; one resolution per hit.
     */
    public Mono<List<CandidateResolution>> resolveAll(List<SearchHit> hits,
                                                      Function<SearchHit, Mono<CandidateResolution>> resolver) {
        if (hits == null || hits.isEmpty()) {
            return Mono.just(Collections.emptyList());
        }
        // concurrency = hits.size() launches every lookup up front; flatMapSequential re-orders on emit
        return Flux.fromIterable(hits)
            .flatMapSequential(resolver, hits.size())
            .collectList();
    }

    /**
     * Resolve, drop non-candidates and truncate.
     *
     * @param query search term the hits came from, for the fan-out summary log
     * @return at most min(MAX_SEARCH_RESULTS, hits.size()) candidates, in hit order
     */
    public Mono<List<ImageCandidate>> select(String query,
                                             List<SearchHit> hits,
                                             Function<SearchHit, Mono<CandidateResolution>> resolver) {
        return resolveAll(hits, resolver).map(resolutions -> {
            List<ImageCandidate> selected = filterAndTruncate(resolutions);
            long resolved = resolutions.stream().filter(CandidateResolution::isResolved).count();
            ExternalApiLogger.logFanOutComplete(log, query, resolutions.size(), (int) resolved, selected.size());
            return selected;
        });
    }

    private List<ImageCandidate> filterAndTruncate(List<CandidateResolution> resolutions) {
        List<ImageCandidate> selected = new ArrayList<>(MAX_SEARCH_RESULTS);
        for (CandidateResolution resolution : resolutions) {
            if (!resolution.isResolved()) {
                metrics.incrementCandidateDropped(resolution.getOutcome());
                continue;
            }
            if (selected.size() < MAX_SEARCH_RESULTS) {
                resolution.getCandidate().ifPresent(selected::add);
            }
        }
        metrics.recordCandidatesSelected(selected.size());
        return selected;
    }
}
