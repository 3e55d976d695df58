package com.williamcallahan.trivia_image_curator.service.discovery;

import com.williamcallahan.trivia_image_curator.types.ImageCandidate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.List;

/**
 * Discovery entry point: search Commons, resolve hits, return permissive candidates.
 * Never errors; failures surface as fewer (or zero) candidates.
 */
@Service
public class ImageDiscoveryService {

    private final WikimediaSearchClient searchClient;
    private final WikimediaMetadataFetcher metadataFetcher;
    private final CandidateSelector candidateSelector;

    public ImageDiscoveryService(WikimediaSearchClient searchClient,
                                 WikimediaMetadataFetcher metadataFetcher,
                                 CandidateSelector candidateSelector) {
        this.searchClient = searchClient;
        this.metadataFetcher = metadataFetcher;
        this.candidateSelector = candidateSelector;
    }

    /**
     * Search with a quoted title and, when present, a quoted author.
     */
    public Mono<List<ImageCandidate>> findCandidates(String title, String author) {
        return findCandidatesForTerm(buildSearchTerm(title, author));
    }

    public Mono<List<ImageCandidate>> findCandidatesForTerm(String term) {
        if (term == null || term.isBlank()) {
            return Mono.just(Collections.emptyList());
        }
        return searchClient.search(term)
            .flatMap(hits -> candidateSelector.select(term, hits, metadataFetcher::resolve));
    }

    static String buildSearchTerm(String title, String author) {
        if (title == null || title.isBlank()) {
            return "";
        }
        String term = "\"" + title.trim() + "\"";
        if (author != null && !author.isBlank()) {
            term += " \"" + author.trim() + "\"";
        }
        return term;
    }
}
