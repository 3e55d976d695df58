/**
 * Client for the Wikimedia Commons full-text search
 *
 * Features:
 * - Searches the File namespace only
 * - Requests twice the selection limit so license rejections leave headroom
 * - Degrades every failure to an empty hit list
 */
package com.williamcallahan.trivia_image_curator.service.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.trivia_image_curator.config.CurationProperties;
import com.williamcallahan.trivia_image_curator.monitoring.CurationMetrics;
import com.williamcallahan.trivia_image_curator.types.SearchHit;
import com.williamcallahan.trivia_image_curator.util.ExternalApiLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Service
@Slf4j
public class WikimediaSearchClient {

    static final int FILE_NAMESPACE = 6;
    static final int SEARCH_LIMIT = 2 * CandidateSelector.MAX_SEARCH_RESULTS;

    private final WebClient webClient;
    private final String apiUrl;
    private final Duration timeout;
    private final CurationMetrics metrics;

    public WikimediaSearchClient(WebClient.Builder webClientBuilder,
                                 CurationProperties properties,
                                 CurationMetrics metrics) {
        this.webClient = webClientBuilder.build();
        this.apiUrl = properties.getWikimedia().getApiUrl();
        this.timeout = properties.getWikimedia().getTimeout();
        this.metrics = metrics;
    }

    /**
     * Search Commons files for a term, in upstream relevance order.
     *
     * @param term query text, used verbatim
     * @return hits, or an empty list on a blank term, zero results or any failure; never errors
     */
    public Mono<List<SearchHit>> search(String term) {
        if (term == null || term.isBlank()) {
            return Mono.just(Collections.emptyList());
        }
        // expanded variables are strictly encoded; a literal '+' would reach MediaWiki as a space
        URI uri = UriComponentsBuilder.fromUriString(apiUrl)
            .queryParam("action", "query")
            .queryParam("list", "search")
            .queryParam("srsearch", "{term}")
            .queryParam("srnamespace", FILE_NAMESPACE)
            .queryParam("srlimit", SEARCH_LIMIT)
            .queryParam("format", "json")
            .encode()
            .buildAndExpand(term)
            .toUri();

        metrics.incrementSearch();
        ExternalApiLogger.logApiCallAttempt(log, "WikimediaCommons", "SEARCH", term);
        ExternalApiLogger.logHttpRequest(log, "GET", uri.toString());

        return webClient.get()
            .uri(uri)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(timeout)
            .map(WikimediaSearchClient::parseHits)
            .defaultIfEmpty(Collections.emptyList())
            .doOnNext(hits -> ExternalApiLogger.logApiCallSuccess(log, "WikimediaCommons", "SEARCH", term, hits.size()))
            .onErrorResume(e -> {
                String reason = e instanceof WebClientResponseException wcre
                    ? "HTTP " + wcre.getStatusCode().value()
                    : e.getClass().getSimpleName() + ": " + e.getMessage();
                ExternalApiLogger.logApiCallFailure(log, "WikimediaCommons", "SEARCH", term, reason);
                metrics.incrementSearchFailure();
                return Mono.just(Collections.emptyList());
            });
    }

    static List<SearchHit> parseHits(JsonNode body) {
        JsonNode results = body.path("query").path("search");
        if (!results.isArray()) {
            return Collections.emptyList();
        }
        List<SearchHit> hits = new ArrayList<>(results.size());
        for (JsonNode result : results) {
            String title = result.path("title").asText("");
            if (!title.isEmpty()) {
                hits.add(new SearchHit(title));
            }
        }
        return hits;
    }
}
