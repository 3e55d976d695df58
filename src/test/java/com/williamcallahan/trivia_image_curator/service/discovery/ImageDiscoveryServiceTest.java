package com.williamcallahan.trivia_image_curator.service.discovery;

import com.williamcallahan.trivia_image_curator.monitoring.CurationMetrics;
import com.williamcallahan.trivia_image_curator.types.CandidateResolution;
import com.williamcallahan.trivia_image_curator.types.ImageCandidate;
import com.williamcallahan.trivia_image_curator.types.SearchHit;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ImageDiscoveryServiceTest {

    private WikimediaSearchClient searchClient;
    private WikimediaMetadataFetcher metadataFetcher;
    private ImageDiscoveryService discoveryService;

    @BeforeEach
    void setUp() {
        searchClient = mock(WikimediaSearchClient.class);
        metadataFetcher = mock(WikimediaMetadataFetcher.class);
        discoveryService = new ImageDiscoveryService(searchClient, metadataFetcher,
            new CandidateSelector(new CurationMetrics(new SimpleMeterRegistry())));
    }

    @Test
    void buildsQuotedTitleAndAuthorTerm() {
        assertEquals("\"The Starry Night\" \"Vincent van Gogh\"",
            ImageDiscoveryService.buildSearchTerm(" The Starry Night ", "Vincent van Gogh"));
        assertEquals("\"Eiffel Tower\"", ImageDiscoveryService.buildSearchTerm("Eiffel Tower", " "));
        assertEquals("", ImageDiscoveryService.buildSearchTerm(null, "anyone"));
    }

    @Test
    void findCandidatesRunsSearchThenKeepsOnlyResolvedHits() {
        when(searchClient.search("\"Sunflowers\" \"Van Gogh\"")).thenReturn(Mono.just(List.of(
            new SearchHit("File:Sunflowers.jpg"), new SearchHit("File:Poster.jpg"))));
        ImageCandidate sunflowers = new ImageCandidate("page", "thumb", "full", "Public domain", "File:Sunflowers.jpg");
        when(metadataFetcher.resolve(new SearchHit("File:Sunflowers.jpg")))
            .thenReturn(Mono.just(CandidateResolution.resolved(sunflowers)));
        when(metadataFetcher.resolve(new SearchHit("File:Poster.jpg")))
            .thenReturn(Mono.just(CandidateResolution.licenseRejected("File:Poster.jpg", "Copyrighted")));

        StepVerifier.create(discoveryService.findCandidates("Sunflowers", "Van Gogh"))
            .assertNext(candidates -> assertThat(candidates).containsExactly(sunflowers))
            .verifyComplete();
    }

    @Test
    void moreThanEightPermissiveHitsAreTruncatedInSearchOrder() {
        List<SearchHit> twelve = IntStream.range(0, 12)
            .mapToObj(i -> new SearchHit("File:Tower " + i + ".jpg"))
            .collect(Collectors.toList());
        when(searchClient.search("\"Eiffel Tower\"")).thenReturn(Mono.just(twelve));
        when(metadataFetcher.resolve(any())).thenAnswer(invocation -> {
            SearchHit hit = invocation.getArgument(0);
            return Mono.just(CandidateResolution.resolved(
                new ImageCandidate("page", "thumb", "full", "CC0", hit.title())));
        });

        List<ImageCandidate> candidates = discoveryService.findCandidates("Eiffel Tower", null).block();

        assertThat(candidates).extracting(ImageCandidate::title).containsExactly(
            "File:Tower 0.jpg", "File:Tower 1.jpg", "File:Tower 2.jpg", "File:Tower 3.jpg",
            "File:Tower 4.jpg", "File:Tower 5.jpg", "File:Tower 6.jpg", "File:Tower 7.jpg");
    }

    @Test
    void failedSearchYieldsNoCandidatesWithoutMetadataLookups() {
        when(searchClient.search(anyString())).thenReturn(Mono.just(Collections.emptyList()));

        StepVerifier.create(discoveryService.findCandidatesForTerm("obscure"))
            .assertNext(candidates -> assertThat(candidates).isEmpty())
            .verifyComplete();
        verify(metadataFetcher, never()).resolve(any());
    }

    @Test
    void blankTitleSkipsSearch() {
        StepVerifier.create(discoveryService.findCandidates("   ", "Someone"))
            .assertNext(candidates -> assertThat(candidates).isEmpty())
            .verifyComplete();
        verify(searchClient, never()).search(anyString());
    }
}
