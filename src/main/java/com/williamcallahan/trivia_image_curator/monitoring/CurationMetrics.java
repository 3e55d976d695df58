/**
 * Metrics for image discovery and ingestion
 * Provides counters and timers for monitoring the curation pipeline
 */

package com.williamcallahan.trivia_image_curator.monitoring;

import com.williamcallahan.trivia_image_curator.types.CandidateResolution;
import com.williamcallahan.trivia_image_curator.types.IngestionMode;
import com.williamcallahan.trivia_image_curator.types.IngestionStage;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.util.Locale;

@Service
public class CurationMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter searches;
    private final Counter searchFailures;
    private final Counter candidatesSelected;
    private final Counter watermarkFallbacks;
    private final Timer s3UploadTimer;

    public CurationMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.searches = Counter.builder("curation.discovery.searches")
            .description("Number of Commons searches issued")
            .register(meterRegistry);

        this.searchFailures = Counter.builder("curation.discovery.search_failures")
            .description("Searches that degraded to zero hits because of a transport or response error")
            .register(meterRegistry);

        this.candidatesSelected = Counter.builder("curation.discovery.candidates")
            .description("Candidates returned to callers after license filtering and truncation")
            .register(meterRegistry);

        this.watermarkFallbacks = Counter.builder("curation.ingest.watermark_fallbacks")
            .description("Uploads that proceeded without a watermark because compositing failed")
            .register(meterRegistry);

        this.s3UploadTimer = Timer.builder("curation.s3.upload.duration")
            .description("Duration of image uploads to object storage")
            .register(meterRegistry);
    }

    public void incrementSearch() {
        searches.increment();
    }

    public void incrementSearchFailure() {
        searchFailures.increment();
    }

    public void recordCandidatesSelected(int count) {
        candidatesSelected.increment(count);
    }

    /**
     * Counts a hit that did not become a candidate, tagged by why.
     */
    public void incrementCandidateDropped(CandidateResolution.Outcome outcome) {
        meterRegistry.counter("curation.discovery.dropped", "outcome", outcome.name().toLowerCase(Locale.ROOT)).increment();
    }

    public void incrementIngestSuccess(IngestionMode mode) {
        meterRegistry.counter("curation.ingest.success", "mode", mode.name().toLowerCase(Locale.ROOT)).increment();
    }

    public void incrementIngestFailure(IngestionMode mode, IngestionStage stage) {
        meterRegistry.counter("curation.ingest.failure",
            "mode", mode.name().toLowerCase(Locale.ROOT),
            "stage", stage.name().toLowerCase(Locale.ROOT)).increment();
    }

    public void incrementWatermarkFallback() {
        watermarkFallbacks.increment();
    }

    public Timer.Sample startS3Timer() {
        return Timer.start(meterRegistry);
    }

    public void stopS3Timer(Timer.Sample sample) {
        sample.stop(s3UploadTimer);
    }
}
