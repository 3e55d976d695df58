package com.williamcallahan.trivia_image_curator.service.ingest;

import com.williamcallahan.trivia_image_curator.config.CurationProperties;
import com.williamcallahan.trivia_image_curator.monitoring.CurationMetrics;
import com.williamcallahan.trivia_image_curator.repository.ArtifactRecordStore;
import com.williamcallahan.trivia_image_curator.service.S3StorageService;
import com.williamcallahan.trivia_image_curator.service.image.WatermarkService;
import com.williamcallahan.trivia_image_curator.testutil.CommonsStubs;
import com.williamcallahan.trivia_image_curator.types.ArtifactRecord;
import com.williamcallahan.trivia_image_curator.types.IngestOptions;
import com.williamcallahan.trivia_image_curator.types.IngestionStage;
import com.williamcallahan.trivia_image_curator.types.ProcessedImage;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ImageIngestionServiceTest {

    private static final long NOW_MILLIS = 1_700_000_000_000L;
    private static final byte[] JPEG_BYTES = "jpeg-bytes".getBytes(StandardCharsets.UTF_8);
    private static final byte[] PNG_BYTES = "png-bytes".getBytes(StandardCharsets.UTF_8);
    private static final String PNG_PAYLOAD = "data:image/png;base64," + Base64.getEncoder().encodeToString(PNG_BYTES);

    private S3StorageService s3StorageService;
    private ArtifactRecordStore artifactRecordStore;
    private WatermarkService watermarkService;
    private CurationProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private AtomicInteger httpCalls;

    @BeforeEach
    void setUp() {
        s3StorageService = mock(S3StorageService.class);
        artifactRecordStore = mock(ArtifactRecordStore.class);
        watermarkService = mock(WatermarkService.class);
        properties = new CurationProperties();
        meterRegistry = new SimpleMeterRegistry();
        httpCalls = new AtomicInteger();
    }

    private ImageIngestionService service(Function<ClientRequest, Mono<ClientResponse>> http) {
        return service(http, s3StorageService);
    }

    private ImageIngestionService service(Function<ClientRequest, Mono<ClientResponse>> http, S3StorageService storage) {
        return new ImageIngestionService(
            CommonsStubs.webClient(request -> {
                httpCalls.incrementAndGet();
                return http.apply(request);
            }),
            storage,
            artifactRecordStore,
            new InlinePayloadDecoder(),
            watermarkService,
            properties,
            new CurationMetrics(meterRegistry),
            Clock.fixed(Instant.ofEpochMilli(NOW_MILLIS), ZoneOffset.UTC));
    }

    private ImageIngestionService serviceServingJpeg() {
        return service(request -> CommonsStubs.image(JPEG_BYTES, "image/jpeg; charset=binary"));
    }

    private void storageReturnsPublicUrl() {
        when(s3StorageService.uploadFileAsync(anyString(), any(byte[].class), anyString()))
            .thenAnswer(inv -> CompletableFuture.completedFuture("https://cdn.example.com/" + inv.getArgument(0)));
    }

    @Test
    void ingestFromUrlUploadsOnceUpdatesRecordOnceAndReturnsStorageUrl() {
        storageReturnsPublicUrl();
        when(artifactRecordStore.updateImage(any(ArtifactRecord.class))).thenReturn(true);

        String publicUrl = serviceServingJpeg().ingestFromUrl("https://example.org/img.jpg", "q42").block();

        assertEquals("https://cdn.example.com/trivia_images/q42.jpg", publicUrl);
        verify(s3StorageService, times(1)).uploadFileAsync(eq("trivia_images/q42.jpg"), any(byte[].class), eq("image/jpeg"));
        ArgumentCaptor<ArtifactRecord> record = ArgumentCaptor.forClass(ArtifactRecord.class);
        verify(artifactRecordStore, times(1)).updateImage(record.capture());
        assertEquals("q42", record.getValue().entityId());
        assertEquals(publicUrl, record.getValue().publicUrl());
        assertEquals("trivia_images/q42.jpg", record.getValue().storagePath());
        assertEquals(1.0, meterRegistry.counter("curation.ingest.success", "mode", "url").count());
    }

    @Test
    void ingestFromUrlUploadsTheDownloadedBytes() {
        storageReturnsPublicUrl();
        when(artifactRecordStore.updateImage(any(ArtifactRecord.class))).thenReturn(true);

        serviceServingJpeg().ingestFromUrl("https://upload.wikimedia.org/a/b/Photo.JPG?download=1", "q7").block();

        ArgumentCaptor<byte[]> bytes = ArgumentCaptor.forClass(byte[].class);
        verify(s3StorageService).uploadFileAsync(eq("trivia_images/q7.jpg"), bytes.capture(), eq("image/jpeg"));
        assertArrayEquals(JPEG_BYTES, bytes.getValue());
    }

    @Test
    void failedDownloadIsFatalAndWritesNothing() {
        ImageIngestionService service = service(request -> CommonsStubs.status(HttpStatus.NOT_FOUND));

        StepVerifier.create(service.ingestFromUrl("https://example.org/missing.jpg", "q42"))
            .expectErrorSatisfies(e -> {
                IngestTransportException transport = (IngestTransportException) e;
                assertEquals(404, transport.getStatusCode());
                assertEquals(IngestionStage.FETCH, transport.getStage());
            })
            .verify();

        verifyNoInteractions(s3StorageService, artifactRecordStore);
        assertEquals(1.0, meterRegistry.counter("curation.ingest.failure", "mode", "url", "stage", "fetch").count());
    }

    @Test
    void uploadFailureIsFatalAndLeavesRecordUntouched() {
        when(s3StorageService.uploadFileAsync(anyString(), any(byte[].class), anyString()))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("bucket unavailable")));

        StepVerifier.create(serviceServingJpeg().ingestFromUrl("https://example.org/img.jpg", "q42"))
            .expectErrorSatisfies(e -> assertEquals("trivia_images/q42.jpg", ((StorageWriteException) e).getStoragePath()))
            .verify();

        verifyNoInteractions(artifactRecordStore);
    }

    @Test
    void missingStorageFailsAtUpload() {
        StepVerifier.create(service(request -> CommonsStubs.image(JPEG_BYTES, "image/jpeg"), null)
                .ingestFromUrl("https://example.org/img.jpg", "q42"))
            .expectError(StorageWriteException.class)
            .verify();

        verifyNoInteractions(artifactRecordStore);
    }

    @Test
    void missingRecordSurfacesAsOrphanedObject() {
        storageReturnsPublicUrl();
        when(artifactRecordStore.updateImage(any(ArtifactRecord.class))).thenReturn(false);

        StepVerifier.create(serviceServingJpeg().ingestFromUrl("https://example.org/img.jpg", "q42"))
            .expectErrorSatisfies(e -> {
                OrphanedObjectException orphan = (OrphanedObjectException) e;
                assertEquals("q42", orphan.getEntityId());
                assertEquals("trivia_images/q42.jpg", orphan.getStoragePath());
                assertEquals("https://cdn.example.com/trivia_images/q42.jpg", orphan.getPublicUrl());
                assertEquals("image/jpeg", orphan.getContentType());
                assertEquals(IngestionStage.PERSIST, orphan.getStage());
            })
            .verify();
    }

    @Test
    void metadataStoreFailureSurfacesAsOrphanedObject() {
        storageReturnsPublicUrl();
        when(artifactRecordStore.updateImage(any(ArtifactRecord.class)))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));

        StepVerifier.create(serviceServingJpeg().ingestFromUrl("https://example.org/img.jpg", "q42"))
            .expectErrorSatisfies(e -> assertEquals(DataAccessResourceFailureException.class, e.getCause().getClass()))
            .verify();
        verify(s3StorageService, times(1)).uploadFileAsync(anyString(), any(byte[].class), anyString());
    }

    @Test
    void createMissingRecordsUpsertsInsteadOfUpdating() {
        properties.getMetadata().setCreateMissingRecords(true);
        storageReturnsPublicUrl();

        serviceServingJpeg().ingestFromUrl("https://example.org/img.png", "q9").block();

        verify(artifactRecordStore).upsertImage(any(ArtifactRecord.class));
        verify(artifactRecordStore, never()).updateImage(any(ArtifactRecord.class));
    }

    @Test
    void inlinePayloadWithoutDataPrefixFailsBeforeAnyIo() {
        ImageIngestionService service = serviceServingJpeg();

        StepVerifier.create(service.ingestFromInlinePayload("q42", "image/png;base64,aGVsbG8=", IngestOptions.withWatermark()))
            .expectError(PayloadFormatException.class)
            .verify();

        verifyNoInteractions(s3StorageService, artifactRecordStore, watermarkService);
        assertEquals(0, httpCalls.get());
        assertEquals(1.0, meterRegistry.counter("curation.ingest.failure", "mode", "inline", "stage", "decode").count());
    }

    @Test
    void inlinePayloadIsStoredUnderTimestampedKeyWithDeclaredType() {
        storageReturnsPublicUrl();
        when(artifactRecordStore.updateImage(any(ArtifactRecord.class))).thenReturn(true);

        String publicUrl = serviceServingJpeg()
            .ingestFromInlinePayload("q7", PNG_PAYLOAD, IngestOptions.withoutWatermark()).block();

        String expectedKey = "trivia_images/q7_upload_" + NOW_MILLIS + ".png";
        assertEquals("https://cdn.example.com/" + expectedKey, publicUrl);
        ArgumentCaptor<byte[]> bytes = ArgumentCaptor.forClass(byte[].class);
        verify(s3StorageService).uploadFileAsync(eq(expectedKey), bytes.capture(), eq("image/png"));
        assertArrayEquals(PNG_BYTES, bytes.getValue());
        verifyNoInteractions(watermarkService);
        assertEquals(0, httpCalls.get());
    }

    @Test
    void watermarkedBytesAreUploadedWhenCompositingSucceeds() {
        storageReturnsPublicUrl();
        when(artifactRecordStore.updateImage(any(ArtifactRecord.class))).thenReturn(true);
        byte[] watermarked = "watermarked".getBytes(StandardCharsets.UTF_8);
        when(watermarkService.applyWatermarkAsync(any(byte[].class), eq("image/png"), eq("q7")))
            .thenReturn(Mono.just(new ProcessedImage(watermarked, "image/png", 10, 10)));

        serviceServingJpeg().ingestFromInlinePayload("q7", PNG_PAYLOAD, IngestOptions.withWatermark()).block();

        ArgumentCaptor<byte[]> bytes = ArgumentCaptor.forClass(byte[].class);
        verify(s3StorageService).uploadFileAsync(anyString(), bytes.capture(), eq("image/png"));
        assertArrayEquals(watermarked, bytes.getValue());
    }

    @Test
    void watermarkFailureFallsBackToOriginalBytes() {
        storageReturnsPublicUrl();
        when(artifactRecordStore.updateImage(any(ArtifactRecord.class))).thenReturn(true);
        when(watermarkService.applyWatermarkAsync(any(byte[].class), anyString(), anyString()))
            .thenReturn(Mono.just(new ProcessedImage("Watermark asset could not be read")));

        String publicUrl = serviceServingJpeg()
            .ingestFromInlinePayload("q7", PNG_PAYLOAD, IngestOptions.withWatermark()).block();

        ArgumentCaptor<byte[]> bytes = ArgumentCaptor.forClass(byte[].class);
        verify(s3StorageService).uploadFileAsync(anyString(), bytes.capture(), eq("image/png"));
        assertArrayEquals(PNG_BYTES, bytes.getValue());
        assertEquals("https://cdn.example.com/trivia_images/q7_upload_" + NOW_MILLIS + ".png", publicUrl);
        assertEquals(1.0, meterRegistry.counter("curation.ingest.watermark_fallbacks").count());
    }

    @Test
    void watermarkErrorSignalAlsoFallsBack() {
        storageReturnsPublicUrl();
        when(artifactRecordStore.updateImage(any(ArtifactRecord.class))).thenReturn(true);
        when(watermarkService.applyWatermarkAsync(any(byte[].class), anyString(), anyString()))
            .thenReturn(Mono.error(new IllegalStateException("executor rejected")));

        StepVerifier.create(serviceServingJpeg().ingestFromInlinePayload("q7", PNG_PAYLOAD, IngestOptions.withWatermark()))
            .expectNext("https://cdn.example.com/trivia_images/q7_upload_" + NOW_MILLIS + ".png")
            .verifyComplete();
    }

    @Test
    void reattachRetriesOnlyTheRecordUpdate() {
        when(artifactRecordStore.updateImage(any(ArtifactRecord.class))).thenReturn(true);
        OrphanedObjectException orphan = new OrphanedObjectException("q42", "trivia_images/q42.jpg",
            "https://cdn.example.com/trivia_images/q42.jpg", "image/jpeg", "record update failed", null);

        String publicUrl = serviceServingJpeg().reattach(orphan).block();

        assertEquals("https://cdn.example.com/trivia_images/q42.jpg", publicUrl);
        verify(artifactRecordStore).updateImage(new ArtifactRecord("q42", publicUrl, "trivia_images/q42.jpg", "image/jpeg"));
        verifyNoInteractions(s3StorageService);
        assertEquals(0, httpCalls.get());
    }

    @Test
    void blankEntityIdIsRejected() {
        StepVerifier.create(serviceServingJpeg().ingestFromUrl("https://example.org/img.jpg", " "))
            .expectError(IllegalArgumentException.class)
            .verify();
        assertEquals(0, httpCalls.get());
    }
}
