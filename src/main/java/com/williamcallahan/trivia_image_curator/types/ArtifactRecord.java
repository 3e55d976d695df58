package com.williamcallahan.trivia_image_curator.types;

import java.time.Instant;

/**
 * Metadata-store row pointing an entity (a trivia question) at its stored image.
 * Writes are last-write-wins: every successful ingest overwrites all fields.
 *
 * @param entityId    caller-supplied key, e.g. a question id
 * @param publicUrl   public URL of the most recently uploaded object
 * @param storagePath object key inside the bucket
 * @param contentType MIME type the object was stored with
 * @param updatedAt   last write time, null before the row is read back
 */
public record ArtifactRecord(
    String entityId,
    String publicUrl,
    String storagePath,
    String contentType,
    Instant updatedAt
) {
    public ArtifactRecord(String entityId, String publicUrl, String storagePath, String contentType) {
        this(entityId, publicUrl, storagePath, contentType, null);
    }
}
