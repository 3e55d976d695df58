package com.williamcallahan.trivia_image_curator.repository;

import com.williamcallahan.trivia_image_curator.types.ArtifactRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JdbcArtifactRecordStoreTest {

    private JdbcTemplate jdbcTemplate;
    private JdbcArtifactRecordStore store;

    @BeforeEach
    void setUp() {
        jdbcTemplate = mock(JdbcTemplate.class);
        store = new JdbcArtifactRecordStore(jdbcTemplate);
    }

    private static final ArtifactRecord RECORD =
        new ArtifactRecord("q42", "https://cdn.example.com/trivia_images/q42.jpg", "trivia_images/q42.jpg", "image/jpeg");

    @Test
    void updateReportsWhetherARowWasChanged() {
        when(jdbcTemplate.update(contains("UPDATE artifact_records"), eq(RECORD.publicUrl()), eq(RECORD.storagePath()),
            eq(RECORD.contentType()), eq("q42"))).thenReturn(1);

        assertTrue(store.updateImage(RECORD));
    }

    @Test
    void updateOfMissingRecordReturnsFalse() {
        when(jdbcTemplate.update(contains("UPDATE artifact_records"), eq(RECORD.publicUrl()), eq(RECORD.storagePath()),
            eq(RECORD.contentType()), eq("q42"))).thenReturn(0);

        assertFalse(store.updateImage(RECORD));
    }

    @Test
    void upsertUsesOnConflict() {
        store.upsertImage(RECORD);

        verify(jdbcTemplate).update(contains("ON CONFLICT (entity_id) DO UPDATE"), eq("q42"), eq(RECORD.publicUrl()),
            eq(RECORD.storagePath()), eq(RECORD.contentType()));
    }

    @Test
    @SuppressWarnings("unchecked")
    void findMapsColumns() throws Exception {
        Instant updatedAt = Instant.parse("2024-05-01T12:00:00Z");
        ResultSet rs = mock(ResultSet.class);
        when(rs.getString("entity_id")).thenReturn("q42");
        when(rs.getString("image_url")).thenReturn(RECORD.publicUrl());
        when(rs.getString("storage_path")).thenReturn(RECORD.storagePath());
        when(rs.getString("content_type")).thenReturn(RECORD.contentType());
        when(rs.getTimestamp("updated_at")).thenReturn(Timestamp.from(updatedAt));
        when(jdbcTemplate.query(anyString(), any(RowMapper.class), eq("q42")))
            .thenAnswer(inv -> List.of(((RowMapper<ArtifactRecord>) inv.getArgument(1)).mapRow(rs, 0)));

        Optional<ArtifactRecord> found = store.findByEntityId("q42");

        assertTrue(found.isPresent());
        assertEquals(RECORD.publicUrl(), found.get().publicUrl());
        assertEquals(updatedAt, found.get().updatedAt());
    }

    @Test
    @SuppressWarnings("unchecked")
    void findOfUnknownEntityIsEmpty() {
        when(jdbcTemplate.query(anyString(), any(RowMapper.class), eq("nope"))).thenReturn(List.of());

        assertFalse(store.findByEntityId("nope").isPresent());
    }

    @Test
    void referencedPathsAreDistinct() {
        when(jdbcTemplate.queryForList(anyString(), eq(String.class)))
            .thenReturn(List.of("trivia_images/a.jpg", "trivia_images/a.jpg", "trivia_images/b.png"));

        assertEquals(2, store.findReferencedStoragePaths().size());
    }
}
