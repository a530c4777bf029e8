package com.adlanda.channelknowledge.repository;

import com.adlanda.channelknowledge.exception.IndexUnavailableException;
import com.adlanda.channelknowledge.model.Chunk;
import com.adlanda.channelknowledge.model.IndexMetadata;
import com.adlanda.channelknowledge.model.IndexQuery;
import com.adlanda.channelknowledge.model.SearchHit;
import com.adlanda.channelknowledge.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

/**
 * Unit tests for PgVectorIndex.
 * Verifies the SQL issued for dedup, expiry and deletion, and the mapping of
 * data-access failures.
 */
@ExtendWith(MockitoExtension.class)
class PgVectorIndexTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 10, 17);

    @Mock
    private JdbcTemplate jdbcTemplate;

    private PgVectorIndex index;

    @BeforeEach
    void setUp() {
        index = new PgVectorIndex(jdbcTemplate, new ObjectMapper(), new FreshnessRanker(0.4, 0.1, 365),
                MutableClock.at("2026-10-17T09:00:00Z"), "index_entries", 3);
    }

    @Test
    void constructor_rejectsUnsafeTableName() {
        assertThatThrownBy(() -> new PgVectorIndex(jdbcTemplate, new ObjectMapper(), new FreshnessRanker(0.4, 0.1, 365),
                MutableClock.at("2026-10-17T09:00:00Z"), "entries; DROP TABLE x", 3))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void upsert_newChunk_insertsRow() {
        UUID id = index.upsert(chunk("channel:42", "hash-a"), new float[]{1f, 0f, 0f},
                Map.of(IndexMetadata.CHANNEL_ID, 42L, IndexMetadata.MESSAGE_ID, 7L));

        assertThat(id).isNotNull();
        verify(jdbcTemplate).update(startsWith("INSERT INTO index_entries"), any(Object[].class));
        verify(jdbcTemplate, never()).update(contains("metadata = metadata ||"), any(Object[].class));
    }

    @Test
    void upsert_duplicateHash_mergesMetadataInsteadOfInserting() {
        UUID existing = UUID.randomUUID();
        when(jdbcTemplate.queryForList(startsWith("SELECT id FROM index_entries WHERE source = ?"), eq(UUID.class),
                any(Object[].class))).thenReturn(List.of(existing));

        UUID id = index.upsert(chunk("channel:42", "hash-a"), new float[]{1f, 0f, 0f},
                Map.of(IndexMetadata.VIEWS, 900));

        assertThat(id).isEqualTo(existing);
        verify(jdbcTemplate).update(contains("metadata = metadata ||"), eq("{\"views\":900}"), eq(TODAY), eq(existing));
        verify(jdbcTemplate, never()).update(startsWith("INSERT"), any(Object[].class));
    }

    @Test
    void upsert_wrongDimensions_throws() {
        assertThatThrownBy(() -> index.upsert(chunk("doc.md", "h"), new float[]{1f, 0f}, Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("3 dimensions");
    }

    @Test
    void upsert_databaseDown_throwsIndexUnavailable() {
        when(jdbcTemplate.queryForList(anyString(), eq(UUID.class), any(Object[].class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> index.upsert(chunk("doc.md", "h"), new float[]{1f, 0f, 0f}, Map.of()))
                .isInstanceOf(IndexUnavailableException.class);
    }

    @Test
    void search_ranksCandidatesFromDatabase() {
        FreshnessRanker.Candidate close = new FreshnessRanker.Candidate(UUID.randomUUID(), chunk("a.md", "h1"), Map.of(), 0.9);
        FreshnessRanker.Candidate far = new FreshnessRanker.Candidate(UUID.randomUUID(), chunk("b.md", "h2"), Map.of(), 0.1);
        when(jdbcTemplate.query(anyString(), ArgumentMatchers.<RowMapper<FreshnessRanker.Candidate>>any(), any(Object[].class)))
                .thenReturn(List.of(far, close));

        List<SearchHit> hits = index.search(IndexQuery.of(new float[]{1f, 0f, 0f}, 5));

        assertThat(hits).extracting(hit -> hit.chunk().sourceId()).containsExactly("a.md");
    }

    @Test
    void search_databaseDown_throwsInsteadOfReturningEmpty() {
        when(jdbcTemplate.query(anyString(), ArgumentMatchers.<RowMapper<FreshnessRanker.Candidate>>any(), any(Object[].class)))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> index.search(IndexQuery.of(new float[]{1f, 0f, 0f}, 5)))
                .isInstanceOf(IndexUnavailableException.class);
    }

    @Test
    void expire_deletesRowsPastExpiry() {
        when(jdbcTemplate.update(anyString(), any(Object[].class))).thenReturn(4);

        assertThat(index.expire()).isEqualTo(4);
        verify(jdbcTemplate).update(
                "DELETE FROM index_entries WHERE expires_date IS NOT NULL AND expires_date < ?",
                TODAY);
    }

    @Test
    void deleteBySource_executesCorrectSql() {
        when(jdbcTemplate.update(anyString(), eq("docs/guide.md"))).thenReturn(5);

        int deleted = index.deleteBySource("docs/guide.md");

        assertThat(deleted).isEqualTo(5);
        verify(jdbcTemplate).update("DELETE FROM index_entries WHERE source = ?", "docs/guide.md");
    }

    @Test
    void size_countsRows() {
        when(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM index_entries", Long.class)).thenReturn(12L);

        assertThat(index.size()).isEqualTo(12L);
    }

    @Test
    void toVectorLiteral_formatsPgvectorText() {
        assertThat(PgVectorIndex.toVectorLiteral(new float[]{1f, 0.5f, -2f})).isEqualTo("[1.0,0.5,-2.0]");
    }

    private static Chunk chunk(String source, String hash) {
        return new Chunk(0, source, null, "content for " + source, "training", TODAY.minusDays(1), TODAY, null, hash);
    }
}
