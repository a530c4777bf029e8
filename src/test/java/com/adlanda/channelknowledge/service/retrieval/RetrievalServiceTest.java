package com.adlanda.channelknowledge.service.retrieval;

import com.adlanda.channelknowledge.exception.EmbeddingException;
import com.adlanda.channelknowledge.exception.IndexUnavailableException;
import com.adlanda.channelknowledge.model.Chunk;
import com.adlanda.channelknowledge.model.IndexMetadata;
import com.adlanda.channelknowledge.model.IndexQuery;
import com.adlanda.channelknowledge.model.RetrievalResponse;
import com.adlanda.channelknowledge.model.SearchHit;
import com.adlanda.channelknowledge.model.Snippet;
import com.adlanda.channelknowledge.repository.VectorIndex;
import com.adlanda.channelknowledge.service.Embedder;
import com.adlanda.channelknowledge.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RetrievalServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 10, 17);
    private static final float[] QUERY_VECTOR = {1f, 0f};

    @Mock
    private Embedder embedder;

    @Mock
    private VectorIndex vectorIndex;

    private RetrievalService service;

    @BeforeEach
    void setUp() {
        service = new RetrievalService(embedder, vectorIndex, new PatternRelevanceFilter(),
                MutableClock.at("2026-10-17T09:00:00Z"));
    }

    @Test
    void query_requestsTwiceTopKAndWithholdsDenylistedSnippets() {
        when(embedder.embed("how to follow up")).thenReturn(QUERY_VECTOR);
        when(vectorIndex.search(any(IndexQuery.class))).thenReturn(List.of(
                hit("channel:1", "Follow up within two days.", 0.91, TODAY.minusDays(3), "Sales Tips"),
                hit("channel:2", "Ингредиенты на порцию: яйца", 0.88, TODAY, null),
                hit("guides/sales.md", "Always confirm the next step.", 0.80, TODAY.minusDays(40), null),
                hit("channel:3", "Third relevant snippet.", 0.75, TODAY, null)));
        when(vectorIndex.size()).thenReturn(120L);

        RetrievalResponse response = service.query("how to follow up", null, 2);

        ArgumentCaptor<IndexQuery> query = ArgumentCaptor.forClass(IndexQuery.class);
        verify(vectorIndex).search(query.capture());
        assertThat(query.getValue().topK()).isEqualTo(4);
        assertThat(query.getValue().excludeExpired()).isTrue();
        assertThat(query.getValue().category()).isNull();

        assertThat(response.snippets()).extracting(Snippet::source)
                .containsExactly("channel:1", "guides/sales.md");
        assertThat(response.totalEntries()).isEqualTo(120L);

        Snippet first = response.snippets().get(0);
        assertThat(first.sourceTitle()).isEqualTo("Sales Tips");
        assertThat(first.freshness()).isEqualTo("3 days ago");
        assertThat(response.snippets().get(1).sourceTitle()).isEqualTo("guides/sales.md");
    }

    @Test
    void query_passesCategoryFilter() {
        when(embedder.embed("pricing")).thenReturn(QUERY_VECTOR);
        when(vectorIndex.search(any(IndexQuery.class))).thenReturn(List.of());

        RetrievalResponse response = service.query("pricing", "products", 5);

        ArgumentCaptor<IndexQuery> query = ArgumentCaptor.forClass(IndexQuery.class);
        verify(vectorIndex).search(query.capture());
        assertThat(query.getValue().category()).isEqualTo("products");
        assertThat(query.getValue().topK()).isEqualTo(10);
        assertThat(response.snippets()).isEmpty();
    }

    @Test
    void query_blankQuestion_isRejected() {
        assertThatThrownBy(() -> service.query(" ", null, 5)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(embedder, vectorIndex);
    }

    @Test
    void query_zeroTopK_isRejected() {
        assertThatThrownBy(() -> service.query("pricing", null, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void query_indexDown_surfacesInsteadOfEmptyResult() {
        when(embedder.embed("pricing")).thenReturn(QUERY_VECTOR);
        when(vectorIndex.search(any(IndexQuery.class)))
                .thenThrow(IndexUnavailableException.during("search", new RuntimeException("connection refused")));

        assertThatThrownBy(() -> service.query("pricing", null, 5)).isInstanceOf(IndexUnavailableException.class);
    }

    @Test
    void query_embeddingFailure_propagates() {
        when(embedder.embed("pricing")).thenThrow(new EmbeddingException("provider down"));

        assertThatThrownBy(() -> service.query("pricing", null, 5)).isInstanceOf(EmbeddingException.class);
        verifyNoInteractions(vectorIndex);
    }

    @Test
    void categoryCountsComeFromIndex() {
        when(vectorIndex.countByCategory()).thenReturn(Map.of("news", 3L, "training", 5L));

        assertThat(service.getCategoryCounts()).containsEntry("training", 5L).hasSize(2);
    }

    private static SearchHit hit(String source, String content, double similarity, LocalDate updated, String title) {
        Chunk chunk = new Chunk(0, source, null, content, "training", updated, updated, null, UUID.randomUUID().toString());
        Map<String, Object> metadata = title != null ? Map.of(IndexMetadata.SOURCE_TITLE, title) : Map.of();
        return new SearchHit(UUID.randomUUID(), chunk, metadata, similarity, similarity, false);
    }
}
