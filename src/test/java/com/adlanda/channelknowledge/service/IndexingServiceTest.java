package com.adlanda.channelknowledge.service;

import com.adlanda.channelknowledge.config.PipelineProperties;
import com.adlanda.channelknowledge.exception.EmbeddingException;
import com.adlanda.channelknowledge.exception.IndexUnavailableException;
import com.adlanda.channelknowledge.model.ChannelRef;
import com.adlanda.channelknowledge.model.Chunk;
import com.adlanda.channelknowledge.model.ContentItem;
import com.adlanda.channelknowledge.model.IndexMetadata;
import com.adlanda.channelknowledge.model.KnowledgeDocument;
import com.adlanda.channelknowledge.model.MediaType;
import com.adlanda.channelknowledge.repository.VectorIndex;
import com.adlanda.channelknowledge.service.chunking.ChunkingEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IndexingServiceTest {

    private static final float[] VECTOR = {0.5f, 0.5f};

    @Mock
    private Embedder embedder;

    @Mock
    private VectorIndex vectorIndex;

    @Captor
    private ArgumentCaptor<Chunk> chunkCaptor;

    @Captor
    private ArgumentCaptor<Map<String, Object>> metadataCaptor;

    private PipelineProperties properties;
    private IndexingService service;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        properties.getChunk().setMaxSize(200);
        properties.getChunk().setOverlap(30);
        service = new IndexingService(new ChunkingEngine(), embedder, vectorIndex,
                new ContentHashService(), new CategoryPolicy(properties), properties);
    }

    @Test
    void indexPost_writesChunkWithChannelAttributionAndExpiry() {
        UUID id = UUID.randomUUID();
        when(embedder.embed(anyString())).thenReturn(VECTOR);
        when(vectorIndex.upsert(any(Chunk.class), any(float[].class), anyMap())).thenReturn(id);

        ContentItem item = new ContentItem(42L, 7L, "Morning news digest for today @editor",
                Instant.parse("2026-10-01T08:30:00Z"), 1200, 30, 5, MediaType.PHOTO);
        List<UUID> ids = service.indexPost(item, new ChannelRef(42L, "daily", "Daily News", "news"), 8.2, "informative");

        assertThat(ids).containsExactly(id);
        verify(vectorIndex).upsert(chunkCaptor.capture(), any(float[].class), metadataCaptor.capture());

        Chunk chunk = chunkCaptor.getValue();
        assertThat(chunk.sourceId()).isEqualTo("channel:42");
        assertThat(chunk.content()).isEqualTo("Morning news digest for today");
        assertThat(chunk.category()).isEqualTo("news");
        assertThat(chunk.createdDate()).isEqualTo(LocalDate.of(2026, 10, 1));
        assertThat(chunk.expiresDate()).isEqualTo(LocalDate.of(2026, 10, 31));
        assertThat(chunk.contentHash()).hasSize(64);

        assertThat(metadataCaptor.getValue())
                .containsEntry(IndexMetadata.CHANNEL_ID, 42L)
                .containsEntry(IndexMetadata.MESSAGE_ID, 7L)
                .containsEntry(IndexMetadata.SOURCE_TITLE, "Daily News")
                .containsEntry(IndexMetadata.CHANNEL_USERNAME, "daily")
                .containsEntry(IndexMetadata.VIEWS, 1200)
                .containsEntry(IndexMetadata.QUALITY_SCORE, 8.2)
                .containsEntry(IndexMetadata.TONE, "informative")
                .containsEntry(IndexMetadata.MEDIA_TYPE, "PHOTO");
    }

    @Test
    void indexPost_longPost_writesOneEntryPerChunk() {
        when(embedder.embed(anyString())).thenReturn(VECTOR);
        when(vectorIndex.upsert(any(Chunk.class), any(float[].class), anyMap()))
                .thenAnswer(invocation -> UUID.randomUUID());

        String text = "First paragraph sentence that is fairly long. ".repeat(4)
                + "\n\n" + "Second paragraph with different words inside. ".repeat(4);
        List<UUID> ids = service.indexPost(post(text), new ChannelRef(42L, null, null, null), 7.5, null);

        assertThat(ids).hasSizeGreaterThan(1);
        verify(vectorIndex, times(ids.size())).upsert(chunkCaptor.capture(), any(float[].class), anyMap());
        assertThat(chunkCaptor.getAllValues()).extracting(Chunk::index)
                .containsExactlyElementsOf(IntStream.range(0, ids.size()).boxed().toList());
        assertThat(chunkCaptor.getAllValues()).allSatisfy(c -> {
            assertThat(c.content().length()).isLessThanOrEqualTo(200);
            assertThat(c.category()).isEqualTo("training");
        });
    }

    @Test
    void indexPost_onlyLinks_writesNothing() {
        List<UUID> ids = service.indexPost(post("https://t.me/somewhere"), new ChannelRef(42L, null, null, null), 9.0, null);

        assertThat(ids).isEmpty();
        verifyNoInteractions(embedder, vectorIndex);
    }

    @Test
    void indexPost_embeddingFailure_propagatesWithoutWriting() {
        when(embedder.embed(anyString())).thenThrow(new EmbeddingException("provider down"));

        assertThatThrownBy(() -> service.indexPost(post("Useful text"), new ChannelRef(42L, null, null, null), 8.0, null))
                .isInstanceOf(EmbeddingException.class);
        verify(vectorIndex, never()).upsert(any(), any(), any());
    }

    @Test
    void indexPost_indexUnavailable_propagates() {
        when(embedder.embed(anyString())).thenReturn(VECTOR);
        when(vectorIndex.upsert(any(Chunk.class), any(float[].class), anyMap()))
                .thenThrow(IndexUnavailableException.during("upsert", new RuntimeException("connection refused")));

        assertThatThrownBy(() -> service.indexPost(post("Useful text"), new ChannelRef(42L, null, null, null), 8.0, null))
                .isInstanceOf(IndexUnavailableException.class);
    }

    @Test
    void indexDocument_usesDocumentDatesAndPath() {
        when(embedder.embed(anyString())).thenReturn(VECTOR);
        when(vectorIndex.upsert(any(Chunk.class), any(float[].class), anyMap())).thenReturn(UUID.randomUUID());

        KnowledgeDocument document = new KnowledgeDocument("guides/start.md", "Start here.", "business",
                LocalDate.of(2026, 1, 1), LocalDate.of(2026, 5, 1), LocalDate.of(2027, 1, 1),
                Map.of(IndexMetadata.SOURCE_TITLE, "Getting started"));

        service.indexDocument(document);

        verify(vectorIndex).upsert(chunkCaptor.capture(), any(float[].class), metadataCaptor.capture());
        Chunk chunk = chunkCaptor.getValue();
        assertThat(chunk.sourceId()).isEqualTo("guides/start.md");
        assertThat(chunk.category()).isEqualTo("business");
        assertThat(chunk.updatedDate()).isEqualTo(LocalDate.of(2026, 5, 1));
        assertThat(chunk.expiresDate()).isEqualTo(LocalDate.of(2027, 1, 1));
        assertThat(metadataCaptor.getValue())
                .containsEntry(IndexMetadata.DOCUMENT_PATH, "guides/start.md")
                .containsEntry(IndexMetadata.SOURCE_TITLE, "Getting started");
    }

    private static ContentItem post(String text) {
        return new ContentItem(42L, 7L, text, Instant.parse("2026-10-01T08:30:00Z"), 1000, 10, 1, null);
    }
}
