package com.adlanda.channelknowledge.repository;

import com.adlanda.channelknowledge.exception.IndexUnavailableException;
import com.adlanda.channelknowledge.model.Chunk;
import com.adlanda.channelknowledge.model.IndexMetadata;
import com.adlanda.channelknowledge.model.IndexQuery;
import com.adlanda.channelknowledge.model.SearchHit;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * PostgreSQL vector index using the pgvector extension.
 *
 * Entries live in one table with a {@code vector(N)} column searched by cosine
 * distance, and a JSONB metadata column. Unique indexes back the dedup rules.
 * Similarity candidates are fetched at three times the requested size and ranked
 * by {@link FreshnessRanker}.
 */
public class PgVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(PgVectorIndex.class);

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final int CANDIDATE_FACTOR = 3;
    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final FreshnessRanker ranker;
    private final Clock clock;
    private final String table;
    private final int dimensions;

    private final String findByHashSql;
    private final String findByMessageSql;
    private final String mergeSql;
    private final String insertSql;
    private final String searchSql;
    private final String expireSql;

    public PgVectorIndex(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper, FreshnessRanker ranker,
                         Clock clock, String table, int dimensions) {
        if (!TABLE_NAME.matcher(table).matches()) {
            throw new IllegalArgumentException("Invalid index table name: " + table);
        }
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.ranker = ranker;
        this.clock = clock;
        this.table = table;
        this.dimensions = dimensions;

        this.findByHashSql = "SELECT id FROM " + table + " WHERE source = ? AND content_hash = ?";
        this.findByMessageSql = "SELECT id FROM " + table
                + " WHERE channel_id = ? AND message_id = ? AND chunk_index = ?";
        this.mergeSql = "UPDATE " + table
                + " SET metadata = metadata || CAST(? AS jsonb), updated_date = GREATEST(updated_date, ?) WHERE id = ?";
        this.insertSql = "INSERT INTO " + table
                + " (id, source, content_hash, channel_id, message_id, chunk_index, section_title, category,"
                + " content, embedding, metadata, created_date, updated_date, expires_date)"
                + " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS vector), CAST(? AS jsonb), ?, ?, ?)";
        this.searchSql = "SELECT id, source, content_hash, chunk_index, section_title, category, content,"
                + " metadata::text AS metadata_json, created_date, updated_date, expires_date,"
                + " 1 - (embedding <=> CAST(? AS vector)) AS similarity"
                + " FROM " + table
                + " WHERE (CAST(? AS varchar) IS NULL OR category = ?)"
                + " AND (? = false OR expires_date IS NULL OR expires_date >= ?)"
                + " ORDER BY embedding <=> CAST(? AS vector) LIMIT ?";
        this.expireSql = "DELETE FROM " + table + " WHERE expires_date IS NOT NULL AND expires_date < ?";
    }

    /**
     * Creates the extension, table and indexes if they are missing.
     */
    public void initializeSchema() {
        try {
            jdbcTemplate.execute("CREATE EXTENSION IF NOT EXISTS vector");
            jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + table + " ("
                    + "id uuid PRIMARY KEY, "
                    + "source varchar(500) NOT NULL, "
                    + "content_hash varchar(64) NOT NULL, "
                    + "channel_id bigint, "
                    + "message_id bigint, "
                    + "chunk_index int NOT NULL, "
                    + "section_title varchar(500), "
                    + "category varchar(100), "
                    + "content text NOT NULL, "
                    + "embedding vector(" + dimensions + ") NOT NULL, "
                    + "metadata jsonb NOT NULL DEFAULT '{}'::jsonb, "
                    + "created_date date NOT NULL, "
                    + "updated_date date NOT NULL, "
                    + "expires_date date, "
                    + "CONSTRAINT " + table + "_expiry_check CHECK (expires_date IS NULL OR expires_date >= created_date))");
            jdbcTemplate.execute("CREATE UNIQUE INDEX IF NOT EXISTS " + table + "_source_hash_ux ON "
                    + table + " (source, content_hash)");
            jdbcTemplate.execute("CREATE UNIQUE INDEX IF NOT EXISTS " + table + "_message_ux ON "
                    + table + " (channel_id, message_id, chunk_index) WHERE channel_id IS NOT NULL");
            jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS " + table + "_category_ix ON " + table + " (category)");
            jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS " + table + "_expires_ix ON " + table + " (expires_date)");
            jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS " + table + "_embedding_ix ON "
                    + table + " USING hnsw (embedding vector_cosine_ops)");
            log.info("Vector index table '{}' ready ({} dimensions)", table, dimensions);
        } catch (DataAccessException e) {
            throw IndexUnavailableException.during("schema initialisation", e);
        }
    }

    @Override
    public synchronized UUID upsert(Chunk chunk, float[] vector, Map<String, Object> metadata) {
        if (vector == null || vector.length != dimensions) {
            throw new IllegalArgumentException("Expected a vector of " + dimensions + " dimensions, got "
                    + (vector == null ? "none" : vector.length));
        }
        Map<String, Object> safeMetadata = metadata == null ? Map.of() : metadata;
        String metadataJson = toJson(safeMetadata);

        try {
            Optional<UUID> duplicate = findDuplicate(chunk, safeMetadata);
            if (duplicate.isPresent()) {
                jdbcTemplate.update(mergeSql, metadataJson, chunk.updatedDate(), duplicate.get());
                log.debug("Merged duplicate chunk {} of {} into entry {}", chunk.index(), chunk.sourceId(), duplicate.get());
                return duplicate.get();
            }

            UUID id = UUID.randomUUID();
            jdbcTemplate.update(insertSql,
                    id,
                    chunk.sourceId(),
                    chunk.contentHash(),
                    IndexMetadata.channelId(safeMetadata).orElse(null),
                    IndexMetadata.messageId(safeMetadata).orElse(null),
                    chunk.index(),
                    chunk.sectionTitle(),
                    chunk.category(),
                    chunk.content(),
                    toVectorLiteral(vector),
                    metadataJson,
                    chunk.createdDate(),
                    chunk.updatedDate(),
                    chunk.expiresDate());
            return id;
        } catch (DataAccessException e) {
            throw IndexUnavailableException.during("upsert", e);
        }
    }

    @Override
    public List<SearchHit> search(IndexQuery query) {
        LocalDate today = LocalDate.now(clock);
        String vectorLiteral = toVectorLiteral(query.vector());
        try {
            List<FreshnessRanker.Candidate> candidates = jdbcTemplate.query(searchSql, candidateMapper(),
                    vectorLiteral,
                    query.category(),
                    query.category(),
                    query.excludeExpired(),
                    today,
                    vectorLiteral,
                    query.topK() * CANDIDATE_FACTOR);
            return ranker.rank(candidates, query, today);
        } catch (DataAccessException e) {
            throw IndexUnavailableException.during("search", e);
        }
    }

    @Override
    public int expire() {
        try {
            int removed = jdbcTemplate.update(expireSql, LocalDate.now(clock));
            if (removed > 0) {
                log.info("Removed {} expired entries", removed);
            }
            return removed;
        } catch (DataAccessException e) {
            throw IndexUnavailableException.during("expiry sweep", e);
        }
    }

    @Override
    public boolean delete(UUID id) {
        try {
            return jdbcTemplate.update("DELETE FROM " + table + " WHERE id = ?", id) > 0;
        } catch (DataAccessException e) {
            throw IndexUnavailableException.during("delete", e);
        }
    }

    @Override
    public int deleteBySource(String source) {
        try {
            int deleted = jdbcTemplate.update("DELETE FROM " + table + " WHERE source = ?", source);
            log.debug("Deleted {} entries for source {}", deleted, source);
            return deleted;
        } catch (DataAccessException e) {
            throw IndexUnavailableException.during("delete by source", e);
        }
    }

    @Override
    public long size() {
        try {
            Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Long.class);
            return count != null ? count : 0L;
        } catch (DataAccessException e) {
            throw IndexUnavailableException.during("count", e);
        }
    }

    @Override
    public Map<String, Long> countByCategory() {
        try {
            Map<String, Long> counts = new LinkedHashMap<>();
            jdbcTemplate.query("SELECT COALESCE(category, 'uncategorized') AS category, COUNT(*) AS entries FROM "
                            + table + " GROUP BY 1 ORDER BY 1",
                    rs -> {
                        counts.put(rs.getString("category"), rs.getLong("entries"));
                    });
            return counts;
        } catch (DataAccessException e) {
            throw IndexUnavailableException.during("category stats", e);
        }
    }

    private Optional<UUID> findDuplicate(Chunk chunk, Map<String, Object> metadata) {
        if (chunk.contentHash() != null) {
            List<UUID> byHash = jdbcTemplate.queryForList(findByHashSql, UUID.class, chunk.sourceId(), chunk.contentHash());
            if (!byHash.isEmpty()) {
                return Optional.of(byHash.get(0));
            }
        }
        Optional<Long> channelId = IndexMetadata.channelId(metadata);
        Optional<Long> messageId = IndexMetadata.messageId(metadata);
        if (channelId.isEmpty() || messageId.isEmpty()) {
            return Optional.empty();
        }
        List<UUID> byMessage = jdbcTemplate.queryForList(findByMessageSql, UUID.class,
                channelId.get(), messageId.get(), chunk.index());
        return byMessage.isEmpty() ? Optional.empty() : Optional.of(byMessage.get(0));
    }

    private RowMapper<FreshnessRanker.Candidate> candidateMapper() {
        return (rs, rowNum) -> new FreshnessRanker.Candidate(
                rs.getObject("id", UUID.class),
                new Chunk(
                        rs.getInt("chunk_index"),
                        rs.getString("source"),
                        rs.getString("section_title"),
                        rs.getString("content"),
                        rs.getString("category"),
                        rs.getObject("created_date", LocalDate.class),
                        rs.getObject("updated_date", LocalDate.class),
                        rs.getObject("expires_date", LocalDate.class),
                        rs.getString("content_hash")),
                readMetadata(rs),
                rs.getDouble("similarity"));
    }

    private Map<String, Object> readMetadata(ResultSet rs) throws SQLException {
        String json = rs.getString("metadata_json");
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, METADATA_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable metadata on entry {}: {}", rs.getObject("id"), e.getMessage());
            return Map.of();
        }
    }

    private String toJson(Map<String, Object> metadata) {
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Metadata is not serializable to JSON", e);
        }
    }

    static String toVectorLiteral(float[] vector) {
        StringBuilder literal = new StringBuilder(vector.length * 10).append('[');
        for (int i = 0; i < vector.length; i++) {
            if (i > 0) {
                literal.append(',');
            }
            literal.append(vector[i]);
        }
        return literal.append(']').toString();
    }
}
