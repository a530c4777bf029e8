package com.adlanda.channelknowledge.service;

import com.adlanda.channelknowledge.config.PipelineProperties;
import com.adlanda.channelknowledge.entity.IngestedSource;
import com.adlanda.channelknowledge.exception.EmbeddingException;
import com.adlanda.channelknowledge.model.KnowledgeDocument;
import com.adlanda.channelknowledge.repository.IngestedSourceRepository;
import com.adlanda.channelknowledge.repository.VectorIndex;
import com.adlanda.channelknowledge.service.FrontMatterParser.FrontMatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Loads curated markdown and text documents into the vector index.
 *
 * Loading is incremental: unchanged files (same SHA-256) are skipped, changed
 * files have their old entries removed before re-indexing, and entries of files
 * that disappeared are deleted.
 */
@Service
public class KnowledgeBaseLoader {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeBaseLoader.class);

    private static final Set<String> RESERVED_KEYS =
            Set.of("title", "category", "date_created", "date_updated", "expires");

    private final ContentHashService hashService;
    private final IngestedSourceRepository repository;
    private final PipelineProperties properties;
    private final VectorIndex vectorIndex;
    private final IndexingService indexingService;
    private final FrontMatterParser frontMatterParser;
    private final Clock clock;

    public KnowledgeBaseLoader(ContentHashService hashService,
                               IngestedSourceRepository repository,
                               PipelineProperties properties,
                               VectorIndex vectorIndex,
                               IndexingService indexingService,
                               FrontMatterParser frontMatterParser,
                               Clock clock) {
        this.hashService = hashService;
        this.repository = repository;
        this.properties = properties;
        this.vectorIndex = vectorIndex;
        this.indexingService = indexingService;
        this.frontMatterParser = frontMatterParser;
        this.clock = clock;
    }

    /**
     * Scans the knowledge-base directory and loads new or changed documents.
     */
    public LoadSummary loadAll() {
        Path root = root();
        if (!Files.isDirectory(root)) {
            log.warn("Knowledge base directory does not exist: {}", root);
            return new LoadSummary(0, 0, 0, 0, 0);
        }

        List<FileIngestionResult> results = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        try (Stream<Path> paths = Files.walk(root)) {
            List<Path> files = paths.filter(Files::isRegularFile)
                    .filter(KnowledgeBaseLoader::isDocument)
                    .sorted()
                    .toList();
            for (Path file : files) {
                seen.add(relativePath(file));
                results.add(processFile(file));
            }
        } catch (IOException e) {
            log.error("Failed to walk knowledge base directory: {}", root, e);
        }

        int deleted = removeDeleted(seen);
        int processed = (int) results.stream().filter(r -> !r.wasSkipped() && r.error() == null).count();
        int skipped = (int) results.stream().filter(FileIngestionResult::wasSkipped).count();
        int failed = (int) results.stream().filter(r -> r.error() != null).count();
        long entries = repository.sumEntryCount();

        LoadSummary summary = new LoadSummary(processed, skipped, deleted, failed, entries);
        log.info("Knowledge base loaded: {} processed, {} unchanged, {} deleted, {} failed, {} entries tracked",
                processed, skipped, deleted, failed, entries);
        return summary;
    }

    /**
     * Loads one document, skipping it when unchanged.
     */
    public FileIngestionResult processFile(Path file) {
        String sourcePath = relativePath(file);
        try {
            String hash = hashService.computeHash(file);
            long size = hashService.getFileSize(file);

            boolean incremental = properties.getKnowledgeBase().isIncremental();
            if (incremental && repository.existsBySourcePathAndContentHash(sourcePath, hash)) {
                log.debug("Skipping unchanged document {}", sourcePath);
                return FileIngestionResult.skipped(sourcePath, "unchanged");
            }

            Optional<IngestedSource> existing = incremental ? repository.findBySourcePath(sourcePath) : Optional.empty();
            if (existing.isPresent()) {
                int removed = vectorIndex.deleteBySource(sourcePath);
                repository.delete(existing.get());
                log.info("Document {} changed, removed {} old entries", sourcePath, removed);
            } else if (!incremental) {
                vectorIndex.deleteBySource(sourcePath);
            }

            KnowledgeDocument document = toDocument(sourcePath, Files.readString(file, StandardCharsets.UTF_8), file);
            if (document.text().isBlank()) {
                return FileIngestionResult.skipped(sourcePath, "empty");
            }
            List<UUID> ids = indexingService.indexDocument(document);

            repository.save(new IngestedSource(sourcePath, hash, size, ids.size(),
                    document.category(), document.expiresDate()));
            log.info("Loaded {} entries from {}", ids.size(), sourcePath);
            return FileIngestionResult.processed(sourcePath, ids);
        } catch (IOException e) {
            log.error("Failed to read document: {}", file, e);
            return FileIngestionResult.failed(sourcePath, e.getMessage());
        } catch (EmbeddingException | IllegalArgumentException e) {
            log.error("Failed to index document {}: {}", sourcePath, e.getMessage());
            return FileIngestionResult.failed(sourcePath, e.getMessage());
        }
    }

    KnowledgeDocument toDocument(String sourcePath, String raw, Path file) throws IOException {
        FrontMatter frontMatter = frontMatterParser.parse(raw);
        String body = sourcePath.endsWith(".md") ? MarkdownText.strip(frontMatter.body()) : frontMatter.body().strip();

        String category = frontMatter.string("category").orElse(properties.getDefaultCategory());
        LocalDate created = frontMatter.date("date_created")
                .orElseGet(() -> lastModified(file));
        LocalDate updated = frontMatter.date("date_updated").orElse(created);
        LocalDate expires = frontMatter.date("expires").orElse(null);
        if (expires != null && expires.isBefore(created)) {
            throw new IllegalArgumentException("expires " + expires + " is before date_created " + created);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        frontMatter.string("title").ifPresent(title -> metadata.put("source_title", title));
        frontMatter.attributes().forEach((key, value) -> {
            if (!RESERVED_KEYS.contains(key) && isScalar(value)) {
                metadata.put(key, value.toString());
            }
        });
        return new KnowledgeDocument(sourcePath, body, category, created, updated, expires, metadata);
    }

    private int removeDeleted(Set<String> seen) {
        int deleted = 0;
        for (IngestedSource source : repository.findAll()) {
            if (!seen.contains(source.getSourcePath())) {
                int removed = vectorIndex.deleteBySource(source.getSourcePath());
                repository.delete(source);
                deleted++;
                log.info("Document {} was removed, deleted {} entries", source.getSourcePath(), removed);
            }
        }
        return deleted;
    }

    private LocalDate lastModified(Path file) {
        try {
            return Files.getLastModifiedTime(file).toInstant().atZone(ZoneOffset.UTC).toLocalDate();
        } catch (IOException e) {
            log.debug("No modification time for {}, using today", file);
            return LocalDate.now(clock);
        }
    }

    private Path root() {
        return Path.of(properties.getKnowledgeBase().getPath());
    }

    private String relativePath(Path file) {
        return root().relativize(file).toString().replace('\\', '/');
    }

    private static boolean isDocument(Path path) {
        String name = path.getFileName().toString();
        return name.endsWith(".md") || name.endsWith(".txt");
    }

    private static boolean isScalar(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }

    /**
     * Outcome of loading one document.
     */
    public record FileIngestionResult(String sourcePath, boolean wasSkipped, String reason, List<UUID> entryIds, String error) {

        static FileIngestionResult skipped(String sourcePath, String reason) {
            return new FileIngestionResult(sourcePath, true, reason, List.of(), null);
        }

        static FileIngestionResult processed(String sourcePath, List<UUID> entryIds) {
            return new FileIngestionResult(sourcePath, false, null, entryIds, null);
        }

        static FileIngestionResult failed(String sourcePath, String error) {
            return new FileIngestionResult(sourcePath, false, "failed", List.of(), error);
        }
    }

    /**
     * Totals of one load run.
     */
    public record LoadSummary(int processedFiles, int skippedFiles, int deletedFiles, int failedFiles, long totalEntries) {}
}
