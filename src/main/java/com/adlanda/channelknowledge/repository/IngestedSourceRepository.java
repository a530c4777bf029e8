package com.adlanda.channelknowledge.repository;

import com.adlanda.channelknowledge.entity.IngestedSource;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository for curated knowledge-base documents.
 *
 * Supports incremental loading by tracking content hashes.
 */
@Repository
public interface IngestedSourceRepository extends JpaRepository<IngestedSource, UUID> {

    Optional<IngestedSource> findBySourcePath(String sourcePath);

    /**
     * If this returns true, the document hasn't changed and can be skipped.
     *
     * @param sourcePath  path relative to the knowledge-base root
     * @param contentHash SHA-256 of the file content
     */
    boolean existsBySourcePathAndContentHash(String sourcePath, String contentHash);

    /**
     * Sum of index entries across all loaded documents.
     */
    @Query("SELECT COALESCE(SUM(s.entryCount), 0) FROM IngestedSource s")
    long sumEntryCount();
}
