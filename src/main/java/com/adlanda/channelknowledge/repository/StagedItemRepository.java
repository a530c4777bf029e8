package com.adlanda.channelknowledge.repository;

import com.adlanda.channelknowledge.entity.ItemStatus;
import com.adlanda.channelknowledge.entity.StagedItem;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for staged channel posts.
 */
@Repository
public interface StagedItemRepository extends JpaRepository<StagedItem, UUID> {

    boolean existsByChannelIdAndMessageId(long channelId, long messageId);

    Optional<StagedItem> findByChannelIdAndMessageId(long channelId, long messageId);

    /**
     * Oldest items first, so that a channel's posts are processed in posting order.
     */
    List<StagedItem> findByStatusOrderByPostedAtAscMessageIdAsc(ItemStatus status, Pageable pageable);

    /**
     * Items with fewer failed attempts first, then oldest first, so repeatedly failing
     * posts cannot hold up the rest of the queue.
     */
    List<StagedItem> findByStatusAndQualityScoreGreaterThanEqualOrderByAttemptsAscPostedAtAscMessageIdAsc(
            ItemStatus status, double minScore, Pageable pageable);

    long countByStatus(ItemStatus status);

    /**
     * Average view count of a channel's posts that have views at all.
     */
    @Query("SELECT AVG(s.views) FROM StagedItem s WHERE s.channelId = :channelId AND s.views > 0")
    Double averageViews(@Param("channelId") long channelId);

    @Query("SELECT AVG(s.qualityScore) FROM StagedItem s WHERE s.channelId = :channelId AND s.qualityScore IS NOT NULL")
    Double averageQualityScore(@Param("channelId") long channelId);

    long countByChannelIdAndQualityScoreGreaterThanEqual(long channelId, double minScore);
}
