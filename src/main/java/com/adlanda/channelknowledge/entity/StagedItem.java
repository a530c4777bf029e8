package com.adlanda.channelknowledge.entity;

import com.adlanda.channelknowledge.model.ContentItem;
import com.adlanda.channelknowledge.model.MediaType;
import com.adlanda.channelknowledge.model.QualityAssessment;
import com.adlanda.channelknowledge.model.StyleTags;
import com.adlanda.channelknowledge.model.Tone;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for a fetched post waiting to be scored or indexed.
 *
 * Staging makes the pipeline restart-safe: a poll persists its items before the
 * watermark moves, and later phases resume from whatever status the item is in.
 * Post text is only kept while it is still needed.
 */
@Entity
@Table(name = "staged_items",
        uniqueConstraints = @UniqueConstraint(name = "ux_staged_items_message", columnNames = {"channel_id", "message_id"}),
        indexes = @Index(name = "ix_staged_items_status", columnList = "status, posted_at"))
public class StagedItem {

    public static final int MAX_TEXT_LENGTH = 16384;
    private static final int MAX_ERROR_LENGTH = 1000;

    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "channel_id", nullable = false)
    private long channelId;

    @Column(name = "message_id", nullable = false)
    private long messageId;

    @Column(name = "post_text", length = MAX_TEXT_LENGTH)
    private String text;

    @Column(name = "posted_at")
    private Instant postedAt;

    @Column(name = "views")
    private Integer views;

    @Column(name = "reactions")
    private Integer reactions;

    @Column(name = "forwards")
    private Integer forwards;

    @Enumerated(EnumType.STRING)
    @Column(name = "media_type", length = 20)
    private MediaType mediaType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ItemStatus status = ItemStatus.PENDING;

    @Column(name = "quality_score")
    private Double qualityScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "tone", length = 20)
    private Tone tone;

    @Column(name = "emoji_count")
    private Integer emojiCount;

    @Column(name = "has_cta")
    private Boolean callToAction;

    @Column(name = "has_formatting")
    private Boolean formatted;

    @Column(name = "paragraph_count")
    private Integer paragraphCount;

    @Column(name = "score_reason", length = 500)
    private String scoreReason;

    @Column(name = "chunk_count")
    private Integer chunkCount;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "last_error", length = MAX_ERROR_LENGTH)
    private String lastError;

    @Column(name = "fetched_at")
    private Instant fetchedAt;

    @Column(name = "scored_at")
    private Instant scoredAt;

    @Column(name = "indexed_at")
    private Instant indexedAt;

    // Default constructor for JPA
    protected StagedItem() {
    }

    public static StagedItem from(ContentItem item, Instant fetchedAt) {
        StagedItem staged = new StagedItem();
        staged.id = UUID.randomUUID();
        staged.channelId = item.channelId();
        staged.messageId = item.messageId();
        staged.text = item.text() != null && item.text().length() > MAX_TEXT_LENGTH
                ? item.text().substring(0, MAX_TEXT_LENGTH)
                : item.text();
        staged.postedAt = item.postedAt();
        staged.views = item.views();
        staged.reactions = item.reactions();
        staged.forwards = item.forwards();
        staged.mediaType = item.mediaType();
        staged.fetchedAt = fetchedAt;
        return staged;
    }

    public ContentItem toContentItem() {
        return new ContentItem(channelId, messageId, text, postedAt, views, reactions, forwards, mediaType);
    }

    /**
     * Stores the assessment and moves the item to ACCEPTED or REJECTED.
     */
    public void applyAssessment(QualityAssessment assessment, double threshold, Instant at) {
        StyleTags tags = assessment.styleTags();
        this.qualityScore = assessment.qualityScore();
        this.tone = tags.tone();
        this.emojiCount = tags.emojiCount();
        this.callToAction = tags.callToAction();
        this.formatted = tags.formatted();
        this.paragraphCount = tags.paragraphCount();
        this.scoreReason = assessment.reason() != null && assessment.reason().length() > 500
                ? assessment.reason().substring(0, 500)
                : assessment.reason();
        this.scoredAt = at;
        if (assessment.passes(threshold)) {
            this.status = ItemStatus.ACCEPTED;
        } else {
            this.status = ItemStatus.REJECTED;
            this.text = null;
        }
    }

    public void markScoringFailed(String error, Instant at) {
        this.status = ItemStatus.SCORING_FAILED;
        this.lastError = truncate(error);
        this.scoredAt = at;
    }

    public void markIndexed(int chunks, Instant at) {
        this.status = ItemStatus.INDEXED;
        this.chunkCount = chunks;
        this.indexedAt = at;
        this.lastError = null;
        this.text = null;
    }

    /**
     * Records a failed indexing attempt. The item stays ACCEPTED and is retried on a later
     * tick until {@code maxAttempts} is reached, then it is parked as INDEX_FAILED.
     */
    public void recordIndexingFailure(String error, int maxAttempts) {
        this.attempts++;
        this.lastError = truncate(error);
        if (attempts >= maxAttempts) {
            this.status = ItemStatus.INDEX_FAILED;
        }
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }

    // Getters
    public UUID getId() {
        return id;
    }

    public long getChannelId() {
        return channelId;
    }

    public long getMessageId() {
        return messageId;
    }

    public String getText() {
        return text;
    }

    public Instant getPostedAt() {
        return postedAt;
    }

    public Integer getViews() {
        return views;
    }

    public Integer getReactions() {
        return reactions;
    }

    public Integer getForwards() {
        return forwards;
    }

    public MediaType getMediaType() {
        return mediaType;
    }

    public ItemStatus getStatus() {
        return status;
    }

    public Double getQualityScore() {
        return qualityScore;
    }

    public Tone getTone() {
        return tone;
    }

    public Integer getEmojiCount() {
        return emojiCount;
    }

    public Boolean getCallToAction() {
        return callToAction;
    }

    public Boolean getFormatted() {
        return formatted;
    }

    public Integer getParagraphCount() {
        return paragraphCount;
    }

    public String getScoreReason() {
        return scoreReason;
    }

    public Integer getChunkCount() {
        return chunkCount;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getLastError() {
        return lastError;
    }

    public Instant getFetchedAt() {
        return fetchedAt;
    }

    public Instant getScoredAt() {
        return scoredAt;
    }

    public Instant getIndexedAt() {
        return indexedAt;
    }

    @Override
    public String toString() {
        return "StagedItem{" +
                "channelId=" + channelId +
                ", messageId=" + messageId +
                ", status=" + status +
                ", qualityScore=" + qualityScore +
                ", attempts=" + attempts +
                '}';
    }
}
