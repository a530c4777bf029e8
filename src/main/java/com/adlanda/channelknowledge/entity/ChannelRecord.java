package com.adlanda.channelknowledge.entity;

import com.adlanda.channelknowledge.model.ChannelRef;
import com.adlanda.channelknowledge.model.PollState;
import com.adlanda.channelknowledge.model.Tier;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity holding the polling bookkeeping of one monitored channel.
 *
 * The watermark ({@code lastMessageId}) only moves forward and is persisted together
 * with the items staged by the same poll.
 */
@Entity
@Table(name = "channel_records")
public class ChannelRecord {

    private static final int MAX_ERROR_LENGTH = 1000;

    @Id
    @Column(name = "id")
    private UUID id;

    @Column(name = "channel_id", unique = true, nullable = false)
    private long channelId;

    @Column(name = "username", length = 255)
    private String username;

    @Column(name = "title", length = 500)
    private String title;

    @Column(name = "priority", nullable = false)
    private int priority;

    @Column(name = "style_category", length = 100)
    private String styleCategory;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "last_fetched_at")
    private Instant lastFetchedAt;

    @Column(name = "last_message_id")
    private Long lastMessageId;

    @Column(name = "last_post_date")
    private Instant lastPostDate;

    @Column(name = "error_count", nullable = false)
    private int errorCount;

    @Column(name = "consecutive_errors", nullable = false)
    private int consecutiveErrors;

    @Column(name = "last_error", length = MAX_ERROR_LENGTH)
    private String lastError;

    @Column(name = "flagged", nullable = false)
    private boolean flagged;

    @Column(name = "posts_count", nullable = false)
    private long postsCount;

    @Column(name = "avg_quality_score")
    private Double avgQualityScore;

    @Column(name = "high_quality_count", nullable = false)
    private long highQualityCount;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    // Default constructor for JPA
    public ChannelRecord() {
        this.id = UUID.randomUUID();
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    public ChannelRecord(long channelId, String username, String title, int priority, String styleCategory) {
        this();
        if (priority < 1 || priority > 10) {
            throw new IllegalArgumentException("priority must be within 1-10, got " + priority);
        }
        this.channelId = channelId;
        this.username = username;
        this.title = title;
        this.priority = priority;
        this.styleCategory = styleCategory;
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public Tier tier() {
        return Tier.fromPriority(priority);
    }

    public PollState pollState(Instant now, Duration interval) {
        if (lastFetchedAt == null) {
            return PollState.NEVER_FETCHED;
        }
        return Duration.between(lastFetchedAt, now).compareTo(interval) >= 0
                ? PollState.POLLING_DUE
                : PollState.RECENTLY_POLLED;
    }

    /**
     * Records a successful poll. The watermark never moves backwards.
     */
    public void recordPollSuccess(Instant fetchedAt, Long newestMessageId, Instant newestPostDate, int newItems) {
        this.lastFetchedAt = fetchedAt;
        if (newestMessageId != null && (lastMessageId == null || newestMessageId > lastMessageId)) {
            this.lastMessageId = newestMessageId;
        }
        if (newestPostDate != null && (lastPostDate == null || newestPostDate.isAfter(lastPostDate))) {
            this.lastPostDate = newestPostDate;
        }
        this.postsCount += newItems;
        this.consecutiveErrors = 0;
    }

    /**
     * Records a failed poll. {@code lastFetchedAt} stays untouched so the channel is due again next tick.
     */
    public void recordPollFailure(String error, boolean permanent) {
        this.errorCount++;
        this.consecutiveErrors++;
        this.lastError = truncate(error);
        if (permanent) {
            this.flagged = true;
        }
    }

    public void updateQualityStats(Double average, long highQuality) {
        this.avgQualityScore = average == null ? null : Math.round(average * 100.0) / 100.0;
        this.highQualityCount = highQuality;
    }

    public ChannelRef toRef() {
        return new ChannelRef(channelId, username, title, styleCategory);
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }

    // Getters and Setters
    public UUID getId() {
        return id;
    }

    public long getChannelId() {
        return channelId;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public String getStyleCategory() {
        return styleCategory;
    }

    public void setStyleCategory(String styleCategory) {
        this.styleCategory = styleCategory;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public Instant getLastFetchedAt() {
        return lastFetchedAt;
    }

    public Long getLastMessageId() {
        return lastMessageId;
    }

    public Instant getLastPostDate() {
        return lastPostDate;
    }

    public int getErrorCount() {
        return errorCount;
    }

    public int getConsecutiveErrors() {
        return consecutiveErrors;
    }

    public String getLastError() {
        return lastError;
    }

    public boolean isFlagged() {
        return flagged;
    }

    public long getPostsCount() {
        return postsCount;
    }

    public Double getAvgQualityScore() {
        return avgQualityScore;
    }

    public long getHighQualityCount() {
        return highQualityCount;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public String toString() {
        return "ChannelRecord{" +
                "channelId=" + channelId +
                ", username='" + username + '\'' +
                ", priority=" + priority +
                ", lastMessageId=" + lastMessageId +
                ", lastFetchedAt=" + lastFetchedAt +
                ", flagged=" + flagged +
                '}';
    }
}
