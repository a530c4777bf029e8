package com.adlanda.channelknowledge.service.scoring;

import com.adlanda.channelknowledge.config.PipelineProperties;
import com.adlanda.channelknowledge.exception.ScoringException;
import com.adlanda.channelknowledge.model.ContentItem;
import com.adlanda.channelknowledge.model.LengthClass;
import com.adlanda.channelknowledge.model.QualityAssessment;
import com.adlanda.channelknowledge.model.StyleTags;
import com.adlanda.channelknowledge.model.SubScores;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic quality score for channel posts.
 *
 * Five sub-scores in [0, 10] are combined with fixed weights:
 * views 0.30, engagement 0.25, length 0.15, readability 0.15, freshness 0.15.
 * Views are judged relative to the channel's average, read through
 * {@link ChannelAverageViewsCache}.
 */
@Service
public class QualityScorer {

    static final double WEIGHT_VIEWS = 0.30;
    static final double WEIGHT_ENGAGEMENT = 0.25;
    static final double WEIGHT_LENGTH = 0.15;
    static final double WEIGHT_READABILITY = 0.15;
    static final double WEIGHT_FRESHNESS = 0.15;

    private static final int OPTIMAL_LENGTH_MIN = 300;
    private static final int OPTIMAL_LENGTH_MAX = 800;
    private static final int ACCEPTABLE_LENGTH_MIN = 200;
    private static final int ACCEPTABLE_LENGTH_MAX = 1200;

    private final ChannelAverageViewsCache averageViews;
    private final ToneClassifier toneClassifier;
    private final int minViews;
    private final Clock clock;

    public QualityScorer(ChannelAverageViewsCache averageViews, ToneClassifier toneClassifier,
                         PipelineProperties properties, Clock clock) {
        this.averageViews = averageViews;
        this.toneClassifier = toneClassifier;
        this.minViews = properties.getScoring().getMinViews();
        this.clock = clock;
    }

    /**
     * Scores a post against its channel's cached average views.
     *
     * @throws ScoringException if the channel statistics cannot be read or the item is malformed
     */
    public QualityAssessment score(ContentItem item) {
        double channelAverage;
        try {
            channelAverage = averageViews.averageViews(item.channelId());
        } catch (RuntimeException e) {
            throw ScoringException.forItem(item.channelId(), item.messageId(), e);
        }
        return score(item, channelAverage);
    }

    /**
     * Scores a post against a known channel average. A pure function of the item,
     * the average and the current time.
     */
    public QualityAssessment score(ContentItem item, double channelAverageViews) {
        try {
            String text = item.text() != null ? item.text() : "";
            SubScores subScores = new SubScores(
                    viewsScore(item.viewsOrZero(), channelAverageViews),
                    engagementScore(item),
                    lengthScore(text.length()),
                    readabilityScore(text),
                    freshnessScore(item.postedAt(), clock.instant()));

            StyleTags tags = new StyleTags(
                    toneClassifier.classify(text),
                    LengthClass.of(text.length()),
                    TextSignals.countEmojis(text),
                    TextSignals.hasCallToAction(text),
                    TextSignals.hasHtmlFormatting(text),
                    TextSignals.paragraphCount(text));

            return new QualityAssessment(combine(subScores), subScores, tags, explain(subScores));
        } catch (RuntimeException e) {
            throw ScoringException.forItem(item.channelId(), item.messageId(), e);
        }
    }

    /**
     * Weighted sum of the sub-scores, clamped to [0, 10] and rounded to one decimal.
     */
    public static double combine(SubScores s) {
        double raw = s.views() * WEIGHT_VIEWS
                + s.engagement() * WEIGHT_ENGAGEMENT
                + s.length() * WEIGHT_LENGTH
                + s.readability() * WEIGHT_READABILITY
                + s.freshness() * WEIGHT_FRESHNESS;
        double clamped = Math.max(0.0, Math.min(10.0, raw));
        return Math.round(clamped * 10.0) / 10.0;
    }

    double viewsScore(int views, double channelAverage) {
        if (views <= 0 || views < minViews) {
            return 0.0;
        }
        if (channelAverage > 0) {
            return Math.min(10.0, views / channelAverage * 5.0);
        }
        return 5.0;
    }

    static double engagementScore(ContentItem item) {
        int views = item.viewsOrZero();
        if (views <= 0) {
            return 0.0;
        }
        double rate = (double) (item.reactionsOrZero() + item.forwardsOrZero()) / views;
        return Math.min(10.0, rate * 50.0);
    }

    static double lengthScore(int length) {
        if (length >= OPTIMAL_LENGTH_MIN && length <= OPTIMAL_LENGTH_MAX) {
            return 10.0;
        }
        if ((length >= ACCEPTABLE_LENGTH_MIN && length < OPTIMAL_LENGTH_MIN)
                || (length > OPTIMAL_LENGTH_MAX && length <= ACCEPTABLE_LENGTH_MAX)) {
            return 7.0;
        }
        return 4.0;
    }

    static double readabilityScore(String text) {
        double score = 5.0;

        String[] paragraphs = TextSignals.paragraphs(text);
        double averageParagraph = averageLength(paragraphs);
        if (averageParagraph < 200) {
            score += 2;
        } else if (averageParagraph < 300) {
            score += 1;
        }

        if (TextSignals.countEmojis(text) > 0) {
            score += 1;
        }

        if (TextSignals.hasHtmlFormatting(text)) {
            score += 2;
        }

        String[] sentences = TextSignals.sentences(text);
        if (sentences.length > 1 && averageLength(sentences) < 100) {
            score += 1;
        }

        return Math.min(10.0, score);
    }

    static double freshnessScore(Instant postedAt, Instant now) {
        if (postedAt == null) {
            return 5.0;
        }
        long ageDays = Math.max(0, Duration.between(postedAt, now).toDays());
        if (ageDays <= 7) {
            return 10.0;
        }
        if (ageDays <= 30) {
            return 7.0;
        }
        if (ageDays <= 90) {
            return 5.0;
        }
        return 3.0;
    }

    static String explain(SubScores s) {
        Map<String, Double> dimensions = new LinkedHashMap<>();
        dimensions.put("views", s.views());
        dimensions.put("engagement", s.engagement());
        dimensions.put("length", s.length());
        dimensions.put("readability", s.readability());
        dimensions.put("freshness", s.freshness());

        List<String> strong = new ArrayList<>();
        List<String> weak = new ArrayList<>();
        dimensions.forEach((name, value) -> {
            if (value >= 8) {
                strong.add(strongLabel(name));
            } else if (value < 5) {
                weak.add(weakLabel(name));
            }
        });

        List<String> reasons = new ArrayList<>();
        if (!strong.isEmpty()) {
            reasons.add("Strong: " + String.join(", ", strong));
        }
        if (!weak.isEmpty()) {
            reasons.add("Weak: " + String.join(", ", weak));
        }
        if (reasons.isEmpty()) {
            reasons.add("Average performance across all metrics");
        }
        return String.join("; ", reasons);
    }

    private static String strongLabel(String dimension) {
        return switch (dimension) {
            case "views" -> "high views";
            case "engagement" -> "high engagement";
            case "length" -> "optimal length";
            case "readability" -> "good readability";
            case "freshness" -> "fresh content";
            default -> dimension;
        };
    }

    private static String weakLabel(String dimension) {
        return switch (dimension) {
            case "views" -> "low views";
            case "engagement" -> "low engagement";
            case "length" -> "suboptimal length";
            case "readability" -> "poor readability";
            case "freshness" -> "old content";
            default -> dimension;
        };
    }

    private static double averageLength(String[] parts) {
        if (parts.length == 0) {
            return 0.0;
        }
        long total = 0;
        for (String part : parts) {
            total += part.length();
        }
        return (double) total / parts.length;
    }
}
