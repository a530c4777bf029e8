package com.adlanda.channelknowledge.model;

/**
 * Outcome of scoring one post.
 *
 * @param qualityScore weighted score in [0, 10], one decimal
 * @param subScores    the five dimensions the score was combined from
 * @param styleTags    stylistic descriptors
 * @param reason       short human-readable explanation
 */
public record QualityAssessment(
        double qualityScore,
        SubScores subScores,
        StyleTags styleTags,
        String reason
) {

    public boolean passes(double threshold) {
        return qualityScore >= threshold;
    }
}
