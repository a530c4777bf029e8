package com.adlanda.channelknowledge.model;

/**
 * The five quality dimensions, each in [0, 10].
 */
public record SubScores(
        double views,
        double engagement,
        double length,
        double readability,
        double freshness
) {
}
