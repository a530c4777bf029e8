package com.adlanda.channelknowledge.model;

/**
 * Stylistic descriptors attached to a scored post and stored with its index entries.
 */
public record StyleTags(
        Tone tone,
        LengthClass lengthClass,
        int emojiCount,
        boolean callToAction,
        boolean formatted,
        int paragraphCount
) {
}
