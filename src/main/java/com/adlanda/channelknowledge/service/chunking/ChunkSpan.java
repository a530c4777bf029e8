package com.adlanda.channelknowledge.service.chunking;

/**
 * One chunk produced by {@link ChunkingEngine}.
 *
 * @param index         position within the source, starting at 0
 * @param sectionTitle  title of the section the chunk came from, empty when untitled
 * @param titlePrefix   "[Title]\n\n" for titled sections, otherwise empty
 * @param body          chunk text without the prefix
 * @param overlapLength number of leading body characters repeated from the previous chunk
 */
public record ChunkSpan(int index, String sectionTitle, String titlePrefix, String body, int overlapLength) {

    public String content() {
        return titlePrefix + body;
    }

    public int length() {
        return titlePrefix.length() + body.length();
    }

    /**
     * The body without the characters repeated from the previous chunk.
     */
    public String newText() {
        return body.substring(overlapLength);
    }
}
