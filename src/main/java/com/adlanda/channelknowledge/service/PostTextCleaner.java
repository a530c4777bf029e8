package com.adlanda.channelknowledge.service;

import java.util.regex.Pattern;

/**
 * Removes links, mentions and excess blank lines from post text before chunking.
 */
public final class PostTextCleaner {

    private static final Pattern LINK = Pattern.compile("https?://\\S+");
    private static final Pattern MENTION = Pattern.compile("@\\w+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");

    private PostTextCleaner() {
    }

    public static String clean(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = LINK.matcher(text).replaceAll("");
        cleaned = MENTION.matcher(cleaned).replaceAll("");
        cleaned = BLANK_LINES.matcher(cleaned).replaceAll("\n\n");
        return cleaned.strip();
    }
}
