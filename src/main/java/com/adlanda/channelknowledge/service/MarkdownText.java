package com.adlanda.channelknowledge.service;

import java.util.regex.Pattern;

/**
 * Reduces markdown to plain text before chunking. Level-two headers stay in place
 * because the chunker splits sections on them.
 */
public final class MarkdownText {

    private static final Pattern CODE_FENCE = Pattern.compile("^[ \\t]*```[^\\n]*\\n?", Pattern.MULTILINE);
    private static final Pattern INLINE_CODE = Pattern.compile("`([^`\\n]+)`");
    private static final Pattern IMAGE = Pattern.compile("!\\[([^\\]]*)\\]\\([^)]*\\)");
    private static final Pattern LINK = Pattern.compile("\\[([^\\]]+)\\]\\([^)]*\\)");
    private static final Pattern BOLD = Pattern.compile("(\\*\\*|__)(.+?)\\1");
    private static final Pattern ITALIC = Pattern.compile("(?<![\\w*])([*_])(?!\\s)(.+?)(?<!\\s)\\1(?![\\w*])");
    private static final Pattern OTHER_HEADERS = Pattern.compile("^(?:#|#{3,6})[ \\t]+", Pattern.MULTILINE);

    private MarkdownText() {
    }

    public static String strip(String markdown) {
        String text = CODE_FENCE.matcher(markdown).replaceAll("");
        text = INLINE_CODE.matcher(text).replaceAll("$1");
        text = IMAGE.matcher(text).replaceAll("$1");
        text = LINK.matcher(text).replaceAll("$1");
        text = BOLD.matcher(text).replaceAll("$2");
        text = ITALIC.matcher(text).replaceAll("$2");
        text = OTHER_HEADERS.matcher(text).replaceAll("");
        return text.strip();
    }
}
