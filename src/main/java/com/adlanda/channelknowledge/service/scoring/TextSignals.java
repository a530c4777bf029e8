package com.adlanda.channelknowledge.service.scoring;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Surface features of post text used by readability scoring and style tags.
 */
final class TextSignals {

    private static final Pattern EMOJI_RUN = Pattern.compile(
            "[\\x{1F300}-\\x{1F5FF}\\x{1F600}-\\x{1F64F}\\x{1F680}-\\x{1F6FF}\\x{1F900}-\\x{1FAFF}"
                    + "\\x{1F1E0}-\\x{1F1FF}\\x{2600}-\\x{27BF}]+");

    private static final List<String> HTML_TAGS =
            List.of("<b>", "<i>", "<u>", "<s>", "<code>", "<pre>", "<blockquote>", "<a href");

    private static final List<Pattern> CALL_TO_ACTION = List.of(
            Pattern.compile("переход(и|ите) по ссылке"),
            Pattern.compile("узна(й|йте) больше"),
            Pattern.compile("закаж(и|ите)"),
            Pattern.compile("напиш(и|ите)"),
            Pattern.compile("подпис(ывайся|ывайтесь)"),
            Pattern.compile("жм(и|ите)"),
            Pattern.compile("переход(и|ите)"),
            Pattern.compile("\\b(click|tap) (the|this) link\\b"),
            Pattern.compile("\\blearn more\\b"),
            Pattern.compile("\\border now\\b"),
            Pattern.compile("\\b(message|write to|dm) (me|us)\\b"),
            Pattern.compile("\\bsubscribe\\b"));

    private TextSignals() {
    }

    /**
     * Number of emoji runs; adjacent emoji count once.
     */
    static int countEmojis(String text) {
        Matcher matcher = EMOJI_RUN.matcher(text);
        int runs = 0;
        while (matcher.find()) {
            runs++;
        }
        return runs;
    }

    static boolean hasHtmlFormatting(String text) {
        return HTML_TAGS.stream().anyMatch(text::contains);
    }

    static boolean hasCallToAction(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return CALL_TO_ACTION.stream().anyMatch(p -> p.matcher(lower).find());
    }

    static int paragraphCount(String text) {
        int count = 1;
        int from = 0;
        int found;
        while ((found = text.indexOf("\n\n", from)) >= 0) {
            count++;
            from = found + 2;
        }
        return count;
    }

    static String[] paragraphs(String text) {
        return text.split("\n\n", -1);
    }

    static String[] sentences(String text) {
        return text.split("\\. ", -1);
    }
}
