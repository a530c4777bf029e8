package com.adlanda.channelknowledge.service.retrieval;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Denylist of regular expressions, matched against lower-cased snippet text.
 */
public class PatternRelevanceFilter implements RelevanceFilter {

    /**
     * Recipes, bare video-stream links and internal routing phrases from channel exports.
     */
    public static final List<String> DEFAULT_PATTERNS = List.of(
            "ингредиенты?\\s+на\\s+порцию",
            "способ\\s+приготовления",
            "нарезаем|обжариваем|выкладываем|перемешиваем",
            "яичница\\s+с",
            "завтрак.*рецепт|рецепт.*завтрак",
            "ingredients\\s+per\\s+serving",
            "preheat\\s+the\\s+oven",
            "https?://(www\\.)?vk\\.com/video-?\\d+",
            "https?://(www\\.)?youtube\\.com/live",
            "https?://(www\\.)?vkvideo\\.ru",
            "рабочий\\s+канал",
            "закрытый\\s+канал",
            "пишите\\s+в\\s+личку",
            "свяжитесь\\s+с\\s+наставником",
            "обратитесь\\s+к\\s+куратору",
            "@\\w+\\s+бот"
    );

    private final List<Pattern> patterns;

    public PatternRelevanceFilter() {
        this(DEFAULT_PATTERNS);
    }

    /**
     * @throws java.util.regex.PatternSyntaxException if a pattern is not a valid regular expression
     */
    public PatternRelevanceFilter(List<String> expressions) {
        this.patterns = expressions.stream()
                .map(expression -> Pattern.compile(expression, Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS))
                .toList();
    }

    @Override
    public boolean isIrrelevant(String content) {
        if (content == null || content.isBlank()) {
            return true;
        }
        String lower = content.toLowerCase(Locale.ROOT);
        return patterns.stream().anyMatch(pattern -> pattern.matcher(lower).find());
    }

    public int size() {
        return patterns.size();
    }
}
