package com.adlanda.channelknowledge.service.scoring;

import com.adlanda.channelknowledge.model.Tone;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Tone by keyword lookup. Tables are checked in order (motivational, promotional,
 * informational); the first table with a hit wins, otherwise the post is conversational.
 */
public class KeywordToneClassifier implements ToneClassifier {

    private static final Map<Tone, List<String>> DEFAULT_KEYWORDS = defaultKeywords();

    private final Map<Tone, List<String>> keywords;

    public KeywordToneClassifier() {
        this(DEFAULT_KEYWORDS);
    }

    public KeywordToneClassifier(Map<Tone, List<String>> keywords) {
        this.keywords = new LinkedHashMap<>(keywords);
    }

    @Override
    public Tone classify(String text) {
        if (text == null || text.isBlank()) {
            return Tone.CONVERSATIONAL;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<Tone, List<String>> table : keywords.entrySet()) {
            for (String keyword : table.getValue()) {
                if (lower.contains(keyword)) {
                    return table.getKey();
                }
            }
        }
        return Tone.CONVERSATIONAL;
    }

    private static Map<Tone, List<String>> defaultKeywords() {
        Map<Tone, List<String>> tables = new LinkedHashMap<>();
        tables.put(Tone.MOTIVATIONAL, List.of(
                "успех", "достичь", "мечта", "цель", "вдохнов", "возможность", "результат", "изменить", "поверь",
                "success", "achieve", "dream", "goal", "inspir", "believe in"));
        tables.put(Tone.PROMOTIONAL, List.of(
                "акция", "скидка", "специальное предложение", "только сегодня", "успей",
                "discount", "special offer", "sale", "today only", "limited offer", "promo code"));
        tables.put(Tone.INFORMATIONAL, List.of(
                "узнать", "информация", "важно", "обратите внимание", "факт",
                "important", "information", "note that", "did you know", "fact"));
        return tables;
    }
}
