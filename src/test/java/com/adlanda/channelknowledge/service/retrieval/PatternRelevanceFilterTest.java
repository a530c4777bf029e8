package com.adlanda.channelknowledge.service.retrieval;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.regex.PatternSyntaxException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PatternRelevanceFilterTest {

    private final PatternRelevanceFilter filter = new PatternRelevanceFilter();

    @ParameterizedTest
    @ValueSource(strings = {
            "Ингредиенты на порцию: два яйца",
            "Способ приготовления очень простой",
            "Preheat the oven to 180 degrees",
            "Live now https://vk.com/video-12345_678",
            "Подробности пишите в личку",
            "Это РАБОЧИЙ КАНАЛ команды"
    })
    void isIrrelevant_matchesDefaultDenylist(String content) {
        assertThat(filter.isIrrelevant(content)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "Как провести первую встречу с клиентом",
            "Three ways to follow up after a call",
            "Our channel grew by 20% this month"
    })
    void isIrrelevant_keepsOrdinaryContent(String content) {
        assertThat(filter.isIrrelevant(content)).isFalse();
    }

    @Test
    void isIrrelevant_blankContent_isWithheld() {
        assertThat(filter.isIrrelevant(null)).isTrue();
        assertThat(filter.isIrrelevant("  ")).isTrue();
    }

    @Test
    void customPatterns_replaceDefaults() {
        PatternRelevanceFilter custom = new PatternRelevanceFilter(List.of("giveaway"));

        assertThat(custom.size()).isEqualTo(1);
        assertThat(custom.isIrrelevant("Weekly GIVEAWAY starts now")).isTrue();
        assertThat(custom.isIrrelevant("Способ приготовления")).isFalse();
    }

    @Test
    void invalidPattern_failsFast() {
        assertThatThrownBy(() -> new PatternRelevanceFilter(List.of("([unclosed")))
                .isInstanceOf(PatternSyntaxException.class);
    }
}
