package com.example.shifttrade.service;

import com.example.shifttrade.config.EligibilityRulesProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EligibilityClassifierTest {

    private EligibilityClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new EligibilityClassifier(new EligibilityRulesProperties());
    }

    @ParameterizedTest
    @ValueSource(strings = {"Day 1", "day-2", "D3", "Eve 1", "Evening 2", "E3", "Night 1", "n2",
            "Pod A 1", "pod-b-2", "PodA 2", "podb1", "Side", "Fast track side", "A1", "c 2"})
    void slotVocabularyIsTradable(String title) {
        assertThat(classifier.classify(title)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"Trauma Day 1", "Ultrasound N2", "US Day 1", "Sick Call", "sickcall day 1"})
    void excludeWinsOverAllow(String title) {
        assertThat(classifier.classify(title)).isFalse();
    }

    @Test
    void traumaDayOneIsNotTradable() {
        assertThat(classifier.classify("Trauma Day 1")).isFalse();
        assertThat(classifier.classify("Day 1")).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"Staff meeting", "Day 4", "D12", "Admin", "Conference", "Bus duty"})
    void titlesWithoutSlotVocabularyAreNotTradable(String title) {
        assertThat(classifier.classify(title)).isFalse();
    }

    @Test
    void missingTitlesAreNotTradable() {
        assertThat(classifier.classify(null)).isFalse();
        assertThat(classifier.classify("")).isFalse();
        assertThat(classifier.classify("   ")).isFalse();
    }

    @Test
    void patternTablesComeFromConfiguration() {
        EligibilityRulesProperties rules = new EligibilityRulesProperties();
        rules.setExclude(List.of("orientation"));
        rules.setAllow(List.of("\\bswing\\b"));

        EligibilityClassifier custom = new EligibilityClassifier(rules);

        assertThat(custom.classify("Swing")).isTrue();
        assertThat(custom.classify("Swing orientation")).isFalse();
        assertThat(custom.classify("Day 1")).isFalse();
        assertThat(custom.classify("Trauma swing")).isTrue();
    }
}
