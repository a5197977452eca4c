package com.faceregistry.entity;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScoreMapConverterTest {

    private final ScoreMapConverter converter = new ScoreMapConverter();

    @Test
    void keepsLabelOrder() {
        Map<String, Double> scores = new LinkedHashMap<>();
        scores.put("happy", 81.5);
        scores.put("neutral", 12.0);
        scores.put("sad", 6.5);

        String json = converter.convertToDatabaseColumn(scores);

        assertThat(json).isEqualTo("{\"happy\":81.5,\"neutral\":12.0,\"sad\":6.5}");
        assertThat(converter.convertToEntityAttribute(json).keySet()).containsExactly("happy", "neutral", "sad");
    }

    @Test
    void emptyDistributionIsStoredAsNull() {
        assertThat(converter.convertToDatabaseColumn(Map.of())).isNull();
        assertThat(converter.convertToEntityAttribute(" ")).isNull();
    }

    @Test
    void corruptColumnFailsLoudly() {
        assertThatThrownBy(() -> converter.convertToEntityAttribute("{not json"))
                .isInstanceOf(IllegalStateException.class);
    }
}
