package com.faceregistry.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.LinkedHashMap;
import java.util.Map;

@Converter
public class ScoreMapConverter implements AttributeConverter<Map<String, Double>, String> {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<LinkedHashMap<String, Double>> SCORES = new TypeReference<>() {
    };

    @Override
    public String convertToDatabaseColumn(Map<String, Double> scores) {
        if (scores == null || scores.isEmpty()) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(scores);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Could not serialize score distribution", e);
        }
    }

    @Override
    public Map<String, Double> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return MAPPER.readValue(json, SCORES);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored score distribution is not valid JSON", e);
        }
    }
}
