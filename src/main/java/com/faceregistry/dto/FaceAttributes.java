package com.faceregistry.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Demographic attributes reported by the face analyzer. Carried through to detection events
 * as-is; nothing in the registry interprets them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FaceAttributes {

    private Integer age;
    private String dominantGender;
    private Map<String, Double> genderScores;
    private String dominantEmotion;
    private Map<String, Double> emotionScores;
    private String dominantEthnicity;
    private Map<String, Double> ethnicityScores;

    public static FaceAttributes empty() {
        return new FaceAttributes();
    }
}
