package com.faceregistry.dto;

import com.faceregistry.entity.DetectionEvent;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DetectionEventView {

    private String eventId;
    private String identityId;
    private String displayCode;
    private DetectionEvent.EventKind kind;
    private LocalDateTime detectedAt;
    private Double confidence;
    private String contentFingerprint;
    private FaceAttributes attributes;

    public static DetectionEventView from(DetectionEvent event) {
        return DetectionEventView.builder()
                .eventId(event.getId())
                .identityId(event.getIdentity().getId())
                .displayCode(event.getIdentity().getDisplayCode())
                .kind(event.getKind())
                .detectedAt(event.getDetectedAt())
                .confidence(event.getConfidence())
                .contentFingerprint(event.getContentFingerprint())
                .attributes(FaceAttributes.builder()
                        .age(event.getAgeDetected())
                        .dominantGender(event.getGenderDetected())
                        .genderScores(event.getGenderScores())
                        .dominantEmotion(event.getEmotionDetected())
                        .emotionScores(event.getEmotionScores())
                        .dominantEthnicity(event.getEthnicityDetected())
                        .ethnicityScores(event.getEthnicityScores())
                        .build())
                .build();
    }
}
