package com.faceregistry.dto;

import com.faceregistry.entity.Identity;
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
public class PersonSummary {

    private String identityId;
    private String personCode;
    private LocalDateTime firstSeen;
    private LocalDateTime lastSeen;
    private int totalDetections;
    private Double avgConfidence;
    private Integer estimatedAge;
    private String estimatedGender;

    public static PersonSummary from(Identity identity) {
        return PersonSummary.builder()
                .identityId(identity.getId())
                .personCode(identity.getDisplayCode())
                .firstSeen(identity.getFirstSeen())
                .lastSeen(identity.getLastSeen())
                .totalDetections(identity.getTotalDetections())
                .avgConfidence(identity.getConfidenceAverage())
                .estimatedAge(identity.getAgeEstimate())
                .estimatedGender(identity.getGenderEstimate())
                .build();
    }
}
