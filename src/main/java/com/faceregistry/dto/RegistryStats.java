package com.faceregistry.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RegistryStats {

    private long totalRegisteredPersons;
    private long totalDetections;
    private long totalExactDuplicates;
    @JsonProperty("detections_last_24h")
    private long detectionsLast24h;
    private MostSeenPerson mostSeenPerson;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class MostSeenPerson {
        private String personCode;
        private long detectionCount;
    }
}
