package com.faceregistry.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
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
public class RegistrationOutcome {

    private Status status;
    private boolean seenBefore;
    private String message;

    private String identityId;
    private String displayCode;
    private Double confidence;
    private Integer totalDetections;
    private LocalDateTime firstSeen;
    private Double avgConfidence;

    private String eventId;
    private String originalEventId;
    private Integer facesFound;

    private FaceAttributes analysis;
    private String error;

    public enum Status {
        NO_FACE("no_face"),
        MULTIPLE_FACES("multiple_faces"),
        EXACT_DUPLICATE("exact_duplicate"),
        PERSON_RECOGNIZED("person_recognized"),
        NEW_PERSON_REGISTERED("new_person_registered"),
        ANALYSIS_FAILED("analysis_failed");

        private final String code;

        Status(String code) {
            this.code = code;
        }

        @JsonValue
        public String getCode() {
            return code;
        }
    }

    public static RegistrationOutcome noFace() {
        return RegistrationOutcome.builder()
                .status(Status.NO_FACE)
                .facesFound(0)
                .message("No face detected in the image")
                .build();
    }

    public static RegistrationOutcome multipleFaces(int facesFound) {
        return RegistrationOutcome.builder()
                .status(Status.MULTIPLE_FACES)
                .facesFound(facesFound)
                .message("Multiple faces detected (" + facesFound + "). Please use an image with a single person.")
                .build();
    }

    public static RegistrationOutcome analysisFailed(String error) {
        return RegistrationOutcome.builder()
                .status(Status.ANALYSIS_FAILED)
                .message("Face analysis failed")
                .error(error)
                .build();
    }
}
