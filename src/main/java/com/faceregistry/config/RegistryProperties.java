package com.faceregistry.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Data
@Component
@Validated
@ConfigurationProperties(prefix = "registry")
public class RegistryProperties {

    /** Similarity threshold applied when a request does not carry one. */
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private double defaultThreshold = 0.65;

    @Valid
    private DisplayCode displayCode = new DisplayCode();
    @Valid
    private Activity activity = new Activity();
    @Valid
    private Analyzer analyzer = new Analyzer();
    private Upload upload = new Upload();

    @Data
    public static class DisplayCode {
        @NotBlank
        private String prefix = "PERSON";
        @Min(1)
        private int maxAttempts = 8;
    }

    @Data
    public static class Activity {
        @Min(1)
        private int recentDefaultLimit = 20;
        @Min(1)
        private int recentMaxLimit = 500;
    }

    @Data
    public static class Analyzer {
        @NotBlank
        private String command = "python3";
        @NotBlank
        private String script = "../analyzer/analyze_face.py";
        private String workingDirectory;
        @Min(1)
        private long timeoutSeconds = 60;
    }

    @Data
    public static class Upload {
        private String tempDirectory;
    }
}
