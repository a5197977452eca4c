package com.faceregistry.service;

import com.faceregistry.config.RegistryProperties;
import com.faceregistry.dto.FaceAnalysis;
import com.faceregistry.dto.FaceAttributes;
import com.faceregistry.exception.FaceAnalysisException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs the external analysis script on a staged copy of the image and parses the JSON report it
 * prints as its last line of output.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScriptFaceAnalyzer implements FaceAnalyzer {

    private final RegistryProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public FaceAnalysis analyze(byte[] image) throws FaceAnalysisException {
        if (image == null || image.length == 0) {
            throw new FaceAnalysisException("Image is empty");
        }
        Path staged = null;
        Path output = null;
        try {
            staged = stage(image);
            output = createTempFile(".log");
            return parse(run(staged, output));
        } catch (IOException e) {
            throw new FaceAnalysisException("Could not run face analysis: " + e.getMessage(), e);
        } finally {
            cleanup(staged);
            cleanup(output);
        }
    }

    private String run(Path imagePath, Path outputPath) throws IOException, FaceAnalysisException {
        RegistryProperties.Analyzer analyzer = properties.getAnalyzer();

        List<String> command = new ArrayList<>();
        command.add(analyzer.getCommand());
        command.add(analyzer.getScript());
        command.add("--image");
        command.add(imagePath.toAbsolutePath().toString());

        ProcessBuilder pb = new ProcessBuilder(command);
        if (analyzer.getWorkingDirectory() != null) {
            pb.directory(new File(analyzer.getWorkingDirectory()));
        }
        // Merged output goes to a file: a full pipe would stall the child until the timeout
        pb.redirectErrorStream(true);
        pb.redirectOutput(outputPath.toFile());

        log.debug("Starting face analysis: {}", command);
        Process process = pb.start();

        try {
            if (!process.waitFor(analyzer.getTimeoutSeconds(), TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new FaceAnalysisException("Face analysis timed out after " + analyzer.getTimeoutSeconds() + "s");
            }
            List<String> lines = readLines(outputPath);
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                log.error("Face analysis failed with exit code: {}", exitCode);
                throw new FaceAnalysisException("Face analysis exited with code " + exitCode + lastLineSuffix(lines));
            }
            return lastNonBlank(lines);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new FaceAnalysisException("Face analysis was interrupted", e);
        }
    }

    FaceAnalysis parse(String json) throws FaceAnalysisException {
        if (json == null || json.isBlank()) {
            throw new FaceAnalysisException("Face analysis produced no output");
        }
        AnalyzerReport report;
        try {
            report = objectMapper.readValue(json, AnalyzerReport.class);
        } catch (JsonProcessingException e) {
            throw new FaceAnalysisException("Face analysis output is not valid JSON", e);
        }
        if (report.getError() != null) {
            throw new FaceAnalysisException(report.getError());
        }
        if (report.getFacesFound() == null || report.getFacesFound() < 0) {
            throw new FaceAnalysisException("Face analysis did not report a face count");
        }

        int faces = report.getFacesFound();
        if (faces == 0) {
            return FaceAnalysis.noFace();
        }
        if (faces > 1) {
            return FaceAnalysis.faces(faces);
        }
        if (report.getEmbedding() == null || report.getEmbedding().length == 0) {
            throw new FaceAnalysisException("Face analysis found one face but returned no embedding");
        }
        FaceAttributes attributes = FaceAttributes.builder()
                .age(report.getAge() != null ? (int) Math.round(report.getAge()) : null)
                .dominantGender(report.getDominantGender())
                .genderScores(report.getGender())
                .dominantEmotion(report.getDominantEmotion())
                .emotionScores(report.getEmotion())
                .dominantEthnicity(report.getDominantRace())
                .ethnicityScores(report.getRace())
                .build();
        return FaceAnalysis.singleFace(report.getEmbedding(), attributes);
    }

    private Path stage(byte[] image) throws IOException {
        Path staged = createTempFile(".img");
        Files.write(staged, image);
        return staged;
    }

    private Path createTempFile(String suffix) throws IOException {
        String tempDirectory = properties.getUpload().getTempDirectory();
        if (tempDirectory == null) {
            return Files.createTempFile("face-", suffix);
        }
        Path dir = Path.of(tempDirectory);
        Files.createDirectories(dir);
        return Files.createTempFile(dir, "face-", suffix);
    }

    private void cleanup(Path staged) {
        if (staged == null) {
            return;
        }
        try {
            Files.deleteIfExists(staged);
        } catch (IOException e) {
            log.warn("Could not delete staged image {}: {}", staged, e.getMessage());
        }
    }

    private static List<String> readLines(Path outputPath) throws IOException {
        List<String> lines = new String(Files.readAllBytes(outputPath), StandardCharsets.UTF_8).lines().toList();
        if (log.isDebugEnabled()) {
            lines.forEach(line -> log.debug("Analyzer output: {}", line));
        }
        return lines;
    }

    private static String lastNonBlank(List<String> lines) {
        for (int i = lines.size() - 1; i >= 0; i--) {
            if (!lines.get(i).isBlank()) {
                return lines.get(i).trim();
            }
        }
        return null;
    }

    private static String lastLineSuffix(List<String> lines) {
        String last = lastNonBlank(lines);
        return last == null ? "" : ": " + last;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class AnalyzerReport {
        @JsonProperty("faces_found")
        private Integer facesFound;
        private float[] embedding;
        private Double age;
        @JsonProperty("dominant_gender")
        private String dominantGender;
        private Map<String, Double> gender;
        @JsonProperty("dominant_emotion")
        private String dominantEmotion;
        private Map<String, Double> emotion;
        @JsonProperty("dominant_race")
        private String dominantRace;
        private Map<String, Double> race;
        private String error;
    }
}
