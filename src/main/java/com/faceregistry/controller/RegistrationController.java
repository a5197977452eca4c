package com.faceregistry.controller;

import com.faceregistry.dto.RegistrationOutcome;
import com.faceregistry.service.RegistrationEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RegistrationController {

    private final RegistrationEngine registrationEngine;

    /**
     * Checks whether the person in the image was seen before and registers them if not.
     */
    @PostMapping(value = "/check-person", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<RegistrationOutcome> checkPerson(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "threshold", required = false) Double threshold) throws IOException {

        if (file.isEmpty()) {
            throw new IllegalArgumentException("Please select an image to upload");
        }
        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            throw new IllegalArgumentException("File must be an image");
        }

        RegistrationOutcome outcome = threshold != null
                ? registrationEngine.register(file.getBytes(), threshold)
                : registrationEngine.register(file.getBytes());

        if (outcome.getStatus() == RegistrationOutcome.Status.ANALYSIS_FAILED) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(outcome);
        }
        return ResponseEntity.ok(outcome);
    }
}
