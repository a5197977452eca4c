package com.faceregistry.controller;

import com.faceregistry.dto.DetectionEventView;
import com.faceregistry.dto.PersonSummary;
import com.faceregistry.entity.Identity;
import com.faceregistry.service.ActivityLog;
import com.faceregistry.service.IdentityGallery;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/persons")
@RequiredArgsConstructor
public class PersonController {

    private final IdentityGallery identityGallery;
    private final ActivityLog activityLog;

    @GetMapping
    public ResponseEntity<List<PersonSummary>> getAllPersons() {
        return ResponseEntity.ok(identityGallery.getAllByLastSeen().stream()
                .map(PersonSummary::from)
                .toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<PersonSummary> getPerson(@PathVariable String id) {
        return ResponseEntity.ok(PersonSummary.from(identityGallery.getIdentity(id)));
    }

    @GetMapping("/{id}/detections")
    public ResponseEntity<List<DetectionEventView>> getPersonDetections(@PathVariable String id) {
        Identity identity = identityGallery.getIdentity(id);
        return ResponseEntity.ok(activityLog.eventsFor(identity));
    }
}
