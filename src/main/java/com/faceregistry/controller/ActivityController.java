package com.faceregistry.controller;

import com.faceregistry.dto.DetectionEventView;
import com.faceregistry.dto.RegistryStats;
import com.faceregistry.service.ActivityLog;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ActivityController {

    private final ActivityLog activityLog;

    @GetMapping("/activity")
    public ResponseEntity<List<DetectionEventView>> getRecentActivity(
            @RequestParam(value = "limit", required = false) Integer limit) {
        return ResponseEntity.ok(activityLog.recent(limit));
    }

    @GetMapping("/stats")
    public ResponseEntity<RegistryStats> getStats() {
        return ResponseEntity.ok(activityLog.stats());
    }
}
