package com.learnguard.api.controller;

import com.learnguard.core.moderation.ModerationPipeline;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/moderation")
@RequiredArgsConstructor
public class ModerationController {

    private final ModerationPipeline moderationPipeline;

    @GetMapping("/checkers")
    public ResponseEntity<Map<String, Object>> getCheckers() {
        return ResponseEntity.ok(moderationPipeline.getCheckerConfiguration());
    }

    /**
     * Enables or disables checkers by type, e.g. {@code {"profanity": false}}.
     */
    @PatchMapping("/checkers")
    public ResponseEntity<Map<String, Object>> updateCheckers(@RequestBody Map<String, Boolean> changes) {
        moderationPipeline.updateCheckers(changes);
        return ResponseEntity.ok(moderationPipeline.getCheckerConfiguration());
    }
}
