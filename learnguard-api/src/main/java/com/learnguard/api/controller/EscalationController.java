package com.learnguard.api.controller;

import com.learnguard.api.dto.request.ResolveEscalationRequest;
import com.learnguard.api.dto.request.TeacherAssignmentRequest;
import com.learnguard.core.coordinator.LearningRequestCoordinator;
import com.learnguard.core.escalation.EscalationEngine;
import com.learnguard.core.escalation.EscalationEvent;
import com.learnguard.core.escalation.EscalationMetrics;
import com.learnguard.core.escalation.rules.EscalationRule;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Teacher-facing view of escalations: history, active incidents, resolution and rule management.
 */
@RestController
@RequestMapping("/api/v1/escalations")
@RequiredArgsConstructor
@Slf4j
public class EscalationController {

    private static final Duration DEFAULT_METRICS_WINDOW = Duration.ofDays(7);

    private final EscalationEngine escalationEngine;
    private final LearningRequestCoordinator coordinator;

    @GetMapping("/active")
    public ResponseEntity<List<EscalationEvent>> getActive() {
        return ResponseEntity.ok(escalationEngine.getActiveEscalations());
    }

    @GetMapping("/users/{userId}")
    public ResponseEntity<List<EscalationEvent>> getUserHistory(
            @PathVariable String userId,
            @RequestParam(defaultValue = "10") int limit
    ) {
        return ResponseEntity.ok(escalationEngine.getUserHistory(userId, limit));
    }

    @GetMapping("/users/{userId}/status")
    public ResponseEntity<Map<String, Object>> getUserSafetyStatus(@PathVariable String userId) {
        return ResponseEntity.ok(coordinator.getUserSafetyStatus(userId));
    }

    @GetMapping("/teachers/{teacherId}")
    public ResponseEntity<List<EscalationEvent>> getTeacherEscalations(@PathVariable String teacherId) {
        return ResponseEntity.ok(escalationEngine.getTeacherEscalations(teacherId));
    }

    @PostMapping("/{escalationId}/resolve")
    public ResponseEntity<EscalationEvent> resolve(
            @PathVariable String escalationId,
            @Valid @RequestBody ResolveEscalationRequest request
    ) {
        log.info("Resolve request - escalationId: {}, teacherId: {}", escalationId, request.getTeacherId());
        return ResponseEntity.ok(escalationEngine.resolve(escalationId, request.getTeacherId(), request.getResolution()));
    }

    /**
     * Counts over {@code [from, to)}; defaults to the last seven days.
     */
    @GetMapping("/metrics")
    public ResponseEntity<EscalationMetrics> getMetrics(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to
    ) {
        Instant end = to != null ? to : Instant.now();
        Instant start = from != null ? from : end.minus(DEFAULT_METRICS_WINDOW);
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("'from' must be before 'to'");
        }
        return ResponseEntity.ok(escalationEngine.getMetrics(start, end));
    }

    @PostMapping("/assignments")
    public ResponseEntity<Void> assignTeacher(@Valid @RequestBody TeacherAssignmentRequest request) {
        escalationEngine.assignTeacher(request.getStudentId(), request.getCourseId(), request.getTeacherId());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/assignments")
    public ResponseEntity<Void> removeTeacher(@Valid @RequestBody TeacherAssignmentRequest request) {
        boolean removed = escalationEngine.removeTeacher(request.getStudentId(), request.getCourseId(), request.getTeacherId());
        return removed ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    @GetMapping("/rules")
    public ResponseEntity<List<EscalationRule>> getRules() {
        return ResponseEntity.ok(escalationEngine.getRules());
    }

    @PutMapping("/rules")
    public ResponseEntity<List<EscalationRule>> updateRules(@RequestBody List<EscalationRule> rules) {
        escalationEngine.updateRules(rules);
        return ResponseEntity.ok(escalationEngine.getRules());
    }
}
