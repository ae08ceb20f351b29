package com.learnguard.core.escalation;

import com.learnguard.common.model.LearningRequest;
import com.learnguard.common.model.LearningResponse;
import com.learnguard.common.model.SafetyCheck;
import com.learnguard.common.model.SafetyLevel;
import com.learnguard.core.config.EscalationProperties;
import com.learnguard.core.config.SafetyProperties;
import com.learnguard.core.escalation.notification.NotificationDispatcher;
import com.learnguard.core.escalation.notification.TeacherNotification;
import com.learnguard.core.escalation.rules.ConditionEvaluator;
import com.learnguard.core.escalation.rules.ConditionType;
import com.learnguard.core.escalation.rules.DefaultEscalationRules;
import com.learnguard.core.escalation.rules.EmotionalDistressEvaluator;
import com.learnguard.core.escalation.rules.EscalationAction;
import com.learnguard.core.escalation.rules.EscalationCondition;
import com.learnguard.core.escalation.rules.EscalationContext;
import com.learnguard.core.escalation.rules.EscalationRule;
import com.learnguard.core.escalation.rules.RepeatedQuestionTracker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Decides when a person has to look at a learner's question, records the incident and
 * alerts the assigned teacher.
 * <p>
 * Evaluation order is fixed:
 * <ol>
 *   <li>distress or harm phrasing in the question escalates at critical, no rule consulted</li>
 *   <li>any failed safety check at or above the escalation threshold escalates at high</li>
 *   <li>the first rule whose conditions all hold escalates at the rule's priority</li>
 * </ol>
 */
@Service
@Slf4j
public class EscalationEngine {

    static final String DISTRESS_REASON = "Student emotional distress or harm intent detected";
    static final String SAFETY_REASON_PREFIX = "High-risk safety violations: ";
    static final String RULE_REASON_PREFIX = "Rule triggered: ";

    static final Map<SafetyLevel, List<String>> SEVERITY_CHANNELS = new EnumMap<>(SafetyLevel.class);

    static {
        SEVERITY_CHANNELS.put(SafetyLevel.CRITICAL, List.of("email", "sms", "in_app", "push"));
        SEVERITY_CHANNELS.put(SafetyLevel.HIGH, List.of("email", "in_app", "push"));
        SEVERITY_CHANNELS.put(SafetyLevel.MEDIUM, List.of("email", "in_app"));
        SEVERITY_CHANNELS.put(SafetyLevel.LOW, List.of("in_app"));
    }

    private final SafetyProperties safetyProperties;
    private final Map<ConditionType, ConditionEvaluator> evaluators = new EnumMap<>(ConditionType.class);
    private final RepeatedQuestionTracker questionTracker;
    private final EscalationEventStore eventStore;
    private final TeacherDirectory teacherDirectory;
    private final NotificationDispatcher notificationDispatcher;
    private final Clock clock;

    private volatile List<EscalationRule> rules;

    @Autowired
    public EscalationEngine(SafetyProperties safetyProperties,
                            EscalationProperties escalationProperties,
                            List<ConditionEvaluator> conditionEvaluators,
                            RepeatedQuestionTracker questionTracker,
                            EscalationEventStore eventStore,
                            TeacherDirectory teacherDirectory,
                            NotificationDispatcher notificationDispatcher) {
        this(safetyProperties, escalationProperties, conditionEvaluators, questionTracker, eventStore,
            teacherDirectory, notificationDispatcher, Clock.systemUTC());
    }

    EscalationEngine(SafetyProperties safetyProperties,
                     EscalationProperties escalationProperties,
                     List<ConditionEvaluator> conditionEvaluators,
                     RepeatedQuestionTracker questionTracker,
                     EscalationEventStore eventStore,
                     TeacherDirectory teacherDirectory,
                     NotificationDispatcher notificationDispatcher,
                     Clock clock) {
        this.safetyProperties = safetyProperties;
        conditionEvaluators.forEach(evaluator -> evaluators.put(evaluator.type(), evaluator));
        this.questionTracker = questionTracker;
        this.eventStore = eventStore;
        this.teacherDirectory = teacherDirectory;
        this.notificationDispatcher = notificationDispatcher;
        this.clock = clock;

        List<EscalationRule> configured = escalationProperties.toRules();
        this.rules = configured.isEmpty() ? DefaultEscalationRules.create() : configured;
        log.info("[ESCALATION] Engine ready | rules={} | source={} | enabled={}",
            rules.size(), configured.isEmpty() ? "defaults" : "configuration", safetyProperties.isEscalationEnabled());
    }

    // ========== Evaluation ==========

    public EscalationDecision evaluate(LearningRequest request, List<SafetyCheck> safetyChecks, LearningResponse response) {
        if (!safetyProperties.isEscalationEnabled()) {
            return EscalationDecision.none();
        }
        List<SafetyCheck> checks = safetyChecks == null ? List.of() : safetyChecks;
        String query = request.getQuery();
        Instant askedAt = request.getTimestamp() == null ? clock.instant() : request.getTimestamp();
        questionTracker.record(request.getUserId(), query, askedAt);

        if (EmotionalDistressEvaluator.isAcute(query)) {
            return EscalationDecision.builder()
                .shouldEscalate(true)
                .reason(DISTRESS_REASON)
                .severity(SafetyLevel.CRITICAL)
                .action(EscalationAction.notifyTeacher(Map.of(
                    EscalationAction.URGENCY, "immediate",
                    EscalationAction.INVOLVE_COUNSELOR, "true")))
                .channels(SEVERITY_CHANNELS.get(SafetyLevel.CRITICAL))
                .build();
        }

        Set<String> violations = checks.stream()
            .filter(check -> !check.isPassed())
            .filter(check -> check.getConfidence() >= safetyProperties.getEscalationThreshold())
            .map(SafetyCheck::getType)
            .collect(Collectors.toCollection(LinkedHashSet::new));
        if (!violations.isEmpty()) {
            return EscalationDecision.builder()
                .shouldEscalate(true)
                .reason(SAFETY_REASON_PREFIX + String.join(", ", violations))
                .severity(SafetyLevel.HIGH)
                .action(EscalationAction.notifyTeacher(Map.of(EscalationAction.URGENCY, "immediate")))
                .channels(SEVERITY_CHANNELS.get(SafetyLevel.HIGH))
                .build();
        }

        EscalationContext context = new EscalationContext(request, checks, response);
        for (EscalationRule rule : rules) {
            if (rule.isEnabled() && allConditionsHold(rule, context)) {
                SafetyLevel severity = rule.getPriority() == null ? SafetyLevel.MEDIUM : rule.getPriority();
                Set<String> channels = new LinkedHashSet<>(SEVERITY_CHANNELS.get(severity));
                channels.addAll(rule.getChannels());
                log.debug("[ESCALATION] Rule matched | ruleId={} | requestId={}", rule.getId(), request.getId());
                return EscalationDecision.builder()
                    .shouldEscalate(true)
                    .reason(RULE_REASON_PREFIX + rule.getName())
                    .severity(severity)
                    .ruleId(rule.getId())
                    .action(rule.getAction())
                    .channels(channels)
                    .build();
            }
        }
        return EscalationDecision.none();
    }

    private boolean allConditionsHold(EscalationRule rule, EscalationContext context) {
        if (rule.getConditions().isEmpty()) {
            return false;
        }
        for (EscalationCondition condition : rule.getConditions()) {
            ConditionEvaluator evaluator = evaluators.get(condition.getType());
            if (evaluator == null) {
                log.warn("[ESCALATION] No evaluator for condition, rule skipped | ruleId={} | condition={}",
                    rule.getId(), condition.getType());
                return false;
            }
            if (!evaluator.matches(condition, context)) {
                return false;
            }
        }
        return true;
    }

    // ========== Incidents ==========

    /**
     * Records the incident, looks up the learner's teacher and sends the alert.
     * Notification happens in the background; an unassigned event is still announced.
     */
    public EscalationEvent createEvent(LearningRequest request, EscalationDecision decision) {
        String teacherId = teacherDirectory.lookup(request.getUserId(), request.courseId()).orElse(null);
        EscalationEvent event = EscalationEvent.builder()
            .id(UUID.randomUUID().toString())
            .userId(request.getUserId())
            .sessionId(request.getSessionId())
            .requestId(request.getId())
            .courseId(request.courseId())
            .query(request.getQuery())
            .reason(decision.getReason())
            .severity(decision.getSeverity())
            .ruleId(decision.getRuleId())
            .teacherId(teacherId)
            .createdAt(clock.instant())
            .build();
        eventStore.append(event);

        log.warn("[ESCALATION] Escalation created | escalationId={} | userId={} | severity={} | teacherId={} | reason={}",
            event.getId(), event.getUserId(), event.getSeverity(), teacherId == null ? "unassigned" : teacherId,
            event.getReason());

        EscalationAction action = decision.getAction();
        if (action != null) {
            switch (action.getType()) {
                case BLOCK_USER -> log.warn("[ESCALATION] User block requested | userId={} | escalationId={}",
                    event.getUserId(), event.getId());
                case REQUIRE_SUPERVISION -> log.info("[ESCALATION] Supervision required | userId={} | escalationId={}",
                    event.getUserId(), event.getId());
                case CUSTOM_RESPONSE -> log.info("[ESCALATION] Custom response requested | escalationId={} | message={}",
                    event.getId(), action.getParameters().get("message"));
                default -> log.debug("[ESCALATION] Teacher notification only | escalationId={}", event.getId());
            }
        }

        notificationDispatcher.dispatch(composeNotification(event, request, action), decision.getChannels());
        return event;
    }

    /**
     * @throws EscalationNotFoundException if no active escalation has this id
     * @throws EscalationUnauthorizedException if another teacher is assigned
     */
    public EscalationEvent resolve(String escalationId, String teacherId, String resolution) {
        EscalationEvent event = eventStore.findActive(escalationId)
            .orElseThrow(() -> new EscalationNotFoundException(escalationId));
        if (event.isAssigned() && !event.getTeacherId().equals(teacherId)) {
            throw new EscalationUnauthorizedException(escalationId, teacherId);
        }
        EscalationEvent resolved = event.resolve(teacherId, resolution, clock.instant());
        eventStore.markResolved(resolved);
        log.info("[ESCALATION] Escalation resolved | escalationId={} | teacherId={} | minutesOpen={}",
            escalationId, teacherId, resolved.timeToResolve().toMinutes());
        return resolved;
    }

    public List<EscalationEvent> getUserHistory(String userId, int limit) {
        return eventStore.history(userId, limit);
    }

    public List<EscalationEvent> getActiveEscalations() {
        return eventStore.active();
    }

    public List<EscalationEvent> getTeacherEscalations(String teacherId) {
        return eventStore.active().stream()
            .filter(event -> teacherId.equals(event.getTeacherId()))
            .toList();
    }

    public long getActiveCount(String userId) {
        return eventStore.active().stream().filter(event -> userId.equals(event.getUserId())).count();
    }

    public EscalationMetrics getMetrics(Instant from, Instant to) {
        List<EscalationEvent> events = eventStore.between(from, to);
        long resolved = events.stream().filter(EscalationEvent::isResolved).count();

        Map<String, Long> byReason = new TreeMap<>();
        events.forEach(event -> byReason.merge(event.getReason(), 1L, Long::sum));

        Map<String, Long> bySeverity = new LinkedHashMap<>();
        for (SafetyLevel level : SafetyLevel.values()) {
            bySeverity.put(level.getCode(), 0L);
        }
        events.forEach(event -> bySeverity.merge(event.getSeverity().getCode(), 1L, Long::sum));

        double averageMinutes = events.stream()
            .filter(EscalationEvent::isResolved)
            .map(EscalationEvent::timeToResolve)
            .filter(Objects::nonNull)
            .mapToDouble(duration -> duration.toMillis() / 60_000.0)
            .average()
            .orElse(0.0);

        return EscalationMetrics.builder()
            .from(from)
            .to(to)
            .totalEscalations(events.size())
            .activeEscalations(events.size() - resolved)
            .resolvedEscalations(resolved)
            .byReason(byReason)
            .bySeverity(bySeverity)
            .resolutionRate(events.isEmpty() ? 0.0 : round2(resolved * 100.0 / events.size()))
            .averageResolutionMinutes(round2(averageMinutes))
            .build();
    }

    // ========== Configuration ==========

    public List<EscalationRule> getRules() {
        return rules;
    }

    public void updateRules(List<EscalationRule> newRules) {
        for (EscalationRule rule : newRules) {
            if (rule.getId() == null || rule.getId().isBlank()) {
                throw new IllegalArgumentException("Escalation rule id is required");
            }
        }
        this.rules = List.copyOf(newRules);
        log.info("[ESCALATION] Rules updated | rules={}", newRules.stream().map(EscalationRule::getId).toList());
    }

    public void assignTeacher(String studentId, String courseId, String teacherId) {
        teacherDirectory.assign(studentId, courseId, teacherId);
    }

    public boolean removeTeacher(String studentId, String courseId, String teacherId) {
        return teacherDirectory.remove(studentId, courseId, teacherId);
    }

    // ========== Helpers ==========

    private TeacherNotification composeNotification(EscalationEvent event, LearningRequest request, EscalationAction action) {
        String severity = event.getSeverity().getCode().toUpperCase(Locale.ROOT);
        String courseName = request.getCourseContext() == null || request.getCourseContext().getCourseName() == null
            ? "Unknown Course"
            : request.getCourseContext().getCourseName();

        List<String> lines = new ArrayList<>();
        lines.add("Student Escalation Alert");
        lines.add("");
        lines.add("Student ID: " + event.getUserId());
        lines.add("Course: " + courseName);
        lines.add("Time: " + event.getCreatedAt());
        lines.add("Severity: " + severity);
        lines.add("Reason: " + event.getReason());
        lines.add("");
        lines.add("Student Question: \"" + event.getQuery() + "\"");
        if (action != null) {
            List<String> hints = new ArrayList<>();
            if ("immediate".equals(action.getParameters().get(EscalationAction.URGENCY))) {
                hints.add("IMMEDIATE ATTENTION REQUIRED");
            }
            if (action.hasFlag(EscalationAction.INVOLVE_COUNSELOR)) {
                hints.add("Consider involving school counselor");
            }
            if (action.hasFlag(EscalationAction.INTERVENTION_NEEDED)) {
                hints.add("Student may need additional learning support");
            }
            if (action.hasFlag(EscalationAction.EXPERTISE_NEEDED)) {
                hints.add("Question requires subject matter expertise");
            }
            if (!hints.isEmpty()) {
                lines.add("");
                lines.addAll(hints);
            }
        }
        lines.add("");
        lines.add("Please review and take appropriate action through the teacher portal.");

        return TeacherNotification.builder()
            .escalationId(event.getId())
            .teacherId(event.getTeacherId())
            .studentId(event.getUserId())
            .severity(event.getSeverity())
            .subject("Student Escalation Alert - " + severity)
            .message(String.join("\n", lines))
            .createdAt(event.getCreatedAt())
            .build();
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
