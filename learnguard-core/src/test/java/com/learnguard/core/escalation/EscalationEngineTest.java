package com.learnguard.core.escalation;

import com.learnguard.common.model.CourseContext;
import com.learnguard.common.model.LearningRequest;
import com.learnguard.common.model.SafetyCheck;
import com.learnguard.common.model.SafetyLevel;
import com.learnguard.core.config.EscalationProperties;
import com.learnguard.core.config.SafetyProperties;
import com.learnguard.core.escalation.notification.NotificationDispatcher;
import com.learnguard.core.escalation.notification.TeacherNotification;
import com.learnguard.core.escalation.rules.ComplexAcademicEvaluator;
import com.learnguard.core.escalation.rules.ConditionType;
import com.learnguard.core.escalation.rules.EmotionalDistressEvaluator;
import com.learnguard.core.escalation.rules.EscalationAction;
import com.learnguard.core.escalation.rules.EscalationCondition;
import com.learnguard.core.escalation.rules.EscalationRule;
import com.learnguard.core.escalation.rules.RepeatedQuestionTracker;
import com.learnguard.core.escalation.rules.RepeatedQuestionsEvaluator;
import com.learnguard.core.escalation.rules.SafetyCheckFailedEvaluator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Map;

import static com.learnguard.core.support.TestRequests.request;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class EscalationEngineTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final SafetyProperties safetyProperties = new SafetyProperties();
    private final NotificationDispatcher dispatcher = mock(NotificationDispatcher.class);
    private final InMemoryEscalationEventStore store = new InMemoryEscalationEventStore();
    private final TeacherDirectory teachers = new TeacherDirectory();
    private MutableClock clock;
    private EscalationEngine engine;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        RepeatedQuestionTracker tracker = new RepeatedQuestionTracker();
        engine = new EscalationEngine(safetyProperties, new EscalationProperties(),
            List.of(new SafetyCheckFailedEvaluator(), new EmotionalDistressEvaluator(),
                new RepeatedQuestionsEvaluator(tracker), new ComplexAcademicEvaluator()),
            tracker, store, teachers, dispatcher, clock);
    }

    @Test
    void harmIntentShortCircuitsToCritical() {
        EscalationDecision decision = engine.evaluate(request("I want to hurt someone").build(), List.of(), null);

        assertTrue(decision.isShouldEscalate());
        assertEquals(SafetyLevel.CRITICAL, decision.getSeverity());
        assertNull(decision.getRuleId());
        assertEquals(List.of("email", "sms", "in_app", "push"), decision.getChannels());
    }

    @Test
    void distressMentionsDistressInReason() {
        LearningRequest request = request("I am so stressed and confused about everything, I want to give up").build();

        EscalationDecision decision = engine.evaluate(request, List.of(), null);

        assertTrue(decision.isShouldEscalate());
        assertTrue(decision.getReason().contains("distress"));
        assertEquals(SafetyLevel.CRITICAL, decision.getSeverity());
    }

    @Test
    void distressShortCircuitIgnoresRuleTable() {
        engine.updateRules(List.of());

        EscalationDecision decision = engine.evaluate(request("I feel hopeless about math").build(), List.of(), null);

        assertTrue(decision.isShouldEscalate());
        assertEquals(SafetyLevel.CRITICAL, decision.getSeverity());
    }

    @Test
    void confidentSafetyFailureEscalatesHigh() {
        List<SafetyCheck> checks = List.of(
            SafetyCheck.passed("profanity", 0.1, "ok"),
            SafetyCheck.failed("personal_information", 0.9, "email"));

        EscalationDecision decision = engine.evaluate(request("my email is a@b.co").build(), checks, null);

        assertTrue(decision.isShouldEscalate());
        assertEquals(SafetyLevel.HIGH, decision.getSeverity());
        assertEquals("High-risk safety violations: personal_information", decision.getReason());
    }

    @Test
    void weakSafetyFailureDoesNotEscalate() {
        List<SafetyCheck> checks = List.of(SafetyCheck.failed("educational_value", 0.6, "thin"));

        EscalationDecision decision = engine.evaluate(request("What is photosynthesis?").build(), checks, null);

        assertFalse(decision.isShouldEscalate());
    }

    @Test
    void complexAcademicRuleFiresAtLowPriority() {
        EscalationDecision decision = engine.evaluate(
            request("Can you help with my research on photosynthesis?").build(), List.of(), null);

        assertTrue(decision.isShouldEscalate());
        assertEquals("complex-academic", decision.getRuleId());
        assertEquals("Rule triggered: Complex academic question", decision.getReason());
        assertEquals(SafetyLevel.LOW, decision.getSeverity());
    }

    @Test
    void repeatedQuestionsEscalateOnTheThirdAsk() {
        Instant start = NOW;
        LearningRequest first = request("How do plants make food?").timestamp(start).build();
        LearningRequest second = request("how do plants make food").timestamp(start.plusSeconds(60)).build();
        LearningRequest third = request("How do the plants make food??").timestamp(start.plusSeconds(120)).build();

        assertFalse(engine.evaluate(first, List.of(), null).isShouldEscalate());
        assertFalse(engine.evaluate(second, List.of(), null).isShouldEscalate());
        EscalationDecision decision = engine.evaluate(third, List.of(), null);

        assertTrue(decision.isShouldEscalate());
        assertEquals("repeated-confusion", decision.getRuleId());
        assertEquals(SafetyLevel.MEDIUM, decision.getSeverity());
    }

    @Test
    void rulesAreConjunctive() {
        engine.updateRules(List.of(EscalationRule.builder()
            .id("complex-and-unsafe")
            .name("Complex and unsafe")
            .condition(EscalationCondition.of(ConditionType.COMPLEX_ACADEMIC, 1))
            .condition(EscalationCondition.of(ConditionType.SAFETY_CHECK_FAILED, 0.95))
            .action(EscalationAction.notifyTeacher(Map.of()))
            .priority(SafetyLevel.MEDIUM)
            .build()));

        EscalationDecision decision = engine.evaluate(request("quantum physics question").build(), List.of(), null);

        assertFalse(decision.isShouldEscalate());
    }

    @Test
    void disabledEscalationNeverFires() {
        safetyProperties.setEscalationEnabled(false);

        assertFalse(engine.evaluate(request("I want to hurt someone").build(), List.of(), null).isShouldEscalate());
    }

    @Test
    void createdEventIsAssignedAndAnnounced() {
        engine.assignTeacher("student-1", null, "teacher-7");
        LearningRequest request = request("I want to hurt someone")
            .courseContext(CourseContext.builder().courseId("bio-101").courseName("Biology").build())
            .build();
        EscalationDecision decision = engine.evaluate(request, List.of(), null);

        EscalationEvent event = engine.createEvent(request, decision);

        assertEquals("teacher-7", event.getTeacherId());
        assertEquals("bio-101", event.getCourseId());
        assertFalse(event.isResolved());
        assertEquals(List.of(event), engine.getTeacherEscalations("teacher-7"));

        ArgumentCaptor<TeacherNotification> notification = ArgumentCaptor.forClass(TeacherNotification.class);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Collection<String>> channels = ArgumentCaptor.forClass(Collection.class);
        verify(dispatcher).dispatch(notification.capture(), channels.capture());
        assertEquals(List.of("email", "sms", "in_app", "push"), List.copyOf(channels.getValue()));
        String message = notification.getValue().getMessage();
        assertTrue(message.contains("Course: Biology"));
        assertTrue(message.contains("Severity: CRITICAL"));
        assertTrue(message.contains("Student Question: \"I want to hurt someone\""));
        assertTrue(message.contains("IMMEDIATE ATTENTION REQUIRED"));
        assertTrue(message.contains("Consider involving school counselor"));
    }

    @Test
    void unassignedEventIsStillRecordedAndAnnounced() {
        LearningRequest request = request("I want to hurt someone").build();

        EscalationEvent event = engine.createEvent(request, engine.evaluate(request, List.of(), null));

        assertNull(event.getTeacherId());
        assertEquals(1, engine.getActiveEscalations().size());
        verify(dispatcher).dispatch(any(TeacherNotification.class), anyCollection());
    }

    @Test
    void courseAssignmentWinsOverStudentAssignment() {
        engine.assignTeacher("student-1", null, "homeroom");
        engine.assignTeacher("student-1", "bio-101", "bio-teacher");
        LearningRequest request = request("I want to hurt someone")
            .courseContext(CourseContext.builder().courseId("bio-101").build())
            .build();

        EscalationEvent event = engine.createEvent(request, engine.evaluate(request, List.of(), null));

        assertEquals("bio-teacher", event.getTeacherId());
    }

    @Test
    void resolveUnknownEventFailsWithNotFound() {
        assertThrows(EscalationNotFoundException.class, () -> engine.resolve("missing", "teacher-7", "done"));
    }

    @Test
    void resolveByOtherTeacherIsUnauthorized() {
        engine.assignTeacher("student-1", null, "teacher-7");
        LearningRequest request = request("I want to hurt someone").build();
        EscalationEvent event = engine.createEvent(request, engine.evaluate(request, List.of(), null));

        assertThrows(EscalationUnauthorizedException.class, () -> engine.resolve(event.getId(), "teacher-8", "done"));
        assertEquals(1, engine.getActiveEscalations().size());
    }

    @Test
    void resolveKeepsHistoryAndClearsActiveIndex() {
        engine.assignTeacher("student-1", null, "teacher-7");
        LearningRequest request = request("I want to hurt someone").build();
        EscalationEvent event = engine.createEvent(request, engine.evaluate(request, List.of(), null));
        clock.advance(Duration.ofMinutes(30));

        EscalationEvent resolved = engine.resolve(event.getId(), "teacher-7", "Talked with the student");

        assertTrue(resolved.isResolved());
        assertEquals("teacher-7", resolved.getResolvedBy());
        assertTrue(engine.getActiveEscalations().isEmpty());
        List<EscalationEvent> history = engine.getUserHistory("student-1", 0);
        assertEquals(1, history.size());
        assertTrue(history.get(0).isResolved());
        assertThrows(EscalationNotFoundException.class, () -> engine.resolve(event.getId(), "teacher-7", "again"));
    }

    @Test
    void metricsCountByReasonAndSeverity() {
        LearningRequest harm = request("I want to hurt someone").build();
        LearningRequest research = request("Help with my thesis outline").build();
        EscalationEvent first = engine.createEvent(harm, engine.evaluate(harm, List.of(), null));
        engine.createEvent(research, engine.evaluate(research, List.of(), null));
        clock.advance(Duration.ofMinutes(10));
        engine.resolve(first.getId(), "anyone", "handled");

        EscalationMetrics metrics = engine.getMetrics(null, null);

        assertEquals(2, metrics.getTotalEscalations());
        assertEquals(1, metrics.getResolvedEscalations());
        assertEquals(1, metrics.getActiveEscalations());
        assertEquals(50.0, metrics.getResolutionRate());
        assertEquals(10.0, metrics.getAverageResolutionMinutes());
        assertEquals(1L, metrics.getBySeverity().get("critical"));
        assertEquals(1L, metrics.getBySeverity().get("low"));
        assertEquals(0L, metrics.getBySeverity().get("high"));
        assertEquals(1L, metrics.getByReason().get("Rule triggered: Complex academic question"));

        EscalationMetrics later = engine.getMetrics(NOW.plusSeconds(1), null);
        assertEquals(0, later.getTotalEscalations());
    }

    @Test
    void historyIsNewestFirstAndLimited() {
        for (int i = 0; i < 3; i++) {
            LearningRequest request = request("I want to hurt someone " + i).id("req-" + i).build();
            engine.createEvent(request, engine.evaluate(request, List.of(), null));
            clock.advance(Duration.ofMinutes(1));
        }

        List<EscalationEvent> history = engine.getUserHistory("student-1", 2);

        assertEquals(2, history.size());
        assertEquals("req-2", history.get(0).getRequestId());
        assertEquals("req-1", history.get(1).getRequestId());
        assertTrue(engine.getUserHistory("someone-else", 5).isEmpty());
    }

    @Test
    void noEscalationMeansNoNotification() {
        LearningRequest request = request("What is photosynthesis?").build();

        assertFalse(engine.evaluate(request, List.of(), null).isShouldEscalate());
        verify(dispatcher, never()).dispatch(any(), anyCollection());
    }

    @Test
    void keywordsInsideScienceWordsDoNotEscalate() {
        for (String query : List.of("What is photosynthesis?", "How do I test a hypothesis?", "What is protein synthesis?")) {
            assertFalse(engine.evaluate(request(query).build(), List.of(), null).isShouldEscalate(), query);
        }
        verify(dispatcher, never()).dispatch(any(), anyCollection());
    }

    private static class MutableClock extends Clock {
        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(java.time.ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
