package com.learnguard.core.coordinator;

import com.learnguard.common.model.ConversationMessage;
import com.learnguard.common.model.LearningRequest;
import com.learnguard.common.model.LearningResponse;
import com.learnguard.common.model.QueryType;
import com.learnguard.common.model.SafetyLevel;
import com.learnguard.core.cache.CacheKeyGenerator;
import com.learnguard.core.cache.CaffeineCacheStore;
import com.learnguard.core.cache.ResponseCache;
import com.learnguard.core.cache.TtlPolicy;
import com.learnguard.core.config.CacheProperties;
import com.learnguard.core.config.CoordinatorProperties;
import com.learnguard.core.config.EscalationProperties;
import com.learnguard.core.config.SafetyProperties;
import com.learnguard.core.conversation.ConversationHistoryStore;
import com.learnguard.core.escalation.EscalationEngine;
import com.learnguard.core.escalation.EscalationEvent;
import com.learnguard.core.escalation.InMemoryEscalationEventStore;
import com.learnguard.core.escalation.TeacherDirectory;
import com.learnguard.core.escalation.notification.NotificationDispatcher;
import com.learnguard.core.escalation.rules.ComplexAcademicEvaluator;
import com.learnguard.core.escalation.rules.EmotionalDistressEvaluator;
import com.learnguard.core.escalation.rules.RepeatedQuestionTracker;
import com.learnguard.core.escalation.rules.RepeatedQuestionsEvaluator;
import com.learnguard.core.escalation.rules.SafetyCheckFailedEvaluator;
import com.learnguard.core.moderation.ModerationPipeline;
import com.learnguard.core.moderation.ModerationResultCombiner;
import com.learnguard.core.moderation.ReadingLevelAdjuster;
import com.learnguard.core.moderation.SafeContentGenerator;
import com.learnguard.core.moderation.checks.AcademicIntegrityChecker;
import com.learnguard.core.moderation.checks.AccuracyChecker;
import com.learnguard.core.moderation.checks.AgeAppropriatenessChecker;
import com.learnguard.core.moderation.checks.BiasChecker;
import com.learnguard.core.moderation.checks.EducationalValueChecker;
import com.learnguard.core.moderation.checks.InappropriateTopicChecker;
import com.learnguard.core.moderation.checks.ParentalControlsChecker;
import com.learnguard.core.moderation.checks.PersonalInformationChecker;
import com.learnguard.core.moderation.checks.ProfanityChecker;
import com.learnguard.core.moderation.checks.ResponseContentChecker;
import com.learnguard.core.moderation.checks.SourceReliabilityChecker;
import com.learnguard.llm.router.NoProviderAvailableException;
import com.learnguard.llm.router.ProviderOrchestrator;
import com.learnguard.llm.router.ProviderOrchestrator.ProviderFailoverException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static com.learnguard.core.support.TestRequests.ANSWER;
import static com.learnguard.core.support.TestRequests.request;
import static com.learnguard.core.support.TestRequests.response;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LearningRequestCoordinatorTest {

    private final ProviderOrchestrator orchestrator = mock(ProviderOrchestrator.class);
    private ResponseCache cache;
    private EscalationEngine escalation;
    private ConversationHistoryStore conversations;
    private LearningRequestCoordinator coordinator;

    @BeforeEach
    void setUp() {
        SafetyProperties safety = new SafetyProperties();
        CacheProperties cacheProperties = new CacheProperties();
        ModerationPipeline moderation = new ModerationPipeline(List.of(
            new ProfanityChecker(), new InappropriateTopicChecker(), new AgeAppropriatenessChecker(),
            new ParentalControlsChecker(), new AcademicIntegrityChecker(), new PersonalInformationChecker(),
            new ResponseContentChecker(), new EducationalValueChecker(), new AccuracyChecker(),
            new BiasChecker(), new SourceReliabilityChecker()), safety, new ModerationResultCombiner());
        CaffeineCacheStore store = new CaffeineCacheStore(100);
        cache = new ResponseCache(store, new CacheKeyGenerator(cacheProperties), new TtlPolicy(cacheProperties));
        conversations = new ConversationHistoryStore(store, cacheProperties);
        RepeatedQuestionTracker tracker = new RepeatedQuestionTracker();
        escalation = new EscalationEngine(safety, new EscalationProperties(),
            List.of(new SafetyCheckFailedEvaluator(), new EmotionalDistressEvaluator(),
                new RepeatedQuestionsEvaluator(tracker), new ComplexAcademicEvaluator()),
            tracker, new InMemoryEscalationEventStore(), new TeacherDirectory(), mock(NotificationDispatcher.class));
        coordinator = new LearningRequestCoordinator(new QueryClassifier(), moderation, cache, orchestrator,
            escalation, new SafeContentGenerator(), new ReadingLevelAdjuster(), conversations, new CoordinatorProperties());
    }

    @AfterEach
    void tearDown() {
        coordinator.shutdown();
    }

    @Test
    void answersAndCachesOrdinaryQuestion() {
        when(orchestrator.generateWithFailover(any())).thenReturn(response(ANSWER).build());

        LearningResponse first = coordinator.process(request("What is photosynthesis?").build());
        LearningResponse second = coordinator.process(request("what is photosynthesis").build());

        assertEquals(ANSWER, first.getText());
        assertFalse(first.isCached());
        assertFalse(first.isEscalationRecommended());
        assertTrue(second.isCached());
        assertEquals(ANSWER, second.getText());
        verify(orchestrator, times(1)).generateWithFailover(any());
    }

    @Test
    void repeatedQuestionServedFromCacheStillEscalates() {
        when(orchestrator.generateWithFailover(any())).thenReturn(response(ANSWER).build());

        LearningResponse first = coordinator.process(request("What is photosynthesis?").build());
        LearningResponse second = coordinator.process(request("What is photosynthesis?").build());
        LearningResponse third = coordinator.process(request("What is photosynthesis?").build());

        assertFalse(first.isEscalationRecommended());
        assertTrue(second.isCached());
        assertFalse(second.isEscalationRecommended());
        assertTrue(third.isCached());
        assertTrue(third.isEscalationRecommended());
        verify(orchestrator, times(1)).generateWithFailover(any());

        List<EscalationEvent> events = escalation.getUserHistory("student-1", 5);
        assertEquals(1, events.size());
        assertEquals("repeated-confusion", events.get(0).getRuleId());
    }

    @Test
    void previousExchangesAreSentWithTheNextQuestion() {
        when(orchestrator.generateWithFailover(any())).thenReturn(response(ANSWER).build());

        LearningResponse first = coordinator.process(request("What is photosynthesis?").build());
        coordinator.process(request("Why are leaves green?").id("req-2").build());

        ArgumentCaptor<LearningRequest> sent = ArgumentCaptor.forClass(LearningRequest.class);
        verify(orchestrator, times(2)).generateWithFailover(sent.capture());
        assertNull(sent.getAllValues().get(0).getConversation());

        List<ConversationMessage> history = sent.getAllValues().get(1).getConversation().getHistory();
        assertEquals(2, history.size());
        assertEquals(ConversationMessage.Role.USER, history.get(0).getRole());
        assertEquals("What is photosynthesis?", history.get(0).getContent());
        assertEquals(ConversationMessage.Role.ASSISTANT, history.get(1).getRole());
        assertEquals(first.getText(), history.get(1).getContent());

        assertEquals(4, conversations.getConversationContext("student-1", "session-1").orElseThrow().getHistory().size());
    }

    @Test
    void harmfulQuestionIsRedirectedAndEscalated() {
        LearningResponse response = coordinator.process(request("I want to hurt someone").build());

        assertEquals(LearningResponse.SAFETY_FILTER_PROVIDER, response.getProvider());
        assertEquals(1.0, response.getConfidence());
        assertEquals(SafetyLevel.HIGH, response.getSafetyLevel());
        assertTrue(response.isEscalationRecommended());
        assertTrue(response.getMetadata().getContentWarnings().contains("inappropriate_topic"));
        assertEquals(1, escalation.getActiveEscalations().size());
        verify(orchestrator, never()).generateWithFailover(any());
        assertEquals(0, cache.getStats().getTotalKeys());
    }

    @Test
    void directAnswerRequestIsRedirected() {
        LearningResponse response = coordinator.process(request("Just give me the answer to question 5").build());

        assertEquals(LearningResponse.SAFETY_FILTER_PROVIDER, response.getProvider());
        assertTrue(response.getText().startsWith("I'd love to help you learn!"));
        verify(orchestrator, never()).generateWithFailover(any());
    }

    @Test
    void unsafeAnswerIsReplacedAndNotCached() {
        when(orchestrator.generateWithFailover(any()))
            .thenReturn(response("Here is how weapons are built, for example").build());

        LearningResponse response = coordinator.process(request("How are castles built?").build());

        assertEquals("openai", response.getProvider());
        assertFalse(response.getText().contains("weapons"));
        assertEquals(SafetyLevel.HIGH, response.getSafetyLevel());
        assertTrue(response.isEscalationRecommended());
        assertEquals(0, cache.getStats().getTotalKeys());
    }

    @Test
    void providerErrorsPropagate() {
        when(orchestrator.generateWithFailover(any())).thenThrow(new NoProviderAvailableException("none"));
        assertThrows(NoProviderAvailableException.class,
            () -> coordinator.process(request("What is photosynthesis?").build()));

        doThrow(new ProviderFailoverException("all failed", List.of(), null))
            .when(orchestrator).generateWithFailover(any());
        assertThrows(ProviderFailoverException.class,
            () -> coordinator.process(request("What is photosynthesis?").build()));
    }

    @Test
    void rejectsIncompleteRequests() {
        assertThrows(IllegalArgumentException.class, () -> coordinator.process(request("   ").build()));
        assertThrows(IllegalArgumentException.class,
            () -> coordinator.process(request("What is photosynthesis?").userId(null).build()));
    }

    @Test
    void prepareClassifiesAndAssignsId() {
        LearningRequest prepared = coordinator.prepare(request("Explain gravity").id(null).queryType(null).build());

        assertNotNull(prepared.getId());
        assertEquals(QueryType.CONCEPT_EXPLANATION, prepared.getQueryType());
    }

    @Test
    void submitRunsOnWorkerPool() throws Exception {
        when(orchestrator.generateWithFailover(any())).thenReturn(response(ANSWER).build());

        LearningResponse response = coordinator.submit(request("What is photosynthesis?").build())
            .get(5, TimeUnit.SECONDS);

        assertEquals(ANSWER, response.getText());
    }

    @Test
    void healthDegradesWithUnhealthyProvider() {
        when(orchestrator.getProviderHealth()).thenReturn(Map.of("openai", true, "gemini", false));
        assertEquals("degraded", coordinator.getServiceHealth().get("status"));

        when(orchestrator.getProviderHealth()).thenReturn(Map.of("openai", false));
        assertEquals("unhealthy", coordinator.getServiceHealth().get("status"));

        when(orchestrator.getProviderHealth()).thenReturn(Map.of("openai", true));
        assertEquals("healthy", coordinator.getServiceHealth().get("status"));
    }

    @Test
    void userSafetyStatusReflectsActiveEscalations() {
        assertEquals("normal", coordinator.getUserSafetyStatus("student-1").get("status"));

        coordinator.process(request("I want to hurt someone").build());

        Map<String, Object> status = coordinator.getUserSafetyStatus("student-1");
        assertEquals("monitored", status.get("status"));
        assertEquals(1L, status.get("activeEscalations"));
    }
}
