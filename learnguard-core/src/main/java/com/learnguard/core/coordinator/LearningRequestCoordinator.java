package com.learnguard.core.coordinator;

import com.learnguard.common.model.LearningRequest;
import com.learnguard.common.model.LearningResponse;
import com.learnguard.common.model.ModerationResult;
import com.learnguard.common.model.ResponseMetadata;
import com.learnguard.common.model.SafetyCheck;
import com.learnguard.common.model.SafetyLevel;
import com.learnguard.common.model.SuggestedAction;
import com.learnguard.core.cache.CacheStats;
import com.learnguard.core.cache.ResponseCache;
import com.learnguard.core.config.CoordinatorProperties;
import com.learnguard.core.conversation.ConversationHistoryStore;
import com.learnguard.core.escalation.EscalationDecision;
import com.learnguard.core.escalation.EscalationEngine;
import com.learnguard.core.escalation.EscalationEvent;
import com.learnguard.core.moderation.ModerationPipeline;
import com.learnguard.core.moderation.ReadingLevelAdjuster;
import com.learnguard.core.moderation.SafeContentGenerator;
import com.learnguard.llm.router.NoProviderAvailableException;
import com.learnguard.llm.router.ProviderOrchestrator;
import com.learnguard.llm.router.ProviderOrchestrator.ProviderFailoverException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for learner questions. Steps run in a fixed order because each one consumes
 * the verdict of the previous: classify, moderate input, cache lookup, attach conversation
 * history, generate, moderate output, escalate, cache write, record the exchange.
 * <p>
 * Cache hits are still evaluated for escalation so repeated questions are counted.
 * <p>
 * A blocked question is answered with a redirect message, never an exception. A cancelled
 * request writes nothing to the cache.
 */
@Service
@Slf4j
public class LearningRequestCoordinator {

    private static final int RECENT_ESCALATIONS = 10;

    private final QueryClassifier classifier;
    private final ModerationPipeline moderation;
    private final ResponseCache cache;
    private final ProviderOrchestrator orchestrator;
    private final EscalationEngine escalation;
    private final SafeContentGenerator safeContent;
    private final ReadingLevelAdjuster readingLevel;
    private final ConversationHistoryStore conversations;
    private final CoordinatorProperties properties;
    private final ExecutorService workers;

    public LearningRequestCoordinator(QueryClassifier classifier,
                                      ModerationPipeline moderation,
                                      ResponseCache cache,
                                      ProviderOrchestrator orchestrator,
                                      EscalationEngine escalation,
                                      SafeContentGenerator safeContent,
                                      ReadingLevelAdjuster readingLevel,
                                      ConversationHistoryStore conversations,
                                      CoordinatorProperties properties) {
        this.classifier = classifier;
        this.moderation = moderation;
        this.cache = cache;
        this.orchestrator = orchestrator;
        this.escalation = escalation;
        this.safeContent = safeContent;
        this.readingLevel = readingLevel;
        this.conversations = conversations;
        this.properties = properties;
        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(properties.getWorkerThreads(), runnable -> {
            Thread thread = new Thread(runnable, "learning-request-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Answers one question synchronously.
     *
     * @throws IllegalArgumentException if the query, user or session is missing
     * @throws NoProviderAvailableException if no provider is configured
     * @throws ProviderFailoverException if every provider failed
     * @throws CancellationException if the calling thread was interrupted
     */
    public LearningResponse process(LearningRequest incoming) {
        long startTime = System.currentTimeMillis();
        LearningRequest request = prepare(incoming);

        log.info("[COORDINATOR] Processing request | requestId={} | userId={} | queryType={} | inputType={}",
            request.getId(), request.getUserId(), request.getQueryType(), request.getInputType());

        try {
            // Step 1: moderate the question
            long stepStart = System.currentTimeMillis();
            ModerationResult input = moderation.moderateInput(request);
            log.debug("[COORDINATOR] Input moderated | requestId={} | action={} | durationMs={}",
                request.getId(), input.getSuggestedAction(), System.currentTimeMillis() - stepStart);

            if (shouldRedirect(input)) {
                EscalationDecision decision = escalateIfNeeded(request, input.getChecks(), null);
                LearningResponse redirect = redirect(request, input, decision, startTime);
                log.info("[COORDINATOR] Question redirected | requestId={} | categories={} | escalated={} | totalDurationMs={}",
                    request.getId(), input.getCategories(), decision.isShouldEscalate(), redirect.getLatencyMs());
                return redirect;
            }

            // Step 2: cache lookup
            stepStart = System.currentTimeMillis();
            Optional<LearningResponse> cached = cache.get(request);
            if (cached.isPresent()) {
                LearningResponse hit = servedFromCache(request, input, cached.get());
                log.info("[COORDINATOR] Served from cache | requestId={} | escalated={} | cacheDurationMs={} | totalDurationMs={}",
                    request.getId(), hit.isEscalationRecommended(), System.currentTimeMillis() - stepStart,
                    System.currentTimeMillis() - startTime);
                return hit;
            }

            // Step 3: generate with the stored conversation attached
            stepStart = System.currentTimeMillis();
            LearningResponse generated = orchestrator.generateWithFailover(conversations.enrich(request));
            log.debug("[COORDINATOR] Answer generated | requestId={} | provider={} | generationDurationMs={}",
                request.getId(), generated.getProvider(), System.currentTimeMillis() - stepStart);

            // Step 4: moderate the answer
            stepStart = System.currentTimeMillis();
            ModerationResult output = moderation.moderateOutput(generated, request);
            LearningResponse moderated = applyOutputModeration(request, generated, output);
            log.debug("[COORDINATOR] Output moderated | requestId={} | action={} | durationMs={}",
                request.getId(), output.getSuggestedAction(), System.currentTimeMillis() - stepStart);

            // Step 5: escalation
            checkNotCancelled(request);
            List<SafetyCheck> checks = new ArrayList<>(input.getChecks());
            checks.addAll(output.getChecks());
            EscalationDecision decision = escalateIfNeeded(request, checks, moderated);

            LearningResponse response = moderated.toBuilder()
                .latencyMs(System.currentTimeMillis() - startTime)
                .metadata(moderated.getMetadata().toBuilder()
                    .escalationRecommended(moderated.isEscalationRecommended() || decision.isShouldEscalate())
                    .build())
                .build();

            // Step 6: cache write
            checkNotCancelled(request);
            boolean stored = cache.put(request, response);
            conversations.recordExchange(request, response);

            log.info("[COORDINATOR] Request complete | requestId={} | provider={} | safetyLevel={} | escalated={} | cached={} | totalDurationMs={}",
                request.getId(), response.getProvider(), response.getSafetyLevel(), decision.isShouldEscalate(),
                stored, response.getLatencyMs());
            return response;

        } catch (NoProviderAvailableException | ProviderFailoverException | CancellationException e) {
            log.error("[COORDINATOR] Request failed | requestId={} | error={}", request.getId(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("[COORDINATOR] Unexpected failure | requestId={} | error={}", request.getId(), e.getMessage(), e);
            throw new RequestProcessingException("Failed to process request " + request.getId(), e);
        }
    }

    /**
     * Runs {@link #process} on the coordinator's worker pool. Cancelling the future interrupts
     * the in-flight provider call.
     */
    public Future<LearningResponse> submit(LearningRequest request) {
        return workers.submit(() -> process(request));
    }

    public double estimateCost(LearningRequest request) {
        return orchestrator.estimateCost(prepare(request));
    }

    public Map<String, Object> getServiceHealth() {
        Map<String, Boolean> providers = orchestrator.getProviderHealth();
        CacheStats cacheStats = cache.getStats();
        long healthy = providers.values().stream().filter(Boolean::booleanValue).count();

        String status;
        if (healthy == 0) {
            status = "unhealthy";
        } else if (healthy < providers.size() || !cacheStats.isAvailable()) {
            status = "degraded";
        } else {
            status = "healthy";
        }

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", status);
        health.put("providers", providers);
        health.put("cache", cacheStats);
        health.put("activeEscalations", escalation.getActiveEscalations().size());
        return health;
    }

    public Map<String, Object> getUsageStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("providers", orchestrator.getStatistics());
        stats.put("cache", cache.getStats());
        stats.put("moderation", moderation.getCheckerConfiguration());
        stats.put("activeEscalations", escalation.getActiveEscalations().size());
        return stats;
    }

    public Map<String, Object> getUserSafetyStatus(String userId) {
        List<EscalationEvent> recent = escalation.getUserHistory(userId, RECENT_ESCALATIONS);
        long active = escalation.getActiveCount(userId);

        Map<String, Object> status = new LinkedHashMap<>();
        status.put("userId", userId);
        status.put("recentEscalations", recent);
        status.put("activeEscalations", active);
        status.put("status", active > 0 ? "monitored" : "normal");
        return status;
    }

    @PreDestroy
    public void shutdown() {
        workers.shutdownNow();
    }

    // ========== Steps ==========

    LearningRequest prepare(LearningRequest incoming) {
        if (incoming == null || incoming.getQuery() == null || incoming.getQuery().isBlank()) {
            throw new IllegalArgumentException("Query must not be empty");
        }
        if (incoming.getUserId() == null || incoming.getSessionId() == null) {
            throw new IllegalArgumentException("userId and sessionId are required");
        }
        LearningRequest.LearningRequestBuilder builder = incoming.toBuilder();
        if (incoming.getId() == null) {
            builder.id(UUID.randomUUID().toString());
        }
        if (incoming.getQueryType() == null) {
            builder.queryType(classifier.classify(incoming.getQuery()));
        }
        return builder.build();
    }

    private boolean shouldRedirect(ModerationResult input) {
        if (input.isAppropriate()) {
            return false;
        }
        SuggestedAction action = input.getSuggestedAction();
        return action == SuggestedAction.BLOCK
            || action == SuggestedAction.ESCALATE
            || input.getConfidence() >= properties.getInputBlockConfidence();
    }

    private LearningResponse servedFromCache(LearningRequest request, ModerationResult input, LearningResponse hit) {
        EscalationDecision decision = escalateIfNeeded(request, input.getChecks(), hit);
        conversations.recordExchange(request, hit);
        if (!decision.isShouldEscalate()) {
            return hit;
        }
        return hit.toBuilder()
            .metadata(hit.getMetadata().toBuilder().escalationRecommended(true).build())
            .build();
    }

    private LearningResponse redirect(LearningRequest request, ModerationResult input,
                                      EscalationDecision decision, long startTime) {
        String text = safeContent.generateSafeContent(request.getQuery(), input, request.getUserProfile());
        return LearningResponse.builder()
            .id(UUID.randomUUID().toString())
            .requestId(request.getId())
            .text(text)
            .provider(LearningResponse.SAFETY_FILTER_PROVIDER)
            .model(LearningResponse.SAFETY_FILTER_MODEL)
            .confidence(1.0)
            .safetyLevel(input.getSeverity())
            .tokensUsed(0)
            .latencyMs(System.currentTimeMillis() - startTime)
            .cached(false)
            .metadata(ResponseMetadata.builder()
                .contentWarnings(input.getCategories())
                .safetyChecks(input.getChecks())
                .escalationRecommended(decision.isShouldEscalate())
                .build())
            .build();
    }

    private LearningResponse applyOutputModeration(LearningRequest request, LearningResponse generated, ModerationResult output) {
        SafetyLevel level = SafetyLevel.max(generated.getSafetyLevel(), output.getSeverity());
        ResponseMetadata.ResponseMetadataBuilder metadata = generated.getMetadata().toBuilder()
            .contentWarnings(output.getCategories())
            .safetyChecks(output.getChecks());

        String text;
        if (output.isBlocked()) {
            log.warn("[COORDINATOR] Answer blocked by output moderation | requestId={} | categories={}",
                request.getId(), output.getCategories());
            text = safeContent.generateSafeContent(generated.getText(), output, request.getUserProfile());
        } else {
            text = readingLevel.adjust(generated.getText(), request.getUserProfile());
        }
        return generated.toBuilder()
            .text(text)
            .safetyLevel(level)
            .metadata(metadata.build())
            .build();
    }

    private EscalationDecision escalateIfNeeded(LearningRequest request, List<SafetyCheck> checks, LearningResponse response) {
        EscalationDecision decision = escalation.evaluate(request, checks, response);
        if (decision.isShouldEscalate()) {
            escalation.createEvent(request, decision);
        }
        return decision;
    }

    private static void checkNotCancelled(LearningRequest request) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Request cancelled: " + request.getId());
        }
    }

    public static class RequestProcessingException extends RuntimeException {
        public RequestProcessingException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
