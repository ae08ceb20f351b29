package com.learnguard.llm.router;

import com.learnguard.common.model.LearningRequest;
import com.learnguard.common.model.LearningResponse;
import com.learnguard.common.model.QueryType;
import com.learnguard.llm.config.LlmProperties;
import com.learnguard.llm.model.ModelCapabilities;
import com.learnguard.llm.provider.LlmProvider;
import com.learnguard.llm.provider.ProviderAdapter;
import com.learnguard.llm.provider.ProviderAdapter.ProviderException;
import com.learnguard.llm.service.UsageMetricsRecorder;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Picks an adapter and model per request and fails over across adapters.
 * <p>
 * Adapters are scored: base availability (10, or 0 while cooling down after repeated failures),
 * a (query type x provider) preference bonus, a guardrail bonus for young learners and a
 * context-window bonus for material-heavy courses. Highest score wins; ties keep registration order.
 * Failover is sequential and never calls the same adapter twice for one request.
 */
@Service
@Slf4j
public class ProviderOrchestrator {

    static final int BASE_AVAILABILITY_SCORE = 10;

    private static final Map<QueryType, Map<LlmProvider, Integer>> PREFERENCES = new EnumMap<>(QueryType.class);
    private static final Map<LlmProvider, Integer> DEFAULT_PREFERENCE =
        Map.of(LlmProvider.OPENAI, 10, LlmProvider.ANTHROPIC, 8, LlmProvider.GEMINI, 6);

    static {
        PREFERENCES.put(QueryType.CODE_ASSISTANCE,
            Map.of(LlmProvider.OPENAI, 15, LlmProvider.ANTHROPIC, 10, LlmProvider.GEMINI, 8));
        PREFERENCES.put(QueryType.CREATIVE_WRITING,
            Map.of(LlmProvider.ANTHROPIC, 15, LlmProvider.OPENAI, 10, LlmProvider.GEMINI, 8));
        PREFERENCES.put(QueryType.MATH_PROBLEM,
            Map.of(LlmProvider.OPENAI, 15, LlmProvider.ANTHROPIC, 12, LlmProvider.GEMINI, 10));
        PREFERENCES.put(QueryType.CONCEPT_EXPLANATION,
            Map.of(LlmProvider.ANTHROPIC, 15, LlmProvider.OPENAI, 12, LlmProvider.GEMINI, 10));
    }

    private final List<ProviderAdapter> candidates;
    private final List<ProviderAdapter> registry = new CopyOnWriteArrayList<>();
    private final Map<LlmProvider, ProviderState> providerStates = new ConcurrentHashMap<>();
    private final LlmProperties.Orchestrator config;
    private final UsageMetricsRecorder usageMetrics;
    private ExecutorService workers;

    public ProviderOrchestrator(List<ProviderAdapter> adapters, LlmProperties properties, UsageMetricsRecorder usageMetrics) {
        this.candidates = adapters.stream()
            .sorted(Comparator.comparing(ProviderAdapter::getProvider))
            .collect(Collectors.toList());
        this.config = properties.getOrchestrator();
        this.usageMetrics = usageMetrics;
    }

    @PostConstruct
    public void initialize() {
        workers = Executors.newFixedThreadPool(config.getWorkerThreads(), namedThreads("llm-call-"));
        candidates.forEach(this::registerAdapter);

        if (registry.isEmpty()) {
            log.warn("[ORCHESTRATOR] No LLM providers configured! Set at least one API key; generation requests will fail.");
            return;
        }

        log.info("[ORCHESTRATOR] Initialized | totalProviders={} | providers={}",
            registry.size(),
            registry.stream().map(a -> a.getProvider().getDisplayName()).collect(Collectors.joining(", ")));
    }

    /**
     * Adds an adapter to the registry. Unconfigured adapters and duplicates are skipped.
     */
    public boolean registerAdapter(ProviderAdapter adapter) {
        LlmProvider provider = adapter.getProvider();
        if (!adapter.isConfigured()) {
            log.debug("[ORCHESTRATOR] Skipping {} - no API key provided", provider.getDisplayName());
            return false;
        }
        if (providerStates.putIfAbsent(provider, new ProviderState(provider)) != null) {
            log.debug("[ORCHESTRATOR] Skipping {} - already registered", provider.getDisplayName());
            return false;
        }
        registry.add(adapter);
        log.info("[ORCHESTRATOR] Provider registered | provider={} | defaultModel={}",
            provider.getDisplayName(), adapter.getDefaultModel());
        return true;
    }

    public List<LlmProvider> getAvailableProviders() {
        return registry.stream().map(ProviderAdapter::getProvider).collect(Collectors.toList());
    }

    /**
     * Registered adapters ordered by descending score for this request.
     */
    public List<ProviderAdapter> rankAdapters(LearningRequest request) {
        if (registry.isEmpty()) {
            throw new NoProviderAvailableException("No LLM providers are registered");
        }
        List<ProviderAdapter> ranked = new ArrayList<>(registry);
        // List.sort is stable: equal scores keep registration order
        ranked.sort(Comparator.comparingInt((ProviderAdapter a) -> score(a, request)).reversed());
        return ranked;
    }

    public ProviderAdapter selectProvider(LearningRequest request) {
        return rankAdapters(request).get(0);
    }

    int score(ProviderAdapter adapter, LearningRequest request) {
        LlmProvider provider = adapter.getProvider();
        ProviderState state = providerStates.get(provider);
        int score = state != null && state.isCoolingDown(config) ? 0 : BASE_AVAILABILITY_SCORE;

        Map<LlmProvider, Integer> preference = PREFERENCES.getOrDefault(request.getQueryType(), DEFAULT_PREFERENCE);
        score += preference.getOrDefault(provider, 0);

        Integer age = request.learnerAge();
        if (age != null && age < config.getYoungLearnerAge()) {
            score += provider.getYoungLearnerBonus();
        }
        if (request.materialCount() > config.getLargeContextMaterials()) {
            score += provider.getLargeContextBonus();
        }
        return score;
    }

    /**
     * Single attempt against the top-scored adapter.
     */
    public LearningResponse generate(LearningRequest request) throws ProviderException {
        ProviderAdapter adapter = selectProvider(request);
        LearningResponse response = attempt(adapter, request, 1, 1);
        usageMetrics.record(response);
        return response;
    }

    public LearningResponse generateWithFailover(LearningRequest request) throws ProviderFailoverException {
        long requestStartTime = System.currentTimeMillis();
        List<ProviderAdapter> ranked = rankAdapters(request);

        log.info("[ORCHESTRATOR] Starting LLM request | requestId={} | queryType={} | candidates={}",
            request.getId(), request.getQueryType(),
            ranked.stream().map(a -> a.getProvider().getDisplayName()).collect(Collectors.joining(",")));

        List<LlmProvider> attemptedProviders = new ArrayList<>();
        ProviderException lastException = null;

        for (ProviderAdapter adapter : ranked) {
            attemptedProviders.add(adapter.getProvider());
            try {
                LearningResponse response = attempt(adapter, request, attemptedProviders.size(), ranked.size());
                log.info("[ORCHESTRATOR] Request succeeded | requestId={} | provider={} | model={} | totalDurationMs={} | attempts={}",
                    request.getId(), adapter.getProvider().getDisplayName(), response.getModel(),
                    System.currentTimeMillis() - requestStartTime, attemptedProviders.size());
                usageMetrics.record(response);
                return response;
            } catch (ProviderException e) {
                lastException = e;
                log.warn("[ORCHESTRATOR] Provider request failed | requestId={} | provider={} | attempt={}/{} | statusCode={} | reason={} | retryable={} | error={}",
                    request.getId(), adapter.getProvider().getDisplayName(), attemptedProviders.size(), ranked.size(),
                    e.getStatusCode(), determineFailureReason(e), e.isRetryable(), e.getMessage());
            }
        }

        log.error("[ORCHESTRATOR] All providers failed | requestId={} | attemptedProviders={} | totalDurationMs={} | lastError={}",
            request.getId(),
            attemptedProviders.stream().map(LlmProvider::getDisplayName).collect(Collectors.joining(",")),
            System.currentTimeMillis() - requestStartTime,
            lastException != null ? lastException.getMessage() : "unknown");

        throw new ProviderFailoverException(
            "All providers failed after " + attemptedProviders.size() + " attempts",
            attemptedProviders,
            lastException
        );
    }

    private LearningResponse attempt(ProviderAdapter adapter, LearningRequest request, int attempt, int of) {
        LlmProvider provider = adapter.getProvider();
        ProviderState state = providerStates.get(provider);
        String model = adapter.selectModel(request);

        log.info("[ORCHESTRATOR] Attempting provider | requestId={} | attempt={}/{} | provider={} | model={} | consecutiveFailures={}",
            request.getId(), attempt, of, provider.getDisplayName(), model,
            state != null ? state.getConsecutiveFailures().get() : 0);

        try {
            LearningResponse response = callWithTimeout(adapter, request, model);
            if (state != null) {
                state.recordSuccess();
            }
            return response;
        } catch (ProviderException e) {
            if (state != null) {
                state.recordFailure();
            }
            throw e;
        }
    }

    private LearningResponse callWithTimeout(ProviderAdapter adapter, LearningRequest request, String model) {
        LlmProvider provider = adapter.getProvider();
        Future<LearningResponse> call = workers.submit(() -> adapter.generateResponse(request, model));
        try {
            return call.get(config.getCallTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new ProviderException(
                provider.getDisplayName() + " call timed out after " + config.getCallTimeout().toMillis() + "ms",
                provider, 504, true, e);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("Generation cancelled for request " + request.getId());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ProviderException) {
                throw (ProviderException) cause;
            }
            throw new ProviderException(
                provider.getDisplayName() + " adapter failed: " + cause.getMessage(),
                provider, 500, true, cause);
        }
    }

    private String determineFailureReason(ProviderException e) {
        int status = e.getStatusCode();
        if (status == 504) return "Timeout";
        if (status == 429) return "RateLimited";
        if (status == 401 || status == 403) return "AuthError";
        if (status >= 500) return "ServerError";
        return "ClientError";
    }

    /**
     * (input tokens + min(2 x input, 1000)) x per-token cost of the model the top adapter would use.
     */
    public double estimateCost(LearningRequest request) {
        ProviderAdapter adapter = selectProvider(request);
        return adapter.estimateCost(request, adapter.selectModel(request));
    }

    public Optional<ModelCapabilities> getProviderCapabilities(LlmProvider provider) {
        return registry.stream()
            .filter(adapter -> adapter.getProvider() == provider)
            .findFirst()
            .map(ProviderAdapter::getCapabilities);
    }

    public List<ModelCapabilities> getAllCapabilities() {
        return registry.stream().map(ProviderAdapter::getCapabilities).collect(Collectors.toList());
    }

    /**
     * Credential validity per provider; a probe that errors or exceeds the health timeout counts as unhealthy.
     */
    public Map<String, Boolean> getProviderHealth() {
        Map<String, Boolean> health = new LinkedHashMap<>();
        for (ProviderAdapter adapter : registry) {
            Future<Boolean> probe = workers.submit(adapter::validateCredential);
            boolean healthy;
            try {
                healthy = Boolean.TRUE.equals(probe.get(config.getHealthCheckTimeout().toMillis(), TimeUnit.MILLISECONDS));
            } catch (InterruptedException e) {
                probe.cancel(true);
                Thread.currentThread().interrupt();
                healthy = false;
            } catch (ExecutionException | TimeoutException e) {
                probe.cancel(true);
                log.warn("[ORCHESTRATOR] Health probe failed | provider={} | error={}",
                    adapter.getProvider().getDisplayName(), e.getMessage());
                healthy = false;
            }
            health.put(adapter.getProvider().getCode(), healthy);
        }
        return health;
    }

    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("totalProviders", registry.size());

        Map<String, Object> providerStats = new LinkedHashMap<>();
        for (ProviderAdapter adapter : registry) {
            ProviderState state = providerStates.get(adapter.getProvider());
            providerStats.put(adapter.getProvider().getDisplayName(), Map.of(
                "defaultModel", adapter.getDefaultModel(),
                "totalRequests", state.getTotalRequests().get(),
                "totalFailures", state.getTotalFailures().get(),
                "consecutiveFailures", state.getConsecutiveFailures().get(),
                "healthy", !state.isCoolingDown(config)
            ));
        }
        stats.put("providers", providerStats);
        stats.put("usage", usageMetrics.getStatistics());
        return stats;
    }

    @PreDestroy
    public void shutdown() {
        if (workers != null) {
            workers.shutdownNow();
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Getter
    static class ProviderState {
        private final LlmProvider provider;
        private final AtomicLong totalRequests = new AtomicLong(0);
        private final AtomicLong totalFailures = new AtomicLong(0);
        private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
        private final AtomicLong lastFailureTime = new AtomicLong(0);

        ProviderState(LlmProvider provider) {
            this.provider = provider;
        }

        boolean isCoolingDown(LlmProperties.Orchestrator config) {
            if (consecutiveFailures.get() >= config.getMaxConsecutiveFailures()) {
                if (System.currentTimeMillis() - lastFailureTime.get() < config.getCooldown().toMillis()) return true;
                consecutiveFailures.set(0);
            }
            return false;
        }

        void recordSuccess() {
            totalRequests.incrementAndGet();
            consecutiveFailures.set(0);
        }

        void recordFailure() {
            totalRequests.incrementAndGet();
            totalFailures.incrementAndGet();
            consecutiveFailures.incrementAndGet();
            lastFailureTime.set(System.currentTimeMillis());
        }
    }

    public static class ProviderFailoverException extends RuntimeException {
        @Getter private final List<LlmProvider> attemptedProviders;
        @Getter private final ProviderException lastError;

        public ProviderFailoverException(String message, List<LlmProvider> attempted, ProviderException lastError) {
            super(message, lastError);
            this.attemptedProviders = attempted;
            this.lastError = lastError;
        }
    }
}
