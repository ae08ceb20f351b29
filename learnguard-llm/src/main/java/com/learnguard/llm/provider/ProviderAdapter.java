package com.learnguard.llm.provider;

import com.learnguard.common.model.LearningRequest;
import com.learnguard.common.model.LearningResponse;
import com.learnguard.llm.model.ModelCapabilities;

import java.util.List;

/**
 * One LLM backend. Implementations own their wire protocol; the orchestrator treats them as opaque.
 */
public interface ProviderAdapter {

    LearningResponse generateResponse(LearningRequest request, String model) throws ProviderException;

    ModelCapabilities getCapabilities(String model);

    default ModelCapabilities getCapabilities() {
        return getCapabilities(getDefaultModel());
    }

    boolean validateCredential();

    List<String> listAvailableModels();

    double estimateCost(LearningRequest request, String model);

    /**
     * Model best suited to the request's classification and context size.
     */
    String selectModel(LearningRequest request);

    LlmProvider getProvider();

    String getDefaultModel();

    /** Adapters without credentials are never registered. */
    boolean isConfigured();

    class ProviderException extends RuntimeException {
        private final boolean retryable;
        private final int statusCode;
        private final LlmProvider provider;

        public ProviderException(String message, LlmProvider provider, int statusCode, boolean retryable) {
            super(message);
            this.provider = provider;
            this.statusCode = statusCode;
            this.retryable = retryable;
        }

        public ProviderException(String message, LlmProvider provider, int statusCode, boolean retryable, Throwable cause) {
            super(message, cause);
            this.provider = provider;
            this.statusCode = statusCode;
            this.retryable = retryable;
        }

        public boolean isRetryable() { return retryable; }
        public int getStatusCode() { return statusCode; }
        public LlmProvider getProvider() { return provider; }
        public boolean isRateLimited() { return statusCode == 429; }
        public boolean isAuthError() { return statusCode == 401 || statusCode == 403; }
        public boolean isTimeout() { return statusCode == 504; }
    }
}
