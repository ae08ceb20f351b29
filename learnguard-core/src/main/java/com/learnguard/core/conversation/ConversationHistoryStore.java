package com.learnguard.core.conversation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.learnguard.common.model.ConversationContext;
import com.learnguard.common.model.ConversationMessage;
import com.learnguard.common.model.LearningRequest;
import com.learnguard.common.model.LearningResponse;
import com.learnguard.core.cache.CacheStore;
import com.learnguard.core.cache.CacheUnavailableException;
import com.learnguard.core.config.CacheProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Conversation history per user and session, kept in the cache store under
 * {@code conversation:{userId}:{sessionId}} and trimmed to the most recent messages.
 * <p>
 * Like the answer cache, a store outage never reaches the caller: reads find no history
 * and writes are skipped with a warning.
 */
@Service
@Slf4j
public class ConversationHistoryStore {

    private final CacheStore store;
    private final CacheProperties.Conversation properties;
    private final ObjectMapper mapper;

    public ConversationHistoryStore(CacheStore store, CacheProperties cacheProperties) {
        this.store = store;
        this.properties = cacheProperties.getConversation();
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public Optional<ConversationContext> getConversationContext(String userId, String sessionId) {
        String key = keyFor(userId, sessionId);
        try {
            Optional<String> payload = store.get(key);
            if (payload.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(mapper.readValue(payload.get(), ConversationContext.class));
        } catch (CacheUnavailableException e) {
            log.warn("[CONVERSATION] Store unavailable, no history | userId={} | sessionId={} | error={}",
                userId, sessionId, e.getMessage());
            return Optional.empty();
        } catch (JsonProcessingException e) {
            log.warn("[CONVERSATION] Unreadable history dropped | key={} | error={}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * Appends messages to the session's history, keeping at most {@code max-history} of them.
     * A non-null topic or subject replaces the stored one.
     */
    public void updateConversationContext(String userId, String sessionId, List<ConversationMessage> messages,
                                          String topic, String subject) {
        ConversationContext current = getConversationContext(userId, sessionId)
            .orElseGet(() -> ConversationContext.builder()
                .conversationId(userId + "_" + sessionId + "_" + System.currentTimeMillis())
                .build());

        List<ConversationMessage> history = new ArrayList<>(current.getHistory());
        history.addAll(messages);
        if (history.size() > properties.getMaxHistory()) {
            history = history.subList(history.size() - properties.getMaxHistory(), history.size());
        }

        ConversationContext updated = ConversationContext.builder()
            .conversationId(current.getConversationId())
            .history(history)
            .topic(topic != null ? topic : current.getTopic())
            .subject(subject != null ? subject : current.getSubject())
            .gradeLevel(current.getGradeLevel())
            .build();

        String key = keyFor(userId, sessionId);
        try {
            store.set(key, mapper.writeValueAsString(updated), properties.getTtl());
            log.debug("[CONVERSATION] History updated | userId={} | sessionId={} | messages={}",
                userId, sessionId, history.size());
        } catch (CacheUnavailableException e) {
            log.warn("[CONVERSATION] Store unavailable, history not saved | userId={} | sessionId={} | error={}",
                userId, sessionId, e.getMessage());
        } catch (JsonProcessingException e) {
            log.warn("[CONVERSATION] Could not serialize history | key={} | error={}", key, e.getOriginalMessage());
        }
    }

    /** Records one answered question as a user message followed by the assistant's answer. */
    public void recordExchange(LearningRequest request, LearningResponse response) {
        Instant askedAt = request.getTimestamp() == null ? Instant.now() : request.getTimestamp();
        Instant answeredAt = response.getTimestamp() == null ? askedAt : response.getTimestamp();
        List<ConversationMessage> exchange = List.of(
            ConversationMessage.builder()
                .id(UUID.randomUUID().toString())
                .role(ConversationMessage.Role.USER)
                .content(request.getQuery())
                .timestamp(askedAt)
                .build(),
            ConversationMessage.builder()
                .id(UUID.randomUUID().toString())
                .role(ConversationMessage.Role.ASSISTANT)
                .content(response.getText())
                .timestamp(answeredAt)
                .build());
        String subject = request.getCourseContext() == null ? null : request.getCourseContext().getSubject();
        updateConversationContext(request.getUserId(), request.getSessionId(), exchange, null, subject);
    }

    /**
     * Attaches the stored history to the request. A client-supplied conversation is kept when
     * nothing is stored; otherwise the stored history wins and the client's topic, subject and
     * grade fill any gaps.
     */
    public LearningRequest enrich(LearningRequest request) {
        Optional<ConversationContext> stored = getConversationContext(request.getUserId(), request.getSessionId());
        if (stored.isEmpty() || stored.get().getHistory().isEmpty()) {
            return request;
        }
        ConversationContext server = stored.get();
        ConversationContext client = request.getConversation();
        ConversationContext merged = server.toBuilder()
            .topic(server.getTopic() != null || client == null ? server.getTopic() : client.getTopic())
            .subject(server.getSubject() != null || client == null ? server.getSubject() : client.getSubject())
            .gradeLevel(server.getGradeLevel() != null || client == null ? server.getGradeLevel() : client.getGradeLevel())
            .build();
        return request.toBuilder().conversation(merged).build();
    }

    String keyFor(String userId, String sessionId) {
        return properties.getKeyPrefix() + userId + ":" + sessionId;
    }
}
