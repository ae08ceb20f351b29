package com.learnguard.core.escalation;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

@Component
public class InMemoryEscalationEventStore implements EscalationEventStore {

    private final Map<String, List<EscalationEvent>> historyByUser = new ConcurrentHashMap<>();
    private final Map<String, EscalationEvent> activeById = new ConcurrentHashMap<>();

    @Override
    public void append(EscalationEvent event) {
        historyByUser.computeIfAbsent(event.getUserId(), id -> new CopyOnWriteArrayList<>()).add(event);
        if (!event.isResolved()) {
            activeById.put(event.getId(), event);
        }
    }

    @Override
    public Optional<EscalationEvent> findActive(String eventId) {
        return Optional.ofNullable(activeById.get(eventId));
    }

    @Override
    public void markResolved(EscalationEvent resolved) {
        List<EscalationEvent> history = historyByUser.get(resolved.getUserId());
        if (history != null) {
            history.replaceAll(event -> event.getId().equals(resolved.getId()) ? resolved : event);
        }
        activeById.remove(resolved.getId());
    }

    @Override
    public List<EscalationEvent> history(String userId, int limit) {
        List<EscalationEvent> events = new ArrayList<>(historyByUser.getOrDefault(userId, List.of()));
        Collections.reverse(events);
        return limit > 0 && events.size() > limit ? events.subList(0, limit) : events;
    }

    @Override
    public List<EscalationEvent> active() {
        return activeById.values().stream()
            .sorted(Comparator.comparing(EscalationEvent::getCreatedAt))
            .toList();
    }

    @Override
    public List<EscalationEvent> between(Instant from, Instant to) {
        return historyByUser.values().stream()
            .flatMap(List::stream)
            .filter(event -> from == null || !event.getCreatedAt().isBefore(from))
            .filter(event -> to == null || !event.getCreatedAt().isAfter(to))
            .toList();
    }
}
