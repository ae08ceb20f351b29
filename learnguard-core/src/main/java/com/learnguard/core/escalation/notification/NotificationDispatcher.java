package com.learnguard.core.escalation.notification;

import com.learnguard.core.config.SafetyProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sends one alert over several channels in parallel, each bounded by the notification timeout.
 * The returned future completes once every channel has delivered, failed or timed out; it never
 * completes exceptionally.
 */
@Service
@Slf4j
public class NotificationDispatcher {

    private static final int DISPATCH_THREADS = 4;

    private final Map<String, NotificationChannel> channels = new LinkedHashMap<>();
    private final Duration timeout;
    private final ExecutorService executor;

    public NotificationDispatcher(List<NotificationChannel> channels, SafetyProperties properties) {
        channels.forEach(channel -> this.channels.put(channel.name(), channel));
        this.timeout = properties.getNotificationTimeout();
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(DISPATCH_THREADS, runnable -> {
            Thread thread = new Thread(runnable, "notify-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        log.info("[NOTIFY] Dispatcher ready | channels={} | timeoutMs={}", this.channels.keySet(), timeout.toMillis());
    }

    public CompletableFuture<Void> dispatch(TeacherNotification notification, Collection<String> channelNames) {
        List<CompletableFuture<Void>> deliveries = new ArrayList<>();
        for (String name : channelNames) {
            NotificationChannel channel = channels.get(name);
            if (channel == null) {
                log.warn("[NOTIFY] Unknown channel, skipping | channel={} | escalationId={}", name, notification.getEscalationId());
                continue;
            }
            deliveries.add(CompletableFuture
                .runAsync(() -> channel.send(notification), executor)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(error -> {
                    log.warn("[NOTIFY] Delivery failed | channel={} | escalationId={} | error={}",
                        name, notification.getEscalationId(), error.toString());
                    return null;
                }));
        }
        return CompletableFuture.allOf(deliveries.toArray(new CompletableFuture[0]));
    }

    public Collection<String> availableChannels() {
        return channels.keySet();
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
