package me.golemcore.adminbot.adapter.outbound.pending;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.adminbot.domain.model.PendingActionExpiredEvent;
import me.golemcore.adminbot.domain.model.PendingEntry;
import me.golemcore.adminbot.domain.model.TakeResult;
import me.golemcore.adminbot.infrastructure.config.BotProperties;
import me.golemcore.adminbot.port.outbound.PendingActionStore;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local {@link PendingActionStore} backed by a
 * {@link ConcurrentHashMap}.
 *
 * <p>
 * Take-if-owner runs as a single {@code compute} on the token, so of two
 * concurrent confirmations at most one receives the entry. Entries older than
 * {@code bot.confirmation.ttl-seconds} are treated as absent and evicted by a
 * periodic sweep, which publishes a {@link PendingActionExpiredEvent} for each.
 * Everything is lost on restart.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class InMemoryPendingActionStore implements PendingActionStore {

    private final Map<String, PendingEntry> pending = new ConcurrentHashMap<>();
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final Duration ttl;
    private final long sweepIntervalSeconds;

    private ScheduledExecutorService sweepExecutor;

    public InMemoryPendingActionStore(BotProperties properties, ApplicationEventPublisher eventPublisher,
            Clock clock) {
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.ttl = Duration.ofSeconds(properties.getConfirmation().getTtlSeconds());
        this.sweepIntervalSeconds = Math.max(1, properties.getConfirmation().getSweepIntervalSeconds());
    }

    @PostConstruct
    public void init() {
        sweepExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "pending-actions-sweep");
            t.setDaemon(true);
            return t;
        });
        sweepExecutor.scheduleAtFixedRate(this::sweepSafely, sweepIntervalSeconds, sweepIntervalSeconds,
                TimeUnit.SECONDS);
    }

    @PreDestroy
    public void destroy() {
        if (sweepExecutor != null) {
            sweepExecutor.shutdownNow();
            try {
                sweepExecutor.awaitTermination(2, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public void put(PendingEntry entry) {
        PendingEntry previous = pending.put(entry.token(), entry);
        if (previous != null) {
            log.warn("[Pending] Replaced existing entry for token {}", entry.token());
        }
    }

    @Override
    public TakeResult takeIfOwner(String token, String requesterId) {
        if (token == null) {
            return TakeResult.notFound();
        }
        AtomicReference<TakeResult> result = new AtomicReference<>(TakeResult.notFound());
        AtomicReference<PendingEntry> expired = new AtomicReference<>();

        pending.computeIfPresent(token, (key, entry) -> {
            if (isExpired(entry)) {
                expired.set(entry);
                return null;
            }
            if (!entry.isOwnedBy(requesterId)) {
                result.set(TakeResult.notOwner());
                return entry;
            }
            result.set(TakeResult.found(entry));
            return null;
        });

        if (expired.get() != null) {
            publishExpired(expired.get());
        }
        return result.get();
    }

    @Override
    public void discard(String token) {
        if (token != null && pending.remove(token) != null) {
            log.debug("[Pending] Discarded entry {}", token);
        }
    }

    @Override
    public int size() {
        return pending.size();
    }

    /**
     * Evicts every expired entry.
     *
     * @return number of evicted entries
     */
    int evictExpired() {
        int evicted = 0;
        for (Map.Entry<String, PendingEntry> entry : pending.entrySet()) {
            PendingEntry value = entry.getValue();
            if (isExpired(value) && pending.remove(entry.getKey(), value)) {
                publishExpired(value);
                evicted++;
            }
        }
        return evicted;
    }

    private void sweepSafely() {
        try {
            int evicted = evictExpired();
            if (evicted > 0) {
                log.info("[Pending] Expired {} pending action list(s)", evicted);
            }
        } catch (RuntimeException e) {
            log.error("[Pending] Sweep failed", e);
        }
    }

    private boolean isExpired(PendingEntry entry) {
        return !entry.createdAt().plus(ttl).isAfter(clock.instant());
    }

    private void publishExpired(PendingEntry entry) {
        log.info("[Pending] Entry {} of user {} expired", entry.token(), entry.requesterId());
        eventPublisher.publishEvent(new PendingActionExpiredEvent(entry));
    }
}
