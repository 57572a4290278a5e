package com.deporacle.engine.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;
import reactor.core.scheduler.Scheduler;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Token bucket refilled in whole windows.
 *
 * <p>
 * The bucket starts full. Once at least one full window has elapsed since the
 * last refill, {@code windows * maxTokens} tokens are added (capped at
 * {@code maxTokens}); partial windows add nothing. Callers that find the
 * bucket empty are parked in arrival order and released by a timer on the
 * supplied {@link Scheduler}. The scheduler is also the time source, so a
 * virtual-time scheduler makes the limiter fully deterministic.
 * </p>
 *
 * @author Naveed Gung
 */
public class RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final String name;
    private final int maxTokens;
    private final long windowMs;
    private final Scheduler scheduler;

    private final Deque<MonoSink<Void>> waiters = new ArrayDeque<>();
    private int tokens;
    private long lastRefill;
    private boolean timerPending;

    public RateLimiter(String name, int maxTokens, long windowMs, Scheduler scheduler) {
        if (maxTokens < 1 || windowMs < 1) {
            throw new IllegalArgumentException(
                    "Rate limiter " + name + " needs maxTokens >= 1 and windowMs >= 1");
        }
        this.name = name;
        this.maxTokens = maxTokens;
        this.windowMs = windowMs;
        this.scheduler = scheduler;
        this.tokens = maxTokens;
        this.lastRefill = now();
    }

    /**
     * Take one token, completing immediately when one is available and
     * otherwise once a later refill grants one to this caller.
     */
    public Mono<Void> acquire() {
        return Mono.create(sink -> {
            List<MonoSink<Void>> released;
            boolean granted = false;
            synchronized (this) {
                released = refill();
                if (tokens > 0 && waiters.isEmpty()) {
                    tokens--;
                    granted = true;
                } else {
                    waiters.addLast(sink);
                    sink.onCancel(() -> removeWaiter(sink));
                    scheduleTimer();
                    log.debug("Rate limiter {} exhausted, {} caller(s) waiting", name, waiters.size());
                }
            }
            released.forEach(MonoSink::success);
            if (granted) {
                sink.success();
            }
        });
    }

    /** Current token count after applying any due refill. */
    public int remaining() {
        List<MonoSink<Void>> released;
        int current;
        synchronized (this) {
            released = refill();
            current = tokens;
        }
        released.forEach(MonoSink::success);
        return current;
    }

    public synchronized long msUntilRefill() {
        return Math.max(0, windowMs - (now() - lastRefill));
    }

    public synchronized int waiting() {
        return waiters.size();
    }

    public String getName() {
        return name;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    /** Must be called while holding the monitor. Returns the waiters to complete outside it. */
    private List<MonoSink<Void>> refill() {
        long now = now();
        long elapsed = now - lastRefill;
        if (elapsed < windowMs) {
            return List.of();
        }
        long windows = elapsed / windowMs;
        tokens = (int) Math.min(maxTokens, tokens + windows * (long) maxTokens);
        lastRefill = now - (elapsed % windowMs);

        List<MonoSink<Void>> released = new ArrayList<>();
        while (tokens > 0 && !waiters.isEmpty()) {
            tokens--;
            released.add(waiters.pollFirst());
        }
        return released;
    }

    private void scheduleTimer() {
        if (timerPending) {
            return;
        }
        timerPending = true;
        long delay = Math.max(1, windowMs - (now() - lastRefill));
        scheduler.schedule(this::onTimer, delay, TimeUnit.MILLISECONDS);
    }

    private void onTimer() {
        List<MonoSink<Void>> released;
        synchronized (this) {
            timerPending = false;
            released = refill();
            if (!waiters.isEmpty()) {
                scheduleTimer();
            }
        }
        released.forEach(MonoSink::success);
    }

    private synchronized void removeWaiter(MonoSink<Void> sink) {
        waiters.remove(sink);
    }

    private long now() {
        return scheduler.now(TimeUnit.MILLISECONDS);
    }
}
