package com.litigation.pipeline.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Token bucket whose tokens refill individually: a token spent at time {@code t} returns
 * to the bucket at {@code t + window}. The bucket therefore never grants more than
 * {@code permitsPerWindow} calls within any window, bursts included.
 *
 * <p>One instance exists per provider and is shared by every session, since the limited
 * resource is the provider's quota.</p>
 */
public class TokenBucketRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(TokenBucketRateLimiter.class);

    private final String name;
    private final int capacity;
    private final long windowNanos;
    private final LongSupplier ticker;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition tokenReturned = lock.newCondition();
    // times at which outstanding tokens were spent, oldest first
    private final Deque<Long> spent = new ArrayDeque<>();

    public TokenBucketRateLimiter(String name, RateLimitConfig config) {
        this(name, config, System::nanoTime);
    }

    TokenBucketRateLimiter(String name, RateLimitConfig config, LongSupplier ticker) {
        this.name = name;
        this.capacity = config.permitsPerWindow();
        this.windowNanos = config.window().toNanos();
        this.ticker = ticker;
    }

    /**
     * Takes a token, waiting up to {@code maxWait} for one to return.
     *
     * @return the grant time in ticker nanos, or empty if no token became available in time
     *         or the thread was interrupted
     */
    public OptionalLong acquire(Duration maxWait) {
        long deadline = ticker.getAsLong() + Math.max(0, maxWait.toNanos());
        lock.lock();
        try {
            while (true) {
                long now = ticker.getAsLong();
                refill(now);
                if (spent.size() < capacity) {
                    spent.addLast(now);
                    return OptionalLong.of(now);
                }
                long nextReturn = spent.peekFirst() + windowNanos;
                if (nextReturn > deadline) {
                    log.debug("rateLimit.exhausted provider={} capacity={}", name, capacity);
                    return OptionalLong.empty();
                }
                tokenReturned.awaitNanos(nextReturn - now);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return OptionalLong.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Takes a token only if one is available right now.
     */
    public boolean tryAcquire() {
        return acquire(Duration.ZERO).isPresent();
    }

    /**
     * Aligns the bucket with the provider's own view of its remaining quota. When the
     * provider reports fewer calls left than the bucket holds, the difference is spent now.
     * A higher report never adds tokens.
     */
    public void syncHeadroom(int providerRemaining) {
        if (providerRemaining < 0) {
            return;
        }
        lock.lock();
        try {
            long now = ticker.getAsLong();
            refill(now);
            int drained = 0;
            while (capacity - spent.size() > providerRemaining) {
                spent.addLast(now);
                drained++;
            }
            if (drained > 0) {
                log.debug("rateLimit.synced provider={} remaining={} drained={}", name, providerRemaining, drained);
            }
        } finally {
            lock.unlock();
        }
    }

    public int availablePermits() {
        lock.lock();
        try {
            refill(ticker.getAsLong());
            return capacity - spent.size();
        } finally {
            lock.unlock();
        }
    }

    public String getName() {
        return name;
    }

    private void refill(long now) {
        boolean returned = false;
        while (!spent.isEmpty() && spent.peekFirst() + windowNanos <= now) {
            spent.pollFirst();
            returned = true;
        }
        if (returned) {
            tokenReturned.signalAll();
        }
    }

    @Override
    public String toString() {
        return "TokenBucketRateLimiter{" + name + ", " + capacity + " per "
                + TimeUnit.NANOSECONDS.toMillis(windowNanos) + "ms}";
    }
}
