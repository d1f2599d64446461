package com.phillippitts.podcaster.service.util;

import com.phillippitts.podcaster.exception.PodcasterException;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Bounds the number of concurrent calls to an external provider with a semaphore.
 *
 * <p><b>Usage Pattern:</b>
 * <pre>{@code
 * ConcurrencyGuard guard = new ConcurrencyGuard(new Semaphore(5), 0, "tts");
 *
 * guard.acquire(); // Blocks until a permit is available
 * try {
 *     // ... call the provider ...
 * } finally {
 *     guard.release();
 * }
 * }</pre>
 *
 * <p><b>Thread Safety:</b> thread-safe; the underlying {@link Semaphore} handles concurrent
 * acquire/release.
 */
public final class ConcurrencyGuard {

    private final Semaphore semaphore;
    private final long timeoutMs;
    private final String name;

    /**
     * @param semaphore semaphore controlling concurrent access
     * @param timeoutMs maximum wait for a permit in milliseconds; {@code <= 0} waits indefinitely
     * @param name      guarded resource name for error messages
     */
    public ConcurrencyGuard(Semaphore semaphore, long timeoutMs, String name) {
        this.semaphore = semaphore;
        this.timeoutMs = timeoutMs;
        this.name = name;
    }

    public static ConcurrencyGuard blocking(int permits, String name) {
        return new ConcurrencyGuard(new Semaphore(permits, true), 0, name);
    }

    /**
     * Acquires a permit, queueing behind earlier callers.
     *
     * @throws PodcasterException if the timeout elapses or the thread is interrupted while waiting
     */
    public void acquire() {
        try {
            if (timeoutMs <= 0) {
                semaphore.acquire();
                return;
            }
            if (!semaphore.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS)) {
                throw new PodcasterException(name + " concurrency limit reached after " + timeoutMs + "ms wait");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PodcasterException(name + " interrupted while waiting for a permit", e);
        }
    }

    /**
     * Releases a permit. Call from a finally block.
     */
    public void release() {
        semaphore.release();
    }

    public int availablePermits() {
        return semaphore.availablePermits();
    }
}
