package com.phillippitts.multishot.service.runner;

import com.phillippitts.multishot.exception.GateTimeoutException;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counting gate that bounds how many engine dispatches of a run execute at once.
 *
 * <p>Backed by a fair {@link Semaphore}, so waiters are served in arrival order. The gate also
 * counts permits it has handed out, which lets {@link #release()} reject a release that was
 * never matched by an acquire instead of silently growing capacity.
 *
 * <p><b>Thread Safety:</b> This class is thread-safe.
 *
 * <p><b>Usage Pattern:</b>
 * <pre>{@code
 * gate.acquire();
 * try {
 *     // ... execute one engine with retries ...
 * } finally {
 *     gate.release();
 * }
 * }</pre>
 */
public final class ConcurrencyGate {

    private final Semaphore semaphore;
    private final int capacity;
    private final AtomicInteger inUse = new AtomicInteger();

    /**
     * @param capacity maximum number of simultaneous holders (at least 1)
     * @throws IllegalArgumentException if capacity is below 1
     */
    public ConcurrencyGate(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Gate capacity must be at least 1, got " + capacity);
        }
        this.capacity = capacity;
        this.semaphore = new Semaphore(capacity, true);
    }

    /**
     * Blocks until a permit is available.
     *
     * @throws InterruptedException if the waiting thread is interrupted; no permit is held then
     */
    public void acquire() throws InterruptedException {
        semaphore.acquire();
        inUse.incrementAndGet();
    }

    /**
     * Waits at most {@code timeoutMs} for a permit.
     *
     * @throws GateTimeoutException if no permit became available in time
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public void acquire(long timeoutMs) throws InterruptedException {
        if (!semaphore.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS)) {
            throw new GateTimeoutException(timeoutMs);
        }
        inUse.incrementAndGet();
    }

    /**
     * Returns a previously acquired permit.
     *
     * @throws IllegalStateException if no permit is currently held
     */
    public void release() {
        int current;
        do {
            current = inUse.get();
            if (current == 0) {
                throw new IllegalStateException("release() without matching acquire()");
            }
        } while (!inUse.compareAndSet(current, current - 1));
        semaphore.release();
    }

    public int availablePermits() {
        return semaphore.availablePermits();
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Estimated number of threads waiting for a permit.
     */
    public int queueLength() {
        return semaphore.getQueueLength();
    }

    public int inUse() {
        return inUse.get();
    }

    public Stats stats() {
        return new Stats(capacity, availablePermits(), inUse(), queueLength());
    }

    /**
     * Point-in-time view of the gate, for logs and status endpoints.
     */
    public record Stats(int capacity, int available, int inUse, int waiting) {}
}
