package com.ryuqq.limiter.adapter.inmemory.slot;

import com.ryuqq.limiter.core.spi.SlotPrimitive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory implementation of {@link SlotPrimitive}: a FIFO-fair counting semaphore
 * shared by async and green waiters.
 *
 * <p>Every waiter, regardless of scheduling model, is a {@link CompletableFuture} in one queue.
 * Async waiters receive the future directly; green waiters block on it.</p>
 *
 * <p><strong>Fairness:</strong></p>
 * <ul>
 *   <li>A released permit is handed directly to the oldest live waiter</li>
 *   <li>Permits are only banked when the queue is empty, so a new arrival never barges past a queued waiter</li>
 *   <li>Non-blocking attempts never enter the queue</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>{@link ReentrantLock} guards the permit count and the queue</li>
 *   <li>Waiters are completed outside the lock so their callbacks never run under it</li>
 *   <li>A waiter is either granted ({@code complete(true)}) or withdrawn, never both</li>
 * </ul>
 *
 * @author Limiter Team
 * @since 1.0.0
 */
public class FairSemaphore implements SlotPrimitive {

    private static final Logger log = LoggerFactory.getLogger(FairSemaphore.class);

    private final int initialValue;
    private final int maxValue;
    private final ReentrantLock lock = new ReentrantLock();
    private final ArrayDeque<CompletableFuture<Boolean>> waiters = new ArrayDeque<>();
    private int permits;

    /**
     * Creates an unbounded semaphore.
     *
     * @param initialValue initial permits (must be >= 0)
     * @throws IllegalArgumentException if initialValue is negative
     */
    public FairSemaphore(int initialValue) {
        this(initialValue, Integer.MAX_VALUE);
    }

    /**
     * Creates a bounded semaphore; releasing beyond {@code maxValue} fails.
     *
     * @param initialValue initial permits (must be >= 0)
     * @param maxValue upper bound of banked permits (must be >= initialValue)
     * @throws IllegalArgumentException if the values are out of range
     */
    public FairSemaphore(int initialValue, int maxValue) {
        if (initialValue < 0) {
            throw new IllegalArgumentException("initialValue must be >= 0 (current: " + initialValue + ")");
        }
        if (maxValue < initialValue) {
            throw new IllegalArgumentException(
                "maxValue must be >= initialValue (current: " + maxValue + " < " + initialValue + ")"
            );
        }
        this.initialValue = initialValue;
        this.maxValue = maxValue;
        this.permits = initialValue;
    }

    @Override
    public int initialValue() {
        return initialValue;
    }

    /**
     * Returns the upper bound of banked permits.
     *
     * @return max value ({@link Integer#MAX_VALUE} when unbounded)
     */
    public int maxValue() {
        return maxValue;
    }

    @Override
    public int value() {
        lock.lock();
        try {
            return permits;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int waiting() {
        lock.lock();
        try {
            return waiters.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Cancelling the returned future removes the waiter from the queue</li>
     *   <li>If a permit was handed over concurrently with the cancellation, it passes to the next waiter</li>
     * </ul>
     */
    @Override
    public CompletableFuture<Boolean> asyncAcquire(boolean blocking) {
        CompletableFuture<Boolean> waiter;
        lock.lock();
        try {
            if (tryAcquireLocked()) {
                return CompletableFuture.completedFuture(true);
            }
            if (!blocking) {
                return CompletableFuture.completedFuture(false);
            }
            waiter = enqueueLocked();
        } finally {
            lock.unlock();
        }

        waiter.whenComplete((granted, error) -> {
            if (waiter.isCancelled()) {
                discard(waiter);
                log.trace("Async waiter cancelled on {}", this);
            }
        });
        return waiter;
    }

    @Override
    public boolean greenAcquire(boolean blocking, long timeoutNanos) throws InterruptedException {
        CompletableFuture<Boolean> waiter;
        lock.lock();
        try {
            if (tryAcquireLocked()) {
                return true;
            }
            if (!blocking) {
                return false;
            }
            waiter = enqueueLocked();
        } finally {
            lock.unlock();
        }

        try {
            if (timeoutNanos < 0) {
                return waiter.get();
            }
            return waiter.get(timeoutNanos, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            if (withdraw(waiter)) {
                log.trace("Green waiter timed out on {}", this);
                return false;
            }
            // granted at the moment of the timeout
            return true;
        } catch (InterruptedException e) {
            if (!withdraw(waiter)) {
                // granted at the moment of the interrupt: hand it on
                release();
            }
            log.debug("Green waiter interrupted on {}", this);
            throw e;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Green waiter completed exceptionally", e.getCause());
        }
    }

    @Override
    public void asyncRelease() {
        release();
    }

    @Override
    public void greenRelease() {
        release();
    }

    /**
     * Releases one permit: hands it to the oldest live waiter or banks it.
     *
     * @throws IllegalStateException if the semaphore is bounded and already at its max value
     */
    public void release() {
        while (true) {
            CompletableFuture<Boolean> next;
            lock.lock();
            try {
                next = waiters.pollFirst();
                if (next == null) {
                    if (permits >= maxValue) {
                        throw new IllegalStateException("semaphore released too many times");
                    }
                    permits++;
                    return;
                }
            } finally {
                lock.unlock();
            }
            if (next.complete(true)) {
                return;
            }
            // waiter was withdrawn after being polled: try the next one
        }
    }

    @Override
    public String toString() {
        int available;
        int queued;
        lock.lock();
        try {
            available = permits;
            queued = waiters.size();
        } finally {
            lock.unlock();
        }
        StringBuilder sb = new StringBuilder()
            .append(getClass().getSimpleName())
            .append('(').append(initialValue).append(')')
            .append("{value=").append(available);
        if (available == 0) {
            sb.append(", waiting=").append(queued);
        }
        return sb.append('}').toString();
    }

    private boolean tryAcquireLocked() {
        if (permits > 0 && waiters.isEmpty()) {
            permits--;
            return true;
        }
        return false;
    }

    private CompletableFuture<Boolean> enqueueLocked() {
        CompletableFuture<Boolean> waiter = new CompletableFuture<>();
        waiters.addLast(waiter);
        return waiter;
    }

    /**
     * Withdraws a green waiter.
     *
     * @return true if withdrawn, false if a permit was already handed to it
     */
    private boolean withdraw(CompletableFuture<Boolean> waiter) {
        if (waiter.complete(false)) {
            discard(waiter);
            return true;
        }
        return false;
    }

    private void discard(CompletableFuture<Boolean> waiter) {
        lock.lock();
        try {
            waiters.remove(waiter);
        } finally {
            lock.unlock();
        }
    }
}
