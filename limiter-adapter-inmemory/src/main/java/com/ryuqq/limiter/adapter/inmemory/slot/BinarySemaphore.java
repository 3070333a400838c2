package com.ryuqq.limiter.adapter.inmemory.slot;

/**
 * Binary {@link FairSemaphore}: at most one permit is ever banked.
 *
 * <p>Releasing while the permit is already available fails with {@link IllegalStateException}.</p>
 *
 * @author Limiter Team
 * @since 1.0.0
 */
public class BinarySemaphore extends FairSemaphore {

    /**
     * Creates a binary semaphore.
     *
     * @param initialValue 0 (locked) or 1 (unlocked)
     * @throws IllegalArgumentException if initialValue is neither 0 nor 1
     */
    public BinarySemaphore(int initialValue) {
        super(requireBinary(initialValue), 1);
    }

    private static int requireBinary(int initialValue) {
        if (initialValue != 0 && initialValue != 1) {
            throw new IllegalArgumentException("initialValue must be 0 or 1 (current: " + initialValue + ")");
        }
        return initialValue;
    }
}
