package com.ryuqq.limiter.adapter.inmemory.slot;

import com.ryuqq.limiter.core.spi.SlotPrimitive;
import com.ryuqq.limiter.core.spi.SlotPrimitiveFactory;

/**
 * In-memory implementation of {@link SlotPrimitiveFactory}.
 *
 * <p>Both kinds are bounded by their initial value, so a release without a matching
 * acquire surfaces as {@link IllegalStateException} instead of silently growing capacity.</p>
 *
 * @author Limiter Team
 * @since 1.0.0
 */
public class InMemorySlotPrimitiveFactory implements SlotPrimitiveFactory {

    @Override
    public SlotPrimitive binary(int initialValue) {
        return new BinarySemaphore(initialValue);
    }

    @Override
    public SlotPrimitive counting(int initialValue) {
        return new FairSemaphore(initialValue, initialValue);
    }
}
