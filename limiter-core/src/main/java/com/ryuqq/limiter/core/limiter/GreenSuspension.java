package com.ryuqq.limiter.core.limiter;

import com.ryuqq.limiter.core.model.TaskIdent;
import com.ryuqq.limiter.core.spi.GreenTaskRuntime;
import com.ryuqq.limiter.core.spi.SlotPrimitive;

/**
 * Green Task 대기 전략 (호출 스레드 블로킹).
 *
 * @author Limiter Team
 * @since 1.0.0
 */
final class GreenSuspension implements Suspension {

    private final GreenTaskRuntime runtime;
    private final SlotPrimitive slot;

    GreenSuspension(GreenTaskRuntime runtime, SlotPrimitive slot) {
        this.runtime = runtime;
        this.slot = slot;
    }

    @Override
    public TaskIdent currentTask() {
        return runtime.currentTask();
    }

    @Override
    public void releaseSlot() {
        slot.greenRelease();
    }

    boolean acquireSlot(boolean blocking, long timeoutNanos) throws InterruptedException {
        return slot.greenAcquire(blocking, timeoutNanos);
    }

    void checkpoint() {
        runtime.checkpoint();
    }
}
