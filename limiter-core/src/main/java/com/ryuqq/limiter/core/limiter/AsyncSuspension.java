package com.ryuqq.limiter.core.limiter;

import com.ryuqq.limiter.core.model.TaskIdent;
import com.ryuqq.limiter.core.spi.AsyncTaskRuntime;
import com.ryuqq.limiter.core.spi.SlotPrimitive;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 비동기 Task 대기 전략 (미완료 Future 반환).
 *
 * @author Limiter Team
 * @since 1.0.0
 */
final class AsyncSuspension implements Suspension {

    private final AsyncTaskRuntime runtime;
    private final SlotPrimitive slot;

    AsyncSuspension(AsyncTaskRuntime runtime, SlotPrimitive slot) {
        this.runtime = runtime;
        this.slot = slot;
    }

    @Override
    public TaskIdent currentTask() {
        return runtime.currentTask();
    }

    @Override
    public void releaseSlot() {
        slot.asyncRelease();
    }

    CompletableFuture<Boolean> acquireSlot(boolean blocking) {
        return slot.asyncAcquire(blocking);
    }

    CompletableFuture<Void> checkpoint() {
        return runtime.checkpoint();
    }

    Executor taskExecutor() {
        return runtime.currentTaskExecutor();
    }
}
