package com.ryuqq.limiter.adapter.inmemory.runtime;

import com.ryuqq.limiter.adapter.inmemory.slot.InMemorySlotPrimitiveFactory;
import com.ryuqq.limiter.core.limiter.LimiterRuntime;

/**
 * In-memory {@link LimiterRuntime} 조립.
 *
 * <pre>{@code
 * LimiterRuntime runtime = InMemoryLimiterRuntime.create();
 * CapacityLimiter limiter = new CapacityLimiter(runtime, 10);
 * }</pre>
 *
 * @author Limiter Team
 * @since 1.0.0
 */
public final class InMemoryLimiterRuntime {

    private InMemoryLimiterRuntime() {
    }

    /**
     * FairSemaphore + 스레드 Green 런타임 + AsyncTaskContext 비동기 런타임.
     *
     * @return 새 LimiterRuntime
     */
    public static LimiterRuntime create() {
        return new LimiterRuntime(
            new InMemorySlotPrimitiveFactory(),
            ThreadTaskRuntime.instance(),
            new ContextAsyncTaskRuntime()
        );
    }
}
