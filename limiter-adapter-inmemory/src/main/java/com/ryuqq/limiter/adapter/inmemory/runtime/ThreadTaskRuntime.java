package com.ryuqq.limiter.adapter.inmemory.runtime;

import com.ryuqq.limiter.core.model.TaskIdent;
import com.ryuqq.limiter.core.spi.GreenTaskRuntime;

/**
 * 스레드 기반 Green Task 런타임.
 *
 * <p>Green Task 하나 = 스레드 하나. 식별자는 스레드 id, 체크포인트는 {@link Thread#yield()}입니다.</p>
 *
 * @author Limiter Team
 * @since 1.0.0
 */
public final class ThreadTaskRuntime implements GreenTaskRuntime {

    private static final ThreadTaskRuntime INSTANCE = new ThreadTaskRuntime();

    public static ThreadTaskRuntime instance() {
        return INSTANCE;
    }

    private ThreadTaskRuntime() {
    }

    @Override
    public TaskIdent currentTask() {
        return TaskIdent.green(Thread.currentThread().getId());
    }

    @Override
    public void checkpoint() {
        Thread.yield();
    }
}
