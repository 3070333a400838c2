package com.ryuqq.limiter.adapter.inmemory.runtime;

import com.ryuqq.limiter.core.model.TaskIdent;
import com.ryuqq.limiter.core.spi.AsyncTaskRuntime;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * {@link AsyncTaskContext} 기반 비동기 Task 런타임.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>currentTask(): 현재 스레드에 바인딩된 {@link AsyncTaskContext}의 식별자</li>
 *   <li>checkpoint(): Task Executor에 빈 작업을 다시 제출하여 다른 작업에 차례를 넘김</li>
 *   <li>currentTaskExecutor(): 현재 Task의 바인딩 Executor</li>
 * </ul>
 *
 * @author Limiter Team
 * @since 1.0.0
 */
public final class ContextAsyncTaskRuntime implements AsyncTaskRuntime {

    @Override
    public TaskIdent currentTask() {
        return requireCurrent().ident();
    }

    @Override
    public CompletableFuture<Void> checkpoint() {
        return CompletableFuture.runAsync(() -> { }, requireCurrent().executor());
    }

    @Override
    public Executor currentTaskExecutor() {
        return requireCurrent().executor();
    }

    private static AsyncTaskContext requireCurrent() {
        return AsyncTaskContext.current()
            .orElseThrow(() -> new IllegalStateException("no async task is bound to the current thread"));
    }
}
