package com.ryuqq.limiter.core.spi;

import com.ryuqq.limiter.core.model.TaskIdent;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 비동기 Task 런타임 SPI.
 *
 * <p>비동기 Task 스케줄링 모델의 Task 식별자 해석, 협력적 체크포인트,
 * 그리고 Task 컨텍스트를 유지한 채 후속 작업을 실행할 Executor를 제공합니다.</p>
 *
 * @author Limiter Team
 * @since 1.0.0
 */
public interface AsyncTaskRuntime {

    /**
     * 호출 중인 비동기 Task의 식별자 조회.
     *
     * @return 현재 Task 식별자
     * @throws IllegalStateException 호출 스레드에 바인딩된 비동기 Task가 없는 경우
     */
    TaskIdent currentTask();

    /**
     * 스케줄러에 실행 기회를 양보합니다.
     *
     * @return 다른 Task가 실행될 기회를 가진 뒤 완료되는 Future
     */
    CompletableFuture<Void> checkpoint();

    /**
     * 호출 중인 Task의 컨텍스트로 작업을 실행하는 Executor 조회.
     *
     * <p>후속 Stage가 다른 스레드에서 완료되더라도
     * 이 Executor로 실행된 코드는 같은 {@link #currentTask()}를 보게 됩니다.</p>
     *
     * @return Task 바인딩 Executor
     * @throws IllegalStateException 호출 스레드에 바인딩된 비동기 Task가 없는 경우
     */
    Executor currentTaskExecutor();
}
