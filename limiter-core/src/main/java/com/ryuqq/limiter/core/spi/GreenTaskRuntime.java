package com.ryuqq.limiter.core.spi;

import com.ryuqq.limiter.core.model.TaskIdent;

/**
 * Green Task 런타임 SPI.
 *
 * <p>Green Task 스케줄링 모델의 Task 식별자 해석과 협력적 체크포인트를 제공합니다.</p>
 *
 * @author Limiter Team
 * @since 1.0.0
 */
public interface GreenTaskRuntime {

    /**
     * 호출 중인 Green Task의 식별자 조회.
     *
     * <p>같은 Task 안에서는 항상 동일한 값을 반환해야 합니다.</p>
     *
     * @return 현재 Task 식별자
     */
    TaskIdent currentTask();

    /**
     * 스케줄러에 실행 기회를 양보합니다.
     *
     * <p>호출자를 무기한 블로킹하지 않습니다. 같은 우선순위의 실행 가능한 Task 순서를 바꿀 수 있습니다.</p>
     */
    void checkpoint();
}
