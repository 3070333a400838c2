package com.ryuqq.limiter.core.limiter;

import com.ryuqq.limiter.core.spi.AsyncTaskRuntime;
import com.ryuqq.limiter.core.spi.GreenTaskRuntime;
import com.ryuqq.limiter.core.spi.SlotPrimitiveFactory;

/**
 * Capacity Limiter가 위임하는 협력 객체 묶음.
 *
 * <p>어댑터 모듈(예: limiter-adapter-inmemory)이 구현체를 조립하여 제공합니다.
 * 여러 limiter 인스턴스가 하나의 LimiterRuntime을 공유할 수 있습니다.</p>
 *
 * @param slots Slot Primitive 생성기
 * @param green Green Task 런타임 (식별자 해석 + 체크포인트)
 * @param async 비동기 Task 런타임 (식별자 해석 + 체크포인트 + Task 바인딩 Executor)
 * @author Limiter Team
 * @since 1.0.0
 */
public record LimiterRuntime(
    SlotPrimitiveFactory slots,
    GreenTaskRuntime green,
    AsyncTaskRuntime async
) {

    /**
     * Compact constructor (null 검증).
     *
     * @throws IllegalArgumentException 협력 객체가 null인 경우
     */
    public LimiterRuntime {
        if (slots == null) {
            throw new IllegalArgumentException("slots cannot be null");
        }
        if (green == null) {
            throw new IllegalArgumentException("green cannot be null");
        }
        if (async == null) {
            throw new IllegalArgumentException("async cannot be null");
        }
    }
}
