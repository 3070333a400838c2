package com.ryuqq.limiter.core.limiter;

import com.ryuqq.limiter.core.model.TaskIdent;

/**
 * 스케줄링 모델별 대기 전략.
 *
 * <p>limiter의 장부/검증 로직은 모델과 무관하게 하나로 공유하고,
 * Task 식별자 해석과 슬롯 반환만 이 전략을 통해 모델별 진입점으로 보냅니다.
 * 획득/체크포인트는 반환 타입이 모델마다 달라 구현 클래스에 정의합니다.</p>
 *
 * @author Limiter Team
 * @since 1.0.0
 */
interface Suspension {

    TaskIdent currentTask();

    void releaseSlot();
}
