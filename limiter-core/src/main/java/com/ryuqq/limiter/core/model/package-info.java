/**
 * Capacity Limiter 도메인 모델.
 *
 * <p>Task 식별자({@link com.ryuqq.limiter.core.model.TaskIdent})와
 * 스케줄링 모델({@link com.ryuqq.limiter.core.model.SchedulingModel})을 정의합니다.</p>
 *
 * @author Limiter Team
 * @since 1.0.0
 */
package com.ryuqq.limiter.core.model;
