/**
 * Capacity Limiter 패키지.
 *
 * <p>동시에 리소스 슬롯을 보유할 수 있는 Task 수를 제한하는 동기화 프리미티브를 제공합니다.
 * 비동기 Task와 Green Task 두 스케줄링 모델을 동일한 의미로 지원합니다.</p>
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.limiter.core.limiter.CapacityLimiter}: Task당 슬롯 하나 (비재진입)</li>
 *   <li>{@link com.ryuqq.limiter.core.limiter.ReentrantCapacityLimiter}: Task당 슬롯 하나 + 누적 단위 수</li>
 *   <li>{@link com.ryuqq.limiter.core.limiter.CapacityLimiterConfig}: 총 토큰 수 설정</li>
 *   <li>{@link com.ryuqq.limiter.core.limiter.LimiterRuntime}: SPI 구현체 묶음</li>
 *   <li>{@link com.ryuqq.limiter.core.limiter.Borrow}: try-with-resources 핸들</li>
 * </ul>
 *
 * <h2>Task별 상태 전이</h2>
 * <pre>
 * NotHolding ──획득 성공──▶ Holding
 * Holding ──재진입 획득 / 부분 반환──▶ Holding   (재진입 limiter만)
 * Holding ──보유량 전체 반환──▶ NotHolding
 * </pre>
 *
 * <h2>오류</h2>
 * <ul>
 *   <li>{@link java.lang.IllegalArgumentException}: totalTokens 음수, count 1 미만</li>
 *   <li>{@link com.ryuqq.limiter.core.limiter.BorrowViolationException}: 중복 획득, 미보유 반환, 초과 반환</li>
 * </ul>
 * <p>타임아웃이나 비블로킹 획득 실패는 오류가 아니며 false로 반환됩니다.</p>
 *
 * @author Limiter Team
 * @since 1.0.0
 */
package com.ryuqq.limiter.core.limiter;
