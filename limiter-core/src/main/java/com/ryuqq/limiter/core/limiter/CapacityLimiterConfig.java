package com.ryuqq.limiter.core.limiter;

/**
 * Capacity Limiter 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>totalTokens: 동시에 슬롯을 보유할 수 있는 최대 Task 수 (기본 1 = 바이너리 limiter)</li>
 * </ul>
 *
 * <p>totalTokens가 0이면 어떤 Task도 슬롯을 얻을 수 없습니다.
 * 블로킹 획득은 무기한 대기하고 비블로킹 획득은 즉시 false를 반환합니다.</p>
 *
 * @author Limiter Team
 * @since 1.0.0
 * @param totalTokens 총 토큰 수 (0 이상이어야 함)
 */
public record CapacityLimiterConfig(int totalTokens) {

    /**
     * 기본 토큰 수.
     */
    public static final int DEFAULT_TOTAL_TOKENS = 1;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: totalTokens=1</p>
     */
    public CapacityLimiterConfig() {
        this(DEFAULT_TOTAL_TOKENS);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException totalTokens가 음수인 경우
     */
    public CapacityLimiterConfig {
        if (totalTokens < 0) {
            throw new IllegalArgumentException(
                "totalTokens must be >= 0 (current: " + totalTokens + ")"
            );
        }
    }

    /**
     * nullable 토큰 수로 설정 생성.
     *
     * @param totalTokens 총 토큰 수, null이면 기본값 1
     * @return 설정 인스턴스
     * @throws IllegalArgumentException totalTokens가 음수인 경우
     */
    public static CapacityLimiterConfig of(Integer totalTokens) {
        if (totalTokens == null) {
            return new CapacityLimiterConfig();
        }
        return new CapacityLimiterConfig(totalTokens);
    }

    /**
     * totalTokens만 변경한 새 인스턴스 생성.
     */
    public CapacityLimiterConfig withTotalTokens(int totalTokens) {
        return new CapacityLimiterConfig(totalTokens);
    }

    /**
     * 카운팅 Slot Primitive가 필요한지 여부.
     *
     * @return totalTokens가 2 이상이면 true
     */
    public boolean requiresCountingSlot() {
        return totalTokens >= 2;
    }
}
