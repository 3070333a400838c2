package com.ryuqq.limiter.core.model;

/**
 * Task 스케줄링 모델.
 *
 * <p>Capacity Limiter는 두 가지 스케줄링 모델의 Task를 동일한 의미로 지원합니다.</p>
 *
 * <ul>
 *   <li>{@link #ASYNC}: 비동기 Task ({@code CompletableFuture} 체인). 대기 = 미완료 Future 반환</li>
 *   <li>{@link #GREEN}: Green Task (스레드). 대기 = 호출 스레드 블로킹</li>
 * </ul>
 *
 * @author Limiter Team
 * @since 1.0.0
 */
public enum SchedulingModel {

    ASYNC("async"),
    GREEN("green");

    private final String label;

    SchedulingModel(String label) {
        this.label = label;
    }

    /**
     * 로그 및 toString 출력용 라벨.
     *
     * @return 소문자 라벨 (예: "green")
     */
    public String label() {
        return label;
    }
}
