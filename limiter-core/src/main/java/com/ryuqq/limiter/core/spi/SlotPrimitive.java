package com.ryuqq.limiter.core.spi;

import java.util.concurrent.CompletableFuture;

/**
 * Slot Primitive SPI.
 *
 * <p>실제 대기/큐잉/깨우기를 수행하는 카운팅(또는 바이너리) 세마포어 추상화입니다.
 * Capacity Limiter는 슬롯 계산을 전적으로 이 SPI에 위임하고, 자신은 Borrower Ledger만 관리합니다.</p>
 *
 * <p><strong>구현체 요구사항:</strong></p>
 * <ul>
 *   <li>{@link #initialValue()}는 생성 후 변경되지 않음</li>
 *   <li>대기자는 스케줄링 모델과 무관하게 도착 순서(FIFO)로 깨어남</li>
 *   <li>비동기 대기자와 Green 대기자를 하나의 큐에서 관리 (어느 쪽이 release 해도 양쪽 모두 깨울 수 있음)</li>
 *   <li>비블로킹 획득 시도는 큐에 들어가지 않으며 {@link #waiting()}에 포함되지 않음</li>
 *   <li>내부 카운터는 구현체가 자체적으로 동기화</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * SlotPrimitive slot = factory.counting(2);
 *
 * if (slot.greenAcquire(true, SlotPrimitive.NO_TIMEOUT)) {
 *     try {
 *         // 보호된 작업
 *     } finally {
 *         slot.greenRelease();
 *     }
 * }
 * }</pre>
 *
 * @author Limiter Team
 * @since 1.0.0
 */
public interface SlotPrimitive {

    /**
     * 타임아웃 없음 (무기한 대기).
     */
    long NO_TIMEOUT = -1L;

    /**
     * 초기 용량 조회.
     *
     * @return 생성 시 지정된 슬롯 수
     */
    int initialValue();

    /**
     * 현재 사용 가능한 슬롯 수 조회.
     *
     * @return 0 이상 {@link #initialValue()} 이하
     */
    int value();

    /**
     * 현재 대기 중인 획득 요청 수 조회.
     *
     * @return 큐에 있는 대기자 수 (취소/타임아웃된 대기자 제외)
     */
    int waiting();

    /**
     * 비동기 Task용 슬롯 획득.
     *
     * <p>슬롯을 즉시 얻을 수 있으면 완료된 Future를 반환합니다.
     * 그렇지 않고 blocking이 true면 큐에 들어가 미완료 Future를 반환합니다.</p>
     *
     * <p>반환된 Future를 {@link CompletableFuture#cancel(boolean) cancel} 하면
     * 대기자는 큐에서 제거되고 슬롯은 할당되지 않습니다.</p>
     *
     * @param blocking false면 큐에 들어가지 않고 즉시 결과 반환
     * @return true: 획득 성공, false: 비블로킹 획득 실패
     */
    CompletableFuture<Boolean> asyncAcquire(boolean blocking);

    /**
     * Green Task용 슬롯 획득 (호출 스레드 블로킹).
     *
     * <p>InterruptedException이 발생하면 슬롯은 할당되지 않은 상태로 보장됩니다.</p>
     *
     * @param blocking false면 큐에 들어가지 않고 즉시 결과 반환
     * @param timeoutNanos 최대 대기 시간 (나노초), {@link #NO_TIMEOUT}이면 무기한
     * @return true: 획득 성공, false: 비블로킹 실패 또는 타임아웃
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    boolean greenAcquire(boolean blocking, long timeoutNanos) throws InterruptedException;

    /**
     * 비동기 Task용 슬롯 반환.
     */
    void asyncRelease();

    /**
     * Green Task용 슬롯 반환.
     */
    void greenRelease();
}
