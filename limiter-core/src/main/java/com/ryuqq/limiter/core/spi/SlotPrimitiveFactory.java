package com.ryuqq.limiter.core.spi;

/**
 * Slot Primitive 생성 SPI.
 *
 * <p>Capacity Limiter는 용량이 2 이상이면 {@link #counting(int)},
 * 그 외(0 또는 1)에는 {@link #binary(int)}를 사용합니다.
 * 이 선택은 내부 최적화이며 호출자에게는 보이지 않습니다.</p>
 *
 * @author Limiter Team
 * @since 1.0.0
 */
public interface SlotPrimitiveFactory {

    /**
     * 바이너리 Slot Primitive 생성.
     *
     * @param initialValue 초기 슬롯 수 (0 또는 1)
     * @return Slot Primitive
     * @throws IllegalArgumentException initialValue가 0 또는 1이 아닌 경우
     */
    SlotPrimitive binary(int initialValue);

    /**
     * 카운팅 Slot Primitive 생성.
     *
     * @param initialValue 초기 슬롯 수 (0 이상)
     * @return Slot Primitive
     * @throws IllegalArgumentException initialValue가 음수인 경우
     */
    SlotPrimitive counting(int initialValue);
}
