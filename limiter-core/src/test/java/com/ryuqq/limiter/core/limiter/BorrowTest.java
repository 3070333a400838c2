package com.ryuqq.limiter.core.limiter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Borrow 핸들 테스트.
 *
 * @author Limiter Team
 * @since 1.0.0
 */
@DisplayName("Borrow 테스트")
class BorrowTest {

    @Test
    @DisplayName("close()는 한 번만 반환 동작을 실행한다")
    void close_멱등() {
        // given
        AtomicInteger releases = new AtomicInteger();
        Borrow borrow = new Borrow(releases::incrementAndGet);

        // when
        borrow.close();
        borrow.close();

        // then
        assertThat(releases.get()).isEqualTo(1);
        assertThat(borrow.isClosed()).isTrue();
    }

    @Test
    @DisplayName("try-with-resources 블록을 벗어나면 반환된다")
    void try_with_resources() {
        // given
        AtomicInteger releases = new AtomicInteger();

        // when
        try (Borrow borrow = new Borrow(releases::incrementAndGet)) {
            assertThat(borrow.isClosed()).isFalse();
        }

        // then
        assertThat(releases.get()).isEqualTo(1);
    }
}
