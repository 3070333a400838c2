package com.ryuqq.limiter.core.limiter;

import com.ryuqq.limiter.core.limiter.BorrowViolationException.Violation;
import com.ryuqq.limiter.core.model.TaskIdent;
import com.ryuqq.limiter.core.spi.AsyncTaskRuntime;
import com.ryuqq.limiter.core.spi.GreenTaskRuntime;
import com.ryuqq.limiter.core.spi.SlotPrimitive;
import com.ryuqq.limiter.core.spi.SlotPrimitiveFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

/**
 * ReentrantCapacityLimiter 유닛 테스트.
 *
 * @author Limiter Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ReentrantCapacityLimiter 테스트")
class ReentrantCapacityLimiterTest {

    private static final TaskIdent GREEN_TASK = TaskIdent.green(7);
    private static final TaskIdent ASYNC_TASK = TaskIdent.async(7);

    @Mock
    private SlotPrimitiveFactory slots;

    @Mock
    private SlotPrimitive slot;

    @Mock
    private GreenTaskRuntime green;

    @Mock
    private AsyncTaskRuntime async;

    private ReentrantCapacityLimiter limiter;

    @BeforeEach
    void setUp() {
        when(slots.counting(anyInt())).thenReturn(slot);
        lenient().when(green.currentTask()).thenReturn(GREEN_TASK);
        lenient().when(async.currentTask()).thenReturn(ASYNC_TASK);
        limiter = new ReentrantCapacityLimiter(new LimiterRuntime(slots, green, async), 2);
    }

    // ============================================================
    // Green Task 계열
    // ============================================================

    @Test
    @DisplayName("acquire(3) 후 acquire(2)는 슬롯을 한 번만 얻고 count는 5가 된다")
    void greenAcquire_재진입_누적() throws InterruptedException {
        // given
        when(slot.greenAcquire(true, SlotPrimitive.NO_TIMEOUT)).thenReturn(true);

        // when
        limiter.greenAcquire(3);
        limiter.greenAcquire(2);

        // then
        assertThat(limiter.greenCount()).isEqualTo(5);
        assertThat(limiter.getBorrowers()).containsEntry(GREEN_TASK, 5).hasSize(1);
        verify(slot, times(1)).greenAcquire(anyBoolean(), anyLong());
    }

    @Test
    @DisplayName("블로킹 재진입 획득은 count 증가 전에 체크포인트를 호출한다")
    void greenAcquire_재진입_블로킹_체크포인트() throws InterruptedException {
        // given
        when(slot.greenAcquire(true, SlotPrimitive.NO_TIMEOUT)).thenReturn(true);
        limiter.greenAcquire();
        doAnswer(invocation -> {
            assertThat(limiter.greenCount()).isEqualTo(1);
            return null;
        }).when(green).checkpoint();

        // when
        boolean acquired = limiter.greenAcquire(1, true);

        // then
        assertThat(acquired).isTrue();
        assertThat(limiter.greenCount()).isEqualTo(2);
        verify(green, times(1)).checkpoint();
    }

    @Test
    @DisplayName("첫 획득은 체크포인트를 호출하지 않는다")
    void greenAcquire_첫_획득_체크포인트_없음() throws InterruptedException {
        // given
        when(slot.greenAcquire(true, SlotPrimitive.NO_TIMEOUT)).thenReturn(true);

        // when
        limiter.greenAcquire(4);

        // then
        assertThat(limiter.greenCount()).isEqualTo(4);
        verify(green, never()).checkpoint();
    }

    @Test
    @DisplayName("비블로킹 재진입 획득은 체크포인트 없이 즉시 성공한다")
    void greenAcquire_재진입_비블로킹_체크포인트_없음() throws InterruptedException {
        // given
        when(slot.greenAcquire(true, SlotPrimitive.NO_TIMEOUT)).thenReturn(true);
        limiter.greenAcquire();

        // when
        boolean acquired = limiter.greenAcquire(2, false);

        // then
        assertThat(acquired).isTrue();
        assertThat(limiter.greenCount()).isEqualTo(3);
        verify(green, never()).checkpoint();
    }

    @Test
    @DisplayName("타임아웃 재진입 획득도 슬롯을 기다리지 않고 체크포인트 후 성공한다")
    void greenAcquire_재진입_타임아웃() throws InterruptedException {
        // given
        when(slot.greenAcquire(true, SlotPrimitive.NO_TIMEOUT)).thenReturn(true);
        limiter.greenAcquire();

        // when
        boolean acquired = limiter.greenAcquire(1, 0, TimeUnit.SECONDS);

        // then
        assertThat(acquired).isTrue();
        assertThat(limiter.greenCount()).isEqualTo(2);
        verify(slot, times(1)).greenAcquire(anyBoolean(), anyLong());
        verify(green).checkpoint();
    }

    @Test
    @DisplayName("상속된 greenAcquire(boolean)은 1 단위 재진입이며 ALREADY_HOLDING이 아니다")
    void greenAcquire_boolean_재진입() throws InterruptedException {
        // given
        when(slot.greenAcquire(true, SlotPrimitive.NO_TIMEOUT)).thenReturn(true);
        limiter.greenAcquire();

        // when
        limiter.greenAcquire(true);

        // then
        assertThat(limiter.greenCount()).isEqualTo(2);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, Integer.MIN_VALUE})
    @DisplayName("count가 1 미만이면 어떤 협력 객체도 호출하기 전에 IllegalArgumentException")
    void count_검증(int count) {
        assertThatThrownBy(() -> limiter.greenAcquire(count))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("count must be >= 1 (current: " + count + ")");
        assertThatThrownBy(() -> limiter.greenRelease(count))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> limiter.asyncAcquire(count))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> limiter.asyncRelease(count))
            .isInstanceOf(IllegalArgumentException.class);

        verifyNoInteractions(slot, green, async);
    }

    @Test
    @DisplayName("부분 반환은 count만 줄이고 전체 반환은 슬롯을 반환한다")
    void greenRelease_부분_전체() throws InterruptedException {
        // given
        when(slot.greenAcquire(true, SlotPrimitive.NO_TIMEOUT)).thenReturn(true);
        limiter.greenAcquire(3);

        // when
        limiter.greenRelease(2);

        // then
        assertThat(limiter.greenCount()).isEqualTo(1);
        verify(slot, never()).greenRelease();

        // when
        limiter.greenRelease();

        // then
        assertThat(limiter.greenCount()).isZero();
        assertThat(limiter.greenBorrowed()).isFalse();
        verify(slot, times(1)).greenRelease();
    }

    @Test
    @DisplayName("보유량보다 많이 반환하면 OVER_RELEASE, 장부와 슬롯은 그대로다")
    void greenRelease_초과_반환() throws InterruptedException {
        // given
        when(slot.greenAcquire(true, SlotPrimitive.NO_TIMEOUT)).thenReturn(true);
        limiter.greenAcquire(2);

        // when
        BorrowViolationException violation =
            catchThrowableOfType(() -> limiter.greenRelease(3), BorrowViolationException.class);

        // then
        assertThat(violation.getViolation()).isEqualTo(Violation.OVER_RELEASE);
        assertThat(violation).hasMessage("capacity limiter released too many times");
        assertThat(limiter.greenCount()).isEqualTo(2);
        verify(slot, never()).greenRelease();
    }

    @Test
    @DisplayName("보유하지 않은 Task의 release(1)은 NOT_HOLDING")
    void greenRelease_미보유() {
        // when
        BorrowViolationException violation =
            catchThrowableOfType(() -> limiter.greenRelease(1), BorrowViolationException.class);

        // then
        assertThat(violation.getViolation()).isEqualTo(Violation.NOT_HOLDING);
        verify(slot, never()).greenRelease();
    }

    // ============================================================
    // 비동기 Task 계열
    // ============================================================

    @Test
    @DisplayName("비동기 첫 획득은 count를 기록한다")
    void asyncAcquire_첫_획득() {
        // given
        when(slot.asyncAcquire(true)).thenReturn(CompletableFuture.completedFuture(true));

        // when
        CompletableFuture<Boolean> result = limiter.asyncAcquire(3);

        // then
        assertThat(result).isCompletedWithValue(true);
        assertThat(limiter.asyncCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("비동기 블로킹 재진입은 체크포인트가 끝난 뒤에 count를 더한다")
    void asyncAcquire_재진입_체크포인트_후_증가() {
        // given
        CompletableFuture<Void> yielded = new CompletableFuture<>();
        when(slot.asyncAcquire(true)).thenReturn(CompletableFuture.completedFuture(true));
        when(async.checkpoint()).thenReturn(yielded);
        limiter.asyncAcquire(3);

        // when
        CompletableFuture<Boolean> result = limiter.asyncAcquire(2);

        // then: 체크포인트 전
        assertThat(result).isNotDone();
        assertThat(limiter.asyncCount()).isEqualTo(3);

        // when
        yielded.complete(null);

        // then
        assertThat(result).isCompletedWithValue(true);
        assertThat(limiter.asyncCount()).isEqualTo(5);
        verify(slot, times(1)).asyncAcquire(anyBoolean());
    }

    @Test
    @DisplayName("비동기 비블로킹 재진입은 체크포인트 없이 즉시 완료된다")
    void asyncAcquire_재진입_비블로킹() {
        // given
        when(slot.asyncAcquire(true)).thenReturn(CompletableFuture.completedFuture(true));
        limiter.asyncAcquire();

        // when
        CompletableFuture<Boolean> result = limiter.asyncAcquire(4, false);

        // then
        assertThat(result).isCompletedWithValue(true);
        assertThat(limiter.asyncCount()).isEqualTo(5);
        verify(async, never()).checkpoint();
    }

    @Test
    @DisplayName("체크포인트 중 취소된 재진입 획득은 count를 바꾸지 않는다")
    void asyncAcquire_재진입_취소() {
        // given
        CompletableFuture<Void> yielded = new CompletableFuture<>();
        when(slot.asyncAcquire(true)).thenReturn(CompletableFuture.completedFuture(true));
        when(async.checkpoint()).thenReturn(yielded);
        limiter.asyncAcquire(2);

        // when
        CompletableFuture<Boolean> result = limiter.asyncAcquire(1);
        result.cancel(false);

        // then
        assertThat(yielded).isCancelled();
        assertThat(limiter.asyncCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("첫 획득이 대기 중일 때 블로킹 재획득은 그 획득에 이어서 누적되고 슬롯은 하나만 얻는다")
    void asyncAcquire_대기_중_재획득_연결() {
        // given
        CompletableFuture<Boolean> granted = new CompletableFuture<>();
        when(slot.asyncAcquire(true)).thenReturn(granted);
        when(async.currentTaskExecutor()).thenReturn(Runnable::run);
        when(async.checkpoint()).thenReturn(CompletableFuture.completedFuture(null));
        CompletableFuture<Boolean> first = limiter.asyncAcquire(1);

        // when
        CompletableFuture<Boolean> second = limiter.asyncAcquire(2);

        // then: 첫 획득 완료 전
        assertThat(second).isNotDone();
        assertThat(limiter.getBorrowers()).isEmpty();

        // when
        granted.complete(true);

        // then
        assertThat(first).isCompletedWithValue(true);
        assertThat(second).isCompletedWithValue(true);
        assertThat(limiter.asyncCount()).isEqualTo(3);
        verify(slot, times(1)).asyncAcquire(anyBoolean());
    }

    @Test
    @DisplayName("첫 획득이 대기 중일 때 비블로킹 재획득은 false이며 아무것도 기록하지 않는다")
    void asyncAcquire_대기_중_비블로킹_재획득() {
        // given
        CompletableFuture<Boolean> granted = new CompletableFuture<>();
        when(slot.asyncAcquire(true)).thenReturn(granted);
        when(async.currentTaskExecutor()).thenReturn(Runnable::run);
        limiter.asyncAcquire(1);

        // when
        CompletableFuture<Boolean> second = limiter.asyncAcquire(2, false);
        granted.complete(true);

        // then
        assertThat(second).isCompletedWithValue(false);
        assertThat(limiter.asyncCount()).isEqualTo(1);
        verify(slot, times(1)).asyncAcquire(anyBoolean());
    }

    @Test
    @DisplayName("이어진 재획득을 취소하면 첫 획득의 count만 남는다")
    void asyncAcquire_연결된_재획득_취소() {
        // given
        CompletableFuture<Boolean> granted = new CompletableFuture<>();
        when(slot.asyncAcquire(true)).thenReturn(granted);
        when(async.currentTaskExecutor()).thenReturn(Runnable::run);
        limiter.asyncAcquire(1);
        CompletableFuture<Boolean> second = limiter.asyncAcquire(2);

        // when
        second.cancel(false);
        granted.complete(true);

        // then
        assertThat(limiter.asyncCount()).isEqualTo(1);
        assertThat(limiter.getBorrowers()).hasSize(1);
        verify(async, never()).checkpoint();
    }

    @Test
    @DisplayName("첫 획득이 취소되면 이어진 재획득이 새로 슬롯을 얻는다")
    void asyncAcquire_첫_획득_취소_후_연결된_재획득() {
        // given
        CompletableFuture<Boolean> granted = new CompletableFuture<>();
        when(slot.asyncAcquire(true))
            .thenReturn(granted)
            .thenReturn(CompletableFuture.completedFuture(true));
        when(async.currentTaskExecutor()).thenReturn(Runnable::run);
        CompletableFuture<Boolean> first = limiter.asyncAcquire(1);
        CompletableFuture<Boolean> second = limiter.asyncAcquire(2);

        // when
        first.cancel(false);

        // then
        assertThat(granted).isCancelled();
        assertThat(second).isCompletedWithValue(true);
        assertThat(limiter.asyncCount()).isEqualTo(2);
        verify(slot, times(2)).asyncAcquire(true);
    }

    @Test
    @DisplayName("비동기 반환도 부분/전체/초과 규칙을 따르고 async 진입점으로 슬롯을 반환한다")
    void asyncRelease_규칙() {
        // given
        when(slot.asyncAcquire(true)).thenReturn(CompletableFuture.completedFuture(true));
        limiter.asyncAcquire(2);

        // when & then
        assertThatThrownBy(() -> limiter.asyncRelease(3)).isInstanceOf(BorrowViolationException.class);
        assertThat(limiter.asyncCount()).isEqualTo(2);

        limiter.asyncRelease();
        assertThat(limiter.asyncCount()).isEqualTo(1);

        limiter.asyncRelease(1);
        assertThat(limiter.asyncCount()).isZero();

        InOrder inOrder = inOrder(slot);
        inOrder.verify(slot).asyncAcquire(true);
        inOrder.verify(slot).asyncRelease();
        verify(slot, never()).greenRelease();
    }

    @Test
    @DisplayName("borrowedTokens는 누적 단위 합이 아니라 슬롯 점유 수다")
    void borrowedTokens_슬롯_점유_의미() throws InterruptedException {
        // given
        when(slot.greenAcquire(true, SlotPrimitive.NO_TIMEOUT)).thenReturn(true);
        when(slot.initialValue()).thenReturn(2);
        when(slot.value()).thenReturn(1);
        limiter.greenAcquire(10);

        // then
        assertThat(limiter.greenCount()).isEqualTo(10);
        assertThat(limiter.getBorrowedTokens()).isEqualTo(1);
    }
}
