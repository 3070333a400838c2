package com.ryuqq.limiter.core.limiter;

import com.ryuqq.limiter.core.limiter.BorrowViolationException.Violation;
import com.ryuqq.limiter.core.model.TaskIdent;
import com.ryuqq.limiter.core.spi.SlotPrimitive;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * 재진입 Capacity Limiter.
 *
 * <p>슬롯을 보유한 Task가 추가 슬롯을 소비하지 않고 논리 단위(count)를 누적할 수 있습니다.
 * 누적된 단위를 모두 반환해야 슬롯이 풀립니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>첫 획득: Slot Primitive에서 슬롯을 얻고 count를 기록</li>
 *   <li>재진입 획득: Slot Primitive를 호출하지 않고 count만 증가.
 *       blocking이면 먼저 체크포인트로 다른 Task에 실행 기회를 양보</li>
 *   <li>부분 반환: count만 감소</li>
 *   <li>전체 반환: 장부에서 제거하고 슬롯 반환</li>
 *   <li>초과 반환: {@link Violation#OVER_RELEASE}, 아무것도 변경하지 않음</li>
 * </ul>
 *
 * <p><strong>주의:</strong> {@link #getBorrowedTokens()}는 슬롯을 점유한 Task 수이며,
 * 누적 단위 수의 합이 아닙니다.</p>
 *
 * @author Limiter Team
 * @since 1.0.0
 */
public class ReentrantCapacityLimiter extends CapacityLimiter {

    public ReentrantCapacityLimiter(LimiterRuntime runtime) {
        super(runtime);
    }

    public ReentrantCapacityLimiter(LimiterRuntime runtime, int totalTokens) {
        super(runtime, totalTokens);
    }

    public ReentrantCapacityLimiter(LimiterRuntime runtime, CapacityLimiterConfig config) {
        super(runtime, config);
    }

    // ============================================================
    // 비동기 Task 계열
    // ============================================================

    /**
     * 1 단위 획득.
     */
    @Override
    public CompletableFuture<Boolean> asyncAcquire(boolean blocking) {
        return asyncAcquire(1, blocking);
    }

    /**
     * count 단위 획득 (블로킹).
     *
     * @param count 획득할 단위 수 (1 이상)
     * @return 획득 시 true로 완료되는 Future
     * @throws IllegalArgumentException count가 1 미만인 경우
     */
    public CompletableFuture<Boolean> asyncAcquire(int count) {
        return asyncAcquire(count, true);
    }

    /**
     * count 단위 획득.
     *
     * <p>이미 보유 중이면 슬롯을 기다리지 않습니다. blocking이면 체크포인트 이후 count를 더합니다.
     * 같은 Task의 첫 획득이 아직 진행 중이면, blocking 호출은 그 획득이 끝난 뒤 이어서 처리되고
     * 비블로킹 호출은 false를 반환합니다.</p>
     *
     * @param count 획득할 단위 수 (1 이상)
     * @param blocking false면 대기/체크포인트 없이 즉시 결과 반환
     * @return true: 획득 성공, false: 비블로킹 획득 실패
     * @throws IllegalArgumentException count가 1 미만인 경우
     */
    public CompletableFuture<Boolean> asyncAcquire(int count, boolean blocking) {
        requireValidCount(count);
        TaskIdent task = async.currentTask();

        if (ledger.holds(task)) {
            return addAsyncUnits(task, count, blocking);
        }
        CompletableFuture<Boolean> result = new CompletableFuture<>();
        CompletableFuture<Boolean> inFlight = ledger.reserve(task, result);
        if (inFlight != null) {
            return afterInFlight(task, inFlight, count, blocking);
        }
        if (ledger.holds(task)) {
            ledger.clearReservation(task, result);
            return addAsyncUnits(task, count, blocking);
        }
        return acquireAsyncSlot(task, count, blocking, result);
    }

    /**
     * 1 단위 반환.
     */
    @Override
    public void asyncRelease() {
        asyncRelease(1);
    }

    /**
     * count 단위 반환.
     *
     * @param count 반환할 단위 수 (1 이상)
     * @throws IllegalArgumentException count가 1 미만인 경우
     * @throws BorrowViolationException 보유하지 않았거나 보유량보다 많이 반환하는 경우
     */
    public void asyncRelease(int count) {
        release(async, count);
    }

    /**
     * 현재 Task의 보유 단위 수.
     *
     * @return 보유 단위 수, 보유하지 않으면 0
     */
    public int asyncCount() {
        return ledger.count(async.currentTask());
    }

    // ============================================================
    // Green Task 계열
    // ============================================================

    /**
     * 1 단위 획득.
     */
    @Override
    public boolean greenAcquire(boolean blocking) throws InterruptedException {
        return greenAcquire(1, blocking);
    }

    /**
     * 1 단위 획득 (타임아웃 대기).
     */
    @Override
    public boolean greenAcquire(long timeout, TimeUnit unit) throws InterruptedException {
        return greenAcquire(1, timeout, unit);
    }

    /**
     * count 단위 획득 (블로킹, 타임아웃 없음).
     *
     * @param count 획득할 단위 수 (1 이상)
     * @return 항상 true
     * @throws InterruptedException 대기 중 인터럽트 발생
     * @throws IllegalArgumentException count가 1 미만인 경우
     */
    public boolean greenAcquire(int count) throws InterruptedException {
        return greenAcquire(count, true);
    }

    /**
     * count 단위 획득.
     *
     * @param count 획득할 단위 수 (1 이상)
     * @param blocking false면 대기/체크포인트 없이 즉시 결과 반환
     * @return true: 획득 성공, false: 비블로킹 획득 실패
     * @throws InterruptedException 대기 중 인터럽트 발생
     * @throws IllegalArgumentException count가 1 미만인 경우
     */
    public boolean greenAcquire(int count, boolean blocking) throws InterruptedException {
        requireValidCount(count);
        return acquireGreen(count, blocking, SlotPrimitive.NO_TIMEOUT);
    }

    /**
     * count 단위 획득 (타임아웃 대기).
     *
     * <p>타임아웃은 슬롯을 기다릴 때만 적용됩니다. 이미 보유 중이면 체크포인트 후 바로 성공합니다.</p>
     *
     * @param count 획득할 단위 수 (1 이상)
     * @param timeout 최대 대기 시간 (0 이상)
     * @param unit 시간 단위
     * @return true: 획득 성공, false: 타임아웃
     * @throws InterruptedException 대기 중 인터럽트 발생
     * @throws IllegalArgumentException count가 1 미만이거나 timeout이 음수인 경우
     */
    public boolean greenAcquire(int count, long timeout, TimeUnit unit) throws InterruptedException {
        requireValidCount(count);
        return acquireGreen(count, true, toTimeoutNanos(timeout, unit));
    }

    /**
     * 1 단위 반환.
     */
    @Override
    public void greenRelease() {
        greenRelease(1);
    }

    /**
     * count 단위 반환.
     *
     * @param count 반환할 단위 수 (1 이상)
     * @throws IllegalArgumentException count가 1 미만인 경우
     * @throws BorrowViolationException 보유하지 않았거나 보유량보다 많이 반환하는 경우
     */
    public void greenRelease(int count) {
        release(green, count);
    }

    /**
     * 현재 Task의 보유 단위 수.
     *
     * @return 보유 단위 수, 보유하지 않으면 0
     */
    public int greenCount() {
        return ledger.count(green.currentTask());
    }

    // ============================================================
    // 공유 코어
    // ============================================================

    private CompletableFuture<Boolean> addAsyncUnits(TaskIdent task, int count, boolean blocking) {
        if (!blocking) {
            ledger.add(task, count);
            return CompletableFuture.completedFuture(true);
        }

        CompletableFuture<Void> yielded = async.checkpoint();
        CompletableFuture<Boolean> result = new CompletableFuture<>();
        yielded.whenComplete((ignored, error) -> {
            if (error != null) {
                result.completeExceptionally(error);
                return;
            }
            ledger.add(task, count);
            if (!result.complete(true)) {
                ledger.subtract(task, count);
            }
        });
        result.whenComplete((success, error) -> {
            if (result.isCancelled()) {
                yielded.cancel(false);
            }
        });
        return result;
    }

    /**
     * 같은 Task의 첫 획득이 끝난 뒤 Task 컨텍스트에서 획득을 다시 시도합니다.
     * 첫 획득이 성공했다면 재진입 경로로, 실패/취소되었다면 새 획득으로 처리됩니다.
     */
    private CompletableFuture<Boolean> afterInFlight(TaskIdent task, CompletableFuture<Boolean> inFlight,
                                                     int count, boolean blocking) {
        if (!blocking) {
            return CompletableFuture.completedFuture(false);
        }
        Executor resume = async.taskExecutor();
        CompletableFuture<Boolean> result = new CompletableFuture<>();

        inFlight.whenCompleteAsync((acquired, error) -> {
            if (result.isDone()) {
                return;
            }
            CompletableFuture<Boolean> retry;
            try {
                retry = asyncAcquire(count, true);
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
                return;
            }
            retry.whenComplete((success, failure) -> {
                if (failure != null) {
                    result.completeExceptionally(failure);
                } else if (!result.complete(success) && success) {
                    release(async, task, count);
                }
            });
            result.whenComplete((success, failure) -> {
                if (result.isCancelled()) {
                    retry.cancel(false);
                }
            });
        }, resume);
        return result;
    }

    private boolean acquireGreen(int count, boolean blocking, long timeoutNanos) throws InterruptedException {
        TaskIdent task = green.currentTask();

        if (!ledger.holds(task)) {
            return acquireGreenSlot(task, count, blocking, timeoutNanos);
        }
        if (blocking) {
            green.checkpoint();
        }
        ledger.add(task, count);
        return true;
    }

    private void release(Suspension suspension, int count) {
        requireValidCount(count);
        release(suspension, suspension.currentTask(), count);
    }

    private void release(Suspension suspension, TaskIdent task, int count) {
        Integer current = ledger.get(task);
        if (current == null) {
            throw violation(Violation.NOT_HOLDING, task);
        }
        if (current > count) {
            ledger.record(task, current - count);
        } else if (current == count) {
            ledger.remove(task);
            suspension.releaseSlot();
        } else {
            throw violation(Violation.OVER_RELEASE, task);
        }
    }

    private static void requireValidCount(int count) {
        if (count < 1) {
            throw new IllegalArgumentException("count must be >= 1 (current: " + count + ")");
        }
    }
}
