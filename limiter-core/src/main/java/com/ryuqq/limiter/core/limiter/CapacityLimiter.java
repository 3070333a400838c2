package com.ryuqq.limiter.core.limiter;

import com.ryuqq.limiter.core.limiter.BorrowViolationException.Violation;
import com.ryuqq.limiter.core.model.TaskIdent;
import com.ryuqq.limiter.core.spi.SlotPrimitive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Capacity Limiter.
 *
 * <p>동시에 리소스 슬롯을 보유할 수 있는 Task 수를 제한합니다.
 * 한 Task는 동시에 최대 하나의 슬롯만 보유할 수 있으며, 보유 중 다시 획득하면
 * {@link BorrowViolationException}({@link Violation#ALREADY_HOLDING})이 발생합니다.</p>
 *
 * <p><strong>두 가지 연산 계열:</strong></p>
 * <ul>
 *   <li>{@code async*}: 비동기 Task용. 대기 시 미완료 {@link CompletableFuture}를 반환</li>
 *   <li>{@code green*}: Green Task(스레드)용. 대기 시 호출 스레드를 블로킹</li>
 * </ul>
 * <p>두 계열은 의미가 동일하며, 각 Task는 자신의 스케줄링 모델에 맞는 계열을 일관되게 사용해야 합니다.
 * 하나의 limiter를 두 종류의 Task가 동시에 사용할 수 있습니다.</p>
 *
 * <p><strong>장부와 슬롯의 일관성:</strong></p>
 * <ul>
 *   <li>Task는 Slot Primitive가 획득 성공을 확인한 뒤에만 장부에 기록됨</li>
 *   <li>장부에 있는 Task 수 = 점유된 슬롯 수 ({@link #getBorrowedTokens()})</li>
 *   <li>오용 예외는 Slot Primitive 호출 및 장부 변경 전에 동기적으로 발생</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CapacityLimiter limiter = new CapacityLimiter(runtime, 10);
 *
 * // Green Task
 * try (Borrow borrow = limiter.greenBorrow()) {
 *     callExternalApi();
 * }
 *
 * // 비동기 Task
 * limiter.asyncWithToken(() -> client.callAsync());
 * }</pre>
 *
 * @author Limiter Team
 * @since 1.0.0
 */
public class CapacityLimiter {

    private static final Logger log = LoggerFactory.getLogger(CapacityLimiter.class);

    final BorrowerLedger ledger = new BorrowerLedger();
    final SlotPrimitive slot;
    final GreenSuspension green;
    final AsyncSuspension async;

    /**
     * 바이너리 limiter 생성 (totalTokens=1).
     *
     * @param runtime 협력 객체 묶음
     * @throws IllegalArgumentException runtime이 null인 경우
     */
    public CapacityLimiter(LimiterRuntime runtime) {
        this(runtime, new CapacityLimiterConfig());
    }

    /**
     * 생성자.
     *
     * @param runtime 협력 객체 묶음
     * @param totalTokens 총 토큰 수 (0 이상)
     * @throws IllegalArgumentException runtime이 null이거나 totalTokens가 음수인 경우
     */
    public CapacityLimiter(LimiterRuntime runtime, int totalTokens) {
        this(runtime, new CapacityLimiterConfig(totalTokens));
    }

    /**
     * 생성자.
     *
     * @param runtime 협력 객체 묶음
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public CapacityLimiter(LimiterRuntime runtime, CapacityLimiterConfig config) {
        if (runtime == null) {
            throw new IllegalArgumentException("runtime cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        int totalTokens = config.totalTokens();
        this.slot = config.requiresCountingSlot()
            ? runtime.slots().counting(totalTokens)
            : runtime.slots().binary(totalTokens);
        this.green = new GreenSuspension(runtime.green(), slot);
        this.async = new AsyncSuspension(runtime.async(), slot);
    }

    // ============================================================
    // 비동기 Task 계열
    // ============================================================

    /**
     * 토큰 획득 (블로킹).
     *
     * @return 획득 시 true로 완료되는 Future
     * @throws BorrowViolationException 현재 Task가 이미 토큰을 보유한 경우
     */
    public CompletableFuture<Boolean> asyncAcquire() {
        return asyncAcquire(true);
    }

    /**
     * 토큰 획득.
     *
     * <p>반환된 Future를 취소하면 대기가 철회되고 장부에는 아무것도 기록되지 않습니다.</p>
     *
     * @param blocking false면 대기하지 않고 즉시 결과 반환
     * @return true: 획득 성공, false: 비블로킹 획득 실패
     * @throws BorrowViolationException 현재 Task가 이미 토큰을 보유했거나 획득을 기다리는 중인 경우
     */
    public CompletableFuture<Boolean> asyncAcquire(boolean blocking) {
        TaskIdent task = async.currentTask();
        requireNotHolding(task);
        CompletableFuture<Boolean> result = new CompletableFuture<>();
        if (ledger.reserve(task, result) != null) {
            throw violation(Violation.ALREADY_HOLDING, task);
        }
        if (ledger.holds(task)) {
            ledger.clearReservation(task, result);
            throw violation(Violation.ALREADY_HOLDING, task);
        }
        return acquireAsyncSlot(task, 1, blocking, result);
    }

    /**
     * 토큰 반환.
     *
     * @throws BorrowViolationException 현재 Task가 토큰을 보유하지 않은 경우
     */
    public void asyncRelease() {
        releaseAll(async);
    }

    /**
     * 현재 Task의 토큰 보유 여부.
     *
     * @return 보유 중이면 true
     */
    public boolean asyncBorrowed() {
        return ledger.holds(async.currentTask());
    }

    /**
     * 토큰을 보유한 채 body를 실행하고, body의 Stage가 어떻게 끝나든 토큰을 반환합니다.
     *
     * <p>body와 반환은 호출한 Task의 컨텍스트에서 실행됩니다.
     * 반환된 Future를 취소하면 토큰 대기도 취소되며, 이미 할당된 토큰은 body 실행 없이 반환됩니다.</p>
     *
     * @param body 보호할 비동기 작업
     * @param <T> 결과 타입
     * @return body의 결과로 완료되는 Future
     * @throws IllegalArgumentException body가 null인 경우
     * @throws BorrowViolationException 현재 Task가 이미 토큰을 보유한 경우 (비재진입 limiter)
     */
    public <T> CompletableFuture<T> asyncWithToken(Supplier<? extends CompletionStage<T>> body) {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        Executor resume = async.taskExecutor();
        CompletableFuture<Boolean> acquire = asyncAcquire(true);
        CompletableFuture<T> result = new CompletableFuture<>();

        acquire.whenComplete((acquired, error) -> {
            if (error != null) {
                result.completeExceptionally(error);
                return;
            }
            if (result.isDone()) {
                asyncRelease();
                log.debug("Released token without running body: scoped acquire was cancelled");
                return;
            }
            CompletionStage<T> stage;
            try {
                stage = body.get();
            } catch (RuntimeException | Error e) {
                asyncRelease();
                result.completeExceptionally(e);
                return;
            }
            stage.whenCompleteAsync((value, failure) -> {
                try {
                    asyncRelease();
                } catch (RuntimeException e) {
                    if (failure != null) {
                        e.addSuppressed(failure);
                    }
                    result.completeExceptionally(e);
                    return;
                }
                if (failure != null) {
                    result.completeExceptionally(failure);
                } else {
                    result.complete(value);
                }
            }, resume);
        });
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                acquire.cancel(false);
            }
        });
        return result;
    }

    // ============================================================
    // Green Task 계열
    // ============================================================

    /**
     * 토큰 획득 (블로킹, 타임아웃 없음).
     *
     * @return 항상 true
     * @throws InterruptedException 대기 중 인터럽트 발생 (토큰은 획득되지 않음)
     * @throws BorrowViolationException 현재 Task가 이미 토큰을 보유한 경우
     */
    public boolean greenAcquire() throws InterruptedException {
        return greenAcquire(true);
    }

    /**
     * 토큰 획득.
     *
     * @param blocking false면 대기하지 않고 즉시 결과 반환
     * @return true: 획득 성공, false: 비블로킹 획득 실패
     * @throws InterruptedException 대기 중 인터럽트 발생 (토큰은 획득되지 않음)
     * @throws BorrowViolationException 현재 Task가 이미 토큰을 보유한 경우
     */
    public boolean greenAcquire(boolean blocking) throws InterruptedException {
        TaskIdent task = green.currentTask();
        requireNotHolding(task);
        return acquireGreenSlot(task, 1, blocking, SlotPrimitive.NO_TIMEOUT);
    }

    /**
     * 토큰 획득 (타임아웃 대기).
     *
     * @param timeout 최대 대기 시간 (0 이상)
     * @param unit 시간 단위
     * @return true: 획득 성공, false: 타임아웃
     * @throws InterruptedException 대기 중 인터럽트 발생 (토큰은 획득되지 않음)
     * @throws IllegalArgumentException timeout이 음수이거나 unit이 null인 경우
     * @throws BorrowViolationException 현재 Task가 이미 토큰을 보유한 경우
     */
    public boolean greenAcquire(long timeout, TimeUnit unit) throws InterruptedException {
        long timeoutNanos = toTimeoutNanos(timeout, unit);
        TaskIdent task = green.currentTask();
        requireNotHolding(task);
        return acquireGreenSlot(task, 1, true, timeoutNanos);
    }

    /**
     * 토큰 반환.
     *
     * @throws BorrowViolationException 현재 Task가 토큰을 보유하지 않은 경우
     */
    public void greenRelease() {
        releaseAll(green);
    }

    /**
     * 현재 Task의 토큰 보유 여부.
     *
     * @return 보유 중이면 true
     */
    public boolean greenBorrowed() {
        return ledger.holds(green.currentTask());
    }

    /**
     * 토큰을 획득(블로킹)하고 try-with-resources용 핸들을 반환합니다.
     *
     * @return close() 시 토큰을 반환하는 핸들
     * @throws InterruptedException 대기 중 인터럽트 발생 (토큰은 획득되지 않음)
     * @throws BorrowViolationException 현재 Task가 이미 토큰을 보유한 경우 (비재진입 limiter)
     */
    public Borrow greenBorrow() throws InterruptedException {
        greenAcquire(true);
        return new Borrow(this::greenRelease);
    }

    // ============================================================
    // 조회
    // ============================================================

    /**
     * 총 토큰 수.
     */
    public int getTotalTokens() {
        return slot.initialValue();
    }

    /**
     * 현재 사용 가능한 토큰 수.
     */
    public int getAvailableTokens() {
        return slot.value();
    }

    /**
     * 현재 대여된 토큰 수.
     *
     * <p>슬롯을 점유한 서로 다른 Task 수와 같습니다.
     * 재진입 limiter에서 Task별 누적 단위 수의 합이 아닙니다.</p>
     */
    public int getBorrowedTokens() {
        return slot.initialValue() - slot.value();
    }

    /**
     * 슬롯을 기다리는 Task 수.
     */
    public int getWaiting() {
        return slot.waiting();
    }

    /**
     * Task → 보유 단위 수 읽기 전용 뷰.
     *
     * @return 수정 불가 Map (장부 변경이 즉시 반영됨)
     */
    public Map<TaskIdent, Integer> getBorrowers() {
        return ledger.view();
    }

    /**
     * 대여된 토큰이 하나라도 있는지 여부.
     *
     * @return 사용 가능 토큰 수가 총 토큰 수보다 작으면 true
     */
    public boolean isInUse() {
        return slot.initialValue() > slot.value();
    }

    @Override
    public String toString() {
        int availableTokens = slot.value();
        StringBuilder sb = new StringBuilder()
            .append(getClass().getName())
            .append('(').append(slot.initialValue()).append(')')
            .append('@').append(Integer.toHexString(System.identityHashCode(this)))
            .append("{availableTokens=").append(availableTokens);
        if (availableTokens == 0) {
            sb.append(", waiting=").append(slot.waiting());
        }
        return sb.append('}').toString();
    }

    // ============================================================
    // 공유 코어
    // ============================================================

    void requireNotHolding(TaskIdent task) {
        if (ledger.holds(task) || ledger.reserved(task)) {
            throw violation(Violation.ALREADY_HOLDING, task);
        }
    }

    boolean acquireGreenSlot(TaskIdent task, int count, boolean blocking, long timeoutNanos)
            throws InterruptedException {
        boolean success = green.acquireSlot(blocking, timeoutNanos);
        if (success) {
            ledger.record(task, count);
        }
        return success;
    }

    /**
     * Slot Primitive에서 슬롯을 얻은 뒤 장부에 기록합니다.
     *
     * <p>호출 전에 {@code result}로 Task가 예약되어 있어야 하며, 예약은 결과가 정해질 때 해제됩니다.
     * 대기 후 슬롯이 할당되면 Task 컨텍스트로 돌아와서 기록합니다.
     * 결과 Future가 이미 취소되었다면 기록하지 않고 슬롯을 반환합니다.</p>
     */
    CompletableFuture<Boolean> acquireAsyncSlot(TaskIdent task, int count, boolean blocking,
                                                CompletableFuture<Boolean> result) {
        CompletableFuture<Boolean> granted;
        try {
            granted = async.acquireSlot(blocking);
        } catch (RuntimeException | Error e) {
            ledger.clearReservation(task, result);
            throw e;
        }
        Executor resume = granted.isDone() ? Runnable::run : async.taskExecutor();

        granted.whenCompleteAsync((success, error) -> {
            if (error != null || !success) {
                ledger.clearReservation(task, result);
                if (error != null) {
                    result.completeExceptionally(error);
                } else {
                    result.complete(false);
                }
                return;
            }
            if (result.isCancelled()) {
                async.releaseSlot();
                log.debug("Returned slot granted to {}: acquire was cancelled", task);
                return;
            }
            ledger.record(task, count);
            ledger.clearReservation(task, result);
            if (!result.complete(true)) {
                ledger.remove(task);
                async.releaseSlot();
                log.debug("Rolled back slot grant for {}: acquire was cancelled", task);
            }
        }, resume);
        result.whenComplete((success, error) -> {
            if (result.isCancelled()) {
                ledger.clearReservation(task, result);
                granted.cancel(false);
            }
        });
        return result;
    }

    void releaseAll(Suspension suspension) {
        TaskIdent task = suspension.currentTask();
        if (!ledger.remove(task)) {
            throw violation(Violation.NOT_HOLDING, task);
        }
        suspension.releaseSlot();
    }

    BorrowViolationException violation(Violation violation, TaskIdent task) {
        log.debug("{} rejected for {} on {}", violation, task, this);
        return new BorrowViolationException(violation, task);
    }

    static long toTimeoutNanos(long timeout, TimeUnit unit) {
        if (unit == null) {
            throw new IllegalArgumentException("unit cannot be null");
        }
        if (timeout < 0) {
            throw new IllegalArgumentException("timeout must be >= 0 (current: " + timeout + ")");
        }
        return unit.toNanos(timeout);
    }
}
