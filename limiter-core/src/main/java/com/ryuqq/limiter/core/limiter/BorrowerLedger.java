package com.ryuqq.limiter.core.limiter;

import com.ryuqq.limiter.core.model.TaskIdent;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Task → 보유 단위 수 장부.
 *
 * <p>장부에 있는 Task는 Slot Primitive의 슬롯을 정확히 하나 점유하고 있습니다.
 * 각 Task는 자신의 항목만 변경하므로 항목 단위 원자성은 {@link ConcurrentHashMap}으로 충분합니다.</p>
 *
 * <p>비동기 획득은 Slot Primitive를 호출하기 전에 Task를 예약합니다. 예약은 획득 결과가 정해지면
 * (성공 시에는 장부 기록 직후) 해제되므로, 한 Task가 동시에 두 번 슬롯을 기다리는 일은 없습니다.</p>
 *
 * @author Limiter Team
 * @since 1.0.0
 */
final class BorrowerLedger {

    private final ConcurrentHashMap<TaskIdent, Integer> entries = new ConcurrentHashMap<>();
    private final Map<TaskIdent, Integer> view = Collections.unmodifiableMap(entries);
    private final ConcurrentHashMap<TaskIdent, CompletableFuture<Boolean>> reservations = new ConcurrentHashMap<>();

    boolean holds(TaskIdent task) {
        return entries.containsKey(task);
    }

    /**
     * @return 보유 단위 수, 보유하지 않으면 null
     */
    Integer get(TaskIdent task) {
        return entries.get(task);
    }

    int count(TaskIdent task) {
        return entries.getOrDefault(task, 0);
    }

    void record(TaskIdent task, int count) {
        entries.put(task, count);
    }

    void add(TaskIdent task, int count) {
        entries.merge(task, count, Integer::sum);
    }

    void subtract(TaskIdent task, int count) {
        entries.computeIfPresent(task, (key, current) -> current - count);
    }

    boolean remove(TaskIdent task) {
        return entries.remove(task) != null;
    }

    /**
     * 진행 중인 비동기 획득을 예약합니다. 이미 완료된 Future의 예약은 남아 있어도 무시됩니다.
     *
     * @return 이미 진행 중인 획득의 결과 Future, 예약에 성공하면 null
     */
    CompletableFuture<Boolean> reserve(TaskIdent task, CompletableFuture<Boolean> acquire) {
        CompletableFuture<Boolean> winner = reservations.compute(task,
            (key, current) -> current == null || current.isDone() ? acquire : current);
        return winner == acquire ? null : winner;
    }

    void clearReservation(TaskIdent task, CompletableFuture<Boolean> acquire) {
        reservations.remove(task, acquire);
    }

    boolean reserved(TaskIdent task) {
        CompletableFuture<Boolean> acquire = reservations.get(task);
        return acquire != null && !acquire.isDone();
    }

    /**
     * 외부 공개용 읽기 전용 뷰 (장부 변경이 즉시 반영됨).
     */
    Map<TaskIdent, Integer> view() {
        return view;
    }
}
