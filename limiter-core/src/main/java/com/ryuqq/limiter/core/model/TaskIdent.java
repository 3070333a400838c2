package com.ryuqq.limiter.core.model;

/**
 * Task의 고유 식별자.
 *
 * <p>TaskIdent는 Borrower Ledger의 키로 사용되며, 하나의 논리적 Task가 살아있는 동안
 * 항상 동일한 값을 가집니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>동등성:</strong> {@link SchedulingModel}과 id가 모두 같을 때만 동일합니다.
 * 따라서 서로 다른 스케줄링 모델의 식별자는 id가 같아도 충돌하지 않습니다.</p>
 *
 * @author Limiter Team
 * @since 1.0.0
 */
public final class TaskIdent {

    private final SchedulingModel model;
    private final long id;

    private TaskIdent(SchedulingModel model, long id) {
        if (model == null) {
            throw new IllegalArgumentException("model cannot be null");
        }
        this.model = model;
        this.id = id;
    }

    /**
     * TaskIdent 생성.
     *
     * @param model 스케줄링 모델
     * @param id 모델 내 고유 id
     * @return TaskIdent 인스턴스
     * @throws IllegalArgumentException model이 null인 경우
     */
    public static TaskIdent of(SchedulingModel model, long id) {
        return new TaskIdent(model, id);
    }

    /**
     * Green Task 식별자 생성.
     *
     * @param id 스레드 id
     * @return TaskIdent 인스턴스
     */
    public static TaskIdent green(long id) {
        return new TaskIdent(SchedulingModel.GREEN, id);
    }

    /**
     * 비동기 Task 식별자 생성.
     *
     * @param id 비동기 Task id
     * @return TaskIdent 인스턴스
     */
    public static TaskIdent async(long id) {
        return new TaskIdent(SchedulingModel.ASYNC, id);
    }

    public SchedulingModel getModel() {
        return model;
    }

    public long getId() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskIdent that = (TaskIdent) o;
        return id == that.id && model == that.model;
    }

    @Override
    public int hashCode() {
        return 31 * model.hashCode() + Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "TaskIdent{" + model.label() + ":" + id + '}';
    }
}
