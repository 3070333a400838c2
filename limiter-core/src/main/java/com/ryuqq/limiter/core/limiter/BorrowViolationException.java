package com.ryuqq.limiter.core.limiter;

import com.ryuqq.limiter.core.model.TaskIdent;

/**
 * Capacity Limiter 오용 예외.
 *
 * <p>호출자의 프로그래밍 오류를 나타내며, limiter 내부에서 재시도하거나 무시하지 않습니다.
 * 예외가 발생한 호출은 Ledger와 Slot Primitive를 전혀 변경하지 않습니다.</p>
 *
 * @author Limiter Team
 * @since 1.0.0
 */
public class BorrowViolationException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * 오용 유형.
     */
    public enum Violation {

        /** 비재진입 limiter에서 이미 토큰을 보유한 Task가 다시 획득을 시도함 */
        ALREADY_HOLDING("the current task is already holding one of this capacity limiter's tokens"),

        /** 토큰을 보유하지 않은 Task가 반환을 시도함 */
        NOT_HOLDING("the current task is not holding any of this capacity limiter's tokens"),

        /** 재진입 limiter에서 보유량보다 많이 반환을 시도함 */
        OVER_RELEASE("capacity limiter released too many times");

        private final String message;

        Violation(String message) {
            this.message = message;
        }

        public String message() {
            return message;
        }
    }

    private final Violation violation;
    private final transient TaskIdent task;

    /**
     * 생성자.
     *
     * @param violation 오용 유형
     * @param task 오용한 Task
     */
    public BorrowViolationException(Violation violation, TaskIdent task) {
        super(violation.message());
        this.violation = violation;
        this.task = task;
    }

    public Violation getViolation() {
        return violation;
    }

    public TaskIdent getTask() {
        return task;
    }
}
