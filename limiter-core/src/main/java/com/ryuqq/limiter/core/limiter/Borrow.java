package com.ryuqq.limiter.core.limiter;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 범위 기반 토큰 보유 핸들.
 *
 * <p>try-with-resources 블록을 벗어나는 모든 경로(정상 종료, 예외)에서 토큰을 반환합니다.
 * {@link #close()}는 여러 번 호출해도 한 번만 반환합니다.</p>
 *
 * <pre>{@code
 * try (Borrow borrow = limiter.greenBorrow()) {
 *     // 보호된 작업
 * }
 * }</pre>
 *
 * @author Limiter Team
 * @since 1.0.0
 */
public final class Borrow implements AutoCloseable {

    private final Runnable release;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    Borrow(Runnable release) {
        this.release = release;
    }

    /**
     * 이미 반환되었는지 여부.
     *
     * @return close() 호출 이후면 true
     */
    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            release.run();
        }
    }
}
