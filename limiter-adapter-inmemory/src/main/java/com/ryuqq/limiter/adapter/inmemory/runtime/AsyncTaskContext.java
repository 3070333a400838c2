package com.ryuqq.limiter.adapter.inmemory.runtime;

import com.ryuqq.limiter.core.model.TaskIdent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * 비동기 Task 컨텍스트.
 *
 * <p>하나의 논리적 비동기 Task를 나타냅니다. Task의 코드 조각은 {@link #executor()}를 통해
 * 실행되며, 실행되는 동안 해당 스레드에 이 컨텍스트가 바인딩됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * AsyncTaskContext task = AsyncTaskContext.open(executorService);
 *
 * task.call(() -> limiter.asyncAcquire())
 *     .thenComposeAsync(acquired -> doWork(), task.executor())
 *     .whenCompleteAsync((result, error) -> limiter.asyncRelease(), task.executor());
 * }</pre>
 *
 * <p><strong>주의:</strong> 다른 스레드에서 완료된 Stage의 후속 작업이 limiter를 호출한다면
 * 반드시 {@code *Async(..., task.executor())} 형태로 연결해야 같은 Task로 인식됩니다.</p>
 *
 * @author Limiter Team
 * @since 1.0.0
 */
public final class AsyncTaskContext {

    private static final Logger log = LoggerFactory.getLogger(AsyncTaskContext.class);
    private static final AtomicLong SEQUENCE = new AtomicLong();
    private static final ThreadLocal<AsyncTaskContext> CURRENT = new ThreadLocal<>();

    private final TaskIdent ident;
    private final Executor delegate;
    private final Executor executor;

    private AsyncTaskContext(TaskIdent ident, Executor delegate) {
        this.ident = ident;
        this.delegate = delegate;
        this.executor = command -> this.delegate.execute(bind(command));
    }

    /**
     * 새 비동기 Task 생성.
     *
     * @param delegate Task 코드 조각을 실행할 Executor
     * @return 새 Task 컨텍스트
     * @throws IllegalArgumentException delegate가 null인 경우
     */
    public static AsyncTaskContext open(Executor delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        AsyncTaskContext context = new AsyncTaskContext(TaskIdent.async(SEQUENCE.incrementAndGet()), delegate);
        log.debug("Opened async task {}", context.ident);
        return context;
    }

    /**
     * 현재 스레드에 바인딩된 Task 조회.
     *
     * @return 바인딩된 Task, 없으면 empty
     */
    public static Optional<AsyncTaskContext> current() {
        return Optional.ofNullable(CURRENT.get());
    }

    public TaskIdent ident() {
        return ident;
    }

    /**
     * 이 Task에 바인딩된 채로 작업을 실행하는 Executor.
     */
    public Executor executor() {
        return executor;
    }

    /**
     * 작업을 이 Task에 바인딩된 채로 실행하도록 감쌉니다.
     *
     * <p>중첩 호출 시 이전 바인딩을 복원합니다.</p>
     */
    public Runnable bind(Runnable command) {
        return () -> {
            AsyncTaskContext previous = CURRENT.get();
            CURRENT.set(this);
            try {
                command.run();
            } finally {
                if (previous == null) {
                    CURRENT.remove();
                } else {
                    CURRENT.set(previous);
                }
            }
        };
    }

    /**
     * body를 이 Task의 Executor에서 실행하고 body가 반환한 Stage의 결과를 전달합니다.
     *
     * @param body 비동기 작업
     * @param <T> 결과 타입
     * @return body Stage의 결과로 완료되는 Future
     */
    public <T> CompletableFuture<T> call(Supplier<? extends CompletionStage<T>> body) {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        return CompletableFuture.<CompletionStage<T>>supplyAsync(body::get, executor)
            .thenCompose(stage -> stage);
    }

    /**
     * 동기 작업을 이 Task의 Executor에서 실행합니다.
     *
     * @param body 동기 작업
     * @param <T> 결과 타입
     * @return body 결과로 완료되는 Future
     */
    public <T> CompletableFuture<T> run(Supplier<T> body) {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        return CompletableFuture.supplyAsync(body, executor);
    }

    @Override
    public String toString() {
        return "AsyncTaskContext{" + ident + '}';
    }
}
