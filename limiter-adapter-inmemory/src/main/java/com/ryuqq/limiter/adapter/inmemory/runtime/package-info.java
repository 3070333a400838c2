/**
 * In-memory 스케줄링 런타임 어댑터.
 *
 * <p>Green Task는 스레드로, 비동기 Task는 {@link com.ryuqq.limiter.adapter.inmemory.runtime.AsyncTaskContext}로
 * 표현합니다. {@link com.ryuqq.limiter.adapter.inmemory.runtime.InMemoryLimiterRuntime#create()}가
 * 모든 SPI 구현체를 묶어 제공합니다.</p>
 *
 * @author Limiter Team
 * @since 1.0.0
 */
package com.ryuqq.limiter.adapter.inmemory.runtime;
