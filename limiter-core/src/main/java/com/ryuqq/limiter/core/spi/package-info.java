/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the collaborators a capacity limiter delegates to.
 * Adapters provide concrete implementations; the core never depends on them.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.limiter.core.spi.SlotPrimitive} - Counting/binary slot with FIFO wait queue</li>
 *   <li>{@link com.ryuqq.limiter.core.spi.SlotPrimitiveFactory} - Binary vs counting slot creation</li>
 *   <li>{@link com.ryuqq.limiter.core.spi.GreenTaskRuntime} - Green task identity and checkpoint</li>
 *   <li>{@link com.ryuqq.limiter.core.spi.AsyncTaskRuntime} - Async task identity, checkpoint and task-bound executor</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., limiter-adapter-inmemory) are responsible for providing
 * concrete implementations of these SPIs.</p>
 *
 * <h2>Slot Primitive Implementation Guidelines</h2>
 * <ul>
 *   <li><strong>Fairness:</strong> Waiters are served in arrival order across both scheduling models</li>
 *   <li><strong>Cancellation:</strong> A cancelled or timed-out waiter never ends up holding a slot</li>
 *   <li><strong>Synchronization:</strong> Internal counters are guarded by the implementation itself</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Limiter Team
 */
package com.ryuqq.limiter.core.spi;
