/**
 * In-memory Slot Primitive adapter.
 *
 * <p>Provides a FIFO-fair semaphore whose single wait queue serves async waiters
 * ({@link java.util.concurrent.CompletableFuture}) and green waiters (blocked threads) alike.</p>
 *
 * <p><strong>Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.limiter.adapter.inmemory.slot.FairSemaphore} - Counting semaphore (optionally bounded)</li>
 *   <li>{@link com.ryuqq.limiter.adapter.inmemory.slot.BinarySemaphore} - Semaphore bounded at one permit</li>
 *   <li>{@link com.ryuqq.limiter.adapter.inmemory.slot.InMemorySlotPrimitiveFactory} - SPI factory</li>
 * </ul>
 *
 * @author Limiter Team
 * @since 1.0.0
 */
package com.ryuqq.limiter.adapter.inmemory.slot;
