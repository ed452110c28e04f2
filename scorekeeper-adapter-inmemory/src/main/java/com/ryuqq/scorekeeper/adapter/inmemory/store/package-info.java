/**
 * In-memory GameStateStore adapter implementation package.
 *
 * <p>This package provides a reference implementation of the
 * {@link com.ryuqq.scorekeeper.core.spi.GameStateStore} SPI for tests and local wiring.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>No durability: data lost on process restart</li>
 *   <li>Suitable for Contract Tests and reference implementation</li>
 * </ul>
 *
 * @see com.ryuqq.scorekeeper.core.spi.GameStateStore
 * @author Scorekeeper Team
 * @since 1.0.0
 */
package com.ryuqq.scorekeeper.adapter.inmemory.store;
