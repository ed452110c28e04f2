/**
 * Scoring action payloads and the single-step action result.
 *
 * <p>Optional payload fields are boxed and {@code null} when omitted; each action exposes the
 * defaulted value (for example {@link com.ryuqq.scorekeeper.core.contract.OutAction#effectiveCount()}).</p>
 */
package com.ryuqq.scorekeeper.core.contract;
