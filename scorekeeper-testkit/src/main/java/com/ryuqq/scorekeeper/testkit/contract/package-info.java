/**
 * Contract test infrastructure for the scoring pipeline.
 *
 * <p>Extend {@link com.ryuqq.scorekeeper.testkit.contract.AbstractScoringContractTest} to run
 * scenarios end to end against the in-memory adapters.</p>
 */
package com.ryuqq.scorekeeper.testkit.contract;
