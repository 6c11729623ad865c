/**
 * Contract test infrastructure.
 *
 * <p>{@link com.ryuqq.mirror.testkit.contract.FakeDestination} stands in for a live
 * deployment, {@link com.ryuqq.mirror.testkit.contract.OplogFixtures} builds oplog entries
 * and transactions, and {@link com.ryuqq.mirror.testkit.contract.AbstractContractTest}
 * wires the replay stack for scenario tests.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.mirror.testkit.contract;
