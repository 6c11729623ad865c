/**
 * Buffered transaction state machine package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.mirror.core.statemachine.TxnPhase} - buffered transaction phases (enum)</li>
 *   <li>{@link com.ryuqq.mirror.core.statemachine.TxnTransition} - phase transition validation</li>
 * </ul>
 *
 * <h2>Transition Rules</h2>
 * <pre>
 * BUFFERING → BUFFERING (continuation)
 * BUFFERING → COMMITTED (final commit)
 * BUFFERING → ABORTED   (final abort)
 *
 * Forbidden:
 * - COMMITTED → * (terminal phase)
 * - ABORTED → *   (terminal phase)
 * </pre>
 *
 * @since 1.0.0
 * @author Mirror Team
 */
package com.ryuqq.mirror.core.statemachine;
