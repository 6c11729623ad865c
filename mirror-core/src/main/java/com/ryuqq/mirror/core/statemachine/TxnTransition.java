package com.ryuqq.mirror.core.statemachine;

import com.ryuqq.mirror.core.error.TxnStateException;

/**
 * 트랜잭션 단계 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>BUFFERING → BUFFERING (continuation 추가)</li>
 *   <li>BUFFERING → COMMITTED</li>
 *   <li>BUFFERING → ABORTED</li>
 * </ul>
 *
 * <p>종료 상태(COMMITTED, ABORTED)에서는 어떤 단계로도 전이할 수 없습니다.</p>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public final class TxnTransition {

    // Utility class - prevent instantiation
    private TxnTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전이가 유효한지 검증.
     *
     * @param from 현재 단계
     * @param to 전이할 단계
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws TxnStateException 유효하지 않은 전이인 경우
     */
    public static void validate(TxnPhase from, TxnPhase to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("Phases cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new TxnStateException(
                String.format("Cannot transition from terminal phase: %s → %s", from, to)
            );
        }
    }

    /**
     * 전이 실행 (검증 후).
     *
     * @param current 현재 단계
     * @param next 다음 단계
     * @return 전이된 단계 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws TxnStateException 유효하지 않은 전이인 경우
     */
    public static TxnPhase transition(TxnPhase current, TxnPhase next) {
        validate(current, next);
        return next;
    }
}
