package com.ryuqq.mirror.core.statemachine;

/**
 * 버퍼링된 트랜잭션의 생명주기 단계.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>BUFFERING → COMMITTED (커밋 entry 수신)</li>
 *   <li>BUFFERING → ABORTED (중단 entry 수신)</li>
 *   <li><strong>역방향 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * (absent)
 *    │
 *    ▼ (첫 entry)
 * BUFFERING ──┐ (continuation)
 *    │  ◄─────┘
 *    ├─► COMMITTED (SINGLE, FINAL_COMMIT)
 *    │
 *    └─► ABORTED (FINAL_ABORT)
 *
 * 종료 상태는 purge로만 제거됩니다.
 * </pre>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public enum TxnPhase {

    /**
     * entry 수집 중.
     */
    BUFFERING,

    /**
     * 커밋 entry 수신 완료, 스트리밍 가능.
     */
    COMMITTED,

    /**
     * 중단 entry 수신 완료, 폐기 대상.
     */
    ABORTED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMMITTED 또는 ABORTED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMMITTED || this == ABORTED;
    }
}
