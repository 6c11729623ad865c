package com.ryuqq.mirror.application.replay;

/**
 * oplog 재생 누적 통계 (불변 스냅샷).
 *
 * @author Mirror Team
 * @since 1.0.0
 * @param appliedOps 대상에 적용된 entry 수 (트랜잭션 내부 작업 포함)
 * @param batches 실행된 applyOps 배치 수
 * @param committedTxns 커밋되어 재생된 트랜잭션 수
 * @param abortedTxns 중단되어 버려진 트랜잭션 수
 */
public record ReplayStats(long appliedOps, long batches, long committedTxns, long abortedTxns) {

    public static final ReplayStats EMPTY = new ReplayStats(0, 0, 0, 0);
}
