package com.ryuqq.mirror.core.txn;

import com.ryuqq.mirror.core.error.TxnStateException;
import com.ryuqq.mirror.core.model.Oplog;
import com.ryuqq.mirror.core.model.TxnId;
import com.ryuqq.mirror.core.statemachine.TxnPhase;
import com.ryuqq.mirror.core.statemachine.TxnTransition;

import java.util.ArrayList;
import java.util.List;

/**
 * 트랜잭션 하나의 버퍼링 상태.
 *
 * <p>같은 식별자에 대한 접근은 이 객체의 모니터로 직렬화되며,
 * 서로 다른 식별자는 서로를 막지 않습니다.</p>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
final class TxnState {

    private final TxnId id;
    private final List<Oplog> entries = new ArrayList<>();
    private TxnPhase phase = TxnPhase.BUFFERING;
    private long bytes;
    private boolean streamed;
    private boolean purged;

    TxnState(TxnId id) {
        this.id = id;
    }

    /**
     * entry 추가 및 단계 전이.
     *
     * @param role entry 역할
     * @param op oplog entry
     * @param size entry 크기 (바이트)
     * @throws TxnStateException 이미 종료되었거나 purge된 트랜잭션인 경우
     */
    synchronized void append(TxnRole role, Oplog op, long size) {
        if (purged) {
            throw new TxnStateException("transaction " + id + " was already purged");
        }
        TxnPhase next = switch (role) {
            case SINGLE, FINAL_COMMIT -> TxnPhase.COMMITTED;
            case FINAL_ABORT -> TxnPhase.ABORTED;
            default -> TxnPhase.BUFFERING;
        };
        try {
            phase = TxnTransition.transition(phase, next);
        } catch (TxnStateException e) {
            throw new TxnStateException("transaction " + id + " is already finalized (" + phase
                + "); cannot add " + role + " entry at " + op.getTimestamp(), e);
        }
        entries.add(op);
        bytes += size;
    }

    /**
     * 스트리밍 시작.
     *
     * <p>한 번만 호출할 수 있으며, 호출 시점의 entry 목록 사본을 반환합니다.</p>
     *
     * @return 수신 순서의 entry 목록
     * @throws TxnStateException 커밋되지 않았거나 이미 스트리밍 또는 purge된 경우
     */
    synchronized List<Oplog> beginStream() {
        if (purged) {
            throw new TxnStateException("transaction " + id + " was already purged");
        }
        if (phase != TxnPhase.COMMITTED) {
            throw new TxnStateException("transaction " + id + " cannot be streamed in phase " + phase);
        }
        if (streamed) {
            throw new TxnStateException("transaction " + id + " was already streamed");
        }
        streamed = true;
        return new ArrayList<>(entries);
    }

    synchronized long markPurged() {
        purged = true;
        return bytes;
    }
}
