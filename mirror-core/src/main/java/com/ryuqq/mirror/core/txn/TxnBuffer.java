package com.ryuqq.mirror.core.txn;

import com.ryuqq.mirror.core.error.TxnStateException;
import com.ryuqq.mirror.core.model.Oplog;
import com.ryuqq.mirror.core.model.TxnId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 트랜잭션 entry 버퍼.
 *
 * <p>여러 oplog entry로 분할된 트랜잭션을 식별자별로 모았다가, 커밋 entry가 도착하면
 * 원래 작업 순서를 복원한 {@link TxnStream}으로 돌려줍니다.</p>
 *
 * <p><strong>사용 흐름:</strong></p>
 * <pre>
 * Meta meta = TxnClassifier.classify(op);
 * if (meta.isTxn()) {
 *     buffer.addOp(meta, op);
 *     if (meta.isCommit()) {
 *         try (TxnStream stream = buffer.stream(meta)) {
 *             stream.forEachRemaining(this::apply);
 *         }
 *     }
 *     if (meta.isFinal()) {
 *         buffer.purge(meta);
 *     }
 * }
 * </pre>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>식별자당 살아 있는 상태는 최대 하나</li>
 *   <li>추가 순서는 수신 순서 그대로 유지</li>
 *   <li>purge는 커밋/중단 모두 상태를 완전히 제거하며, 없는 식별자 purge는 no-op</li>
 * </ul>
 *
 * <p><strong>Thread-safety:</strong> {@link ConcurrentHashMap} 기반이며 서로 다른 식별자에 대한
 * 호출은 서로를 막지 않습니다. 같은 식별자에 대한 순서는 호출자(단일 producer)가 보장합니다.</p>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public class TxnBuffer {

    private static final Logger log = LoggerFactory.getLogger(TxnBuffer.class);

    private final ConcurrentHashMap<TxnId, TxnState> txns = new ConcurrentHashMap<>();
    private final AtomicLong bufferedBytes = new AtomicLong();
    private final long maxBufferedBytes;

    /**
     * 용량 제한 없는 버퍼 생성.
     */
    public TxnBuffer() {
        this(0);
    }

    /**
     * 용량 제한이 있는 버퍼 생성.
     *
     * @param maxBufferedBytes 버퍼 전체 최대 바이트 (0이면 제한 없음)
     * @throws IllegalArgumentException maxBufferedBytes가 음수인 경우
     */
    public TxnBuffer(long maxBufferedBytes) {
        if (maxBufferedBytes < 0) {
            throw new IllegalArgumentException("maxBufferedBytes must be non-negative (current: " + maxBufferedBytes + ")");
        }
        this.maxBufferedBytes = maxBufferedBytes;
    }

    /**
     * 트랜잭션 entry 추가.
     *
     * <p>이전 상태가 없는 continuation/final entry는 새 상태를 만들어 받아들입니다.
     * 이미 일부가 적용된 뒤 재개된 경우를 위한 동작이며, debug 로그를 남깁니다.</p>
     *
     * @param meta entry 분류 결과
     * @param op oplog entry
     * @throws IllegalArgumentException meta 또는 op가 null인 경우
     * @throws TxnStateException 트랜잭션 entry가 아니거나, 이미 버퍼링 중인 식별자에 시작 entry가 오거나,
     *                           종료된 트랜잭션이거나, 용량 제한을 넘는 경우
     */
    public void addOp(Meta meta, Oplog op) {
        if (meta == null) {
            throw new IllegalArgumentException("meta cannot be null");
        }
        if (op == null) {
            throw new IllegalArgumentException("op cannot be null");
        }
        if (!meta.isTxn()) {
            throw new TxnStateException("cannot buffer non-transaction entry at " + op.getTimestamp());
        }

        TxnId id = meta.id();
        TxnState fresh = new TxnState(id);
        TxnState existing = txns.putIfAbsent(id, fresh);
        if (existing != null && meta.role().startsTxn()) {
            throw new TxnStateException("transaction " + id + " already has buffered state; unexpected "
                + meta.role() + " entry at " + op.getTimestamp());
        }
        TxnState state = existing != null ? existing : fresh;
        if (existing == null && !meta.role().startsTxn()) {
            log.debug("No buffered state for {}; starting from {} entry at {}", id, meta.role(), op.getTimestamp());
        }

        long size = op.sizeBytes();
        long total = bufferedBytes.addAndGet(size);
        try {
            if (maxBufferedBytes > 0 && total > maxBufferedBytes) {
                throw new TxnStateException(String.format(
                    "transaction buffer limit exceeded: %d bytes buffered, limit %d (txn %s)",
                    total, maxBufferedBytes, id));
            }
            state.append(meta.role(), op, size);
        } catch (TxnStateException e) {
            bufferedBytes.addAndGet(-size);
            if (existing == null) {
                txns.remove(id, fresh);
            }
            throw e;
        }
        log.trace("Buffered {} entry for {} ({} bytes)", meta.role(), id, size);
    }

    /**
     * 커밋된 트랜잭션의 작업 스트림 획득.
     *
     * <p>식별자당 한 번만 호출할 수 있습니다.</p>
     *
     * @param meta 커밋 entry의 분류 결과
     * @return 복원된 작업 스트림
     * @throws IllegalArgumentException meta가 null인 경우
     * @throws TxnStateException 버퍼에 없거나, 커밋되지 않았거나(중단 포함), 이미 스트리밍된 경우
     */
    public TxnStream stream(Meta meta) {
        if (meta == null) {
            throw new IllegalArgumentException("meta cannot be null");
        }
        TxnState state = txns.get(meta.id());
        if (state == null) {
            throw new TxnStateException("no buffered transaction for " + meta.id());
        }
        TxnStream stream = new TxnStream(meta.id(), state.beginStream());
        log.debug("Streaming transaction {}", meta.id());
        return stream;
    }

    /**
     * 트랜잭션 상태 제거.
     *
     * <p>커밋과 중단 모두에 사용하며 멱등입니다.</p>
     *
     * @param meta 트랜잭션 분류 결과
     * @throws IllegalArgumentException meta가 null인 경우
     */
    public void purge(Meta meta) {
        if (meta == null) {
            throw new IllegalArgumentException("meta cannot be null");
        }
        TxnState state = txns.remove(meta.id());
        if (state == null) {
            return;
        }
        long released = state.markPurged();
        bufferedBytes.addAndGet(-released);
        log.debug("Purged transaction {} ({} bytes released)", meta.id(), released);
    }

    public boolean contains(TxnId id) {
        return id != null && txns.containsKey(id);
    }

    /**
     * 버퍼링 중인 트랜잭션 수.
     *
     * @return 식별자 수
     */
    public int size() {
        return txns.size();
    }

    public long bufferedBytes() {
        return bufferedBytes.get();
    }

    /**
     * 모든 상태 제거.
     */
    public void clear() {
        for (TxnId id : txns.keySet()) {
            TxnState state = txns.remove(id);
            if (state != null) {
                bufferedBytes.addAndGet(-state.markPurged());
            }
        }
    }
}
