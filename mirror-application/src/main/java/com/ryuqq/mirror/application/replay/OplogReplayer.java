package com.ryuqq.mirror.application.replay;

import com.ryuqq.mirror.application.retry.RetryableExecutor;
import com.ryuqq.mirror.core.model.Oplog;
import com.ryuqq.mirror.core.txn.Meta;
import com.ryuqq.mirror.core.txn.TxnBuffer;
import com.ryuqq.mirror.core.txn.TxnClassifier;
import com.ryuqq.mirror.core.txn.TxnStream;
import org.bson.BsonDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * oplog 재생기.
 *
 * <p>원본 oplog entry를 받은 순서대로 처리하여 대상 서버에 applyOps 배치로 적용합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * apply(entry)
 *   ├─ 비트랜잭션 entry → 배치에 추가 (한도 도달 시 flush)
 *   └─ 트랜잭션 entry → TxnBuffer.addOp
 *        ├─ 중단(abort) → purge (재생하지 않음)
 *        └─ 커밋(commit) → flush → 내부 작업을 순서대로 배치에 추가 → flush → purge
 * </pre>
 *
 * <p>배치는 적용에 성공한 뒤에만 비워집니다. 실패하면 배치가 그대로 남아
 * 다음 {@link #flush()}에서 다시 적용됩니다.</p>
 *
 * <p>단일 생산자 전용이며 스레드 안전하지 않습니다.</p>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public class OplogReplayer {

    private static final Logger log = LoggerFactory.getLogger(OplogReplayer.class);

    private final RetryableExecutor executor;
    private final ReplayConfig config;
    private final TxnBuffer buffer;

    private final List<BsonDocument> pending = new ArrayList<>();
    private long pendingBytes;

    private long appliedOps;
    private long batches;
    private long committedTxns;
    private long abortedTxns;

    /**
     * OplogReplayer 생성.
     *
     * @param executor 재시도 실행기
     * @param config 재생 설정
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public OplogReplayer(RetryableExecutor executor, ReplayConfig config) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.executor = executor;
        this.config = config;
        this.buffer = new TxnBuffer(config.maxBufferedBytes());
    }

    /**
     * oplog entry 하나 처리.
     *
     * @param raw 원본 oplog 문서
     * @throws com.ryuqq.mirror.core.error.OplogParseException entry 형식이 잘못된 경우
     * @throws com.ryuqq.mirror.core.error.TxnStateException 트랜잭션 상태 위반
     */
    public void apply(BsonDocument raw) {
        Oplog op = Oplog.fromBson(raw);
        Meta meta = TxnClassifier.classify(op);
        if (!meta.isTxn()) {
            enqueue(op);
            return;
        }

        buffer.addOp(meta, op);
        if (meta.isAbort()) {
            buffer.purge(meta);
            abortedTxns++;
            log.debug("Discarded aborted transaction {}", meta.id());
            return;
        }
        if (meta.isCommit()) {
            replayCommitted(meta);
        }
    }

    private void replayCommitted(Meta meta) {
        flush();
        int count = 0;
        try (TxnStream stream = buffer.stream(meta)) {
            while (stream.hasNext()) {
                enqueue(stream.next());
                count++;
            }
            flush();
        } catch (RuntimeException e) {
            log.error("Failed to replay transaction {}, discarding {} pending entries", meta.id(), pending.size());
            clearPending();
            buffer.purge(meta);
            throw e;
        }
        buffer.purge(meta);
        committedTxns++;
        log.debug("Replayed transaction {} with {} operations", meta.id(), count);
    }

    private void enqueue(Oplog op) {
        int size = op.sizeBytes();
        if (!pending.isEmpty()
            && (pending.size() >= config.maxBatchOps() || pendingBytes + size > config.maxBatchBytes())) {
            flush();
        }
        pending.add(op.toBson());
        pendingBytes += size;
    }

    /**
     * 대기 중인 entry를 대상에 적용.
     *
     * <p>대기 중인 entry가 없으면 아무 것도 하지 않습니다.</p>
     */
    public void flush() {
        if (pending.isEmpty()) {
            return;
        }
        executor.applyOps(new ArrayList<>(pending), config.bypassDocumentValidation());
        appliedOps += pending.size();
        batches++;
        log.debug("Flushed batch of {} entries ({} bytes)", pending.size(), pendingBytes);
        clearPending();
    }

    private void clearPending() {
        pending.clear();
        pendingBytes = 0;
    }

    public int pendingCount() {
        return pending.size();
    }

    public int bufferedTransactions() {
        return buffer.size();
    }

    public ReplayStats stats() {
        return new ReplayStats(appliedOps, batches, committedTxns, abortedTxns);
    }
}
