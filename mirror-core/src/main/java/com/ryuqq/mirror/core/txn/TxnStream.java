package com.ryuqq.mirror.core.txn;

import com.ryuqq.mirror.core.error.OplogParseException;
import com.ryuqq.mirror.core.error.TxnStreamException;
import com.ryuqq.mirror.core.model.Oplog;
import com.ryuqq.mirror.core.model.TxnId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * 커밋된 트랜잭션의 작업 스트림.
 *
 * <p>버퍼링된 entry의 내부 작업을 수신 순서대로 돌려주는 pull 방식 iterator입니다.
 * entry는 소비자가 요청할 때 하나씩 디코딩되므로 메모리에 풀어 놓는 작업은
 * 한 entry 분량으로 제한됩니다.</p>
 *
 * <p><strong>종료 오류:</strong> 디코딩 실패는 {@link TxnStreamException}으로
 * {@link #hasNext()}/{@link #next()}에서 발생하며 {@link #failure()}로 다시 확인할 수 있습니다.
 * 이후 호출은 같은 예외를 다시 던집니다.</p>
 *
 * <p><strong>Thread-safety:</strong> 단일 소비자 전용. 스레드 간 공유하지 마세요.</p>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public final class TxnStream implements Iterator<Oplog>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TxnStream.class);

    private final TxnId id;
    private final Iterator<Oplog> entries;
    private Iterator<Oplog> current = Collections.emptyIterator();
    private TxnStreamException failure;
    private boolean drained;
    private boolean closed;
    private int emitted;

    TxnStream(TxnId id, List<Oplog> entries) {
        this.id = id;
        this.entries = entries.iterator();
    }

    /**
     * 다음 작업 존재 여부.
     *
     * @return 남은 작업이 있으면 true
     * @throws TxnStreamException entry 디코딩에 실패한 경우
     */
    @Override
    public boolean hasNext() {
        if (failure != null) {
            throw failure;
        }
        if (closed) {
            return false;
        }
        while (!current.hasNext()) {
            if (!entries.hasNext()) {
                drained = true;
                return false;
            }
            Oplog entry = entries.next();
            try {
                current = entry.embeddedOps().iterator();
            } catch (OplogParseException e) {
                failure = new TxnStreamException(
                    "failed to decode transaction entry at " + entry.getTimestamp() + " for " + id, e);
                log.error("Transaction stream for {} failed after {} ops", id, emitted, e);
                throw failure;
            }
        }
        return true;
    }

    @Override
    public Oplog next() {
        if (!hasNext()) {
            throw new NoSuchElementException("transaction stream for " + id + " is exhausted");
        }
        emitted++;
        return current.next();
    }

    public TxnId id() {
        return id;
    }

    /**
     * 스트림의 종료 오류.
     *
     * @return 디코딩 실패가 있었으면 해당 예외
     */
    public Optional<TxnStreamException> failure() {
        return Optional.ofNullable(failure);
    }

    /**
     * 모든 작업을 오류 없이 내보냈는지 확인.
     *
     * @return 끝까지 소비되었으면 true
     */
    public boolean isDrained() {
        return drained;
    }

    public int emittedCount() {
        return emitted;
    }

    /**
     * 스트림 종료.
     *
     * <p>스트림에는 취소 개념이 없습니다. 끝까지 소비하지 않고 닫으면 경고를 남깁니다.</p>
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!drained && failure == null) {
            log.warn("Transaction stream for {} closed before being drained ({} ops emitted)", id, emitted);
        }
    }
}
