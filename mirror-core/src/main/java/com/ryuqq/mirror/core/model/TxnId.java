package com.ryuqq.mirror.core.model;

import org.bson.BsonDocument;

/**
 * 트랜잭션 식별자 (logical session id, transaction number).
 *
 * <p>oplog entry의 {@code lsid}와 {@code txnNumber}에서 한 번 추출되며,
 * 여러 entry로 분할된 트랜잭션을 하나로 묶는 키로 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 시 lsid 문서를 복사하므로 원본 문서 변경의 영향을 받지 않음</p>
 * <p><strong>Zero value:</strong> {@link #NONE}은 "식별자 없음"을 나타내며 버퍼 키로 사용되지 않음</p>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public final class TxnId {

    /**
     * 트랜잭션이 아닌 entry의 식별자.
     */
    public static final TxnId NONE = new TxnId(new BsonDocument(), 0);

    private final BsonDocument lsid;
    private final long txnNumber;

    private TxnId(BsonDocument lsid, long txnNumber) {
        this.lsid = lsid;
        this.txnNumber = txnNumber;
    }

    /**
     * TxnId 생성.
     *
     * @param lsid logical session id 문서 (예: {@code {id: UUID, uid: BinData}})
     * @param txnNumber 세션 내 트랜잭션 번호 (0 이상)
     * @return TxnId 인스턴스
     * @throws IllegalArgumentException lsid가 null 또는 빈 문서이거나 txnNumber가 음수인 경우
     */
    public static TxnId of(BsonDocument lsid, long txnNumber) {
        if (lsid == null || lsid.isEmpty()) {
            throw new IllegalArgumentException("lsid cannot be null or empty");
        }
        if (txnNumber < 0) {
            throw new IllegalArgumentException("txnNumber must be non-negative (current: " + txnNumber + ")");
        }
        return new TxnId(lsid.clone(), txnNumber);
    }

    public BsonDocument getLsid() {
        return lsid.clone();
    }

    public long getTxnNumber() {
        return txnNumber;
    }

    public boolean isNone() {
        return lsid.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TxnId txnId = (TxnId) o;
        return txnNumber == txnId.txnNumber && lsid.equals(txnId.lsid);
    }

    @Override
    public int hashCode() {
        return 31 * lsid.hashCode() + Long.hashCode(txnNumber);
    }

    @Override
    public String toString() {
        if (isNone()) {
            return "TxnId{NONE}";
        }
        Object session = lsid.containsKey("id") ? lsid.get("id") : lsid;
        return "TxnId{lsid=" + session + ", txnNumber=" + txnNumber + '}';
    }
}
