package com.ryuqq.mirror.core.txn;

import com.ryuqq.mirror.core.model.TxnId;

/**
 * oplog entry 한 건의 트랜잭션 분류 결과.
 *
 * <p>{@link TxnClassifier}가 생성하며 불변입니다. 트랜잭션 식별자와
 * {@link TxnRole} 하나로 구성됩니다.</p>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public final class Meta {

    /**
     * 트랜잭션이 아닌 entry의 분류 결과.
     */
    public static final Meta NON_TXN = new Meta(TxnId.NONE, TxnRole.NON_TXN);

    private final TxnId id;
    private final TxnRole role;

    private Meta(TxnId id, TxnRole role) {
        this.id = id;
        this.role = role;
    }

    /**
     * Meta 생성.
     *
     * @param id 트랜잭션 식별자
     * @param role entry 역할
     * @return Meta 인스턴스
     * @throws IllegalArgumentException id 또는 role이 null이거나, 역할과 식별자 유무가 맞지 않는 경우
     */
    public static Meta of(TxnId id, TxnRole role) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
        if (role == TxnRole.NON_TXN) {
            if (!id.isNone()) {
                throw new IllegalArgumentException("NON_TXN meta cannot carry a transaction id: " + id);
            }
            return NON_TXN;
        }
        if (id.isNone()) {
            throw new IllegalArgumentException("transaction meta requires a transaction id (role: " + role + ")");
        }
        return new Meta(id, role);
    }

    public TxnId id() {
        return id;
    }

    public TxnRole role() {
        return role;
    }

    public boolean isTxn() {
        return role != TxnRole.NON_TXN;
    }

    /**
     * 여러 entry로 구성된 트랜잭션의 일부인지 확인.
     *
     * @return SINGLE과 NON_TXN을 제외한 모든 역할에서 true
     */
    public boolean isMultiOp() {
        return isTxn() && role != TxnRole.SINGLE;
    }

    public boolean isCommit() {
        return role == TxnRole.SINGLE || role == TxnRole.FINAL_COMMIT;
    }

    public boolean isAbort() {
        return role == TxnRole.FINAL_ABORT;
    }

    public boolean isFinal() {
        return isCommit() || isAbort();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Meta meta = (Meta) o;
        return role == meta.role && id.equals(meta.id);
    }

    @Override
    public int hashCode() {
        return 31 * id.hashCode() + role.hashCode();
    }

    @Override
    public String toString() {
        return "Meta{id=" + id + ", role=" + role + '}';
    }
}
