package com.ryuqq.mirror.core.txn;

/**
 * 트랜잭션 내에서 oplog entry가 맡는 역할.
 *
 * <p>역할 하나로 분류 결과를 표현하여 "커밋이면서 중단" 같은 불가능한 조합이
 * 표현되지 않도록 합니다.</p>
 *
 * <pre>
 * NON_TXN         트랜잭션이 아님
 * SINGLE          단일 entry 트랜잭션 (첫 entry이자 커밋)
 * FIRST_OF_MULTI  다중 entry 트랜잭션의 첫 entry
 * CONTINUATION    다중 entry 트랜잭션의 중간 entry
 * FINAL_COMMIT    다중 entry 트랜잭션의 커밋 entry
 * FINAL_ABORT     다중 entry 트랜잭션의 중단 entry
 * </pre>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public enum TxnRole {

    NON_TXN,
    SINGLE,
    FIRST_OF_MULTI,
    CONTINUATION,
    FINAL_COMMIT,
    FINAL_ABORT;

    /**
     * 새 트랜잭션을 시작하는 역할인지 확인.
     *
     * @return SINGLE 또는 FIRST_OF_MULTI인 경우 true
     */
    public boolean startsTxn() {
        return this == SINGLE || this == FIRST_OF_MULTI;
    }
}
