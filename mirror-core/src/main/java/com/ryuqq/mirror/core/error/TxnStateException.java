package com.ryuqq.mirror.core.error;

/**
 * 트랜잭션 버퍼 사용 규칙 위반.
 *
 * <p>트랜잭션이 아닌 entry의 추가, 종료된 트랜잭션에 대한 추가, 커밋되지 않은 트랜잭션의
 * 스트리밍 등 호출자의 사용 오류를 나타냅니다.</p>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public class TxnStateException extends IllegalStateException {

    public TxnStateException(String message) {
        super(message);
    }

    public TxnStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
