package com.ryuqq.mirror.core.error;

/**
 * 트랜잭션 스트림의 종료 오류.
 *
 * <p>버퍼링된 entry의 내부 작업을 디코딩하다 실패한 경우 발생하며, 원인 예외를 보존합니다.
 * 한 번 발생하면 같은 스트림에서 더 이상 작업이 나오지 않습니다.</p>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public class TxnStreamException extends RuntimeException {

    public TxnStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
