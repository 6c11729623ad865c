package com.ryuqq.mirror.core.error;

/**
 * oplog entry 디코딩 실패.
 *
 * <p>필수 필드 누락, 필드 타입 불일치, 트랜잭션 메타데이터의 모호한 조합(lsid와 txnNumber 중
 * 하나만 존재)을 나타냅니다. 재시도 대상이 아니며 호출자에게 그대로 전달됩니다.</p>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public class OplogParseException extends RuntimeException {

    public OplogParseException(String message) {
        super(message);
    }

    public OplogParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
