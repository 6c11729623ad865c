package com.ryuqq.mirror.core.model;

import org.bson.BsonDocument;
import org.bson.BsonInt64;
import org.bson.BsonTimestamp;

/**
 * oplog 위치 (timestamp, term).
 *
 * <p>트랜잭션 oplog entry의 {@code prevOpTime} 필드가 같은 트랜잭션의 직전 entry를 가리킬 때
 * 사용됩니다. timestamp가 (0, 0)인 경우 "직전 entry 없음"을 의미합니다.</p>
 *
 * @param timestamp oplog timestamp
 * @param term replication term (4.0 이전 또는 미지정 시 -1)
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public record OpTime(BsonTimestamp timestamp, long term) {

    /**
     * 역링크가 없음을 나타내는 값.
     */
    public static final OpTime ZERO = new OpTime(new BsonTimestamp(0, 0), -1);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException timestamp가 null인 경우
     */
    public OpTime {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
    }

    /**
     * {@code {ts: Timestamp, t: long}} 문서에서 OpTime 생성.
     *
     * @param document prevOpTime 문서
     * @return OpTime 인스턴스
     * @throws org.bson.BsonInvalidOperationException 필드 타입이 맞지 않는 경우
     */
    public static OpTime fromBson(BsonDocument document) {
        BsonTimestamp ts = document.containsKey("ts")
            ? document.getTimestamp("ts")
            : new BsonTimestamp(0, 0);
        long term = document.containsKey("t") && document.get("t").isNumber()
            ? document.getNumber("t").longValue()
            : -1;
        return new OpTime(ts, term);
    }

    /**
     * 역링크 없음 여부.
     *
     * @return timestamp가 (0, 0)이면 true
     */
    public boolean isZero() {
        return timestamp.getTime() == 0 && timestamp.getInc() == 0;
    }

    public BsonDocument toBson() {
        return new BsonDocument("ts", timestamp).append("t", new BsonInt64(term));
    }
}
