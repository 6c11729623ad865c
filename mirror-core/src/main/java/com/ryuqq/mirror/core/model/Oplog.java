package com.ryuqq.mirror.core.model;

import com.ryuqq.mirror.core.error.OplogParseException;
import org.bson.BsonArray;
import org.bson.BsonBinary;
import org.bson.BsonDocument;
import org.bson.BsonInvalidOperationException;
import org.bson.BsonTimestamp;
import org.bson.BsonValue;
import org.bson.RawBsonDocument;
import org.bson.codecs.BsonDocumentCodec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * oplog entry의 타입 지정 뷰.
 *
 * <p>원본 문서를 그대로 보관하여 재적용(applyOps) 시 변형 없이 전달합니다.
 * 파싱은 생성 시 한 번만 수행되며, 형식이 맞지 않으면 {@link OplogParseException}이 발생합니다.</p>
 *
 * <p><strong>필드:</strong></p>
 * <ul>
 *   <li>ts, t, h, v: 위치 및 버전 정보</li>
 *   <li>op: 작업 종류 (i, u, d, c, n)</li>
 *   <li>ns, o, ui: 대상 네임스페이스, 본문, collection UUID</li>
 *   <li>lsid, txnNumber, prevOpTime: 트랜잭션 메타데이터 (선택)</li>
 * </ul>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public final class Oplog {

    public static final String INSERT = "i";
    public static final String UPDATE = "u";
    public static final String DELETE = "d";
    public static final String COMMAND = "c";
    public static final String NOOP = "n";

    private final BsonDocument raw;
    private final BsonTimestamp timestamp;
    private final Long term;
    private final String operation;
    private final String namespace;
    private final BsonDocument object;
    private final BsonBinary uuid;
    private final BsonDocument lsid;
    private final Long txnNumber;
    private final OpTime prevOpTime;
    private volatile int sizeBytes = -1;

    private Oplog(BsonDocument raw) {
        this.raw = raw;
        this.timestamp = raw.getTimestamp("ts");
        this.term = raw.containsKey("t") ? raw.getNumber("t").longValue() : null;
        this.operation = raw.getString("op").getValue();
        this.namespace = raw.getString("ns").getValue();
        this.object = raw.containsKey("o") ? raw.getDocument("o") : new BsonDocument();
        this.uuid = raw.containsKey("ui") ? raw.getBinary("ui") : null;
        this.lsid = raw.containsKey("lsid") ? raw.getDocument("lsid") : null;
        this.txnNumber = raw.containsKey("txnNumber") ? raw.getNumber("txnNumber").longValue() : null;
        this.prevOpTime = raw.containsKey("prevOpTime") ? OpTime.fromBson(raw.getDocument("prevOpTime")) : null;
    }

    /**
     * 원본 문서에서 Oplog 생성.
     *
     * @param raw oplog 문서
     * @return Oplog 인스턴스
     * @throws OplogParseException 필수 필드(ts, op, ns)가 없거나 필드 타입이 맞지 않는 경우
     */
    public static Oplog fromBson(BsonDocument raw) {
        if (raw == null) {
            throw new OplogParseException("oplog entry cannot be null");
        }
        for (String required : new String[]{"ts", "op", "ns"}) {
            if (!raw.containsKey(required)) {
                throw new OplogParseException("oplog entry is missing required field '" + required + "': " + raw.toJson());
            }
        }
        try {
            return new Oplog(raw);
        } catch (BsonInvalidOperationException e) {
            throw new OplogParseException("malformed oplog entry: " + e.getMessage(), e);
        }
    }

    /**
     * 트랜잭션 entry에 포함된 내부 작업 목록 추출.
     *
     * <p>{@code applyOps} 명령 entry에서만 내부 작업이 존재합니다.
     * commitTransaction, abortTransaction 등은 빈 목록을 반환합니다.</p>
     *
     * <p>내부 작업에 ts, t, h가 없으면 외부 entry의 값을 상속합니다.</p>
     *
     * @return 내부 작업 목록 (entry 순서 유지)
     * @throws OplogParseException applyOps 배열 또는 내부 작업 형식이 잘못된 경우
     */
    public List<Oplog> embeddedOps() {
        if (!COMMAND.equals(operation) || !"applyOps".equals(commandName())) {
            return Collections.emptyList();
        }
        BsonValue value = object.get("applyOps");
        if (!value.isArray()) {
            throw new OplogParseException("applyOps field is not an array at " + timestamp);
        }
        BsonArray array = value.asArray();
        List<Oplog> ops = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            BsonValue element = array.get(i);
            if (!element.isDocument()) {
                throw new OplogParseException("applyOps element " + i + " is not a document at " + timestamp);
            }
            BsonDocument inner = element.asDocument().clone();
            inheritField(inner, "ts");
            inheritField(inner, "t");
            inheritField(inner, "h");
            ops.add(fromBson(inner));
        }
        return ops;
    }

    private void inheritField(BsonDocument inner, String key) {
        if (!inner.containsKey(key) && raw.containsKey(key)) {
            inner.put(key, raw.get(key));
        }
    }

    /**
     * 명령 entry의 명령 이름 (o 문서의 첫 번째 키).
     *
     * @return 명령 이름, 명령 entry가 아니거나 o가 비어 있으면 null
     */
    public String commandName() {
        if (!COMMAND.equals(operation) || object.isEmpty()) {
            return null;
        }
        return object.getFirstKey();
    }

    /**
     * 원본 문서의 BSON 크기 (바이트).
     *
     * @return 인코딩된 크기
     */
    public int sizeBytes() {
        int size = sizeBytes;
        if (size < 0) {
            if (raw instanceof RawBsonDocument) {
                size = ((RawBsonDocument) raw).getByteBuffer().remaining();
            } else {
                size = new RawBsonDocument(raw, new BsonDocumentCodec()).getByteBuffer().remaining();
            }
            sizeBytes = size;
        }
        return size;
    }

    /**
     * 재적용용 원본 문서.
     *
     * @return 원본 oplog 문서 (변경 금지)
     */
    public BsonDocument toBson() {
        return raw;
    }

    public BsonTimestamp getTimestamp() {
        return timestamp;
    }

    public Long getTerm() {
        return term;
    }

    public String getOperation() {
        return operation;
    }

    public String getNamespace() {
        return namespace;
    }

    public BsonDocument getObject() {
        return object;
    }

    public BsonBinary getUuid() {
        return uuid;
    }

    public BsonDocument getLsid() {
        return lsid;
    }

    public Long getTxnNumber() {
        return txnNumber;
    }

    public OpTime getPrevOpTime() {
        return prevOpTime;
    }

    @Override
    public String toString() {
        return "Oplog{ts=" + timestamp + ", op=" + operation + ", ns=" + namespace + '}';
    }
}
