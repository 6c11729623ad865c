package com.ryuqq.mirror.core.model;

import org.bson.BsonArray;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.bson.BsonValue;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * {@code applyOps} 명령 응답.
 *
 * <p>드라이버 예외보다 더 많은 정보를 담고 있습니다. 특히 {@code results} 배열로
 * 배치 내에서 실패한 작업의 위치를 특정할 수 있습니다.</p>
 *
 * @param ok 성공 여부
 * @param errmsg 오류 메시지 (성공 시 빈 문자열)
 * @param code 오류 코드 (성공 시 0)
 * @param applied 적용된 작업 수
 * @param results 작업별 성공 여부 (배치 순서)
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public record ApplyOpsResponse(boolean ok, String errmsg, int code, int applied, List<Boolean> results) {

    public ApplyOpsResponse {
        errmsg = errmsg == null ? "" : errmsg;
        results = results == null ? List.of() : List.copyOf(results);
    }

    /**
     * 응답 문서에서 생성.
     *
     * @param reply applyOps 응답 (ok:0 응답 포함)
     * @return ApplyOpsResponse 인스턴스
     */
    public static ApplyOpsResponse fromBson(BsonDocument reply) {
        boolean ok = isOk(reply.get("ok"));
        String errmsg = reply.containsKey("errmsg") && reply.get("errmsg").isString()
            ? reply.getString("errmsg").getValue()
            : "";
        int code = reply.containsKey("code") && reply.get("code").isNumber()
            ? reply.getNumber("code").intValue()
            : 0;
        int applied = reply.containsKey("applied") && reply.get("applied").isNumber()
            ? reply.getNumber("applied").intValue()
            : 0;
        List<Boolean> results = new ArrayList<>();
        if (reply.containsKey("results") && reply.get("results").isArray()) {
            for (BsonValue value : reply.getArray("results")) {
                results.add(value.isBoolean() && value.asBoolean().getValue());
            }
        }
        return new ApplyOpsResponse(ok, errmsg, code, applied, results);
    }

    private static boolean isOk(BsonValue value) {
        if (value == null) {
            return false;
        }
        if (value.isBoolean()) {
            return value.asBoolean().getValue();
        }
        return value.isNumber() && value.asNumber().doubleValue() == 1.0;
    }

    /**
     * 첫 번째로 실패한 작업의 배치 내 위치.
     *
     * @return 실패 위치, results가 비어 있거나 모두 성공이면 empty
     */
    public OptionalInt firstFailedIndex() {
        for (int i = 0; i < results.size(); i++) {
            if (!results.get(i)) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    public boolean hasErrorMessage() {
        return !errmsg.isEmpty();
    }

    public BsonDocument toBson() {
        BsonArray array = new BsonArray();
        results.forEach(r -> array.add(BsonBoolean.valueOf(r)));
        BsonDocument document = new BsonDocument("applied", new BsonInt32(applied))
            .append("results", array)
            .append("ok", new BsonDouble(ok ? 1.0 : 0.0));
        if (!errmsg.isEmpty()) {
            document.append("errmsg", new BsonString(errmsg));
        }
        if (code != 0) {
            document.append("code", new BsonInt32(code));
        }
        return document;
    }

    @Override
    public String toString() {
        return toBson().toJson();
    }
}
