package com.ryuqq.mirror.application.command;

import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 인덱스 명세 보정 유틸리티.
 *
 * <p>원본에서 읽은 인덱스 명세를 대상 서버가 받아들일 수 있는 형태로 바꿉니다.</p>
 *
 * <p><strong>보정 규칙:</strong></p>
 * <ul>
 *   <li>{@code background} 옵션 제거 (신규 서버에서 무시되거나 거부됨)</li>
 *   <li>{@code v}가 없으면 {@code v: 1} 추가</li>
 *   <li>레거시 키 값(0, 빈 문자열, 숫자/문자열이 아닌 값)을 1로 변환</li>
 * </ul>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public final class IndexSpecs {

    // Utility class - prevent instantiation
    private IndexSpecs() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 대상 서버로 보낼 인덱스 명세 목록 보정.
     *
     * @param specs 원본 인덱스 명세 목록 (변경되지 않음)
     * @return 보정된 사본 목록
     */
    public static List<BsonDocument> fixOutgoing(List<BsonDocument> specs) {
        List<BsonDocument> fixed = new ArrayList<>(specs.size());
        for (BsonDocument spec : specs) {
            fixed.add(fixOutgoing(spec));
        }
        return fixed;
    }

    /**
     * 인덱스 명세 하나 보정.
     *
     * @param spec 원본 인덱스 명세 (변경되지 않음)
     * @return 보정된 사본
     */
    public static BsonDocument fixOutgoing(BsonDocument spec) {
        BsonDocument fixed = spec.clone();
        fixed.remove("background");
        if (fixed.containsKey("key") && fixed.get("key").isDocument()) {
            fixed.put("key", convertLegacyIndexKeys(fixed.getDocument("key")));
        }
        appendV1IfMissing(fixed);
        return fixed;
    }

    /**
     * {@code v} 필드가 없으면 {@code v: 1} 추가.
     *
     * @param spec 인덱스 명세 (직접 변경됨)
     */
    public static void appendV1IfMissing(BsonDocument spec) {
        if (!spec.containsKey("v")) {
            spec.put("v", new BsonInt32(1));
        }
    }

    /**
     * 레거시 인덱스 키 값 변환.
     *
     * <p>구버전 서버가 허용하던 키 값을 오름차순(1)으로 바꿉니다:</p>
     * <ul>
     *   <li>숫자 0 (Decimal128 "0" 포함)</li>
     *   <li>빈 문자열</li>
     *   <li>숫자도 문자열도 아닌 값 (예: boolean, 문서)</li>
     * </ul>
     * <p>그 외 값(예: -1, "2dsphere", "hashed")은 유지됩니다.</p>
     *
     * @param key 인덱스 키 문서 (변경되지 않음)
     * @return 변환된 새 키 문서 (키 순서 유지)
     */
    public static BsonDocument convertLegacyIndexKeys(BsonDocument key) {
        BsonDocument converted = new BsonDocument();
        for (Map.Entry<String, BsonValue> entry : key.entrySet()) {
            BsonValue value = entry.getValue();
            converted.put(entry.getKey(), isLegacyValue(value) ? new BsonInt32(1) : value);
        }
        return converted;
    }

    private static boolean isLegacyValue(BsonValue value) {
        if (value.isDecimal128()) {
            return "0".equals(value.asDecimal128().getValue().toString());
        }
        if (value.isNumber()) {
            return value.asNumber().doubleValue() == 0.0;
        }
        if (value.isString()) {
            return value.asString().getValue().isEmpty();
        }
        return true;
    }

    /**
     * 두 인덱스 키가 같은지 비교.
     *
     * <p>키 이름과 순서가 같아야 하며, 값은 숫자로 비교합니다. 숫자로 해석되는 문자열은
     * 숫자로 취급합니다 (예: "1" == 1, "1.0" == 1, -1.0 == -1).</p>
     *
     * @param first 첫 번째 인덱스 키
     * @param second 두 번째 인덱스 키
     * @return 같으면 true
     */
    public static boolean isIndexKeysEqual(BsonDocument first, BsonDocument second) {
        if (first.size() != second.size()) {
            return false;
        }
        List<String> firstKeys = new ArrayList<>(first.keySet());
        List<String> secondKeys = new ArrayList<>(second.keySet());
        for (int i = 0; i < firstKeys.size(); i++) {
            String name = firstKeys.get(i);
            if (!name.equals(secondKeys.get(i))) {
                return false;
            }
            if (!isKeyValueEqual(first.get(name), second.get(name))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isKeyValueEqual(BsonValue a, BsonValue b) {
        Double left = toNumber(a);
        Double right = toNumber(b);
        if (left != null && right != null) {
            return left.doubleValue() == right.doubleValue();
        }
        if (a.isString() && b.isString()) {
            return a.asString().getValue().equals(b.asString().getValue());
        }
        return a.equals(b);
    }

    private static Double toNumber(BsonValue value) {
        if (value.isDecimal128()) {
            return value.asDecimal128().getValue().bigDecimalValue().doubleValue();
        }
        if (value.isNumber()) {
            return value.asNumber().doubleValue();
        }
        if (value.isString()) {
            try {
                return Double.parseDouble(value.asString().getValue());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
