package com.ryuqq.mirror.core.model;

import org.bson.BsonDocument;
import org.bson.BsonValue;

import java.util.ArrayList;
import java.util.List;

/**
 * 대상 서버의 {@code buildInfo} 응답.
 *
 * <p>버전별로 동작이 다른 명령(collMod의 write concern 지원, createIndexes의 write concern 지원)을
 * 분기하는 데 사용됩니다.</p>
 *
 * @param version 버전 문자열 (예: "4.2.1")
 * @param versionArray 버전 배열 (예: [4, 2, 1, 0])
 * @param maxBsonObjectSize 최대 BSON 문서 크기 (바이트)
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public record BuildInfo(String version, List<Integer> versionArray, int maxBsonObjectSize) {

    /**
     * 서버 기본 최대 문서 크기 (16MB).
     */
    public static final int DEFAULT_MAX_BSON_OBJECT_SIZE = 16 * 1024 * 1024;

    public BuildInfo {
        if (version == null) {
            version = "";
        }
        versionArray = versionArray == null ? List.of() : List.copyOf(versionArray);
        if (maxBsonObjectSize <= 0) {
            maxBsonObjectSize = DEFAULT_MAX_BSON_OBJECT_SIZE;
        }
    }

    /**
     * buildInfo 응답 문서에서 생성.
     *
     * <p>versionArray가 없는 오래된 서버는 version 문자열에서 배열을 조립합니다.</p>
     *
     * @param reply buildInfo 응답
     * @return BuildInfo 인스턴스
     */
    public static BuildInfo fromBson(BsonDocument reply) {
        String version = reply.containsKey("version") ? reply.getString("version").getValue() : "";
        List<Integer> array = new ArrayList<>();
        if (reply.containsKey("versionArray") && reply.get("versionArray").isArray()) {
            for (BsonValue value : reply.getArray("versionArray")) {
                array.add(value.asNumber().intValue());
            }
        } else {
            for (String part : version.split("[.\\-]")) {
                try {
                    array.add(Integer.parseInt(part));
                } catch (NumberFormatException e) {
                    break;
                }
            }
        }
        int maxSize = reply.containsKey("maxBsonObjectSize")
            ? reply.getNumber("maxBsonObjectSize").intValue()
            : DEFAULT_MAX_BSON_OBJECT_SIZE;
        return new BuildInfo(version, array, maxSize);
    }

    /**
     * 버전이 주어진 값 이상인지 확인.
     *
     * <p>숫자는 major, minor, patch 순으로 비교합니다.</p>
     *
     * @param required 최소 버전 (예: 3, 6, 0)
     * @return 서버 버전이 required 이상이면 true
     */
    public boolean versionAtLeast(int... required) {
        for (int i = 0; i < required.length; i++) {
            if (i == versionArray.size()) {
                return false;
            }
            int actual = versionArray.get(i);
            if (actual != required[i]) {
                return actual >= required[i];
            }
        }
        return true;
    }
}
