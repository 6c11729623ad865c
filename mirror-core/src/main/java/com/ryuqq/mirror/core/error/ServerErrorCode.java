package com.ryuqq.mirror.core.error;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 분류에 사용하는 서버 오류 코드 목록.
 *
 * <p>코드 값은 서버가 응답하는 숫자 코드이며, 일부 코드는 구버전 서버의 레거시 값입니다.
 * {@link #isReconnectable()}이 true인 코드는 세션 복구 후 재시도 대상입니다.</p>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public enum ServerErrorCode {

    BAD_VALUE(2, false),
    HOST_UNREACHABLE(6, true),
    HOST_NOT_FOUND(7, true),
    USER_NOT_FOUND(11, false),
    UNAUTHORIZED(13, false),
    NAMESPACE_NOT_FOUND(26, false),
    CURSOR_NOT_FOUND(43, false),
    NAMESPACE_EXISTS(48, false),
    COMMAND_NOT_FOUND(59, false),
    WRITE_CONCERN_FAILED(64, true),
    CANNOT_CREATE_INDEX(67, false),
    INVALID_OPTIONS(72, false),
    NETWORK_TIMEOUT(89, true),
    SHUTDOWN_IN_PROGRESS(91, true),
    CAPPED_POSITION_LOST(136, true),
    COMMAND_NOT_SUPPORTED_ON_VIEW(166, false),
    QUERY_PLAN_KILLED(175, true),
    PRIMARY_STEPPED_DOWN(189, true),
    INVALID_INDEX_SPECIFICATION_OPTION(197, false),
    SOCKET_EXCEPTION(9001, true),
    NOT_WRITABLE_PRIMARY(10107, true),
    DUPLICATE_KEY(11000, false),
    DUPLICATE_KEY_ON_UPDATE(11001, false),
    INTERRUPTED_AT_SHUTDOWN(11600, true),
    INTERRUPTED(11601, true),
    INTERRUPTED_DUE_TO_REPL_STATE_CHANGE(11602, true),
    DUPLICATE_KEY_LEGACY(12582, false),
    COMMAND_NOT_FOUND_LEGACY(13390, false),
    NOT_PRIMARY_NO_SECONDARY_OK(13435, true),
    NOT_PRIMARY_OR_SECONDARY(13436, true),
    BAD_HINT_LEGACY(17007, false);

    private static final Map<Integer, ServerErrorCode> BY_CODE = new HashMap<>();

    static {
        for (ServerErrorCode value : values()) {
            BY_CODE.put(value.code, value);
        }
    }

    private final int code;
    private final boolean reconnectable;

    ServerErrorCode(int code, boolean reconnectable) {
        this.code = code;
        this.reconnectable = reconnectable;
    }

    /**
     * 숫자 코드로 조회.
     *
     * @param code 서버 오류 코드
     * @return 알려진 코드이면 해당 값, 아니면 empty
     */
    public static Optional<ServerErrorCode> of(int code) {
        return Optional.ofNullable(BY_CODE.get(code));
    }

    public int code() {
        return code;
    }

    public boolean isReconnectable() {
        return reconnectable;
    }

    public boolean matches(int other) {
        return code == other;
    }
}
