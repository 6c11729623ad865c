package com.ryuqq.mirror.core.error;

import com.ryuqq.mirror.core.model.ApplyOpsResponse;

/**
 * {@code applyOps} 명령이 ok:0으로 응답한 경우.
 *
 * <p>구조화된 응답을 보존하여 호출자가 {@link ApplyOpsResponse#firstFailedIndex()}로
 * 실패한 작업을 특정할 수 있도록 합니다.</p>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public class ApplyOpsException extends RuntimeException {

    private final transient ApplyOpsResponse response;

    public ApplyOpsException(ApplyOpsResponse response, Throwable cause) {
        super("applyOps failed: " + (response.hasErrorMessage() ? response.errmsg() : "unknown error")
            + " (code: " + response.code() + ")", cause);
        this.response = response;
    }

    public ApplyOpsResponse getResponse() {
        return response;
    }

    public int getCode() {
        return response.code();
    }
}
