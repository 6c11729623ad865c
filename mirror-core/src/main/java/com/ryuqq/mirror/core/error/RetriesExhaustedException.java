package com.ryuqq.mirror.core.error;

import java.time.Duration;

/**
 * 재시도 한도 소진.
 *
 * <p>최소 시도 횟수와 최소 경과 시간을 모두 넘긴 뒤에도 작업이 성공하지 못한 경우 발생합니다.
 * 마지막 오류를 원인으로 보존합니다.</p>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public class RetriesExhaustedException extends RuntimeException {

    private final int attempts;
    private final Duration elapsed;

    public RetriesExhaustedException(String message, int attempts, Duration elapsed, Throwable cause) {
        super(message + " after " + attempts + " attempts which took " + elapsed + ": "
            + (cause == null ? "unknown error" : cause.getMessage()), cause);
        this.attempts = attempts;
        this.elapsed = elapsed;
    }

    public int getAttempts() {
        return attempts;
    }

    public Duration getElapsed() {
        return elapsed;
    }
}
