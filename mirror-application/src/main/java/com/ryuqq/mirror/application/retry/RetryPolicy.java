package com.ryuqq.mirror.application.retry;

/**
 * 재시도 및 세션 복구 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>minAttempts: 최소 재시도 횟수 (기본 10)</li>
 *   <li>minDurationMs: 최소 재시도 시간 (기본 300000ms = 5분)</li>
 *   <li>recoverSleepMs: 세션 복구 연결 확인 간격 (기본 5000ms)</li>
 *   <li>reconnectAttempts: 세션 복구 최소 연결 확인 횟수 (기본 10)</li>
 * </ul>
 *
 * <p><strong>종료 조건:</strong> 시도 횟수와 경과 시간 두 기준을 <em>모두</em> 넘겨야 포기합니다.
 * 빠르게 실패하는 오류는 minDurationMs 동안, 느리게 실패하는 오류는 minAttempts 만큼 재시도됩니다.</p>
 *
 * @author Mirror Team
 * @since 1.0.0
 * @param minAttempts 최소 재시도 횟수 (1 이상이어야 함)
 * @param minDurationMs 최소 재시도 시간 (밀리초, 0 이상이어야 함)
 * @param recoverSleepMs 복구 연결 확인 간격 (밀리초, 0 이상이어야 함)
 * @param reconnectAttempts 복구 최소 연결 확인 횟수 (1 이상이어야 함)
 */
public record RetryPolicy(
    int minAttempts,
    long minDurationMs,
    long recoverSleepMs,
    int reconnectAttempts
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: minAttempts=10, minDurationMs=300000ms, recoverSleepMs=5000ms, reconnectAttempts=10</p>
     */
    public RetryPolicy() {
        this(10, 300_000, 5_000, 10);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryPolicy {
        if (minAttempts <= 0) {
            throw new IllegalArgumentException(
                "minAttempts must be positive (current: " + minAttempts + ")"
            );
        }
        if (minDurationMs < 0) {
            throw new IllegalArgumentException(
                "minDurationMs must be non-negative (current: " + minDurationMs + ")"
            );
        }
        if (recoverSleepMs < 0) {
            throw new IllegalArgumentException(
                "recoverSleepMs must be non-negative (current: " + recoverSleepMs + ")"
            );
        }
        if (reconnectAttempts <= 0) {
            throw new IllegalArgumentException(
                "reconnectAttempts must be positive (current: " + reconnectAttempts + ")"
            );
        }
    }

    /**
     * minAttempts만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMinAttempts(int minAttempts) {
        return new RetryPolicy(minAttempts, minDurationMs, recoverSleepMs, reconnectAttempts);
    }

    /**
     * minDurationMs만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMinDurationMs(long minDurationMs) {
        return new RetryPolicy(minAttempts, minDurationMs, recoverSleepMs, reconnectAttempts);
    }

    /**
     * recoverSleepMs만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withRecoverSleepMs(long recoverSleepMs) {
        return new RetryPolicy(minAttempts, minDurationMs, recoverSleepMs, reconnectAttempts);
    }

    /**
     * reconnectAttempts만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withReconnectAttempts(int reconnectAttempts) {
        return new RetryPolicy(minAttempts, minDurationMs, recoverSleepMs, reconnectAttempts);
    }

    /**
     * 두 종료 기준을 모두 넘겼는지 확인.
     *
     * @param attempts 지금까지의 시도 횟수
     * @param elapsedMs 시작 이후 경과 시간 (밀리초)
     * @return 횟수와 시간 모두 최소값 이상이면 true
     */
    public boolean isExhausted(int attempts, long elapsedMs) {
        return attempts >= minAttempts && elapsedMs >= minDurationMs;
    }
}
