package com.ryuqq.mirror.application.retry;

/**
 * 재시도 가능한 작업 한 번의 실행.
 *
 * <p>첫 실행에는 {@code isRetry=false}, 세션 복구 후 재실행에는 {@code isRetry=true}가 전달됩니다.
 * 재실행 시에는 이전 시도의 효과가 이미 대상에 반영되었을 수 있으므로, 구현은 이를 성공으로
 * 취급할 오류(예: namespace exists)를 판단하는 데 이 값을 사용합니다.</p>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RetryableAttempt {

    /**
     * 작업 실행.
     *
     * @param isRetry 재실행 여부
     * @throws RuntimeException 실패 시 (분류는 호출자가 수행)
     */
    void run(boolean isRetry);
}
