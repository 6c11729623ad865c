/**
 * 재시도 및 세션 복구.
 *
 * <p>대상 서버에 대한 변경 작업을 재연결 가능한 오류에 대해 재시도합니다.</p>
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.mirror.application.retry.RetryableExecutor} - 재시도 루프 및 파생 작업 (insert, DDL, 인덱스, applyOps)</li>
 *   <li>{@link com.ryuqq.mirror.application.retry.SessionRecovery} - 재시도 전 대상 서버 응답 대기</li>
 *   <li>{@link com.ryuqq.mirror.application.retry.RetryPolicy} - 재시도 한도 설정</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.mirror.application.retry;
