package com.ryuqq.mirror.application.retry;

import com.ryuqq.mirror.application.command.CommandRunner;
import com.ryuqq.mirror.core.error.ErrorClassifier;
import com.ryuqq.mirror.core.error.RetriesExhaustedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * 대상 서버 세션 복구.
 *
 * <p>재연결 가능한 오류 이후, 재시도 전에 대상 서버가 다시 응답할 때까지 기다립니다.
 * 고정 간격으로 sleep한 뒤 연결 확인 명령을 보내며, 확인이 성공하면 복구가 끝납니다.</p>
 *
 * <p><strong>연결 확인 명령:</strong></p>
 * <ul>
 *   <li>쓰기 가능한 대상: majority no-op applyOps (primary 선출과 복제 모두 확인)</li>
 *   <li>그 외: isMaster</li>
 * </ul>
 *
 * <p><strong>종료 조건:</strong> 연결 확인 횟수가 {@link RetryPolicy#reconnectAttempts()} 이상이고
 * 바깥 재시도 루프 시작 이후 경과 시간이 {@link RetryPolicy#minDurationMs()} 이상이면 포기합니다.
 * 재연결 불가능한 연결 확인 오류는 즉시 포기합니다.</p>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public class SessionRecovery {

    private static final Logger log = LoggerFactory.getLogger(SessionRecovery.class);

    private final CommandRunner commandRunner;
    private final RetryPolicy policy;
    private final boolean writeable;

    /**
     * SessionRecovery 생성.
     *
     * @param commandRunner 연결 확인 명령 실행기
     * @param policy 재시도 설정
     * @param writeable 대상이 쓰기 가능한지 여부 (연결 확인 명령 선택)
     * @throws IllegalArgumentException commandRunner 또는 policy가 null인 경우
     */
    public SessionRecovery(CommandRunner commandRunner, RetryPolicy policy, boolean writeable) {
        if (commandRunner == null) {
            throw new IllegalArgumentException("commandRunner cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        this.commandRunner = commandRunner;
        this.policy = policy;
        this.writeable = writeable;
    }

    /**
     * 대상 서버가 응답할 때까지 대기.
     *
     * @param startNanos 바깥 재시도 루프의 시작 시각 ({@link System#nanoTime()})
     * @throws RetriesExhaustedException 연결 확인이 재연결 불가능한 오류로 실패했거나 한도를 소진한 경우
     */
    public void recover(long startNanos) {
        int attempts = 0;
        while (true) {
            sleep(policy.recoverSleepMs());
            attempts++;
            try {
                checkConnection();
                log.info("Reconnected to destination after {} attempt(s)", attempts);
                return;
            } catch (RuntimeException e) {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
                if (!ErrorClassifier.isReconnectable(e)) {
                    log.error("Destination connection check failed with non-reconnectable error: {}", e.getMessage());
                    throw new RetriesExhaustedException(
                        "gave up reconnecting to the destination", attempts, elapsed, e);
                }
                if (attempts >= policy.reconnectAttempts() && elapsed.toMillis() >= policy.minDurationMs()) {
                    log.error("Giving up reconnecting after {} attempt(s) and {}", attempts, elapsed);
                    throw new RetriesExhaustedException(
                        "gave up reconnecting to the destination", attempts, elapsed, e);
                }
                log.warn("Destination connection check {} failed, retrying in {}ms: {}",
                    attempts, policy.recoverSleepMs(), e.getMessage());
            }
        }
    }

    private void checkConnection() {
        if (writeable) {
            commandRunner.waitForWriteConcernMajority();
        } else {
            commandRunner.isMaster();
        }
    }

    /**
     * Thread.sleep wrapper (InterruptedException 처리).
     *
     * @param millis 대기 시간 (밀리초)
     * @throws RuntimeException sleep 중 인터럽트 발생 시
     */
    private void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Session recovery interrupted", e);
        }
    }
}
