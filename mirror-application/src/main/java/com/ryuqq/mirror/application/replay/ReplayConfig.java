package com.ryuqq.mirror.application.replay;

/**
 * oplog 재생 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxBatchOps: applyOps 배치 최대 entry 수 (기본 1000)</li>
 *   <li>maxBatchBytes: applyOps 배치 최대 크기 (기본 16MB)</li>
 *   <li>bypassDocumentValidation: validator 무시 여부 (기본 false)</li>
 *   <li>maxBufferedBytes: 트랜잭션 버퍼 최대 크기 (기본 0 = 무제한)</li>
 * </ul>
 *
 * @author Mirror Team
 * @since 1.0.0
 * @param maxBatchOps 배치 최대 entry 수 (1 이상이어야 함)
 * @param maxBatchBytes 배치 최대 바이트 (1 이상이어야 함)
 * @param bypassDocumentValidation validator 무시 여부
 * @param maxBufferedBytes 트랜잭션 버퍼 최대 바이트 (0 이상, 0은 무제한)
 */
public record ReplayConfig(
    int maxBatchOps,
    int maxBatchBytes,
    boolean bypassDocumentValidation,
    long maxBufferedBytes
) {

    public static final int DEFAULT_MAX_BATCH_BYTES = 16 * 1024 * 1024;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxBatchOps=1000, maxBatchBytes=16MB, bypassDocumentValidation=false, maxBufferedBytes=0</p>
     */
    public ReplayConfig() {
        this(1000, DEFAULT_MAX_BATCH_BYTES, false, 0);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ReplayConfig {
        if (maxBatchOps <= 0) {
            throw new IllegalArgumentException(
                "maxBatchOps must be positive (current: " + maxBatchOps + ")"
            );
        }
        if (maxBatchBytes <= 0) {
            throw new IllegalArgumentException(
                "maxBatchBytes must be positive (current: " + maxBatchBytes + ")"
            );
        }
        if (maxBufferedBytes < 0) {
            throw new IllegalArgumentException(
                "maxBufferedBytes must be non-negative (current: " + maxBufferedBytes + ")"
            );
        }
    }

    public ReplayConfig withMaxBatchOps(int maxBatchOps) {
        return new ReplayConfig(maxBatchOps, maxBatchBytes, bypassDocumentValidation, maxBufferedBytes);
    }

    public ReplayConfig withMaxBatchBytes(int maxBatchBytes) {
        return new ReplayConfig(maxBatchOps, maxBatchBytes, bypassDocumentValidation, maxBufferedBytes);
    }

    public ReplayConfig withBypassDocumentValidation(boolean bypassDocumentValidation) {
        return new ReplayConfig(maxBatchOps, maxBatchBytes, bypassDocumentValidation, maxBufferedBytes);
    }

    public ReplayConfig withMaxBufferedBytes(long maxBufferedBytes) {
        return new ReplayConfig(maxBatchOps, maxBatchBytes, bypassDocumentValidation, maxBufferedBytes);
    }
}
