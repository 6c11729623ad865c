/**
 * oplog 재생.
 *
 * <p>{@link com.ryuqq.mirror.application.replay.OplogReplayer}는 원본 oplog entry를 받은 순서대로
 * 처리하며, 트랜잭션은 커밋 시점에 내부 작업으로 풀어서 적용하고 중단된 트랜잭션은 버립니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.mirror.application.replay;
