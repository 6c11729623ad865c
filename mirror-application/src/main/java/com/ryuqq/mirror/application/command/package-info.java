/**
 * 대상 서버 명령 조립 및 단일 실행.
 *
 * <p>write concern 부착, applyOps 배치 조립, 인덱스 명세 보정을 담당합니다.
 * 재시도는 retry 패키지에서 수행합니다.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.mirror.application.command;
