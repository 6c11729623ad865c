package com.ryuqq.mirror.application.retry;

import com.ryuqq.mirror.application.command.CommandRunner;
import com.ryuqq.mirror.application.command.IndexSpecs;
import com.ryuqq.mirror.core.error.ErrorClassifier;
import com.ryuqq.mirror.core.error.RetriesExhaustedException;
import com.ryuqq.mirror.core.model.ApplyOpsResponse;
import com.ryuqq.mirror.core.model.BuildInfo;
import com.ryuqq.mirror.core.model.Namespace;
import com.ryuqq.mirror.core.model.Oplog;
import com.ryuqq.mirror.core.spi.Destination;
import org.bson.BsonArray;
import org.bson.BsonBinary;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 재시도 실행기.
 *
 * <p>대상 서버에 대한 모든 변경 작업을 재연결 가능한 오류에 대해 재시도합니다.
 * 재시도 사이에는 {@link SessionRecovery}로 대상이 다시 응답할 때까지 기다립니다.</p>
 *
 * <p><strong>재시도 규칙:</strong></p>
 * <ol>
 *   <li>첫 실행은 {@code isRetry=false}</li>
 *   <li>실패하면 오류 분류: 재연결 불가능한 오류는 즉시 다시 던짐</li>
 *   <li>재연결 가능한 오류는 세션 복구 후 {@code isRetry=true}로 재실행</li>
 *   <li>재시도 횟수와 경과 시간 모두 최소값을 넘기면 {@link RetriesExhaustedException}</li>
 * </ol>
 *
 * <p><strong>멱등성:</strong> 재실행 시 이전 시도가 이미 반영되었을 수 있으므로,
 * create의 namespace exists, drop의 namespace not found는 재실행에서 성공으로 취급합니다.</p>
 *
 * <p>재시도 상태는 호출마다 지역적이므로 여러 스레드에서 동시에 사용할 수 있습니다.</p>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public class RetryableExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryableExecutor.class);

    static final String DROP_PENDING_PREFIX = "_mirror_drop_pending_";
    private static final String SYSTEM_JS = "system.js";

    private final Destination destination;
    private final CommandRunner commandRunner;
    private final SessionRecovery recovery;
    private final RetryPolicy policy;

    /**
     * 기본 구성 생성자 (쓰기 가능한 대상).
     *
     * @param destination 대상 서버
     * @param policy 재시도 설정
     */
    public RetryableExecutor(Destination destination, RetryPolicy policy) {
        this(destination, new CommandRunner(destination), policy);
    }

    private RetryableExecutor(Destination destination, CommandRunner commandRunner, RetryPolicy policy) {
        this(destination, commandRunner, new SessionRecovery(commandRunner, policy, true), policy);
    }

    /**
     * 전체 구성 생성자.
     *
     * @param destination 대상 서버
     * @param commandRunner 명령 실행기
     * @param recovery 세션 복구
     * @param policy 재시도 설정
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public RetryableExecutor(Destination destination, CommandRunner commandRunner,
                             SessionRecovery recovery, RetryPolicy policy) {
        if (destination == null) {
            throw new IllegalArgumentException("destination cannot be null");
        }
        if (commandRunner == null) {
            throw new IllegalArgumentException("commandRunner cannot be null");
        }
        if (recovery == null) {
            throw new IllegalArgumentException("recovery cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        this.destination = destination;
        this.commandRunner = commandRunner;
        this.recovery = recovery;
        this.policy = policy;
    }

    /**
     * 재시도하며 작업 실행.
     *
     * @param attempt 실행할 작업
     * @throws RuntimeException 재연결 불가능한 오류 (원래 예외 그대로)
     * @throws RetriesExhaustedException 재시도 한도를 소진했거나 세션 복구에 실패한 경우
     */
    public void runRetryable(RetryableAttempt attempt) {
        long start = System.nanoTime();
        RuntimeException last;
        try {
            attempt.run(false);
            return;
        } catch (RuntimeException e) {
            last = e;
        }

        int retries = 0;
        while (!policy.isExhausted(retries, elapsedMs(start))) {
            if (!ErrorClassifier.isReconnectable(last)) {
                throw last;
            }
            log.warn("Retrying after reconnectable error (retry {}): {}", retries + 1, last.getMessage());
            recovery.recover(start);
            retries++;
            try {
                attempt.run(true);
                log.info("Operation succeeded after {} retries", retries);
                return;
            } catch (RuntimeException e) {
                last = e;
            }
        }

        if (!ErrorClassifier.isReconnectable(last)) {
            throw last;
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        log.error("Retries exhausted after {} attempts ({})", retries + 1, elapsed);
        throw new RetriesExhaustedException("retries exhausted", retries + 1, elapsed, last);
    }

    // ========== 문서 삽입 ==========

    /**
     * 문서 일괄 삽입.
     *
     * <p>duplicate key로 실패하면 이미 존재하는 문서를 건너뛰며 하나씩 삽입하다가,
     * 처음으로 새 문서가 삽입되면 다음 문서부터 다시 일괄 삽입합니다.
     * 진행 위치는 재시도 간에 유지됩니다.</p>
     *
     * @param namespace 대상 네임스페이스
     * @param documents 삽입할 문서
     * @param bypassDocumentValidation validator 무시 여부
     */
    public void insertMany(Namespace namespace, List<BsonDocument> documents, boolean bypassDocumentValidation) {
        if (documents.isEmpty()) {
            return;
        }
        String ns = namespace.fullName();
        AtomicInteger next = new AtomicInteger();
        runRetryable(isRetry -> {
            while (next.get() < documents.size()) {
                try {
                    destination.insertMany(ns, documents.subList(next.get(), documents.size()), bypassDocumentValidation);
                    next.set(documents.size());
                } catch (RuntimeException e) {
                    if (!ErrorClassifier.isDuplicateKey(e)) {
                        throw e;
                    }
                    log.debug("Duplicate key inserting into {}, falling back to single inserts from {}", ns, next.get());
                    insertUntilFirstNew(ns, documents, next, bypassDocumentValidation);
                }
            }
        });
    }

    private void insertUntilFirstNew(String ns, List<BsonDocument> documents, AtomicInteger next,
                                     boolean bypassDocumentValidation) {
        while (next.get() < documents.size()) {
            BsonDocument document = documents.get(next.get());
            try {
                destination.insertOne(ns, document, bypassDocumentValidation);
                next.incrementAndGet();
                return;
            } catch (RuntimeException e) {
                if (!ErrorClassifier.isDuplicateKey(e)) {
                    throw e;
                }
                next.incrementAndGet();
            }
        }
    }

    // ========== Collection / Database DDL ==========

    /**
     * collection 생성.
     *
     * @param database 대상 database
     * @param createCommand {@code create} 명령 문서
     */
    public void create(String database, BsonDocument createCommand) {
        runRetryable(isRetry -> {
            try {
                commandRunner.runWithMajority(database, createCommand);
            } catch (RuntimeException e) {
                if (isRetry && ErrorClassifier.isNamespaceExists(e)) {
                    log.debug("Collection already created by a previous attempt: {}", createCommand);
                    return;
                }
                throw e;
            }
        });
    }

    /**
     * collection 삭제.
     *
     * <p>{@code system.js}는 직접 삭제할 수 없으므로 이름을 바꾼 뒤 삭제합니다.</p>
     *
     * @param namespace 삭제할 네임스페이스
     */
    public void drop(Namespace namespace) {
        if (SYSTEM_JS.equals(namespace.collection())) {
            renameAndDrop(namespace);
            return;
        }
        runRetryable(isRetry -> {
            try {
                commandRunner.runWithMajority(namespace.database(),
                    new BsonDocument("drop", new BsonString(namespace.collection())));
            } catch (RuntimeException e) {
                if (isRetry && ErrorClassifier.isNamespaceNotFound(e)) {
                    log.debug("Collection already dropped by a previous attempt: {}", namespace);
                    return;
                }
                throw e;
            }
        });
    }

    /**
     * 임시 이름으로 바꾼 뒤 삭제.
     *
     * @param namespace 삭제할 네임스페이스
     */
    public void renameAndDrop(Namespace namespace) {
        Namespace pending = namespace.sibling(DROP_PENDING_PREFIX + namespace.collection());
        BsonDocument rename = new BsonDocument("renameCollection", new BsonString(namespace.fullName()))
            .append("to", new BsonString(pending.fullName()));
        runRetryable(isRetry -> {
            try {
                commandRunner.runWithMajority(CommandRunner.ADMIN_DATABASE, rename);
            } catch (RuntimeException e) {
                if (isRetry && ErrorClassifier.isNamespaceNotFound(e)) {
                    return;
                }
                throw e;
            }
        });
        log.debug("Renamed {} to {} for dropping", namespace, pending);
        drop(pending);
    }

    public void dropDatabase(String database) {
        runRetryable(isRetry ->
            commandRunner.runWithMajority(database, new BsonDocument("dropDatabase", new BsonInt32(1))));
    }

    /**
     * collMod 실행.
     *
     * <p>3.6 미만 대상은 collMod에 write concern을 붙일 수 없으므로 실행 후 majority no-op으로 대기합니다.</p>
     *
     * @param namespace 대상 네임스페이스
     * @param collModCommand {@code collMod} 명령 문서
     * @param destinationInfo 대상 buildInfo
     */
    public void collMod(Namespace namespace, BsonDocument collModCommand, BuildInfo destinationInfo) {
        runRetryable(isRetry -> {
            if (destinationInfo.versionAtLeast(3, 6)) {
                commandRunner.runWithMajority(namespace.database(), collModCommand);
            } else {
                commandRunner.run(namespace.database(), collModCommand);
                commandRunner.waitForWriteConcernMajority();
            }
        });
    }

    // ========== 인덱스 ==========

    /**
     * 인덱스 일괄 생성.
     *
     * @param namespace 대상 네임스페이스
     * @param indexes 원본 인덱스 명세 (보정 후 전송)
     * @param destinationInfo 대상 buildInfo
     */
    public void createIndexes(Namespace namespace, List<BsonDocument> indexes, BuildInfo destinationInfo) {
        BsonDocument command = new BsonDocument("createIndexes", new BsonString(namespace.collection()))
            .append("indexes", new BsonArray(IndexSpecs.fixOutgoing(indexes)));
        runRetryable(isRetry -> {
            if (destinationInfo.versionAtLeast(3, 3, 5)) {
                commandRunner.runWithMajority(namespace.database(), command);
            } else {
                commandRunner.run(namespace.database(), command);
                commandRunner.waitForWriteConcernMajority();
            }
        });
    }

    /**
     * 인덱스 하나를 oplog entry로 생성.
     *
     * <p>collection UUID가 있으면 {@code createIndexes} 명령 entry를, 없으면
     * {@code system.indexes} 삽입 entry를 만들어 applyOps로 적용합니다.
     * applyOps는 createIndexes 명령이 거부하는 레거시 옵션도 받아들입니다.</p>
     *
     * @param namespace 대상 네임스페이스
     * @param index 원본 인덱스 명세
     * @param uuid collection UUID (없으면 null)
     */
    public void applyOpsCreateIndex(Namespace namespace, BsonDocument index, BsonBinary uuid) {
        BsonDocument spec = IndexSpecs.fixOutgoing(index);
        BsonDocument entry;
        if (uuid != null) {
            spec.remove("ns");
            BsonDocument object = new BsonDocument("createIndexes", new BsonString(namespace.collection()));
            for (Map.Entry<String, BsonValue> field : spec.entrySet()) {
                object.put(field.getKey(), field.getValue());
            }
            entry = new BsonDocument("op", new BsonString(Oplog.COMMAND))
                .append("ns", new BsonString(Namespace.command(namespace.database()).fullName()))
                .append("ui", uuid)
                .append("o", object);
        } else {
            spec.put("ns", new BsonString(namespace.fullName()));
            entry = new BsonDocument("op", new BsonString(Oplog.INSERT))
                .append("ns", new BsonString(namespace.sibling("system.indexes").fullName()))
                .append("o", spec);
        }
        applyOps(List.of(entry), false);
    }

    /**
     * 인덱스 생성 (fallback 포함).
     *
     * <p>일괄 생성이 invalid index specification option 또는 cannot create index로
     * 실패하면 인덱스마다 {@link #applyOpsCreateIndex}로 다시 생성합니다.</p>
     *
     * @param namespace 대상 네임스페이스
     * @param indexes 원본 인덱스 명세
     * @param destinationInfo 대상 buildInfo
     * @param uuid collection UUID (없으면 null)
     */
    public void createIndexesWithFallback(Namespace namespace, List<BsonDocument> indexes,
                                          BuildInfo destinationInfo, BsonBinary uuid) {
        try {
            createIndexes(namespace, indexes, destinationInfo);
        } catch (RuntimeException e) {
            if (!ErrorClassifier.isInvalidIndexSpecificationOption(e) && !ErrorClassifier.isCannotCreateIndex(e)) {
                throw e;
            }
            log.info("createIndexes on {} rejected ({}), applying {} index(es) one by one",
                namespace, e.getMessage(), indexes.size());
            for (BsonDocument index : indexes) {
                applyOpsCreateIndex(namespace, index, uuid);
            }
        }
    }

    // ========== applyOps / 조회 ==========

    /**
     * oplog entry 배치 적용 (재시도 포함).
     *
     * @param entries 적용할 entry
     * @param bypassDocumentValidation validator 무시 여부
     * @return 성공 응답
     * @see CommandRunner#applyOps(List, boolean)
     */
    public ApplyOpsResponse applyOps(List<BsonDocument> entries, boolean bypassDocumentValidation) {
        AtomicReference<ApplyOpsResponse> result = new AtomicReference<>();
        runRetryable(isRetry -> result.set(commandRunner.applyOps(entries, bypassDocumentValidation)));
        return result.get();
    }

    /**
     * collection 정보 조회 (재시도 포함).
     *
     * @param namespace 대상 네임스페이스
     * @return listCollections 결과 문서, 없으면 null
     */
    public BsonDocument collectionInfo(Namespace namespace) {
        AtomicReference<BsonDocument> result = new AtomicReference<>();
        runRetryable(isRetry -> result.set(commandRunner.collectionInfo(namespace)));
        return result.get();
    }

    public BuildInfo buildInfo() {
        AtomicReference<BuildInfo> result = new AtomicReference<>();
        runRetryable(isRetry -> result.set(commandRunner.buildInfo()));
        return result.get();
    }

    public void waitForWriteConcernMajority() {
        runRetryable(isRetry -> commandRunner.waitForWriteConcernMajority());
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
