package com.ryuqq.mirror.application.command;

import com.mongodb.MongoCommandException;
import com.ryuqq.mirror.core.error.ApplyOpsException;
import com.ryuqq.mirror.core.error.WriteConcernFailureException;
import com.ryuqq.mirror.core.model.ApplyOpsResponse;
import com.ryuqq.mirror.core.model.BuildInfo;
import com.ryuqq.mirror.core.model.Namespace;
import com.ryuqq.mirror.core.spi.Destination;
import org.bson.BsonArray;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 대상 서버 명령 실행기.
 *
 * <p>{@link Destination} 위에서 명령 한 번을 실행하며, 재시도는 하지 않습니다.
 * 재시도와 세션 복구는 {@code RetryableExecutor}가 이 클래스를 감싸서 수행합니다.</p>
 *
 * <p><strong>주요 책임:</strong></p>
 * <ul>
 *   <li>majority write concern 부착 및 응답의 writeConcernError 검사</li>
 *   <li>applyOps 배치 명령 조립 (다중 entry 배치에 no-op 추가)</li>
 *   <li>no-op 기반 majority 대기, isMaster 연결 확인</li>
 *   <li>buildInfo, listCollections 조회</li>
 * </ul>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public class CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

    public static final String ADMIN_DATABASE = "admin";

    /**
     * 다중 entry 배치를 비원자적으로 적용하도록 강제하는 dummy entry.
     */
    static final BsonDocument NOOP_BATCH_ENTRY = BsonDocument.parse(
        "{op: 'c', ns: 'noop.$cmd', o: {applyOps: [{op: 'n', ns: '', o: {msg: 'mirror noop'}}]}}");

    private static final BsonDocument NOOP_ENTRY = BsonDocument.parse(
        "{op: 'n', ns: '', o: {msg: 'mirror noop'}}");

    private final Destination destination;

    /**
     * CommandRunner 생성.
     *
     * @param destination 대상 서버
     * @throws IllegalArgumentException destination이 null인 경우
     */
    public CommandRunner(Destination destination) {
        if (destination == null) {
            throw new IllegalArgumentException("destination cannot be null");
        }
        this.destination = destination;
    }

    /**
     * 명령 실행.
     *
     * @param database 대상 database
     * @param command 명령 문서
     * @return 응답
     */
    public BsonDocument run(String database, BsonDocument command) {
        log.trace("Running {} on {}", commandName(command), database);
        return destination.runCommand(database, command);
    }

    /**
     * majority write concern으로 명령 실행.
     *
     * @param database 대상 database
     * @param command 명령 문서 (변경되지 않음)
     * @return 응답
     * @throws WriteConcernFailureException 응답에 writeConcernError가 포함된 경우
     */
    public BsonDocument runWithMajority(String database, BsonDocument command) {
        BsonDocument reply = run(database, withMajority(command));
        checkWriteConcern(reply);
        return reply;
    }

    /**
     * 명령 문서에 {@code writeConcern: {w: "majority"}}를 붙인 사본 생성.
     *
     * @param command 명령 문서
     * @return writeConcern이 포함된 새 문서
     */
    public static BsonDocument withMajority(BsonDocument command) {
        BsonDocument copy = command.clone();
        copy.put("writeConcern", new BsonDocument("w", new BsonString("majority")));
        return copy;
    }

    /**
     * 응답의 writeConcernError 검사.
     *
     * @param reply 명령 응답
     * @throws WriteConcernFailureException writeConcernError가 있는 경우
     */
    public static void checkWriteConcern(BsonDocument reply) {
        BsonValue value = reply.get("writeConcernError");
        if (value == null || !value.isDocument()) {
            return;
        }
        BsonDocument error = value.asDocument();
        int code = error.containsKey("code") && error.get("code").isNumber()
            ? error.getNumber("code").intValue()
            : 0;
        String codeName = error.containsKey("codeName") ? error.getString("codeName").getValue() : "";
        String message = error.containsKey("errmsg") ? error.getString("errmsg").getValue() : "";
        throw new WriteConcernFailureException(code, codeName, message);
    }

    /**
     * majority 복제 대기.
     *
     * <p>write concern을 지원하지 않는 명령 뒤에 no-op applyOps를 majority로 실행하여
     * 앞선 쓰기가 majority에 반영될 때까지 기다립니다.</p>
     */
    public void waitForWriteConcernMajority() {
        BsonDocument command = new BsonDocument("applyOps", new BsonArray(List.of(NOOP_ENTRY.clone())));
        runWithMajority(ADMIN_DATABASE, command);
    }

    /**
     * 연결 상태 확인용 isMaster 실행.
     *
     * @return isMaster 응답
     */
    public BsonDocument isMaster() {
        return run(ADMIN_DATABASE, new BsonDocument("isMaster", new BsonInt32(1)));
    }

    /**
     * oplog entry 배치 적용.
     *
     * <p>entry가 둘 이상이면 no-op 명령 entry를 덧붙여 서버가 배치를 비원자적으로 적용하도록 합니다.
     * entry 하나짜리 배치는 원자적으로 적용되므로 그대로 보냅니다.</p>
     *
     * @param entries 적용할 oplog entry (1개 이상)
     * @param bypassDocumentValidation validator 무시 여부
     * @return 성공 응답
     * @throws IllegalArgumentException entries가 null이거나 비어 있는 경우
     * @throws ApplyOpsException 서버가 ok:0으로 응답한 경우
     * @throws WriteConcernFailureException majority 확인에 실패한 경우
     */
    public ApplyOpsResponse applyOps(List<BsonDocument> entries, boolean bypassDocumentValidation) {
        if (entries == null || entries.isEmpty()) {
            throw new IllegalArgumentException("entries cannot be null or empty");
        }
        BsonArray ops = new BsonArray(entries);
        if (entries.size() > 1) {
            ops.add(NOOP_BATCH_ENTRY.clone());
        }
        BsonDocument command = new BsonDocument("applyOps", ops);
        if (bypassDocumentValidation) {
            command.put("bypassDocumentValidation", BsonBoolean.TRUE);
        }

        BsonDocument reply;
        try {
            reply = runWithMajority(ADMIN_DATABASE, command);
        } catch (MongoCommandException e) {
            throw new ApplyOpsException(ApplyOpsResponse.fromBson(e.getResponse()), e);
        }
        ApplyOpsResponse response = ApplyOpsResponse.fromBson(reply);
        if (!response.ok()) {
            throw new ApplyOpsException(response, null);
        }
        log.debug("Applied {} oplog entries", entries.size());
        return response;
    }

    public BuildInfo buildInfo() {
        return BuildInfo.fromBson(run(ADMIN_DATABASE, new BsonDocument("buildInfo", new BsonInt32(1))));
    }

    /**
     * collection 정보 조회.
     *
     * @param namespace 대상 네임스페이스
     * @return listCollections 결과 문서, 없으면 null
     */
    public BsonDocument collectionInfo(Namespace namespace) {
        BsonDocument command = new BsonDocument("listCollections", new BsonInt32(1))
            .append("filter", new BsonDocument("name", new BsonString(namespace.collection())));
        BsonDocument reply = run(namespace.database(), command);
        BsonValue cursor = reply.get("cursor");
        if (cursor == null || !cursor.isDocument()) {
            return null;
        }
        BsonValue batch = cursor.asDocument().get("firstBatch");
        if (batch == null || !batch.isArray() || batch.asArray().isEmpty()) {
            return null;
        }
        return batch.asArray().get(0).asDocument();
    }

    private static String commandName(BsonDocument command) {
        return command.isEmpty() ? "<empty>" : command.getFirstKey();
    }
}
