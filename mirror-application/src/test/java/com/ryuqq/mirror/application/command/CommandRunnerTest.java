package com.ryuqq.mirror.application.command;

import com.mongodb.MongoCommandException;
import com.mongodb.ServerAddress;
import com.ryuqq.mirror.core.error.ApplyOpsException;
import com.ryuqq.mirror.core.error.WriteConcernFailureException;
import com.ryuqq.mirror.core.model.ApplyOpsResponse;
import com.ryuqq.mirror.core.model.BuildInfo;
import com.ryuqq.mirror.core.model.Namespace;
import com.ryuqq.mirror.core.spi.Destination;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * CommandRunner 유닛 테스트.
 *
 * <ul>
 *   <li>applyOps 배치 조립 (no-op 추가 조건, bypass 플래그)</li>
 *   <li>ok:0 응답과 명령 예외의 ApplyOpsException 변환</li>
 *   <li>writeConcernError 검사</li>
 * </ul>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class CommandRunnerTest {

    private static final BsonDocument OK = BsonDocument.parse("{ok: 1}");

    @Mock
    private Destination destination;

    private CommandRunner runner;

    @BeforeEach
    void setUp() {
        runner = new CommandRunner(destination);
    }

    // ============================================================
    // 1. applyOps 배치 조립
    // ============================================================

    @Test
    void applyOps_entry_하나면_noop_없이_그대로_전송됨() {
        // given
        BsonDocument entry = insert(1);
        when(destination.runCommand(eq("admin"), any())).thenReturn(BsonDocument.parse("{ok: 1, applied: 1, results: [true]}"));

        // when
        ApplyOpsResponse response = runner.applyOps(List.of(entry), false);

        // then
        BsonDocument sent = captureCommand();
        assertThat(sent.getArray("applyOps")).containsExactly(entry);
        assertThat(sent.containsKey("bypassDocumentValidation")).isFalse();
        assertThat(sent.getDocument("writeConcern").getString("w").getValue()).isEqualTo("majority");
        assertThat(response.applied()).isEqualTo(1);
    }

    @Test
    void applyOps_entry_여러개면_마지막에_noop_명령이_추가됨() {
        // given
        when(destination.runCommand(eq("admin"), any())).thenReturn(OK);

        // when
        runner.applyOps(List.of(insert(1), insert(2)), true);

        // then
        BsonDocument sent = captureCommand();
        BsonArray ops = sent.getArray("applyOps");
        assertThat(ops).hasSize(3);
        assertThat(ops.get(2)).isEqualTo(CommandRunner.NOOP_BATCH_ENTRY);
        assertThat(sent.getBoolean("bypassDocumentValidation").getValue()).isTrue();
    }

    @Test
    void applyOps_빈_배치는_거부됨() {
        assertThatThrownBy(() -> runner.applyOps(List.of(), false))
            .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(destination);
    }

    // ============================================================
    // 2. 실패 응답
    // ============================================================

    @Test
    void applyOps_ok_0_응답이면_ApplyOpsException() {
        // given
        when(destination.runCommand(eq("admin"), any()))
            .thenReturn(BsonDocument.parse("{ok: 0, errmsg: 'bad', code: 2, applied: 2, results: [true, false]}"));

        // when & then
        assertThatThrownBy(() -> runner.applyOps(List.of(insert(1), insert(2)), false))
            .isInstanceOf(ApplyOpsException.class)
            .satisfies(e -> {
                ApplyOpsException exception = (ApplyOpsException) e;
                assertThat(exception.getCode()).isEqualTo(2);
                assertThat(exception.getResponse().firstFailedIndex()).hasValue(1);
            });
    }

    @Test
    void applyOps_명령_예외는_응답을_보존한_ApplyOpsException으로_변환됨() {
        // given
        BsonDocument reply = BsonDocument.parse("{ok: 0, errmsg: 'not master', code: 10107}");
        MongoCommandException cause = new MongoCommandException(reply, new ServerAddress());
        when(destination.runCommand(eq("admin"), any())).thenThrow(cause);

        // when & then
        assertThatThrownBy(() -> runner.applyOps(List.of(insert(1)), false))
            .isInstanceOf(ApplyOpsException.class)
            .hasCause(cause)
            .satisfies(e -> assertThat(((ApplyOpsException) e).getCode()).isEqualTo(10107));
    }

    @Test
    void runWithMajority_writeConcernError가_있으면_예외() {
        // given
        when(destination.runCommand(eq("test"), any())).thenReturn(BsonDocument.parse(
            "{ok: 1, writeConcernError: {code: 64, codeName: 'WriteConcernFailed', errmsg: 'waiting for replication timed out'}}"));

        // when & then
        assertThatThrownBy(() -> runner.runWithMajority("test", BsonDocument.parse("{create: 'foo'}")))
            .isInstanceOf(WriteConcernFailureException.class)
            .satisfies(e -> assertThat(((WriteConcernFailureException) e).getCode()).isEqualTo(64));
    }

    @Test
    void withMajority_원본_명령은_변경되지_않음() {
        // given
        BsonDocument command = BsonDocument.parse("{drop: 'foo'}");

        // when
        BsonDocument copy = CommandRunner.withMajority(command);

        // then
        assertThat(command.containsKey("writeConcern")).isFalse();
        assertThat(copy.getFirstKey()).isEqualTo("drop");
        assertThat(copy.containsKey("writeConcern")).isTrue();
    }

    // ============================================================
    // 3. 조회
    // ============================================================

    @Test
    void collectionInfo_firstBatch_첫_문서를_반환() {
        // given
        when(destination.runCommand(eq("test"), any())).thenReturn(BsonDocument.parse(
            "{ok: 1, cursor: {id: 0, ns: 'test.$cmd.listCollections', firstBatch: [{name: 'foo', type: 'collection'}]}}"));

        // when
        BsonDocument info = runner.collectionInfo(new Namespace("test", "foo"));

        // then
        assertThat(info.getString("name").getValue()).isEqualTo("foo");
        BsonDocument sent = captureCommand("test");
        assertThat(sent.getDocument("filter").getString("name").getValue()).isEqualTo("foo");
    }

    @Test
    void collectionInfo_결과가_없으면_null() {
        // given
        when(destination.runCommand(eq("test"), any()))
            .thenReturn(BsonDocument.parse("{ok: 1, cursor: {id: 0, firstBatch: []}}"));

        // when & then
        assertThat(runner.collectionInfo(new Namespace("test", "missing"))).isNull();
    }

    @Test
    void buildInfo_버전_배열을_파싱함() {
        // given
        when(destination.runCommand(eq("admin"), any()))
            .thenReturn(BsonDocument.parse("{ok: 1, version: '4.2.1', versionArray: [4, 2, 1, 0], maxBsonObjectSize: 16777216}"));

        // when
        BuildInfo info = runner.buildInfo();

        // then
        assertThat(info.versionAtLeast(4, 2)).isTrue();
        assertThat(info.versionAtLeast(4, 4)).isFalse();
    }

    // ============================================================
    // Helpers
    // ============================================================

    private BsonDocument captureCommand() {
        return captureCommand("admin");
    }

    private BsonDocument captureCommand(String database) {
        ArgumentCaptor<BsonDocument> captor = ArgumentCaptor.forClass(BsonDocument.class);
        verify(destination).runCommand(eq(database), captor.capture());
        return captor.getValue();
    }

    private static BsonDocument insert(int id) {
        return BsonDocument.parse("{ts: Timestamp(1, " + id + "), op: 'i', ns: 'test.foo', o: {_id: " + id + "}}");
    }
}
