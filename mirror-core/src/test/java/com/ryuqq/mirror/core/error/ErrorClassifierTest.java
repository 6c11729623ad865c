package com.ryuqq.mirror.core.error;

import com.mongodb.MongoBulkWriteException;
import com.mongodb.MongoCommandException;
import com.mongodb.MongoException;
import com.mongodb.MongoSocketReadException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.MongoWriteConcernException;
import com.mongodb.MongoWriteException;
import com.mongodb.ServerAddress;
import com.mongodb.WriteError;
import com.mongodb.bulk.BulkWriteError;
import com.mongodb.bulk.BulkWriteResult;
import com.mongodb.bulk.WriteConcernError;
import com.ryuqq.mirror.core.model.ApplyOpsResponse;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.junit.jupiter.api.Test;

import java.io.EOFException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ErrorClassifier 테스트.
 *
 * @author Mirror Team
 * @since 1.0.0
 */
class ErrorClassifierTest {

    private static final ServerAddress ADDRESS = new ServerAddress();

    // ========== 코드 추출 ==========

    @Test
    void errorCode_CommandException_ReturnsCode() {
        assertEquals(10107, ErrorClassifier.errorCode(commandError(10107, "not master")));
    }

    @Test
    void errorCode_WriteException_ReturnsWriteErrorCode() {
        assertEquals(11000, ErrorClassifier.errorCode(writeError(11000)));
    }

    @Test
    void errorCode_WrappedException_FollowsCauseChain() {
        // Given
        RuntimeException wrapped = new RuntimeException("outer", new IllegalStateException("mid", commandError(48, "exists")));

        // When & Then
        assertEquals(48, ErrorClassifier.errorCode(wrapped));
    }

    @Test
    void errorCode_Unclassified_ReturnsZero() {
        assertEquals(0, ErrorClassifier.errorCode(new IllegalArgumentException("boom")));
        assertEquals(0, ErrorClassifier.errorCode(null));
    }

    @Test
    void errorCodes_BulkWrite_ReturnsAllCodesInOrder() {
        // Given
        MongoBulkWriteException bulk = bulkError(List.of(121, 11000), null);

        // When
        List<Integer> codes = ErrorClassifier.errorCodes(bulk);

        // Then
        assertEquals(List.of(121, 11000), codes);
        assertEquals(121, ErrorClassifier.errorCode(bulk));
    }

    // ========== 재연결 가능 여부 ==========

    @Test
    void isReconnectable_NotPrimaryCode_ReturnsTrue() {
        assertTrue(ErrorClassifier.isReconnectable(commandError(10107, "not master")));
        assertTrue(ErrorClassifier.isReconnectable(commandError(189, "stepped down")));
        assertTrue(ErrorClassifier.isReconnectable(commandError(11602, "interrupted")));
    }

    @Test
    void isReconnectable_NotMasterMessageWithoutCode_ReturnsTrue() {
        assertTrue(ErrorClassifier.isReconnectable(new MongoException("not master")));
        assertTrue(ErrorClassifier.isReconnectable(new RuntimeException("could not contact primary for replica set rs0")));
    }

    @Test
    void isReconnectable_CommandReplyWithoutCode_UsesMessage() {
        // Given
        MongoCommandException exception = new MongoCommandException(
            BsonDocument.parse("{ok: 0, errmsg: 'not master'}"), ADDRESS);

        // When & Then
        assertEquals(0, ErrorClassifier.errorCode(exception));
        assertEquals(List.of(), ErrorClassifier.errorCodes(exception));
        assertTrue(ErrorClassifier.isReconnectable(exception));
        assertEquals(ErrorCategory.RECONNECTABLE, ErrorClassifier.classify(exception));
    }

    @Test
    void errorCodes_ApplyOpsOverCommandReplyWithoutCode_ReturnsNoCodes() {
        // Given
        MongoCommandException cause = new MongoCommandException(
            BsonDocument.parse("{ok: 0, errmsg: 'not master'}"), ADDRESS);
        ApplyOpsException exception = new ApplyOpsException(
            new ApplyOpsResponse(false, "not master", 0, 0, List.of()), cause);

        // When & Then
        assertEquals(List.of(), ErrorClassifier.errorCodes(exception));
        assertTrue(ErrorClassifier.isReconnectable(exception));
    }

    @Test
    void isReconnectable_TransportFailures_ReturnsTrue() {
        assertTrue(ErrorClassifier.isReconnectable(new MongoSocketReadException("reset", ADDRESS)));
        assertTrue(ErrorClassifier.isReconnectable(new MongoTimeoutException("no server selected")));
        assertTrue(ErrorClassifier.isReconnectable(new RuntimeException(new SocketTimeoutException("read timed out"))));
        assertTrue(ErrorClassifier.isReconnectable(new EOFException()));
    }

    @Test
    void isReconnectable_WriteConcernErrors_ReturnsTrue() {
        assertTrue(ErrorClassifier.isReconnectable(new WriteConcernFailureException(100, "UnsatisfiableWriteConcern", "not enough")));
        assertTrue(ErrorClassifier.isReconnectable(new MongoWriteConcernException(
            new WriteConcernError(64, "WriteConcernFailed", "timed out", new BsonDocument()), null, ADDRESS)));
        assertTrue(ErrorClassifier.isReconnectable(bulkError(List.of(), new WriteConcernError(79, "UnknownReplWriteConcern", "x", new BsonDocument()))));
    }

    @Test
    void isReconnectable_TerminalErrors_ReturnsFalse() {
        assertFalse(ErrorClassifier.isReconnectable(writeError(11000)));
        assertFalse(ErrorClassifier.isReconnectable(commandError(48, "collection already exists")));
        assertFalse(ErrorClassifier.isReconnectable(commandError(2, "not master in name only")));
        assertFalse(ErrorClassifier.isReconnectable(new IllegalStateException("boom")));
        assertFalse(ErrorClassifier.isReconnectable(null));
    }

    @Test
    void isReconnectable_ApplyOpsFailureWithReconnectableCode_ReturnsTrue() {
        // Given
        ApplyOpsException exception = new ApplyOpsException(
            new ApplyOpsResponse(false, "not master", 10107, 0, List.of()), null);

        // When & Then
        assertTrue(ErrorClassifier.isReconnectable(exception));
    }

    // ========== 세부 범주 ==========

    @Test
    void isDuplicateKey_AnyBulkError_ReturnsTrue() {
        assertTrue(ErrorClassifier.isDuplicateKey(bulkError(List.of(121, 11000), null)));
        assertTrue(ErrorClassifier.isDuplicateKey(writeError(11001)));
        assertTrue(ErrorClassifier.isDuplicateKey(commandError(12582, "dup")));
        assertFalse(ErrorClassifier.isDuplicateKey(bulkError(List.of(121), null)));
    }

    @Test
    void predicates_KnownCodes_Match() {
        assertTrue(ErrorClassifier.isNamespaceExists(commandError(48, "exists")));
        assertTrue(ErrorClassifier.isNamespaceNotFound(commandError(26, "ns not found")));
        assertTrue(ErrorClassifier.isInvalidIndexSpecificationOption(commandError(197, "bad option")));
        assertTrue(ErrorClassifier.isCannotCreateIndex(commandError(67, "cannot create")));
        assertTrue(ErrorClassifier.isCommandNotFound(commandError(59, "no such command")));
        assertTrue(ErrorClassifier.isCommandNotFound(new MongoException("no such cmd: listIndexes")));
        assertTrue(ErrorClassifier.isCursorNotFound(commandError(43, "cursor id 1 not found")));
        assertTrue(ErrorClassifier.isUnauthorized(commandError(13, "unauthorized")));
        assertTrue(ErrorClassifier.isUserNotFound(commandError(11, "user not found")));
        assertTrue(ErrorClassifier.isViewError(commandError(166, "view")));
        assertTrue(ErrorClassifier.isInvalidOptions(commandError(72, "invalid")));
        assertTrue(ErrorClassifier.isBadHint(commandError(17007, "hint")));
        assertTrue(ErrorClassifier.isBadHint(commandError(2, "error processing query: bad hint")));
        assertFalse(ErrorClassifier.isBadHint(commandError(2, "bad value")));
    }

    @Test
    void classify_ReturnsFirstMatchingCategory() {
        assertEquals(ErrorCategory.RECONNECTABLE, ErrorClassifier.classify(commandError(91, "shutdown")));
        assertEquals(ErrorCategory.DUPLICATE_KEY, ErrorClassifier.classify(writeError(11000)));
        assertEquals(ErrorCategory.NAMESPACE_EXISTS, ErrorClassifier.classify(commandError(48, "exists")));
        assertEquals(ErrorCategory.COMMAND_NOT_FOUND, ErrorClassifier.classify(commandError(13390, "legacy")));
        assertEquals(ErrorCategory.UNCLASSIFIED, ErrorClassifier.classify(commandError(12345, "other")));
        assertEquals(ErrorCategory.UNCLASSIFIED, ErrorClassifier.classify(null));
    }

    @Test
    void writeConcernFailure_Message_IncludesCodeName() {
        // When
        WriteConcernFailureException exception = new WriteConcernFailureException(64, "WriteConcernFailed", "waiting timed out");

        // Then
        assertEquals("WriteConcernError: waiting timed out, code: 64, codeName: WriteConcernFailed", exception.getMessage());
        assertEquals("WriteConcernFailed", exception.getCodeName());
        assertEquals(64, ErrorClassifier.errorCode(exception));
    }

    // ========== Helpers ==========

    private static MongoCommandException commandError(int code, String message) {
        BsonDocument response = new BsonDocument("ok", new BsonInt32(0))
            .append("code", new BsonInt32(code))
            .append("errmsg", new BsonString(message));
        return new MongoCommandException(response, ADDRESS);
    }

    private static MongoWriteException writeError(int code) {
        return new MongoWriteException(new WriteError(code, "E" + code + " write error", new BsonDocument()), ADDRESS, Set.of());
    }

    private static MongoBulkWriteException bulkError(List<Integer> codes, WriteConcernError writeConcernError) {
        List<BulkWriteError> errors = new ArrayList<>();
        for (int i = 0; i < codes.size(); i++) {
            errors.add(new BulkWriteError(codes.get(i), "error " + codes.get(i), new BsonDocument(), i));
        }
        return new MongoBulkWriteException(BulkWriteResult.unacknowledged(), errors, writeConcernError, ADDRESS, Set.of());
    }
}
