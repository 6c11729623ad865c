package com.ryuqq.mirror.core.model;

import com.ryuqq.mirror.core.OplogEntriesFixture;
import com.ryuqq.mirror.core.error.OplogParseException;
import org.bson.BsonDocument;
import org.bson.BsonTimestamp;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Oplog 테스트.
 *
 * @author Mirror Team
 * @since 1.0.0
 */
class OplogTest {

    @Test
    void fromBson_CrudEntry_ParsesFields() {
        // When
        Oplog op = OplogEntriesFixture.ops("not transaction").get(0);

        // Then
        assertEquals(new BsonTimestamp(100, 1), op.getTimestamp());
        assertEquals(1L, op.getTerm());
        assertEquals(Oplog.INSERT, op.getOperation());
        assertEquals("test.foo", op.getNamespace());
        assertNotNull(op.getUuid());
        assertNull(op.getLsid());
        assertNull(op.getTxnNumber());
        assertNull(op.getPrevOpTime());
        assertNull(op.commandName());
        assertTrue(op.embeddedOps().isEmpty());
    }

    @Test
    void fromBson_TransactionEntry_ParsesSessionFields() {
        // When
        Oplog op = OplogEntriesFixture.ops("large, unprepared").get(1);

        // Then
        assertEquals("applyOps", op.commandName());
        assertNotNull(op.getLsid());
        assertEquals(1L, op.getTxnNumber());
        assertEquals(new BsonTimestamp(3000, 1), op.getPrevOpTime().timestamp());
        assertFalse(op.getPrevOpTime().isZero());
    }

    @Test
    void fromBson_ZeroPrevOpTime_IsZero() {
        // When
        Oplog op = OplogEntriesFixture.ops("small, unprepared").get(0);

        // Then
        assertTrue(op.getPrevOpTime().isZero());
        assertEquals(-1L, op.getPrevOpTime().term());
    }

    @Test
    void fromBson_MissingRequiredField_ThrowsException() {
        // Given
        BsonDocument noNamespace = BsonDocument.parse("{ts: {$timestamp: {t: 1, i: 1}}, op: 'i', o: {_id: 1}}");

        // When & Then
        OplogParseException exception = assertThrows(OplogParseException.class, () -> Oplog.fromBson(noNamespace));
        assertTrue(exception.getMessage().contains("'ns'"));
        assertThrows(OplogParseException.class, () -> Oplog.fromBson(null));
    }

    @Test
    void fromBson_WrongFieldType_ThrowsException() {
        // Given
        BsonDocument badOp = BsonDocument.parse("{ts: {$timestamp: {t: 1, i: 1}}, op: 1, ns: 'test.foo', o: {_id: 1}}");

        // When & Then
        assertThrows(OplogParseException.class, () -> Oplog.fromBson(badOp));
    }

    @Test
    void embeddedOps_InheritTimestampFromOuterEntry() {
        // Given
        Oplog outer = OplogEntriesFixture.ops("small, unprepared, 4.0").get(0);

        // When
        List<Oplog> inner = outer.embeddedOps();

        // Then
        assertEquals(3, inner.size());
        for (Oplog op : inner) {
            assertEquals(outer.getTimestamp(), op.getTimestamp());
            assertEquals(outer.getTerm(), op.getTerm());
            assertEquals("test.foo", op.getNamespace());
        }
    }

    @Test
    void embeddedOps_NonArrayPayload_ThrowsException() {
        // Given
        Oplog corrupt = OplogEntriesFixture.ops("corrupt continuation").get(1);

        // When & Then
        assertThrows(OplogParseException.class, corrupt::embeddedOps);
    }

    @Test
    void sizeBytes_MatchesEncodedLength() {
        // Given
        Oplog op = OplogEntriesFixture.ops("not transaction").get(0);

        // When
        int size = op.sizeBytes();

        // Then
        assertTrue(size > 0);
        assertEquals(size, op.sizeBytes());
    }
}
