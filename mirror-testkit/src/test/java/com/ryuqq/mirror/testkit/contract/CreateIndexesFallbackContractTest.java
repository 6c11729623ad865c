package com.ryuqq.mirror.testkit.contract;

import com.ryuqq.mirror.core.model.BuildInfo;
import com.ryuqq.mirror.core.model.Namespace;
import org.bson.BsonBinary;
import org.bson.BsonDocument;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for index creation fallback.
 *
 * <p>When the destination rejects a batch {@code createIndexes} because of legacy options,
 * each index is re-created through applyOps, as a {@code createIndexes} command entry when
 * the collection UUID is known and as a {@code system.indexes} insert otherwise.</p>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
class CreateIndexesFallbackContractTest extends AbstractContractTest {

    private static final Namespace FOO = Namespace.parse("test.foo");

    private static final List<BsonDocument> INDEXES = List.of(
        BsonDocument.parse("{v: 1, key: {a: 1}, name: 'a_1', ns: 'test.foo', background: true}"),
        BsonDocument.parse("{v: 1, key: {b: 0}, name: 'b_1', ns: 'test.foo'}"));

    @Test
    void testCreateIndexes_Accepted_NoFallback() {
        // Given
        executor.create("test", BsonDocument.parse("{create: 'foo'}"));

        // When
        executor.createIndexesWithFallback(FOO, INDEXES, executor.buildInfo(), null);

        // Then
        assertIndexNames("test.foo", "a_1", "b_1");
        assertEquals(0, destination.commandCount("applyOps"), "No fallback expected");
        BsonDocument b = destination.indexes("test.foo").get(1);
        assertEquals(1, b.getDocument("key").getInt32("b").getValue(), "Legacy key value should be fixed");
        assertFalse(destination.indexes("test.foo").get(0).containsKey("background"));
    }

    @Test
    void testInvalidIndexSpecificationOption_WithUuid_AppliedAsCommandEntries() {
        // Given
        executor.create("test", BsonDocument.parse("{create: 'foo'}"));
        BsonBinary uuid = destination.uuid("test.foo");
        destination.rejectCreateIndexesWith(197);

        // When
        executor.createIndexesWithFallback(FOO, INDEXES, executor.buildInfo(), uuid);

        // Then
        assertIndexNames("test.foo", "a_1", "b_1");
        assertEquals(INDEXES.size(), destination.commandCount("applyOps"), "One applyOps per index");
    }

    @Test
    void testCannotCreateIndex_WithoutUuid_AppliedAsSystemIndexesInserts() {
        // Given
        destination.rejectCreateIndexesWith(67);

        // When
        executor.createIndexesWithFallback(FOO, INDEXES, executor.buildInfo(), null);

        // Then
        assertIndexNames("test.foo", "a_1", "b_1");
        assertCollectionNotExists("test.system.indexes");
    }

    @Test
    void testOtherRejection_Propagated() {
        // Given
        destination.rejectCreateIndexesWith(72);

        // When & Then
        assertThrows(RuntimeException.class,
            () -> executor.createIndexesWithFallback(FOO, INDEXES, executor.buildInfo(), null));
        assertIndexNames("test.foo");
    }

    @Test
    void testOldDestination_WaitsForMajorityAfterCreateIndexes() {
        // Given
        destination.setVersion(3, 2, 0);
        BuildInfo info = executor.buildInfo();

        // When
        executor.createIndexes(FOO, INDEXES, info);

        // Then
        assertIndexNames("test.foo", "a_1", "b_1");
        assertEquals(List.of("buildInfo", "createIndexes", "applyOps"), destination.commandLog(),
            "Old servers need a majority no-op after createIndexes");
    }
}
