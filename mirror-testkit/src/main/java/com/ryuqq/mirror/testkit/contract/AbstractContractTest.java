package com.ryuqq.mirror.testkit.contract;

import com.ryuqq.mirror.application.replay.OplogReplayer;
import com.ryuqq.mirror.application.replay.ReplayConfig;
import com.ryuqq.mirror.application.retry.RetryPolicy;
import com.ryuqq.mirror.application.retry.RetryableExecutor;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonValue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for Contract Tests.
 *
 * <p>Wires the replay stack against an in-memory destination so that scenarios exercise
 * the real classifier, buffer, executor and replayer together.</p>
 *
 * <p><strong>Test Infrastructure:</strong></p>
 * <ul>
 *   <li>FakeDestination: in-memory destination with failure injection</li>
 *   <li>RetryableExecutor: retries without sleeping ({@link #retryPolicy()})</li>
 *   <li>OplogReplayer: default batching ({@link #replayConfig()})</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractContractTest {
 *     {@literal @}Test
 *     void testScenario() {
 *         replayAll(List.of(OplogFixtures.insert(1, "test.foo", doc(1))));
 *
 *         assertDocumentIds("test.foo", 1);
 *     }
 * }
 * </pre>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public abstract class AbstractContractTest {

    protected FakeDestination destination;
    protected RetryableExecutor executor;
    protected OplogReplayer replayer;

    /**
     * Sets up test fixtures before each test.
     */
    @BeforeEach
    void setUp() {
        destination = new FakeDestination();
        executor = new RetryableExecutor(destination, retryPolicy());
        replayer = new OplogReplayer(executor, replayConfig());
    }

    /**
     * Clears all in-memory state to prevent test interference.
     */
    @AfterEach
    void tearDown() {
        if (destination != null) {
            destination.clear();
        }
    }

    /**
     * Retry policy for the executor: three retries, no minimum duration, no sleep.
     *
     * @return the policy
     */
    protected RetryPolicy retryPolicy() {
        return new RetryPolicy(3, 0, 0, 2);
    }

    protected ReplayConfig replayConfig() {
        return new ReplayConfig();
    }

    /**
     * Applies the entries in order and flushes the pending batch.
     *
     * @param entries oplog entries
     */
    protected void replayAll(List<BsonDocument> entries) {
        for (BsonDocument entry : entries) {
            replayer.apply(entry);
        }
        replayer.flush();
    }

    /**
     * Creates {@code {_id: id, x: id}}.
     *
     * @param id document id
     * @return a new document
     */
    protected static BsonDocument doc(int id) {
        return new BsonDocument("_id", new BsonInt32(id)).append("x", new BsonInt32(id));
    }

    /**
     * Asserts the collection holds exactly the given integer ids, in any order.
     *
     * @param namespace full namespace
     * @param ids expected ids
     */
    protected void assertDocumentIds(String namespace, int... ids) {
        List<Integer> expected = new ArrayList<>();
        for (int id : ids) {
            expected.add(id);
        }
        List<Integer> actual = new ArrayList<>();
        for (BsonDocument document : destination.find(namespace)) {
            actual.add(document.getInt32("_id").getValue());
        }
        Collections.sort(expected);
        Collections.sort(actual);
        assertEquals(expected, actual,
                String.format("Unexpected documents in %s", namespace));
    }

    /**
     * Asserts the stored document equals the expected one.
     *
     * @param namespace full namespace
     * @param expected expected document (its {@code _id} selects the stored one)
     */
    protected void assertDocument(String namespace, BsonDocument expected) {
        BsonValue id = expected.get("_id");
        BsonDocument actual = destination.findById(namespace, id);
        assertNotNull(actual, String.format("Expected document %s in %s", id, namespace));
        assertEquals(expected, actual);
    }

    protected void assertCollectionExists(String namespace) {
        assertTrue(destination.exists(namespace),
                String.format("Expected collection %s to exist", namespace));
    }

    protected void assertCollectionNotExists(String namespace) {
        assertFalse(destination.exists(namespace),
                String.format("Expected collection %s not to exist", namespace));
    }

    /**
     * Asserts the collection has exactly the named indexes, in any order.
     *
     * @param namespace full namespace
     * @param names expected index names
     */
    protected void assertIndexNames(String namespace, String... names) {
        List<String> expected = new ArrayList<>(List.of(names));
        List<String> actual = new ArrayList<>();
        for (BsonDocument spec : destination.indexes(namespace)) {
            actual.add(spec.getString("name").getValue());
        }
        Collections.sort(expected);
        Collections.sort(actual);
        assertEquals(expected, actual,
                String.format("Unexpected indexes on %s", namespace));
    }
}
