package com.ryuqq.mirror.testkit.contract;

import org.bson.BsonArray;
import org.bson.BsonBinary;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonString;
import org.bson.BsonTimestamp;
import org.bson.BsonValue;

import java.util.UUID;

/**
 * Builders for oplog documents used by contract tests.
 *
 * <p>Top-level entries carry {@code ts} (seconds, increment 1), {@code t} and {@code h}.
 * Inner operations built with the {@code inner*} methods carry neither; they inherit the
 * enclosing entry's values when a transaction is streamed.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * OplogFixtures.Transaction txn = OplogFixtures.transaction(1, 1);
 * BsonDocument first = txn.partial(100, OplogFixtures.innerInsert("test.foo", doc(1)));
 * BsonDocument last = txn.commit(101, OplogFixtures.innerInsert("test.foo", doc(2)));
 * </pre>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public final class OplogFixtures {

    // Utility class - prevent instantiation
    private OplogFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static BsonDocument insert(int seconds, String namespace, BsonDocument document) {
        return entry(seconds, "i", namespace).append("o", document.clone());
    }

    public static BsonDocument update(int seconds, String namespace, BsonValue id, BsonDocument change) {
        return entry(seconds, "u", namespace)
            .append("o2", new BsonDocument("_id", id))
            .append("o", change.clone());
    }

    public static BsonDocument delete(int seconds, String namespace, BsonValue id) {
        return entry(seconds, "d", namespace).append("o", new BsonDocument("_id", id));
    }

    public static BsonDocument noop(int seconds) {
        return entry(seconds, "n", "").append("o", new BsonDocument("msg", new BsonString("periodic noop")));
    }

    /**
     * Builds a command entry on {@code database.$cmd}.
     *
     * @param seconds timestamp seconds
     * @param database database name
     * @param command command document
     * @return the oplog entry
     */
    public static BsonDocument command(int seconds, String database, BsonDocument command) {
        return entry(seconds, "c", database + ".$cmd").append("o", command.clone());
    }

    public static BsonDocument innerInsert(String namespace, BsonDocument document) {
        return new BsonDocument("op", new BsonString("i"))
            .append("ns", new BsonString(namespace))
            .append("o", document.clone());
    }

    public static BsonDocument innerUpdate(String namespace, BsonValue id, BsonDocument change) {
        return new BsonDocument("op", new BsonString("u"))
            .append("ns", new BsonString(namespace))
            .append("o2", new BsonDocument("_id", id))
            .append("o", change.clone());
    }

    public static BsonDocument innerDelete(String namespace, BsonValue id) {
        return new BsonDocument("op", new BsonString("d"))
            .append("ns", new BsonString(namespace))
            .append("o", new BsonDocument("_id", id));
    }

    /**
     * Starts a transaction builder.
     *
     * @param sessionSeed distinguishes session ids (same seed, same lsid)
     * @param txnNumber transaction number within the session
     * @return a builder that chains {@code prevOpTime} across its entries
     */
    public static Transaction transaction(long sessionSeed, long txnNumber) {
        return new Transaction(sessionSeed, txnNumber);
    }

    private static BsonDocument entry(int seconds, String op, String namespace) {
        return new BsonDocument("ts", new BsonTimestamp(seconds, 1))
            .append("t", new BsonInt64(1))
            .append("h", new BsonInt64(0))
            .append("v", new BsonInt32(2))
            .append("op", new BsonString(op))
            .append("ns", new BsonString(namespace));
    }

    /**
     * Builds the entries of one transaction in order.
     *
     * <p>Each call returns the next entry and records its timestamp as the back-link of the
     * following one. The first entry has a zero {@code prevOpTime}.</p>
     */
    public static final class Transaction {

        private final BsonDocument lsid;
        private final long txnNumber;
        private BsonTimestamp previous;

        private Transaction(long sessionSeed, long txnNumber) {
            this.lsid = new BsonDocument("id", new BsonBinary(new UUID(0, sessionSeed)))
                .append("uid", new BsonBinary(new byte[32]));
            this.txnNumber = txnNumber;
        }

        /**
         * Non-final applyOps entry ({@code partialTxn: true}).
         */
        public BsonDocument partial(int seconds, BsonDocument... ops) {
            return next(seconds, applyOps(ops).append("partialTxn", BsonBoolean.TRUE));
        }

        /**
         * Prepare entry ({@code prepare: true}), followed by commitTransaction or abortTransaction.
         */
        public BsonDocument prepare(int seconds, BsonDocument... ops) {
            return next(seconds, applyOps(ops).append("prepare", BsonBoolean.TRUE));
        }

        /**
         * Final applyOps entry. Without earlier entries this is a single-entry transaction.
         */
        public BsonDocument commit(int seconds, BsonDocument... ops) {
            return next(seconds, applyOps(ops));
        }

        public BsonDocument commitTransaction(int seconds) {
            return next(seconds, new BsonDocument("commitTransaction", new BsonInt32(1))
                .append("commitTimestamp", new BsonTimestamp(seconds, 0)));
        }

        public BsonDocument abortTransaction(int seconds) {
            return next(seconds, new BsonDocument("abortTransaction", new BsonInt32(1)));
        }

        private BsonDocument next(int seconds, BsonDocument object) {
            BsonDocument prevOpTime = previous == null
                ? new BsonDocument("ts", new BsonTimestamp(0, 0)).append("t", new BsonInt64(-1))
                : new BsonDocument("ts", previous).append("t", new BsonInt64(1));
            BsonDocument entry = entry(seconds, "c", "admin.$cmd")
                .append("lsid", lsid.clone())
                .append("txnNumber", new BsonInt64(txnNumber))
                .append("o", object)
                .append("prevOpTime", prevOpTime);
            previous = new BsonTimestamp(seconds, 1);
            return entry;
        }

        private static BsonDocument applyOps(BsonDocument... ops) {
            BsonArray array = new BsonArray();
            for (BsonDocument op : ops) {
                array.add(op.clone());
            }
            return new BsonDocument("applyOps", array);
        }
    }
}
