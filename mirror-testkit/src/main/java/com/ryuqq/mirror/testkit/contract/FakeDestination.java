package com.ryuqq.mirror.testkit.contract;

import com.mongodb.MongoBulkWriteException;
import com.mongodb.MongoCommandException;
import com.mongodb.MongoSocketReadException;
import com.mongodb.MongoWriteException;
import com.mongodb.ServerAddress;
import com.mongodb.WriteError;
import com.mongodb.bulk.BulkWriteError;
import com.mongodb.bulk.BulkWriteResult;
import com.ryuqq.mirror.core.model.Namespace;
import com.ryuqq.mirror.core.spi.Destination;
import org.bson.BsonArray;
import org.bson.BsonBinary;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonObjectId;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * In-memory implementation of {@link Destination} for testing purposes.
 *
 * <p>Keeps collections, indexes and collection options in maps and answers the subset of
 * server commands the replay layer issues: {@code isMaster}/{@code hello}, {@code buildInfo},
 * {@code create}, {@code drop}, {@code dropDatabase}, {@code renameCollection},
 * {@code collMod}, {@code createIndexes}, {@code listCollections} and {@code applyOps}.
 * Anything else fails with code 59 (command not found).</p>
 *
 * <p><strong>applyOps semantics:</strong></p>
 * <ul>
 *   <li>{@code i} and {@code u} are upserts, {@code d} removes by {@code _id}, {@code n} does nothing</li>
 *   <li>{@code c} entries run the embedded command (nested {@code applyOps} included)</li>
 *   <li>An insert into {@code db.system.indexes} creates the index named by its {@code ns} field</li>
 *   <li>The first failing entry stops the batch; the error reply carries {@code applied} and {@code results}</li>
 * </ul>
 *
 * <p><strong>Failure injection</strong> is keyed by command name ({@code "insert"} for the
 * insert methods) and consumed in FIFO order:</p>
 * <ul>
 *   <li>{@link #failNext(String, RuntimeException)}: throw without applying</li>
 *   <li>{@link #failAfterApplying(String, RuntimeException)}: apply, then throw (lost reply)</li>
 *   <li>{@link #writeConcernErrorNext(String)}: apply, then reply with a {@code writeConcernError}</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Updates support {@code $set}, {@code $unset} and full replacement only</li>
 *   <li>No query language: documents are addressed by {@code _id}</li>
 *   <li>Suitable for Contract Tests but not production use</li>
 * </ul>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public class FakeDestination implements Destination {

    private static final Logger log = LoggerFactory.getLogger(FakeDestination.class);

    public static final String INSERT = "insert";

    private static final ServerAddress ADDRESS = new ServerAddress("fake-destination", 27017);

    private final Map<String, Map<BsonValue, BsonDocument>> collections = new LinkedHashMap<>();
    private final Map<String, Map<String, BsonDocument>> indexes = new HashMap<>();
    private final Map<String, BsonDocument> options = new HashMap<>();
    private final Map<String, BsonBinary> uuids = new HashMap<>();

    private final Map<String, Deque<Injected>> injected = new HashMap<>();
    private final List<String> commandLog = new ArrayList<>();

    private List<Integer> versionArray = List.of(4, 2, 0, 0);
    private int rejectCreateIndexesCode;

    /**
     * Creates a new FakeDestination with no collections, reporting version 4.2.0.
     */
    public FakeDestination() {
    }

    // ========== Destination ==========

    /**
     * {@inheritDoc}
     */
    @Override
    public synchronized BsonDocument runCommand(String database, BsonDocument command) {
        if (database == null) {
            throw new IllegalArgumentException("database cannot be null");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command cannot be null or empty");
        }
        String name = command.getFirstKey();
        commandLog.add(name);
        Injected failure = nextInjected(name);
        if (failure != null && failure.kind == Kind.FAIL) {
            throw failure.error;
        }

        BsonDocument reply = execute(database, command);
        if (failure != null && failure.kind == Kind.FAIL_AFTER) {
            log.debug("Applied {} then failing with {}", name, failure.error.getClass().getSimpleName());
            throw failure.error;
        }
        if (failure != null && failure.kind == Kind.WRITE_CONCERN) {
            reply.put("writeConcernError", new BsonDocument("code", new BsonInt32(64))
                .append("codeName", new BsonString("WriteConcernFailed"))
                .append("errmsg", new BsonString("waiting for replication timed out")));
        }
        return reply;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public synchronized void insertMany(String namespace, List<BsonDocument> documents, boolean bypassDocumentValidation) {
        commandLog.add(INSERT);
        Injected failure = nextInjected(INSERT);
        if (failure != null && failure.kind == Kind.FAIL) {
            throw failure.error;
        }
        Map<BsonValue, BsonDocument> collection = collection(namespace);
        for (int i = 0; i < documents.size(); i++) {
            BsonDocument document = withId(documents.get(i));
            if (collection.containsKey(document.get("_id"))) {
                BulkWriteError error = new BulkWriteError(11000, duplicateMessage(namespace, document), new BsonDocument(), i);
                throw new MongoBulkWriteException(BulkWriteResult.unacknowledged(), List.of(error), null, ADDRESS, Set.of());
            }
            collection.put(document.get("_id"), document);
        }
        if (failure != null && failure.error != null) {
            throw failure.error;
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public synchronized void insertOne(String namespace, BsonDocument document, boolean bypassDocumentValidation) {
        commandLog.add(INSERT);
        Injected failure = nextInjected(INSERT);
        if (failure != null && failure.kind == Kind.FAIL) {
            throw failure.error;
        }
        Map<BsonValue, BsonDocument> collection = collection(namespace);
        BsonDocument copy = withId(document);
        if (collection.containsKey(copy.get("_id"))) {
            throw new MongoWriteException(
                new WriteError(11000, duplicateMessage(namespace, copy), new BsonDocument()), ADDRESS, Set.of());
        }
        collection.put(copy.get("_id"), copy);
        if (failure != null && failure.error != null) {
            throw failure.error;
        }
    }

    // ========== Command handling ==========

    private BsonDocument execute(String database, BsonDocument command) {
        String name = command.getFirstKey();
        switch (name) {
            case "isMaster":
            case "ismaster":
            case "hello":
                return ok().append("ismaster", BsonBoolean.TRUE);
            case "buildInfo":
                return buildInfoReply();
            case "create":
                create(new Namespace(database, command.getString("create").getValue()), command);
                return ok();
            case "drop":
                drop(new Namespace(database, command.getString("drop").getValue()));
                return ok();
            case "dropDatabase":
                dropDatabase(database);
                return ok();
            case "renameCollection":
                rename(command);
                return ok();
            case "collMod":
                collMod(new Namespace(database, command.getString("collMod").getValue()), command);
                return ok();
            case "createIndexes":
                createIndexes(new Namespace(database, command.getString("createIndexes").getValue()), command);
                return ok();
            case "listCollections":
                return listCollections(database, command);
            case "applyOps":
                return applyOps(command.getArray("applyOps"));
            default:
                throw commandError(59, "CommandNotFound", "no such command: '" + name + "'");
        }
    }

    private BsonDocument buildInfoReply() {
        BsonArray array = new BsonArray();
        StringBuilder version = new StringBuilder();
        for (int i = 0; i < versionArray.size(); i++) {
            array.add(new BsonInt32(versionArray.get(i)));
            if (i < 3) {
                version.append(i == 0 ? "" : ".").append(versionArray.get(i));
            }
        }
        return ok().append("version", new BsonString(version.toString()))
            .append("versionArray", array)
            .append("maxBsonObjectSize", new BsonInt32(16 * 1024 * 1024));
    }

    private void create(Namespace namespace, BsonDocument command) {
        String ns = namespace.fullName();
        if (collections.containsKey(ns)) {
            throw commandError(48, "NamespaceExists", "collection already exists: " + ns);
        }
        collections.put(ns, new LinkedHashMap<>());
        uuids.put(ns, new BsonBinary(UUID.randomUUID()));
        BsonDocument collectionOptions = command.clone();
        collectionOptions.remove("create");
        collectionOptions.remove("writeConcern");
        options.put(ns, collectionOptions);
    }

    private void drop(Namespace namespace) {
        String ns = namespace.fullName();
        if ("system.js".equals(namespace.collection())) {
            throw commandError(20, "IllegalOperation", "can't drop system collection " + ns);
        }
        if (!collections.containsKey(ns)) {
            throw commandError(26, "NamespaceNotFound", "ns not found");
        }
        removeCollection(ns);
    }

    private void dropDatabase(String database) {
        List<String> names = new ArrayList<>();
        for (String ns : collections.keySet()) {
            if (Namespace.parse(ns).database().equals(database)) {
                names.add(ns);
            }
        }
        for (String ns : names) {
            removeCollection(ns);
        }
    }

    private void rename(BsonDocument command) {
        String source = command.getString("renameCollection").getValue();
        String target = command.getString("to").getValue();
        boolean dropTarget = command.containsKey("dropTarget") && command.getBoolean("dropTarget").getValue();
        if (!collections.containsKey(source)) {
            throw commandError(26, "NamespaceNotFound", "source namespace does not exist");
        }
        if (collections.containsKey(target)) {
            if (!dropTarget) {
                throw commandError(48, "NamespaceExists", "target namespace exists");
            }
            removeCollection(target);
        }
        collections.put(target, collections.remove(source));
        indexes.put(target, indexes.remove(source));
        options.put(target, options.remove(source));
        uuids.put(target, uuids.remove(source));
    }

    private void collMod(Namespace namespace, BsonDocument command) {
        String ns = namespace.fullName();
        if (!collections.containsKey(ns)) {
            throw commandError(26, "NamespaceNotFound", "ns does not exist");
        }
        BsonDocument collectionOptions = options.computeIfAbsent(ns, k -> new BsonDocument());
        for (Map.Entry<String, BsonValue> entry : command.entrySet()) {
            if (!"collMod".equals(entry.getKey()) && !"writeConcern".equals(entry.getKey())) {
                collectionOptions.put(entry.getKey(), entry.getValue());
            }
        }
    }

    private void createIndexes(Namespace namespace, BsonDocument command) {
        if (rejectCreateIndexesCode != 0) {
            throw commandError(rejectCreateIndexesCode, "IndexRejected",
                "createIndexes rejected by destination (code " + rejectCreateIndexesCode + ")");
        }
        for (BsonValue spec : command.getArray("indexes")) {
            addIndex(namespace.fullName(), spec.asDocument());
        }
    }

    private void addIndex(String ns, BsonDocument spec) {
        collection(ns);
        BsonDocument copy = spec.clone();
        copy.remove("ns");
        indexes.computeIfAbsent(ns, k -> new LinkedHashMap<>()).put(copy.getString("name").getValue(), copy);
    }

    private BsonDocument listCollections(String database, BsonDocument command) {
        String nameFilter = null;
        if (command.containsKey("filter") && command.getDocument("filter").containsKey("name")) {
            nameFilter = command.getDocument("filter").getString("name").getValue();
        }
        BsonArray batch = new BsonArray();
        for (String ns : collections.keySet()) {
            Namespace parsed = Namespace.parse(ns);
            if (!parsed.database().equals(database)) {
                continue;
            }
            if (nameFilter != null && !nameFilter.equals(parsed.collection())) {
                continue;
            }
            batch.add(new BsonDocument("name", new BsonString(parsed.collection()))
                .append("type", new BsonString("collection"))
                .append("options", options.getOrDefault(ns, new BsonDocument()).clone())
                .append("info", new BsonDocument("uuid", uuids.get(ns))));
        }
        return ok().append("cursor", new BsonDocument("id", new BsonInt32(0))
            .append("ns", new BsonString(database + ".$cmd.listCollections"))
            .append("firstBatch", batch));
    }

    // ========== applyOps ==========

    private BsonDocument applyOps(BsonArray entries) {
        BsonArray results = new BsonArray();
        for (int i = 0; i < entries.size(); i++) {
            try {
                applyEntry(entries.get(i).asDocument());
                results.add(BsonBoolean.TRUE);
            } catch (MongoCommandException e) {
                results.add(BsonBoolean.FALSE);
                BsonDocument response = new BsonDocument("ok", new BsonInt32(0))
                    .append("errmsg", new BsonString(e.getErrorMessage()))
                    .append("code", new BsonInt32(e.getErrorCode()))
                    .append("codeName", new BsonString(e.getErrorCodeName()))
                    .append("applied", new BsonInt32(i))
                    .append("results", results);
                throw new MongoCommandException(response, ADDRESS);
            }
        }
        return ok().append("applied", new BsonInt32(entries.size())).append("results", results);
    }

    private void applyEntry(BsonDocument entry) {
        String op = entry.getString("op").getValue();
        String ns = entry.getString("ns").getValue();
        switch (op) {
            case "n":
                return;
            case "i":
                if (Namespace.parse(ns).collection().equals("system.indexes")) {
                    BsonDocument spec = entry.getDocument("o");
                    addIndex(spec.getString("ns").getValue(), spec);
                    return;
                }
                BsonDocument document = withId(entry.getDocument("o"));
                collection(ns).put(document.get("_id"), document);
                return;
            case "u":
                update(ns, entry.getDocument("o2").get("_id"), entry.getDocument("o"));
                return;
            case "d":
                collection(ns).remove(entry.getDocument("o").get("_id"));
                return;
            case "c":
                applyCommandEntry(Namespace.parse(ns).database(), entry.getDocument("o"));
                return;
            default:
                throw commandError(2, "BadValue", "invalid op type: " + op);
        }
    }

    private void applyCommandEntry(String database, BsonDocument object) {
        if ("createIndexes".equals(object.getFirstKey())) {
            BsonDocument spec = object.clone();
            String collection = spec.remove("createIndexes").asString().getValue();
            addIndex(new Namespace(database, collection).fullName(), spec);
            return;
        }
        execute(database, object);
    }

    private void update(String ns, BsonValue id, BsonDocument change) {
        Map<BsonValue, BsonDocument> collection = collection(ns);
        BsonDocument current = collection.get(id);
        BsonDocument updated;
        if (change.containsKey("$set") || change.containsKey("$unset")) {
            updated = current == null ? new BsonDocument("_id", id) : current.clone();
            if (change.containsKey("$set")) {
                for (Map.Entry<String, BsonValue> field : change.getDocument("$set").entrySet()) {
                    updated.put(field.getKey(), field.getValue());
                }
            }
            if (change.containsKey("$unset")) {
                for (String field : change.getDocument("$unset").keySet()) {
                    updated.remove(field);
                }
            }
        } else {
            updated = new BsonDocument("_id", id);
            for (Map.Entry<String, BsonValue> field : change.entrySet()) {
                if (!"_id".equals(field.getKey())) {
                    updated.put(field.getKey(), field.getValue());
                }
            }
        }
        collection.put(id, updated);
    }

    // ========== Failure injection / configuration ==========

    /**
     * Makes the next call of the named command throw {@code error} without applying it.
     *
     * @param commandName command name, or {@link #INSERT} for insert calls
     * @param error the error to throw
     */
    public synchronized void failNext(String commandName, RuntimeException error) {
        inject(commandName, new Injected(Kind.FAIL, error));
    }

    /**
     * Makes the next call of the named command apply its effect and then throw {@code error}.
     *
     * @param commandName command name, or {@link #INSERT} for insert calls
     * @param error the error to throw
     */
    public synchronized void failAfterApplying(String commandName, RuntimeException error) {
        inject(commandName, new Injected(Kind.FAIL_AFTER, error));
    }

    /**
     * Makes the next call of the named command apply its effect and reply with a write concern error.
     *
     * @param commandName command name
     */
    public synchronized void writeConcernErrorNext(String commandName) {
        inject(commandName, new Injected(Kind.WRITE_CONCERN, null));
    }

    /**
     * Makes every {@code createIndexes} command fail with the given code (0 disables).
     *
     * @param code server error code, e.g. 197 or 67
     */
    public synchronized void rejectCreateIndexesWith(int code) {
        this.rejectCreateIndexesCode = code;
    }

    /**
     * Sets the version reported by {@code buildInfo}.
     *
     * @param version version components, e.g. {@code 3, 4, 0}
     */
    public synchronized void setVersion(int... version) {
        List<Integer> array = new ArrayList<>();
        for (int part : version) {
            array.add(part);
        }
        while (array.size() < 4) {
            array.add(0);
        }
        this.versionArray = List.copyOf(array);
    }

    /**
     * Creates a reconnectable transport error.
     *
     * @return a socket read exception
     */
    public static MongoSocketReadException networkError() {
        return new MongoSocketReadException("connection reset by peer", ADDRESS);
    }

    /**
     * Creates a server command error.
     *
     * @param code server error code
     * @param codeName server error code name
     * @param message error message
     * @return the command exception the driver would raise
     */
    public static MongoCommandException commandError(int code, String codeName, String message) {
        BsonDocument response = new BsonDocument("ok", new BsonInt32(0))
            .append("errmsg", new BsonString(message))
            .append("code", new BsonInt32(code))
            .append("codeName", new BsonString(codeName));
        return new MongoCommandException(response, ADDRESS);
    }

    // ========== Inspection ==========

    public synchronized boolean exists(String namespace) {
        return collections.containsKey(namespace);
    }

    public synchronized List<BsonDocument> find(String namespace) {
        Map<BsonValue, BsonDocument> collection = collections.get(namespace);
        if (collection == null) {
            return List.of();
        }
        List<BsonDocument> copies = new ArrayList<>();
        for (BsonDocument document : collection.values()) {
            copies.add(document.clone());
        }
        return copies;
    }

    public synchronized BsonDocument findById(String namespace, BsonValue id) {
        Map<BsonValue, BsonDocument> collection = collections.get(namespace);
        BsonDocument document = collection == null ? null : collection.get(id);
        return document == null ? null : document.clone();
    }

    public synchronized int count(String namespace) {
        Map<BsonValue, BsonDocument> collection = collections.get(namespace);
        return collection == null ? 0 : collection.size();
    }

    public synchronized List<BsonDocument> indexes(String namespace) {
        Map<String, BsonDocument> specs = indexes.get(namespace);
        return specs == null ? List.of() : new ArrayList<>(specs.values());
    }

    public synchronized BsonDocument collectionOptions(String namespace) {
        BsonDocument collectionOptions = options.get(namespace);
        return collectionOptions == null ? null : collectionOptions.clone();
    }

    public synchronized BsonBinary uuid(String namespace) {
        return uuids.get(namespace);
    }

    /**
     * Returns the names of every command received, in order ({@link #INSERT} for insert calls).
     *
     * @return a copy of the command log
     */
    public synchronized List<String> commandLog() {
        return new ArrayList<>(commandLog);
    }

    public synchronized int commandCount(String commandName) {
        int count = 0;
        for (String name : commandLog) {
            if (name.equals(commandName)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Clears all stored data, injected failures and the command log.
     */
    public synchronized void clear() {
        collections.clear();
        indexes.clear();
        options.clear();
        uuids.clear();
        injected.clear();
        commandLog.clear();
        versionArray = List.of(4, 2, 0, 0);
        rejectCreateIndexesCode = 0;
    }

    // ========== Helpers ==========

    private Map<BsonValue, BsonDocument> collection(String ns) {
        return collections.computeIfAbsent(ns, k -> {
            uuids.put(k, new BsonBinary(UUID.randomUUID()));
            return new LinkedHashMap<>();
        });
    }

    private void removeCollection(String ns) {
        collections.remove(ns);
        indexes.remove(ns);
        options.remove(ns);
        uuids.remove(ns);
    }

    private void inject(String commandName, Injected injection) {
        if (commandName == null) {
            throw new IllegalArgumentException("commandName cannot be null");
        }
        injected.computeIfAbsent(commandName, k -> new ArrayDeque<>()).addLast(injection);
    }

    private Injected nextInjected(String commandName) {
        Deque<Injected> queue = injected.get(commandName);
        return queue == null ? null : queue.pollFirst();
    }

    private static BsonDocument withId(BsonDocument document) {
        BsonDocument copy = document.clone();
        if (!copy.containsKey("_id")) {
            BsonDocument ordered = new BsonDocument("_id", new BsonObjectId());
            ordered.putAll(copy);
            return ordered;
        }
        return copy;
    }

    private static String duplicateMessage(String namespace, BsonDocument document) {
        return "E11000 duplicate key error collection: " + namespace + " index: _id_ dup key: " + document.get("_id");
    }

    private static BsonDocument ok() {
        return new BsonDocument("ok", new BsonInt32(1));
    }

    private enum Kind {
        FAIL,
        FAIL_AFTER,
        WRITE_CONCERN
    }

    private static final class Injected {

        private final Kind kind;
        private final RuntimeException error;

        private Injected(Kind kind, RuntimeException error) {
            this.kind = kind;
            this.error = error;
        }
    }
}
