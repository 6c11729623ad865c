package com.ryuqq.mirror.adapter.mongo;

import com.mongodb.WriteConcern;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.InsertManyOptions;
import com.mongodb.client.model.InsertOneOptions;
import com.ryuqq.mirror.core.model.Namespace;
import com.ryuqq.mirror.core.spi.Destination;
import org.bson.BsonDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.List;

/**
 * {@link Destination} backed by the MongoDB sync driver.
 *
 * <p>Commands go through {@code MongoDatabase.runCommand}, so an {@code ok: 0} reply
 * surfaces as {@link com.mongodb.MongoCommandException}. Inserts are ordered and use
 * majority write concern.</p>
 *
 * <p>Thread-safe: {@link MongoClient} is shared and pools its own connections.</p>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public class MongoDestination implements Destination, Closeable {

    private static final Logger log = LoggerFactory.getLogger(MongoDestination.class);

    private final MongoClient client;

    /**
     * Wraps an existing client. The destination takes ownership and closes it in {@link #close()}.
     *
     * @param client connected client
     * @throws IllegalArgumentException if client is null
     */
    public MongoDestination(MongoClient client) {
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        this.client = client;
    }

    /**
     * Opens a client from the given config.
     *
     * @param config connection settings
     * @return a new destination
     * @throws IllegalArgumentException if the config cannot be turned into client settings
     */
    public static MongoDestination create(MongoDestinationConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        MongoClient client = MongoClients.create(config.toClientSettings());
        log.info("Connected destination client (connectTimeout={}ms, socketTimeout={}ms)",
            config.connectTimeoutMs(), config.socketTimeoutMs());
        return new MongoDestination(client);
    }

    @Override
    public BsonDocument runCommand(String database, BsonDocument command) {
        return client.getDatabase(database).runCommand(command, BsonDocument.class);
    }

    @Override
    public void insertMany(String namespace, List<BsonDocument> documents, boolean bypassDocumentValidation) {
        collection(namespace).insertMany(documents,
            new InsertManyOptions().ordered(true).bypassDocumentValidation(bypassDocumentValidation));
    }

    @Override
    public void insertOne(String namespace, BsonDocument document, boolean bypassDocumentValidation) {
        collection(namespace).insertOne(document,
            new InsertOneOptions().bypassDocumentValidation(bypassDocumentValidation));
    }

    private MongoCollection<BsonDocument> collection(String namespace) {
        Namespace ns = Namespace.parse(namespace);
        if (ns.collection().isEmpty()) {
            throw new IllegalArgumentException("namespace has no collection: " + namespace);
        }
        return client.getDatabase(ns.database())
            .getCollection(ns.collection(), BsonDocument.class)
            .withWriteConcern(WriteConcern.MAJORITY);
    }

    @Override
    public void close() {
        log.debug("Closing destination client");
        client.close();
    }
}
