package com.ryuqq.mirror.core.spi;

import org.bson.BsonDocument;

import java.util.List;

/**
 * Destination deployment SPI.
 *
 * <p>This interface is the only seam between the replay logic and a live server.
 * The retry layer issues every command through it and classifies whatever the
 * implementation throws.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Running database commands and returning the raw reply</li>
 *   <li>Inserting documents with majority write concern</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Failures surface as driver exceptions ({@code com.mongodb.MongoException} subclasses)
 *       so that {@link com.ryuqq.mirror.core.error.ErrorClassifier} can classify them</li>
 *   <li>A reply with {@code ok: 0} is raised as an exception, never returned</li>
 *   <li>A reply that carries {@code writeConcernError} is returned as is; callers check it</li>
 *   <li>Thread-safe: methods may be called from multiple threads</li>
 * </ul>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public interface Destination {

    /**
     * Runs a command against a database.
     *
     * @param database target database name
     * @param command command document (first key is the command name)
     * @return the server reply
     * @throws com.mongodb.MongoException if the command fails or the server cannot be reached
     */
    BsonDocument runCommand(String database, BsonDocument command);

    /**
     * Inserts documents in order with majority write concern.
     *
     * <p>Stops at the first failing document, like an ordered bulk write.</p>
     *
     * @param namespace full namespace ({@code db.collection})
     * @param documents documents to insert
     * @param bypassDocumentValidation whether to skip collection validators
     * @throws com.mongodb.MongoBulkWriteException if a document is rejected
     */
    void insertMany(String namespace, List<BsonDocument> documents, boolean bypassDocumentValidation);

    /**
     * Inserts a single document with majority write concern.
     *
     * @param namespace full namespace ({@code db.collection})
     * @param document document to insert
     * @param bypassDocumentValidation whether to skip collection validators
     * @throws com.mongodb.MongoWriteException if the document is rejected
     */
    void insertOne(String namespace, BsonDocument document, boolean bypassDocumentValidation);
}
