/**
 * MongoDB sync driver adapter.
 *
 * <p>{@link com.ryuqq.mirror.adapter.mongo.MongoDestination} implements the
 * {@link com.ryuqq.mirror.core.spi.Destination} SPI against a live deployment, configured by
 * {@link com.ryuqq.mirror.adapter.mongo.MongoDestinationConfig}.</p>
 *
 * @since 1.0.0
 */
package com.ryuqq.mirror.adapter.mongo;
