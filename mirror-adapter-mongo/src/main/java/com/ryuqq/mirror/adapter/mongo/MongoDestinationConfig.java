package com.ryuqq.mirror.adapter.mongo;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.WriteConcern;

import java.util.concurrent.TimeUnit;

/**
 * Connection settings for {@link MongoDestination} (immutable record).
 *
 * <p><strong>Settings:</strong></p>
 * <ul>
 *   <li>connectionString: destination URI (required)</li>
 *   <li>connectTimeoutMs: socket connect timeout (default 10000ms)</li>
 *   <li>socketTimeoutMs: socket read timeout, 0 for none (default 0)</li>
 *   <li>tlsAllowed: whether TLS connections may be opened (default false)</li>
 * </ul>
 *
 * <p>When {@code tlsAllowed} is false, a URI that asks for TLS ({@code tls=true},
 * {@code ssl=true} or an SRV URI) is rejected up front instead of failing on the first
 * command.</p>
 *
 * @author Mirror Team
 * @since 1.0.0
 * @param connectionString destination connection string
 * @param connectTimeoutMs connect timeout in milliseconds (must be non-negative)
 * @param socketTimeoutMs read timeout in milliseconds (must be non-negative)
 * @param tlsAllowed whether TLS is supported by this deployment
 */
public record MongoDestinationConfig(
    String connectionString,
    long connectTimeoutMs,
    long socketTimeoutMs,
    boolean tlsAllowed
) {

    /**
     * Creates a config with default timeouts and TLS disabled.
     *
     * @param connectionString destination connection string
     */
    public MongoDestinationConfig(String connectionString) {
        this(connectionString, 10_000, 0, false);
    }

    /**
     * Compact constructor (validation).
     *
     * @throws IllegalArgumentException if a parameter is invalid
     */
    public MongoDestinationConfig {
        if (connectionString == null || connectionString.isBlank()) {
            throw new IllegalArgumentException("connectionString cannot be null or blank");
        }
        if (connectTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "connectTimeoutMs must be non-negative (current: " + connectTimeoutMs + ")"
            );
        }
        if (socketTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "socketTimeoutMs must be non-negative (current: " + socketTimeoutMs + ")"
            );
        }
    }

    public MongoDestinationConfig withConnectTimeoutMs(long connectTimeoutMs) {
        return new MongoDestinationConfig(connectionString, connectTimeoutMs, socketTimeoutMs, tlsAllowed);
    }

    public MongoDestinationConfig withSocketTimeoutMs(long socketTimeoutMs) {
        return new MongoDestinationConfig(connectionString, connectTimeoutMs, socketTimeoutMs, tlsAllowed);
    }

    public MongoDestinationConfig withTlsAllowed(boolean tlsAllowed) {
        return new MongoDestinationConfig(connectionString, connectTimeoutMs, socketTimeoutMs, tlsAllowed);
    }

    /**
     * Builds driver settings from this config.
     *
     * @return client settings with majority write concern
     * @throws IllegalArgumentException if the URI is malformed, or asks for TLS while TLS is not allowed
     */
    public MongoClientSettings toClientSettings() {
        ConnectionString uri = new ConnectionString(connectionString);
        if (!tlsAllowed && Boolean.TRUE.equals(uri.getSslEnabled())) {
            throw new IllegalArgumentException(
                "TLS was requested by the connection string but is not supported by this deployment");
        }
        return MongoClientSettings.builder()
            .applyConnectionString(uri)
            .applyToSocketSettings(socket -> socket
                .connectTimeout((int) connectTimeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout((int) socketTimeoutMs, TimeUnit.MILLISECONDS))
            .writeConcern(WriteConcern.MAJORITY)
            .build();
    }
}
