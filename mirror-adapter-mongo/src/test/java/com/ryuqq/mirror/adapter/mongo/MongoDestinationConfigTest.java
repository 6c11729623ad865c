package com.ryuqq.mirror.adapter.mongo;

import com.mongodb.MongoClientSettings;
import com.mongodb.WriteConcern;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * MongoDestinationConfig unit tests.
 *
 * @author Mirror Team
 * @since 1.0.0
 */
class MongoDestinationConfigTest {

    @Test
    void defaults_applyTimeoutsAndMajority() {
        // given
        MongoDestinationConfig config = new MongoDestinationConfig("mongodb://localhost:27017");

        // when
        MongoClientSettings settings = config.toClientSettings();

        // then
        assertThat(config.tlsAllowed()).isFalse();
        assertThat(settings.getSocketSettings().getConnectTimeout(TimeUnit.MILLISECONDS)).isEqualTo(10_000);
        assertThat(settings.getSocketSettings().getReadTimeout(TimeUnit.MILLISECONDS)).isZero();
        assertThat(settings.getWriteConcern()).isEqualTo(WriteConcern.MAJORITY);
    }

    @Test
    void tlsUri_withoutTlsSupport_isRejected() {
        // given
        MongoDestinationConfig config = new MongoDestinationConfig("mongodb://localhost:27017/?tls=true");

        // when & then
        assertThatThrownBy(config::toClientSettings)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("TLS");
    }

    @Test
    void tlsUri_withTlsSupport_isAccepted() {
        // given
        MongoDestinationConfig config = new MongoDestinationConfig("mongodb://localhost:27017/?ssl=true")
            .withTlsAllowed(true)
            .withConnectTimeoutMs(2_000)
            .withSocketTimeoutMs(30_000);

        // when
        MongoClientSettings settings = config.toClientSettings();

        // then
        assertThat(settings.getSslSettings().isEnabled()).isTrue();
        assertThat(settings.getSocketSettings().getReadTimeout(TimeUnit.MILLISECONDS)).isEqualTo(30_000);
        assertThat(settings.getSocketSettings().getConnectTimeout(TimeUnit.MILLISECONDS)).isEqualTo(2_000);
    }

    @Test
    void invalidValues_areRejected() {
        assertThatThrownBy(() -> new MongoDestinationConfig(" "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("connectionString cannot be null or blank");
        assertThatThrownBy(() -> new MongoDestinationConfig("mongodb://localhost", -1, 0, false))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("connectTimeoutMs must be non-negative");
        assertThatThrownBy(() -> new MongoDestinationConfig("mongodb://localhost", 0, -1, false))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void malformedUri_isRejected() {
        assertThatThrownBy(() -> new MongoDestinationConfig("http://localhost").toClientSettings())
            .isInstanceOf(IllegalArgumentException.class);
    }
}
