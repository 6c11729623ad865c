/**
 * Service Provider Interfaces.
 *
 * <p>{@link com.ryuqq.mirror.core.spi.Destination} abstracts the destination deployment.
 * The MongoDB adapter implements it with the sync driver; the testkit ships an
 * in-memory fake for contract tests.</p>
 *
 * @since 1.0.0
 * @author Mirror Team
 */
package com.ryuqq.mirror.core.spi;
