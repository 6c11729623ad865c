/**
 * Error types and classification.
 *
 * <p>{@link com.ryuqq.mirror.core.error.ErrorClassifier} maps driver and server failures to
 * {@link com.ryuqq.mirror.core.error.ErrorCategory} values; the retry loop only re-attempts
 * {@link com.ryuqq.mirror.core.error.ErrorCategory#RECONNECTABLE} failures.</p>
 *
 * @since 1.0.0
 * @author Mirror Team
 */
package com.ryuqq.mirror.core.error;
