/**
 * Oplog domain model.
 *
 * <p>Typed views over raw oplog documents and server replies: {@link com.ryuqq.mirror.core.model.Oplog},
 * {@link com.ryuqq.mirror.core.model.OpTime}, {@link com.ryuqq.mirror.core.model.TxnId},
 * {@link com.ryuqq.mirror.core.model.Namespace}, {@link com.ryuqq.mirror.core.model.BuildInfo} and
 * {@link com.ryuqq.mirror.core.model.ApplyOpsResponse}.</p>
 *
 * @since 1.0.0
 * @author Mirror Team
 */
package com.ryuqq.mirror.core.model;
