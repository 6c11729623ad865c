/**
 * Transaction reconstruction.
 *
 * <p>Classifies oplog entries ({@link com.ryuqq.mirror.core.txn.TxnClassifier}), buffers
 * multi-entry transactions by identity ({@link com.ryuqq.mirror.core.txn.TxnBuffer}) and
 * streams the reconstructed operations of committed transactions
 * ({@link com.ryuqq.mirror.core.txn.TxnStream}).</p>
 *
 * @since 1.0.0
 * @author Mirror Team
 */
package com.ryuqq.mirror.core.txn;
