package com.ryuqq.mirror.core.txn;

import com.ryuqq.mirror.core.error.OplogParseException;
import com.ryuqq.mirror.core.model.OpTime;
import com.ryuqq.mirror.core.model.Oplog;
import com.ryuqq.mirror.core.model.TxnId;
import org.bson.BsonDocument;
import org.bson.BsonValue;

import java.util.Set;

/**
 * oplog entry 트랜잭션 분류기.
 *
 * <p><strong>분류 규칙:</strong></p>
 * <ol>
 *   <li>op가 "c"이고 o의 첫 키가 applyOps, commitTransaction, abortTransaction 중 하나인
 *       경우에만 트랜잭션 후보입니다. 나머지는 모두 NON_TXN (retryable write 포함).</li>
 *   <li>lsid와 txnNumber가 모두 없으면 NON_TXN (레거시 applyOps 명령).</li>
 *   <li>둘 중 하나만 있으면 모호한 인코딩으로 보고 {@link OplogParseException}.</li>
 *   <li>applyOps에 partialTxn 또는 prepare가 있으면 최종 entry가 아님:
 *       역링크가 없으면 FIRST_OF_MULTI, 있으면 CONTINUATION.</li>
 *   <li>플래그 없는 applyOps는 역링크가 없으면 SINGLE (prevOpTime이 없는 4.0 형식 포함),
 *       있으면 FINAL_COMMIT.</li>
 *   <li>commitTransaction은 FINAL_COMMIT, abortTransaction은 FINAL_ABORT.</li>
 * </ol>
 *
 * <p>역링크는 prevOpTime이 존재하고 timestamp가 (0, 0)이 아닌 경우입니다.</p>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public final class TxnClassifier {

    static final String APPLY_OPS = "applyOps";
    static final String COMMIT_TRANSACTION = "commitTransaction";
    static final String ABORT_TRANSACTION = "abortTransaction";

    private static final Set<String> TXN_COMMANDS = Set.of(APPLY_OPS, COMMIT_TRANSACTION, ABORT_TRANSACTION);

    // Utility class - prevent instantiation
    private TxnClassifier() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 원본 문서를 파싱한 뒤 분류.
     *
     * @param raw oplog 문서
     * @return 분류 결과
     * @throws OplogParseException 문서를 디코딩할 수 없거나 트랜잭션 메타데이터가 모호한 경우
     */
    public static Meta classify(BsonDocument raw) {
        return classify(Oplog.fromBson(raw));
    }

    /**
     * oplog entry 분류.
     *
     * @param op oplog entry
     * @return 분류 결과 (트랜잭션이 아니면 {@link Meta#NON_TXN})
     * @throws IllegalArgumentException op가 null인 경우
     * @throws OplogParseException 트랜잭션 메타데이터가 모호한 경우
     */
    public static Meta classify(Oplog op) {
        if (op == null) {
            throw new IllegalArgumentException("op cannot be null");
        }
        if (!Oplog.COMMAND.equals(op.getOperation())) {
            return Meta.NON_TXN;
        }
        String command = op.commandName();
        if (command == null || !TXN_COMMANDS.contains(command)) {
            return Meta.NON_TXN;
        }

        boolean hasLsid = op.getLsid() != null;
        boolean hasTxnNumber = op.getTxnNumber() != null;
        if (!hasLsid && !hasTxnNumber) {
            return Meta.NON_TXN;
        }
        if (hasLsid != hasTxnNumber) {
            throw new OplogParseException(String.format(
                "ambiguous transaction metadata at %s: %s is present without %s",
                op.getTimestamp(), hasLsid ? "lsid" : "txnNumber", hasLsid ? "txnNumber" : "lsid"));
        }

        TxnId id;
        try {
            id = TxnId.of(op.getLsid(), op.getTxnNumber());
        } catch (IllegalArgumentException e) {
            throw new OplogParseException("invalid transaction id at " + op.getTimestamp() + ": " + e.getMessage(), e);
        }
        return Meta.of(id, roleOf(command, op));
    }

    private static TxnRole roleOf(String command, Oplog op) {
        switch (command) {
            case COMMIT_TRANSACTION:
                return TxnRole.FINAL_COMMIT;
            case ABORT_TRANSACTION:
                return TxnRole.FINAL_ABORT;
            default:
                break;
        }
        boolean backLink = hasBackLink(op.getPrevOpTime());
        if (isPartial(op.getObject())) {
            return backLink ? TxnRole.CONTINUATION : TxnRole.FIRST_OF_MULTI;
        }
        return backLink ? TxnRole.FINAL_COMMIT : TxnRole.SINGLE;
    }

    private static boolean hasBackLink(OpTime prevOpTime) {
        return prevOpTime != null && !prevOpTime.isZero();
    }

    private static boolean isPartial(BsonDocument object) {
        return isTrue(object.get("partialTxn")) || isTrue(object.get("prepare"));
    }

    private static boolean isTrue(BsonValue value) {
        if (value == null) {
            return false;
        }
        if (value.isBoolean()) {
            return value.asBoolean().getValue();
        }
        return value.isNumber() && value.asNumber().intValue() != 0;
    }
}
