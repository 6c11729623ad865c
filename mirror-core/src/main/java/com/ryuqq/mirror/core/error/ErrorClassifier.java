package com.ryuqq.mirror.core.error;

import com.mongodb.MongoBulkWriteException;
import com.mongodb.MongoCommandException;
import com.mongodb.MongoException;
import com.mongodb.MongoServerException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.MongoWriteConcernException;
import com.mongodb.MongoWriteException;
import com.mongodb.bulk.BulkWriteError;

import java.io.EOFException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 드라이버 및 서버 오류 분류.
 *
 * <p>예외의 원인 체인을 따라가며 서버 오류 코드를 추출하고, 코드 또는 메시지로
 * 재연결 가능 여부와 세부 범주를 판정합니다.</p>
 *
 * <p><strong>코드 추출 우선순위:</strong></p>
 * <ol>
 *   <li>{@link WriteConcernFailureException}, {@link ApplyOpsException}</li>
 *   <li>{@link MongoWriteException} (단일 쓰기 오류)</li>
 *   <li>{@link MongoBulkWriteException} (쓰기 오류 목록, 이후 write concern 오류)</li>
 *   <li>{@link MongoWriteConcernException}</li>
 *   <li>{@link MongoCommandException}, 기타 {@link MongoServerException}</li>
 * </ol>
 *
 * <p>코드를 찾지 못하면 0을 반환하며, 이 경우 메시지 기반 판정만 적용됩니다.</p>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public final class ErrorClassifier {

    private static final String NETWORK_ERROR_LABEL = "NetworkError";

    private static final List<String> RECONNECTABLE_PHRASES = List.of(
        "not master",
        "not primary",
        "no reachable servers",
        "connection reset",
        "connection refused",
        "connection closed",
        "closed explicitly",
        "could not contact primary",
        "waiting for replication timed out",
        "write results unavailable from",
        "could not find host matching read preference",
        "unable to target"
    );

    // Utility class - prevent instantiation
    private ErrorClassifier() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 첫 번째 서버 오류 코드 추출.
     *
     * @param error 검사할 예외 (null 허용)
     * @return 오류 코드, 찾지 못하면 0
     */
    public static int errorCode(Throwable error) {
        for (Throwable current : causeChain(error)) {
            int code = directCode(current);
            if (code != 0) {
                return code;
            }
        }
        return 0;
    }

    /**
     * 모든 서버 오류 코드 추출.
     *
     * <p>bulk 쓰기 오류는 목록 순서대로 모두 포함됩니다.</p>
     *
     * @param error 검사할 예외 (null 허용)
     * @return 오류 코드 목록 (발견 순서)
     */
    public static List<Integer> errorCodes(Throwable error) {
        List<Integer> codes = new ArrayList<>();
        for (Throwable current : causeChain(error)) {
            if (current instanceof MongoBulkWriteException) {
                MongoBulkWriteException bulk = (MongoBulkWriteException) current;
                for (BulkWriteError writeError : bulk.getWriteErrors()) {
                    codes.add(writeError.getCode());
                }
                if (bulk.getWriteConcernError() != null) {
                    codes.add(bulk.getWriteConcernError().getCode());
                }
                continue;
            }
            int code = directCode(current);
            if (code != 0) {
                codes.add(code);
            }
        }
        return codes;
    }

    private static int directCode(Throwable error) {
        if (error instanceof WriteConcernFailureException) {
            return ((WriteConcernFailureException) error).getCode();
        }
        if (error instanceof ApplyOpsException) {
            return ((ApplyOpsException) error).getCode();
        }
        if (error instanceof MongoWriteException) {
            return ((MongoWriteException) error).getError().getCode();
        }
        if (error instanceof MongoBulkWriteException) {
            MongoBulkWriteException bulk = (MongoBulkWriteException) error;
            if (!bulk.getWriteErrors().isEmpty()) {
                return bulk.getWriteErrors().get(0).getCode();
            }
            if (bulk.getWriteConcernError() != null) {
                return bulk.getWriteConcernError().getCode();
            }
            return 0;
        }
        if (error instanceof MongoWriteConcernException) {
            return ((MongoWriteConcernException) error).getWriteConcernError().getCode();
        }
        if (error instanceof MongoCommandException) {
            return Math.max(((MongoCommandException) error).getErrorCode(), 0);
        }
        if (error instanceof MongoServerException) {
            return Math.max(((MongoServerException) error).getCode(), 0);
        }
        return 0;
    }

    /**
     * 세션 복구 후 재시도할 수 있는 오류인지 확인.
     *
     * <p>다음 중 하나라도 해당하면 true:</p>
     * <ul>
     *   <li>재연결 가능으로 표시된 {@link ServerErrorCode}</li>
     *   <li>모든 write concern 오류</li>
     *   <li>소켓, 타임아웃 등 전송 계층 오류</li>
     *   <li>코드가 없고 메시지에 알려진 문구가 포함된 경우 (예: "not master")</li>
     * </ul>
     *
     * @param error 검사할 예외 (null 허용)
     * @return 재연결 가능하면 true
     */
    public static boolean isReconnectable(Throwable error) {
        if (error == null) {
            return false;
        }
        for (Throwable current : causeChain(error)) {
            if (isWriteConcernError(current) || isTransportError(current)) {
                return true;
            }
        }
        int code = errorCode(error);
        if (code != 0) {
            return ServerErrorCode.of(code).map(ServerErrorCode::isReconnectable).orElse(false);
        }
        for (Throwable current : causeChain(error)) {
            if (containsPhrase(current)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isWriteConcernError(Throwable error) {
        if (error instanceof WriteConcernFailureException || error instanceof MongoWriteConcernException) {
            return true;
        }
        return error instanceof MongoBulkWriteException
            && ((MongoBulkWriteException) error).getWriteConcernError() != null;
    }

    private static boolean isTransportError(Throwable error) {
        if (error instanceof MongoSocketException
            || error instanceof MongoTimeoutException
            || error instanceof SocketException
            || error instanceof SocketTimeoutException
            || error instanceof EOFException) {
            return true;
        }
        return error instanceof MongoException && ((MongoException) error).hasErrorLabel(NETWORK_ERROR_LABEL);
    }

    private static boolean containsPhrase(Throwable error) {
        String message = lowerMessage(error);
        for (String phrase : RECONNECTABLE_PHRASES) {
            if (message.contains(phrase)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 중복 키 오류인지 확인.
     *
     * <p>bulk 쓰기 오류 목록 중 하나라도 중복 키 코드이면 true입니다.</p>
     *
     * @param error 검사할 예외
     * @return 중복 키 오류이면 true
     */
    public static boolean isDuplicateKey(Throwable error) {
        for (int code : errorCodes(error)) {
            if (ServerErrorCode.DUPLICATE_KEY.matches(code)
                || ServerErrorCode.DUPLICATE_KEY_ON_UPDATE.matches(code)
                || ServerErrorCode.DUPLICATE_KEY_LEGACY.matches(code)) {
                return true;
            }
        }
        return false;
    }

    public static boolean isNamespaceExists(Throwable error) {
        return ServerErrorCode.NAMESPACE_EXISTS.matches(errorCode(error));
    }

    public static boolean isNamespaceNotFound(Throwable error) {
        return ServerErrorCode.NAMESPACE_NOT_FOUND.matches(errorCode(error));
    }

    public static boolean isInvalidIndexSpecificationOption(Throwable error) {
        return ServerErrorCode.INVALID_INDEX_SPECIFICATION_OPTION.matches(errorCode(error));
    }

    public static boolean isCannotCreateIndex(Throwable error) {
        return ServerErrorCode.CANNOT_CREATE_INDEX.matches(errorCode(error));
    }

    public static boolean isCommandNotFound(Throwable error) {
        int code = errorCode(error);
        return ServerErrorCode.COMMAND_NOT_FOUND.matches(code)
            || ServerErrorCode.COMMAND_NOT_FOUND_LEGACY.matches(code)
            || anyMessageContains(error, "no such cmd");
    }

    public static boolean isCursorNotFound(Throwable error) {
        return ServerErrorCode.CURSOR_NOT_FOUND.matches(errorCode(error))
            || anyMessageContains(error, "cursor not found");
    }

    public static boolean isUnauthorized(Throwable error) {
        return ServerErrorCode.UNAUTHORIZED.matches(errorCode(error));
    }

    public static boolean isUserNotFound(Throwable error) {
        return ServerErrorCode.USER_NOT_FOUND.matches(errorCode(error));
    }

    public static boolean isViewError(Throwable error) {
        return ServerErrorCode.COMMAND_NOT_SUPPORTED_ON_VIEW.matches(errorCode(error));
    }

    public static boolean isInvalidOptions(Throwable error) {
        return ServerErrorCode.INVALID_OPTIONS.matches(errorCode(error));
    }

    public static boolean isBadHint(Throwable error) {
        int code = errorCode(error);
        return ServerErrorCode.BAD_HINT_LEGACY.matches(code)
            || (ServerErrorCode.BAD_VALUE.matches(code) && anyMessageContains(error, "bad hint"));
    }

    /**
     * 오류 범주 판정.
     *
     * @param error 검사할 예외
     * @return 처음으로 일치하는 범주, 없으면 {@link ErrorCategory#UNCLASSIFIED}
     */
    public static ErrorCategory classify(Throwable error) {
        if (error == null) {
            return ErrorCategory.UNCLASSIFIED;
        }
        for (ErrorCategory category : ErrorCategory.values()) {
            if (category.matches(error)) {
                return category;
            }
        }
        return ErrorCategory.UNCLASSIFIED;
    }

    private static boolean anyMessageContains(Throwable error, String phrase) {
        for (Throwable current : causeChain(error)) {
            if (lowerMessage(current).contains(phrase)) {
                return true;
            }
        }
        return false;
    }

    private static String lowerMessage(Throwable error) {
        String message = error.getMessage();
        return message == null ? "" : message.toLowerCase(Locale.ROOT);
    }

    private static List<Throwable> causeChain(Throwable error) {
        if (error == null) {
            return Collections.emptyList();
        }
        List<Throwable> chain = new ArrayList<>();
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = error;
        while (current != null && seen.add(current)) {
            chain.add(current);
            current = current.getCause();
        }
        return chain;
    }
}
