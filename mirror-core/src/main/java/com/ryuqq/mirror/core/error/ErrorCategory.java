package com.ryuqq.mirror.core.error;

import java.util.function.Predicate;

/**
 * 오류 분류 결과.
 *
 * <p>선언 순서가 곧 {@link ErrorClassifier#classify(Throwable)}의 검사 순서입니다.
 * 재연결 가능 여부가 재시도 여부를 결정하므로 가장 먼저 검사합니다.</p>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public enum ErrorCategory {

    RECONNECTABLE(ErrorClassifier::isReconnectable),
    DUPLICATE_KEY(ErrorClassifier::isDuplicateKey),
    NAMESPACE_EXISTS(ErrorClassifier::isNamespaceExists),
    NAMESPACE_NOT_FOUND(ErrorClassifier::isNamespaceNotFound),
    INVALID_INDEX_SPECIFICATION_OPTION(ErrorClassifier::isInvalidIndexSpecificationOption),
    CANNOT_CREATE_INDEX(ErrorClassifier::isCannotCreateIndex),
    COMMAND_NOT_FOUND(ErrorClassifier::isCommandNotFound),
    CURSOR_NOT_FOUND(ErrorClassifier::isCursorNotFound),
    UNAUTHORIZED(ErrorClassifier::isUnauthorized),
    USER_NOT_FOUND(ErrorClassifier::isUserNotFound),
    VIEW(ErrorClassifier::isViewError),
    INVALID_OPTIONS(ErrorClassifier::isInvalidOptions),
    BAD_HINT(ErrorClassifier::isBadHint),
    UNCLASSIFIED(error -> true);

    private final Predicate<Throwable> predicate;

    ErrorCategory(Predicate<Throwable> predicate) {
        this.predicate = predicate;
    }

    boolean matches(Throwable error) {
        return predicate.test(error);
    }
}
