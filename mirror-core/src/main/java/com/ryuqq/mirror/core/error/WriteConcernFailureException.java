package com.ryuqq.mirror.core.error;

/**
 * 명령 응답에 포함된 {@code writeConcernError}.
 *
 * <p>명령 자체는 ok:1로 성공했지만 majority 복제 확인에 실패한 경우입니다.
 * 항상 재연결 가능한 오류로 분류됩니다.</p>
 *
 * @author Mirror Team
 * @since 1.0.0
 */
public class WriteConcernFailureException extends RuntimeException {

    private final int code;
    private final String codeName;

    public WriteConcernFailureException(int code, String codeName, String message) {
        super(format(code, codeName, message));
        this.code = code;
        this.codeName = codeName == null ? "" : codeName;
    }

    private static String format(int code, String codeName, String message) {
        String text = String.format("WriteConcernError: %s, code: %d", message, code);
        if (codeName != null && !codeName.isEmpty()) {
            text += ", codeName: " + codeName;
        }
        return text;
    }

    public int getCode() {
        return code;
    }

    public String getCodeName() {
        return codeName;
    }
}
