package org.drive.metadata;

import java.util.Objects;

/**
 * 元数据核心统一抛出的运行时异常，携带 {@link ErrorCode}。
 * <p>
 * 说明：核心不做自动重试；{@link #isRetryable()} 只是告诉调用方这类错误是否值得重试。
 */
public class DriveException extends RuntimeException {

    private final ErrorCode code;

    public DriveException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public DriveException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ErrorCode getCode() {
        return code;
    }

    public boolean isRetryable() {
        return code.isRetryable();
    }

    public static DriveException invalidInput(String message) {
        return new DriveException(ErrorCode.INVALID_INPUT, message);
    }

    public static DriveException unauthorized(String message) {
        return new DriveException(ErrorCode.UNAUTHORIZED, message);
    }

    public static DriveException forbidden(String message) {
        return new DriveException(ErrorCode.FORBIDDEN, message);
    }

    public static DriveException notFound(String message) {
        return new DriveException(ErrorCode.NOT_FOUND, message);
    }

    public static DriveException conflict(String message) {
        return new DriveException(ErrorCode.CONFLICT, message);
    }

    public static DriveException internal(String message) {
        return new DriveException(ErrorCode.INTERNAL, message);
    }

    @Override
    public String toString() {
        return "DriveException[" + code + "]: " + getMessage();
    }
}
