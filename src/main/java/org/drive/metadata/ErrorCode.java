package org.drive.metadata;

/**
 * 核心错误分类。
 * <p>
 * 外部存储（行存储/对象存储）抛出的异常都会在组件边界被转换为这里的某一类，再原样交给调用方。
 */
public enum ErrorCode {

    /**
     * 入参缺失或格式不合法（调用方错误，原样重试无意义）。
     */
    INVALID_INPUT(false),

    /**
     * 没有有效的调用主体。
     */
    UNAUTHORIZED(false),

    /**
     * 调用主体权限不足。
     */
    FORBIDDEN(false),

    /**
     * 目标节点/授权记录不存在，或不属于调用主体。
     */
    NOT_FOUND(false),

    /**
     * 路径冲突，或唯一约束冲突。
     */
    CONFLICT(false),

    /**
     * 外部调用超时（可由调用方重试）。
     */
    TIMEOUT(true),

    /**
     * 外部存储不可用（可由调用方重试）。
     */
    UNAVAILABLE(true),

    /**
     * 内部不变量被破坏（例如文件节点缺少 backingKey）。
     */
    INTERNAL(false);

    private final boolean retryable;

    ErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
