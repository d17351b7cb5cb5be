package org.drive.metadata;

/**
 * 已由上游认证层确认身份的调用主体。核心既不签发也不校验凭证。
 *
 * @param id    主体标识（不透明字符串）
 * @param email 邮箱（仅用于日志/展示）
 */
public record Principal(String id, String email) {

    /**
     * 校验调用主体存在且 id 非空，否则抛出 {@code UNAUTHORIZED}。
     */
    public static Principal requireAuthenticated(Principal principal) {
        if (principal == null || principal.id() == null || principal.id().isBlank()) {
            throw DriveException.unauthorized("缺少有效的调用主体");
        }
        return principal;
    }
}
