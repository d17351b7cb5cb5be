package org.drive.metadata;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 授权角色，按权限从高到低：owner > editor > viewer。
 * <p>
 * 同时用作“请求的权限级别”：读/分享需要 viewer，改名/移动需要 editor，授权管理需要 owner。
 */
public enum Role {
    VIEWER("viewer", 1),
    EDITOR("editor", 2),
    OWNER("owner", 3);

    private final String wireName;
    private final int rank;

    Role(String wireName, int rank) {
        this.wireName = wireName;
        this.rank = rank;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * 当前角色是否达到（或超过）要求的权限级别。
     */
    public boolean satisfies(Role required) {
        return rank >= required.rank;
    }

    /**
     * 解析角色名（不区分大小写）；不是 owner/editor/viewer 之一时抛出 {@code INVALID_INPUT}。
     */
    public static Role parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw DriveException.invalidInput("role 不能为空（owner/editor/viewer）");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Role role : values()) {
            if (role.wireName.equals(normalized)) {
                return role;
            }
        }
        throw DriveException.invalidInput("无效的 role：" + raw + "（只允许 owner/editor/viewer）");
    }
}
