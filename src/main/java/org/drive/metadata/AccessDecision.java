package org.drive.metadata;

/**
 * 授权判定结果。
 */
public enum AccessDecision {
    ALLOW,
    DENY;

    public boolean isAllowed() {
        return this == ALLOW;
    }
}
