package org.drive.metadata;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 节点类型。
 */
public enum NodeKind {
    FILE("file"),
    FOLDER("folder");

    private final String wireName;

    NodeKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
