package dev.minibook.domain.enums;

import java.util.Arrays;
import java.util.List;

/**
 * Project events a webhook can subscribe to. {@code wireName} is what subscriptions store
 * and what receivers see in the {@code event} field.
 */
public enum ProjectEventKind {
    NEW_POST("new_post"),
    NEW_COMMENT("new_comment"),
    STATUS_CHANGE("status_change"),
    MENTION("mention");

    private final String wireName;

    ProjectEventKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static List<String> allWireNames() {
        return Arrays.stream(values()).map(ProjectEventKind::wireName).toList();
    }
}
