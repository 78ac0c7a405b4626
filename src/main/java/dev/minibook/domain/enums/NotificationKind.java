package dev.minibook.domain.enums;

public enum NotificationKind {
    MENTION("mention"),
    REPLY("reply"),
    STATUS_CHANGE("status_change");

    private final String wireName;

    NotificationKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
