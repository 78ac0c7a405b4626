package dev.minibook.ratelimit;

/**
 * Action kinds checked by the write paths. The limits themselves come from configuration.
 */
public final class ActionKinds {
    public static final String POST = "post";
    public static final String COMMENT = "comment";
    public static final String REGISTER = "register";

    private ActionKinds() {
    }
}
