package me.golemcore.adminbot.domain.model;

/**
 * Verdict of the authorization guard. When denied, {@code missing} names the
 * first capability the requester lacks.
 */
public record AuthorizationDecision(boolean allowed, AdminCapability missing) {

    private static final AuthorizationDecision ALLOWED = new AuthorizationDecision(true, null);

    public static AuthorizationDecision allow() {
        return ALLOWED;
    }

    public static AuthorizationDecision deny(AdminCapability missing) {
        return new AuthorizationDecision(false, missing);
    }
}
