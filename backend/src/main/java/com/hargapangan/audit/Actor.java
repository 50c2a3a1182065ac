package com.hargapangan.audit;

/**
 * Caller identity as set by the gateway headers. Elevated callers (ADMIN) bypass override approval.
 */
public record Actor(String id, Role role, String ipAddress, String userAgent) {

    public enum Role {
        ADMIN, EDITOR, VIEWER;

        public static Role fromHeader(String value) {
            if (value == null || value.isBlank()) {
                return VIEWER;
            }
            for (Role r : values()) {
                if (r.name().equalsIgnoreCase(value.strip())) {
                    return r;
                }
            }
            return VIEWER;
        }
    }

    public boolean isElevated() {
        return role == Role.ADMIN;
    }

    public boolean canEdit() {
        return role == Role.ADMIN || role == Role.EDITOR;
    }

    public static Actor system() {
        return new Actor(AuditActions.SYSTEM_ACTOR, Role.ADMIN, null, null);
    }
}
