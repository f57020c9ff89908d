package com.yamdb.backend.modules.policy.domain;

/**
 * Action classes checked before any state change. Each carries the minimum role an owner needs
 * and the minimum role anyone else needs.
 */
public enum PolicyAction {
    READ(Role.ANONYMOUS, Role.ANONYMOUS),
    CREATE_CONTENT(Role.USER, Role.USER),
    MODIFY_CONTENT(Role.USER, Role.MODERATOR),
    MANAGE_CATALOG(Role.ADMIN, Role.ADMIN),
    CHANGE_ROLE(Role.ADMIN, Role.ADMIN),
    MANAGE_USERS(Role.ADMIN, Role.ADMIN),
    MANAGE_OWN_PROFILE(Role.USER, Role.USER);

    private final Role minimumForOwner;
    private final Role minimumForOthers;

    PolicyAction(Role minimumForOwner, Role minimumForOthers) {
        this.minimumForOwner = minimumForOwner;
        this.minimumForOthers = minimumForOthers;
    }

    public Role minimumFor(boolean isOwner) {
        return isOwner ? minimumForOwner : minimumForOthers;
    }
}
