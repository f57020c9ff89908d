package com.yamdb.backend.modules.policy.application;

import com.yamdb.backend.modules.policy.domain.Decision;
import com.yamdb.backend.modules.policy.domain.PolicyAction;
import com.yamdb.backend.modules.policy.domain.Role;

/**
 * Pure role/action/ownership table. No I/O.
 */
public final class AuthorizationPolicy {

    private AuthorizationPolicy() {
    }

    public static Decision decide(Role role, PolicyAction action, boolean isOwner) {
        if (role == null || action == null) {
            return Decision.DENY;
        }
        // ownership is meaningless without an identity
        boolean owner = isOwner && role != Role.ANONYMOUS;
        return role.isAtLeast(action.minimumFor(owner)) ? Decision.ALLOW : Decision.DENY;
    }
}
