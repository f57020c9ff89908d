package com.yamdb.backend.modules.policy.application;

import com.yamdb.backend.global.error.ErrorKind;
import com.yamdb.backend.global.error.ProblemException;
import com.yamdb.backend.modules.policy.domain.Actor;
import com.yamdb.backend.modules.policy.domain.Decision;
import com.yamdb.backend.modules.policy.domain.PolicyAction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class PolicyEnforcer {

    private static final Logger log = LoggerFactory.getLogger(PolicyEnforcer.class);

    public void require(Actor actor, PolicyAction action) {
        require(actor, action, false);
    }

    public void require(Actor actor, PolicyAction action, boolean isOwner) {
        Actor effective = actor != null ? actor : Actor.anonymous();
        if (AuthorizationPolicy.decide(effective.role(), action, isOwner) == Decision.DENY) {
            log.debug("Denied {} for role={} owner={}", action, effective.role(), isOwner);
            throw new ProblemException(ErrorKind.FORBIDDEN, "forbidden", "Not allowed to perform " + action.name().toLowerCase());
        }
    }
}
