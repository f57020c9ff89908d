package com.yamdb.backend.modules.policy.domain;

public enum Decision {
    ALLOW,
    DENY
}
