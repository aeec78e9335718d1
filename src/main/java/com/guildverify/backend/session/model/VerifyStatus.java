package com.guildverify.backend.session.model;

public enum VerifyStatus {
    VERIFIED,
    ATTEMPTS_REMAINING,
    NOT_FOUND
}
