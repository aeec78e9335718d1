package com.guildverify.backend.session.model;

/**
 * Lifecycle of a verification session.
 * <p>
 * Transitions only move forward:
 * {@code AWAITING_START -> AWAITING_CODE -> VERIFIED | FAILED}.
 * Both terminal states stay in the store until the session expires.
 */
public enum SessionState {
    /** Created by the bot, waiting for the user to enter an email address. */
    AWAITING_START,
    /** Code was mailed, waiting for the user to type it. */
    AWAITING_CODE,
    VERIFIED,
    /** All attempts used up. */
    FAILED;

    public boolean isTerminal() {
        return this == VERIFIED || this == FAILED;
    }
}
