package com.guildverify.backend.session.model;

import java.time.Instant;

/**
 * Read-only snapshot of a stored session, detached from the persistence context.
 *
 * @param secondaryId       capability token bound to the session
 * @param userId            platform user id, primary key
 * @param guildId           guild the session was started in
 * @param displayName       label for logs
 * @param verificationCode  six digit code mailed to the user
 * @param createdAt         creation time, used for expiry
 * @param state             current lifecycle state
 * @param remainingAttempts wrong guesses left before the session fails
 */
public record VerificationSession(
        String secondaryId,
        long userId,
        long guildId,
        String displayName,
        String verificationCode,
        Instant createdAt,
        SessionState state,
        int remainingAttempts) {
}
