package com.guildverify.backend.session.model;

/**
 * Outcome of a code attempt. {@code remainingAttempts} is only meaningful for
 * {@link VerifyStatus#ATTEMPTS_REMAINING}; zero means the session has failed.
 */
public record VerifyResult(VerifyStatus status, int remainingAttempts) {

    private static final VerifyResult VERIFIED = new VerifyResult(VerifyStatus.VERIFIED, 0);
    private static final VerifyResult NOT_FOUND = new VerifyResult(VerifyStatus.NOT_FOUND, 0);

    public static VerifyResult verified() {
        return VERIFIED;
    }

    public static VerifyResult notFound() {
        return NOT_FOUND;
    }

    public static VerifyResult attemptsRemaining(int remaining) {
        return new VerifyResult(VerifyStatus.ATTEMPTS_REMAINING, remaining);
    }

    public boolean isVerified() {
        return status == VerifyStatus.VERIFIED;
    }

    public boolean isExhausted() {
        return status == VerifyStatus.ATTEMPTS_REMAINING && remainingAttempts == 0;
    }
}
