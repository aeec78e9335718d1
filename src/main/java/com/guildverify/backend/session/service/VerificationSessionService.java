package com.guildverify.backend.session.service;

import com.guildverify.backend.session.config.SessionProperties;
import com.guildverify.backend.session.entity.VerificationSessionEntity;
import com.guildverify.backend.session.model.SessionState;
import com.guildverify.backend.session.model.VerificationSession;
import com.guildverify.backend.session.model.VerifyResult;
import com.guildverify.backend.session.repo.VerificationSessionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Owns the verification session state machine.
 * <p>
 * Every mutation touches exactly one row and runs in its own short transaction:
 * the row is read under a pessimistic write lock and written back with an
 * optimistic version check, so two writers for the same user are serialized
 * while writers for different users never wait on each other. Conflicts are
 * retried a bounded number of times.
 * <p>
 * Sweeps ({@link #collectGarbage()}, {@link #listVerifiedSessions()}) snapshot
 * the keys first and then visit each row on its own; a row that disappears in
 * between is skipped.
 */
@Slf4j
@Service
public class VerificationSessionService {

    /** Code of the synthetic session used for manual end-to-end checks; never matches a real code. */
    public static final String TESTING_VERIFICATION_CODE = "-420";
    public static final long TESTING_USER_ID = 0L;
    public static final String TESTING_SECONDARY_ID = "8ab14a16-9168-4d44-95d7-605ef23583f8";
    private static final String TESTING_DISPLAY_NAME = "Testing#123";

    private static final SecureRandom RANDOM = new SecureRandom();

    private final VerificationSessionRepository repo;
    private final SessionProperties props;
    private final Clock clock;
    private final TransactionTemplate tx;

    public VerificationSessionService(VerificationSessionRepository repo,
                                      SessionProperties props,
                                      Clock clock,
                                      PlatformTransactionManager txManager) {
        this.repo = repo;
        this.props = props;
        this.clock = clock;
        this.tx = new TransactionTemplate(txManager);
        this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Starts a session for the user, or returns the secondary id of the one that
     * already exists. An existing session is never touched, so asking again does
     * not mint a fresh code.
     */
    public String createOrGet(long userId, long guildId, String displayName) {
        try {
            return withConflictRetry("createOrGet", userId, () -> tx.execute(status -> {
                Optional<VerificationSessionEntity> existing = repo.findById(userId);
                if (existing.isPresent()) {
                    return existing.get().getSecondaryId();
                }
                VerificationSessionEntity created = newSession(
                        userId, guildId, displayName, UUID.randomUUID().toString(), generateCode());
                repo.saveAndFlush(created);
                log.info("started new session for ({}, {}) guildId={}", displayName, userId, guildId);
                return created.getSecondaryId();
            }));
        } catch (DataIntegrityViolationException e) {
            // lost an insert race: the winner's row is the session
            return repo.findById(userId)
                    .map(VerificationSessionEntity::getSecondaryId)
                    .orElseThrow(() -> e);
        }
    }

    public Optional<VerificationSession> lookup(long userId, String secondaryId) {
        return repo.findById(userId)
                .filter(s -> capabilityMatches(s, secondaryId))
                .map(VerificationSessionEntity::toSnapshot);
    }

    /**
     * Records that the code was mailed. Returns {@code false} when the session is
     * gone, which happens if it expired between the caller's lookup and this call.
     */
    public boolean markEmailSent(long userId, String secondaryId) {
        Boolean found = withConflictRetry("markEmailSent", userId, () -> tx.execute(status -> {
            Optional<VerificationSessionEntity> locked = lockedSession(userId, secondaryId);
            if (locked.isEmpty()) {
                return false;
            }
            VerificationSessionEntity s = locked.get();
            if (s.getState() == SessionState.AWAITING_START) {
                s.setState(SessionState.AWAITING_CODE);
                repo.save(s);
            }
            return true;
        }));
        if (!Boolean.TRUE.equals(found)) {
            log.warn("session ({}, {}) went away before the email-sent transition", userId, secondaryId);
            return false;
        }
        return true;
    }

    public VerifyResult verify(long userId, String secondaryId, String attemptedCode) {
        VerifyResult result = withConflictRetry("verify", userId, () -> tx.execute(status -> {
            Optional<VerificationSessionEntity> locked = lockedSession(userId, secondaryId);
            if (locked.isEmpty()) {
                return VerifyResult.notFound();
            }
            VerificationSessionEntity s = locked.get();
            if (s.getState() == SessionState.VERIFIED) {
                return VerifyResult.verified();
            }
            // exhausted sessions stay until expiry so a user cannot reset the counter by starting over
            if (s.getRemainingAttempts() <= 0) {
                return VerifyResult.attemptsRemaining(0);
            }
            if (s.getVerificationCode().equals(attemptedCode)) {
                s.setState(SessionState.VERIFIED);
                repo.save(s);
                return VerifyResult.verified();
            }
            int remaining = s.getRemainingAttempts() - 1;
            s.setRemainingAttempts(remaining);
            if (remaining == 0) {
                s.setState(SessionState.FAILED);
            }
            repo.save(s);
            return VerifyResult.attemptsRemaining(remaining);
        }));

        if (result.isVerified()) {
            log.info("session verified userId={}", userId);
        } else if (result.isExhausted()) {
            log.info("session out of attempts userId={}", userId);
        }
        return result;
    }

    public boolean deleteSession(long userId) {
        Integer deleted = withConflictRetry("deleteSession", userId,
                () -> tx.execute(status -> repo.deleteByUserId(userId)));
        if (deleted == null || deleted == 0) {
            log.warn("attempted to delete nonexistent session for userId={}", userId);
            return false;
        }
        log.info("deleted session userId={}", userId);
        return true;
    }

    /**
     * Deletes every session older than the configured expiry, whatever its state.
     * Each row is removed in its own transaction so live traffic is never blocked
     * for the length of the sweep.
     */
    public int collectGarbage() {
        Instant cutoff = clock.instant().minus(props.getExpiry());
        List<Long> userIds = repo.findAllUserIds();

        int deleted = 0;
        for (Long userId : userIds) {
            try {
                Integer n = tx.execute(status -> repo.deleteIfCreatedBefore(userId, cutoff));
                if (n != null) {
                    deleted += n;
                }
            } catch (DataAccessException e) {
                // left for the next sweep
                log.warn("gc could not expire session userId={}", userId, e);
            }
        }
        if (deleted > 0) {
            log.info("gc removed {} expired session(s) of {}", deleted, userIds.size());
        }
        return deleted;
    }

    /**
     * Lazily yields the sessions that are currently verified. The key set is
     * captured when this is called; each row is re-read when the stream reaches it.
     * The synthetic testing session is never included.
     */
    public Stream<VerificationSession> listVerifiedSessions() {
        List<Long> userIds = repo.findUserIdsByState(SessionState.VERIFIED);
        return userIds.stream()
                .map(repo::findById)
                .flatMap(Optional::stream)
                .filter(s -> s.getState() == SessionState.VERIFIED)
                .filter(s -> !TESTING_VERIFICATION_CODE.equals(s.getVerificationCode()))
                .map(VerificationSessionEntity::toSnapshot);
    }

    /**
     * Replaces the synthetic testing session with a fresh one and returns its
     * fixed secondary id.
     */
    public String createTestingSession() {
        tx.executeWithoutResult(status -> {
            repo.deleteByUserId(TESTING_USER_ID);
            repo.saveAndFlush(newSession(
                    TESTING_USER_ID, 0L, TESTING_DISPLAY_NAME, TESTING_SECONDARY_ID, TESTING_VERIFICATION_CODE));
        });
        return TESTING_SECONDARY_ID;
    }

    private Optional<VerificationSessionEntity> lockedSession(long userId, String secondaryId) {
        return repo.findByIdForUpdate(userId).filter(s -> capabilityMatches(s, secondaryId));
    }

    private VerificationSessionEntity newSession(long userId, long guildId, String displayName,
                                                 String secondaryId, String code) {
        VerificationSessionEntity s = new VerificationSessionEntity();
        s.setUserId(userId);
        s.setGuildId(guildId);
        s.setDisplayName(displayName);
        s.setSecondaryId(secondaryId);
        s.setVerificationCode(code);
        s.setCreatedAtUtc(clock.instant());
        s.setState(SessionState.AWAITING_START);
        s.setRemainingAttempts(props.getMaxAttempts());
        return s;
    }

    private <T> T withConflictRetry(String op, long userId, Supplier<T> action) {
        int conflicts = 0;
        while (true) {
            try {
                return action.get();
            } catch (ConcurrencyFailureException e) {
                conflicts++;
                if (conflicts > props.getMaxConflictRetries()) {
                    throw e;
                }
                log.debug("{} conflict on userId={}, retry {}", op, userId, conflicts);
            }
        }
    }

    // a wrong secondary id looks exactly like a missing session
    private static boolean capabilityMatches(VerificationSessionEntity s, String secondaryId) {
        if (secondaryId == null) {
            return false;
        }
        return MessageDigest.isEqual(
                s.getSecondaryId().getBytes(StandardCharsets.UTF_8),
                secondaryId.getBytes(StandardCharsets.UTF_8));
    }

    private static String generateCode() {
        return String.valueOf(100_000 + RANDOM.nextInt(900_000));
    }
}
