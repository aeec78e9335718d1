package com.guildverify.backend.bot.worker;

import com.guildverify.backend.bot.config.RoleSyncProperties;
import com.guildverify.backend.bot.platform.ChatPlatform;
import com.guildverify.backend.bot.service.VerifiedRoleCache;
import com.guildverify.backend.session.model.VerificationSession;
import com.guildverify.backend.session.service.VerificationSessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Grants the verified role to every verified session, then expires old sessions.
 * <p>
 * Sessions are not deleted after a grant: they stay until expiry and the same
 * role is granted again, harmlessly, on each sweep.
 */
@Slf4j
@RequiredArgsConstructor
@Component
@ConditionalOnProperty(prefix = "app.role-sync", name = "enabled", havingValue = "true")
public class RoleSyncWorker {

    private final VerificationSessionService sessions;
    private final ChatPlatform platform;
    private final VerifiedRoleCache roleCache;
    private final RoleSyncProperties props;

    @Scheduled(fixedDelayString = "${app.role-sync.check-interval-seconds:60}",
            initialDelayString = "${app.role-sync.initial-delay-seconds:5}",
            timeUnit = TimeUnit.SECONDS)
    public void runOnce() {
        RoleSyncReport report = syncOnce();
        if (report.granted() + report.failed() + report.expired() > 0) {
            log.info("role sync done. granted={} skipped={} failed={} expired={}",
                    report.granted(), report.skipped(), report.failed(), report.expired());
        }
    }

    public RoleSyncReport syncOnce() {
        if (!platform.isReady() || !roleCache.isLoaded()) {
            log.debug("chat platform not ready, role sync skipped");
            return new RoleSyncReport(0, 0, 0, 0);
        }

        int granted = 0;
        int skipped = 0;
        int failed = 0;
        try (Stream<VerificationSession> verified = sessions.listVerifiedSessions()) {
            Iterator<VerificationSession> it = verified.iterator();
            while (it.hasNext()) {
                switch (grant(it.next())) {
                    case GRANTED -> granted++;
                    case SKIPPED -> skipped++;
                    case FAILED -> failed++;
                }
            }
        } catch (DataAccessException e) {
            // next sweep picks up where this one stopped
            log.warn("role sync could not read sessions", e);
        }

        int expired = 0;
        try {
            expired = sessions.collectGarbage();
        } catch (DataAccessException e) {
            log.warn("session gc failed", e);
        }
        return new RoleSyncReport(granted, skipped, failed, expired);
    }

    private Outcome grant(VerificationSession s) {
        Optional<Long> roleId = roleCache.roleFor(s.guildId());
        if (roleId.isEmpty()) {
            log.warn("skipping verification for {} because no role was found in guild {}",
                    s.displayName(), s.guildId());
            return Outcome.SKIPPED;
        }
        try {
            platform.grantRole(s.guildId(), s.userId(), roleId.get(), props.getGrantReason());
            log.info("added role to ({}, {})", s.displayName(), s.userId());
            return Outcome.GRANTED;
        } catch (RuntimeException e) {
            log.warn("failed to add role to userId={} in guildId={}", s.userId(), s.guildId(), e);
            return Outcome.FAILED;
        }
    }

    private enum Outcome { GRANTED, SKIPPED, FAILED }
}
