package com.guildverify.backend.session.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.session")
public class SessionProperties {

    /** Session TTL; a session older than this is deleted by the next GC sweep whatever its state. */
    private Duration expiry = Duration.ofHours(1);

    /** Wrong guesses allowed before a session fails. */
    private int maxAttempts = 5;

    /** Retries of a single-session transaction after a lock or version conflict. */
    private int maxConflictRetries = 5;

    private TestingSession testingSession = new TestingSession();

    @Data
    public static class TestingSession {
        /** Seed the synthetic end-to-end session on web start-up. */
        private boolean enabled = false;
    }
}
