package com.guildverify.backend.session.entity;

import com.guildverify.backend.session.model.SessionState;
import com.guildverify.backend.session.model.VerificationSession;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Getter @Setter
@Entity
@Table(name = "verification_sessions",
        indexes = @Index(name = "idx_verification_sessions_state", columnList = "state"),
        uniqueConstraints = @UniqueConstraint(name = "uk_verification_sessions_secondary", columnNames = "secondary_id"))
public class VerificationSessionEntity {

    @Id
    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "secondary_id", length = 36, nullable = false, updatable = false)
    private String secondaryId;

    @Column(name = "guild_id", nullable = false)
    private Long guildId;

    @Column(name = "display_name", length = 128)
    private String displayName;

    @Column(name = "verification_code", length = 16, nullable = false, updatable = false)
    private String verificationCode;

    @Column(name = "created_at_utc", nullable = false, updatable = false)
    private Instant createdAtUtc;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private SessionState state;

    @Column(name = "remaining_attempts", nullable = false)
    private int remainingAttempts;

    // null until first persist, which is how Spring Data tells a new row from an assigned-id update
    @Version
    private Long version;

    public VerificationSession toSnapshot() {
        return new VerificationSession(
                secondaryId,
                userId,
                guildId,
                displayName,
                verificationCode,
                createdAtUtc,
                state,
                remainingAttempts
        );
    }
}
