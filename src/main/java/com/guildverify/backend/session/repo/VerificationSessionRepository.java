package com.guildverify.backend.session.repo;

import com.guildverify.backend.session.entity.VerificationSessionEntity;
import com.guildverify.backend.session.model.SessionState;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface VerificationSessionRepository extends JpaRepository<VerificationSessionEntity, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from VerificationSessionEntity s where s.userId = :userId")
    Optional<VerificationSessionEntity> findByIdForUpdate(@Param("userId") Long userId);

    @Query("select s.userId from VerificationSessionEntity s order by s.userId")
    List<Long> findAllUserIds();

    @Query("select s.userId from VerificationSessionEntity s where s.state = :state order by s.userId")
    List<Long> findUserIdsByState(@Param("state") SessionState state);

    /**
     * Deletes the row only if it is still older than {@code cutoff}; a session
     * re-created after the caller's key snapshot survives.
     */
    @Modifying
    @Query("delete from VerificationSessionEntity s where s.userId = :userId and s.createdAtUtc < :cutoff")
    int deleteIfCreatedBefore(@Param("userId") Long userId, @Param("cutoff") Instant cutoff);

    @Modifying
    @Query("delete from VerificationSessionEntity s where s.userId = :userId")
    int deleteByUserId(@Param("userId") Long userId);
}
