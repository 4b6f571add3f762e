package com.postx.pool.repository;

import com.postx.pool.entity.MembershipStatus;
import com.postx.pool.entity.PoolMembership;
import jakarta.persistence.LockModeType;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface PoolMembershipRepository extends JpaRepository<PoolMembership, Long> {

    @Query(
            "SELECT m FROM PoolMembership m JOIN FETCH m.socialAccount "
                    + "WHERE m.accountPool.id = :poolId ORDER BY m.id ASC")
    List<PoolMembership> findByPoolIdWithAccount(@Param("poolId") Long poolId);

    // Row lock for outcome recording; relations are loaded lazily inside the same transaction
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM PoolMembership m WHERE m.id = :id")
    Optional<PoolMembership> findByIdWithLock(@Param("id") Long id);

    @Query(
            "SELECT m FROM PoolMembership m JOIN FETCH m.socialAccount JOIN FETCH m.accountPool "
                    + "WHERE m.id = :id")
    Optional<PoolMembership> findByIdWithPoolAndAccount(@Param("id") Long id);

    Optional<PoolMembership> findByAccountPoolIdAndSocialAccountId(Long poolId, Long accountId);

    boolean existsByAccountPoolIdAndSocialAccountId(Long poolId, Long accountId);

    /**
     * Compare-and-swap reservation: succeeds only while the membership is free, under the daily
     * cap and still eligible. Takes the daily slot in the same statement.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(
            "UPDATE PoolMembership m SET m.inFlight = true, m.reservedAt = :now, m.reservationToken = :token, "
                    + "m.postsToday = m.postsToday + 1, m.version = m.version + 1 "
                    + "WHERE m.id = :id AND m.inFlight = false AND m.postsToday < :cap "
                    + "AND m.status NOT IN (:blocked) "
                    + "AND (m.cooldownUntil IS NULL OR m.cooldownUntil <= :now)")
    int tryReserve(
            @Param("id") Long id,
            @Param("token") String token,
            @Param("cap") int cap,
            @Param("now") LocalDateTime now,
            @Param("blocked") Collection<MembershipStatus> blocked);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE PoolMembership m SET m.postsToday = 0, m.version = m.version + 1")
    int resetAllPostsToday();

    @Query(
            "SELECT m.id FROM PoolMembership m WHERE m.inFlight = true "
                    + "AND m.reservedAt < :cutoff ORDER BY m.id ASC")
    List<Long> findStaleReservationIds(@Param("cutoff") LocalDateTime cutoff);

    @Query(
            "SELECT m.id FROM PoolMembership m WHERE m.status = :status "
                    + "AND m.cooldownUntil <= :now ORDER BY m.id ASC")
    List<Long> findExpiredCooldownIds(
            @Param("status") MembershipStatus status, @Param("now") LocalDateTime now);

    long countByAccountPoolId(Long poolId);
}
