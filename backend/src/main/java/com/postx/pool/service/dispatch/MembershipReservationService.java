package com.postx.pool.service.dispatch;

import com.postx.pool.entity.MembershipStatus;
import com.postx.pool.entity.PoolMembership;
import com.postx.pool.repository.PoolMembershipRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Holds a membership for the duration of one publish attempt. Reserving takes the daily slot in the
 * same conditional update, so two dispatches can never both pass the cap check for the last slot.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MembershipReservationService {

    private static final Set<MembershipStatus> BLOCKED_STATUSES =
            EnumSet.of(MembershipStatus.SUSPENDED, MembershipStatus.BANNED);

    private final PoolMembershipRepository poolMembershipRepository;
    private final Clock clock;

    /** @return the reservation token, or empty when another dispatch won or the member is no longer eligible */
    @Transactional
    public Optional<String> tryReserve(Long membershipId, int maxPostsPerDay) {
        String token = UUID.randomUUID().toString();
        int updated =
                poolMembershipRepository.tryReserve(
                        membershipId, token, maxPostsPerDay, LocalDateTime.now(clock), BLOCKED_STATUSES);
        if (updated == 0) {
            log.debug("Reservation of membership {} lost", membershipId);
            return Optional.empty();
        }
        log.debug("Membership {} reserved with token {}", membershipId, token);
        return Optional.of(token);
    }

    /**
     * Fail-safe release when the outcome could not be recorded. Gives the daily slot back. No-op
     * when the reservation was already finalized or swept.
     */
    @Transactional
    public boolean release(Long membershipId, String token) {
        Optional<PoolMembership> locked = poolMembershipRepository.findByIdWithLock(membershipId);
        if (locked.isEmpty() || !locked.get().holdsReservation(token)) {
            return false;
        }
        PoolMembership membership = locked.get();
        membership.releaseReservation();
        membership.setPostsToday(Math.max(0, membership.getPostsToday() - 1));
        poolMembershipRepository.save(membership);
        log.warn("Released reservation {} on membership {} without an outcome", token, membershipId);
        return true;
    }
}
