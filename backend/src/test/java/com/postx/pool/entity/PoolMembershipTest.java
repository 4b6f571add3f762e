package com.postx.pool.entity;

import static org.junit.jupiter.api.Assertions.*;

import java.time.LocalDateTime;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PoolMembershipTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 12, 0);

    private PoolMembership membership() {
        SocialAccount account = SocialAccount.builder().id(1L).platform(Platform.TIKTOK).build();
        return PoolMembership.builder().id(10L).socialAccount(account).build();
    }

    @Test
    @DisplayName("Lapsed cooldown reads as ACTIVE without a sweep")
    void effectiveStatus_CooldownExpired_IsActive() {
        PoolMembership membership = membership();
        membership.setStatus(MembershipStatus.COOLDOWN);
        membership.setCooldownUntil(NOW.minusMinutes(1));

        assertEquals(MembershipStatus.ACTIVE, membership.effectiveStatus(NOW));
        assertTrue(membership.isEligible(NOW, 5));
    }

    @Test
    @DisplayName("Running cooldown keeps the member out of rotation")
    void isEligible_CoolingDown_False() {
        PoolMembership membership = membership();
        membership.setStatus(MembershipStatus.COOLDOWN);
        membership.setCooldownUntil(NOW.plusMinutes(5));

        assertEquals(MembershipStatus.COOLDOWN, membership.effectiveStatus(NOW));
        assertFalse(membership.isEligible(NOW, 5));
    }

    @Test
    void isEligible_DailyCapReached_False() {
        PoolMembership membership = membership();
        membership.setPostsToday(5);

        assertFalse(membership.isEligible(NOW, 5));
        assertTrue(membership.isEligible(NOW, 6));
    }

    @Test
    void isEligible_BannedOrSuspended_False() {
        PoolMembership banned = membership();
        banned.setStatus(MembershipStatus.BANNED);
        PoolMembership suspended = membership();
        suspended.setStatus(MembershipStatus.SUSPENDED);

        assertFalse(banned.isEligible(NOW, 10));
        assertFalse(suspended.isEligible(NOW, 10));
    }

    @Test
    @DisplayName("ERROR members stay eligible")
    void isEligible_Error_True() {
        PoolMembership membership = membership();
        membership.setStatus(MembershipStatus.ERROR);

        assertTrue(membership.isEligible(NOW, 10));
    }

    @Test
    void isEligible_AccountDeactivated_False() {
        PoolMembership membership = membership();
        membership.getSocialAccount().deactivate(NOW);

        assertFalse(membership.isEligible(NOW, 10));
    }

    @Test
    void holdsReservation_MatchesOnlyLiveToken() {
        PoolMembership membership = membership();
        membership.setInFlight(true);
        membership.setReservationToken("abc");

        assertTrue(membership.holdsReservation("abc"));
        assertFalse(membership.holdsReservation("other"));
        assertFalse(membership.holdsReservation(null));

        membership.releaseReservation();
        assertFalse(membership.holdsReservation("abc"));
        assertNull(membership.getReservedAt());
    }

    @Test
    void getSuccessRate_NoAttempts_IsHundred() {
        PoolMembership membership = membership();
        assertEquals(100.0, membership.getSuccessRate());

        membership.setSuccessCount(3);
        membership.setFailureCount(1);
        assertEquals(75.0, membership.getSuccessRate());
    }
}
