package com.postx.pool.service.credential;

import static org.junit.jupiter.api.Assertions.*;

import com.postx.pool.entity.AccountPool;
import com.postx.pool.entity.BackupCredential;
import com.postx.pool.entity.CredentialType;
import com.postx.pool.entity.MembershipStatus;
import com.postx.pool.entity.PoolMembership;
import com.postx.pool.entity.RotationStrategy;
import com.postx.pool.entity.SocialAccount;
import com.postx.pool.exception.ResourceNotFoundException;
import com.postx.pool.service.health.AccountHealthService;
import com.postx.pool.support.AbstractPoolIntegrationTest;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class CredentialBackupServiceTest extends AbstractPoolIntegrationTest {

    @Autowired private CredentialBackupService credentialBackupService;
    @Autowired private AccountHealthService accountHealthService;

    private SocialAccount accountWithTokens(AccountPool pool, String access, String refresh) {
        PoolMembership membership = addMembers(pool, 1).get(0);
        SocialAccount account = membership.getSocialAccount();
        account.setAccessToken(access);
        account.setRefreshToken(refresh);
        account.setTokenExpiresAt(LocalDateTime.now().plusDays(30));
        return socialAccountRepository.save(account);
    }

    @Test
    @DisplayName("Backups are stored encrypted and only the newest one per type stays primary")
    void backupCredentials_Twice_NewestPrimary() {
        AccountPool pool = createPool(RotationStrategy.ROUND_ROBIN, 10);
        SocialAccount account = accountWithTokens(pool, "access-1", "refresh-1");

        assertEquals(2, credentialBackupService.backupCredentials(account.getId()));
        account.setAccessToken("access-2");
        socialAccountRepository.save(account);
        assertEquals(2, credentialBackupService.backupCredentials(account.getId()));

        List<BackupCredential> backups =
                backupCredentialRepository.findBySocialAccountIdOrderByIdDesc(account.getId());
        assertEquals(4, backups.size());
        assertTrue(
                backups.stream()
                        .map(BackupCredential::getEncryptedValue)
                        .noneMatch(v -> v.equals("access-1") || v.equals("access-2")));
        assertEquals(1, backupCredentialRepository.findPrimary(account.getId(), CredentialType.ACCESS_TOKEN).size());
        assertEquals(1, backupCredentialRepository.findPrimary(account.getId(), CredentialType.REFRESH_TOKEN).size());
    }

    @Test
    void restoreCredentials_PutsLatestBackupBack() {
        AccountPool pool = createPool(RotationStrategy.ROUND_ROBIN, 10);
        SocialAccount account = accountWithTokens(pool, "good-access", "good-refresh");
        credentialBackupService.backupCredentials(account.getId());
        account.setAccessToken("revoked");
        account.setRefreshToken(null);
        socialAccountRepository.save(account);

        assertTrue(credentialBackupService.restoreCredentials(account.getId()));

        SocialAccount restored = socialAccountRepository.findById(account.getId()).orElseThrow();
        assertEquals("good-access", restored.getAccessToken());
        assertEquals("good-refresh", restored.getRefreshToken());
        assertNotNull(restored.getTokenExpiresAt());
    }

    @Test
    @DisplayName("An expired access token backup is not restored")
    void restoreCredentials_ExpiredBackup_ReturnsFalse() {
        AccountPool pool = createPool(RotationStrategy.ROUND_ROBIN, 10);
        SocialAccount account = accountWithTokens(pool, "old-access", null);
        account.setTokenExpiresAt(LocalDateTime.now().minusDays(1));
        socialAccountRepository.save(account);
        credentialBackupService.backupCredentials(account.getId());
        account.setAccessToken("current");
        socialAccountRepository.save(account);

        assertFalse(credentialBackupService.restoreCredentials(account.getId()));
        assertEquals(
                "current",
                socialAccountRepository.findById(account.getId()).orElseThrow().getAccessToken());
    }

    @Test
    void restoreCredentials_NoBackup_ReturnsFalse() {
        AccountPool pool = createPool(RotationStrategy.ROUND_ROBIN, 10);
        SocialAccount account = accountWithTokens(pool, null, null);

        assertEquals(0, credentialBackupService.backupCredentials(account.getId()));
        assertFalse(credentialBackupService.restoreCredentials(account.getId()));
    }

    @Test
    void backupCredentials_UnknownAccount_NotFound() {
        assertThrows(
                ResourceNotFoundException.class, () -> credentialBackupService.backupCredentials(9999L));
    }

    @Test
    @DisplayName("Operator reset of an ERROR member restores the backed-up token")
    void resetMembership_FromError_RestoresBackup() {
        AccountPool pool = createPool(RotationStrategy.ROUND_ROBIN, 10);
        SocialAccount account = accountWithTokens(pool, "good-access", "good-refresh");
        credentialBackupService.backupCredentials(account.getId());
        account.setAccessToken("broken");
        socialAccountRepository.save(account);
        PoolMembership membership = poolMembershipRepository.findByPoolIdWithAccount(pool.getId()).get(0);
        membership.setStatus(MembershipStatus.ERROR);
        membership.setConsecutiveFailures(5);
        poolMembershipRepository.save(membership);

        accountHealthService.resetMembership(membership.getId());

        assertEquals(
                MembershipStatus.ACTIVE,
                poolMembershipRepository.findById(membership.getId()).orElseThrow().getStatus());
        assertEquals(
                "good-access",
                socialAccountRepository.findById(account.getId()).orElseThrow().getAccessToken());
    }
}
