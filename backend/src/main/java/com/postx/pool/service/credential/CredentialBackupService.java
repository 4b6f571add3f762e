package com.postx.pool.service.credential;

import com.postx.pool.entity.BackupCredential;
import com.postx.pool.entity.CredentialType;
import com.postx.pool.entity.SocialAccount;
import com.postx.pool.exception.ResourceNotFoundException;
import com.postx.pool.repository.BackupCredentialRepository;
import com.postx.pool.repository.SocialAccountRepository;
import com.postx.pool.security.CredentialCipher;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Encrypted backups of an account's tokens.
 *
 * <p>Each backup becomes the primary one for its account and type. Restore puts the newest primary
 * access token back on the account, provided it has not expired, together with the newest primary
 * refresh token if there is one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialBackupService {

    private final BackupCredentialRepository backupCredentialRepository;
    private final SocialAccountRepository socialAccountRepository;
    private final CredentialCipher credentialCipher;
    private final Clock clock;

    /** @return the number of credentials stored */
    @Transactional
    public int backupCredentials(Long accountId) {
        return backupCredentials(findAccount(accountId));
    }

    @Transactional
    public int backupCredentials(SocialAccount account) {
        LocalDateTime now = LocalDateTime.now(clock);
        int stored = 0;
        if (account.getAccessToken() != null) {
            store(
                    account,
                    CredentialType.ACCESS_TOKEN,
                    account.getAccessToken(),
                    account.getTokenExpiresAt(),
                    now);
            stored++;
        }
        if (account.getRefreshToken() != null) {
            store(account, CredentialType.REFRESH_TOKEN, account.getRefreshToken(), null, now);
            stored++;
        }
        if (stored == 0) {
            log.debug("Account {} has no credentials to back up", account.getId());
        } else {
            log.info("Backed up {} credential(s) for account {}", stored, account.getId());
        }
        return stored;
    }

    /** @return whether a valid backup was found and put back on the account */
    @Transactional
    public boolean restoreCredentials(Long accountId) {
        SocialAccount account = findAccount(accountId);
        boolean restored = restoreCredentials(account);
        if (restored) {
            socialAccountRepository.save(account);
        }
        return restored;
    }

    /** Restores onto an account the caller already holds; the caller saves it. */
    @Transactional
    public boolean restoreCredentials(SocialAccount account) {
        LocalDateTime now = LocalDateTime.now(clock);
        Optional<BackupCredential> accessToken =
                latestPrimary(account.getId(), CredentialType.ACCESS_TOKEN)
                        .filter(backup -> backup.isValidAt(now));
        if (accessToken.isEmpty()) {
            log.warn("No valid backup credentials found for account {}", account.getId());
            return false;
        }
        Optional<BackupCredential> refreshToken =
                latestPrimary(account.getId(), CredentialType.REFRESH_TOKEN);

        account.setAccessToken(credentialCipher.decrypt(accessToken.get().getEncryptedValue()));
        account.setRefreshToken(
                refreshToken.map(b -> credentialCipher.decrypt(b.getEncryptedValue())).orElse(null));
        account.setTokenExpiresAt(accessToken.get().getValidUntil());

        log.info(
                "Restored credentials for account {} from backup {}",
                account.getId(),
                accessToken.get().getId());
        return true;
    }

    private void store(
            SocialAccount account,
            CredentialType type,
            String value,
            LocalDateTime validUntil,
            LocalDateTime now) {
        backupCredentialRepository.clearPrimary(account.getId(), type);
        backupCredentialRepository.save(
                BackupCredential.builder()
                        .socialAccountId(account.getId())
                        .credentialType(type)
                        .encryptedValue(credentialCipher.encrypt(value))
                        .description("Auto backup - " + now)
                        .primary(true)
                        .validUntil(validUntil)
                        .createdAt(now)
                        .build());
    }

    private Optional<BackupCredential> latestPrimary(Long accountId, CredentialType type) {
        return backupCredentialRepository.findPrimary(accountId, type).stream().findFirst();
    }

    private SocialAccount findAccount(Long accountId) {
        return socialAccountRepository
                .findById(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("SocialAccount", accountId));
    }
}
