package com.postx.pool.service.account;

import com.postx.pool.dto.request.LinkAccountRequest;
import com.postx.pool.entity.SocialAccount;
import com.postx.pool.exception.ResourceNotFoundException;
import com.postx.pool.repository.SocialAccountRepository;
import com.postx.pool.service.credential.CredentialBackupService;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Linking and soft deactivation of social accounts. Accounts are never deleted. */
@Slf4j
@Service
@RequiredArgsConstructor
public class SocialAccountService {

    private final SocialAccountRepository socialAccountRepository;
    private final CredentialBackupService credentialBackupService;
    private final Clock clock;

    @Transactional
    public SocialAccount linkAccount(LinkAccountRequest request) {
        SocialAccount account =
                SocialAccount.builder()
                        .brandId(request.getBrandId())
                        .platform(request.getPlatform())
                        .displayName(request.getDisplayName())
                        .platformUserId(request.getPlatformUserId())
                        .accessToken(request.getAccessToken())
                        .refreshToken(request.getRefreshToken())
                        .tokenExpiresAt(request.getTokenExpiresAt())
                        .build();
        SocialAccount saved = socialAccountRepository.save(account);
        if (saved.hasCredentials()) {
            credentialBackupService.backupCredentials(saved);
        }
        log.info(
                "Linked {} account {} ({}) to brand {}",
                saved.getPlatform(),
                saved.getId(),
                saved.getDisplayName(),
                saved.getBrandId());
        return saved;
    }

    /** Inactive accounts drop out of every pool they belong to until reactivated. */
    @Transactional
    public SocialAccount deactivateAccount(Long accountId) {
        SocialAccount account = getAccount(accountId);
        if (!account.isActive()) {
            return account;
        }
        account.deactivate(LocalDateTime.now(clock));
        log.info("Deactivated social account {}", accountId);
        return socialAccountRepository.save(account);
    }

    @Transactional
    public SocialAccount reactivateAccount(Long accountId) {
        SocialAccount account = getAccount(accountId);
        account.setActive(true);
        account.setDeactivatedAt(null);
        log.info("Reactivated social account {}", accountId);
        return socialAccountRepository.save(account);
    }

    @Transactional(readOnly = true)
    public SocialAccount getAccount(Long accountId) {
        return socialAccountRepository
                .findById(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("SocialAccount", accountId));
    }

    @Transactional(readOnly = true)
    public List<SocialAccount> listBrandAccounts(Long brandId) {
        return socialAccountRepository.findByBrandIdOrderByIdAsc(brandId);
    }
}
