package com.postx.pool.controller;

import com.postx.pool.dto.ApiResponse;
import com.postx.pool.dto.request.LinkAccountRequest;
import com.postx.pool.dto.response.SocialAccountResponse;
import com.postx.pool.exception.ResourceNotFoundException;
import com.postx.pool.service.account.SocialAccountService;
import com.postx.pool.service.credential.CredentialBackupService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/social-accounts")
@RequiredArgsConstructor
@Tag(name = "Social Accounts", description = "Linking and deactivating platform accounts")
public class SocialAccountController {

    private final SocialAccountService socialAccountService;
    private final CredentialBackupService credentialBackupService;

    @PostMapping
    @Operation(summary = "Link account to brand")
    public ResponseEntity<ApiResponse<SocialAccountResponse>> linkAccount(
            @Valid @RequestBody LinkAccountRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(
                        ApiResponse.success(
                                SocialAccountResponse.fromEntity(
                                        socialAccountService.linkAccount(request)),
                                "Account linked"));
    }

    @GetMapping
    @Operation(summary = "List a brand's accounts")
    public ResponseEntity<ApiResponse<List<SocialAccountResponse>>> listAccounts(
            @RequestParam Long brandId) {
        return ResponseEntity.ok(
                ApiResponse.success(
                        socialAccountService.listBrandAccounts(brandId).stream()
                                .map(SocialAccountResponse::fromEntity)
                                .toList()));
    }

    @GetMapping("/{accountId}")
    @Operation(summary = "Get account")
    public ResponseEntity<ApiResponse<SocialAccountResponse>> getAccount(
            @PathVariable Long accountId) {
        return ResponseEntity.ok(
                ApiResponse.success(
                        SocialAccountResponse.fromEntity(socialAccountService.getAccount(accountId))));
    }

    @PostMapping("/{accountId}/deactivate")
    @Operation(summary = "Deactivate account", description = "Soft deactivation; history is kept")
    public ResponseEntity<ApiResponse<SocialAccountResponse>> deactivateAccount(
            @PathVariable Long accountId) {
        return ResponseEntity.ok(
                ApiResponse.success(
                        SocialAccountResponse.fromEntity(
                                socialAccountService.deactivateAccount(accountId)),
                        "Account deactivated"));
    }

    @PostMapping("/{accountId}/reactivate")
    @Operation(summary = "Reactivate account")
    public ResponseEntity<ApiResponse<SocialAccountResponse>> reactivateAccount(
            @PathVariable Long accountId) {
        return ResponseEntity.ok(
                ApiResponse.success(
                        SocialAccountResponse.fromEntity(
                                socialAccountService.reactivateAccount(accountId)),
                        "Account reactivated"));
    }

    @PostMapping("/{accountId}/credentials/backup")
    @Operation(summary = "Back up account credentials", description = "Stores encrypted copies")
    public ResponseEntity<ApiResponse<Integer>> backupCredentials(@PathVariable Long accountId) {
        int stored = credentialBackupService.backupCredentials(accountId);
        return ResponseEntity.ok(
                ApiResponse.success(stored, "Backed up " + stored + " credential(s)"));
    }

    @PostMapping("/{accountId}/credentials/restore")
    @Operation(summary = "Restore account credentials from the latest valid backup")
    public ResponseEntity<ApiResponse<SocialAccountResponse>> restoreCredentials(
            @PathVariable Long accountId) {
        if (!credentialBackupService.restoreCredentials(accountId)) {
            throw new ResourceNotFoundException(
                    "No valid credential backup for SocialAccount with ID " + accountId);
        }
        return ResponseEntity.ok(
                ApiResponse.success(
                        SocialAccountResponse.fromEntity(socialAccountService.getAccount(accountId)),
                        "Credentials restored"));
    }
}
