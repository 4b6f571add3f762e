package com.postx.pool.controller;

import com.postx.pool.dto.ApiResponse;
import com.postx.pool.dto.request.AddMemberRequest;
import com.postx.pool.dto.request.CreatePoolRequest;
import com.postx.pool.dto.request.UpdateMemberRequest;
import com.postx.pool.dto.request.UpdatePoolRequest;
import com.postx.pool.dto.response.AccountPoolResponse;
import com.postx.pool.dto.response.PoolMembershipResponse;
import com.postx.pool.entity.DispatchOutcomeRecord;
import com.postx.pool.entity.MembershipStatusEvent;
import com.postx.pool.service.audit.DispatchAuditService;
import com.postx.pool.service.health.AccountHealthService;
import com.postx.pool.service.pool.AccountPoolAdminService;
import com.postx.pool.service.pool.PoolHealthReport;
import com.postx.pool.service.pool.PoolHealthService;
import com.postx.pool.service.pool.PoolHealthSummary;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/** Pool administration, health and operator overrides */
@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/account-pools")
@RequiredArgsConstructor
@Tag(name = "Account Pools", description = "Account pool configuration, health and recovery")
public class AccountPoolController {

    private final AccountPoolAdminService adminService;
    private final PoolHealthService poolHealthService;
    private final AccountHealthService accountHealthService;
    private final DispatchAuditService auditService;

    @PostMapping
    @Operation(summary = "Create pool")
    public ResponseEntity<ApiResponse<AccountPoolResponse>> createPool(
            @Valid @RequestBody CreatePoolRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(adminService.createPool(request), "Pool created"));
    }

    @GetMapping
    @Operation(summary = "List a brand's pools")
    public ResponseEntity<ApiResponse<List<AccountPoolResponse>>> listPools(
            @RequestParam Long brandId) {
        return ResponseEntity.ok(ApiResponse.success(adminService.listBrandPools(brandId)));
    }

    @GetMapping("/{poolId}")
    @Operation(summary = "Get pool")
    public ResponseEntity<ApiResponse<AccountPoolResponse>> getPool(@PathVariable Long poolId) {
        return ResponseEntity.ok(ApiResponse.success(adminService.getPool(poolId)));
    }

    @PutMapping("/{poolId}")
    @Operation(summary = "Update pool settings", description = "Fields left null are unchanged")
    public ResponseEntity<ApiResponse<AccountPoolResponse>> updatePool(
            @PathVariable Long poolId, @Valid @RequestBody UpdatePoolRequest request) {
        return ResponseEntity.ok(
                ApiResponse.success(adminService.updatePool(poolId, request), "Pool updated"));
    }

    @DeleteMapping("/{poolId}")
    @Operation(summary = "Deactivate pool", description = "Pools are deactivated, never deleted")
    public ResponseEntity<ApiResponse<AccountPoolResponse>> deactivatePool(
            @PathVariable Long poolId) {
        return ResponseEntity.ok(
                ApiResponse.success(adminService.deactivatePool(poolId), "Pool deactivated"));
    }

    @GetMapping("/{poolId}/health")
    @Operation(summary = "Pool health summary")
    public ResponseEntity<ApiResponse<PoolHealthSummary>> getPoolHealth(@PathVariable Long poolId) {
        return ResponseEntity.ok(ApiResponse.success(poolHealthService.getPoolHealth(poolId)));
    }

    @GetMapping("/health-report")
    @Operation(summary = "Attempt and status-change totals over the last N hours")
    public ResponseEntity<ApiResponse<PoolHealthReport>> getHealthReport(
            @RequestParam(defaultValue = "24") @Min(1) @Max(720) int hours) {
        return ResponseEntity.ok(ApiResponse.success(poolHealthService.getHealthReport(hours)));
    }

    @GetMapping("/{poolId}/members")
    @Operation(summary = "List pool members")
    public ResponseEntity<ApiResponse<List<PoolMembershipResponse>>> listMembers(
            @PathVariable Long poolId) {
        return ResponseEntity.ok(ApiResponse.success(adminService.listMembers(poolId)));
    }

    @PostMapping("/{poolId}/members")
    @Operation(summary = "Add account to pool")
    public ResponseEntity<ApiResponse<PoolMembershipResponse>> addMember(
            @PathVariable Long poolId, @Valid @RequestBody AddMemberRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.success(adminService.addMember(poolId, request), "Member added"));
    }

    @GetMapping("/{poolId}/next-account")
    @Operation(
            summary = "Preview next account",
            description = "The member the next dispatch would try first; nothing is reserved")
    public ResponseEntity<ApiResponse<PoolMembershipResponse>> previewNextAccount(
            @PathVariable Long poolId) {
        return adminService
                .previewNextAccount(poolId)
                .map(member -> ResponseEntity.ok(ApiResponse.success(member)))
                .orElseGet(
                        () ->
                                ResponseEntity.ok(
                                        ApiResponse.<PoolMembershipResponse>error(
                                                "POOL_EXHAUSTED", "No eligible account in pool " + poolId)));
    }

    @GetMapping("/{poolId}/outcomes")
    @Operation(summary = "Recent publish attempts for a pool")
    public ResponseEntity<ApiResponse<Page<DispatchOutcomeRecord>>> getOutcomes(
            @PathVariable Long poolId,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(200) int size) {
        return ResponseEntity.ok(
                ApiResponse.success(auditService.getPoolOutcomes(poolId, PageRequest.of(page, size))));
    }

    @PutMapping("/memberships/{membershipId}")
    @Operation(summary = "Update member priority or weight")
    public ResponseEntity<ApiResponse<PoolMembershipResponse>> updateMember(
            @PathVariable Long membershipId, @Valid @RequestBody UpdateMemberRequest request) {
        return ResponseEntity.ok(
                ApiResponse.success(adminService.updateMember(membershipId, request), "Member updated"));
    }

    @DeleteMapping("/memberships/{membershipId}")
    @Operation(summary = "Remove account from pool")
    public ResponseEntity<ApiResponse<Void>> removeMember(@PathVariable Long membershipId) {
        adminService.removeMember(membershipId);
        return ResponseEntity.ok(ApiResponse.success(null, "Member removed"));
    }

    @GetMapping("/memberships/{membershipId}/events")
    @Operation(summary = "Status history of a membership")
    public ResponseEntity<ApiResponse<List<MembershipStatusEvent>>> getMembershipEvents(
            @PathVariable Long membershipId) {
        return ResponseEntity.ok(ApiResponse.success(auditService.getMembershipHistory(membershipId)));
    }

    @PostMapping("/memberships/{membershipId}/reset")
    @Operation(
            summary = "Reset membership",
            description = "Operator override returning a suspended, banned or cooling member to ACTIVE")
    public ResponseEntity<ApiResponse<PoolMembershipResponse>> resetMembership(
            @PathVariable Long membershipId) {
        log.info("Operator reset requested for membership {}", membershipId);
        accountHealthService.resetMembership(membershipId);
        return ResponseEntity.ok(
                ApiResponse.success(adminService.getMember(membershipId), "Membership reset to ACTIVE"));
    }

    @PostMapping("/reset-daily-counters")
    @Operation(summary = "Zero every member's daily post counter")
    public ResponseEntity<ApiResponse<Integer>> resetDailyCounters() {
        int reset = accountHealthService.resetDailyCounters();
        return ResponseEntity.ok(ApiResponse.success(reset, "Daily counters reset"));
    }
}
