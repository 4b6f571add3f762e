package com.postx.pool.service.audit;

import com.postx.pool.entity.DispatchOutcomeRecord;
import com.postx.pool.entity.EventTrigger;
import com.postx.pool.entity.MembershipStatus;
import com.postx.pool.entity.MembershipStatusEvent;
import com.postx.pool.entity.PoolMembership;
import com.postx.pool.entity.StatusEventType;
import com.postx.pool.repository.DispatchOutcomeRecordRepository;
import com.postx.pool.repository.MembershipStatusEventRepository;
import com.postx.pool.service.dispatch.DispatchOutcome;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Append-only audit trail: one row per publish attempt and one per membership status change.
 * Dispatch correctness never depends on these rows.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DispatchAuditService {

    private final DispatchOutcomeRecordRepository outcomeRecordRepository;
    private final MembershipStatusEventRepository statusEventRepository;
    private final Clock clock;

    /** Writes in its own transaction; a failed audit write is logged and never fails the dispatch. */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordAttempt(DispatchOutcome outcome) {
        try {
            outcomeRecordRepository.save(
                    DispatchOutcomeRecord.builder()
                            .dispatchId(outcome.dispatchId())
                            .accountPoolId(outcome.poolId())
                            .membershipId(outcome.membershipId())
                            .socialAccountId(outcome.accountId())
                            .platform(outcome.platform())
                            .attemptNumber(outcome.attemptNumber())
                            .success(outcome.success())
                            .errorKind(outcome.errorKind())
                            .errorMessage(outcome.errorMessage())
                            .postId(outcome.postId())
                            .latencyMs(outcome.latencyMs())
                            .createdAt(
                                    outcome.timestamp() != null
                                            ? outcome.timestamp()
                                            : LocalDateTime.now(clock))
                            .build());
        } catch (Exception e) {
            log.error(
                    "Failed to write outcome log for dispatch {} membership {}: {}",
                    outcome.dispatchId(),
                    outcome.membershipId(),
                    e.getMessage(),
                    e);
        }
    }

    /** Joins the caller's transaction so the event commits together with the state change. */
    @Transactional
    public MembershipStatusEvent recordStatusChange(
            PoolMembership membership,
            StatusEventType eventType,
            MembershipStatus oldStatus,
            MembershipStatus newStatus,
            String message,
            EventTrigger trigger) {
        MembershipStatusEvent event =
                MembershipStatusEvent.builder()
                        .accountPoolId(membership.getAccountPool().getId())
                        .membershipId(membership.getId())
                        .socialAccountId(membership.getAccountId())
                        .eventType(eventType)
                        .oldStatus(oldStatus)
                        .newStatus(newStatus)
                        .message(message)
                        .triggeredBy(trigger)
                        .createdAt(LocalDateTime.now(clock))
                        .build();
        log.info(
                "Membership {} in pool {}: {} {} -> {} ({})",
                membership.getId(),
                event.getAccountPoolId(),
                eventType,
                oldStatus,
                newStatus,
                trigger);
        return statusEventRepository.save(event);
    }

    @Transactional(readOnly = true)
    public Page<DispatchOutcomeRecord> getPoolOutcomes(Long poolId, Pageable pageable) {
        return outcomeRecordRepository.findByAccountPoolIdOrderByCreatedAtDesc(poolId, pageable);
    }

    @Transactional(readOnly = true)
    public List<DispatchOutcomeRecord> getDispatchAttempts(String dispatchId) {
        return outcomeRecordRepository.findByDispatchIdOrderByAttemptNumberAsc(dispatchId);
    }

    @Transactional(readOnly = true)
    public List<MembershipStatusEvent> getMembershipHistory(Long membershipId) {
        return statusEventRepository.findByMembershipIdOrderByCreatedAtAsc(membershipId);
    }
}
