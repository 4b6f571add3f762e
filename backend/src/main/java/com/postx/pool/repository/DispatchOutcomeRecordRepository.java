package com.postx.pool.repository;

import com.postx.pool.entity.DispatchOutcomeRecord;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DispatchOutcomeRecordRepository
        extends JpaRepository<DispatchOutcomeRecord, Long> {

    Page<DispatchOutcomeRecord> findByAccountPoolIdOrderByCreatedAtDesc(
            Long accountPoolId, Pageable pageable);

    List<DispatchOutcomeRecord> findByDispatchIdOrderByAttemptNumberAsc(String dispatchId);

    List<DispatchOutcomeRecord> findByCreatedAtAfter(LocalDateTime since);
}
