package com.postx.pool.repository;

import com.postx.pool.entity.MembershipStatusEvent;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface MembershipStatusEventRepository
        extends JpaRepository<MembershipStatusEvent, Long> {

    List<MembershipStatusEvent> findByMembershipIdOrderByCreatedAtAsc(Long membershipId);

    List<MembershipStatusEvent> findByCreatedAtAfter(LocalDateTime since);
}
