package com.postx.pool.repository;

import com.postx.pool.entity.SocialAccount;
import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface SocialAccountRepository extends JpaRepository<SocialAccount, Long> {

    // Lifetime counters are shared by every pool the account is in
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM SocialAccount a WHERE a.id = :id")
    Optional<SocialAccount> findByIdWithLock(@Param("id") Long id);

    List<SocialAccount> findByBrandIdOrderByIdAsc(Long brandId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE SocialAccount a SET a.postsUsedToday = 0")
    int resetAllPostsUsedToday();
}
