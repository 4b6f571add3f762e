package com.postx.pool.repository;

import com.postx.pool.entity.AccountPool;
import com.postx.pool.entity.Platform;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface AccountPoolRepository extends JpaRepository<AccountPool, Long> {

    @Query(
            "SELECT p FROM AccountPool p WHERE p.brandId = :brandId AND p.platform = :platform "
                    + "AND p.active = true ORDER BY p.id ASC")
    List<AccountPool> findActivePools(
            @Param("brandId") Long brandId, @Param("platform") Platform platform);

    @Query(
            "SELECT DISTINCT p FROM AccountPool p LEFT JOIN FETCH p.memberships m "
                    + "LEFT JOIN FETCH m.socialAccount WHERE p.id = :id")
    Optional<AccountPool> findByIdWithMemberships(@Param("id") Long id);

    List<AccountPool> findByBrandIdOrderByIdAsc(Long brandId);

    boolean existsByBrandIdAndPlatformAndName(Long brandId, Platform platform, String name);
}
