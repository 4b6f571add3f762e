package com.postx.pool.repository;

import com.postx.pool.entity.BackupCredential;
import com.postx.pool.entity.CredentialType;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface BackupCredentialRepository extends JpaRepository<BackupCredential, Long> {

    @Query(
            "SELECT b FROM BackupCredential b WHERE b.socialAccountId = :accountId "
                    + "AND b.credentialType = :type AND b.primary = true ORDER BY b.id DESC")
    List<BackupCredential> findPrimary(
            @Param("accountId") Long accountId, @Param("type") CredentialType type);

    @Modifying(flushAutomatically = true)
    @Query(
            "UPDATE BackupCredential b SET b.primary = false WHERE b.socialAccountId = :accountId "
                    + "AND b.credentialType = :type AND b.primary = true")
    int clearPrimary(@Param("accountId") Long accountId, @Param("type") CredentialType type);

    List<BackupCredential> findBySocialAccountIdOrderByIdDesc(Long accountId);
}
