package com.social.tipping.repository;

import com.social.tipping.model.TipLedgerEntry;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface TipLedgerRepository extends JpaRepository<TipLedgerEntry, Long> {

    boolean existsByJobId(String jobId);

    @Query("SELECT e FROM TipLedgerEntry e WHERE e.senderId = :userId OR e.recipientId = :userId")
    Page<TipLedgerEntry> findByParticipant(@Param("userId") String userId, Pageable pageable);
}
