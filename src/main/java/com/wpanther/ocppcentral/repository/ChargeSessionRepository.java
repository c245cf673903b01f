package com.wpanther.ocppcentral.repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.wpanther.ocppcentral.entity.ChargeSession;

@Repository
public interface ChargeSessionRepository extends JpaRepository<ChargeSession, Long> {

    /**
     * Highest session id assigned so far
     */
    @Query("SELECT MAX(s.id) FROM ChargeSession s")
    Optional<Long> findMaxId();

    /**
     * The open session on a connector, if any
     */
    Optional<ChargeSession> findFirstByChargerIdAndConnectorIdAndEndedAtIsNullOrderByStartedAtDesc(
            Long chargerId, Integer connectorId);

    /**
     * Closed, billable sessions without a settled payment, newest first
     */
    @Query("SELECT s FROM ChargeSession s WHERE s.endedAt IS NOT NULL AND s.cost > 0 " +
            "AND (s.paymentStatus IS NULL OR s.paymentStatus IN :statuses) " +
            "AND (:companyId IS NULL OR s.companyId = :companyId) " +
            "AND (:siteId IS NULL OR s.siteId = :siteId) " +
            "AND (:chargerId IS NULL OR s.chargerId = :chargerId) " +
            "ORDER BY s.endedAt DESC")
    List<ChargeSession> findUnpaid(@Param("statuses") Collection<String> statuses,
                                   @Param("companyId") Long companyId,
                                   @Param("siteId") Long siteId,
                                   @Param("chargerId") Long chargerId,
                                   Pageable pageable);
}
