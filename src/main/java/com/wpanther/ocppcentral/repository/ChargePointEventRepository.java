package com.wpanther.ocppcentral.repository;

import java.util.List;
import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.wpanther.ocppcentral.entity.ChargePointEvent;

@Repository
public interface ChargePointEventRepository extends JpaRepository<ChargePointEvent, Long> {

    /**
     * Energy register readings of a session in append order
     */
    List<ChargePointEvent> findBySessionIdAndMeterValueIsNotNullOrderBySampledAtAscIdAsc(Long sessionId);

    /**
     * Earliest energy register reading of a session, the meter-start baseline
     */
    Optional<ChargePointEvent> findFirstBySessionIdAndMeterValueIsNotNullOrderBySampledAtAscIdAsc(Long sessionId);

    /**
     * Current and voltage readings of a session in append order, used for power
     */
    @Query("SELECT e FROM ChargePointEvent e WHERE e.sessionId = :sessionId " +
           "AND (e.currentAmps IS NOT NULL OR e.voltage IS NOT NULL) ORDER BY e.sampledAt ASC, e.id ASC")
    List<ChargePointEvent> findElectricalSamples(@Param("sessionId") Long sessionId);

    List<ChargePointEvent> findBySessionIdOrderBySampledAtAscIdAsc(Long sessionId);
}
