package com.wpanther.ocppcentral.repository;

import java.util.Optional;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.wpanther.ocppcentral.entity.ChargePoint;

@Repository
public interface ChargePointRepository extends JpaRepository<ChargePoint, Long> {

    /**
     * Find a charger by its exact OCPP identity
     */
    Optional<ChargePoint> findByName(String name);

    /**
     * Case-insensitive fallback for chargers configured with different casing
     */
    Optional<ChargePoint> findFirstByNameIgnoreCase(String name);
}
